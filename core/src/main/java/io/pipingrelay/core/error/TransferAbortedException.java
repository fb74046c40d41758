package io.pipingrelay.core.error;

import java.io.IOException;

/**
 * Signals that the other side of a pairing went away: a handoff was aborted
 * before delivery, or a body pipe was failed by the sender or cancelled by the
 * receiver.
 *
 * <p>
 * An {@link IOException} because every such abort originates in a transport
 * failure on some connection; stream loops handle it with the same code path
 * as their own I/O errors.
 */
public class TransferAbortedException extends IOException {

    private static final long serialVersionUID = 1L;

    public TransferAbortedException(String message) {
        super(message);
    }

    public TransferAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
