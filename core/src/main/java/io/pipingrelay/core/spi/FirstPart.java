package io.pipingrelay.core.spi;

import io.pipingrelay.core.model.HttpHeaders;
import java.io.IOException;
import java.io.InputStream;

/**
 * Content of the first part of a multipart body. Reads hit end of stream at
 * the part's closing delimiter.
 *
 * <p>
 * Not thread-safe; owned by the sender's thread.
 */
public abstract class FirstPart extends InputStream {

    /** Headers of the part ({@code Content-Type}, {@code Content-Disposition}, ...). */
    public abstract HttpHeaders headers();

    /**
     * Reads and discards whatever follows the part (further parts, the
     * epilogue) so the client is never left blocked on a full send buffer.
     *
     * @return number of bytes discarded
     */
    public abstract long drainRemainder() throws IOException;
}
