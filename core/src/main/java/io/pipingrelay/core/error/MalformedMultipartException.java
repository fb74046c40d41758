package io.pipingrelay.core.error;

import java.io.IOException;

/**
 * Thrown while unwrapping a {@code multipart/form-data} sender body whose
 * framing is broken: missing boundary parameter, no opening delimiter, or a
 * part header block that never terminates.
 */
public class MalformedMultipartException extends IOException {

    private static final long serialVersionUID = 1L;

    public MalformedMultipartException(String message) {
        super(message);
    }
}
