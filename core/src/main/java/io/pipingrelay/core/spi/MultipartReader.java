package io.pipingrelay.core.spi;

import java.io.IOException;
import java.io.InputStream;

/**
 * Unwraps {@code multipart/form-data} sender bodies so receivers get the
 * uploaded file instead of the MIME envelope.
 *
 * <p>
 * The server module supplies an implementation on top of its HTTP stack's
 * multipart parser. {@link #NONE} relays every body as sent.
 */
public interface MultipartReader {

    /** Relays every body untouched. */
    MultipartReader NONE = new MultipartReader() {
        @Override
        public boolean accepts(String contentType) {
            return false;
        }

        @Override
        public FirstPart open(InputStream body, String contentType) {
            throw new UnsupportedOperationException("multipart bodies are relayed as sent");
        }
    };

    /** Returns {@code true} if bodies of this content type are unwrapped. */
    boolean accepts(String contentType);

    /**
     * Consumes the preamble and the first part's header block.
     *
     * @param body        the raw request body
     * @param contentType the request's {@code Content-Type}
     * @return a stream positioned at the first part's content
     * @throws io.pipingrelay.core.error.MalformedMultipartException if the
     *         boundary is missing or the framing is broken
     */
    FirstPart open(InputStream body, String contentType) throws IOException;
}
