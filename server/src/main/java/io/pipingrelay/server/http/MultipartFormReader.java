package io.pipingrelay.server.http;

import io.pipingrelay.core.error.MalformedMultipartException;
import io.pipingrelay.core.model.HttpHeaders;
import io.pipingrelay.core.spi.FirstPart;
import io.pipingrelay.core.spi.MultipartReader;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.jetty.http.HttpField;
import org.eclipse.jetty.server.MultiPartParser;
import org.eclipse.jetty.util.BufferUtil;

/**
 * {@link MultipartReader} on Jetty's streaming {@link MultiPartParser}.
 *
 * <p>
 * HTML forms cannot post a raw body, so browsers without JavaScript upload via
 * {@code multipart/form-data}. Only the first part is relayed: its header
 * block becomes the part headers and its content is handed out chunk by chunk
 * straight from the read buffer. Nothing beyond one buffer is held in memory.
 */
public final class MultipartFormReader implements MultipartReader {

    static final String MULTIPART_FORM_DATA = "multipart/form-data";
    private static final int BUFFER_SIZE = 16 * 1024;
    private static final int MAX_BOUNDARY = 70;

    @Override
    public boolean accepts(String contentType) {
        return contentType != null
                && MULTIPART_FORM_DATA.equalsIgnoreCase(HttpField.valueParameters(contentType, null).trim());
    }

    @Override
    public FirstPart open(InputStream body, String contentType) throws IOException {
        String boundary = boundaryOf(contentType);
        if (boundary == null) {
            throw new MalformedMultipartException("multipart/form-data without a valid boundary parameter");
        }
        ParsedFirstPart part = new ParsedFirstPart(body, boundary);
        part.readHeaders();
        return part;
    }

    /**
     * Extracts the {@code boundary} parameter of a multipart content type.
     *
     * @return the unquoted boundary, or {@code null} if absent or invalid
     */
    static String boundaryOf(String contentType) {
        if (contentType == null) {
            return null;
        }
        Map<String, String> parameters = new LinkedHashMap<>();
        HttpField.valueParameters(contentType, parameters);
        for (Map.Entry<String, String> parameter : parameters.entrySet()) {
            if ("boundary".equalsIgnoreCase(parameter.getKey())) {
                String value = parameter.getValue();
                return value == null || value.isEmpty() || value.length() > MAX_BOUNDARY ? null : value;
            }
        }
        return null;
    }

    /** Drives the parser from the request stream; owned by the sender's thread. */
    private static final class ParsedFirstPart extends FirstPart implements MultiPartParser.Handler {

        private final InputStream in;
        private final MultiPartParser parser;
        private final ByteBuffer raw = BufferUtil.allocate(BUFFER_SIZE);
        private final HttpHeaders.Builder headers = HttpHeaders.builder();
        private ByteBuffer pending = BufferUtil.EMPTY_BUFFER;
        private HttpHeaders partHeaders = HttpHeaders.empty();
        private boolean headersComplete;
        private boolean partComplete;
        private String failure;

        ParsedFirstPart(InputStream in, String boundary) {
            this.in = in;
            this.parser = new MultiPartParser(this, boundary);
        }

        void readHeaders() throws IOException {
            while (!headersComplete) {
                advance();
            }
            partHeaders = headers.build();
        }

        @Override
        public HttpHeaders headers() {
            return partHeaders;
        }

        @Override
        public int read() throws IOException {
            byte[] one = new byte[1];
            int n = read(one, 0, 1);
            return n == -1 ? -1 : one[0] & 0xff;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (len == 0) {
                return 0;
            }
            while (!pending.hasRemaining()) {
                if (partComplete) {
                    return -1;
                }
                advance();
            }
            int n = Math.min(len, pending.remaining());
            pending.get(b, off, n);
            return n;
        }

        @Override
        public long drainRemainder() throws IOException {
            long discarded = pending.remaining() + raw.remaining();
            pending = BufferUtil.EMPTY_BUFFER;
            BufferUtil.clear(raw);
            byte[] scratch = new byte[BUFFER_SIZE];
            int n;
            while ((n = in.read(scratch)) != -1) {
                discarded += n;
            }
            return discarded;
        }

        /** Parses until the next header block or content chunk, reading as needed. */
        private void advance() throws IOException {
            try {
                while (true) {
                    if (raw.hasRemaining()) {
                        if (parser.parse(raw, false)) {
                            break;
                        }
                    } else if (!fill()) {
                        parser.parse(BufferUtil.EMPTY_BUFFER, true);
                        break;
                    }
                }
            } catch (RuntimeException e) {
                throw new MalformedMultipartException("malformed multipart framing: " + e.getMessage());
            }
            if (failure != null) {
                throw new MalformedMultipartException(failure);
            }
        }

        /** Refills the drained read buffer; {@code false} at end of stream. */
        private boolean fill() throws IOException {
            BufferUtil.clear(raw);
            int n = in.read(raw.array(), raw.arrayOffset(), raw.capacity());
            if (n > 0) {
                raw.limit(n);
            }
            return n != -1;
        }

        @Override
        public void parsedField(String name, String value) {
            if (!headersComplete) {
                headers.add(name, value);
            }
        }

        @Override
        public boolean headerComplete() {
            headersComplete = true;
            return true;
        }

        @Override
        public boolean content(ByteBuffer item, boolean last) {
            // the slice stays valid until the next parse call
            pending = item;
            partComplete = last;
            return true;
        }

        @Override
        public boolean messageComplete() {
            if (!headersComplete) {
                failure = "multipart body has no parts";
            }
            return true;
        }

        @Override
        public void earlyEOF() {
            switch (parser.getState()) {
                case PREAMBLE, DELIMITER, DELIMITER_CLOSE, DELIMITER_PADDING ->
                        failure = "multipart body has no opening delimiter";
                case BODY_PART -> failure = "multipart body ended inside a header block";
                default -> failure = "multipart body ended before the closing delimiter";
            }
        }
    }
}
