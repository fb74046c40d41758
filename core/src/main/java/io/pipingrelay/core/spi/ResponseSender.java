package io.pipingrelay.core.spi;

import io.pipingrelay.core.model.HttpHeaders;
import java.io.IOException;

/**
 * Incremental response writer the engine drives for both senders and
 * receivers.
 *
 * <p>
 * Gateway adapters implement this over their native response object (see the
 * server module's servlet implementation). The engine calls, in order:
 * {@link #sendStatus} and {@link #sendHeaders} (any number of times while the
 * response is uncommitted), then {@link #writeChunk} zero or more times, then
 * either {@link #end()} or {@link #abort(Throwable)}.
 *
 * <p>
 * Contract:
 * <ul>
 * <li>Status and headers are committed no later than the first
 * {@code writeChunk} or {@code end}; afterwards {@code sendStatus} and
 * {@code sendHeaders} throw {@link IllegalStateException}.</li>
 * <li>{@code writeChunk} blocks until the bytes are handed to the transport and
 * flushed; this is how the engine applies backpressure.</li>
 * <li>{@code abort} terminates the exchange so that the peer observes an early
 * end of body rather than a clean one.</li>
 * </ul>
 */
public interface ResponseSender {

    /**
     * Sets the status line.
     *
     * @param code   HTTP status code
     * @param reason reason phrase; adapters may ignore it where the transport
     *               derives its own
     */
    void sendStatus(int code, String reason);

    /** Adds headers to the uncommitted response, replacing same-named ones. */
    void sendHeaders(HttpHeaders headers);

    /** Writes and flushes body bytes, committing the headers first. */
    void writeChunk(byte[] bytes, int offset, int length) throws IOException;

    /** Writes and flushes a whole chunk. */
    default void writeChunk(byte[] bytes) throws IOException {
        writeChunk(bytes, 0, bytes.length);
    }

    /** Completes the response normally. */
    void end() throws IOException;

    /** Terminates the response abnormally. Never throws. */
    void abort(Throwable cause);

    /** Returns {@code true} once status and headers are on the wire. */
    boolean isCommitted();

    /**
     * Returns {@code false} once the client is known to have closed its
     * connection. The engine polls this while a sender or receiver waits for
     * its peers; adapters may read from the connection to find out, but must
     * not lose request body bytes doing so.
     */
    boolean isClientConnected();
}
