package io.pipingrelay.server.http;

import io.pipingrelay.core.model.HttpHeaders;
import io.pipingrelay.core.spi.ResponseSender;
import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;
import org.eclipse.jetty.io.EndPoint;
import org.eclipse.jetty.server.HttpChannel;
import org.eclipse.jetty.server.HttpConnection;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.util.BufferUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ResponseSender} over a blocking Jetty servlet response.
 *
 * <p>
 * Writes go to the raw servlet output stream and are flushed one by one, so a
 * sender's status lines reach the client immediately and a slow receiver
 * blocks the writing thread. {@link #abort(Throwable)} aborts the underlying
 * Jetty channel: the client sees the connection end without the terminating
 * chunk instead of a clean end of body.
 *
 * <p>
 * Jetty does not watch a connection while a blocking handler runs on it, so
 * {@link #isClientConnected()} looks for itself: while the request body is
 * still arriving it lets Jetty fill and parse without blocking (the bytes stay
 * queued for the handler), otherwise it fills the endpoint directly and
 * treats end of stream as a closed client.
 *
 * <p>
 * Used by exactly one request thread.
 */
public final class ServletResponseSender implements ResponseSender {

    private static final Logger LOG = LoggerFactory.getLogger(ServletResponseSender.class);
    private static final int SCRATCH_SIZE = 512;

    private final HttpServletRequest request;
    private final HttpServletResponse response;
    private ServletOutputStream out;
    private boolean committed;
    private boolean closed;
    private boolean strayInput;

    public ServletResponseSender(HttpServletRequest request, HttpServletResponse response) {
        this.request = request;
        this.response = response;
    }

    @Override
    public void sendStatus(int code, String reason) {
        requireUncommitted();
        response.setStatus(code);
    }

    @Override
    public void sendHeaders(HttpHeaders headers) {
        requireUncommitted();
        for (String name : headers.names()) {
            List<String> values = headers.all(name);
            response.setHeader(name, values.get(0));
            for (int i = 1; i < values.size(); i++) {
                response.addHeader(name, values.get(i));
            }
        }
    }

    @Override
    public void writeChunk(byte[] bytes, int offset, int length) throws IOException {
        if (closed) {
            throw new IOException("Response already closed");
        }
        ServletOutputStream stream = outputStream();
        committed = true;
        stream.write(bytes, offset, length);
        stream.flush();
    }

    @Override
    public void end() throws IOException {
        if (closed) {
            return;
        }
        ServletOutputStream stream = outputStream();
        committed = true;
        closed = true;
        stream.close();
    }

    @Override
    public void abort(Throwable cause) {
        if (closed) {
            return;
        }
        closed = true;
        HttpChannel channel = channel();
        if (channel == null) {
            LOG.debug("No Jetty channel to abort for {}", request.getRequestURI());
            return;
        }
        try {
            channel.abort(cause);
        } catch (RuntimeException e) {
            LOG.debug("Aborting response for {} failed: {}", request.getRequestURI(), e.getMessage());
        }
    }

    @Override
    public boolean isCommitted() {
        return committed || response.isCommitted();
    }

    @Override
    public boolean isClientConnected() {
        HttpChannel channel = channel();
        if (channel == null) {
            return !closed;
        }
        EndPoint endPoint = channel.getEndPoint();
        if (!endPoint.isOpen() || endPoint.isInputShutdown()) {
            return false;
        }
        try {
            if (endPoint.getConnection() instanceof HttpConnection connection
                    && connection.getParser().inContentState()) {
                request.getInputStream().available();
            } else if (!strayInput) {
                readPastRequest(endPoint);
            }
        } catch (IOException e) {
            LOG.debug("Connection check for {} failed: {}", request.getRequestURI(), e.getMessage());
            return false;
        }
        return endPoint.isOpen() && !endPoint.isInputShutdown();
    }

    /** Non-blocking read past the end of the request; -1 means the client closed. */
    private void readPastRequest(EndPoint endPoint) throws IOException {
        ByteBuffer scratch = BufferUtil.allocate(SCRATCH_SIZE);
        if (endPoint.fill(scratch) > 0) {
            // a pipelined request; it cannot be handed back to Jetty
            strayInput = true;
            LOG.debug("Discarded {} pipelined bytes on {}", scratch.remaining(), request.getRequestURI());
            if (!isCommitted()) {
                response.setHeader("Connection", "close");
            }
        }
    }

    private HttpChannel channel() {
        Request baseRequest = Request.getBaseRequest(request);
        return baseRequest != null ? baseRequest.getHttpChannel() : null;
    }

    private ServletOutputStream outputStream() throws IOException {
        if (out == null) {
            out = response.getOutputStream();
        }
        return out;
    }

    private void requireUncommitted() {
        if (isCommitted()) {
            throw new IllegalStateException("Response already committed");
        }
    }
}
