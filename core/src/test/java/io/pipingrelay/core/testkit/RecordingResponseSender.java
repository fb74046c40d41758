package io.pipingrelay.core.testkit;

import io.pipingrelay.core.model.HttpHeaders;
import io.pipingrelay.core.spi.ResponseSender;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * In-memory {@link ResponseSender} that records what the engine wrote.
 *
 * <p>
 * Can be told to fail once a number of body bytes were written, which is how
 * tests simulate a client that disconnects mid-transfer.
 */
public final class RecordingResponseSender implements ResponseSender {

    private final ByteArrayOutputStream body = new ByteArrayOutputStream();
    private final CountDownLatch done = new CountDownLatch(1);
    private final HttpHeaders.Builder headers = HttpHeaders.builder();
    private long failAfterBytes = Long.MAX_VALUE;
    private int status;
    private boolean committed;
    private boolean ended;
    private boolean clientGone;
    private Throwable abortCause;

    /** Makes the write that crosses {@code bytes} body bytes throw. */
    public synchronized RecordingResponseSender failAfter(long bytes) {
        this.failAfterBytes = bytes;
        return this;
    }

    @Override
    public synchronized void sendStatus(int code, String reason) {
        requireUncommitted();
        status = code;
    }

    @Override
    public synchronized void sendHeaders(HttpHeaders more) {
        requireUncommitted();
        more.forEach(headers::set);
    }

    @Override
    public synchronized void writeChunk(byte[] bytes, int offset, int length) throws IOException {
        if (ended || abortCause != null) {
            throw new IOException("Response already closed");
        }
        committed = true;
        if (body.size() + (long) length > failAfterBytes) {
            throw new IOException("Simulated client disconnect");
        }
        body.write(bytes, offset, length);
        notifyAll();
    }

    @Override
    public synchronized void end() throws IOException {
        if (abortCause != null) {
            throw new IOException("Response already aborted");
        }
        committed = true;
        ended = true;
        done.countDown();
        notifyAll();
    }

    @Override
    public synchronized void abort(Throwable cause) {
        if (!ended && abortCause == null) {
            abortCause = cause;
        }
        done.countDown();
        notifyAll();
    }

    @Override
    public synchronized boolean isCommitted() {
        return committed;
    }

    @Override
    public synchronized boolean isClientConnected() {
        return !clientGone;
    }

    /** Simulates the client closing its connection while it waits. */
    public synchronized void disconnect() {
        clientGone = true;
    }

    private void requireUncommitted() {
        if (committed) {
            throw new IllegalStateException("Response already committed");
        }
    }

    /** Waits until the response ended or aborted. */
    public boolean awaitDone(Duration timeout) throws InterruptedException {
        return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** Waits until the body contains {@code text}. */
    public synchronized boolean awaitBody(String text, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!bodyAsString().contains(text)) {
            long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remaining <= 0) {
                return false;
            }
            wait(remaining);
        }
        return true;
    }

    public synchronized int status() {
        return status;
    }

    public synchronized HttpHeaders headers() {
        return headers.build();
    }

    public synchronized String bodyAsString() {
        return body.toString(StandardCharsets.UTF_8);
    }

    public synchronized byte[] bodyBytes() {
        return body.toByteArray();
    }

    public synchronized boolean isEnded() {
        return ended;
    }

    public synchronized boolean isAborted() {
        return abortCause != null;
    }
}
