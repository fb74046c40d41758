package io.pipingrelay.core.transfer;

import io.pipingrelay.core.error.TransferAbortedException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-receiver body channel fed by the sender's fan-out loop.
 *
 * <p>
 * Holds at most one chunk. {@link #offer(byte[])} hands a chunk over and
 * returns a future that completes when the receiver acknowledges it, so the
 * sender can wait for its slowest receiver before reading the next chunk.
 * Chunks are shared between pipes and must not be mutated after the offer.
 *
 * <p>
 * Thread-safe: one sender thread and one receiver thread per pipe.
 */
public final class ChunkPipe implements BodyStream {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    private byte[] pending;
    private CompletableFuture<Void> pendingAck;
    private boolean closed;
    private Throwable upstreamFailure;
    private Throwable downstreamFailure;

    /** Creates a pipe that is already at end of body (for header-only receivers). */
    public static ChunkPipe closedPipe() {
        ChunkPipe pipe = new ChunkPipe();
        pipe.closed = true;
        return pipe;
    }

    // ── Sender side ──

    /**
     * Hands the next chunk to the receiver.
     *
     * @param chunk a non-empty chunk
     * @return completes once the receiver wrote the chunk, or exceptionally if
     *         the receiver cancelled
     * @throws IllegalStateException if the previous chunk was not acknowledged
     *                               yet, or the pipe was already closed
     */
    public CompletableFuture<Void> offer(byte[] chunk) {
        lock.lock();
        try {
            if (downstreamFailure != null) {
                return CompletableFuture.failedFuture(downstreamFailure);
            }
            if (closed || upstreamFailure != null) {
                throw new IllegalStateException("Pipe already closed");
            }
            if (pendingAck != null) {
                throw new IllegalStateException("Previous chunk not acknowledged yet");
            }
            pending = chunk;
            pendingAck = new CompletableFuture<>();
            changed.signalAll();
            return pendingAck;
        } finally {
            lock.unlock();
        }
    }

    /** Marks the end of the body. */
    public void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Aborts the body: the receiver's next {@link #read()} throws. */
    public void fail(Throwable cause) {
        lock.lock();
        try {
            if (upstreamFailure == null) {
                upstreamFailure = cause;
            }
            pending = null;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Completes when the receiver finished its response, exceptionally when it
     * cancelled.
     */
    public CompletableFuture<Void> completion() {
        return completion;
    }

    // ── Receiver side ──

    @Override
    public byte[] read() throws TransferAbortedException, InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                if (upstreamFailure != null) {
                    throw new TransferAbortedException("Sender aborted the transfer", upstreamFailure);
                }
                if (downstreamFailure != null) {
                    throw new TransferAbortedException("Receiver already cancelled", downstreamFailure);
                }
                if (pending != null) {
                    byte[] chunk = pending;
                    pending = null;
                    return chunk;
                }
                if (closed) {
                    return null;
                }
                changed.await();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void acknowledge() {
        CompletableFuture<Void> ack;
        lock.lock();
        try {
            ack = pendingAck;
            pendingAck = null;
        } finally {
            lock.unlock();
        }
        if (ack != null) {
            ack.complete(null);
        }
    }

    @Override
    public void finish() {
        completion.complete(null);
    }

    @Override
    public void cancel(Throwable cause) {
        CompletableFuture<Void> ack;
        lock.lock();
        try {
            if (downstreamFailure == null) {
                downstreamFailure = cause;
            }
            pending = null;
            ack = pendingAck;
            pendingAck = null;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        if (ack != null) {
            ack.completeExceptionally(cause);
        }
        completion.completeExceptionally(cause);
    }
}
