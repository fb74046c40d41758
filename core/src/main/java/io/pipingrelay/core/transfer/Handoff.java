package io.pipingrelay.core.transfer;

import io.pipingrelay.core.error.TransferAbortedException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot channel between two request-handling threads.
 *
 * <p>
 * The producing side calls {@link #offer(Object)} exactly once; the consuming
 * side blocks in {@link #receive()} until the value arrives. Either side can
 * {@link #abort(Throwable)}: a consumer blocked in {@code receive()} then gets a
 * {@link TransferAbortedException}, and a producer that offers afterwards gets
 * {@code false} back.
 *
 * <ul>
 * <li>A second {@code offer} throws {@link IllegalStateException}.</li>
 * <li>A second {@code receive} returns {@link Optional#empty()}.</li>
 * </ul>
 *
 * <p>
 * Thread-safe.
 *
 * @param <T> the type of the value handed over
 */
public final class Handoff<T> {

    private final CompletableFuture<T> value = new CompletableFuture<>();
    private final AtomicBoolean offered = new AtomicBoolean();
    private final AtomicBoolean received = new AtomicBoolean();

    /**
     * Delivers the value to the consuming side.
     *
     * @param item the value, never {@code null}
     * @return {@code true} if delivered, {@code false} if the handoff was
     *         aborted first
     * @throws IllegalStateException if a value was already offered
     */
    public boolean offer(T item) {
        if (item == null) {
            throw new NullPointerException("item must not be null");
        }
        if (!offered.compareAndSet(false, true)) {
            throw new IllegalStateException("Handoff already used");
        }
        return value.complete(item);
    }

    /**
     * Blocks until the value is offered or the handoff is aborted.
     *
     * @return the value on the first call, empty on every later call
     * @throws TransferAbortedException if the handoff was aborted
     * @throws InterruptedException     if the waiting thread is interrupted
     */
    public Optional<T> receive() throws TransferAbortedException, InterruptedException {
        if (!received.compareAndSet(false, true)) {
            return Optional.empty();
        }
        try {
            return Optional.of(value.get());
        } catch (ExecutionException e) {
            throw new TransferAbortedException("Handoff aborted", e.getCause());
        }
    }

    /**
     * Waits up to {@code timeout} for the value or an abort without consuming
     * either. Lets a waiting side check on its own client between waits.
     *
     * @return {@code true} once {@link #receive()} would return without blocking
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(Duration timeout) throws InterruptedException {
        try {
            value.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (ExecutionException e) {
            return true;
        } catch (TimeoutException e) {
            return false;
        }
    }

    /**
     * Aborts the handoff. Has no effect once a value was delivered.
     *
     * @param cause why the pairing is being abandoned
     * @return {@code true} if this call aborted the handoff
     */
    public boolean abort(Throwable cause) {
        return value.completeExceptionally(cause);
    }

    /**
     * Returns the delivered value without waiting and without consuming it.
     * Used by the side that gives up after the other side already delivered.
     */
    public Optional<T> delivered() {
        if (!value.isDone() || value.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.of(value.join());
    }

    /** Returns {@code true} once a value was delivered or the handoff aborted. */
    public boolean isDone() {
        return value.isDone();
    }

    /** Returns {@code true} if the handoff ended in an abort. */
    public boolean isAborted() {
        return value.isCompletedExceptionally();
    }
}
