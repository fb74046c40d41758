package io.pipingrelay.core.transfer;

import java.io.IOException;

/**
 * Receiver-side view of the sender's body.
 *
 * <p>
 * Usage: {@link #read()} a chunk, write it to the receiver's response, then
 * {@link #acknowledge()} it so the sender may read on. After {@code read()}
 * returns {@code null}, end the response and call {@link #finish()}. On a
 * local write failure call {@link #cancel(Throwable)} instead.
 */
public interface BodyStream {

    /**
     * Blocks until the next chunk is available.
     *
     * @return the next chunk (never empty), or {@code null} at end of body
     * @throws io.pipingrelay.core.error.TransferAbortedException if the sender
     *         aborted the transfer
     * @throws InterruptedException if the waiting thread is interrupted
     */
    byte[] read() throws IOException, InterruptedException;

    /** Marks the chunk last returned by {@link #read()} as written. */
    void acknowledge();

    /** Signals that the receiver ended its response after the last chunk. */
    void finish();

    /**
     * Drops this receiver from the transfer. Pending and future chunks fail
     * immediately on the sender side.
     */
    void cancel(Throwable cause);
}
