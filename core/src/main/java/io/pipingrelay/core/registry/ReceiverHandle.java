package io.pipingrelay.core.registry;

import io.pipingrelay.core.model.ReceiverCount;
import io.pipingrelay.core.transfer.Handoff;
import io.pipingrelay.core.transfer.Transfer;

/**
 * Registry entry for a receiver: its expected count, whether it only wants
 * headers ({@code HEAD}), and the handoff through which the sender delivers
 * the {@link Transfer}. Never the response itself.
 *
 * @param receiverCount the receiver's {@code n}; {@link ReceiverCount#DEFAULT}
 *                      when the request did not name one
 * @param countGiven    {@code false} if the request had no {@code n}; such a
 *                      receiver joins whatever count the path already expects
 * @param headOnly      {@code true} for {@code HEAD} requests
 * @param transfer      delivers status, headers and body stream from the sender
 */
public record ReceiverHandle(int receiverCount, boolean countGiven, boolean headOnly, Handoff<Transfer> transfer) {

    /** A receiver that named its count with {@code ?n=}. */
    public static ReceiverHandle create(int receiverCount, boolean headOnly) {
        if (receiverCount < 1) {
            throw new IllegalArgumentException("receiverCount must be positive: " + receiverCount);
        }
        return new ReceiverHandle(receiverCount, true, headOnly, new Handoff<>());
    }

    /** A receiver without {@code ?n=}. */
    public static ReceiverHandle withoutCount(boolean headOnly) {
        return new ReceiverHandle(ReceiverCount.DEFAULT, false, headOnly, new Handoff<>());
    }

    /** Whether this receiver can join a path expecting {@code expected} receivers. */
    boolean accepts(int expected) {
        return !countGiven || receiverCount == expected;
    }
}
