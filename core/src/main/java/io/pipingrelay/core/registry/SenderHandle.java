package io.pipingrelay.core.registry;

import io.pipingrelay.core.transfer.Handoff;
import java.util.List;

/**
 * Registry entry for a sender. Holds only what a committing receiver needs to
 * resume the sender: the expected receiver count and the handoff through which
 * the paired receivers are delivered. Never the request body.
 *
 * @param receiverCount the sender's {@code n}
 * @param pairing       delivers the committed receivers to the sender's thread
 */
public record SenderHandle(int receiverCount, Handoff<List<ReceiverHandle>> pairing) {

    public static SenderHandle create(int receiverCount) {
        if (receiverCount < 1) {
            throw new IllegalArgumentException("receiverCount must be positive: " + receiverCount);
        }
        return new SenderHandle(receiverCount, new Handoff<>());
    }
}
