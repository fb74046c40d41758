package io.pipingrelay.core.registry;

import java.util.List;

/**
 * Outcome of registering a sender or receiver on a path.
 */
public sealed interface Registration {

    /**
     * The arrival completed the pairing; the path is now in progress.
     *
     * @param sender    the paired sender
     * @param receivers the paired receivers, in arrival order
     */
    record Commit(SenderHandle sender, List<ReceiverHandle> receivers) implements Registration {
        public Commit {
            receivers = List.copyOf(receivers);
        }

        @Override
        public String toString() {
            return "Commit[receivers=" + receivers.size() + "]";
        }
    }

    /**
     * The arrival was queued.
     *
     * @param queuedReceivers receivers already on the path after this arrival
     */
    record Wait(int queuedReceivers) implements Registration {}

    /**
     * The arrival was refused; the slot is unchanged.
     *
     * @param reason why
     */
    record Reject(RejectionReason reason) implements Registration {}
}
