package io.pipingrelay.core.registry;

import java.util.List;

/**
 * Registry record for one path. An absent map entry is the empty slot; the
 * three variants below are the occupied ones.
 *
 * <p>
 * Variants are immutable; every transition replaces the slot.
 */
sealed interface PathSlot {

    SlotState state();

    /** A sender arrived first; {@code receivers} have joined it so far. */
    record SenderWaiting(SenderHandle sender, List<ReceiverHandle> receivers) implements PathSlot {
        public SenderWaiting {
            receivers = List.copyOf(receivers);
        }

        int expected() {
            return sender.receiverCount();
        }

        @Override
        public SlotState state() {
            return SlotState.SENDER_WAITING;
        }
    }

    /** Receivers arrived first and await a sender asking for {@code expected}. */
    record ReceiverWaiting(List<ReceiverHandle> receivers, int expected) implements PathSlot {
        public ReceiverWaiting {
            receivers = List.copyOf(receivers);
        }

        @Override
        public SlotState state() {
            return SlotState.RECEIVER_WAITING;
        }
    }

    /** A pairing is committed and streaming. */
    record InProgress(int receivers) implements PathSlot {
        @Override
        public SlotState state() {
            return SlotState.IN_PROGRESS;
        }
    }
}
