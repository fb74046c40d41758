package io.pipingrelay.core.registry;

import io.pipingrelay.core.registry.PathSlot.InProgress;
import io.pipingrelay.core.registry.PathSlot.ReceiverWaiting;
import io.pipingrelay.core.registry.PathSlot.SenderWaiting;
import io.pipingrelay.core.registry.Registration.Commit;
import io.pipingrelay.core.registry.Registration.Reject;
import io.pipingrelay.core.registry.Registration.Wait;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide rendezvous table: path → who is currently registered on it.
 *
 * <p>
 * Slot lifecycle: {@code EMPTY → SENDER_WAITING | RECEIVER_WAITING →
 * IN_PROGRESS → EMPTY}. A pairing commits when, after an arrival, the slot
 * holds one sender and exactly {@code n} receivers. Every operation is one
 * atomic read-modify-write under a single lock and does O(1) work apart from
 * copying the (small) waiting-receiver list; no I/O happens under the lock and
 * waiting tasks are resumed by the caller after the lock is released.
 *
 * <p>
 * The registry stores handles only, never request or response bodies.
 */
public final class PathRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(PathRegistry.class);

    private final Map<String, PathSlot> slots = new HashMap<>();

    /**
     * Registers a sender.
     *
     * @return {@link Commit} with the queued receivers if they complete the
     *         sender's count, {@link Wait} if the sender must wait, or
     *         {@link Reject}
     */
    public Registration registerSender(String path, SenderHandle sender) {
        Registration result = commitSender(path, sender);
        LOG.debug("Sender on {} (n={}): {}", path, sender.receiverCount(), result);
        return result;
    }

    /**
     * Registers a receiver.
     *
     * @return {@link Commit} with the waiting sender and all receivers if this
     *         arrival completes the pairing, {@link Wait}, or {@link Reject}
     */
    public Registration registerReceiver(String path, ReceiverHandle receiver) {
        Registration result = commitReceiver(path, receiver);
        LOG.debug("Receiver on {} (n={}): {}",
                path, receiver.countGiven() ? receiver.receiverCount() : "unset", result);
        return result;
    }

    private synchronized Registration commitSender(String path, SenderHandle sender) {
        if (ReservedPaths.isReserved(path)) {
            return new Reject(RejectionReason.RESERVED_PATH);
        }
        PathSlot slot = slots.get(path);
        Registration result;
        if (slot == null) {
            slots.put(path, new SenderWaiting(sender, List.of()));
            result = new Wait(0);
        } else if (slot instanceof SenderWaiting) {
            result = new Reject(RejectionReason.ALREADY_SENDER);
        } else if (slot instanceof InProgress) {
            result = new Reject(RejectionReason.IN_PROGRESS);
        } else {
            ReceiverWaiting waiting = (ReceiverWaiting) slot;
            if (sender.receiverCount() != waiting.expected()) {
                result = new Reject(RejectionReason.MISMATCHED_N);
            } else if (waiting.receivers().size() == waiting.expected()) {
                slots.put(path, new InProgress(waiting.expected()));
                result = new Commit(sender, waiting.receivers());
            } else {
                slots.put(path, new SenderWaiting(sender, waiting.receivers()));
                result = new Wait(waiting.receivers().size());
            }
        }
        return result;
    }

    private synchronized Registration commitReceiver(String path, ReceiverHandle receiver) {
        if (ReservedPaths.isReserved(path)) {
            return new Reject(RejectionReason.RESERVED_PATH);
        }
        PathSlot slot = slots.get(path);
        Registration result;
        if (slot == null) {
            slots.put(path, new ReceiverWaiting(List.of(receiver), receiver.receiverCount()));
            result = new Wait(1);
        } else if (slot instanceof InProgress) {
            result = new Reject(RejectionReason.IN_PROGRESS);
        } else if (slot instanceof ReceiverWaiting waiting) {
            if (!receiver.accepts(waiting.expected())) {
                result = new Reject(RejectionReason.MISMATCHED_N);
            } else if (waiting.receivers().size() >= waiting.expected()) {
                result = new Reject(RejectionReason.TOO_MANY_RECEIVERS);
            } else {
                List<ReceiverHandle> receivers = append(waiting.receivers(), receiver);
                slots.put(path, new ReceiverWaiting(receivers, waiting.expected()));
                result = new Wait(receivers.size());
            }
        } else {
            SenderWaiting waiting = (SenderWaiting) slot;
            if (!receiver.accepts(waiting.expected())) {
                result = new Reject(RejectionReason.MISMATCHED_N);
            } else {
                List<ReceiverHandle> receivers = append(waiting.receivers(), receiver);
                if (receivers.size() == waiting.expected()) {
                    slots.put(path, new InProgress(waiting.expected()));
                    result = new Commit(waiting.sender(), receivers);
                } else {
                    slots.put(path, new SenderWaiting(waiting.sender(), receivers));
                    result = new Wait(receivers.size());
                }
            }
        }
        return result;
    }

    /** Returns the path to the empty slot. Called once per committed pairing. */
    public void release(String path) {
        PathSlot removed;
        synchronized (this) {
            removed = slots.remove(path);
        }
        LOG.debug("Released {} (was {})", path, removed != null ? removed.state() : SlotState.EMPTY);
    }

    /**
     * Removes a sender whose waiting task was cancelled before commit. Queued
     * receivers stay on the path. Does nothing if the sender is no longer the
     * waiting one (e.g. the pairing already committed).
     *
     * @return {@code true} if the sender was removed
     */
    public synchronized boolean withdraw(String path, SenderHandle sender) {
        PathSlot slot = slots.get(path);
        if (!(slot instanceof SenderWaiting waiting) || waiting.sender() != sender) {
            return false;
        }
        if (waiting.receivers().isEmpty()) {
            slots.remove(path);
        } else {
            slots.put(path, new ReceiverWaiting(waiting.receivers(), waiting.expected()));
        }
        return true;
    }

    /**
     * Removes a receiver whose waiting task was cancelled before commit.
     *
     * @return {@code true} if the receiver was removed
     */
    public synchronized boolean withdraw(String path, ReceiverHandle receiver) {
        PathSlot slot = slots.get(path);
        if (slot instanceof ReceiverWaiting waiting && containsHandle(waiting.receivers(), receiver)) {
            List<ReceiverHandle> remaining = without(waiting.receivers(), receiver);
            if (remaining.isEmpty()) {
                slots.remove(path);
            } else {
                slots.put(path, new ReceiverWaiting(remaining, waiting.expected()));
            }
            return true;
        }
        if (slot instanceof SenderWaiting waiting && containsHandle(waiting.receivers(), receiver)) {
            slots.put(path, new SenderWaiting(waiting.sender(), without(waiting.receivers(), receiver)));
            return true;
        }
        return false;
    }

    /** Current slot kind for a path. */
    public synchronized SlotState stateOf(String path) {
        PathSlot slot = slots.get(path);
        return slot != null ? slot.state() : SlotState.EMPTY;
    }

    /** Number of receivers registered on a path (queued or in progress). */
    public synchronized int receiverCount(String path) {
        PathSlot slot = slots.get(path);
        if (slot instanceof SenderWaiting waiting) {
            return waiting.receivers().size();
        }
        if (slot instanceof ReceiverWaiting waiting) {
            return waiting.receivers().size();
        }
        if (slot instanceof InProgress inProgress) {
            return inProgress.receivers();
        }
        return 0;
    }

    /** Number of non-empty slots. */
    public synchronized int size() {
        return slots.size();
    }

    private static List<ReceiverHandle> append(List<ReceiverHandle> receivers, ReceiverHandle receiver) {
        List<ReceiverHandle> result = new ArrayList<>(receivers.size() + 1);
        result.addAll(receivers);
        result.add(receiver);
        return result;
    }

    private static boolean containsHandle(List<ReceiverHandle> receivers, ReceiverHandle receiver) {
        for (ReceiverHandle r : receivers) {
            if (r == receiver) {
                return true;
            }
        }
        return false;
    }

    private static List<ReceiverHandle> without(List<ReceiverHandle> receivers, ReceiverHandle receiver) {
        List<ReceiverHandle> result = new ArrayList<>(receivers);
        result.removeIf(r -> r == receiver);
        return result;
    }
}
