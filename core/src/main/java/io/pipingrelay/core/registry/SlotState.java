package io.pipingrelay.core.registry;

/** Observable kind of a path's registry slot. */
public enum SlotState {
    EMPTY,
    SENDER_WAITING,
    RECEIVER_WAITING,
    IN_PROGRESS
}
