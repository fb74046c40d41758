package io.pipingrelay.core.model;

/**
 * How a single sender or receiver request ended. Returned by the engine's
 * entry points once the request is fully handled.
 */
public enum TransferOutcome {
    /** Every byte reached every receiver. */
    COMPLETED,
    /** The body reached some receivers; others disconnected mid-transfer. */
    PARTIAL,
    /** The sender's body ended early (connection drop, malformed body). */
    SENDER_ABORTED,
    /** Every receiver disconnected before the end of the body. */
    RECEIVERS_ABORTED,
    /** This receiver's own connection failed mid-transfer. */
    RECEIVER_ABORTED,
    /** The request was refused with a 4xx before any pairing. */
    REJECTED;

    /** Returns {@code true} if at least one receiver got the complete body. */
    public boolean isDelivered() {
        return this == COMPLETED || this == PARTIAL;
    }
}
