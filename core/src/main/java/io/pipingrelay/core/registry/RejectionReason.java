package io.pipingrelay.core.registry;

/**
 * Why the registry refused a sender or receiver. Each reason carries the
 * plain-text line returned to the refused client with a {@code 400}.
 */
public enum RejectionReason {
    ALREADY_SENDER(
            "[ERROR] The path has been used by another sender.\n",
            "[ERROR] The path has been used by another sender.\n"),
    TOO_MANY_RECEIVERS(
            "[ERROR] The number of receivers has reached limit.\n",
            "[ERROR] The number of receivers has reached limit.\n"),
    MISMATCHED_N(
            "[ERROR] The number of receivers has been mismatched.\n",
            "[ERROR] The number of receivers has been mismatched.\n"),
    RESERVED_PATH(
            "[ERROR] Cannot send to the reserved path.\n",
            "[ERROR] Cannot receive from the reserved path.\n"),
    IN_PROGRESS(
            "[ERROR] The path has been used by another sender.\n",
            "[ERROR] The path is already in use by an established transfer.\n");

    private final String senderMessage;
    private final String receiverMessage;

    RejectionReason(String senderMessage, String receiverMessage) {
        this.senderMessage = senderMessage;
        this.receiverMessage = receiverMessage;
    }

    /** Body line for a refused sender. */
    public String senderMessage() {
        return senderMessage;
    }

    /** Body line for a refused receiver. */
    public String receiverMessage() {
        return receiverMessage;
    }
}
