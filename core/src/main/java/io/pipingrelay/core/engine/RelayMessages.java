package io.pipingrelay.core.engine;

/**
 * Fixed plain-text lines the relay writes to senders. They are part of the
 * external contract: clients (and tests) match on them.
 */
public final class RelayMessages {

    public static final String INVALID_N = "[ERROR] Invalid n query parameter.\n";
    public static final String SENT_SUCCESSFULLY = "[INFO] Sent successfully!\n";
    public static final String SENDING_ABORTED = "[INFO] Sending aborted.\n";
    public static final String A_RECEIVER_CONNECTED = "[INFO] A receiver was connected.\n";

    private RelayMessages() {
        // utility class
    }

    /** First line of every accepted sender's response. */
    public static String waitingFor(int receivers) {
        return "[INFO] Waiting for " + receivers + " receiver(s)...\n";
    }

    /** Written right after {@link #waitingFor} when receivers were already queued. */
    public static String alreadyConnected(int queued) {
        return "[INFO] " + queued + " receiver(s) has/have been connected.\n";
    }

    /** Written once the pairing commits. */
    public static String connected(int receivers) {
        return receivers == 1 ? A_RECEIVER_CONNECTED : "[INFO] " + receivers + " receivers were connected.\n";
    }

    /** Written before the final line when some receivers dropped mid-transfer. */
    public static String partialDelivery(int dropped, int receivers) {
        return "[WARN] " + dropped + " of " + receivers
                + " receiver(s) disconnected before the end of the transfer.\n";
    }
}
