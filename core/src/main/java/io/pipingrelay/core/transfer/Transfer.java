package io.pipingrelay.core.transfer;

import io.pipingrelay.core.model.HttpHeaders;
import java.util.Objects;

/**
 * What a sender hands to each paired receiver: the status line and headers to
 * respond with, and the stream of body chunks to relay.
 *
 * @param status  HTTP status for the receiver's response
 * @param headers headers forwarded from the sender
 * @param body    the receiver's own view of the sender's body
 */
public record Transfer(int status, HttpHeaders headers, BodyStream body) {

    public Transfer {
        Objects.requireNonNull(headers, "headers must not be null");
        Objects.requireNonNull(body, "body must not be null");
    }
}
