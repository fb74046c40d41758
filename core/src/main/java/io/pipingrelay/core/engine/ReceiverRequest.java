package io.pipingrelay.core.engine;

import java.util.Objects;

/**
 * A {@code GET}/{@code HEAD} arriving on a rendezvous path.
 *
 * @param path          raw request path, the rendezvous key
 * @param receiverCount raw {@code n} query parameter, {@code null} if absent
 * @param headOnly      {@code true} for {@code HEAD}: headers only, empty body
 */
public record ReceiverRequest(String path, String receiverCount, boolean headOnly) {

    public ReceiverRequest {
        Objects.requireNonNull(path, "path must not be null");
    }
}
