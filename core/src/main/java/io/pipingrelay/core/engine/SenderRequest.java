package io.pipingrelay.core.engine;

import io.pipingrelay.core.model.HttpHeaders;
import java.io.InputStream;
import java.util.Objects;

/**
 * A {@code POST}/{@code PUT} arriving on a rendezvous path.
 *
 * @param path           raw request path, the rendezvous key
 * @param receiverCount  raw {@code n} query parameter, {@code null} if absent
 * @param headers        request headers
 * @param body           the streaming request body
 */
public record SenderRequest(String path, String receiverCount, HttpHeaders headers, InputStream body) {

    public SenderRequest {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(headers, "headers must not be null");
        Objects.requireNonNull(body, "body must not be null");
    }
}
