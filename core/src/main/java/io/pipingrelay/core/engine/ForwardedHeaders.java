package io.pipingrelay.core.engine;

import io.pipingrelay.core.model.HttpHeaders;

/**
 * Builds the response headers a receiver gets from its sender.
 *
 * <p>
 * Only {@code Content-Type}, {@code Content-Length} and
 * {@code Content-Disposition} travel from sender to receiver; everything else
 * the sender sent stays behind. The relay then adds its own CORS exposure and
 * {@code X-Robots-Tag: none} so that shared links are not indexed.
 */
public final class ForwardedHeaders {

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String CONTENT_LENGTH = "Content-Length";
    public static final String CONTENT_DISPOSITION = "Content-Disposition";

    private ForwardedHeaders() {
        // utility class
    }

    /**
     * @param source headers of the sender's request, or of the first multipart
     *               part (which carries no {@code Content-Length})
     * @return the headers to send to every receiver
     */
    public static HttpHeaders from(HttpHeaders source) {
        HttpHeaders.Builder builder = HttpHeaders.builder();
        copy(source, builder, CONTENT_TYPE);
        copy(source, builder, CONTENT_LENGTH);
        copy(source, builder, CONTENT_DISPOSITION);
        builder.set("Access-Control-Allow-Origin", "*");
        builder.set("Access-Control-Expose-Headers", "Content-Length, Content-Type");
        builder.set("X-Robots-Tag", "none");
        return builder.build();
    }

    private static void copy(HttpHeaders source, HttpHeaders.Builder target, String name) {
        String value = source.first(name);
        if (value != null) {
            target.set(name, value);
        }
    }
}
