package io.pipingrelay.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.pipingrelay.core.model.HttpHeaders;
import org.junit.jupiter.api.Test;

/** Tests for {@link ForwardedHeaders}. */
class ForwardedHeadersTest {

    @Test
    void copiesContentHeadersAndDropsTheRest() {
        var source = HttpHeaders.builder()
                .set("content-type", "application/octet-stream")
                .set("Content-Length", "42")
                .set("Content-Disposition", "attachment; filename=\"a.bin\"")
                .set("Authorization", "Bearer secret")
                .set("Cookie", "session=1")
                .build();

        HttpHeaders forwarded = ForwardedHeaders.from(source);

        assertThat(forwarded.first("Content-Type")).isEqualTo("application/octet-stream");
        assertThat(forwarded.first("Content-Length")).isEqualTo("42");
        assertThat(forwarded.first("Content-Disposition")).isEqualTo("attachment; filename=\"a.bin\"");
        assertThat(forwarded.contains("Authorization")).isFalse();
        assertThat(forwarded.contains("Cookie")).isFalse();
    }

    @Test
    void alwaysAddsCorsAndRobotsHeaders() {
        HttpHeaders forwarded = ForwardedHeaders.from(HttpHeaders.empty());

        assertThat(forwarded.first("Access-Control-Allow-Origin")).isEqualTo("*");
        assertThat(forwarded.first("Access-Control-Expose-Headers")).isEqualTo("Content-Length, Content-Type");
        assertThat(forwarded.first("X-Robots-Tag")).isEqualTo("none");
        assertThat(forwarded.contains("Content-Type")).isFalse();
        assertThat(forwarded.contains("Content-Length")).isFalse();
    }
}
