package io.pipingrelay.server.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link StaticPages} and {@link HelpHandler#helpText}. */
class StaticPagesTest {

    @Test
    @DisplayName("bundled pages carry their placeholders")
    void pagesOnClasspath() {
        assertThat(StaticPages.read(StaticPages.INDEX_HTML)).contains("{{version}}");
        assertThat(StaticPages.read(StaticPages.NO_SCRIPT_HTML))
                .contains("{{path}}")
                .contains("multipart/form-data");
    }

    @Test
    @DisplayName("missing resource is an IllegalStateException")
    void missingResource() {
        assertThatThrownBy(() -> StaticPages.read("/static/missing.html"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("/static/missing.html");
    }

    @Test
    @DisplayName("version is never blank")
    void version() {
        assertThat(StaticPages.version()).isNotBlank().doesNotContain("${");
    }

    @Test
    @DisplayName("help text addresses the URL the client used")
    void helpText() {
        String text = HelpHandler.helpText("https://relay.example:8443", "1.2.3");

        assertThat(text)
                .startsWith("Help for piping-relay 1.2.3\n")
                .contains("curl -T myfile https://relay.example:8443/mypath\n")
                .contains("curl 'https://relay.example:8443/mypath?n=3'\n");
    }
}
