package tech.demoserver.app;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CorsFilterTest {

    private static CorsFilter filterFor(List<String> origins) {
        CorsFilter filter = new CorsFilter();
        filter.corsConfig = () -> origins;
        return filter;
    }

    @Test
    @DisplayName("Only listed origins should be allowed")
    void isOriginAllowed_shouldMatchExactly() {
        CorsFilter filter = filterFor(List.of("http://localhost:3000"));

        assertThat(filter.isOriginAllowed("http://localhost:3000")).isTrue();
        assertThat(filter.isOriginAllowed("http://localhost:3001")).isFalse();
        assertThat(filter.isOriginAllowed("https://localhost:3000")).isFalse();
    }

    @Test
    @DisplayName("A wildcard entry should allow any origin")
    void isOriginAllowed_shouldAcceptWildcard() {
        assertThat(filterFor(List.of("*")).isOriginAllowed("http://anywhere.example")).isTrue();
    }
}
