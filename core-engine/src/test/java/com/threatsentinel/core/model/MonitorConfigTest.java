package com.threatsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MonitorConfig#normalized(int)}.
 */
class MonitorConfigTest {

    @ParameterizedTest
    @CsvSource({
            "example.com,              https://example.com",
            "localhost:8080/health,    http://localhost:8080/health",
            "127.0.0.1:5000,           http://127.0.0.1:5000",
            "192.168.1.10:443,         https://192.168.1.10:443",
            "http://example.com/path,  http://example.com/path"
    })
    @DisplayName("Should add a default scheme where missing")
    void shouldDefaultScheme(String raw, String expected) {
        assertThat(new MonitorConfig(raw).normalized(30).getUrl()).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"ftp://example.com", "https://", "http://exa mple.com", "  "})
    @DisplayName("Should reject malformed URLs")
    void shouldRejectMalformed(String raw) {
        assertThatThrownBy(() -> new MonitorConfig(raw).normalized(30))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should clamp the interval and leave the original untouched")
    void shouldClampInterval() {
        MonitorConfig config = new MonitorConfig("example.com");
        config.setCheckIntervalSeconds(5);

        MonitorConfig normalized = config.normalized(30);

        assertThat(normalized.getCheckIntervalSeconds()).isEqualTo(30);
        assertThat(config.getCheckIntervalSeconds()).isEqualTo(5);
        assertThat(config.getUrl()).isEqualTo("example.com");
    }

    @Test
    @DisplayName("Should reject a non-positive timeout")
    void shouldRejectTimeout() {
        MonitorConfig config = new MonitorConfig("example.com");
        config.setTimeoutSeconds(0);

        assertThatThrownBy(() -> config.normalized(30))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("timeout");
    }
}
