package de.mirkosertic.mcp.travelserver.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BuildInfo")
class BuildInfoTest {

    @Test
    @DisplayName("Should load version and timestamp")
    void shouldLoadVersionAndTimestamp() {
        // When
        final String version = BuildInfo.getVersion();
        final String timestamp = BuildInfo.getBuildTimestamp();

        // Then: either the filtered Maven values or the dev fallbacks
        assertThat(version).matches("^(\\d+\\.\\d+\\.\\d+.*|dev)$");
        assertThat(timestamp).matches("^(\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}Z|unknown)$");
        assertThat(BuildInfo.describe()).isEqualTo(version + " (built " + timestamp + ")");
    }

    @Test
    @DisplayName("Unfiltered placeholders should fall back")
    void unfilteredPlaceholder() {
        assertThat(BuildInfo.filtered("${project.version}", "dev")).isEqualTo("dev");
        assertThat(BuildInfo.filtered(null, "dev")).isEqualTo("dev");
        assertThat(BuildInfo.filtered("1.2.3", "dev")).isEqualTo("1.2.3");
    }
}
