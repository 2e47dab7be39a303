package de.mirkosertic.mcp.travelserver.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.spec.ProtocolVersions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LatestProtocolStdioServerTransportProvider")
class LatestProtocolStdioServerTransportProviderTest {

    @Test
    @DisplayName("Should offer the newest protocol revision first and keep the original one")
    void protocolVersionsNewestFirst() {
        final LatestProtocolStdioServerTransportProvider provider =
                new LatestProtocolStdioServerTransportProvider(new JacksonMcpJsonMapper(new ObjectMapper()));

        assertThat(provider.protocolVersions())
                .first().isEqualTo(ProtocolVersions.MCP_2025_06_18);
        assertThat(provider.protocolVersions()).contains(ProtocolVersions.MCP_2024_11_05);
    }
}
