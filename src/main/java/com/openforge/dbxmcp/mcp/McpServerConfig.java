package com.openforge.dbxmcp.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Attaches the tool server to stdin/stdout.
 *
 * The transport gets its own plain ObjectMapper: MCP messages are camelCase and must not
 * pass through the application's snake_case mapper.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "mcp.server", name = "stdio-enabled", havingValue = "true", matchIfMissing = true)
public class McpServerConfig {

    @Bean
    public StdioServerTransportProvider stdioServerTransportProvider() {
        return new StdioServerTransportProvider(new ObjectMapper());
    }

    @Bean(destroyMethod = "closeGracefully")
    public McpSyncServer mcpSyncServer(StdioServerTransportProvider transportProvider,
                                       McpServerProperties properties,
                                       McpToolBridge bridge) {
        var tools = bridge.toolSpecifications();
        McpSyncServer server = McpServer.sync(transportProvider)
                .serverInfo(properties.name(), properties.version())
                .capabilities(McpSchema.ServerCapabilities.builder()
                        .tools(false)
                        .logging()
                        .build())
                .tools(tools)
                .build();
        log.info("[McpServer] {} {} serving {} tools over stdio", properties.name(), properties.version(), tools.size());
        return server;
    }
}
