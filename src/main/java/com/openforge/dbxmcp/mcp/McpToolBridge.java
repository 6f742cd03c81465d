package com.openforge.dbxmcp.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.dbxmcp.dispatch.ProgressListener;
import com.openforge.dbxmcp.dispatch.ToolCallRequest;
import com.openforge.dbxmcp.dispatch.ToolDispatcher;
import com.openforge.dbxmcp.dispatch.ToolProgress;
import com.openforge.dbxmcp.dispatch.ToolResult;
import com.openforge.dbxmcp.tool.ToolDescriptor;
import com.openforge.dbxmcp.tool.ToolMetadata;
import com.openforge.dbxmcp.tool.ToolRegistry;
import io.modelcontextprotocol.server.McpServerFeatures.SyncToolSpecification;
import io.modelcontextprotocol.server.McpSyncServerExchange;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Adapts the registry and dispatcher to the MCP SDK.
 *
 *   tools/list  ← one {@link McpSchema.Tool} per descriptor (name, description, JSON schema)
 *   tools/call  → {@link ToolDispatcher#dispatch} → {@link McpSchema.CallToolResult}
 *   progress    → notifications/message, logger "tool-progress", one JSON event per line
 *
 * Success content is the result JSON as text; errors carry the error message as text and
 * isError=true.
 */
@Slf4j
@Component
public class McpToolBridge {

    static final String PROGRESS_LOGGER = "tool-progress";

    private final ToolRegistry   registry;
    private final ToolDispatcher dispatcher;
    private final ObjectMapper   objectMapper;

    public McpToolBridge(ToolRegistry registry, ToolDispatcher dispatcher, ObjectMapper objectMapper) {
        this.registry     = registry;
        this.dispatcher   = dispatcher;
        this.objectMapper = objectMapper;
    }

    public List<SyncToolSpecification> toolSpecifications() {
        return registry.stream()
                .map(descriptor -> new SyncToolSpecification(
                        toTool(descriptor),
                        (exchange, arguments) -> call(exchange, descriptor.name(), arguments)))
                .toList();
    }

    McpSchema.Tool toTool(ToolDescriptor descriptor) {
        ToolMetadata metadata = descriptor.metadata();
        return new McpSchema.Tool(metadata.name(), metadata.description(), toJson(metadata.parameters()));
    }

    McpSchema.CallToolResult call(McpSyncServerExchange exchange, String toolName, Map<String, Object> arguments) {
        ToolCallRequest request = ToolCallRequest.of(toolName, arguments);
        ProgressListener listener = exchange == null ? ProgressListener.NONE : progress -> notify(exchange, progress);
        return toCallToolResult(dispatcher.dispatch(request, listener));
    }

    McpSchema.CallToolResult toCallToolResult(ToolResult result) {
        String text = result.isError() ? result.errorMessage() : render(result.content());
        return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(text)), result.isError());
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private void notify(McpSyncServerExchange exchange, ToolProgress progress) {
        exchange.loggingNotification(new McpSchema.LoggingMessageNotification(
                McpSchema.LoggingLevel.INFO, PROGRESS_LOGGER, toJson(progress)));
    }

    private String render(JsonNode content) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(content);
        } catch (JsonProcessingException e) {
            log.warn("[McpBridge] Could not render result: {}", e.getOriginalMessage());
            return String.valueOf(content);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
