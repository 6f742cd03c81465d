package com.openforge.dbxmcp.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.dbxmcp.tool.ToolContext;

import java.util.Map;

/**
 * Custom behaviour around a catalog operation: extra argument rules, status polling,
 * result reshaping. Registered as a Spring bean and referenced from operations.yml by
 * bean name ({@code handler: runJobHandler}).
 *
 * Implementations perform the operation's own request through {@code endpoint} and may
 * issue further calls through {@link ToolContext#client()}.
 */
@FunctionalInterface
public interface OperationHandler {

    JsonNode handle(EndpointToolHandler endpoint, Map<String, Object> arguments, ToolContext context);
}
