package com.openforge.dbxmcp.tool;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Executes one tool invocation.
 *
 * Arguments have already been validated against the descriptor's parameter schema and
 * carry declared defaults. Handlers throw on failure; the dispatcher turns every
 * exception into an error result. Handlers must not swallow interrupts: an interrupt
 * means the call was cancelled or timed out.
 */
@FunctionalInterface
public interface ToolHandler {

    JsonNode handle(Map<String, Object> arguments, ToolContext context);
}
