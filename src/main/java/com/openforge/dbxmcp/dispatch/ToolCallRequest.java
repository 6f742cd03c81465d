package com.openforge.dbxmcp.dispatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A decoded inbound tool call. Consumed once by the dispatcher, never persisted.
 *
 * @param callId correlation id; generated when the transport does not supply one
 */
public record ToolCallRequest(
        String              callId,
        String              toolName,
        Map<String, Object> arguments
) {

    public ToolCallRequest {
        callId    = callId == null || callId.isBlank() ? UUID.randomUUID().toString() : callId;
        arguments = arguments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public static ToolCallRequest of(String toolName, Map<String, Object> arguments) {
        return new ToolCallRequest(null, toolName, arguments);
    }
}
