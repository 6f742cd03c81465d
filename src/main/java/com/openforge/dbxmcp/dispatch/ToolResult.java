package com.openforge.dbxmcp.dispatch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The single terminal outcome of a tool call.
 *
 * Wire format (field names are fixed by the protocol):
 *   { "content": ..., "isError": false }
 *   { "content": null, "isError": true, "errorMessage": "unknown tool foo" }
 *
 * Exactly one of the two shapes: a success never carries an error message, an error
 * always carries a non-blank one.
 */
public record ToolResult(
        @JsonProperty("content")
        JsonNode content,

        @JsonProperty("isError")
        boolean isError,

        @JsonProperty("errorMessage")
        @JsonInclude(JsonInclude.Include.NON_NULL)
        String errorMessage
) {

    private static final String FALLBACK_ERROR = "tool call failed";

    public ToolResult {
        if (isError) {
            content = null;
            errorMessage = errorMessage == null || errorMessage.isBlank() ? FALLBACK_ERROR : errorMessage;
        } else {
            errorMessage = null;
        }
    }

    public static ToolResult success(JsonNode content) {
        return new ToolResult(content, false, null);
    }

    public static ToolResult error(String errorMessage) {
        return new ToolResult(null, true, errorMessage);
    }
}
