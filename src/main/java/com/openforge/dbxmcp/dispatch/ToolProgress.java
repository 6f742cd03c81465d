package com.openforge.dbxmcp.dispatch;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One intermediate progress event of a long-running tool call.
 *
 * Zero or more of these precede the single {@link ToolResult} of a call; none follow it.
 *
 * Fields:
 *   callId    : the call this event belongs to
 *   toolName  : the tool being executed
 *   sequence  : 1-based, strictly increasing per call
 *   message   : human-readable state, e.g. "run 42: RUNNING"
 *   fraction  : completion in [0, 1] when the handler can tell, else null
 *   timestamp : epoch millis
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolProgress(
        String callId,
        String toolName,
        int    sequence,
        String message,
        Double fraction,
        long   timestamp
) {

    public static ToolProgress of(String callId, String toolName, int sequence, String message, Double fraction) {
        return new ToolProgress(callId, toolName, sequence, message, fraction, System.currentTimeMillis());
    }
}
