package com.openforge.dbxmcp.tool;

import com.openforge.dbxmcp.client.DatabricksApiClient;

/**
 * What a handler gets besides its arguments.
 *
 * @param callId   correlation id of this invocation, for logging
 * @param client   the shared remote client
 * @param progress sink for intermediate progress of long-running tools
 */
public record ToolContext(
        String              callId,
        String              toolName,
        DatabricksApiClient client,
        ProgressReporter    progress
) {}
