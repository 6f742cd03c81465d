package com.openforge.dbxmcp.tool;

import java.util.Map;

/**
 * Published description of a tool, answered to "list tools".
 *
 * Wire format:
 * {
 *   "name": "get_cluster",
 *   "description": "GET /api/2.0/clusters/get\n...",
 *   "parameters": { "type": "object", "properties": { ... }, "required": [ ... ] },
 *   "returns": "Cluster details"
 * }
 */
public record ToolMetadata(
        String              name,
        String              description,
        Map<String, Object> parameters,
        String              returns
) {}
