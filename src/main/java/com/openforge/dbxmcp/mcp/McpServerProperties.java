package com.openforge.dbxmcp.mcp;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * MCP server identity and transport switch (prefix {@code mcp.server}).
 *
 * @param stdioEnabled false keeps the context up without attaching to stdin/stdout (tests)
 */
@ConfigurationProperties(prefix = "mcp.server")
public record McpServerProperties(
        @DefaultValue("databricks-mcp") String  name,
        @DefaultValue("0.1.0")          String  version,
        @DefaultValue("true")           boolean stdioEnabled
) {}
