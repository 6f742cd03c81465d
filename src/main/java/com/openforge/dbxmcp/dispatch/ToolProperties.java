package com.openforge.dbxmcp.dispatch;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Dispatcher and tool-catalog settings (prefix {@code mcp.tools}).
 *
 * <pre>
 * mcp:
 *   tools:
 *     default-timeout: 120s       # ordinary tools
 *     long-running-timeout: 15m   # job runs, SQL statements
 *     poll-interval: 5s           # status polling of long-running tools
 *     catalog-location: classpath:catalog/operations.yml
 * </pre>
 */
@ConfigurationProperties(prefix = "mcp.tools")
public record ToolProperties(
        @DefaultValue("120s")                               Duration defaultTimeout,
        @DefaultValue("15m")                                Duration longRunningTimeout,
        @DefaultValue("5s")                                 Duration pollInterval,
        @DefaultValue("classpath:catalog/operations.yml")   String   catalogLocation
) {

    public Duration timeoutFor(boolean longRunning) {
        return longRunning ? longRunningTimeout : defaultTimeout;
    }
}
