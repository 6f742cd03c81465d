package com.openforge.dbxmcp.config;

import com.openforge.dbxmcp.client.DatabricksProperties;
import com.openforge.dbxmcp.dispatch.ToolProperties;
import com.openforge.dbxmcp.mcp.McpServerProperties;
import com.openforge.dbxmcp.tool.ToolDescriptor;
import com.openforge.dbxmcp.tool.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Goes to the log (stderr and file), never to stdout: stdout carries the MCP protocol.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DatabricksProperties databricksProperties;
    private final ToolProperties       toolProperties;
    private final McpServerProperties  serverProperties;
    private final ToolRegistry         registry;

    @Override
    public void run(ApplicationArguments args) {
        DatabricksProperties.ClientConfig client = databricksProperties.client();
        long longRunning = registry.stream().filter(ToolDescriptor::longRunning).count();

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║            Databricks MCP  :  Startup Summary            ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    Name / Version : {} {}
                ║    Transport      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Workspace                                               ║
                ║    Host           : {}
                ║    Token          : {}
                ║    Retries        : {}  backoff {} ms ×{} (max {} ms)
                ║    Call timeout   : {} s
                ╠══════════════════════════════════════════════════════════╣
                ║  Tools                                                   ║
                ║    Registered     : {}  ({} long-running)
                ║    Timeouts       : {} s / {} s long-running
                ║    Catalog        : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                serverProperties.name(), serverProperties.version(),
                serverProperties.stdioEnabled() ? "✔ stdio" : "✘ disabled",
                System.getProperty("java.version"),

                databricksProperties.baseUrl(),
                maskKey(databricksProperties.token()),
                client.maxRetries(), client.initialBackoff().toMillis(), client.backoffMultiplier(),
                client.maxBackoff().toMillis(),
                client.callTimeout().toSeconds(),

                registry.size(), longRunning,
                toolProperties.defaultTimeout().toSeconds(), toolProperties.longRunningTimeout().toSeconds(),
                toolProperties.catalogLocation()
        );
    }

    /**
     * Masks a token: shows first 4 chars + "..." + last 4 chars.
     * Returns "(not set)" for blank values.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank()) {
            return "(not set)";
        }
        if (key.length() <= 12) return "***";
        return key.substring(0, 4) + "..." + key.substring(key.length() - 4);
    }
}
