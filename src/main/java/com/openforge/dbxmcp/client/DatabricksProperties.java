package com.openforge.dbxmcp.client;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Externalised Databricks workspace configuration.
 *
 * Reads from application.yml under the "databricks" prefix:
 *
 * databricks:
 *   host: https://adb-1234567890.12.azuredatabricks.net
 *   token: dapi...
 *   client:
 *     connect-timeout: 10s
 *     call-timeout: 60s
 *     max-retries: 3
 *     initial-backoff: 1s
 *     backoff-multiplier: 2.0
 *     max-backoff: 30s
 *
 * Loaded once at startup; read-only afterwards.
 */
@Validated
@ConfigurationProperties(prefix = "databricks")
public record DatabricksProperties(
        @NotBlank String host,
        @NotBlank String token,
        @DefaultValue ClientConfig client
) {

    /**
     * @param callTimeout budget for one remote call, measured from the first attempt and
     *                    inclusive of every retry and backoff wait
     * @param maxRetries  retries after the first attempt; total attempts = maxRetries + 1
     */
    public record ClientConfig(
            @DefaultValue("10s")  Duration connectTimeout,
            @DefaultValue("60s")  Duration callTimeout,
            @DefaultValue("3")    int      maxRetries,
            @DefaultValue("1s")   Duration initialBackoff,
            @DefaultValue("2.0")  double   backoffMultiplier,
            @DefaultValue("30s")  Duration maxBackoff
    ) {}

    /** Host with scheme, without trailing slash, e.g. "https://adb-123.azuredatabricks.net". */
    public String baseUrl() {
        String h = host.strip();
        if (!h.startsWith("http://") && !h.startsWith("https://")) {
            h = "https://" + h;
        }
        while (h.endsWith("/")) {
            h = h.substring(0, h.length() - 1);
        }
        return h;
    }
}
