package com.openforge.dbxmcp.config;

import com.openforge.dbxmcp.client.DatabricksProperties;
import io.github.resilience4j.core.IntervalFunction;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Programmatic Resilience4j wiring.
 *
 * The remote client runs its own attempt loop (it needs per-call deadlines, Retry-After
 * hints and interrupt handling), so only the backoff schedule is taken from Resilience4j:
 *
 *   wait after attempt n = min(initial × multiplier^(n-1), max)
 *
 * With the defaults that is 1 s → 2 s → 4 s, capped at 30 s.
 */
@Configuration
public class Resilience4jConfig {

    @Bean
    public IntervalFunction remoteBackoff(DatabricksProperties properties) {
        DatabricksProperties.ClientConfig client = properties.client();
        return IntervalFunction.ofExponentialBackoff(
                client.initialBackoff().toMillis(),
                client.backoffMultiplier(),
                client.maxBackoff().toMillis());
    }
}
