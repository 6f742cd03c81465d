package com.openforge.dbxmcp.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openforge.dbxmcp.client.CredentialProvider;
import com.openforge.dbxmcp.client.DatabricksProperties;
import com.openforge.dbxmcp.client.RateLimitState;
import com.openforge.dbxmcp.client.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * Core infrastructure beans:
 *  - HttpClient        → the only HTTP engine, shared by every tool call
 *  - ObjectMapper      → snake_case JSON as the Databricks REST API speaks it
 *  - tool executors    → one worker thread per in-flight call, one timer thread for deadlines
 *  - clock / sleeper   → replaceable in tests so retry schedules run instantly
 */
@Configuration
public class AppConfig {

    /**
     * Single, shared HttpClient instance.
     * Connect timeout from {@code databricks.client.connect-timeout}; per-request
     * timeouts are set from the remaining call budget at the call site.
     */
    @Bean
    public HttpClient httpClient(DatabricksProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.client().connectTimeout())
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Shared ObjectMapper for the Databricks wire format:
     *  - snake_case property names (cluster_id, spark_version …)
     *  - ISO-8601 dates, not timestamps
     *  - unknown properties ignored (the API adds fields without notice)
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public RateLimitState rateLimitState(Clock clock) {
        return new RateLimitState(clock);
    }

    /** The token is read once from configuration and never logged. */
    @Bean
    public CredentialProvider credentialProvider(DatabricksProperties properties) {
        return properties::token;
    }

    /**
     * Workers for tool handlers. Unbounded: each in-flight call owns one thread for
     * its lifetime, and calls are expected to be few and mostly waiting on I/O.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService toolCallExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("tool-call-"));
    }

    /** Fires per-call timeouts. Cancelled timers are removed immediately. */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService toolTimeoutScheduler() {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, daemonThreads("tool-timeout-"));
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    private static CustomizableThreadFactory daemonThreads(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }
}
