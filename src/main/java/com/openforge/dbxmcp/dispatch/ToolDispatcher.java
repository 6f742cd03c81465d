package com.openforge.dbxmcp.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.openforge.dbxmcp.client.DatabricksApiClient;
import com.openforge.dbxmcp.tool.ToolContext;
import com.openforge.dbxmcp.tool.ToolDescriptor;
import com.openforge.dbxmcp.tool.ToolRegistry;
import com.openforge.dbxmcp.tool.UnknownToolException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Routes tool calls to their handlers and guarantees each call one terminal result.
 *
 * Flow of a call:
 *
 *   lookup(name)        unknown          → error result, no remote traffic
 *   validate(arguments) bad / missing    → error result, no remote traffic
 *   handler on worker   returns          → success result
 *                       throws           → error result (redacted message)
 *   timeout timer       fires first      → error result, worker interrupted
 *   cancel()            called first     → error result, worker interrupted
 *
 * Calls are independent of each other; concurrency is bounded only by the worker pool.
 */
@Slf4j
@Service
public class ToolDispatcher {

    private final ToolRegistry             registry;
    private final ArgumentValidator        validator;
    private final DatabricksApiClient      client;
    private final ToolProperties           properties;
    private final ErrorMessages            errorMessages;
    private final ExecutorService          workers;
    private final ScheduledExecutorService timeouts;

    public ToolDispatcher(ToolRegistry registry,
                          ArgumentValidator validator,
                          DatabricksApiClient client,
                          ToolProperties properties,
                          ErrorMessages errorMessages,
                          @Qualifier("toolCallExecutor") ExecutorService workers,
                          @Qualifier("toolTimeoutScheduler") ScheduledExecutorService timeouts) {
        this.registry      = registry;
        this.validator     = validator;
        this.client        = client;
        this.properties    = properties;
        this.errorMessages = errorMessages;
        this.workers       = workers;
        this.timeouts      = timeouts;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /** Runs a call to completion on the caller's behalf and returns its result. */
    public ToolResult dispatch(ToolCallRequest request) {
        return submit(request, ProgressListener.NONE).await();
    }

    public ToolResult dispatch(ToolCallRequest request, ProgressListener listener) {
        return submit(request, listener).await();
    }

    /**
     * Starts a call and returns immediately.
     *
     * Unknown tools and invalid arguments resolve synchronously: the returned handle is
     * already done and the handler was never invoked.
     */
    public PendingToolCall submit(ToolCallRequest request, ProgressListener listener) {
        ToolDescriptor descriptor;
        Map<String, Object> arguments;
        try {
            descriptor = registry.lookup(request.toolName());
            arguments  = validator.validate(descriptor, request.arguments());
        } catch (UnknownToolException | ValidationException e) {
            log.warn("[Dispatcher] {} rejected: {}", request.callId(), e.getMessage());
            return PendingToolCall.resolved(request, ToolResult.error(errorMessages.describe(request.toolName(), e)));
        }

        PendingToolCall call = new PendingToolCall(request, descriptor.name(), listener);
        ToolContext context = new ToolContext(request.callId(), descriptor.name(), client, call::progress);
        Duration timeout = properties.timeoutFor(descriptor.longRunning());

        log.info("[Dispatcher] {} → {} (timeout {} s)", request.callId(), descriptor.name(), timeout.toSeconds());
        try {
            Future<?> task = workers.submit(() -> execute(descriptor, arguments, context, call));
            call.attachTask(task);
            ScheduledFuture<?> timer = timeouts.schedule(
                    () -> expire(call, timeout), timeout.toMillis(), TimeUnit.MILLISECONDS);
            call.attachTimer(timer);
        } catch (RejectedExecutionException e) {
            log.error("[Dispatcher] {} could not be scheduled: {}", request.callId(), e.getMessage());
            call.settle(ToolResult.error("tool %s could not be started: server is shutting down"
                    .formatted(descriptor.name())), true);
        }
        return call;
    }

    // ── Internals ────────────────────────────────────────────────────────────

    private void execute(ToolDescriptor descriptor, Map<String, Object> arguments,
                         ToolContext context, PendingToolCall call) {
        long started = System.nanoTime();
        ToolResult outcome;
        Error fatal = null;
        try {
            JsonNode content = descriptor.handler().handle(arguments, context);
            outcome = ToolResult.success(content == null ? NullNode.getInstance() : content);
        } catch (RuntimeException e) {
            if (log.isDebugEnabled()) {
                log.debug("[Dispatcher] {} handler {} threw", context.callId(), descriptor.name(), e);
            }
            outcome = ToolResult.error(errorMessages.describe(descriptor.name(), e));
        } catch (Error e) {
            log.error("[Dispatcher] {} handler {} raised {}", context.callId(), descriptor.name(),
                    e.getClass().getName(), e);
            outcome = ToolResult.error(errorMessages.describe(descriptor.name(), e));
            // an unwound stack overflow leaves the worker usable; other VM errors do not
            if (e instanceof VirtualMachineError && !(e instanceof StackOverflowError)) {
                fatal = e;
            }
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        if (call.settle(outcome, false)) {
            if (outcome.isError()) {
                log.warn("[Dispatcher] {} ✗ {} in {} ms: {}",
                        context.callId(), descriptor.name(), elapsedMs, outcome.errorMessage());
            } else {
                log.info("[Dispatcher] {} ✓ {} in {} ms", context.callId(), descriptor.name(), elapsedMs);
            }
        } else {
            log.debug("[Dispatcher] {} late result of {} discarded after {} ms",
                    context.callId(), descriptor.name(), elapsedMs);
        }
        if (fatal != null) {
            throw fatal;
        }
    }

    private void expire(PendingToolCall call, Duration timeout) {
        String message = errorMessages.timedOut(call.toolName(), timeout.toMillis());
        if (call.settle(ToolResult.error(message), true)) {
            log.warn("[Dispatcher] {} {}", call.callId(), message);
        }
    }
}
