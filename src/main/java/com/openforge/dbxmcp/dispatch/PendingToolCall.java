package com.openforge.dbxmcp.dispatch;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;

/**
 * Handle of one in-flight tool call.
 *
 * Settles exactly once: whichever of completion, timeout or cancellation gets there
 * first wins, the others become no-ops. A progress event reserves its sequence number
 * under the lock and is handed to the listener outside it, so a stalled listener never
 * holds up a timeout or cancellation. The settled outcome is published only once every
 * reserved event has been delivered, so no progress event can follow the result.
 */
@Slf4j
public final class PendingToolCall {

    private final ToolCallRequest                request;
    private final String                         toolName;
    private final ProgressListener               listener;
    private final CompletableFuture<ToolResult>  result = new CompletableFuture<>();
    private final Object                         lock   = new Object();

    // guarded by lock
    private boolean            settled;
    private int                progressSequence;
    private int                emitting;
    private ToolResult         pendingOutcome;
    private Future<?>          task;
    private ScheduledFuture<?> timer;

    PendingToolCall(ToolCallRequest request, String toolName, ProgressListener listener) {
        this.request  = request;
        this.toolName = toolName;
        this.listener = listener == null ? ProgressListener.NONE : listener;
    }

    /** A call that was resolved before any work started (unknown tool, bad arguments). */
    static PendingToolCall resolved(ToolCallRequest request, ToolResult outcome) {
        PendingToolCall call = new PendingToolCall(request, request.toolName(), ProgressListener.NONE);
        call.settle(outcome, false);
        return call;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public String callId() {
        return request.callId();
    }

    public String toolName() {
        return toolName;
    }

    public boolean isDone() {
        return result.isDone();
    }

    /**
     * Cancels the call: the worker is interrupted, which aborts any remote wait or retry,
     * and the call settles with a "cancelled" error.
     *
     * @return false when the call had already settled
     */
    public boolean cancel() {
        return settle(ToolResult.error("tool %s was cancelled".formatted(toolName)), true);
    }

    /**
     * Blocks until the call settles. Interrupting the waiting thread cancels the call.
     */
    public ToolResult await() {
        try {
            return result.get();
        } catch (InterruptedException e) {
            cancel();
            Thread.currentThread().interrupt();
            return result.getNow(ToolResult.error("tool %s was cancelled".formatted(toolName)));
        } catch (ExecutionException e) {
            // result is only ever completed normally
            throw new IllegalStateException("tool call future failed", e.getCause());
        }
    }

    /** Read-only view of the outcome; completing or cancelling it does not affect the call. */
    public CompletableFuture<ToolResult> toCompletableFuture() {
        return result.copy();
    }

    // ── Dispatcher side ──────────────────────────────────────────────────────

    void attachTask(Future<?> task) {
        boolean lateCancel;
        synchronized (lock) {
            this.task  = task;
            lateCancel = settled;
        }
        if (lateCancel) task.cancel(true);
    }

    void attachTimer(ScheduledFuture<?> timer) {
        boolean lateCancel;
        synchronized (lock) {
            this.timer = timer;
            lateCancel = settled;
        }
        if (lateCancel) timer.cancel(false);
    }

    void progress(String message, Double fraction) {
        ToolProgress event;
        synchronized (lock) {
            if (settled) {
                log.debug("[ToolCall] {} dropped progress after result: {}", request.callId(), message);
                return;
            }
            event = ToolProgress.of(request.callId(), toolName, ++progressSequence, message, fraction);
            emitting++;
        }
        try {
            listener.onProgress(event);
        } catch (RuntimeException e) {
            log.warn("[ToolCall] {} progress listener failed: {}", request.callId(), e.getMessage());
        } finally {
            emissionDone();
        }
    }

    private void emissionDone() {
        ToolResult deferred = null;
        synchronized (lock) {
            emitting--;
            if (emitting == 0 && settled) {
                deferred = pendingOutcome;
                pendingOutcome = null;
            }
        }
        if (deferred != null) result.complete(deferred);
    }

    /**
     * @param interruptWorker true for timeout and cancellation, false for normal completion
     * @return true if this call settled the outcome
     */
    boolean settle(ToolResult outcome, boolean interruptWorker) {
        Future<?>          runningTask;
        ScheduledFuture<?> pendingTimer;
        boolean            deliverNow;
        synchronized (lock) {
            if (settled) return false;
            settled      = true;
            runningTask  = task;
            pendingTimer = timer;
            deliverNow   = emitting == 0;
            if (!deliverNow) pendingOutcome = outcome;
        }
        if (pendingTimer != null) pendingTimer.cancel(false);
        if (interruptWorker && runningTask != null) runningTask.cancel(true);
        // otherwise the last in-flight progress delivery publishes it
        if (deliverNow) result.complete(outcome);
        return true;
    }
}
