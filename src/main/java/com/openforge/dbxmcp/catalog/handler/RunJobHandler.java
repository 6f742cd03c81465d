package com.openforge.dbxmcp.catalog.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.dbxmcp.catalog.EndpointToolHandler;
import com.openforge.dbxmcp.catalog.OperationHandler;
import com.openforge.dbxmcp.client.Sleeper;
import com.openforge.dbxmcp.dispatch.ToolProperties;
import com.openforge.dbxmcp.normalize.FieldSpec;
import com.openforge.dbxmcp.normalize.JsonType;
import com.openforge.dbxmcp.normalize.ResponseNormalizer;
import com.openforge.dbxmcp.normalize.ResponseShape;
import com.openforge.dbxmcp.tool.ToolContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * run_job: triggers run-now and, with {@code wait_for_completion}, follows the run until
 * its life cycle ends, reporting each observed state as progress.
 *
 *   run-now ──► run_id
 *     └─ loop: runs/get → PENDING | QUEUED | RUNNING | ...  → progress, sleep poll-interval
 *              runs/get → TERMINATED | SKIPPED | INTERNAL_ERROR → result
 *
 * A failed job is still a successful tool call: the result carries result_state.
 */
@Slf4j
@Component("runJobHandler")
public class RunJobHandler implements OperationHandler {

    static final String RUNS_GET = "/api/2.1/jobs/runs/get";

    private static final Set<String> TERMINAL = Set.of("TERMINATED", "SKIPPED", "INTERNAL_ERROR");

    private static final ResponseShape RUN_NOW_SHAPE = ResponseShape.of(
            FieldSpec.required("run_id", JsonType.INTEGER));

    private static final ResponseShape RUN_SHAPE = ResponseShape.of(
            FieldSpec.required("state", JsonType.OBJECT).withShape(ResponseShape.of(
                    FieldSpec.required("life_cycle_state", JsonType.STRING),
                    FieldSpec.optional("result_state", JsonType.STRING, null),
                    FieldSpec.optional("state_message", JsonType.STRING, null))));

    private final ResponseNormalizer normalizer;
    private final ToolProperties     properties;
    private final Sleeper            sleeper;

    public RunJobHandler(ResponseNormalizer normalizer, ToolProperties properties, Sleeper sleeper) {
        this.normalizer = normalizer;
        this.properties = properties;
        this.sleeper    = sleeper;
    }

    @Override
    public JsonNode handle(EndpointToolHandler endpoint, Map<String, Object> arguments, ToolContext context) {
        JsonNode started = normalizer.normalize(endpoint.handle(arguments, context), RUN_NOW_SHAPE);
        long runId = started.get("run_id").asLong();
        log.info("[RunJob:{}] Job {} started run {}", context.callId(), arguments.get("job_id"), runId);

        if (!Boolean.TRUE.equals(arguments.get("wait_for_completion"))) {
            return started;
        }

        context.progress().report("run %d: submitted".formatted(runId), null);
        String lastState = null;
        while (true) {
            JsonNode run   = normalizer.normalize(context.client().get(RUNS_GET, Map.of("run_id", runId)), RUN_SHAPE);
            JsonNode state = run.get("state");
            String lifeCycle = state.get("life_cycle_state").asText();

            if (TERMINAL.contains(lifeCycle)) {
                String resultState = state.path("result_state").asText(null);
                log.info("[RunJob:{}] Run {} finished: {} {}", context.callId(), runId, lifeCycle, resultState);
                context.progress().report("run %d: %s%s".formatted(runId, lifeCycle,
                        resultState == null ? "" : " (" + resultState + ")"), 1.0);
                return summarize((ObjectNode) started.deepCopy(), run, lifeCycle, resultState);
            }
            if (!lifeCycle.equals(lastState)) {
                context.progress().report("run %d: %s".formatted(runId, lifeCycle), null);
                lastState = lifeCycle;
            }
            Polling.pause(sleeper, properties.pollInterval(), "run " + runId);
        }
    }

    private static JsonNode summarize(ObjectNode result, JsonNode run, String lifeCycle, String resultState) {
        result.put("life_cycle_state", lifeCycle);
        if (resultState != null) {
            result.put("result_state", resultState);
        }
        JsonNode message = run.path("state").path("state_message");
        if (message.isTextual()) {
            result.put("state_message", message.asText());
        }
        if (run.hasNonNull("run_page_url")) {
            result.set("run_page_url", run.get("run_page_url"));
        }
        result.set("run", run);
        return result;
    }
}
