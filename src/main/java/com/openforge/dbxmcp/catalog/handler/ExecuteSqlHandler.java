package com.openforge.dbxmcp.catalog.handler;

import com.fasterxml.jackson.databind.JsonNode;
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
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;

/**
 * execute_sql: submits a statement to a SQL warehouse and polls it while the warehouse
 * reports PENDING or RUNNING. SUCCEEDED returns the statement (manifest and first result
 * chunk); FAILED and CANCELED end the call with the warehouse's error message.
 */
@Slf4j
@Component("executeSqlHandler")
public class ExecuteSqlHandler implements OperationHandler {

    static final String STATEMENTS = "/api/2.0/sql/statements/";

    private static final Set<String> IN_PROGRESS = Set.of("PENDING", "RUNNING");
    private static final Set<String> FAILED      = Set.of("FAILED", "CANCELED");

    private static final ResponseShape STATEMENT_SHAPE = ResponseShape.of(
            FieldSpec.required("statement_id", JsonType.STRING),
            FieldSpec.required("status", JsonType.OBJECT).withShape(ResponseShape.of(
                    FieldSpec.required("state", JsonType.STRING))));

    private final ResponseNormalizer normalizer;
    private final ToolProperties     properties;
    private final Sleeper            sleeper;

    public ExecuteSqlHandler(ResponseNormalizer normalizer, ToolProperties properties, Sleeper sleeper) {
        this.normalizer = normalizer;
        this.properties = properties;
        this.sleeper    = sleeper;
    }

    @Override
    public JsonNode handle(EndpointToolHandler endpoint, Map<String, Object> arguments, ToolContext context) {
        JsonNode statement = normalizer.normalize(endpoint.handle(arguments, context), STATEMENT_SHAPE);
        String statementId = statement.get("statement_id").asText();
        log.info("[ExecuteSql:{}] Statement {} submitted to warehouse {}",
                context.callId(), statementId, arguments.get("warehouse_id"));

        String lastState = null;
        while (true) {
            String state = statement.get("status").get("state").asText();
            if (FAILED.contains(state)) {
                String detail = statement.path("status").path("error").path("message").asText(null);
                throw new StatementFailedException(statementId, state, detail);
            }
            if (!IN_PROGRESS.contains(state)) {
                log.info("[ExecuteSql:{}] Statement {} finished: {}", context.callId(), statementId, state);
                return statement;
            }
            if (!state.equals(lastState)) {
                context.progress().report("statement %s: %s".formatted(statementId, state), null);
                lastState = state;
            }
            Polling.pause(sleeper, properties.pollInterval(), "statement " + statementId);
            String path = STATEMENTS + UriUtils.encodePathSegment(statementId, StandardCharsets.UTF_8);
            statement = normalizer.normalize(context.client().get(path, Map.of()), STATEMENT_SHAPE);
        }
    }
}
