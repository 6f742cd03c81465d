package com.openforge.dbxmcp.catalog.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.dbxmcp.catalog.EndpointToolHandler;
import com.openforge.dbxmcp.catalog.OperationHandler;
import com.openforge.dbxmcp.dispatch.ValidationException;
import com.openforge.dbxmcp.tool.ToolContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/** create_cluster: a cluster needs a fixed size or an autoscale range. */
@Slf4j
@Component("createClusterHandler")
public class CreateClusterHandler implements OperationHandler {

    @Override
    public JsonNode handle(EndpointToolHandler endpoint, Map<String, Object> arguments, ToolContext context) {
        if (arguments.get("num_workers") == null && arguments.get("autoscale") == null) {
            throw new ValidationException(context.toolName(),
                    "one of 'num_workers' or 'autoscale' is required");
        }
        log.info("[CreateCluster:{}] Creating cluster '{}' ({})",
                context.callId(), arguments.get("cluster_name"), arguments.get("spark_version"));
        return endpoint.handle(arguments, context);
    }
}
