package com.openforge.dbxmcp.catalog;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.openforge.dbxmcp.normalize.ResponseNormalizer;
import com.openforge.dbxmcp.tool.ToolDescriptor;
import com.openforge.dbxmcp.tool.ToolRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolCatalogConfigTest {

    private static final OperationHandler STUB =
            (endpoint, arguments, context) -> JsonNodeFactory.instance.objectNode();

    private final List<ApiOperation> operations =
            new CatalogLoader(new DefaultResourceLoader()).load("classpath:catalog/operations.yml");

    private final Map<String, OperationHandler> handlers = Map.of(
            "createClusterHandler", STUB,
            "runJobHandler", STUB,
            "executeSqlHandler", STUB);

    @Test
    void everyOperationBecomesAFrozenTool() {
        ToolRegistry registry = ToolCatalogConfig.buildRegistry(operations, new ResponseNormalizer(), handlers);

        assertThat(registry.size()).isEqualTo(operations.size());
        assertThat(registry.isFrozen()).isTrue();

        ToolDescriptor runJob = registry.lookup("run_job");
        assertThat(runJob.longRunning()).isTrue();
        assertThat(runJob.requiredParameters()).containsExactly("job_id");
        assertThat(runJob.parameters().get("wait_for_completion").defaultValue()).isEqualTo(false);
        assertThat(runJob.description()).startsWith("POST /api/2.1/jobs/run-now");
        assertThat(registry.lookup("list_clusters").returns()).isEqualTo("JSON object returned by GET /api/2.0/clusters/list");
    }

    @Test
    void unknownHandlerNameFailsStartup() {
        ApiOperation op = new ApiOperation("run_job", "POST", "/api/2.1/jobs/run-now", "run", null,
                List.of(), null, "jobRunner", true, "job", null);

        assertThatThrownBy(() -> ToolCatalogConfig.buildRegistry(List.of(op), new ResponseNormalizer(), handlers))
                .isInstanceOf(CatalogException.class)
                .hasMessageContaining("jobRunner");
    }
}
