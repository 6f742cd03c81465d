package com.openforge.dbxmcp.catalog;

import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.DefaultResourceLoader;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogLoaderTest {

    private final CatalogLoader loader = new CatalogLoader(new DefaultResourceLoader());

    private static ByteArrayResource yaml(String text) {
        return new ByteArrayResource(text.getBytes(StandardCharsets.UTF_8), "test catalog");
    }

    @Test
    void bundledCatalogLoadsAndIsConsistent() {
        List<ApiOperation> operations = loader.load("classpath:catalog/operations.yml");

        assertThat(operations).hasSize(151);
        assertThat(loader.validate(operations)).isEmpty();

        Map<String, ApiOperation> byName = operations.stream()
                .collect(Collectors.toMap(ApiOperation::name, Function.identity()));
        assertThat(byName).containsKeys("list_clusters", "get_cluster", "run_job", "execute_sql",
                "list_catalogs", "get_table", "read_dbfs_file", "list_secret_scopes");

        ApiOperation runJob = byName.get("run_job");
        assertThat(runJob.longRunning()).isTrue();
        assertThat(runJob.handler()).isEqualTo("runJobHandler");
        ApiParameter wait = runJob.parameters().stream()
                .filter(p -> p.name().equals("wait_for_completion")).findFirst().orElseThrow();
        assertThat(runJob.locationOf(wait)).isEqualTo(ParamLocation.LOCAL);

        ApiOperation getTable = byName.get("get_table");
        assertThat(getTable.locationOf(getTable.parameters().get(0))).isEqualTo(ParamLocation.PATH);

        assertThat(byName.get("read_dbfs_file").decodeField()).isEqualTo("data");
        assertThat(byName.get("list_clusters").longRunning()).isFalse();
    }

    @Test
    void bundledCatalogCoversSqlObjectsComputeAndGovernance() {
        Map<String, ApiOperation> byName = loader.load("classpath:catalog/operations.yml").stream()
                .collect(Collectors.toMap(ApiOperation::name, Function.identity()));

        assertThat(byName).containsKeys(
                "list_queries", "create_alert", "get_dashboard", "create_visualization",
                "list_lakeview_dashboards", "publish_lakeview_dashboard", "list_budgets",
                "create_execution_context", "execute_command", "get_command_status",
                "list_connections", "list_metastores", "assign_metastore",
                "list_instance_pools", "create_instance_pool", "list_cluster_policies", "get_cluster_policy");

        ApiOperation status = byName.get("get_command_status");
        assertThat(status.parameters()).extracting(ApiParameter::name)
                .containsExactly("clusterId", "contextId", "commandId");
        assertThat(status.parameters()).allSatisfy(p -> assertThat(status.locationOf(p)).isEqualTo(ParamLocation.QUERY));

        ApiOperation assign = byName.get("assign_metastore");
        assertThat(assign.method()).isEqualTo("PUT");
        assertThat(assign.pathPlaceholders()).containsExactly("workspace_id");
        assertThat(assign.locationOf(assign.parameters().get(1))).isEqualTo(ParamLocation.BODY);

        ApiOperation updateQuery = byName.get("update_query");
        assertThat(updateQuery.method()).isEqualTo("PATCH");
        assertThat(updateQuery.resource()).isEqualTo("query");
    }

    @Test
    void descriptionListsEndpointAndParameters() {
        ApiOperation getCluster = loader.load("classpath:catalog/operations.yml").stream()
                .filter(op -> op.name().equals("get_cluster")).findFirst().orElseThrow();

        assertThat(getCluster.description()).isEqualTo("""
                GET /api/2.0/clusters/get
                Get information about a specific cluster.
                Parameters:
                - cluster_id (required): ID of the cluster""");
    }

    @Test
    void missingCatalogIsReported() {
        assertThatThrownBy(() -> loader.load("classpath:catalog/nope.yml"))
                .isInstanceOf(CatalogException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void everyProblemIsReportedAtOnce() {
        ByteArrayResource broken = yaml("""
                operations:
                  - name: get_repo
                    method: FETCH
                    path: /api/2.0/repos/{repo_id}
                    parameters:
                      - { name: id, type: integer, required: true }
                  - name: get_repo
                    method: GET
                    path: api/2.0/repos
                  - name: update_repo
                    method: PATCH
                    path: /api/2.0/repos/{repo_id}
                    parameters:
                      - { name: repo_id, type: integer }
                      - { name: branch, encoding: gzip }
                """);

        assertThatThrownBy(() -> loader.load(broken))
                .isInstanceOf(CatalogException.class)
                .hasMessageContaining("get_repo: unsupported method FETCH")
                .hasMessageContaining("get_repo: path placeholder {repo_id} has no path parameter")
                .hasMessageContaining("get_repo: duplicate operation name")
                .hasMessageContaining("get_repo: path must start with '/'")
                .hasMessageContaining("update_repo: path parameter repo_id must be required")
                .hasMessageContaining("update_repo: parameter branch has unsupported encoding gzip");
    }

    @Test
    void pathParameterMissingFromPathIsRejected() {
        ByteArrayResource broken = yaml("""
                operations:
                  - name: get_warehouse
                    method: GET
                    path: /api/2.0/sql/warehouses
                    parameters:
                      - { name: id, type: string, required: true, in: path }
                """);

        assertThatThrownBy(() -> loader.load(broken))
                .isInstanceOf(CatalogException.class)
                .hasMessageContaining("path parameter id does not appear in /api/2.0/sql/warehouses");
    }

    @Test
    void unknownKeysAreRejected() {
        ByteArrayResource typo = yaml("""
                operations:
                  - name: list_jobs
                    method: GET
                    path: /api/2.1/jobs/list
                    long_running: true
                """);

        assertThatThrownBy(() -> loader.load(typo))
                .isInstanceOf(CatalogException.class)
                .hasMessageContaining("failed to read");
    }

    @Test
    void locationsAreInferredFromMethodAndPath() {
        ApiParameter id   = new ApiParameter("id", null, true, null, null, null, null);
        ApiParameter size = new ApiParameter("size", null, false, null, null, null, null);

        ApiOperation get  = new ApiOperation("get_warehouse", "get", "/api/2.0/sql/warehouses/{id}",
                null, null, List.of(id, size), null, null, false, null, null);
        ApiOperation post = new ApiOperation("edit_warehouse", "POST", "/api/2.0/sql/warehouses/{id}/edit",
                null, null, List.of(id, size), null, null, false, null, null);

        assertThat(get.method()).isEqualTo("GET");
        assertThat(get.locationOf(id)).isEqualTo(ParamLocation.PATH);
        assertThat(get.locationOf(size)).isEqualTo(ParamLocation.QUERY);
        assertThat(post.locationOf(size)).isEqualTo(ParamLocation.BODY);
    }
}
