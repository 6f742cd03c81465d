package com.openforge.dbxmcp.catalog;

import com.openforge.dbxmcp.normalize.ResponseShape;
import org.springframework.http.HttpMethod;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One Databricks REST operation exposed as a tool, as declared in operations.yml:
 *
 * <pre>
 * - name: get_cluster
 *   method: GET
 *   path: /api/2.0/clusters/get
 *   summary: Get information about a specific cluster.
 *   resource: cluster
 *   parameters:
 *     - { name: cluster_id, type: string, required: true, description: ID of the cluster }
 *   response:
 *     - { name: cluster_id, type: string, required: true }
 * </pre>
 *
 * @param handler     bean name of an {@link OperationHandler} wrapping the plain call; null = plain call
 * @param longRunning selects the long timeout class
 * @param resource    noun used in "not found" messages, e.g. "cluster"
 * @param decodeField response field holding base64 data; a decoded copy is added as "decoded_&lt;field&gt;"
 */
public record ApiOperation(
        String              name,
        String              method,
        String              path,
        String              summary,
        String              returns,
        List<ApiParameter>  parameters,
        List<ResponseField> response,
        String              handler,
        boolean             longRunning,
        String              resource,
        String              decodeField
) {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}/]+)}");

    public ApiOperation {
        method     = method == null ? null : method.strip().toUpperCase(Locale.ROOT);
        summary    = summary == null ? "" : summary.strip();
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        response   = response == null ? List.of() : List.copyOf(response);
        handler    = handler == null || handler.isBlank() ? null : handler.strip();
    }

    public HttpMethod httpMethod() {
        return HttpMethod.valueOf(method);
    }

    public ResponseShape responseShape() {
        return response.isEmpty() ? ResponseShape.ANY : ResponseField.toShape(response);
    }

    /** Names of the {@code {placeholders}} in the path, in order of appearance. */
    public Set<String> pathPlaceholders() {
        Set<String> names = new LinkedHashSet<>();
        Matcher m = PLACEHOLDER.matcher(path == null ? "" : path);
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }

    /**
     * Effective placement of a parameter: the declared one, else PATH for names that
     * appear as placeholders, else QUERY for GET/DELETE and BODY otherwise.
     */
    public ParamLocation locationOf(ApiParameter parameter) {
        if (parameter.in() != null) {
            return parameter.in();
        }
        if (pathPlaceholders().contains(parameter.name())) {
            return ParamLocation.PATH;
        }
        return "GET".equals(method) || "DELETE".equals(method) ? ParamLocation.QUERY : ParamLocation.BODY;
    }

    /**
     * Tool description in the form
     * <pre>
     * POST /api/2.0/clusters/start
     * Start a terminated cluster.
     * Parameters:
     * - cluster_id (required): ID of the cluster to start
     * </pre>
     */
    public String description() {
        StringBuilder sb = new StringBuilder()
                .append(method).append(' ').append(path).append('\n')
                .append(summary);
        if (!parameters.isEmpty()) {
            sb.append("\nParameters:");
            for (ApiParameter p : parameters) {
                sb.append("\n- ").append(p.name())
                  .append(p.required() ? " (required)" : " (optional)");
                if (p.description() != null && !p.description().isBlank()) {
                    sb.append(": ").append(p.description().strip());
                }
            }
        }
        return sb.toString();
    }

    public String returnsOrDefault() {
        return returns == null || returns.isBlank()
                ? "JSON object returned by %s %s".formatted(method, path)
                : returns.strip();
    }
}
