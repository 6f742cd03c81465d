package com.openforge.dbxmcp.catalog;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads operations.yml and rejects catalogs that would produce broken tools.
 *
 * Checks per operation:
 *   - name present and unique, method one of GET/POST/PUT/PATCH/DELETE, path starts with "/"
 *   - parameter names unique and typed
 *   - every {placeholder} in the path is a parameter placed in the path, and vice versa
 *   - path parameters are required
 *   - encoding, when given, is "base64"
 * All problems are reported at once.
 */
@Slf4j
@Component
public class CatalogLoader {

    private static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE");

    private final ResourceLoader resourceLoader;
    private final ObjectMapper   yaml;

    public CatalogLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
        this.yaml = new ObjectMapper(new YAMLFactory())
                .setPropertyNamingStrategy(PropertyNamingStrategies.KEBAB_CASE)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public List<ApiOperation> load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new CatalogException("operation catalog not found: " + location);
        }
        return load(resource);
    }

    public List<ApiOperation> load(Resource resource) {
        OperationCatalog catalog;
        try (InputStream in = resource.getInputStream()) {
            catalog = yaml.readValue(in, OperationCatalog.class);
        } catch (IOException e) {
            throw new CatalogException("failed to read operation catalog %s: %s"
                    .formatted(resource.getDescription(), e.getMessage()), e);
        }
        if (catalog == null) {
            throw new CatalogException("operation catalog %s is empty".formatted(resource.getDescription()));
        }

        List<String> problems = validate(catalog.operations());
        if (!problems.isEmpty()) {
            throw new CatalogException("invalid operation catalog %s:\n  %s"
                    .formatted(resource.getDescription(), String.join("\n  ", problems)));
        }
        log.info("[Catalog] Loaded {} operations from {}", catalog.operations().size(), resource.getDescription());
        return catalog.operations();
    }

    // ── Validation ───────────────────────────────────────────────────────────

    List<String> validate(List<ApiOperation> operations) {
        List<String> problems = new ArrayList<>();
        Set<String> names = new HashSet<>();

        for (int i = 0; i < operations.size(); i++) {
            ApiOperation op = operations.get(i);
            String where = op.name() == null || op.name().isBlank() ? "operations[%d]".formatted(i) : op.name();

            if (op.name() == null || op.name().isBlank()) {
                problems.add(where + ": missing name");
            } else if (!names.add(op.name())) {
                problems.add(where + ": duplicate operation name");
            }
            if (op.method() == null || !METHODS.contains(op.method())) {
                problems.add(where + ": unsupported method " + op.method());
            }
            if (op.path() == null || !op.path().startsWith("/")) {
                problems.add(where + ": path must start with '/'");
                continue;
            }

            Set<String> paramNames = new HashSet<>();
            Set<String> pathParams = new HashSet<>();
            for (ApiParameter p : op.parameters()) {
                if (p.name() == null || p.name().isBlank()) {
                    problems.add(where + ": parameter without name");
                    continue;
                }
                if (!paramNames.add(p.name())) {
                    problems.add(where + ": duplicate parameter " + p.name());
                }
                if (p.encoding() != null && !p.isBase64()) {
                    problems.add(where + ": parameter %s has unsupported encoding %s".formatted(p.name(), p.encoding()));
                }
                if (op.method() != null && op.locationOf(p) == ParamLocation.PATH) {
                    pathParams.add(p.name());
                    if (!p.required()) {
                        problems.add(where + ": path parameter %s must be required".formatted(p.name()));
                    }
                }
            }

            for (String placeholder : op.pathPlaceholders()) {
                if (!pathParams.contains(placeholder)) {
                    problems.add(where + ": path placeholder {%s} has no path parameter".formatted(placeholder));
                }
            }
            for (String pathParam : pathParams) {
                if (!op.pathPlaceholders().contains(pathParam)) {
                    problems.add(where + ": path parameter %s does not appear in %s".formatted(pathParam, op.path()));
                }
            }
        }
        return problems;
    }
}
