package com.openforge.dbxmcp.tool;

import lombok.Builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable registry entry for one tool.
 *
 * The parameter map keeps declaration order; it drives both argument validation and the
 * JSON Schema published to MCP clients.
 *
 * @param longRunning selects the long timeout class (job runs, SQL statements)
 */
@Builder
public record ToolDescriptor(
        String                     name,
        String                     description,
        Map<String, ParameterSpec> parameters,
        ToolHandler                handler,
        String                     returns,
        boolean                    longRunning
) {

    public ToolDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler for tool " + name);
        description = description == null ? "" : description;
        returns     = returns == null ? "" : returns;
        parameters  = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public List<String> requiredParameters() {
        return parameters.values().stream()
                .filter(ParameterSpec::required)
                .map(ParameterSpec::name)
                .toList();
    }

    /** The "list tools" view: name, description, JSON object-schema, returns. */
    public ToolMetadata metadata() {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (ParameterSpec p : parameters.values()) {
            Map<String, Object> prop = new LinkedHashMap<>();
            prop.put("type", p.type().jsonName());
            if (p.description() != null && !p.description().isBlank()) {
                prop.put("description", p.description());
            }
            if (p.defaultValue() != null) {
                prop.put("default", p.defaultValue());
            }
            properties.put(p.name(), prop);
        }

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", new ArrayList<>(requiredParameters()));
        schema.put("additionalProperties", false);

        return new ToolMetadata(name, description, Collections.unmodifiableMap(schema), returns);
    }
}
