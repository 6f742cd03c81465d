package com.openforge.dbxmcp.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

/**
 * Checks a raw Databricks response against a {@link ResponseShape} and fills documented
 * defaults, so tool handlers never branch on absence (a missing "clusters" list comes
 * back as []).
 *
 * Pure: no I/O, no state, the input node is never mutated.
 */
@Component
public class ResponseNormalizer {

    private static final String ROOT = "$";

    /**
     * @return a normalized copy of {@code raw}
     * @throws SchemaException naming the first offending field path
     */
    public JsonNode normalize(JsonNode raw, ResponseShape shape) {
        if (shape == null || shape.isEmpty()) {
            return raw == null ? JsonNodeFactory.instance.objectNode() : raw.deepCopy();
        }
        JsonNode root = raw == null || raw.isMissingNode() || raw.isNull()
                ? JsonNodeFactory.instance.objectNode()
                : raw;
        if (!root.isObject()) {
            throw new SchemaException(ROOT, "expected response object but was " + JsonType.describe(root));
        }
        return normalizeObject((ObjectNode) root, shape, null);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private ObjectNode normalizeObject(ObjectNode source, ResponseShape shape, String parentPath) {
        ObjectNode copy = source.deepCopy();
        for (FieldSpec field : shape.fields()) {
            String   path  = parentPath == null ? field.name() : parentPath + "." + field.name();
            JsonNode value = copy.get(field.name());

            if (value == null || value.isNull()) {
                if (field.required()) {
                    throw new SchemaException(path, "required response field '%s' is missing".formatted(path));
                }
                if (field.defaultValue() != null) {
                    copy.set(field.name(), field.defaultValue().deepCopy());
                }
                continue;
            }

            if (!field.type().matches(value)) {
                throw new SchemaException(path, "response field '%s' expected %s but was %s"
                        .formatted(path, field.type().jsonName(), JsonType.describe(value)));
            }

            if (field.shape() != null && !field.shape().isEmpty()) {
                copy.set(field.name(), normalizeNested(value, field, path));
            }
        }
        return copy;
    }

    private JsonNode normalizeNested(JsonNode value, FieldSpec field, String path) {
        if (value.isObject()) {
            return normalizeObject((ObjectNode) value, field.shape(), path);
        }
        if (value.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode(value.size());
            for (int i = 0; i < value.size(); i++) {
                JsonNode element = value.get(i);
                String elementPath = path + "[" + i + "]";
                if (!element.isObject()) {
                    throw new SchemaException(elementPath, "response field '%s' expected object but was %s"
                            .formatted(elementPath, JsonType.describe(element)));
                }
                out.add(normalizeObject((ObjectNode) element, field.shape(), elementPath));
            }
            return out;
        }
        return value;
    }
}
