package com.openforge.dbxmcp.normalize;

import lombok.Getter;

/**
 * A remote response did not have the expected shape.
 * {@code fieldPath} points at the offending node, e.g. "clusters[2].cluster_id"; "$" is the root.
 */
@Getter
public class SchemaException extends RuntimeException {

    private final String fieldPath;

    public SchemaException(String fieldPath, String message) {
        super(message);
        this.fieldPath = fieldPath;
    }
}
