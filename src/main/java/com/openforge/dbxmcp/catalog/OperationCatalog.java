package com.openforge.dbxmcp.catalog;

import java.util.List;

/** Root of operations.yml. */
public record OperationCatalog(List<ApiOperation> operations) {

    public OperationCatalog {
        operations = operations == null ? List.of() : List.copyOf(operations);
    }
}
