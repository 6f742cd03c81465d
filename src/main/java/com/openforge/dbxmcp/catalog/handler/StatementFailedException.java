package com.openforge.dbxmcp.catalog.handler;

import lombok.Getter;

/** A SQL statement reached FAILED or CANCELED on the warehouse. */
@Getter
public class StatementFailedException extends RuntimeException {

    private final String statementId;
    private final String state;

    public StatementFailedException(String statementId, String state, String detail) {
        super(detail == null || detail.isBlank()
                ? "SQL statement %s ended in state %s".formatted(statementId, state)
                : "SQL statement %s ended in state %s: %s".formatted(statementId, state, detail));
        this.statementId = statementId;
        this.state       = state;
    }
}
