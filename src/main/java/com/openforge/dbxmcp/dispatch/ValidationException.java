package com.openforge.dbxmcp.dispatch;

import lombok.Getter;

import java.util.List;

/** Bad, missing or unknown tool arguments. Each violation names its field. */
@Getter
public class ValidationException extends RuntimeException {

    private final String       toolName;
    private final List<String> violations;

    public ValidationException(String toolName, List<String> violations) {
        super("invalid arguments for tool %s: %s".formatted(toolName, String.join("; ", violations)));
        this.toolName   = toolName;
        this.violations = List.copyOf(violations);
    }

    public ValidationException(String toolName, String violation) {
        this(toolName, List.of(violation));
    }
}
