package com.openforge.dbxmcp.tool;

import lombok.Getter;

@Getter
public class DuplicateToolException extends RuntimeException {

    private final String toolName;

    public DuplicateToolException(String toolName) {
        super("tool already registered: " + toolName);
        this.toolName = toolName;
    }
}
