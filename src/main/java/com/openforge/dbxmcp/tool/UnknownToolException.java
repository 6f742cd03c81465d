package com.openforge.dbxmcp.tool;

import lombok.Getter;

@Getter
public class UnknownToolException extends RuntimeException {

    private final String toolName;

    public UnknownToolException(String toolName) {
        super("unknown tool " + toolName);
        this.toolName = toolName;
    }
}
