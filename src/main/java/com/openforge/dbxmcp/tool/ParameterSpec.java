package com.openforge.dbxmcp.tool;

/**
 * One entry of a tool's parameter schema.
 *
 * @param defaultValue applied by the dispatcher when an optional argument is absent; null = none
 */
public record ParameterSpec(
        String    name,
        ParamType type,
        boolean   required,
        Object    defaultValue,
        String    description
) {

    public static ParameterSpec required(String name, ParamType type, String description) {
        return new ParameterSpec(name, type, true, null, description);
    }

    public static ParameterSpec optional(String name, ParamType type, String description) {
        return new ParameterSpec(name, type, false, null, description);
    }
}
