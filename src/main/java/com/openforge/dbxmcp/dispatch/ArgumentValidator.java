package com.openforge.dbxmcp.dispatch;

import com.openforge.dbxmcp.tool.ParameterSpec;
import com.openforge.dbxmcp.tool.ToolDescriptor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks call arguments against a tool's parameter schema.
 *
 * Rules: required parameters present and non-null; present values match their declared
 * type; names not in the schema rejected. Absent optional parameters receive their
 * declared default. All violations are reported together.
 */
@Component
public class ArgumentValidator {

    /**
     * @return validated arguments in schema order, defaults applied
     * @throws ValidationException listing every violation
     */
    public Map<String, Object> validate(ToolDescriptor descriptor, Map<String, Object> arguments) {
        Map<String, Object> args = arguments == null ? Map.of() : arguments;
        Map<String, ParameterSpec> schema = descriptor.parameters();
        List<String> violations = new ArrayList<>();

        for (String name : args.keySet()) {
            if (!schema.containsKey(name)) {
                violations.add("unknown parameter '%s'".formatted(name));
            }
        }

        Map<String, Object> validated = new LinkedHashMap<>();
        for (ParameterSpec spec : schema.values()) {
            Object value = args.get(spec.name());
            if (value == null) {
                if (spec.required()) {
                    violations.add("missing required parameter '%s'".formatted(spec.name()));
                } else if (spec.defaultValue() != null) {
                    validated.put(spec.name(), spec.defaultValue());
                }
                continue;
            }
            if (!spec.type().matches(value)) {
                violations.add("parameter '%s' must be of type %s but was %s"
                        .formatted(spec.name(), spec.type().jsonName(), describe(value)));
                continue;
            }
            validated.put(spec.name(), value);
        }

        if (!violations.isEmpty()) {
            throw new ValidationException(descriptor.name(), violations);
        }
        return validated;
    }

    private static String describe(Object value) {
        if (value instanceof CharSequence) return "string";
        if (value instanceof Boolean)      return "boolean";
        if (value instanceof Number)       return "number";
        if (value instanceof Map<?, ?>)    return "object";
        if (value instanceof Iterable<?>)  return "array";
        return value.getClass().getSimpleName();
    }
}
