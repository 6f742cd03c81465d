package com.openforge.dbxmcp.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.openforge.dbxmcp.tool.ParamType;
import com.openforge.dbxmcp.tool.ParameterSpec;

/**
 * One parameter of a catalog operation.
 *
 * @param in       request placement; null = inferred (see {@link ApiOperation#locationOf})
 * @param encoding "base64" to send the value base64-encoded (plain text is encoded,
 *                 values that already are base64 are sent as-is)
 */
public record ApiParameter(
        String        name,
        ParamType     type,
        boolean       required,
        @JsonProperty("default")
        Object        defaultValue,
        String        description,
        ParamLocation in,
        String        encoding
) {

    public static final String BASE64 = "base64";

    public ApiParameter {
        type = type == null ? ParamType.STRING : type;
    }

    public boolean isBase64() {
        return BASE64.equalsIgnoreCase(encoding);
    }

    public ParameterSpec toSpec() {
        return new ParameterSpec(name, type, required, defaultValue, description);
    }
}
