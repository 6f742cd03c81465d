package com.openforge.dbxmcp.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.dbxmcp.client.RemoteApiException;
import com.openforge.dbxmcp.client.ResourceNotFoundException;
import com.openforge.dbxmcp.normalize.ResponseNormalizer;
import com.openforge.dbxmcp.tool.ToolContext;
import com.openforge.dbxmcp.tool.ToolHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Generic handler: one tool call = one request to the operation's endpoint.
 *
 *   arguments ──► path placeholders (segment-encoded)
 *             ──► query string        (GET / DELETE default)
 *             ──► JSON body           (POST / PUT / PATCH default)
 *   response  ──► normalized against the operation's response fields
 *             ──► "decoded_<field>" added for base64 payloads
 */
@Slf4j
public class EndpointToolHandler implements ToolHandler {

    private static final Pattern BASE64_TEXT = Pattern.compile("^[A-Za-z0-9+/]*={0,2}$");

    private final ApiOperation       operation;
    private final ResponseNormalizer normalizer;

    public EndpointToolHandler(ApiOperation operation, ResponseNormalizer normalizer) {
        this.operation  = operation;
        this.normalizer = normalizer;
    }

    public ApiOperation operation() {
        return operation;
    }

    @Override
    public JsonNode handle(Map<String, Object> arguments, ToolContext context) {
        return handle(arguments, Map.of(), context);
    }

    /**
     * @param bodyExtras fields merged into the request body after the arguments, used by
     *                   custom handlers that derive request fields
     */
    public JsonNode handle(Map<String, Object> arguments, Map<String, Object> bodyExtras, ToolContext context) {
        String path = operation.path();
        Map<String, Object> query = new LinkedHashMap<>();
        Map<String, Object> body  = new LinkedHashMap<>();

        for (ApiParameter p : operation.parameters()) {
            Object value = arguments.get(p.name());
            if (value == null) continue;
            if (p.isBase64() && value instanceof String text) {
                value = ensureBase64(text);
            }
            switch (operation.locationOf(p)) {
                case PATH  -> path = path.replace("{" + p.name() + "}",
                        UriUtils.encodePathSegment(String.valueOf(value), StandardCharsets.UTF_8));
                case QUERY -> query.put(p.name(), value);
                case BODY  -> body.put(p.name(), value);
                case LOCAL -> { }
            }
        }
        body.putAll(bodyExtras);

        boolean sendsBody = !body.isEmpty() || !("GET".equals(operation.method()) || "DELETE".equals(operation.method()));
        log.debug("[Endpoint:{}] {} {} query={} body-fields={}",
                context.callId(), operation.method(), path, query.keySet(), body.keySet());

        JsonNode raw;
        try {
            raw = context.client().call(operation.httpMethod(), path, query, sendsBody ? body : null);
        } catch (RemoteApiException e) {
            if (e.isNotFound() && operation.resource() != null && !(e instanceof ResourceNotFoundException)) {
                throw new ResourceNotFoundException(describeResource(arguments), e);
            }
            throw e;
        }

        JsonNode normalized = normalizer.normalize(raw, operation.responseShape());
        return decode(normalized);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private JsonNode decode(JsonNode normalized) {
        String field = operation.decodeField();
        if (field == null || !(normalized instanceof ObjectNode object)) {
            return normalized;
        }
        JsonNode encoded = object.get(field);
        if (encoded == null || !encoded.isTextual()) {
            return normalized;
        }
        try {
            byte[] bytes = Base64.getDecoder().decode(encoded.asText());
            object.put("decoded_" + field, new String(bytes, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            log.debug("[Endpoint] {}.{} is not base64: {}", operation.name(), field, e.getMessage());
        }
        return object;
    }

    /** "cluster 0412-abcd" from the resource noun and the first required argument. */
    private String describeResource(Map<String, Object> arguments) {
        return operation.parameters().stream()
                .filter(ApiParameter::required)
                .map(p -> arguments.get(p.name()))
                .filter(v -> v instanceof CharSequence || v instanceof Number)
                .findFirst()
                .map(v -> operation.resource() + " " + v)
                .orElse(operation.resource());
    }

    /** Plain text is encoded as UTF-8 base64; text that already decodes as base64 is kept. */
    static String ensureBase64(String text) {
        if (isBase64(text)) {
            return text;
        }
        return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
    }

    static boolean isBase64(String text) {
        if (text.isEmpty() || text.length() % 4 != 0 || !BASE64_TEXT.matcher(text).matches()) {
            return false;
        }
        try {
            Base64.getDecoder().decode(text);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
