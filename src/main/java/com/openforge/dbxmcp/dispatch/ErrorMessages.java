package com.openforge.dbxmcp.dispatch;

import com.openforge.dbxmcp.client.CredentialProvider;
import com.openforge.dbxmcp.client.RemoteApiException;
import com.openforge.dbxmcp.client.RemoteTimeoutException;
import com.openforge.dbxmcp.client.ResourceNotFoundException;
import com.openforge.dbxmcp.normalize.SchemaException;
import com.openforge.dbxmcp.tool.UnknownToolException;
import org.springframework.stereotype.Component;

import java.util.concurrent.CancellationException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns any failure of a tool call into the one-line message that goes into
 * {@link ToolResult#errorMessage()}.
 *
 * Messages never contain stack traces, and credentials are masked before they leave
 * the process.
 */
@Component
public class ErrorMessages {

    private static final String  MASK           = "****";
    private static final Pattern BEARER_TOKEN   = Pattern.compile("(?i)(bearer\\s+)[A-Za-z0-9._~+/=-]+");
    private static final Pattern PERSONAL_TOKEN = Pattern.compile("dapi[0-9a-fA-F]{16,}(-\\d+)?");

    private final CredentialProvider credentials;

    public ErrorMessages(CredentialProvider credentials) {
        this.credentials = credentials;
    }

    public String describe(String toolName, Throwable failure) {
        String message;
        if (failure instanceof UnknownToolException || failure instanceof ValidationException) {
            message = failure.getMessage();
        } else if (failure instanceof RemoteApiException remote) {
            message = remote.isNotFound() && !(remote instanceof ResourceNotFoundException)
                    ? "resource not found: " + remote.getMessage()
                    : remote.getMessage();
        } else if (failure instanceof RemoteTimeoutException) {
            message = "tool %s timed out: %s".formatted(toolName, failure.getMessage());
        } else if (failure instanceof SchemaException schema) {
            message = "unexpected response shape from Databricks at %s: %s"
                    .formatted(schema.getFieldPath(), schema.getMessage());
        } else if (failure instanceof CancellationException) {
            message = cancelled(toolName);
        } else {
            String detail = failure.getMessage();
            message = detail == null || detail.isBlank()
                    ? "tool %s failed: %s".formatted(toolName, failure.getClass().getSimpleName())
                    : "tool %s failed: %s".formatted(toolName, detail);
        }
        return redact(message);
    }

    public String timedOut(String toolName, long timeoutMillis) {
        return "tool %s timed out after %d ms".formatted(toolName, timeoutMillis);
    }

    public String cancelled(String toolName) {
        return "tool %s was cancelled".formatted(toolName);
    }

    /** Masks the configured token, any bearer credential and anything shaped like a PAT. */
    public String redact(String text) {
        if (text == null || text.isEmpty()) return text;
        String out = text;
        String token = currentToken();
        if (token != null && !token.isBlank()) {
            out = out.replace(token, MASK);
        }
        out = BEARER_TOKEN.matcher(out).replaceAll("$1" + Matcher.quoteReplacement(MASK));
        return PERSONAL_TOKEN.matcher(out).replaceAll(MASK);
    }

    private String currentToken() {
        try {
            return credentials.bearerToken();
        } catch (RuntimeException e) {
            // no credential available means nothing to mask
            return null;
        }
    }
}
