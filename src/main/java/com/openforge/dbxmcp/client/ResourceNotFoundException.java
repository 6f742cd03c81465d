package com.openforge.dbxmcp.client;

/**
 * A 404 / RESOURCE_DOES_NOT_EXIST answer, reworded with the resource the caller asked for,
 * e.g. "Cluster 0412-abcd not found: ...".
 */
public class ResourceNotFoundException extends RemoteApiException {

    public ResourceNotFoundException(String resource, RemoteApiException cause) {
        super(cause.getStatus(), cause.getErrorCode(),
                "%s not found: %s".formatted(capitalize(resource), cause.getMessage()),
                cause.getAttempts(), cause);
    }

    private static String capitalize(String s) {
        if (s == null || s.isEmpty()) return "Resource";
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
