package com.openforge.dbxmcp.client;

/**
 * Source of the bearer credential attached to every Databricks request.
 *
 * Resolved per request so that a rotating implementation (OAuth M2M, token file)
 * can be dropped in without touching the client.
 */
@FunctionalInterface
public interface CredentialProvider {

    String bearerToken();
}
