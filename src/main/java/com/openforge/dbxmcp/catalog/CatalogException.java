package com.openforge.dbxmcp.catalog;

/** The operation catalog is missing, unreadable or inconsistent. Fails startup. */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
