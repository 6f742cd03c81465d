package com.openforge.dbxmcp.client;

import lombok.Getter;

/**
 * The Databricks platform rejected or failed a call after all applicable retries.
 *
 * {@code status} is the HTTP status of the last attempt, or 0 when no response was
 * received (network failure). {@code errorCode} is the platform's symbolic code
 * (e.g. RESOURCE_DOES_NOT_EXIST) when the error body carried one.
 */
@Getter
public class RemoteApiException extends RuntimeException {

    private final int    status;
    private final String errorCode;
    private final int    attempts;

    public RemoteApiException(int status, String errorCode, String message, int attempts) {
        super(message);
        this.status    = status;
        this.errorCode = errorCode;
        this.attempts  = attempts;
    }

    public RemoteApiException(int status, String errorCode, String message, int attempts, Throwable cause) {
        super(message, cause);
        this.status    = status;
        this.errorCode = errorCode;
        this.attempts  = attempts;
    }

    public boolean isNotFound() {
        return status == 404 || "RESOURCE_DOES_NOT_EXIST".equals(errorCode);
    }

    /** 5xx, 429 and network failures are worth another attempt. */
    public boolean isTransient() {
        return status == 0 || status == 429 || status >= 500;
    }
}
