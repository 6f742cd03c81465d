package com.openforge.dbxmcp.client;

import lombok.Getter;

import java.time.Duration;

/** The overall call budget ran out, whatever retry budget was left. */
@Getter
public class RemoteTimeoutException extends RuntimeException {

    private final Duration budget;
    private final int      attempts;

    public RemoteTimeoutException(String message, Duration budget, int attempts) {
        super(message);
        this.budget   = budget;
        this.attempts = attempts;
    }
}
