package com.openforge.dbxmcp.catalog.handler;

import com.openforge.dbxmcp.client.Sleeper;

import java.time.Duration;
import java.util.concurrent.CancellationException;

final class Polling {

    private Polling() {}

    /** Sleeps one poll interval; an interrupt ends the wait as a cancellation. */
    static void pause(Sleeper sleeper, Duration interval, String what) {
        try {
            sleeper.sleep(interval);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException(what + " was cancelled while polling");
        }
    }
}
