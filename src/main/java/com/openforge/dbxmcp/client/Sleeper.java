package com.openforge.dbxmcp.client;

import java.time.Duration;

/**
 * Blocking wait used between retry attempts and status polls.
 * Must stay interruptible: cancellation of a tool call arrives as a thread interrupt.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
