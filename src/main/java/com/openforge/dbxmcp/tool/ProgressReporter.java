package com.openforge.dbxmcp.tool;

/**
 * Lets a long-running handler report intermediate state before its terminal result.
 * Reports made after the call has settled (completed, timed out, cancelled) are dropped.
 */
@FunctionalInterface
public interface ProgressReporter {

    ProgressReporter NONE = (message, fraction) -> { };

    /**
     * @param fraction completion in [0, 1], or null when unknown
     */
    void report(String message, Double fraction);
}
