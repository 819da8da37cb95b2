package com.koni.eventcache.application.ingestion;

/**
 * Ends the running application. Used by the supervisor under {@link FailurePolicy#TERMINATE}.
 */
@FunctionalInterface
public interface ApplicationTerminator {

    void terminate(int exitCode);
}
