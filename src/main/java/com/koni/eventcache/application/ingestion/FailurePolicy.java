package com.koni.eventcache.application.ingestion;

/**
 * What the supervisor does when the ingestion loop fails.
 */
public enum FailurePolicy {

    /**
     * Shut the application down with a non-zero exit code.
     */
    TERMINATE,

    /**
     * Keep serving queries from the stale store.
     */
    DEGRADED
}
