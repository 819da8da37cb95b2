package com.koni.eventcache.application.ingestion;

/**
 * Lifecycle states of the ingestion loop.
 * CLOSED and FAILED are terminal.
 */
public enum IngestionState {
    CONNECTING,
    RUNNING,
    CLOSED,
    FAILED
}
