package com.koni.eventcache.application.ingestion;

import lombok.Getter;
import lombok.ToString;

/**
 * Terminal result of an ingestion loop run, reported to the supervisor.
 */
@Getter
@ToString
public final class IngestionOutcome {

    private final IngestionState state;
    private final Throwable error;

    private IngestionOutcome(IngestionState state, Throwable error) {
        this.state = state;
        this.error = error;
    }

    /**
     * The broker closed the link, or the loop was stopped locally.
     */
    public static IngestionOutcome closed() {
        return new IngestionOutcome(IngestionState.CLOSED, null);
    }

    /**
     * The loop could not connect or lost its link to the broker.
     *
     * @param error the transport failure
     */
    public static IngestionOutcome failed(Throwable error) {
        return new IngestionOutcome(IngestionState.FAILED, error);
    }

    public boolean isFailed() {
        return state == IngestionState.FAILED;
    }
}
