package com.koni.eventcache.infrastructure.observability;

import com.koni.eventcache.application.ingestion.IngestionState;
import com.koni.eventcache.application.ingestion.IngestionSupervisor;
import com.koni.eventcache.domain.repository.EventStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the ingestion loop, exposed as "ingestion".
 *
 * - UP while connecting or running
 * - OUT_OF_SERVICE once the subscription was closed
 * - DOWN once ingestion failed; queries are still answered from the stale store
 *
 * Reports UNKNOWN when ingestion is disabled.
 */
@Component
public class IngestionHealthIndicator implements HealthIndicator {

    private final ObjectProvider<IngestionSupervisor> supervisor;
    private final EventStore eventStore;

    public IngestionHealthIndicator(ObjectProvider<IngestionSupervisor> supervisor, EventStore eventStore) {
        this.supervisor = supervisor;
        this.eventStore = eventStore;
    }

    @Override
    public Health health() {
        IngestionSupervisor current = supervisor.getIfAvailable();
        if (current == null) {
            return Health.unknown()
                    .withDetail("reason", "ingestion disabled")
                    .withDetail("storeSize", eventStore.size())
                    .build();
        }

        IngestionState state = current.getState();
        Health.Builder builder;
        if (state == IngestionState.FAILED) {
            builder = Health.down();
        } else if (state == IngestionState.CLOSED) {
            builder = Health.outOfService();
        } else {
            builder = Health.up();
        }

        builder.withDetail("state", state.name())
                .withDetail("storeSize", eventStore.size());

        Throwable lastError = current.getLastError();
        if (lastError != null) {
            builder.withDetail("error", lastError.getClass().getSimpleName())
                    .withDetail("message", String.valueOf(lastError.getMessage()));
        }
        return builder.build();
    }
}
