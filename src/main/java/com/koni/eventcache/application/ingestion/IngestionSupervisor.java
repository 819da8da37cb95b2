package com.koni.eventcache.application.ingestion;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the ingestion loop on a dedicated thread and decides what happens when it ends.
 *
 * The loop reports its terminal outcome through a future; the supervisor applies the
 * configured {@link FailurePolicy} to a FAILED outcome. A CLOSED outcome is logged
 * and the application keeps serving queries.
 */
@Slf4j
public class IngestionSupervisor implements SmartLifecycle {

    private static final int FAILURE_EXIT_CODE = 1;

    private final IngestionLoop loop;
    private final FailurePolicy failurePolicy;
    private final ApplicationTerminator terminator;
    private final Duration shutdownTimeout;

    private ExecutorService executor;
    private volatile CompletableFuture<IngestionOutcome> outcome;

    public IngestionSupervisor(IngestionLoop loop,
                               FailurePolicy failurePolicy,
                               ApplicationTerminator terminator,
                               Duration shutdownTimeout) {
        this.loop = loop;
        this.failurePolicy = failurePolicy;
        this.terminator = terminator;
        this.shutdownTimeout = shutdownTimeout;
    }

    @Override
    public synchronized void start() {
        if (outcome != null) {
            return;
        }
        executor = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("event-ingestion-"));
        outcome = CompletableFuture.supplyAsync(loop::run, executor);
        outcome.whenComplete((result, error) -> onLoopFinished(result, error));
        log.info("Ingestion loop started (failure policy {})", failurePolicy);
    }

    @Override
    public synchronized void stop() {
        if (outcome == null) {
            return;
        }
        log.info("Stopping ingestion loop");
        loop.stop();
        try {
            outcome.get(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the ingestion loop to stop");
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Ingestion loop did not stop cleanly within {}: {}", shutdownTimeout, e.toString());
        } finally {
            executor.shutdownNow();
        }
    }

    @Override
    public boolean isRunning() {
        CompletableFuture<IngestionOutcome> current = outcome;
        return current != null && !current.isDone();
    }

    /**
     * Returns the future completed with the loop's terminal outcome.
     *
     * @return the outcome future, or null if the loop was never started
     */
    public CompletableFuture<IngestionOutcome> getOutcome() {
        return outcome;
    }

    public IngestionState getState() {
        return loop.getState();
    }

    public Throwable getLastError() {
        return loop.getLastError();
    }

    private void onLoopFinished(IngestionOutcome result, Throwable error) {
        if (error != null) {
            result = IngestionOutcome.failed(error);
        }

        if (!result.isFailed()) {
            log.info("Ingestion loop finished: {}", result.getState());
            return;
        }

        if (failurePolicy == FailurePolicy.DEGRADED) {
            log.error("Ingestion failed; serving queries from the stale event store", result.getError());
            return;
        }

        log.error("Ingestion failed; terminating the application", result.getError());
        terminator.terminate(FAILURE_EXIT_CODE);
    }
}
