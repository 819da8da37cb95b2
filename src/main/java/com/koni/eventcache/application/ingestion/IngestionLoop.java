package com.koni.eventcache.application.ingestion;

import com.koni.eventcache.application.decoder.EventDecoder;
import com.koni.eventcache.application.port.BrokerSubscription;
import com.koni.eventcache.application.port.BrokerSubscriptionFactory;
import com.koni.eventcache.application.port.ReceivedMessage;
import com.koni.eventcache.domain.exception.EventDecodingException;
import com.koni.eventcache.domain.exception.SubscriptionClosedException;
import com.koni.eventcache.domain.model.Event;
import com.koni.eventcache.domain.repository.EventStore;
import com.koni.eventcache.infrastructure.observability.EventCacheMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * IngestionLoop moves events from a broker subscription into the event store.
 * This is the only writer of the store.
 *
 * States: CONNECTING -> RUNNING -> (CLOSED | FAILED).
 *
 * Key responsibilities:
 * - Open the subscription, starting at "now - window" when a window is set and
 *   seeking by time is enabled, otherwise at the configured offset
 * - Decode each message, store it and accept it
 * - Reject messages that cannot be decoded and keep going
 * - End with CLOSED when the link is closed or {@link #stop()} is called, and with
 *   FAILED on any transport error
 *
 * {@link #run()} blocks the calling thread for the lifetime of the loop and may be
 * called at most once.
 */
@Slf4j
public class IngestionLoop {

    private final BrokerSubscriptionFactory subscriptionFactory;
    private final EventDecoder decoder;
    private final EventStore store;
    private final EventCacheMetrics metrics;
    private final Clock clock;

    private final String topic;
    private final long startOffset;
    private final Duration window;
    private final boolean seekByWindow;

    private volatile IngestionState state = IngestionState.CONNECTING;
    private volatile BrokerSubscription subscription;
    private volatile boolean stopRequested;
    private volatile Throwable lastError;

    public IngestionLoop(BrokerSubscriptionFactory subscriptionFactory,
                         EventDecoder decoder,
                         EventStore store,
                         EventCacheMetrics metrics,
                         Clock clock,
                         String topic,
                         long startOffset,
                         Duration window,
                         boolean seekByWindow) {
        this.subscriptionFactory = subscriptionFactory;
        this.decoder = decoder;
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
        this.topic = topic;
        this.startOffset = startOffset;
        this.window = window == null ? Duration.ZERO : window;
        this.seekByWindow = seekByWindow;
    }

    /**
     * Runs the loop until the subscription closes or fails.
     *
     * @return the terminal outcome, never null
     */
    public IngestionOutcome run() {
        BrokerSubscription opened;
        try {
            opened = connect();
        } catch (RuntimeException e) {
            return fail("Failed to connect to topic " + topic, e);
        }

        try (BrokerSubscription active = opened) {
            subscription = active;
            if (stopRequested) {
                active.cancel();
            }
            transitionTo(IngestionState.RUNNING);

            while (true) {
                handle(active.receive());
            }
        } catch (SubscriptionClosedException e) {
            log.info("Subscription to topic {} closed: {}", topic, e.getMessage());
            transitionTo(IngestionState.CLOSED);
            return IngestionOutcome.closed();
        } catch (RuntimeException e) {
            return fail("Lost subscription to topic " + topic, e);
        } finally {
            subscription = null;
        }
    }

    /**
     * Requests a clean stop. A blocked receive is woken up and the loop ends CLOSED.
     * Safe to call from any thread, before or during {@link #run()}.
     */
    public void stop() {
        stopRequested = true;
        BrokerSubscription current = subscription;
        if (current != null) {
            current.cancel();
        }
    }

    public IngestionState getState() {
        return state;
    }

    public Throwable getLastError() {
        return lastError;
    }

    private BrokerSubscription connect() {
        if (!window.isZero() && seekByWindow) {
            Instant since = clock.instant().minus(window);
            if (since.isBefore(Instant.EPOCH)) {
                // broker timestamps start at the epoch
                since = Instant.EPOCH;
            }
            log.info("Connecting to topic {} from {} (window {}s)", topic, since, window.getSeconds());
            return subscriptionFactory.connectSince(topic, since);
        }
        log.info("Connecting to topic {} from offset {}", topic,
                startOffset == BrokerSubscriptionFactory.LATEST ? "latest" : String.valueOf(startOffset));
        return subscriptionFactory.connect(topic, startOffset);
    }

    /**
     * Stores one message. A decoding failure rejects the message and leaves the store untouched.
     */
    private void handle(ReceivedMessage message) {
        Event event;
        try {
            event = decoder.decode(message.body());
        } catch (EventDecodingException e) {
            log.warn("Rejecting undecodable message from topic {}: {}", topic, e.getMessage());
            message.reject(e.getMessage());
            metrics.recordRejected();
            return;
        }

        store.insert(event);
        message.accept();
        metrics.recordAccepted();
        log.debug("Stored event: deviceId={}, creationTime={}", event.getDeviceId(), event.getCreationTime());
    }

    private IngestionOutcome fail(String message, RuntimeException e) {
        log.error("{}: {}", message, e.getMessage(), e);
        lastError = e;
        transitionTo(IngestionState.FAILED);
        return IngestionOutcome.failed(e);
    }

    private void transitionTo(IngestionState next) {
        log.info("Ingestion state transition: {} -> {}", state, next);
        state = next;
    }
}
