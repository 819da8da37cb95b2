package com.koni.eventcache.application.port;

/**
 * A message delivered by a broker subscription, awaiting acknowledgment.
 *
 * Every received message must end in exactly one of {@link #accept()} or
 * {@link #reject(String)}.
 */
public interface ReceivedMessage {

    /**
     * Returns the raw message body.
     *
     * @return the body bytes, possibly empty
     */
    byte[] body();

    /**
     * Signals that the message was consumed.
     *
     * @throws IllegalStateException if the message was already acknowledged
     * @throws com.koni.eventcache.domain.exception.BrokerUnavailableException if the broker cannot record it
     */
    void accept();

    /**
     * Signals that the message could not be processed. The broker may redeliver
     * or drop it according to its own policy.
     *
     * @param reason a short description of why processing failed
     * @throws IllegalStateException if the message was already acknowledged
     * @throws com.koni.eventcache.domain.exception.BrokerUnavailableException if the broker cannot record it
     */
    void reject(String reason);
}
