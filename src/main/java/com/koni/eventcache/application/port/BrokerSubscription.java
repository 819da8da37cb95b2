package com.koni.eventcache.application.port;

/**
 * An open receiving link on a broker topic.
 *
 * {@link #receive()} and acknowledgment are called from a single thread, the
 * ingestion thread. {@link #cancel()} may be called from any thread.
 */
public interface BrokerSubscription extends AutoCloseable {

    /**
     * Blocks until the next message is available.
     *
     * @return the next message, never null
     * @throws com.koni.eventcache.domain.exception.SubscriptionClosedException
     *         if the link was closed by the broker or cancelled locally
     * @throws com.koni.eventcache.domain.exception.BrokerUnavailableException
     *         on any other transport failure
     */
    ReceivedMessage receive();

    /**
     * Requests that a blocked or future {@link #receive()} end with
     * {@link com.koni.eventcache.domain.exception.SubscriptionClosedException}.
     */
    void cancel();

    /**
     * Releases the underlying connection.
     */
    @Override
    void close();
}
