package com.koni.eventcache.application.port;

import java.time.Instant;

/**
 * Port for opening broker subscriptions.
 * Implemented by the messaging adapter.
 */
public interface BrokerSubscriptionFactory {

    /**
     * Sentinel start offset meaning "only messages published from now on".
     */
    long LATEST = -1L;

    /**
     * Opens a subscription on a topic starting at a fixed offset.
     *
     * @param topic the topic name
     * @param offset the offset to start from, or {@link #LATEST}
     * @return the open subscription
     * @throws com.koni.eventcache.domain.exception.BrokerUnavailableException
     *         if the broker cannot be reached or the topic does not exist
     */
    BrokerSubscription connect(String topic, long offset);

    /**
     * Opens a subscription on a topic starting at the first message published at
     * or after the given time.
     *
     * @param topic the topic name
     * @param since the earliest publish time to deliver
     * @return the open subscription
     * @throws com.koni.eventcache.domain.exception.BrokerUnavailableException
     *         if the broker cannot be reached or the topic does not exist
     */
    BrokerSubscription connectSince(String topic, Instant since);
}
