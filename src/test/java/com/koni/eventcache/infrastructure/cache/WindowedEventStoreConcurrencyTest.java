package com.koni.eventcache.infrastructure.cache;

import com.koni.eventcache.domain.model.Event;
import com.koni.eventcache.domain.repository.OutOfOrderPolicy;
import com.koni.eventcache.infrastructure.observability.EventCacheMetrics;
import com.koni.eventcache.support.MutableClock;
import com.koni.eventcache.tags.UnitTest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Readers running against a single writer must only ever see consistent snapshots:
 * creation times non-decreasing, nothing older than the cutoff of the latest insert,
 * and no gaps in the retained suffix.
 */
@UnitTest
class WindowedEventStoreConcurrencyTest {

    private static final int EVENTS = 20_000;
    private static final int WINDOW = 50;
    private static final int READERS = 4;

    @Test
    void shouldNeverExposeTornStateToConcurrentReaders() throws Exception {
        // Given
        MutableClock clock = new MutableClock(0);
        WindowedEventStore store = new WindowedEventStore(
                Duration.ofSeconds(WINDOW),
                OutOfOrderPolicy.RETAIN,
                clock,
                new EventCacheMetrics(new SimpleMeterRegistry()));

        ExecutorService executor = Executors.newFixedThreadPool(READERS + 1);
        AtomicBoolean writerDone = new AtomicBoolean(false);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<String>>> readers = new ArrayList<>();

        for (int r = 0; r < READERS; r++) {
            readers.add(executor.submit(() -> {
                List<String> violations = new ArrayList<>();
                start.await();
                while (!writerDone.get() && violations.isEmpty()) {
                    List<Event> snapshot = store.query("", 0, 0);
                    for (int i = 1; i < snapshot.size(); i++) {
                        long previous = snapshot.get(i - 1).getCreationTime();
                        long current = snapshot.get(i).getCreationTime();
                        if (current != previous + 1) {
                            violations.add("gap between " + previous + " and " + current);
                        }
                    }
                    if (snapshot.size() > WINDOW + 1) {
                        violations.add("snapshot of " + snapshot.size() + " events exceeds the window");
                    }
                }
                return violations;
            }));
        }

        // When
        Future<?> writer = executor.submit(() -> {
            try {
                start.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            for (long t = 1; t <= EVENTS; t++) {
                clock.setEpochSecond(t);
                store.insert(new Event("d" + (t % 7), t, Collections.emptyMap()));
            }
            writerDone.set(true);
        });
        start.countDown();

        // Then
        writer.get(30, TimeUnit.SECONDS);
        for (Future<List<String>> reader : readers) {
            assertThat(reader.get(30, TimeUnit.SECONDS)).isEmpty();
        }
        executor.shutdownNow();

        assertThat(store.size()).isEqualTo(WINDOW + 1);
        assertThat(store.query("", 0, 1).get(0).getCreationTime()).isEqualTo(EVENTS - WINDOW);
    }
}
