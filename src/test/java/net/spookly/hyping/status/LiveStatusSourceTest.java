package net.spookly.hyping.status;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;

class LiveStatusSourceTest {
    private static final StatusRecord INITIAL = StatusRecord.of("init", 0, 100, BattleMode.globalPve());

    @Test
    void readsReturnLatestPublishedRecord() {
        LiveStatusSource source = new LiveStatusSource(INITIAL);
        assertSame(INITIAL, source.current());
        assertEquals(0L, source.version());

        StatusRecord next = INITIAL.withPlayersCount(7);
        long version = source.publish(next);

        assertEquals(1L, version);
        assertSame(next, source.current());
        assertEquals(1L, source.version());
    }

    @Test
    void listenersSeeUpdatesInOrderUntilClosed() {
        LiveStatusSource source = new LiveStatusSource(INITIAL);
        List<Long> versions = new ArrayList<>();
        StatusSubscription subscription = source.subscribe((record, version) -> versions.add(version));

        source.publish(INITIAL.withPlayersCount(1));
        source.publish(INITIAL.withPlayersCount(2));
        subscription.close();
        subscription.close();
        source.publish(INITIAL.withPlayersCount(3));

        assertEquals(List.of(1L, 2L), versions);
        assertEquals(0, source.listenerCount());
    }

    @Test
    void failingListenerDoesNotBlockPublish() {
        LiveStatusSource source = new LiveStatusSource(INITIAL);
        List<StatusRecord> seen = new ArrayList<>();
        source.subscribe((record, version) -> {
            throw new IllegalStateException("boom");
        });
        source.subscribe((record, version) -> seen.add(record));

        StatusRecord next = INITIAL.withPlayersCount(9);
        source.publish(next);

        assertSame(next, source.current());
        assertEquals(List.of(next), seen);
    }

    @Test
    void readersNeverObserveOlderRecords() throws Exception {
        LiveStatusSource source = new LiveStatusSource(INITIAL);
        int publishes = 5_000;
        int readers = 4;
        ExecutorService executor = Executors.newFixedThreadPool(readers);
        AtomicBoolean done = new AtomicBoolean(false);
        CountDownLatch started = new CountDownLatch(readers);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < readers; i++) {
            results.add(executor.submit(() -> {
                started.countDown();
                long lastVersion = -1;
                int lastCount = -1;
                while (!done.get()) {
                    long version = source.version();
                    int count = source.current().playersCount();
                    if (version < lastVersion || count < lastCount) {
                        return false;
                    }
                    lastVersion = version;
                    lastCount = count;
                }
                return true;
            }));
        }
        assertTrue(started.await(5, TimeUnit.SECONDS));
        for (int i = 1; i <= publishes; i++) {
            source.publish(INITIAL.withPlayersCount(i));
            assertEquals(i, source.current().playersCount());
        }
        done.set(true);
        for (Future<Boolean> result : results) {
            assertTrue(result.get(5, TimeUnit.SECONDS));
        }
        executor.shutdownNow();
    }
}
