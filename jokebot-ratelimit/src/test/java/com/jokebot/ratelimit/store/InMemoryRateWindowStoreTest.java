package com.jokebot.ratelimit.store;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryRateWindowStoreTest {

    private final InMemoryRateWindowStore store = new InMemoryRateWindowStore();

    @Test
    void firstIncrementCreatesWindowLazily() {
        assertThat(store.get("u1")).isEmpty();

        RateWindow window = store.increment("u1", 1_000, 5_000);

        assertThat(window.getCount()).isEqualTo(1);
        assertThat(window.getWindowResetAt()).isEqualTo(6_000);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void incrementsWithinWindowKeepResetTime() {
        store.increment("u1", 1_000, 5_000);
        RateWindow window = store.increment("u1", 4_000, 5_000);

        assertThat(window.getCount()).isEqualTo(2);
        assertThat(window.getWindowResetAt()).isEqualTo(6_000);
    }

    @Test
    void windowRollsOverOnceResetTimeIsReached() {
        store.increment("u1", 1_000, 5_000);
        store.increment("u1", 2_000, 5_000);

        RateWindow window = store.increment("u1", 6_000, 5_000);

        assertThat(window.getCount()).isEqualTo(1);
        assertThat(window.getWindowResetAt()).isEqualTo(11_000);
    }

    @Test
    void sweepRemovesOnlyEntriesStaleForAFullWindow() {
        store.increment("stale", 0, 1_000);      // reset at 1000, stale after 2000
        store.increment("fresh", 1_500, 1_000);  // reset at 2500

        int removed = store.sweep(2_001, 1_000);

        assertThat(removed).isEqualTo(1);
        assertThat(store.get("stale")).isEmpty();
        assertThat(store.get("fresh")).isPresent();
    }

    @Test
    void sweepKeepsEntryJustPastResetTime() {
        store.increment("u1", 0, 1_000);

        assertThat(store.sweep(2_000, 1_000)).isZero();
        assertThat(store.get("u1")).isPresent();
    }

    @Test
    void concurrentIncrementsOnSameKeyAreNotLost() throws Exception {
        int threads = 8;
        int perThread = 1_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);

        for (int i = 0; i < threads; i++) {
            pool.submit(() -> {
                try {
                    start.await();
                    for (int j = 0; j < perThread; j++) {
                        store.increment("hot", 0, 60_000);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        pool.shutdown();

        assertThat(store.get("hot")).get()
                .extracting(RateWindow::getCount)
                .isEqualTo(threads * perThread);
    }

    @Test
    void resetAndClearDropEntries() {
        store.increment("a", 0, 1_000);
        store.increment("b", 0, 1_000);

        store.reset("a");
        assertThat(store.get("a")).isEmpty();
        assertThat(store.size()).isEqualTo(1);

        store.clear();
        assertThat(store.size()).isZero();
    }
}
