package com.deepansh.inbox.trigger;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecentEventCacheTest {

    @Test
    void markIfAbsent_secondSighting_false() {
        RecentEventCache cache = new RecentEventCache(10);

        assertThat(cache.markIfAbsent("e1")).isTrue();
        assertThat(cache.markIfAbsent("e1")).isFalse();
    }

    @Test
    void markIfAbsent_overCapacity_evictsOldestFirst() {
        RecentEventCache cache = new RecentEventCache(2);
        cache.markIfAbsent("e1");
        cache.markIfAbsent("e2");
        cache.markIfAbsent("e1");
        cache.markIfAbsent("e3");

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.contains("e1")).isFalse();
        assertThat(cache.contains("e2")).isTrue();
        assertThat(cache.contains("e3")).isTrue();
    }

    @Test
    void forget_allowsIdAgain() {
        RecentEventCache cache = new RecentEventCache(10);
        cache.markIfAbsent("e1");
        cache.forget("e1");

        assertThat(cache.markIfAbsent("e1")).isTrue();
    }

    @Test
    void markIfAbsent_concurrentSameId_exactlyOneWins() throws Exception {
        RecentEventCache cache = new RecentEventCache(100);
        ExecutorService pool = Executors.newFixedThreadPool(16);
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                tasks.add(() -> cache.markIfAbsent("e1"));
            }
            int winners = 0;
            for (Future<Boolean> future : pool.invokeAll(tasks)) {
                if (future.get()) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void constructor_nonPositiveCapacity_rejected() {
        assertThatThrownBy(() -> new RecentEventCache(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
