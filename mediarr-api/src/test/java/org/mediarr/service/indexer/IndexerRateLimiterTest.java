package org.mediarr.service.indexer;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class IndexerRateLimiterTest {

    @Test
    void consecutiveCallsToSameIndexerAreSpaced() {
        IndexerRateLimiter limiter = new IndexerRateLimiter(0, 100);

        List<Long> stamps = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            limiter.acquireSlot("1");
            stamps.add(System.currentTimeMillis());
        }

        for (int i = 1; i < stamps.size(); i++) {
            assertThat(stamps.get(i) - stamps.get(i - 1)).isGreaterThanOrEqualTo(95);
        }
    }

    @Test
    void differentIndexersOnlyWaitForGlobalInterval() {
        IndexerRateLimiter limiter = new IndexerRateLimiter(0, 1000);

        long start = System.currentTimeMillis();
        limiter.acquireSlot("1");
        limiter.acquireSlot("2");
        limiter.acquireSlot("3");

        assertThat(System.currentTimeMillis() - start).isLessThan(500);
    }

    @Test
    void concurrentCallersNeverShareASlot() throws Exception {
        IndexerRateLimiter limiter = new IndexerRateLimiter(50, 0);
        List<Long> stamps = Collections.synchronizedList(new ArrayList<>());
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            for (int i = 0; i < 4; i++) {
                String indexer = String.valueOf(i);
                executor.submit(() -> {
                    limiter.acquireSlot(indexer);
                    stamps.add(System.currentTimeMillis());
                });
            }
        } finally {
            executor.shutdown();
        }
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        List<Long> sorted = new ArrayList<>(stamps);
        Collections.sort(sorted);
        assertThat(sorted).hasSize(4);
        for (int i = 1; i < sorted.size(); i++) {
            assertThat(sorted.get(i) - sorted.get(i - 1)).isGreaterThanOrEqualTo(45);
        }
    }
}
