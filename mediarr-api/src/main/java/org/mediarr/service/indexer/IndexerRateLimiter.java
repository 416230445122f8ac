package org.mediarr.service.indexer;

import lombok.extern.slf4j.Slf4j;
import org.mediarr.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Throttles outbound indexer requests. Callers queue on a fair lock and the lock is held for the
 * whole wait-then-stamp sequence, so two callers can never both observe a slot as free.
 */
@Slf4j
@Component
public class IndexerRateLimiter {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Map<String, Long> lastRequestByIndexer = new HashMap<>();
    private final long globalMinIntervalMs;
    private final long perIndexerMinIntervalMs;
    private long lastGlobalRequest;

    @Autowired
    public IndexerRateLimiter(AppProperties appProperties) {
        this(appProperties.getIndexer().getGlobalMinIntervalMs(), appProperties.getIndexer().getPerIndexerMinIntervalMs());
    }

    IndexerRateLimiter(long globalMinIntervalMs, long perIndexerMinIntervalMs) {
        this.globalMinIntervalMs = globalMinIntervalMs;
        this.perIndexerMinIntervalMs = perIndexerMinIntervalMs;
    }

    public void acquireSlot(String indexerId) {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for indexer slot: " + indexerId, e);
        }
        try {
            long now = System.currentTimeMillis();
            long globalWait = lastGlobalRequest + globalMinIntervalMs - now;
            long indexerWait = lastRequestByIndexer.getOrDefault(indexerId, 0L) + perIndexerMinIntervalMs - now;
            long sleepTime = Math.max(globalWait, indexerWait);
            if (sleepTime > 0) {
                log.debug("[RateLimit] Waiting {}ms before request to indexer {}", sleepTime, indexerId);
                Thread.sleep(sleepTime);
            }
            long stamp = System.currentTimeMillis();
            lastGlobalRequest = stamp;
            lastRequestByIndexer.put(indexerId, stamp);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for indexer slot: " + indexerId, e);
        } finally {
            lock.unlock();
        }
    }
}
