package org.mediarr.service.indexer;

import lombok.extern.slf4j.Slf4j;
import org.mediarr.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs one logical search at a time, first come first served, with a floor between search starts.
 */
@Slf4j
@Component
public class SearchQueue {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final long minIntervalMs;
    private long lastSearchStart;

    @Autowired
    public SearchQueue(AppProperties appProperties) {
        this(appProperties.getIndexer().getSearchMinIntervalMs());
    }

    SearchQueue(long minIntervalMs) {
        this.minIntervalMs = minIntervalMs;
    }

    public <T> T execute(String description, Supplier<T> search) {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while queued for search: " + description, e);
        }
        try {
            long wait = lastSearchStart + minIntervalMs - System.currentTimeMillis();
            if (wait > 0) {
                log.debug("[SEARCH] Waiting {}ms before starting search: {}", wait, description);
                Thread.sleep(wait);
            }
            lastSearchStart = System.currentTimeMillis();
            return search.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while queued for search: " + description, e);
        } finally {
            lock.unlock();
        }
    }
}
