package com.nei10u.bazi.service;

import com.nei10u.bazi.model.BaziAnalysis;
import com.nei10u.bazi.model.BaziReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 简单的进程内缓存：分步调用时在 /chart 与 /report 之间传递排盘结果。
 * 以 requestId 为 key，避免重复排盘。读取时顺带淘汰过期项，另有定时清理。
 */
@Component
public class AnalysisSessionCache {

    private static final Logger log = LoggerFactory.getLogger(AnalysisSessionCache.class);

    private final Duration ttl;
    private final ConcurrentHashMap<String, CacheEntry> store = new ConcurrentHashMap<>();

    public AnalysisSessionCache(@Value("${bazi.session.ttl-minutes:30}") long ttlMinutes) {
        this.ttl = Duration.ofMinutes(ttlMinutes);
    }

    /**
     * 写入排盘结果。已缓存的报告属于旧的排盘，一并清掉。
     */
    public void upsertAnalysis(String requestId, BaziAnalysis analysis) {
        if (requestId == null || requestId.isBlank()) {
            return;
        }
        store.put(requestId, new CacheEntry(System.currentTimeMillis(), analysis, null));
    }

    /**
     * 仅更新报告，排盘结果不会被覆盖。
     */
    public void upsertReport(String requestId, BaziReport report) {
        if (requestId == null || requestId.isBlank()) {
            return;
        }
        store.compute(requestId, (k, old) -> {
            long now = System.currentTimeMillis();
            if (old == null || isExpired(old.createdAtMillis)) {
                return new CacheEntry(now, null, report);
            }
            return new CacheEntry(old.createdAtMillis, old.analysis, report);
        });
    }

    public Optional<CacheEntry> get(String requestId) {
        if (requestId == null || requestId.isBlank()) {
            return Optional.empty();
        }
        CacheEntry entry = store.get(requestId);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry.createdAtMillis)) {
            store.remove(requestId);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    /**
     * 定时清理过期项，只写不读的 requestId 也不会一直留在内存里。
     */
    @Scheduled(fixedDelayString = "${bazi.session.sweep-interval-ms:300000}")
    public void sweep() {
        int removed = evictExpired();
        if (removed > 0) {
            log.debug("session cache evicted {} expired entries, {} left", removed, store.size());
        }
    }

    int evictExpired() {
        int removed = 0;
        for (Iterator<CacheEntry> it = store.values().iterator(); it.hasNext(); ) {
            if (isExpired(it.next().createdAtMillis)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    int size() {
        return store.size();
    }

    private boolean isExpired(long createdAtMillis) {
        return System.currentTimeMillis() - createdAtMillis > ttl.toMillis();
    }

    public record CacheEntry(long createdAtMillis, BaziAnalysis analysis, BaziReport report) {
    }
}
