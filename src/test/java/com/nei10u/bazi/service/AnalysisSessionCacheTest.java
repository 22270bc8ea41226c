package com.nei10u.bazi.service;

import com.nei10u.bazi.BaziFixtures;
import com.nei10u.bazi.model.BaziAnalysis;
import com.nei10u.bazi.model.BaziReport;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisSessionCacheTest {

    private final BaziAnalysis analysis = BaziFixtures.newEngine().analyze(BaziFixtures.sampleInput());

    @Test
    void reportUpdateKeepsAnalysis() {
        AnalysisSessionCache cache = new AnalysisSessionCache(30);
        BaziReport report = new BaziReport();

        cache.upsertAnalysis("rid", analysis);
        cache.upsertReport("rid", report);

        AnalysisSessionCache.CacheEntry entry = cache.get("rid").orElseThrow();
        assertThat(entry.analysis()).isSameAs(analysis);
        assertThat(entry.report()).isSameAs(report);
    }

    @Test
    void newAnalysisDropsStaleReport() {
        AnalysisSessionCache cache = new AnalysisSessionCache(30);
        cache.upsertAnalysis("rid", analysis);
        cache.upsertReport("rid", new BaziReport());

        cache.upsertAnalysis("rid", analysis);

        assertThat(cache.get("rid").orElseThrow().report()).isNull();
    }

    @Test
    void blankKeysAreIgnored() {
        AnalysisSessionCache cache = new AnalysisSessionCache(30);

        cache.upsertAnalysis(" ", analysis);

        assertThat(cache.get(" ")).isEmpty();
        assertThat(cache.get(null)).isEmpty();
    }

    @Test
    void expiredEntriesAreEvicted() throws Exception {
        AnalysisSessionCache cache = new AnalysisSessionCache(0);
        cache.upsertAnalysis("rid", analysis);

        Thread.sleep(5);

        assertThat(cache.get("rid")).isEmpty();
    }

    @Test
    void sweepRemovesEntriesThatAreNeverReadAgain() throws Exception {
        AnalysisSessionCache cache = new AnalysisSessionCache(0);
        cache.upsertAnalysis("rid-1", analysis);
        cache.upsertReport("rid-2", new BaziReport());

        Thread.sleep(5);
        cache.sweep();

        assertThat(cache.size()).isZero();
    }

    @Test
    void sweepKeepsLiveEntries() {
        AnalysisSessionCache cache = new AnalysisSessionCache(30);
        cache.upsertAnalysis("rid", analysis);

        assertThat(cache.evictExpired()).isZero();
        assertThat(cache.get("rid")).isPresent();
    }
}
