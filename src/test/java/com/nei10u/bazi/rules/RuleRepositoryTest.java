package com.nei10u.bazi.rules;

import com.nei10u.bazi.BaziFixtures;
import com.nei10u.bazi.model.DegradedSection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class RuleRepositoryTest {

    @Test
    void loadsBundledRules() {
        RuleSnapshot snapshot = new RuleRepository(BaziFixtures.RULES).snapshot();

        assertThat(snapshot.tables()).allMatch(RuleTable::isLoaded);
        assertThat(snapshot.degradedSections()).isEmpty();
        assertThat(snapshot.getTenGodTraits().getData()).hasSize(10);
        assertThat(snapshot.getSpiritMarkers().getData().getTianYi().get("甲")).containsExactly("丑", "未");
        assertThat(snapshot.getZodiacRelations().getData().getClash()).containsEntry("鼠", "马");
        assertThat(snapshot.getPersonalityScoring().getData().get("领导力"))
                .extracting(ScoringRule::getPredicate)
                .contains("OFFICER_STRONG_AND_USEFUL");
    }

    @Test
    void missingLocationDegradesEveryTable() {
        RuleSnapshot snapshot = new RuleRepository("classpath:no-such-rules/").snapshot();

        assertThat(snapshot.tables()).extracting(RuleTable::getStatus).containsOnly(RuleTable.Status.EMPTY);
        assertThat(snapshot.getSpiritMarkers().getData().isEmpty()).isTrue();
        assertThat(snapshot.getTenGodTraits().getData()).isEmpty();
        assertThat(snapshot.degradedSections()).extracting(DegradedSection::getSection)
                .containsExactly("十神性格特征", "格局职业倾向", "神煞规则", "性格维度评分", "生肖关系");
    }

    @Test
    void brokenFileIsFailedAndBlankFileIsEmpty(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve(RuleCategory.TEN_GOD_TRAITS.fileName()), "{\"比肩\": [", StandardCharsets.UTF_8);
        Files.writeString(dir.resolve(RuleCategory.PATTERN_CAREERS.fileName()), "   ", StandardCharsets.UTF_8);
        Files.writeString(dir.resolve(RuleCategory.ZODIAC_RELATIONS.fileName()), "{}", StandardCharsets.UTF_8);

        RuleSnapshot snapshot = new RuleRepository(dir.toUri().toString()).snapshot();

        assertThat(snapshot.getTenGodTraits().getStatus()).isEqualTo(RuleTable.Status.FAILED);
        assertThat(snapshot.getTenGodTraits().getData()).isEmpty();
        assertThat(snapshot.getPatternCareers().getStatus()).isEqualTo(RuleTable.Status.EMPTY);
        assertThat(snapshot.getZodiacRelations().getStatus()).isEqualTo(RuleTable.Status.EMPTY);
        assertThat(snapshot.getSpiritMarkers().getStatus()).isEqualTo(RuleTable.Status.EMPTY);
    }

    @Test
    void concurrentCallersShareOneLoad() throws Exception {
        RuleRepository repository = new RuleRepository(BaziFixtures.RULES);
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<RuleSnapshot>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<RuleSnapshot> task = () -> {
                    start.await();
                    return repository.snapshot();
                };
                futures.add(pool.submit(task));
            }
            start.countDown();

            RuleSnapshot first = futures.get(0).get();
            for (Future<RuleSnapshot> future : futures) {
                assertThat(future.get()).isSameAs(first);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(repository.loadCount()).isEqualTo(1);
    }

    @Test
    void snapshotIsReusedAfterFirstLoad() {
        RuleRepository repository = new RuleRepository(BaziFixtures.RULES);

        assertThat(repository.loadCount()).isZero();
        RuleSnapshot first = repository.snapshot();
        assertThat(repository.snapshot()).isSameAs(first);
        assertThat(repository.loadCount()).isEqualTo(1);
    }
}
