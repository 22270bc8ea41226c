package com.nei10u.bazi.engine;

import com.nei10u.bazi.BaziFixtures;
import com.nei10u.bazi.model.EarthlyBranch;
import com.nei10u.bazi.model.PillarPosition;
import com.nei10u.bazi.model.SpiritMarker;
import com.nei10u.bazi.model.SpiritMarkerResult;
import com.nei10u.bazi.model.SpiritMarkerType;
import com.nei10u.bazi.rules.RuleRepository;
import com.nei10u.bazi.rules.SpiritMarkerTables;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class SpiritMarkerEngineTest {

    private static SpiritMarkerTables tables;

    private final SpiritMarkerEngine engine = new SpiritMarkerEngine();

    @BeforeAll
    static void loadTables() {
        tables = new RuleRepository(BaziFixtures.RULES).snapshot().getSpiritMarkers().getData();
    }

    @Test
    void findsMarkersOfSampleChart() {
        SpiritMarkerResult result = engine.evaluate(BaziFixtures.chart("庚午", "壬午", "庚辰", "癸未"), tables);

        assertThat(result.getAuspiciousNames()).containsExactly("天乙贵人");
        assertThat(result.getInauspiciousNames()).containsExactly("寡宿");
        assertThat(result.getAuspiciousDetails())
                .extracting(SpiritMarker::getPosition, SpiritMarker::getBranch)
                .containsExactly(tuple(PillarPosition.HOUR, EarthlyBranch.WEI));
    }

    @Test
    void scansYearToHourAndKeepsFirstHit() {
        // 甲日羊刃在卯，子年灾煞在午、孤辰在寅
        SpiritMarkerResult result = engine.evaluate(BaziFixtures.chart("甲子", "丙寅", "甲午", "丁卯"), tables);

        assertThat(result.getInauspiciousNames()).containsExactly("羊刃", "灾煞", "孤辰");
        assertThat(result.getInauspiciousDetails())
                .extracting(SpiritMarker::getType, SpiritMarker::getPosition)
                .containsExactly(
                        tuple(SpiritMarkerType.YANG_REN, PillarPosition.HOUR),
                        tuple(SpiritMarkerType.ZAI_SHA, PillarPosition.DAY),
                        tuple(SpiritMarkerType.GU_CHEN, PillarPosition.MONTH));
        assertThat(result.has(SpiritMarkerType.JIE_SHA)).isFalse();
    }

    @Test
    void peachBlossomFallsBackToDayBranch() {
        // 子年桃花在酉（不见），午日桃花在卯（时柱见）
        SpiritMarkerResult result = engine.evaluate(BaziFixtures.chart("甲子", "丙寅", "甲午", "丁卯"), tables);

        assertThat(result.getAuspiciousNames()).containsExactly("红鸾", "桃花");
        assertThat(result.getAuspiciousDetails())
                .extracting(SpiritMarker::getType, SpiritMarker::getPosition)
                .containsExactly(
                        tuple(SpiritMarkerType.HONG_LUAN, PillarPosition.HOUR),
                        tuple(SpiritMarkerType.TAO_HUA, PillarPosition.HOUR));
    }

    @Test
    void redPhoenixRecordsEveryHit() {
        // 子年红鸾在卯，月、日、时三柱均见
        SpiritMarkerResult result = engine.evaluate(BaziFixtures.chart("甲子", "丁卯", "乙卯", "己卯"), tables);

        assertThat(result.getAuspiciousDetails())
                .filteredOn(m -> m.getType() == SpiritMarkerType.HONG_LUAN)
                .extracting(SpiritMarker::getPosition)
                .containsExactly(PillarPosition.MONTH, PillarPosition.DAY, PillarPosition.HOUR);
        assertThat(result.getAuspiciousNames()).containsOnlyOnce("红鸾");
    }

    @Test
    void emptyTablesOnlyDisableAuspiciousMarkers() {
        SpiritMarkerResult result = engine.evaluate(BaziFixtures.chart("甲子", "丙寅", "甲午", "丁卯"),
                new SpiritMarkerTables());

        assertThat(result.getAuspiciousNames()).isEmpty();
        assertThat(result.getInauspiciousNames()).containsExactly("羊刃", "灾煞", "孤辰");
    }
}
