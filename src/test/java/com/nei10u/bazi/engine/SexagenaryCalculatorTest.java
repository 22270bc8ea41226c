package com.nei10u.bazi.engine;

import com.nei10u.bazi.model.EarthlyBranch;
import com.nei10u.bazi.model.HeavenlyStem;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class SexagenaryCalculatorTest {

    @Test
    void yearPillarFollowsAnchor() {
        assertThat(SexagenaryCalculator.yearPillar(1900).getGanZhi()).isEqualTo("庚子");
        assertThat(SexagenaryCalculator.yearPillar(1984).getGanZhi()).isEqualTo("甲子");
        assertThat(SexagenaryCalculator.yearPillar(1990).getGanZhi()).isEqualTo("庚午");
        assertThat(SexagenaryCalculator.yearPillar(2024).getGanZhi()).isEqualTo("甲辰");
    }

    @Test
    void dayPillarCountsFromEpoch() {
        assertThat(SexagenaryCalculator.dayPillar(LocalDate.of(1900, 1, 1)).getGanZhi()).isEqualTo("甲戌");
        assertThat(SexagenaryCalculator.dayPillar(LocalDate.of(1900, 1, 2)).getGanZhi()).isEqualTo("乙亥");
        assertThat(SexagenaryCalculator.dayPillar(LocalDate.of(2000, 1, 1)).getGanZhi()).isEqualTo("戊午");
        assertThat(SexagenaryCalculator.dayPillar(LocalDate.of(1990, 5, 15)).getGanZhi()).isEqualTo("庚辰");
    }

    @Test
    void dayPillarRepeatsEverySixtyDays() {
        LocalDate date = LocalDate.of(1975, 8, 3);
        assertThat(SexagenaryCalculator.dayPillar(date.plusDays(60)))
                .isEqualTo(SexagenaryCalculator.dayPillar(date));
    }

    @Test
    void monthPillarUsesFiveTigerRule() {
        assertThat(SexagenaryCalculator.monthBranch(1)).isEqualTo(EarthlyBranch.YIN);
        assertThat(SexagenaryCalculator.monthBranch(12)).isEqualTo(EarthlyBranch.CHOU);
        // 甲己之年丙作首
        assertThat(SexagenaryCalculator.monthPillar(HeavenlyStem.JIA, 1).getGanZhi()).isEqualTo("丙寅");
        assertThat(SexagenaryCalculator.monthPillar(HeavenlyStem.JI, 1).getGanZhi()).isEqualTo("丙寅");
        // 乙庚之岁戊为头
        assertThat(SexagenaryCalculator.monthPillar(HeavenlyStem.GENG, 1).getGanZhi()).isEqualTo("戊寅");
        assertThat(SexagenaryCalculator.monthPillar(HeavenlyStem.GENG, 5).getGanZhi()).isEqualTo("壬午");
        // 戊癸之年甲寅起
        assertThat(SexagenaryCalculator.monthPillar(HeavenlyStem.GUI, 1).getGanZhi()).isEqualTo("甲寅");
        assertThat(SexagenaryCalculator.monthPillar(HeavenlyStem.JIA, 11).getGanZhi()).isEqualTo("丙子");
    }

    @Test
    void hourBranchWrapsLateNightIntoZi() {
        assertThat(SexagenaryCalculator.hourBranch(23)).isEqualTo(EarthlyBranch.ZI);
        assertThat(SexagenaryCalculator.hourBranch(0)).isEqualTo(EarthlyBranch.ZI);
        assertThat(SexagenaryCalculator.hourBranch(1)).isEqualTo(EarthlyBranch.CHOU);
        assertThat(SexagenaryCalculator.hourBranch(12)).isEqualTo(EarthlyBranch.WU);
        assertThat(SexagenaryCalculator.hourBranch(14)).isEqualTo(EarthlyBranch.WEI);
    }

    @Test
    void hourPillarUsesFiveRatRule() {
        assertThat(SexagenaryCalculator.hourPillar(HeavenlyStem.JIA, 0).getGanZhi()).isEqualTo("甲子");
        assertThat(SexagenaryCalculator.hourPillar(HeavenlyStem.YI, 0).getGanZhi()).isEqualTo("丙子");
        assertThat(SexagenaryCalculator.hourPillar(HeavenlyStem.WU, 0).getGanZhi()).isEqualTo("壬子");
        assertThat(SexagenaryCalculator.hourPillar(HeavenlyStem.GENG, 14).getGanZhi()).isEqualTo("癸未");
    }
}
