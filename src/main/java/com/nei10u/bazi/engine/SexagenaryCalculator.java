package com.nei10u.bazi.engine;

import com.nei10u.bazi.model.EarthlyBranch;
import com.nei10u.bazi.model.HeavenlyStem;
import com.nei10u.bazi.model.StemBranchPillar;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * 六十甲子的模运算：年、日按固定基准偏移，月、时按五虎遁 / 五鼠遁起干。
 */
public final class SexagenaryCalculator {

    /** 1900 年为庚子年。 */
    public static final int YEAR_ANCHOR = 1900;
    public static final int YEAR_ANCHOR_STEM = 6;
    public static final int YEAR_ANCHOR_BRANCH = 0;

    /** 1900-01-01 为甲戌日。 */
    public static final LocalDate DAY_ANCHOR = LocalDate.of(1900, 1, 1);
    public static final int DAY_ANCHOR_STEM = 0;
    public static final int DAY_ANCHOR_BRANCH = 10;

    // 以公历月份近似节气：1 月寅 ... 11 月子、12 月丑
    private static final EarthlyBranch[] MONTH_BRANCHES = {
            EarthlyBranch.YIN, EarthlyBranch.MAO, EarthlyBranch.CHEN, EarthlyBranch.SI,
            EarthlyBranch.WU, EarthlyBranch.WEI, EarthlyBranch.SHEN, EarthlyBranch.YOU,
            EarthlyBranch.XU, EarthlyBranch.HAI, EarthlyBranch.ZI, EarthlyBranch.CHOU
    };

    // 五虎遁：甲己之年丙作首，乙庚之岁戊为头，丙辛必定寻庚起，丁壬壬位顺行流，戊癸何方发，甲寅之上好追求
    private static final int[] FIVE_TIGER_BASE = {2, 4, 6, 8, 0};

    // 五鼠遁：甲己还加甲，乙庚丙作初，丙辛从戊起，丁壬庚子居，戊癸何方发，壬子是真途
    private static final int[] FIVE_RAT_BASE = {0, 2, 4, 6, 8};

    private SexagenaryCalculator() {
    }

    public static StemBranchPillar yearPillar(int year) {
        int diff = year - YEAR_ANCHOR;
        return StemBranchPillar.of(YEAR_ANCHOR_STEM + diff, YEAR_ANCHOR_BRANCH + diff);
    }

    public static EarthlyBranch monthBranch(int month) {
        return MONTH_BRANCHES[month - 1];
    }

    public static StemBranchPillar monthPillar(HeavenlyStem yearStem, int month) {
        EarthlyBranch branch = monthBranch(month);
        int positionFromYin = Math.floorMod(branch.index() - EarthlyBranch.YIN.index(), 12);
        int stem = FIVE_TIGER_BASE[yearStem.index() % 5] + positionFromYin;
        return StemBranchPillar.of(HeavenlyStem.of(stem), branch);
    }

    public static StemBranchPillar dayPillar(LocalDate date) {
        long days = ChronoUnit.DAYS.between(DAY_ANCHOR, date);
        int stem = (int) Math.floorMod(DAY_ANCHOR_STEM + days, 10L);
        int branch = (int) Math.floorMod(DAY_ANCHOR_BRANCH + days, 12L);
        return StemBranchPillar.of(stem, branch);
    }

    /** 两小时一个时辰，23:00–00:59 为子时。 */
    public static EarthlyBranch hourBranch(int hour) {
        return EarthlyBranch.of((hour + 1) / 2);
    }

    public static StemBranchPillar hourPillar(HeavenlyStem dayStem, int hour) {
        EarthlyBranch branch = hourBranch(hour);
        int stem = FIVE_RAT_BASE[dayStem.index() % 5] + branch.index();
        return StemBranchPillar.of(HeavenlyStem.of(stem), branch);
    }
}
