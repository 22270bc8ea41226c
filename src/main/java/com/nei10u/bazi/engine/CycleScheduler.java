package com.nei10u.bazi.engine;

import com.nei10u.bazi.model.CycleDirection;
import com.nei10u.bazi.model.CycleEvaluation;
import com.nei10u.bazi.model.FavorableElementSet;
import com.nei10u.bazi.model.FourPillarChart;
import com.nei10u.bazi.model.Gender;
import com.nei10u.bazi.model.MajorCycle;
import com.nei10u.bazi.model.MajorCycleSchedule;
import com.nei10u.bazi.model.StemBranchPillar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 大运：定顺逆 → 找节 → 折算起运岁数 → 从月柱起排十步。
 */
@Component
public class CycleScheduler {

    private static final Logger log = LoggerFactory.getLogger(CycleScheduler.class);

    public static final int STEPS = 10;
    public static final int YEARS_PER_STEP = 10;

    private static final long SECONDS_PER_DAY = 24 * 3600;
    private static final long HALF_DAY_SECONDS = 12 * 3600;

    private final SolarTermSource termSource;

    public CycleScheduler(SolarTermSource termSource) {
        this.termSource = termSource;
    }

    public MajorCycleSchedule schedule(FourPillarChart chart, LocalDateTime birth, Gender gender,
                                       FavorableElementSet favorable) {
        CycleDirection direction = CycleDirection.of(chart.getYear().getStemPolarity(), gender);
        SolarTermSource.Term governing = governingTerm(birth, direction);

        int years;
        int months;
        LocalDateTime startDate;
        if (governing != null) {
            long days = roundedDays(birth, governing.moment());
            // 三天折一岁，一天折四个月
            years = (int) (days / 3);
            months = (int) (days % 3) * 4;
            startDate = birth.plusDays(days);
        } else {
            log.warn("未找到起运节气，按 1 岁起运: {}", birth);
            years = 1;
            months = 0;
            startDate = birth.plusDays(365);
        }

        List<MajorCycle> cycles = new ArrayList<>(STEPS);
        StemBranchPillar month = chart.getMonth();
        int birthYear = birth.getYear();
        for (int i = 0; i < STEPS; i++) {
            int offset = direction.step() * (i + 1);
            StemBranchPillar pillar = StemBranchPillar.of(month.getStem().index() + offset,
                    month.getBranch().index() + offset);
            int startAge = years + i * YEARS_PER_STEP;
            int endAge = startAge + YEARS_PER_STEP - 1;
            cycles.add(MajorCycle.builder()
                    .step(i + 1)
                    .pillar(pillar)
                    .startAge(startAge)
                    .endAge(endAge)
                    .startYear(birthYear + startAge)
                    .endYear(birthYear + endAge)
                    .evaluation(evaluate(pillar, favorable))
                    .build());
        }

        return MajorCycleSchedule.builder()
                .direction(direction)
                .startAgeYears(years)
                .startAgeMonths(months)
                .startDate(startDate.toLocalDate())
                .governingTerm(governing == null ? null : governing.name())
                .fallbackUsed(governing == null)
                .cycles(List.copyOf(cycles))
                .build();
    }

    /**
     * 顺排取出生后最近的节，逆排取出生前最近的节。
     */
    SolarTermSource.Term governingTerm(LocalDateTime birth, CycleDirection direction) {
        SolarTermSource.Term best = null;
        for (SolarTermSource.Term term : termSource.jieTermsAround(birth)) {
            boolean candidate = direction == CycleDirection.FORWARD
                    ? term.moment().isAfter(birth)
                    : term.moment().isBefore(birth);
            if (!candidate) {
                continue;
            }
            if (best == null || distance(birth, term) < distance(birth, best)) {
                best = term;
            }
        }
        return best;
    }

    /** 整天数，余数满 12 小时进一天。 */
    static long roundedDays(LocalDateTime from, LocalDateTime to) {
        long seconds = Math.abs(Duration.between(from, to).getSeconds());
        long days = seconds / SECONDS_PER_DAY;
        if (seconds % SECONDS_PER_DAY >= HALF_DAY_SECONDS) {
            days++;
        }
        return days;
    }

    static CycleEvaluation evaluate(StemBranchPillar pillar, FavorableElementSet favorable) {
        if (favorable.getUseful().contains(pillar.getStemElement())
                || favorable.getUseful().contains(pillar.getBranchElement())) {
            return CycleEvaluation.FAVORABLE;
        }
        if (favorable.getUnfavorable().contains(pillar.getStemElement())
                || favorable.getUnfavorable().contains(pillar.getBranchElement())) {
            return CycleEvaluation.UNFAVORABLE;
        }
        return CycleEvaluation.NEUTRAL;
    }

    private static long distance(LocalDateTime birth, SolarTermSource.Term term) {
        return Math.abs(Duration.between(birth, term.moment()).getSeconds());
    }
}
