package com.nei10u.bazi.engine;

import com.nei10u.bazi.model.AnnualCycle;
import com.nei10u.bazi.model.BaziAnalysis;
import com.nei10u.bazi.model.BirthInput;
import com.nei10u.bazi.model.ChartResult;
import com.nei10u.bazi.model.DegradedSection;
import com.nei10u.bazi.model.ElementAnalysis;
import com.nei10u.bazi.model.FourPillarChart;
import com.nei10u.bazi.model.LifeAspects;
import com.nei10u.bazi.model.MajorCycleSchedule;
import com.nei10u.bazi.model.PatternResult;
import com.nei10u.bazi.model.PersonalityProfile;
import com.nei10u.bazi.model.SpiritMarkerResult;
import com.nei10u.bazi.model.TenGodAnalysis;
import com.nei10u.bazi.rules.RuleRepository;
import com.nei10u.bazi.rules.RuleSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 核心排盘分析的唯一入口：排盘 → 五行 → 十神 → 格局 → 神煞 → 大运 → 流年 → 性格 → 各方面推断。
 * 纯计算，不调用外部服务；同一输入、同一份规则快照下结果相同。
 */
@Component
public class BaziEngine {

    private static final Logger log = LoggerFactory.getLogger(BaziEngine.class);

    private final CalendarEngine calendarEngine;
    private final ElementAnalyzer elementAnalyzer;
    private final TenGodClassifier tenGodClassifier;
    private final PatternClassifier patternClassifier;
    private final SpiritMarkerEngine spiritMarkerEngine;
    private final CycleScheduler cycleScheduler;
    private final AnnualCycleEvaluator annualCycleEvaluator;
    private final PersonalityAnalyzer personalityAnalyzer;
    private final LifeAspectAnalyzer lifeAspectAnalyzer;
    private final RuleRepository ruleRepository;
    private final int annualYears;

    public BaziEngine(CalendarEngine calendarEngine,
                      ElementAnalyzer elementAnalyzer,
                      TenGodClassifier tenGodClassifier,
                      PatternClassifier patternClassifier,
                      SpiritMarkerEngine spiritMarkerEngine,
                      CycleScheduler cycleScheduler,
                      AnnualCycleEvaluator annualCycleEvaluator,
                      PersonalityAnalyzer personalityAnalyzer,
                      LifeAspectAnalyzer lifeAspectAnalyzer,
                      RuleRepository ruleRepository,
                      @Value("${bazi.analysis.annual-years:10}") int annualYears) {
        this.calendarEngine = calendarEngine;
        this.elementAnalyzer = elementAnalyzer;
        this.tenGodClassifier = tenGodClassifier;
        this.patternClassifier = patternClassifier;
        this.spiritMarkerEngine = spiritMarkerEngine;
        this.cycleScheduler = cycleScheduler;
        this.annualCycleEvaluator = annualCycleEvaluator;
        this.personalityAnalyzer = personalityAnalyzer;
        this.lifeAspectAnalyzer = lifeAspectAnalyzer;
        this.ruleRepository = ruleRepository;
        this.annualYears = annualYears;
    }

    public BaziAnalysis analyze(BirthInput input) {
        // 输入错误在这里直接抛出，不会产生部分结果
        ChartResult chartResult = calendarEngine.calculate(input);
        FourPillarChart chart = chartResult.getChart();
        RuleSnapshot rules = ruleRepository.snapshot();
        List<DegradedSection> degraded = new ArrayList<>(rules.degradedSections());

        ElementAnalysis elements = elementAnalyzer.analyze(chart);
        TenGodAnalysis tenGods = tenGodClassifier.analyze(chart);
        PatternResult pattern = patternClassifier.classify(chart, elements.getProfile(), elements.getStrength());
        SpiritMarkerResult markers = spiritMarkerEngine.evaluate(chart, rules.getSpiritMarkers().getData());

        MajorCycleSchedule majorCycles = cycleScheduler.schedule(chart, chartResult.getBirthMoment(),
                input.getGender(), elements.getFavorable());
        if (majorCycles.isFallbackUsed()) {
            degraded.add(new DegradedSection("大运", "未找到起运节气，按 1 岁起运"));
        }

        int startYear = input.getAnnualStartYear() != null
                ? input.getAnnualStartYear()
                : chartResult.getBirthMoment().getYear();
        List<AnnualCycle> annualCycles = annualCycleEvaluator.evaluateRange(chart, elements.getFavorable(),
                startYear, annualYears);

        PersonalityProfile personality = personalityAnalyzer.analyze(tenGods, elements,
                chart.getDayMaster().element(),
                rules.getTenGodTraits().getData(), rules.getPersonalityScoring().getData());

        LifeAspects lifeAspects = lifeAspectAnalyzer.analyze(LifeAspectAnalyzer.Inputs.builder()
                .pattern(pattern)
                .tenGods(tenGods)
                .profile(elements.getProfile())
                .spiritMarkers(markers)
                .gender(input.getGender())
                .zodiac(chartResult.getLunarInfo().getZodiac())
                .patternCareers(rules.getPatternCareers().getData())
                .zodiacRelations(rules.getZodiacRelations().getData())
                .build());

        if (!degraded.isEmpty()) {
            log.warn("分析存在降级项: {}", degraded);
        }
        log.info("分析完成: {} {} {} 格局={}", chart, elements.getStrength().getLevel(),
                elements.getFavorable().getUseful(), pattern.getType());

        return BaziAnalysis.builder()
                .input(input)
                .chart(chartResult)
                .elements(elements)
                .tenGods(tenGods)
                .pattern(pattern)
                .spiritMarkers(markers)
                .majorCycles(majorCycles)
                .annualCycles(annualCycles)
                .personality(personality)
                .lifeAspects(lifeAspects)
                .degradedSections(List.copyOf(degraded))
                .build();
    }
}
