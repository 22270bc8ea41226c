package com.nei10u.bazi.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 一次完整排盘分析的结果。同一输入、同一份规则快照下结果完全相同。
 */
@Value
@Builder
public class BaziAnalysis {
    BirthInput input;
    ChartResult chart;
    ElementAnalysis elements;
    TenGodAnalysis tenGods;
    PatternResult pattern;
    SpiritMarkerResult spiritMarkers;
    MajorCycleSchedule majorCycles;
    List<AnnualCycle> annualCycles;
    PersonalityProfile personality;
    LifeAspects lifeAspects;
    List<DegradedSection> degradedSections;
}
