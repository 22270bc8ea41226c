package com.nei10u.bazi.rules;

import com.nei10u.bazi.model.DegradedSection;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 一次加载得到的全部规则表，加载后只读。
 */
@Value
public class RuleSnapshot {
    RuleTable<Map<String, TraitRule>> tenGodTraits;
    RuleTable<Map<String, List<String>>> patternCareers;
    RuleTable<SpiritMarkerTables> spiritMarkers;
    RuleTable<Map<String, List<ScoringRule>>> personalityScoring;
    RuleTable<ZodiacRelations> zodiacRelations;

    public List<RuleTable<?>> tables() {
        return List.of(tenGodTraits, patternCareers, spiritMarkers, personalityScoring, zodiacRelations);
    }

    /** 未成功加载的表，转为结果上的降级记录。 */
    public List<DegradedSection> degradedSections() {
        List<DegradedSection> degraded = new ArrayList<>();
        for (RuleTable<?> table : tables()) {
            if (!table.isLoaded()) {
                degraded.add(new DegradedSection(table.getCategory().label(),
                        table.getStatus() + ": " + table.getReason()));
            }
        }
        return degraded;
    }
}
