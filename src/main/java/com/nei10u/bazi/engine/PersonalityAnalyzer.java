package com.nei10u.bazi.engine;

import com.nei10u.bazi.model.DimensionScore;
import com.nei10u.bazi.model.ElementAnalysis;
import com.nei10u.bazi.model.FiveElement;
import com.nei10u.bazi.model.PersonalityDimension;
import com.nei10u.bazi.model.PersonalityProfile;
import com.nei10u.bazi.model.TenGod;
import com.nei10u.bazi.model.TenGodAnalysis;
import com.nei10u.bazi.rules.ScoringRule;
import com.nei10u.bazi.rules.TraitRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 性格：十神性格特征汇总 + 十个维度的规则评分。
 */
@Component
public class PersonalityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(PersonalityAnalyzer.class);

    public static final double DEFAULT_SCORE = 5.0;
    private static final int MAX_LISTED = 5;

    public PersonalityProfile analyze(TenGodAnalysis tenGods, ElementAnalysis elements, FiveElement self,
                                      Map<String, TraitRule> traits, Map<String, List<ScoringRule>> scoring) {
        Set<String> core = new LinkedHashSet<>();
        Set<String> strengths = new LinkedHashSet<>();
        Set<String> weaknesses = new LinkedHashSet<>();

        for (TenGod god : TenGod.values()) {
            TraitRule rule = traits.get(god.label());
            if (tenGods.count(god) <= 0 || rule == null) {
                continue;
            }
            core.addAll(rule.getPositive());
            strengths.addAll(head(rule.getPositive(), 2));
            weaknesses.addAll(head(rule.getNegative(), 2));
        }

        Map<PersonalityDimension, DimensionScore> scores = new EnumMap<>(PersonalityDimension.class);
        for (PersonalityDimension dimension : PersonalityDimension.values()) {
            scores.put(dimension, score(dimension, scoring.getOrDefault(dimension.label(), List.of()),
                    tenGods, elements, self));
        }

        return PersonalityProfile.builder()
                .coreTraits(List.copyOf(core))
                .strengths(head(new ArrayList<>(strengths), MAX_LISTED))
                .weaknesses(head(new ArrayList<>(weaknesses), MAX_LISTED))
                .scores(scores)
                .build();
    }

    /**
     * 按表内顺序取第一条成立的规则，得分为区间均值；都不成立时 5 分。
     */
    DimensionScore score(PersonalityDimension dimension, List<ScoringRule> rules, TenGodAnalysis tenGods,
                         ElementAnalysis elements, FiveElement self) {
        for (ScoringRule rule : rules) {
            Optional<PersonalityPredicate> predicate = PersonalityPredicate.fromName(rule.getPredicate());
            if (predicate.isEmpty()) {
                log.warn("{} 评分规则的判定条件无法识别，已忽略: {}", dimension, rule.getPredicate());
                continue;
            }
            if (rule.getScoreRange() == null || rule.getScoreRange().isEmpty()) {
                continue;
            }
            if (predicate.get().test(tenGods, elements.getFavorable(), elements.getStrength().getStatus(), self)) {
                double mean = rule.getScoreRange().stream().mapToInt(Integer::intValue).average().orElse(DEFAULT_SCORE);
                double rounded = Math.round(mean * 10) / 10.0;
                return new DimensionScore(rounded, level(rounded), predicate.get().label(), rule.getReason());
            }
        }
        return new DimensionScore(DEFAULT_SCORE, level(DEFAULT_SCORE), null, null);
    }

    static String level(double score) {
        if (score >= 8) {
            return "非常突出";
        }
        if (score >= 7) {
            return "突出";
        }
        if (score >= 6) {
            return "良好";
        }
        if (score >= 4) {
            return "中等";
        }
        return "较弱";
    }

    private static List<String> head(List<String> values, int n) {
        if (values == null) {
            return List.of();
        }
        return List.copyOf(values.subList(0, Math.min(n, values.size())));
    }
}
