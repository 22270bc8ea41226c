package com.nei10u.bazi.engine;

import com.nei10u.bazi.model.ElementProfile;
import com.nei10u.bazi.model.FiveElement;
import com.nei10u.bazi.model.FourPillarChart;
import com.nei10u.bazi.model.PatternCategory;
import com.nei10u.bazi.model.PatternLevel;
import com.nei10u.bazi.model.PatternResult;
import com.nei10u.bazi.model.StrengthAssessment;
import com.nei10u.bazi.model.TenGod;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 格局判定：先看专旺格，不成立再以月干十神定正格。
 */
@Component
public class PatternClassifier {

    public static final int SPECIAL_SCORE_CEILING = 30;
    public static final double SPECIAL_SHARE_FLOOR = 0.7;

    private static final Map<FiveElement, String> SPECIAL_NAMES = new EnumMap<>(FiveElement.class);
    private static final Set<TenGod> ORDINARY_GODS = EnumSet.of(
            TenGod.ZHENG_GUAN, TenGod.QI_SHA, TenGod.ZHENG_CAI, TenGod.PIAN_CAI,
            TenGod.ZHENG_YIN, TenGod.PIAN_YIN, TenGod.SHI_SHEN, TenGod.SHANG_GUAN);

    static {
        SPECIAL_NAMES.put(FiveElement.WOOD, "曲直格");
        SPECIAL_NAMES.put(FiveElement.FIRE, "炎上格");
        SPECIAL_NAMES.put(FiveElement.EARTH, "稼穑格");
        SPECIAL_NAMES.put(FiveElement.METAL, "从革格");
        SPECIAL_NAMES.put(FiveElement.WATER, "润下格");
    }

    public PatternResult classify(FourPillarChart chart, ElementProfile profile, StrengthAssessment strength) {
        if (strength.getScore() < SPECIAL_SCORE_CEILING) {
            FiveElement dominant = profile.getMostRepresented();
            if (profile.share(dominant) > SPECIAL_SHARE_FLOOR) {
                return special(dominant);
            }
        }
        return ordinary(TenGodClassifier.classify(chart.getDayMaster(), chart.getMonth().getStem()));
    }

    static PatternResult special(FiveElement dominant) {
        return PatternResult.builder()
                .type(SPECIAL_NAMES.get(dominant))
                .category(PatternCategory.SPECIAL)
                .level(dominant == FiveElement.WOOD ? PatternLevel.HIGH : PatternLevel.MEDIUM_HIGH)
                .description("满盘" + dominant.label() + "，" + dominant.label() + "专旺")
                .build();
    }

    static PatternResult ordinary(TenGod monthGod) {
        String type = ORDINARY_GODS.contains(monthGod) ? monthGod.label() + "格" : PatternResult.ORDINARY_PATTERN;
        return PatternResult.builder()
                .type(type)
                .category(PatternCategory.ORDINARY)
                .level(PatternLevel.MEDIUM)
                .description("月令透" + monthGod.label() + "，为" + type)
                .monthTenGod(monthGod)
                .build();
    }
}
