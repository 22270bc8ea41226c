package com.nei10u.bazi.engine;

import com.nei10u.bazi.model.ElementProfile;
import com.nei10u.bazi.model.FiveElement;
import com.nei10u.bazi.model.Gender;
import com.nei10u.bazi.model.LifeAspects;
import com.nei10u.bazi.model.PatternResult;
import com.nei10u.bazi.model.SpiritMarker;
import com.nei10u.bazi.model.SpiritMarkerResult;
import com.nei10u.bazi.model.TenGod;
import com.nei10u.bazi.model.TenGodAnalysis;
import com.nei10u.bazi.rules.ZodiacRelations;
import lombok.Builder;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 事业、财运、婚姻、健康、人际五个方面的规则推断。
 */
@Component
public class LifeAspectAnalyzer {

    private static final Map<FiveElement, String> RISK_ORGANS = new EnumMap<>(FiveElement.class);

    static {
        RISK_ORGANS.put(FiveElement.WOOD, "肝胆");
        RISK_ORGANS.put(FiveElement.FIRE, "心血管");
        RISK_ORGANS.put(FiveElement.EARTH, "脾胃");
        RISK_ORGANS.put(FiveElement.METAL, "肺部");
        RISK_ORGANS.put(FiveElement.WATER, "肾脏");
    }

    public LifeAspects analyze(Inputs in) {
        return LifeAspects.builder()
                .career(career(in.getPattern(), in.getTenGods(), in.getPatternCareers()))
                .wealth(wealth(in.getTenGods()))
                .marriage(marriage(in.getTenGods(), in.getGender()))
                .health(health(in.getProfile()))
                .interpersonal(interpersonal(in.getZodiac(), in.getSpiritMarkers(), in.getZodiacRelations()))
                .build();
    }

    LifeAspects.Career career(PatternResult pattern, TenGodAnalysis tenGods,
                              Map<String, List<String>> patternCareers) {
        Set<String> fields = new LinkedHashSet<>(patternCareers.getOrDefault(pattern.getType(), List.of()));
        if (tenGods.count(TenGod.ZHENG_GUAN) > 0) {
            fields.add("政府机关/公职");
        }
        if (tenGods.count(TenGod.QI_SHA) > 0) {
            fields.add("军警/执法");
        }
        if (tenGods.count(TenGod.ZHENG_CAI) > 0) {
            fields.add("金融/会计");
        }
        if (tenGods.count(TenGod.SHI_SHEN, TenGod.SHANG_GUAN) > 0) {
            fields.add("教师/培训");
        }
        return new LifeAspects.Career(pattern.getType(), List.copyOf(fields), "适合稳定工作，发挥执行力优势");
    }

    LifeAspects.Wealth wealth(TenGodAnalysis tenGods) {
        String level = "中等";
        if (tenGods.count(TenGod.ZHENG_CAI) > 0) {
            level = "中等偏上";
        } else if (tenGods.count(TenGod.PIAN_CAI) > 0) {
            level = "较好";
        }
        String source = tenGods.count(TenGod.ZHENG_CAI) > 0 ? "正财(工资)" : "其他";
        return new LifeAspects.Wealth(level, source, "踏实工作，争取加薪");
    }

    /** 男命以正财为妻星，女命以正官为夫星。 */
    LifeAspects.Marriage marriage(TenGodAnalysis tenGods, Gender gender) {
        TenGod spouseStar = gender == Gender.MALE ? TenGod.ZHENG_CAI : TenGod.ZHENG_GUAN;
        String level = tenGods.count(spouseStar) > 0 ? "中等偏上" : "中等";
        return new LifeAspects.Marriage(level, spouseStar.label(), "28-32岁", "选择性格温和、包容心强的伴侣");
    }

    LifeAspects.Health health(ElementProfile profile) {
        List<String> risks = new ArrayList<>();
        for (FiveElement missing : profile.getMissing()) {
            risks.add(RISK_ORGANS.get(missing));
        }
        return new LifeAspects.Health("中等", List.copyOf(risks), "注意养生，定期体检");
    }

    LifeAspects.Interpersonal interpersonal(String zodiac, SpiritMarkerResult markers, ZodiacRelations relations) {
        Set<String> benefactors = new LinkedHashSet<>();
        for (SpiritMarker marker : markers.getAuspiciousDetails()) {
            benefactors.add(marker.getBranch().zodiac());
        }
        return LifeAspects.Interpersonal.builder()
                .zodiac(zodiac)
                .tripleHarmony(List.copyOf(relations.getTripleHarmony().getOrDefault(zodiac, List.of())))
                .sixHarmony(single(relations.getSixHarmony().get(zodiac)))
                .clash(single(relations.getClash().get(zodiac)))
                .harm(single(relations.getHarm().get(zodiac)))
                .benefactors(List.copyOf(benefactors))
                .advice("多与贵人交往，避开小人")
                .build();
    }

    private static List<String> single(String value) {
        return value == null || value.isBlank() ? List.of() : List.of(value);
    }

    /** 推断所需的上游结果。 */
    @Value
    @Builder
    public static class Inputs {
        PatternResult pattern;
        TenGodAnalysis tenGods;
        ElementProfile profile;
        SpiritMarkerResult spiritMarkers;
        Gender gender;
        String zodiac;
        Map<String, List<String>> patternCareers;
        ZodiacRelations zodiacRelations;
    }
}
