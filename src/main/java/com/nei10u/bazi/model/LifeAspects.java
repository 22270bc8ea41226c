package com.nei10u.bazi.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 事业、财运、婚姻、健康、人际。
 */
@Value
@Builder
public class LifeAspects {
    Career career;
    Wealth wealth;
    Marriage marriage;
    Health health;
    Interpersonal interpersonal;

    @Value
    public static class Career {
        String patternType;
        List<String> suitableFields;
        String advice;
    }

    @Value
    public static class Wealth {
        String level;
        String mainSource;
        String advice;
    }

    @Value
    public static class Marriage {
        String level;
        String spouseStar;
        String bestAge;
        String advice;
    }

    @Value
    public static class Health {
        String constitution;
        List<String> riskParts;
        String advice;
    }

    @Value
    @Builder
    public static class Interpersonal {
        String zodiac;
        List<String> tripleHarmony;
        List<String> sixHarmony;
        List<String> clash;
        List<String> harm;
        List<String> benefactors;
        String advice;
    }
}
