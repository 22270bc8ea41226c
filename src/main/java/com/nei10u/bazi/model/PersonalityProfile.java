package com.nei10u.bazi.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class PersonalityProfile {
    List<String> coreTraits;
    List<String> strengths;
    List<String> weaknesses;
    Map<PersonalityDimension, DimensionScore> scores;
}
