package com.nei10u.bazi.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class ElementProfile {
    Map<FiveElement, Double> weightedCounts;
    Map<FiveElement, Double> percentages;
    Map<FiveElement, List<String>> positions;
    double totalWeight;
    FiveElement mostRepresented;
    FiveElement leastRepresented;
    List<FiveElement> missing;

    public double share(FiveElement element) {
        if (totalWeight <= 0) {
            return 0;
        }
        return weightedCounts.getOrDefault(element, 0.0) / totalWeight;
    }
}
