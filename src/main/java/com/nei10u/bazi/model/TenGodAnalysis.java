package com.nei10u.bazi.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class TenGodAnalysis {
    List<TenGodEntry> assignments;
    Map<TenGod, Double> distribution;
    Map<TenGod, List<String>> positions;
    List<TenGodCombination> combinations;

    public double count(TenGod tenGod) {
        return distribution.getOrDefault(tenGod, 0.0);
    }

    public double count(TenGod first, TenGod second) {
        return count(first) + count(second);
    }
}
