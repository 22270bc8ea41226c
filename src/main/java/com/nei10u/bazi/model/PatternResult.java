package com.nei10u.bazi.model;

import lombok.Builder;
import lombok.Value;

/**
 * 格局。普通格局时 monthTenGod 为月干十神，专旺格时为 null。
 */
@Value
@Builder
public class PatternResult {
    public static final String ORDINARY_PATTERN = "普通格局";

    String type;
    PatternCategory category;
    PatternLevel level;
    String description;
    TenGod monthTenGod;
}
