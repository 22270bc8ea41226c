package com.nei10u.bazi.rules;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 性格维度评分规则的一行。predicate 为 {@code PersonalityPredicate} 的枚举名，
 * condition 只是展示用的原文描述。
 */
@Data
public class ScoringRule {
    private String predicate;
    private String condition;
    private List<Integer> scoreRange = new ArrayList<>();
    private String reason;
}
