package com.nei10u.bazi.model;

/**
 * 旺衰等级，按分数下限（含）从高到低匹配。
 */
public enum StrengthLevel {
    VERY_STRONG("太旺", 80, StrengthStatus.STRONG),
    STRONG("偏旺", 65, StrengthStatus.STRONG),
    BALANCED("中和", 50, StrengthStatus.BALANCED),
    WEAK("偏弱", 35, StrengthStatus.WEAK),
    VERY_WEAK("太弱", Integer.MIN_VALUE, StrengthStatus.WEAK);

    private final String label;
    private final int lowerBound;
    private final StrengthStatus status;

    StrengthLevel(String label, int lowerBound, StrengthStatus status) {
        this.label = label;
        this.lowerBound = lowerBound;
        this.status = status;
    }

    public String label() {
        return label;
    }

    public StrengthStatus status() {
        return status;
    }

    public static StrengthLevel fromScore(int score) {
        for (StrengthLevel level : values()) {
            if (score >= level.lowerBound) {
                return level;
            }
        }
        return VERY_WEAK;
    }

    @Override
    public String toString() {
        return label;
    }
}
