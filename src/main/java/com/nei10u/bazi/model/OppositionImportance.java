package com.nei10u.bazi.model;

public enum OppositionImportance {
    HIGHEST("最高"),
    HIGH("高"),
    MEDIUM("中");

    private final String label;

    OppositionImportance(String label) {
        this.label = label;
    }

    public static OppositionImportance of(PillarPosition position) {
        switch (position) {
            case DAY:
                return HIGHEST;
            case MONTH:
                return HIGH;
            default:
                return MEDIUM;
        }
    }

    @Override
    public String toString() {
        return label;
    }
}
