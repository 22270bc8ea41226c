package com.nei10u.bazi.model;

public enum PatternLevel {
    HIGH("高"),
    MEDIUM_HIGH("中高"),
    MEDIUM("中等");

    private final String label;

    PatternLevel(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return label;
    }
}
