package com.nei10u.bazi.model;

public enum PatternCategory {
    SPECIAL("专旺格"),
    ORDINARY("正格");

    private final String label;

    PatternCategory(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return label;
    }
}
