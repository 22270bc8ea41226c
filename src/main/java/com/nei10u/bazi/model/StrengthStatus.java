package com.nei10u.bazi.model;

public enum StrengthStatus {
    STRONG("身旺"),
    BALANCED("中和"),
    WEAK("身弱");

    private final String label;

    StrengthStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
