package com.nei10u.bazi.model;

public enum CycleEvaluation {
    FAVORABLE("吉"),
    NEUTRAL("平"),
    UNFAVORABLE("凶");

    private final String label;

    CycleEvaluation(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return label;
    }
}
