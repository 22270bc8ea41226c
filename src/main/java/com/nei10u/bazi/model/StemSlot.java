package com.nei10u.bazi.model;

/** 一柱内可出现天干的位置。 */
public enum StemSlot {
    STEM("天干"),
    HIDDEN_MAIN("本气"),
    HIDDEN_MIDDLE("中气"),
    HIDDEN_RESIDUAL("余气");

    private final String label;

    StemSlot(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static StemSlot hidden(int order) {
        return values()[order + 1];
    }

    @Override
    public String toString() {
        return label;
    }
}
