package com.nei10u.bazi.model;

public enum Polarity {
    YANG("阳"),
    YIN("阴");

    private final String label;

    Polarity(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    static Polarity ofIndex(int index) {
        return index % 2 == 0 ? YANG : YIN;
    }

    @Override
    public String toString() {
        return label;
    }
}
