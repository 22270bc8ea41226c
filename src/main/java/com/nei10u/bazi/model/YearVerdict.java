package com.nei10u.bazi.model;

public enum YearVerdict {
    FAVORABLE("吉"),
    NEUTRAL("平"),
    UNFAVORABLE("凶");

    private final String label;

    YearVerdict(String label) {
        this.label = label;
    }

    /** 按十倍分值判断：≥40 吉，≥30 平。 */
    public static YearVerdict fromTenfoldScore(int tenfold) {
        if (tenfold >= 40) {
            return FAVORABLE;
        }
        if (tenfold >= 30) {
            return NEUTRAL;
        }
        return UNFAVORABLE;
    }

    @Override
    public String toString() {
        return label;
    }
}
