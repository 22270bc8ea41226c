package com.nei10u.bazi.model;

/**
 * 十天干。五行按两两一组依次为木火土金水，偶数位为阳干。
 */
public enum HeavenlyStem {
    JIA("甲"),
    YI("乙"),
    BING("丙"),
    DING("丁"),
    WU("戊"),
    JI("己"),
    GENG("庚"),
    XIN("辛"),
    REN("壬"),
    GUI("癸");

    private final String label;

    HeavenlyStem(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public int index() {
        return ordinal();
    }

    public FiveElement element() {
        return FiveElement.values()[ordinal() / 2];
    }

    public Polarity polarity() {
        return Polarity.ofIndex(ordinal());
    }

    /** 按序号取干，序号按 10 取模（可为负）。 */
    public static HeavenlyStem of(int index) {
        return values()[Math.floorMod(index, 10)];
    }

    public static HeavenlyStem fromLabel(String label) {
        for (HeavenlyStem s : values()) {
            if (s.label.equals(label)) {
                return s;
            }
        }
        throw new IllegalArgumentException("未知天干: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
