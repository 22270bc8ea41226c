package com.nei10u.bazi.model;

/**
 * 五行。声明顺序即相生顺序：木 → 火 → 土 → 金 → 水 → 木。
 * 相克隔一位：木克土、火克金、土克水、金克木、水克火。
 */
public enum FiveElement {
    WOOD("木"),
    FIRE("火"),
    EARTH("土"),
    METAL("金"),
    WATER("水");

    private final String label;

    FiveElement(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** 我生者 */
    public FiveElement generates() {
        return shift(1);
    }

    /** 生我者 */
    public FiveElement generatedBy() {
        return shift(4);
    }

    /** 我克者 */
    public FiveElement destroys() {
        return shift(2);
    }

    /** 克我者 */
    public FiveElement destroyedBy() {
        return shift(3);
    }

    public static FiveElement fromLabel(String label) {
        for (FiveElement e : values()) {
            if (e.label.equals(label)) {
                return e;
            }
        }
        throw new IllegalArgumentException("未知五行: " + label);
    }

    private FiveElement shift(int steps) {
        FiveElement[] all = values();
        return all[(ordinal() + steps) % all.length];
    }

    @Override
    public String toString() {
        return label;
    }
}
