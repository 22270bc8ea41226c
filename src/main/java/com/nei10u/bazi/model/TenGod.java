package com.nei10u.bazi.model;

/**
 * 十神。同五行为比劫，我生为食伤，克我为官杀，我克为财，生我为印；
 * 每组前者与日主同阴阳，后者异阴阳。
 */
public enum TenGod {
    BI_JIAN("比肩"),
    JIE_CAI("劫财"),
    SHI_SHEN("食神"),
    SHANG_GUAN("伤官"),
    QI_SHA("七杀"),
    ZHENG_GUAN("正官"),
    PIAN_CAI("偏财"),
    ZHENG_CAI("正财"),
    PIAN_YIN("偏印"),
    ZHENG_YIN("正印");

    private final String label;

    TenGod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static TenGod fromLabel(String label) {
        for (TenGod g : values()) {
            if (g.label.equals(label)) {
                return g;
            }
        }
        throw new IllegalArgumentException("未知十神: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
