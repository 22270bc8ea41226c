package com.nei10u.bazi.model;

/**
 * 四柱位置。声明顺序 年 → 月 → 日 → 时 也是所有"先命中者优先"扫描的顺序。
 */
public enum PillarPosition {
    YEAR("年柱"),
    MONTH("月柱"),
    DAY("日柱"),
    HOUR("时柱");

    private final String label;

    PillarPosition(String label) {
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
