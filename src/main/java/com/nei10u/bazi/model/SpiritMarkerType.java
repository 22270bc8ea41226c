package com.nei10u.bazi.model;

/**
 * 神煞。前五个为凶煞，按固定表计算；其余为吉神，查规则库。
 */
public enum SpiritMarkerType {
    YANG_REN("羊刃", false, "刚烈冲动，易有血光，需注意安全"),
    JIE_SHA("劫煞", false, "破财损失，易有意外支出，需谨慎理财"),
    ZAI_SHA("灾煞", false, "易有疾病灾难，注意健康安全"),
    GU_CHEN("孤辰", false, "性格孤僻，六亲缘薄，容易孤独"),
    GUA_SU("寡宿", false, "性格孤僻，六亲缘薄，容易孤独"),
    TIAN_YI("天乙贵人", true, "逢凶化吉，遇难呈祥"),
    WEN_CHANG("文昌贵人", true, "聪明智慧，利于学业"),
    HONG_LUAN("红鸾", true, "婚姻喜庆，利于结婚"),
    TIAN_XI("天喜", true, "喜庆吉祥，有喜事"),
    TAO_HUA("桃花", true, "异性缘，需谨慎");

    private final String label;
    private final boolean auspicious;
    private final String description;

    SpiritMarkerType(String label, boolean auspicious, String description) {
        this.label = label;
        this.auspicious = auspicious;
        this.description = description;
    }

    public String label() {
        return label;
    }

    public boolean auspicious() {
        return auspicious;
    }

    public String description() {
        return description;
    }

    @Override
    public String toString() {
        return label;
    }
}
