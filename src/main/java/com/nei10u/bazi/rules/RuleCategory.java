package com.nei10u.bazi.rules;

/**
 * 规则表分类及其对应的资源文件名。
 */
public enum RuleCategory {
    TEN_GOD_TRAITS("十神性格特征", "ten-god-personality.json"),
    PATTERN_CAREERS("格局职业倾向", "pattern-career.json"),
    SPIRIT_MARKERS("神煞规则", "spirit-markers.json"),
    PERSONALITY_SCORING("性格维度评分", "personality-scoring.json"),
    ZODIAC_RELATIONS("生肖关系", "zodiac-relations.json");

    private final String label;
    private final String fileName;

    RuleCategory(String label, String fileName) {
        this.label = label;
        this.fileName = fileName;
    }

    public String label() {
        return label;
    }

    public String fileName() {
        return fileName;
    }

    @Override
    public String toString() {
        return label;
    }
}
