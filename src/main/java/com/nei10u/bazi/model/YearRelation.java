package com.nei10u.bazi.model;

/**
 * 流年天干五行与参照五行（用神或忌神）的关系，degree 为 1..5 档。
 */
public enum YearRelation {
    GENERATES("流年生", "大吉", 5, "得力，运势极佳，贵人相助，事业顺利"),
    SAME("流年助", "吉", 4, "增强，运势上升，得朋友帮助"),
    NONE("无特殊关系", "平", 3, "运势平稳"),
    DRAINS("流年泄", "小凶", 2, "力量被泄，消耗较多，付出多收获少"),
    DESTROYS("流年克", "大凶", 1, "受制，运势低迷，事业受阻，易有灾祸");

    private final String relation;
    private final String verdict;
    private final int degree;
    private final String description;

    YearRelation(String relation, String verdict, int degree, String description) {
        this.relation = relation;
        this.verdict = verdict;
        this.degree = degree;
        this.description = description;
    }

    public String relation() {
        return relation;
    }

    public String verdict() {
        return verdict;
    }

    public int degree() {
        return degree;
    }

    public String description() {
        return description;
    }

    public static YearRelation between(FiveElement annual, FiveElement reference) {
        if (annual.generates() == reference) {
            return GENERATES;
        }
        if (annual.destroys() == reference) {
            return DESTROYS;
        }
        if (annual == reference) {
            return SAME;
        }
        if (reference.generates() == annual) {
            return DRAINS;
        }
        return NONE;
    }
}
