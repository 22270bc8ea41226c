package com.nei10u.bazi.model;

public enum PersonalityDimension {
    EXTRAVERSION("外向性"),
    RESPONSIBILITY("责任感"),
    EMOTIONAL_STABILITY("情绪稳定性"),
    OPENNESS("开放性"),
    AGREEABLENESS("宜人性"),
    EXECUTION("执行力"),
    LEADERSHIP("领导力"),
    CREATIVITY("创造力"),
    SOCIABILITY("社交能力"),
    LEARNING("学习能力");

    private final String label;

    PersonalityDimension(String label) {
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
