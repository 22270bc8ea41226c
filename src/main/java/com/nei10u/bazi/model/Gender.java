package com.nei10u.bazi.model;

import com.nei10u.bazi.exception.InvalidInputException;

public enum Gender {
    MALE("男"),
    FEMALE("女");

    private final String label;

    Gender(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * 解析请求中的性别，接受 "男"/"女" 以及 male/female（不区分大小写）。
     */
    public static Gender parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidInputException("缺少性别");
        }
        String v = raw.trim();
        if ("男".equals(v) || "male".equalsIgnoreCase(v) || "m".equalsIgnoreCase(v)) {
            return MALE;
        }
        if ("女".equals(v) || "female".equalsIgnoreCase(v) || "f".equalsIgnoreCase(v)) {
            return FEMALE;
        }
        throw new InvalidInputException("性别只能是 男/女: " + raw);
    }

    @Override
    public String toString() {
        return label;
    }
}
