package com.nei10u.bazi.model;

import com.nei10u.bazi.exception.InvalidInputException;

/** 报告详略程度。 */
public enum ReportLevel {
    SIMPLE("simple", "简洁"),
    NORMAL("normal", "标准"),
    DETAILED("detailed", "详细"),
    COMPREHENSIVE("comprehensive", "全面深入");

    private final String code;
    private final String label;

    ReportLevel(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    public static ReportLevel parse(String raw, ReportLevel defaultLevel) {
        if (raw == null || raw.isBlank()) {
            return defaultLevel;
        }
        for (ReportLevel level : values()) {
            if (level.code.equalsIgnoreCase(raw.trim()) || level.label.equals(raw.trim())) {
                return level;
            }
        }
        throw new InvalidInputException("未知的报告级别: " + raw);
    }

    @Override
    public String toString() {
        return code;
    }
}
