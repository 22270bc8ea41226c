package com.nei10u.bazi.model;

import lombok.Value;

/** 结果落盘情况。失败不影响分析结果本身。 */
@Value
public class PersistenceOutcome {
    boolean success;
    String path;
    String error;

    public static PersistenceOutcome written(String path) {
        return new PersistenceOutcome(true, path, null);
    }

    public static PersistenceOutcome failed(String error) {
        return new PersistenceOutcome(false, null, error);
    }
}
