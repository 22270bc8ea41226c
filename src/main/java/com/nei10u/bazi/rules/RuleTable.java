package com.nei10u.bazi.rules;

import lombok.Value;

/**
 * 一张规则表的加载结果。EMPTY 表示没有数据，FAILED 表示文件存在但解析失败；
 * 两种情况下 data 都是该类别的空值，调用方照常使用即可。
 */
@Value
public class RuleTable<T> {

    public enum Status {
        LOADED,
        EMPTY,
        FAILED
    }

    RuleCategory category;
    Status status;
    T data;
    String reason;

    public static <T> RuleTable<T> loaded(RuleCategory category, T data) {
        return new RuleTable<>(category, Status.LOADED, data, null);
    }

    public static <T> RuleTable<T> empty(RuleCategory category, T emptyData, String reason) {
        return new RuleTable<>(category, Status.EMPTY, emptyData, reason);
    }

    public static <T> RuleTable<T> failed(RuleCategory category, T emptyData, String reason) {
        return new RuleTable<>(category, Status.FAILED, emptyData, reason);
    }

    public boolean isLoaded() {
        return status == Status.LOADED;
    }
}
