package com.nei10u.bazi.engine;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 提供出生时刻前后的"节"（十二个月令交接的节气）。
 */
public interface SolarTermSource {

    /**
     * @return 覆盖出生年份的节及其交节时刻，顺序不限；查不到时返回空列表
     */
    List<Term> jieTermsAround(LocalDateTime birth);

    record Term(String name, LocalDateTime moment) {
    }
}
