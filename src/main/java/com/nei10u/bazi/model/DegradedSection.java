package com.nei10u.bazi.model;

import lombok.Value;

/**
 * 某一分项因数据缺失而降级（使用空值或默认值）时的记录。
 */
@Value
public class DegradedSection {
    String section;
    String reason;
}
