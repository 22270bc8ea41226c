package com.nei10u.bazi.model;

import lombok.Value;

@Value
public class DimensionScore {
    double score;
    String level;
    /** 命中的判定条件，未命中任何规则时为 null。 */
    String matchedPredicate;
    String reason;
}
