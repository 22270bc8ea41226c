package com.nei10u.bazi.model;

import lombok.Builder;
import lombok.Value;

/**
 * 日主旺衰。score 只由 得令/得地/得势 三个信号决定。
 */
@Value
@Builder
public class StrengthAssessment {
    int score;
    StrengthLevel level;
    StrengthStatus status;
    boolean seasonalSupport; // 得令
    boolean rooted;          // 得地
    int peerSupportCount;    // 得势
}
