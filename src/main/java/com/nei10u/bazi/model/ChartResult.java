package com.nei10u.bazi.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 排盘结果：四柱 + 农历信息 + 实际用于排时柱的时间。
 */
@Value
@Builder
public class ChartResult {
    FourPillarChart chart;
    LunarInfo lunarInfo;
    LocalDateTime birthMoment;
    LocalDateTime chartMoment;
    boolean solarTimeCorrected;
    double longitude;
    double latitude;
}
