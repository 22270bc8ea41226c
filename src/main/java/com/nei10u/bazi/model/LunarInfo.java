package com.nei10u.bazi.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LunarInfo {
    int lunarYear;
    int lunarMonth;
    int lunarDay;
    boolean leapMonth;
    String lunarDate;      // 农历文本
    String zodiac;         // 生肖
    String constellation;  // 星座
    String season;         // 出生季节
    String birthSolarTerm; // 近似节气
    String monthCommand;   // 月令，如 "寅木"
}
