package com.nei10u.bazi.model;

import lombok.Builder;
import lombok.Value;

/**
 * 核心排盘入口的输入。经纬度可缺省，此时按省市查表或使用基准经线。
 */
@Value
@Builder
public class BirthInput {
    int year;
    int month;
    int day;
    int hour;
    int minute;
    Gender gender;
    Double longitude;
    Double latitude;
    String province;
    String city;
    boolean trueSolarTime;
    Integer annualStartYear;
}
