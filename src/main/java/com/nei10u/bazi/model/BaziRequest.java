package com.nei10u.bazi.model;

import lombok.Data;

@Data
public class BaziRequest {
    private String requestId;
    private String name;
    private int year;
    private int month;
    private int day;
    private int hour;
    private int minute;
    private String gender;         // "男" / "女"，也接受 male / female
    private String province;       // 出生省份
    private String city;           // 出生城市
    private Double longitude;      // 经度，可选，优先于省市
    private Double latitude;       // 纬度，可选
    private boolean trueSolarTime; // 是否按真太阳时排时柱
    private Integer annualStartYear; // 流年起始年份，缺省为出生年
    private String reportLevel;    // simple / normal / detailed / comprehensive
}
