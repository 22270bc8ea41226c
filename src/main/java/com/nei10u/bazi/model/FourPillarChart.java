package com.nei10u.bazi.model;

import lombok.Value;

import java.util.List;

/**
 * 四柱命盘。日柱天干即日主，所有十神关系都以它为参照。
 */
@Value
public class FourPillarChart {
    StemBranchPillar year;
    StemBranchPillar month;
    StemBranchPillar day;
    StemBranchPillar hour;

    public HeavenlyStem getDayMaster() {
        return day.getStem();
    }

    public StemBranchPillar pillar(PillarPosition position) {
        switch (position) {
            case YEAR:
                return year;
            case MONTH:
                return month;
            case DAY:
                return day;
            default:
                return hour;
        }
    }

    /** 按 年、月、日、时 顺序。 */
    public List<StemBranchPillar> pillars() {
        return List.of(year, month, day, hour);
    }

    public List<EarthlyBranch> branches() {
        return List.of(year.getBranch(), month.getBranch(), day.getBranch(), hour.getBranch());
    }

    @Override
    public String toString() {
        return year + " " + month + " " + day + " " + hour;
    }
}
