package com.nei10u.bazi.model;

import lombok.Builder;
import lombok.Value;

/** 一步大运（十年）。 */
@Value
@Builder
public class MajorCycle {
    int step;
    StemBranchPillar pillar;
    int startAge;
    int endAge;
    int startYear;
    int endYear;
    CycleEvaluation evaluation;

    public String getGanZhi() {
        return pillar.getGanZhi();
    }

    public String getAgeRange() {
        return startAge + "-" + endAge + "岁";
    }
}
