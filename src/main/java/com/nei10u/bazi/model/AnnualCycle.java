package com.nei10u.bazi.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/** 流年。 */
@Value
@Builder
public class AnnualCycle {
    int year;
    StemBranchPillar pillar;
    RelationAssessment usefulAssessment;
    RelationAssessment unfavorableAssessment;
    List<OppositionHit> oppositions;
    double totalScore;
    YearVerdict verdict;

    public String getGanZhi() {
        return pillar.getGanZhi();
    }

    public boolean isClashing() {
        return !oppositions.isEmpty();
    }
}
