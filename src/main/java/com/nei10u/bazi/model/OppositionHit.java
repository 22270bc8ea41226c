package com.nei10u.bazi.model;

import lombok.Value;

/** 流年地支冲命局某柱地支。 */
@Value
public class OppositionHit {
    PillarPosition position;
    EarthlyBranch chartBranch;
    EarthlyBranch annualBranch;
    OppositionImportance importance;
    String description;
}
