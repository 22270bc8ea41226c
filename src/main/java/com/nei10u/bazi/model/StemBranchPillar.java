package com.nei10u.bazi.model;

import lombok.Value;

import java.util.List;

/**
 * 一柱：天干 + 地支，附五行、阴阳与藏干。构造后不可变。
 */
@Value
public class StemBranchPillar {
    HeavenlyStem stem;
    EarthlyBranch branch;
    FiveElement stemElement;
    FiveElement branchElement;
    Polarity stemPolarity;
    List<HeavenlyStem> hiddenStems;

    public static StemBranchPillar of(HeavenlyStem stem, EarthlyBranch branch) {
        return new StemBranchPillar(stem, branch, stem.element(), branch.element(), stem.polarity(),
                branch.hiddenStems());
    }

    public static StemBranchPillar of(int stemIndex, int branchIndex) {
        return of(HeavenlyStem.of(stemIndex), EarthlyBranch.of(branchIndex));
    }

    /** 干支文本，如 "庚午"。 */
    public String getGanZhi() {
        return stem.label() + branch.label();
    }

    @Override
    public String toString() {
        return getGanZhi();
    }
}
