package com.nei10u.bazi.engine;

import com.nei10u.bazi.model.EarthlyBranch;
import com.nei10u.bazi.model.FiveElement;
import com.nei10u.bazi.model.FourPillarChart;
import com.nei10u.bazi.model.HeavenlyStem;
import com.nei10u.bazi.model.PillarPosition;
import com.nei10u.bazi.model.Polarity;
import com.nei10u.bazi.model.StemBranchPillar;
import com.nei10u.bazi.model.StemSlot;
import com.nei10u.bazi.model.TenGod;
import com.nei10u.bazi.model.TenGodAnalysis;
import com.nei10u.bazi.model.TenGodCombination;
import com.nei10u.bazi.model.TenGodEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 十神判定与统计。
 */
@Component
public class TenGodClassifier {

    /** 地支本气计入十神统计的权重 */
    public static final double MAIN_HIDDEN_WEIGHT = 0.5;

    public static TenGod classify(HeavenlyStem dayMaster, HeavenlyStem candidate) {
        return classify(dayMaster.element(), dayMaster.polarity(), candidate.element(), candidate.polarity());
    }

    /**
     * 五行生克 + 阴阳异同 决定十神，十个天干对任一日主都有确定结果。
     */
    public static TenGod classify(FiveElement self, Polarity selfPolarity,
                                  FiveElement other, Polarity otherPolarity) {
        boolean same = selfPolarity == otherPolarity;
        if (other == self) {
            return same ? TenGod.BI_JIAN : TenGod.JIE_CAI;
        }
        if (self.generates() == other) {
            return same ? TenGod.SHI_SHEN : TenGod.SHANG_GUAN;
        }
        if (other.destroys() == self) {
            return same ? TenGod.QI_SHA : TenGod.ZHENG_GUAN;
        }
        if (self.destroys() == other) {
            return same ? TenGod.PIAN_CAI : TenGod.ZHENG_CAI;
        }
        if (other.generates() == self) {
            return same ? TenGod.PIAN_YIN : TenGod.ZHENG_YIN;
        }
        throw new IllegalStateException("五行关系无法归类: " + self + " / " + other);
    }

    public TenGodAnalysis analyze(FourPillarChart chart) {
        HeavenlyStem dayMaster = chart.getDayMaster();
        List<TenGodEntry> assignments = new ArrayList<>();
        Map<TenGod, Double> distribution = new EnumMap<>(TenGod.class);
        Map<TenGod, List<String>> positions = new EnumMap<>(TenGod.class);

        for (PillarPosition position : PillarPosition.values()) {
            StemBranchPillar pillar = chart.pillar(position);

            TenGod stemGod = classify(dayMaster, pillar.getStem());
            assignments.add(new TenGodEntry(position, StemSlot.STEM, pillar.getStem(), stemGod));
            distribution.merge(stemGod, 1.0, Double::sum);
            positions.computeIfAbsent(stemGod, k -> new ArrayList<>())
                    .add(position.label() + "天干" + pillar.getStem().label());

            EarthlyBranch branch = pillar.getBranch();
            List<HeavenlyStem> hidden = branch.hiddenStems();
            for (int i = 0; i < hidden.size(); i++) {
                TenGod hiddenGod = classify(dayMaster, hidden.get(i));
                assignments.add(new TenGodEntry(position, StemSlot.hidden(i), hidden.get(i), hiddenGod));
                if (i == 0) {
                    distribution.merge(hiddenGod, MAIN_HIDDEN_WEIGHT, Double::sum);
                    positions.computeIfAbsent(hiddenGod, k -> new ArrayList<>())
                            .add(position.label() + "地支" + branch.label() + "藏" + hidden.get(i).label());
                }
            }
        }

        return TenGodAnalysis.builder()
                .assignments(List.copyOf(assignments))
                .distribution(distribution)
                .positions(positions)
                .combinations(combinations(distribution))
                .build();
    }

    static List<TenGodCombination> combinations(Map<TenGod, Double> distribution) {
        List<TenGodCombination> found = new ArrayList<>();
        if (distribution.containsKey(TenGod.ZHENG_GUAN) && distribution.containsKey(TenGod.QI_SHA)) {
            found.add(new TenGodCombination("官杀混杂", false, "官杀并见，压力较大，做事易犹豫反复"));
        }
        if (distribution.containsKey(TenGod.SHI_SHEN) && distribution.containsKey(TenGod.SHANG_GUAN)) {
            found.add(new TenGodCombination("食伤泄秀", true, "才华横溢，表达能力强"));
        }
        return List.copyOf(found);
    }
}
