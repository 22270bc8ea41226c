package com.nei10u.bazi.engine;

import com.nei10u.bazi.model.EarthlyBranch;
import com.nei10u.bazi.model.FourPillarChart;
import com.nei10u.bazi.model.HeavenlyStem;
import com.nei10u.bazi.model.PillarPosition;
import com.nei10u.bazi.model.SpiritMarker;
import com.nei10u.bazi.model.SpiritMarkerResult;
import com.nei10u.bazi.model.SpiritMarkerType;
import com.nei10u.bazi.rules.SpiritMarkerTables;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 神煞。凶煞用固定表，吉神查规则库；各神煞互相独立。
 * 四柱一律按 年 → 月 → 日 → 时 扫描，除红鸾天喜外只记第一次命中。
 */
@Component
public class SpiritMarkerEngine {

    // 羊刃：日干帝旺之位
    private static final Map<HeavenlyStem, EarthlyBranch> YANG_REN = new EnumMap<>(HeavenlyStem.class);
    // 以下四表以年支三合局 / 方局为键
    private static final Map<EarthlyBranch, EarthlyBranch> JIE_SHA = new EnumMap<>(EarthlyBranch.class);
    private static final Map<EarthlyBranch, EarthlyBranch> ZAI_SHA = new EnumMap<>(EarthlyBranch.class);
    private static final Map<EarthlyBranch, EarthlyBranch> GU_CHEN = new EnumMap<>(EarthlyBranch.class);
    private static final Map<EarthlyBranch, EarthlyBranch> GUA_SU = new EnumMap<>(EarthlyBranch.class);

    private static final PillarPosition[] ALL_POSITIONS = PillarPosition.values();
    private static final PillarPosition[] NON_YEAR_POSITIONS = {
            PillarPosition.MONTH, PillarPosition.DAY, PillarPosition.HOUR
    };

    static {
        put(YANG_REN, "甲卯", "乙寅", "丙午", "丁巳", "戊午", "己巳", "庚酉", "辛申", "壬子", "癸亥");

        // 寅午戌见亥、巳酉丑见寅、申子辰见巳、亥卯未见申
        group(JIE_SHA, "寅午戌亥", "巳酉丑寅", "申子辰巳", "亥卯未申");
        // 寅午戌见子、巳酉丑见卯、申子辰见午、亥卯未见酉
        group(ZAI_SHA, "寅午戌子", "巳酉丑卯", "申子辰午", "亥卯未酉");
        // 寅卯辰见巳、巳午未见申、申酉戌见亥、亥子丑见寅
        group(GU_CHEN, "寅卯辰巳", "巳午未申", "申酉戌亥", "亥子丑寅");
        // 寅卯辰见丑、巳午未见辰、申酉戌见未、亥子丑见戌
        group(GUA_SU, "寅卯辰丑", "巳午未辰", "申酉戌未", "亥子丑戌");
    }

    public SpiritMarkerResult evaluate(FourPillarChart chart, SpiritMarkerTables tables) {
        HeavenlyStem dayStem = chart.getDayMaster();
        EarthlyBranch yearBranch = chart.getYear().getBranch();
        EarthlyBranch dayBranch = chart.getDay().getBranch();

        List<SpiritMarker> inauspicious = new ArrayList<>();
        firstMatch(chart, SpiritMarkerType.YANG_REN, is(YANG_REN.get(dayStem)), inauspicious);
        firstMatch(chart, SpiritMarkerType.JIE_SHA, is(JIE_SHA.get(yearBranch)), inauspicious);
        firstMatch(chart, SpiritMarkerType.ZAI_SHA, is(ZAI_SHA.get(yearBranch)), inauspicious);
        firstMatch(chart, SpiritMarkerType.GU_CHEN, is(GU_CHEN.get(yearBranch)), inauspicious);
        firstMatch(chart, SpiritMarkerType.GUA_SU, is(GUA_SU.get(yearBranch)), inauspicious);

        List<SpiritMarker> auspicious = new ArrayList<>();
        firstMatch(chart, SpiritMarkerType.TIAN_YI, in(tables.getTianYi().get(dayStem.label())), auspicious);
        firstMatch(chart, SpiritMarkerType.WEN_CHANG, is(tables.getWenChang().get(dayStem.label())), auspicious);

        // 红鸾天喜：以年支查月、日、时柱，每次命中都记录
        Predicate<EarthlyBranch> hongLuan = is(tables.getHongLuan().get(yearBranch.label()));
        Predicate<EarthlyBranch> tianXi = is(tables.getTianXi().get(yearBranch.label()));
        for (PillarPosition position : NON_YEAR_POSITIONS) {
            EarthlyBranch branch = chart.pillar(position).getBranch();
            if (hongLuan.test(branch)) {
                auspicious.add(new SpiritMarker(SpiritMarkerType.HONG_LUAN, position, branch));
            }
            if (tianXi.test(branch)) {
                auspicious.add(new SpiritMarker(SpiritMarkerType.TIAN_XI, position, branch));
            }
        }

        // 桃花：先以年支查，未见再以日支查
        boolean found = firstMatch(chart, SpiritMarkerType.TAO_HUA,
                in(tables.getTaoHua().get(yearBranch.label())), auspicious);
        if (!found) {
            firstMatch(chart, SpiritMarkerType.TAO_HUA, in(tables.getTaoHua().get(dayBranch.label())), auspicious);
        }

        return new SpiritMarkerResult(names(auspicious), names(inauspicious),
                List.copyOf(auspicious), List.copyOf(inauspicious));
    }

    private static boolean firstMatch(FourPillarChart chart, SpiritMarkerType type,
                                      Predicate<EarthlyBranch> target, List<SpiritMarker> out) {
        for (PillarPosition position : ALL_POSITIONS) {
            EarthlyBranch branch = chart.pillar(position).getBranch();
            if (target.test(branch)) {
                out.add(new SpiritMarker(type, position, branch));
                return true;
            }
        }
        return false;
    }

    private static List<String> names(List<SpiritMarker> markers) {
        Set<String> names = new LinkedHashSet<>();
        for (SpiritMarker marker : markers) {
            names.add(marker.getName());
        }
        return List.copyOf(names);
    }

    private static Predicate<EarthlyBranch> is(EarthlyBranch target) {
        return branch -> branch == target;
    }

    private static Predicate<EarthlyBranch> is(String label) {
        return branch -> branch.label().equals(label);
    }

    private static Predicate<EarthlyBranch> in(List<String> labels) {
        return branch -> labels != null && labels.contains(branch.label());
    }

    private static void put(Map<HeavenlyStem, EarthlyBranch> table, String... pairs) {
        for (String pair : pairs) {
            table.put(HeavenlyStem.fromLabel(pair.substring(0, 1)), EarthlyBranch.fromLabel(pair.substring(1)));
        }
    }

    /** 每组前三字为年支，末字为目标地支。 */
    private static void group(Map<EarthlyBranch, EarthlyBranch> table, String... groups) {
        for (String g : groups) {
            EarthlyBranch target = EarthlyBranch.fromLabel(g.substring(3));
            for (int i = 0; i < 3; i++) {
                table.put(EarthlyBranch.fromLabel(g.substring(i, i + 1)), target);
            }
        }
    }
}
