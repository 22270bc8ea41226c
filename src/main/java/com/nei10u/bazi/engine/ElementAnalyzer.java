package com.nei10u.bazi.engine;

import com.nei10u.bazi.model.ElementAnalysis;
import com.nei10u.bazi.model.ElementProfile;
import com.nei10u.bazi.model.FavorableElementSet;
import com.nei10u.bazi.model.FiveElement;
import com.nei10u.bazi.model.FourPillarChart;
import com.nei10u.bazi.model.HeavenlyStem;
import com.nei10u.bazi.model.PillarPosition;
import com.nei10u.bazi.model.StemBranchPillar;
import com.nei10u.bazi.model.StrengthAssessment;
import com.nei10u.bazi.model.StrengthLevel;
import com.nei10u.bazi.model.StrengthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 五行统计、日主旺衰与喜用神。
 */
@Component
public class ElementAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ElementAnalyzer.class);

    /** 藏干权重 */
    public static final double HIDDEN_STEM_WEIGHT = 0.3;

    /** 占比低于 5% 视为缺失 */
    public static final double MISSING_SHARE = 0.05;

    public static final int BASE_SCORE = 50;
    public static final int SEASONAL_BONUS = 20;
    public static final int ROOTED_BONUS = 15;
    public static final int PEER_BONUS = 5;

    private static final PillarPosition[] PEER_POSITIONS = {
            PillarPosition.YEAR, PillarPosition.MONTH, PillarPosition.HOUR
    };

    public ElementAnalysis analyze(FourPillarChart chart) {
        ElementProfile profile = tally(chart);
        StrengthAssessment strength = assessStrength(chart);
        FavorableElementSet favorable = favorableElements(strength.getStatus(), chart.getDayMaster().element());
        log.debug("五行 {} 旺衰 {}({}) 用神 {}", profile.getWeightedCounts(), strength.getLevel(),
                strength.getScore(), favorable.getUseful());
        return new ElementAnalysis(profile, strength, favorable);
    }

    public ElementProfile tally(FourPillarChart chart) {
        Map<FiveElement, Double> counts = new EnumMap<>(FiveElement.class);
        Map<FiveElement, List<String>> positions = new EnumMap<>(FiveElement.class);
        Set<FiveElement> appearance = new LinkedHashSet<>();
        for (FiveElement e : FiveElement.values()) {
            counts.put(e, 0.0);
            positions.put(e, new ArrayList<>());
        }

        for (PillarPosition position : PillarPosition.values()) {
            StemBranchPillar pillar = chart.pillar(position);
            add(counts, positions, appearance, pillar.getStemElement(), 1.0,
                    position.label() + "天干" + pillar.getStem().label());
            add(counts, positions, appearance, pillar.getBranchElement(), 1.0,
                    position.label() + "地支" + pillar.getBranch().label());
            for (HeavenlyStem hidden : pillar.getHiddenStems()) {
                add(counts, positions, appearance, hidden.element(), HIDDEN_STEM_WEIGHT,
                        position.label() + "藏干" + hidden.label());
            }
        }

        double total = 0;
        for (double v : counts.values()) {
            total += v;
        }

        Map<FiveElement, Double> percentages = new EnumMap<>(FiveElement.class);
        List<FiveElement> missing = new ArrayList<>();
        for (FiveElement e : FiveElement.values()) {
            double count = counts.get(e);
            double share = total > 0 ? count / total : 0;
            percentages.put(e, Math.round(share * 10000) / 100.0);
            if (count == 0 || share < MISSING_SHARE) {
                missing.add(e);
            }
        }

        // 并列时按盘中首次出现的顺序（年→时，干→支→藏干）取先者，未出现的五行排在最后
        List<FiveElement> order = new ArrayList<>(appearance);
        for (FiveElement e : FiveElement.values()) {
            if (!appearance.contains(e)) {
                order.add(e);
            }
        }
        FiveElement most = order.get(0);
        FiveElement least = order.get(0);
        for (FiveElement e : order) {
            if (counts.get(e) > counts.get(most)) {
                most = e;
            }
            if (counts.get(e) < counts.get(least)) {
                least = e;
            }
        }

        Map<FiveElement, List<String>> frozenPositions = new EnumMap<>(FiveElement.class);
        positions.forEach((k, v) -> frozenPositions.put(k, List.copyOf(v)));

        return ElementProfile.builder()
                .weightedCounts(counts)
                .percentages(percentages)
                .positions(frozenPositions)
                .totalWeight(total)
                .mostRepresented(most)
                .leastRepresented(least)
                .missing(List.copyOf(missing))
                .build();
    }

    public StrengthAssessment assessStrength(FourPillarChart chart) {
        FiveElement self = chart.getDayMaster().element();

        // 得令：月令五行与日主相同
        boolean seasonal = chart.getMonth().getBranchElement() == self;

        // 得地：四柱地支或藏干中有日主五行
        boolean rooted = false;
        for (StemBranchPillar pillar : chart.pillars()) {
            if (pillar.getBranchElement() == self) {
                rooted = true;
            }
            for (HeavenlyStem hidden : pillar.getHiddenStems()) {
                if (hidden.element() == self) {
                    rooted = true;
                }
            }
        }

        // 得势：年、月、时柱的干支中与日主同五行者
        int peers = 0;
        for (PillarPosition position : PEER_POSITIONS) {
            StemBranchPillar pillar = chart.pillar(position);
            if (pillar.getStemElement() == self) {
                peers++;
            }
            if (pillar.getBranchElement() == self) {
                peers++;
            }
        }

        int score = BASE_SCORE
                + (seasonal ? SEASONAL_BONUS : 0)
                + (rooted ? ROOTED_BONUS : 0)
                + PEER_BONUS * peers;
        StrengthLevel level = StrengthLevel.fromScore(score);
        return StrengthAssessment.builder()
                .score(score)
                .level(level)
                .status(level.status())
                .seasonalSupport(seasonal)
                .rooted(rooted)
                .peerSupportCount(peers)
                .build();
    }

    /**
     * 身旺取克泄，身弱取生扶，中和不取。
     */
    public static FavorableElementSet favorableElements(StrengthStatus status, FiveElement self) {
        switch (status) {
            case STRONG:
                return new FavorableElementSet(
                        List.of(self.destroyedBy()),
                        List.of(self.generates()),
                        List.of(self.generatedBy()),
                        List.of(self));
            case WEAK:
                return new FavorableElementSet(
                        List.of(self.generatedBy(), self),
                        List.of(self.generatedBy()),
                        List.of(self.destroyedBy(), self.generates()),
                        // 生官杀者为财；生食伤者即日主本身，已在用神中，不重复归入仇神
                        List.of(self.destroys()));
            default:
                return FavorableElementSet.empty();
        }
    }

    private static void add(Map<FiveElement, Double> counts, Map<FiveElement, List<String>> positions,
                            Set<FiveElement> appearance, FiveElement element, double weight, String where) {
        counts.merge(element, weight, Double::sum);
        positions.get(element).add(where);
        appearance.add(element);
    }
}
