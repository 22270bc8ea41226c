package com.nei10u.bazi.engine;

import com.nei10u.bazi.model.AnnualCycle;
import com.nei10u.bazi.model.EarthlyBranch;
import com.nei10u.bazi.model.FavorableElementSet;
import com.nei10u.bazi.model.FiveElement;
import com.nei10u.bazi.model.FourPillarChart;
import com.nei10u.bazi.model.OppositionHit;
import com.nei10u.bazi.model.OppositionImportance;
import com.nei10u.bazi.model.PillarPosition;
import com.nei10u.bazi.model.RelationAssessment;
import com.nei10u.bazi.model.StemBranchPillar;
import com.nei10u.bazi.model.YearRelation;
import com.nei10u.bazi.model.YearVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 流年：流年天干对用神、忌神的生克，加上流年地支对四柱地支的六冲。
 */
@Component
public class AnnualCycleEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AnnualCycleEvaluator.class);

    /** 综合分 = 0.6 × 用神档位 + 0.4 × 忌神档位，按十倍整数计算 */
    private static final int USEFUL_WEIGHT = 6;
    private static final int UNFAVORABLE_WEIGHT = 4;

    private static final Map<PillarPosition, String> CLASH_DESCRIPTIONS = new EnumMap<>(PillarPosition.class);

    static {
        CLASH_DESCRIPTIONS.put(PillarPosition.YEAR, "父母、祖辈有变动，可能搬迁或家庭变化");
        CLASH_DESCRIPTIONS.put(PillarPosition.MONTH, "工作变动、跳槽、升职降职、兄弟姐妹事");
        CLASH_DESCRIPTIONS.put(PillarPosition.DAY, "婚姻变动、离婚、结婚、配偶健康、搬家");
        CLASH_DESCRIPTIONS.put(PillarPosition.HOUR, "子女事、生育、子女离家、晚年变动");
    }

    public List<AnnualCycle> evaluateRange(FourPillarChart chart, FavorableElementSet favorable,
                                           int startYear, int years) {
        List<AnnualCycle> cycles = new ArrayList<>(years);
        for (int year = startYear; year < startYear + years; year++) {
            cycles.add(evaluate(chart, favorable, year));
        }
        return List.copyOf(cycles);
    }

    public AnnualCycle evaluate(FourPillarChart chart, FavorableElementSet favorable, int year) {
        StemBranchPillar pillar = SexagenaryCalculator.yearPillar(year);
        FiveElement annual = pillar.getStemElement();

        RelationAssessment useful = assessUseful(annual, favorable.primaryUseful());
        RelationAssessment unfavorable = assessUnfavorable(annual, favorable.primaryUnfavorable());
        List<OppositionHit> oppositions = oppositions(chart, pillar.getBranch());

        int tenfold = USEFUL_WEIGHT * useful.getDegree() + UNFAVORABLE_WEIGHT * unfavorable.getDegree();
        YearVerdict verdict = YearVerdict.fromTenfoldScore(tenfold);
        log.debug("流年 {} {} 用神{} 忌神{} -> {}", year, pillar, useful.getDegree(),
                unfavorable.getDegree(), verdict);

        return AnnualCycle.builder()
                .year(year)
                .pillar(pillar)
                .usefulAssessment(useful)
                .unfavorableAssessment(unfavorable)
                .oppositions(oppositions)
                .totalScore(tenfold / 10.0)
                .verdict(verdict)
                .build();
    }

    static RelationAssessment assessUseful(FiveElement annual, Optional<FiveElement> reference) {
        YearRelation relation = reference.map(r -> YearRelation.between(annual, r)).orElse(YearRelation.NONE);
        return new RelationAssessment(reference.map(FiveElement::label).orElse(null),
                describe(relation, "用神"), relation.verdict(), relation.degree(), relation.description());
    }

    /**
     * 忌神关系反着看：生忌神为凶，克忌神为吉，其余照用。
     */
    static RelationAssessment assessUnfavorable(FiveElement annual, Optional<FiveElement> reference) {
        YearRelation relation = reference.map(r -> YearRelation.between(annual, r)).orElse(YearRelation.NONE);
        String ref = reference.map(FiveElement::label).orElse(null);
        switch (relation) {
            case GENERATES:
                return new RelationAssessment(ref, "流年生忌神", "凶", 2, "忌神得力，运势差，易有灾祸");
            case DESTROYS:
                return new RelationAssessment(ref, "流年克忌神", "吉", 4, "忌神受制，运势转好，困扰减少");
            default:
                return new RelationAssessment(ref, describe(relation, "忌神"), relation.verdict(),
                        relation.degree(), relation.description());
        }
    }

    private static String describe(YearRelation relation, String target) {
        return relation == YearRelation.NONE ? relation.relation() : relation.relation() + target;
    }

    static List<OppositionHit> oppositions(FourPillarChart chart, EarthlyBranch annualBranch) {
        List<OppositionHit> hits = new ArrayList<>();
        for (PillarPosition position : PillarPosition.values()) {
            EarthlyBranch branch = chart.pillar(position).getBranch();
            if (branch.clashPartner() == annualBranch) {
                hits.add(new OppositionHit(position, branch, annualBranch,
                        OppositionImportance.of(position), CLASH_DESCRIPTIONS.get(position)));
            }
        }
        return List.copyOf(hits);
    }
}
