package com.nei10u.bazi.engine;

import com.nei10u.bazi.model.FavorableElementSet;
import com.nei10u.bazi.model.FiveElement;
import com.nei10u.bazi.model.StrengthStatus;
import com.nei10u.bazi.model.TenGod;
import com.nei10u.bazi.model.TenGodAnalysis;

import java.util.Optional;

/**
 * 性格评分规则可用的判定条件。"X旺且为用神" 指该组十神合计不少于 2，且其五行在用神之中。
 */
public enum PersonalityPredicate {
    OFFICER_STRONG_AND_USEFUL("官杀旺且为用神") {
        @Override
        public boolean test(TenGodAnalysis tenGods, FavorableElementSet favorable, StrengthStatus status,
                            FiveElement self) {
            return strongAndUseful(tenGods.count(TenGod.ZHENG_GUAN, TenGod.QI_SHA), self.destroyedBy(), favorable);
        }
    },
    PEER_STRONG_AND_USEFUL("比劫旺且为用神") {
        @Override
        public boolean test(TenGodAnalysis tenGods, FavorableElementSet favorable, StrengthStatus status,
                            FiveElement self) {
            return strongAndUseful(tenGods.count(TenGod.BI_JIAN, TenGod.JIE_CAI), self, favorable);
        }
    },
    OUTPUT_STRONG_AND_USEFUL("食伤旺且为用神") {
        @Override
        public boolean test(TenGodAnalysis tenGods, FavorableElementSet favorable, StrengthStatus status,
                            FiveElement self) {
            return strongAndUseful(tenGods.count(TenGod.SHI_SHEN, TenGod.SHANG_GUAN), self.generates(), favorable);
        }
    },
    RESOURCE_STRONG_AND_USEFUL("印星旺且为用神") {
        @Override
        public boolean test(TenGodAnalysis tenGods, FavorableElementSet favorable, StrengthStatus status,
                            FiveElement self) {
            return strongAndUseful(tenGods.count(TenGod.ZHENG_YIN, TenGod.PIAN_YIN), self.generatedBy(), favorable);
        }
    },
    WEALTH_STRONG_AND_USEFUL("财星旺且为用神") {
        @Override
        public boolean test(TenGodAnalysis tenGods, FavorableElementSet favorable, StrengthStatus status,
                            FiveElement self) {
            return strongAndUseful(tenGods.count(TenGod.ZHENG_CAI, TenGod.PIAN_CAI), self.destroys(), favorable);
        }
    },
    WEAK_SELF("身弱") {
        @Override
        public boolean test(TenGodAnalysis tenGods, FavorableElementSet favorable, StrengthStatus status,
                            FiveElement self) {
            return status == StrengthStatus.WEAK;
        }
    },
    STRONG_SELF("身旺") {
        @Override
        public boolean test(TenGodAnalysis tenGods, FavorableElementSet favorable, StrengthStatus status,
                            FiveElement self) {
            return status == StrengthStatus.STRONG;
        }
    },
    BALANCED_SELF("中和") {
        @Override
        public boolean test(TenGodAnalysis tenGods, FavorableElementSet favorable, StrengthStatus status,
                            FiveElement self) {
            return status == StrengthStatus.BALANCED;
        }
    };

    static final double STRONG_TALLY = 2.0;

    private final String label;

    PersonalityPredicate(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public abstract boolean test(TenGodAnalysis tenGods, FavorableElementSet favorable, StrengthStatus status,
                                 FiveElement self);

    public static Optional<PersonalityPredicate> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (PersonalityPredicate p : values()) {
            if (p.name().equalsIgnoreCase(name.trim()) || p.label.equals(name.trim())) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    private static boolean strongAndUseful(double tally, FiveElement element, FavorableElementSet favorable) {
        return tally >= STRONG_TALLY && favorable.getUseful().contains(element);
    }

    @Override
    public String toString() {
        return label;
    }
}
