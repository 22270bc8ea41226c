package com.nei10u.bazi.model;

import java.util.List;

import static com.nei10u.bazi.model.HeavenlyStem.BING;
import static com.nei10u.bazi.model.HeavenlyStem.DING;
import static com.nei10u.bazi.model.HeavenlyStem.GENG;
import static com.nei10u.bazi.model.HeavenlyStem.GUI;
import static com.nei10u.bazi.model.HeavenlyStem.JI;
import static com.nei10u.bazi.model.HeavenlyStem.JIA;
import static com.nei10u.bazi.model.HeavenlyStem.REN;
import static com.nei10u.bazi.model.HeavenlyStem.XIN;
import static com.nei10u.bazi.model.HeavenlyStem.YI;

/**
 * 十二地支，附五行、生肖与藏干（本气在前）。
 */
public enum EarthlyBranch {
    ZI("子", FiveElement.WATER, "鼠", List.of(GUI)),
    CHOU("丑", FiveElement.EARTH, "牛", List.of(JI, GUI, XIN)),
    YIN("寅", FiveElement.WOOD, "虎", List.of(JIA, BING, HeavenlyStem.WU)),
    MAO("卯", FiveElement.WOOD, "兔", List.of(YI)),
    CHEN("辰", FiveElement.EARTH, "龙", List.of(HeavenlyStem.WU, YI, GUI)),
    SI("巳", FiveElement.FIRE, "蛇", List.of(BING, HeavenlyStem.WU, GENG)),
    WU("午", FiveElement.FIRE, "马", List.of(DING, JI)),
    WEI("未", FiveElement.EARTH, "羊", List.of(JI, DING, YI)),
    SHEN("申", FiveElement.METAL, "猴", List.of(GENG, REN, HeavenlyStem.WU)),
    YOU("酉", FiveElement.METAL, "鸡", List.of(XIN)),
    XU("戌", FiveElement.EARTH, "狗", List.of(HeavenlyStem.WU, XIN, DING)),
    HAI("亥", FiveElement.WATER, "猪", List.of(REN, JIA));

    private final String label;
    private final FiveElement element;
    private final String zodiac;
    private final List<HeavenlyStem> hiddenStems;

    EarthlyBranch(String label, FiveElement element, String zodiac, List<HeavenlyStem> hiddenStems) {
        this.label = label;
        this.element = element;
        this.zodiac = zodiac;
        this.hiddenStems = hiddenStems;
    }

    public String label() {
        return label;
    }

    public int index() {
        return ordinal();
    }

    public FiveElement element() {
        return element;
    }

    public Polarity polarity() {
        return Polarity.ofIndex(ordinal());
    }

    public String zodiac() {
        return zodiac;
    }

    public List<HeavenlyStem> hiddenStems() {
        return hiddenStems;
    }

    /** 六冲：相隔六位。 */
    public EarthlyBranch clashPartner() {
        return of(ordinal() + 6);
    }

    public static EarthlyBranch of(int index) {
        return values()[Math.floorMod(index, 12)];
    }

    public static EarthlyBranch fromLabel(String label) {
        for (EarthlyBranch b : values()) {
            if (b.label.equals(label)) {
                return b;
            }
        }
        throw new IllegalArgumentException("未知地支: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
