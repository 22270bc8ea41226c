package com.nei10u.bazi.model;

/** 大运顺逆：阳男阴女顺排，阴男阳女逆排。 */
public enum CycleDirection {
    FORWARD("顺排", 1),
    REVERSE("逆排", -1);

    private final String label;
    private final int step;

    CycleDirection(String label, int step) {
        this.label = label;
        this.step = step;
    }

    public int step() {
        return step;
    }

    public static CycleDirection of(Polarity yearStemPolarity, Gender gender) {
        boolean yang = yearStemPolarity == Polarity.YANG;
        boolean male = gender == Gender.MALE;
        return yang == male ? FORWARD : REVERSE;
    }

    @Override
    public String toString() {
        return label;
    }
}
