package com.nei10u.bazi.model;

import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * 用神 / 喜神 / 忌神 / 仇神。中和时四组均为空。
 */
@Value
public class FavorableElementSet {
    private static final FavorableElementSet EMPTY =
            new FavorableElementSet(List.of(), List.of(), List.of(), List.of());

    List<FiveElement> useful;
    List<FiveElement> supportive;
    List<FiveElement> unfavorable;
    List<FiveElement> hostile;

    public static FavorableElementSet empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return useful.isEmpty() && supportive.isEmpty() && unfavorable.isEmpty() && hostile.isEmpty();
    }

    public Optional<FiveElement> primaryUseful() {
        return useful.isEmpty() ? Optional.empty() : Optional.of(useful.get(0));
    }

    public Optional<FiveElement> primaryUnfavorable() {
        return unfavorable.isEmpty() ? Optional.empty() : Optional.of(unfavorable.get(0));
    }
}
