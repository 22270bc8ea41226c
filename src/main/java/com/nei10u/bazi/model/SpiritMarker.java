package com.nei10u.bazi.model;

import lombok.Value;

/** 一次神煞命中：名称、所在柱位与命中的地支。 */
@Value
public class SpiritMarker {
    SpiritMarkerType type;
    PillarPosition position;
    EarthlyBranch branch;

    public String getName() {
        return type.label();
    }

    public String getDescription() {
        return type.description();
    }
}
