package com.nei10u.bazi.model;

import lombok.Value;

import java.util.List;

/**
 * 神煞结果。名称列表按名称去重，明细保留每一次命中。
 */
@Value
public class SpiritMarkerResult {
    List<String> auspiciousNames;
    List<String> inauspiciousNames;
    List<SpiritMarker> auspiciousDetails;
    List<SpiritMarker> inauspiciousDetails;

    public boolean has(SpiritMarkerType type) {
        return (type.auspicious() ? auspiciousNames : inauspiciousNames).contains(type.label());
    }
}
