package com.nei10u.bazi.model;

import lombok.Value;

@Value
public class TenGodCombination {
    String name;
    boolean auspicious;
    String description;
}
