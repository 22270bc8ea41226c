package com.nei10u.bazi.rules;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/** 某个十神的正面 / 负面性格。 */
@Data
public class TraitRule {
    private List<String> positive = new ArrayList<>();
    private List<String> negative = new ArrayList<>();
}
