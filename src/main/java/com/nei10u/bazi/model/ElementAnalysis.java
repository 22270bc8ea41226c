package com.nei10u.bazi.model;

import lombok.Value;

@Value
public class ElementAnalysis {
    ElementProfile profile;
    StrengthAssessment strength;
    FavorableElementSet favorable;
}
