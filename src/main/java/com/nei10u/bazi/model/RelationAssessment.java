package com.nei10u.bazi.model;

import lombok.Value;

/** 流年对用神 / 忌神的作用判断。 */
@Value
public class RelationAssessment {
    String reference;
    String relation;
    String verdict;
    int degree;
    String description;
}
