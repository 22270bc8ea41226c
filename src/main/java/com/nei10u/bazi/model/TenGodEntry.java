package com.nei10u.bazi.model;

import lombok.Value;

@Value
public class TenGodEntry {
    PillarPosition position;
    StemSlot slot;
    HeavenlyStem stem;
    TenGod tenGod;
}
