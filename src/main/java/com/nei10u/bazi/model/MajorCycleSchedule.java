package com.nei10u.bazi.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class MajorCycleSchedule {
    CycleDirection direction;
    int startAgeYears;
    int startAgeMonths;
    LocalDate startDate;
    /** 起运所依据的节，查不到时为 null 并按 1 岁起运。 */
    String governingTerm;
    boolean fallbackUsed;
    List<MajorCycle> cycles;
}
