package com.nei10u.bazi.service;

import com.nei10u.bazi.exception.ReportGenerationException;
import com.nei10u.bazi.model.BaziAnalysis;
import com.nei10u.bazi.model.BaziReport;
import com.nei10u.bazi.model.ReportLevel;

/**
 * 根据分析结果生成文字报告。报告失败不影响已算出的分析结果。
 */
public interface ReportGenerator {

    BaziReport generate(BaziAnalysis analysis, ReportLevel level, String requestId) throws ReportGenerationException;
}
