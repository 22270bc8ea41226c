package com.nei10u.bazi.service;

import com.nei10u.bazi.engine.BaziEngine;
import com.nei10u.bazi.exception.ReportGenerationException;
import com.nei10u.bazi.exception.ResultWriteException;
import com.nei10u.bazi.model.BaziAnalysis;
import com.nei10u.bazi.model.BaziReport;
import com.nei10u.bazi.model.BaziRequest;
import com.nei10u.bazi.model.BaziResponse;
import com.nei10u.bazi.model.BirthInput;
import com.nei10u.bazi.model.Gender;
import com.nei10u.bazi.model.PersistenceOutcome;
import com.nei10u.bazi.model.ReportLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * 编排：核心分析 → （可选）报告 → （可选）落盘。
 * 核心分析先于、且独立于两个外部协作方完成，协作方失败不会使分析结果失效。
 */
@Service
public class BaziAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(BaziAnalysisService.class);

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    static final String GENERATED_BY = "bazi-agent";

    private final BaziEngine engine;
    private final ReportGenerator reportGenerator;
    private final PersistenceWriter persistenceWriter;
    private final AnalysisSessionCache sessionCache;

    @Value("${bazi.report.enabled:true}")
    private boolean reportEnabled = true;

    @Value("${bazi.report.default-level:detailed}")
    private String defaultReportLevel = "detailed";

    @Value("${bazi.output.enabled:true}")
    private boolean outputEnabled = true;

    @Value("${bazi.version:1.0.0}")
    private String version = "1.0.0";

    public BaziAnalysisService(BaziEngine engine, ReportGenerator reportGenerator,
                               PersistenceWriter persistenceWriter, AnalysisSessionCache sessionCache) {
        this.engine = engine;
        this.reportGenerator = reportGenerator;
        this.persistenceWriter = persistenceWriter;
        this.sessionCache = sessionCache;
    }

    /**
     * 全流程：一次性返回分析、报告与落盘结果。
     */
    public BaziResponse analyze(BaziRequest request) {
        long started = System.currentTimeMillis();
        String requestId = resolveRequestId(request);
        ReportLevel level = reportLevel(request);
        log.info("[{}] analyze start", requestId);

        BaziAnalysis analysis = engine.analyze(toBirthInput(request));
        sessionCache.upsertAnalysis(requestId, analysis);
        log.info("[{}] chart calculated: {}", requestId, analysis.getChart().getChart());

        BaziResponse response = newResponse(requestId, request, analysis);
        if (reportEnabled) {
            generateReport(response, analysis, level);
        }
        response.setMetadata(metadata(started));
        if (outputEnabled) {
            response.setPersistence(persist(response));
        }
        log.info("[{}] analyze done in {} ms", requestId, response.getMetadata().getExecutionMillis());
        return response;
    }

    /**
     * 仅排盘分析，结果写入缓存供 /report 复用。
     */
    public BaziResponse chart(BaziRequest request) {
        long started = System.currentTimeMillis();
        String requestId = resolveRequestId(request);
        log.info("[{}] step-chart start", requestId);
        BaziAnalysis analysis = engine.analyze(toBirthInput(request));
        sessionCache.upsertAnalysis(requestId, analysis);
        BaziResponse response = newResponse(requestId, request, analysis);
        response.setMetadata(metadata(started));
        log.info("[{}] step-chart done", requestId);
        return response;
    }

    /**
     * 生成报告。优先复用缓存的排盘结果，缓存未命中时补算。
     */
    public BaziResponse report(BaziRequest request) {
        long started = System.currentTimeMillis();
        String requestId = resolveRequestId(request);
        ReportLevel level = reportLevel(request);
        log.info("[{}] step-report start", requestId);
        BaziAnalysis analysis = sessionCache.get(requestId)
                .map(AnalysisSessionCache.CacheEntry::analysis)
                .orElse(null);
        if (analysis == null) {
            log.info("[{}] step-report cache miss, calculating chart", requestId);
            analysis = engine.analyze(toBirthInput(request));
            sessionCache.upsertAnalysis(requestId, analysis);
        }
        BaziReport report = reportGenerator.generate(analysis, level, requestId);
        sessionCache.upsertReport(requestId, report);

        BaziResponse response = newResponse(requestId, request, analysis);
        response.setReport(report);
        response.setMetadata(metadata(started));
        log.info("[{}] step-report done", requestId);
        return response;
    }

    /**
     * 请求 → 核心入参。性别、报告级别等在此校验，日期时间由排盘校验。
     */
    public static BirthInput toBirthInput(BaziRequest request) {
        return BirthInput.builder()
                .year(request.getYear())
                .month(request.getMonth())
                .day(request.getDay())
                .hour(request.getHour())
                .minute(request.getMinute())
                .gender(Gender.parse(request.getGender()))
                .longitude(request.getLongitude())
                .latitude(request.getLatitude())
                .province(request.getProvince())
                .city(request.getCity())
                .trueSolarTime(request.isTrueSolarTime())
                .annualStartYear(request.getAnnualStartYear())
                .build();
    }

    private ReportLevel reportLevel(BaziRequest request) {
        return ReportLevel.parse(request.getReportLevel(), ReportLevel.parse(defaultReportLevel, ReportLevel.DETAILED));
    }

    /**
     * 报告失败（未开启兜底）只记在响应上，排盘结果照常返回并落盘。
     */
    private void generateReport(BaziResponse response, BaziAnalysis analysis, ReportLevel level) {
        String requestId = response.getRequestId();
        try {
            BaziReport report = reportGenerator.generate(analysis, level, requestId);
            sessionCache.upsertReport(requestId, report);
            response.setReport(report);
            log.info("[{}] report generated fallback={}", requestId, report.isFallback());
        } catch (ReportGenerationException e) {
            log.warn("[{}] 报告生成失败，仅返回排盘结果: {}", requestId, e.getMessage());
            response.setReportError(e.getMessage());
        }
    }

    private PersistenceOutcome persist(BaziResponse response) {
        try {
            Path path = persistenceWriter.write(response);
            return PersistenceOutcome.written(path.toString());
        } catch (ResultWriteException e) {
            log.error("[{}] {}", response.getRequestId(), e.getMessage(), e);
            return PersistenceOutcome.failed(e.getMessage());
        }
    }

    private BaziResponse newResponse(String requestId, BaziRequest request, BaziAnalysis analysis) {
        BaziResponse response = new BaziResponse();
        response.setRequestId(requestId);
        response.setName(request.getName());
        response.setAnalysis(analysis);
        return response;
    }

    private BaziResponse.Metadata metadata(long startedMillis) {
        BaziResponse.Metadata metadata = new BaziResponse.Metadata();
        metadata.setVersion(version);
        metadata.setTimestamp(LocalDateTime.now().format(TIMESTAMP));
        metadata.setGeneratedBy(GENERATED_BY);
        metadata.setExecutionMillis(System.currentTimeMillis() - startedMillis);
        return metadata;
    }

    private String resolveRequestId(BaziRequest request) {
        if (request.getRequestId() != null && !request.getRequestId().isBlank()) {
            return request.getRequestId();
        }
        String rid = UUID.randomUUID().toString();
        request.setRequestId(rid);
        return rid;
    }
}
