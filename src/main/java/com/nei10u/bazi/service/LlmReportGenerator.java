package com.nei10u.bazi.service;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONReader;
import com.nei10u.bazi.exception.ReportGenerationException;
import com.nei10u.bazi.model.BaziAnalysis;
import com.nei10u.bazi.model.BaziReport;
import com.nei10u.bazi.model.ElementAnalysis;
import com.nei10u.bazi.model.FourPillarChart;
import com.nei10u.bazi.model.MajorCycle;
import com.nei10u.bazi.model.ReportLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.stream.Collectors;

/**
 * 通过 OpenAI 兼容接口（OpenRouter 等）生成命理报告，使用 fastjson2 解析模型输出。
 */
@Service
public class LlmReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(LlmReportGenerator.class);

    private static final JSONReader.Feature[] JSON_FEATURES = new JSONReader.Feature[]{
            JSONReader.Feature.SupportSmartMatch
    };

    private static final String REPORT_SCHEMA_HINT = """
            {
              "comprehensive": "",
              "career": "",
              "wealth": "",
              "marriage": "",
              "health": "",
              "suggestions": ["", ""]
            }
            """;

    private final ChatClient chatClient;
    private final boolean fallbackEnabled;
    private final int maxRetries;
    private final long retryDelayMillis;

    public LlmReportGenerator(ChatClient.Builder builder,
                              @Value("${bazi.report.fallback-enabled:true}") boolean fallbackEnabled,
                              @Value("${bazi.report.max-retries:2}") int maxRetries,
                              @Value("${bazi.report.retry-delay-ms:1000}") long retryDelayMillis) {
        this.chatClient = builder.build();
        this.fallbackEnabled = fallbackEnabled;
        this.maxRetries = maxRetries;
        this.retryDelayMillis = retryDelayMillis;
    }

    @Override
    public BaziReport generate(BaziAnalysis analysis, ReportLevel level, String requestId) {
        String prompt = buildPrompt(analysis, level);
        try {
            String raw = callWithRetry(prompt, requestId);
            log.info("[{}] report raw: {}", requestId, abbreviate(raw));
            BaziReport parsed = parseWithFastjson(raw);
            if (parsed == null) {
                // 模型没按 JSON 输出时，整段文字作为综合分析
                log.warn("[{}] report 非 JSON 输出，按纯文本处理", requestId);
                parsed = new BaziReport();
                parsed.setComprehensive(raw.trim());
            }
            parsed.setLevel(level.code());
            return ensureSections(parsed, null);
        } catch (ReportGenerationException e) {
            log.error("[{}] {}", requestId, e.getMessage(), e);
            if (!fallbackEnabled) {
                throw e;
            }
            BaziReport fallback = ensureSections(new BaziReport(), e.getMessage());
            fallback.setLevel(level.code());
            fallback.setFallback(true);
            return fallback;
        }
    }

    String buildPrompt(BaziAnalysis analysis, ReportLevel level) {
        FourPillarChart chart = analysis.getChart().getChart();
        ElementAnalysis elements = analysis.getElements();
        String cycles = analysis.getMajorCycles().getCycles().stream()
                .map(c -> c.getGanZhi() + "(" + c.getAgeRange() + "," + c.getEvaluation() + ")")
                .collect(Collectors.joining("、"));
        MajorCycle first = analysis.getMajorCycles().getCycles().get(0);

        return String.format("""
                        你是一位资深的命理分析专家，请根据以下八字信息，生成一份专业的命理分析报告。

                        性别：%s
                        出生时间：%s
                        八字：年柱%s 月柱%s 日柱%s 时柱%s（日主%s）
                        五行：最旺%s，缺失%s
                        日主旺衰：%s（%d分），用神%s，忌神%s
                        格局：%s（%s，层次%s）
                        吉神：%s；凶煞：%s
                        大运：%s起运（%d岁%d个月，首运%s）；%s

                        请生成一份%s的命理分析报告，包括：
                        1. 综合分析（性格、能力、运势）
                        2. 事业、财运、婚姻、健康分项解读
                        3. 个性化建议

                        要求：语言专业但易懂，内容积极正面，避免绝对化表述，提供实用建议。
                        必须严格返回 JSON，不要包含 Markdown、额外引号或注释。

                        输出格式示例（严格遵守键名与结构）：
                        %s
                        """,
                analysis.getInput().getGender(),
                analysis.getChart().getBirthMoment(),
                chart.getYear(), chart.getMonth(), chart.getDay(), chart.getHour(), chart.getDayMaster(),
                elements.getProfile().getMostRepresented(), elements.getProfile().getMissing(),
                elements.getStrength().getLevel(), elements.getStrength().getScore(),
                elements.getFavorable().getUseful(), elements.getFavorable().getUnfavorable(),
                analysis.getPattern().getType(), analysis.getPattern().getCategory(), analysis.getPattern().getLevel(),
                analysis.getSpiritMarkers().getAuspiciousNames(), analysis.getSpiritMarkers().getInauspiciousNames(),
                analysis.getMajorCycles().getDirection(), analysis.getMajorCycles().getStartAgeYears(),
                analysis.getMajorCycles().getStartAgeMonths(), first.getGanZhi(), cycles,
                level.label(),
                REPORT_SCHEMA_HINT);
    }

    private String callWithRetry(String prompt, String requestId) {
        RuntimeException last = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                String raw = chatClient.prompt().user(prompt).call().content();
                if (StringUtils.hasText(raw)) {
                    return raw;
                }
                last = new IllegalStateException("模型返回空内容");
            } catch (RuntimeException e) {
                last = e;
            }
            log.warn("[{}] 报告生成失败 (尝试 {}/{}): {}", requestId, attempt + 1, maxRetries + 1, last.getMessage());
            if (attempt < maxRetries) {
                pause(retryDelayMillis * (attempt + 1));
            }
        }
        throw new ReportGenerationException("AI 报告生成失败（请检查 OpenRouter API Key / 模型配额）: "
                + last.getMessage(), last);
    }

    private void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReportGenerationException("报告生成被中断", e);
        }
    }

    private BaziReport parseWithFastjson(String raw) {
        String normalized = normalizeJson(raw);
        if (!normalized.startsWith("{")) {
            return null;
        }
        try {
            return JSON.parseObject(normalized, BaziReport.class, JSON_FEATURES);
        } catch (Exception ex) {
            log.warn("fastjson2 解析失败 (BaziReport): {}", ex.getMessage());
            return null;
        }
    }

    static String normalizeJson(String raw) {
        if (!StringUtils.hasText(raw)) {
            return "";
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("```")) {
            int start = trimmed.indexOf('{');
            int end = trimmed.lastIndexOf('}');
            if (start >= 0 && end > start) {
                return trimmed.substring(start, end + 1);
            }
        }
        int first = trimmed.indexOf('{');
        int last = trimmed.lastIndexOf('}');
        if (first >= 0 && last > first) {
            return trimmed.substring(first, last + 1);
        }
        return trimmed;
    }

    private String abbreviate(String raw) {
        if (raw == null) {
            return "";
        }
        String clean = raw.replaceAll("\\s+", " ");
        return clean.length() > 200 ? clean.substring(0, 200) + "..." : clean;
    }

    private BaziReport ensureSections(BaziReport report, String fallbackMessage) {
        String filler = StringUtils.hasText(fallbackMessage) ? fallbackMessage : "";
        if (!StringUtils.hasText(report.getComprehensive())) {
            report.setComprehensive(filler);
        }
        if (!StringUtils.hasText(report.getCareer())) {
            report.setCareer(filler);
        }
        if (!StringUtils.hasText(report.getWealth())) {
            report.setWealth(filler);
        }
        if (!StringUtils.hasText(report.getMarriage())) {
            report.setMarriage(filler);
        }
        if (!StringUtils.hasText(report.getHealth())) {
            report.setHealth(filler);
        }
        if (report.getSuggestions() == null) {
            report.setSuggestions(new ArrayList<>());
        }
        return report;
    }
}
