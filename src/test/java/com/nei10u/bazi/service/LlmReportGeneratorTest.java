package com.nei10u.bazi.service;

import com.nei10u.bazi.BaziFixtures;
import com.nei10u.bazi.exception.ReportGenerationException;
import com.nei10u.bazi.model.BaziAnalysis;
import com.nei10u.bazi.model.BaziReport;
import com.nei10u.bazi.model.ReportLevel;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LlmReportGeneratorTest {

    private static BaziAnalysis analysis;

    private final ChatClient chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);

    @BeforeAll
    static void analyze() {
        analysis = BaziFixtures.newEngine().analyze(BaziFixtures.sampleInput());
    }

    @Test
    void parsesFencedJsonReport() {
        when(chatClient.prompt().user(anyString()).call().content()).thenReturn("""
                ```json
                {"comprehensive": "庚金日主，性格坚毅", "career": "宜技术岗位", "wealth": "稳中有升",
                 "marriage": "晚婚为宜", "health": "注意脾胃", "suggestions": ["多运动", "勤学习"]}
                ```
                """);

        BaziReport report = generator(true, 0).generate(analysis, ReportLevel.DETAILED, "rid-1");

        assertThat(report.isFallback()).isFalse();
        assertThat(report.getLevel()).isEqualTo("detailed");
        assertThat(report.getComprehensive()).isEqualTo("庚金日主，性格坚毅");
        assertThat(report.getCareer()).isEqualTo("宜技术岗位");
        assertThat(report.getSuggestions()).containsExactly("多运动", "勤学习");
    }

    @Test
    void plainTextBecomesComprehensiveSection() {
        when(chatClient.prompt().user(anyString()).call().content()).thenReturn("  命主性格坚毅，宜稳中求进。 ");

        BaziReport report = generator(true, 0).generate(analysis, ReportLevel.SIMPLE, "rid-2");

        assertThat(report.isFallback()).isFalse();
        assertThat(report.getComprehensive()).isEqualTo("命主性格坚毅，宜稳中求进。");
        assertThat(report.getCareer()).isEmpty();
        assertThat(report.getSuggestions()).isEmpty();
    }

    @Test
    void fallsBackAfterRetriesAreExhausted() {
        when(chatClient.prompt().user(anyString()).call().content()).thenThrow(new RuntimeException("401 Unauthorized"));

        BaziReport report = generator(true, 1).generate(analysis, ReportLevel.NORMAL, "rid-3");

        assertThat(report.isFallback()).isTrue();
        assertThat(report.getLevel()).isEqualTo("normal");
        assertThat(report.getComprehensive()).contains("AI 报告生成失败").contains("401 Unauthorized");
        assertThat(report.getCareer()).isEqualTo(report.getComprehensive());
        assertThat(report.getHealth()).isEqualTo(report.getComprehensive());
    }

    @Test
    void blankOutputCountsAsFailure() {
        when(chatClient.prompt().user(anyString()).call().content()).thenReturn("   ");

        BaziReport report = generator(true, 0).generate(analysis, ReportLevel.NORMAL, "rid-4");

        assertThat(report.isFallback()).isTrue();
        assertThat(report.getComprehensive()).contains("模型返回空内容");
    }

    @Test
    void rethrowsWhenFallbackDisabled() {
        when(chatClient.prompt().user(anyString()).call().content()).thenThrow(new RuntimeException("timeout"));

        LlmReportGenerator generator = generator(false, 0);

        assertThatThrownBy(() -> generator.generate(analysis, ReportLevel.NORMAL, "rid-5"))
                .isInstanceOf(ReportGenerationException.class)
                .hasMessageContaining("timeout");
    }

    @Test
    void promptCarriesChartFacts() {
        String prompt = generator(true, 0).buildPrompt(analysis, ReportLevel.COMPREHENSIVE);

        assertThat(prompt)
                .contains("年柱庚午 月柱壬午 日柱庚辰 时柱癸未")
                .contains("食神格")
                .contains("天乙贵人")
                .contains("全面深入");
    }

    @Test
    void normalizesJsonWrappedInProse() {
        assertThat(LlmReportGenerator.normalizeJson("结果如下：{\"career\":\"x\"} 以上")).isEqualTo("{\"career\":\"x\"}");
        assertThat(LlmReportGenerator.normalizeJson(null)).isEmpty();
    }

    private LlmReportGenerator generator(boolean fallbackEnabled, int maxRetries) {
        ChatClient.Builder builder = mock(ChatClient.Builder.class);
        when(builder.build()).thenReturn(chatClient);
        return new LlmReportGenerator(builder, fallbackEnabled, maxRetries, 0);
    }
}
