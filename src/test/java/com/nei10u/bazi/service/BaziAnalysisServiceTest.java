package com.nei10u.bazi.service;

import com.nei10u.bazi.BaziFixtures;
import com.nei10u.bazi.engine.BaziEngine;
import com.nei10u.bazi.exception.InvalidInputException;
import com.nei10u.bazi.exception.ReportGenerationException;
import com.nei10u.bazi.exception.ResultWriteException;
import com.nei10u.bazi.model.BaziAnalysis;
import com.nei10u.bazi.model.BaziReport;
import com.nei10u.bazi.model.BaziRequest;
import com.nei10u.bazi.model.BaziResponse;
import com.nei10u.bazi.model.BirthInput;
import com.nei10u.bazi.model.Gender;
import com.nei10u.bazi.model.ReportLevel;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BaziAnalysisServiceTest {

    private static BaziAnalysis analysis;

    private BaziEngine engine;
    private ReportGenerator reportGenerator;
    private PersistenceWriter persistenceWriter;
    private BaziAnalysisService service;
    private BaziReport report;

    @BeforeAll
    static void analyze() {
        analysis = BaziFixtures.newEngine().analyze(BaziFixtures.sampleInput());
    }

    @BeforeEach
    void setUp() {
        engine = mock(BaziEngine.class);
        reportGenerator = mock(ReportGenerator.class);
        persistenceWriter = mock(PersistenceWriter.class);
        service = new BaziAnalysisService(engine, reportGenerator, persistenceWriter, new AnalysisSessionCache(30));

        report = new BaziReport();
        report.setComprehensive("综合分析");
        when(engine.analyze(any(BirthInput.class))).thenReturn(analysis);
        when(reportGenerator.generate(any(), any(), any())).thenReturn(report);
    }

    @Test
    void fullAnalysisReportsAndPersists() {
        when(persistenceWriter.write(any())).thenReturn(Path.of("output", "张三_19900515", "result.json"));

        BaziResponse response = service.analyze(request(null));

        assertThat(response.getRequestId()).isNotBlank();
        assertThat(response.getName()).isEqualTo("张三");
        assertThat(response.getAnalysis()).isSameAs(analysis);
        assertThat(response.getReport()).isSameAs(report);
        assertThat(response.getPersistence().isSuccess()).isTrue();
        assertThat(response.getPersistence().getPath()).endsWith("result.json");
        assertThat(response.getMetadata().getGeneratedBy()).isEqualTo("bazi-agent");
        assertThat(response.getMetadata().getVersion()).isEqualTo("1.0.0");
        assertThat(response.getMetadata().getExecutionMillis()).isNotNegative();
        verify(reportGenerator).generate(analysis, ReportLevel.DETAILED, response.getRequestId());
    }

    @Test
    void writeFailureKeepsAnalysis() {
        when(persistenceWriter.write(any()))
                .thenThrow(new ResultWriteException("写入结果失败: output", new IOException("磁盘已满")));

        BaziResponse response = service.analyze(request("rid-1"));

        assertThat(response.getAnalysis()).isSameAs(analysis);
        assertThat(response.getReport()).isSameAs(report);
        assertThat(response.getPersistence().isSuccess()).isFalse();
        assertThat(response.getPersistence().getError()).contains("写入结果失败");
    }

    @Test
    void controlCharactersInNameAreDroppedFromOutputPath(@TempDir Path dir) {
        BaziAnalysisService writing = new BaziAnalysisService(engine, reportGenerator,
                new JsonFileResultWriter(dir.toString()), new AnalysisSessionCache(30));
        BaziRequest request = request("rid-8");
        request.setName("张\u0000三");

        BaziResponse response = writing.analyze(request);

        assertThat(response.getAnalysis()).isSameAs(analysis);
        assertThat(response.getPersistence().isSuccess()).isTrue();
        assertThat(Path.of(response.getPersistence().getPath()))
                .isEqualTo(dir.resolve("张三_19900515").resolve("result.json"))
                .exists();
    }

    @Test
    void unusableOutputPathKeepsAnalysisAndReport() {
        BaziAnalysisService writing = new BaziAnalysisService(engine, reportGenerator,
                new JsonFileResultWriter("out\u0000put"), new AnalysisSessionCache(30));

        BaziResponse response = writing.analyze(request("rid-9"));

        assertThat(response.getAnalysis()).isSameAs(analysis);
        assertThat(response.getReport()).isSameAs(report);
        assertThat(response.getPersistence().isSuccess()).isFalse();
        assertThat(response.getPersistence().getError()).contains("写入结果失败");
    }

    @Test
    void reportFailureWithoutFallbackKeepsAnalysisAndPersists() {
        when(reportGenerator.generate(any(), any(), any()))
                .thenThrow(new ReportGenerationException("AI 报告生成失败"));
        when(persistenceWriter.write(any())).thenReturn(Path.of("output", "张三_19900515", "result.json"));

        BaziResponse response = service.analyze(request("rid-10"));

        assertThat(response.getAnalysis()).isSameAs(analysis);
        assertThat(response.getReport()).isNull();
        assertThat(response.getReportError()).contains("AI 报告生成失败");
        assertThat(response.getPersistence().isSuccess()).isTrue();
        verify(persistenceWriter).write(response);
    }

    @Test
    void chartOnlySkipsCollaborators() {
        BaziResponse response = service.chart(request("rid-2"));

        assertThat(response.getAnalysis()).isSameAs(analysis);
        assertThat(response.getReport()).isNull();
        assertThat(response.getPersistence()).isNull();
        verify(reportGenerator, never()).generate(any(), any(), any());
        verify(persistenceWriter, never()).write(any());
    }

    @Test
    void reportReusesCachedChart() {
        service.chart(request("rid-3"));

        BaziRequest second = request("rid-3");
        second.setReportLevel("simple");
        BaziResponse response = service.report(second);

        assertThat(response.getReport()).isSameAs(report);
        verify(engine, times(1)).analyze(any());
        verify(reportGenerator).generate(analysis, ReportLevel.SIMPLE, "rid-3");
    }

    @Test
    void reportComputesChartOnCacheMiss() {
        service.report(request("rid-4"));

        verify(engine, times(1)).analyze(any());
        verify(reportGenerator).generate(eq(analysis), eq(ReportLevel.DETAILED), eq("rid-4"));
    }

    @Test
    void invalidRequestFailsBeforeAnalysis() {
        BaziRequest badGender = request("rid-5");
        badGender.setGender("未知");
        BaziRequest badLevel = request("rid-6");
        badLevel.setReportLevel("verbose");

        assertThatThrownBy(() -> service.analyze(badGender)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.analyze(badLevel)).isInstanceOf(InvalidInputException.class);
        verify(engine, never()).analyze(any());
    }

    @Test
    void mapsRequestToBirthInput() {
        BaziRequest request = request("rid-7");
        request.setGender("female");
        request.setCity("上海");
        request.setTrueSolarTime(true);
        request.setAnnualStartYear(2025);

        BirthInput input = BaziAnalysisService.toBirthInput(request);

        assertThat(input.getGender()).isEqualTo(Gender.FEMALE);
        assertThat(input.getCity()).isEqualTo("上海");
        assertThat(input.isTrueSolarTime()).isTrue();
        assertThat(input.getAnnualStartYear()).isEqualTo(2025);
        assertThat(input.getHour()).isEqualTo(14);
    }

    private static BaziRequest request(String requestId) {
        BaziRequest request = new BaziRequest();
        request.setRequestId(requestId);
        request.setName("张三");
        request.setYear(1990);
        request.setMonth(5);
        request.setDay(15);
        request.setHour(14);
        request.setMinute(30);
        request.setGender("男");
        return request;
    }
}
