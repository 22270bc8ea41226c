package com.nei10u.bazi.model;

import lombok.Data;

@Data
public class BaziResponse {
    private String requestId;
    private String name;
    private BaziAnalysis analysis;
    private BaziReport report;
    /** 报告生成失败且未兜底时的原因 */
    private String reportError;
    private PersistenceOutcome persistence;
    private Metadata metadata;

    @Data
    public static class Metadata {
        private String version;
        private String timestamp;
        private String generatedBy;
        private long executionMillis;
    }
}
