package com.nei10u.bazi.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class BaziReport {
    private String level;            // 报告级别
    private String comprehensive;    // 综合分析
    private String career;           // 事业
    private String wealth;           // 财运
    private String marriage;         // 婚姻
    private String health;           // 健康
    private List<String> suggestions = new ArrayList<>(); // 个性化建议
    private boolean fallback;        // 是否为生成失败后的兜底报告
}
