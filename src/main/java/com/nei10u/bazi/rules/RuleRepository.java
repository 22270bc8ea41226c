package com.nei10u.bazi.rules;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONReader;
import com.alibaba.fastjson2.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 规则库。进程内只加载一次，之后所有分析共用同一份只读快照。
 * 文件缺失或为空时返回 EMPTY 表，解析异常时返回 FAILED 表，均不抛出。
 */
@Component
public class RuleRepository {

    private static final Logger log = LoggerFactory.getLogger(RuleRepository.class);

    private static final JSONReader.Feature[] JSON_FEATURES = new JSONReader.Feature[]{
            JSONReader.Feature.SupportSmartMatch
    };

    private final String location;
    private final ResourceLoader resourceLoader;
    private final AtomicInteger loadCount = new AtomicInteger();

    private volatile RuleSnapshot snapshot;

    public RuleRepository(@Value("${bazi.rules.location:classpath:rules/}") String location) {
        this.location = location.endsWith("/") ? location : location + "/";
        this.resourceLoader = new DefaultResourceLoader();
    }

    public RuleSnapshot snapshot() {
        RuleSnapshot current = snapshot;
        if (current == null) {
            synchronized (this) {
                current = snapshot;
                if (current == null) {
                    current = load();
                    snapshot = current;
                }
            }
        }
        return current;
    }

    /** 实际加载次数，正常情况下恒为 0 或 1。 */
    public int loadCount() {
        return loadCount.get();
    }

    private RuleSnapshot load() {
        loadCount.incrementAndGet();
        log.info("加载规则库: {}", location);
        RuleSnapshot loaded = new RuleSnapshot(
                read(RuleCategory.TEN_GOD_TRAITS, new TypeReference<Map<String, TraitRule>>() {
                }, LinkedHashMap::new, Map::isEmpty),
                read(RuleCategory.PATTERN_CAREERS, new TypeReference<Map<String, List<String>>>() {
                }, LinkedHashMap::new, Map::isEmpty),
                read(RuleCategory.SPIRIT_MARKERS, new TypeReference<SpiritMarkerTables>() {
                }, SpiritMarkerTables::new, SpiritMarkerTables::isEmpty),
                read(RuleCategory.PERSONALITY_SCORING, new TypeReference<Map<String, List<ScoringRule>>>() {
                }, LinkedHashMap::new, Map::isEmpty),
                read(RuleCategory.ZODIAC_RELATIONS, new TypeReference<ZodiacRelations>() {
                }, ZodiacRelations::new, ZodiacRelations::isEmpty));
        for (RuleTable<?> table : loaded.tables()) {
            log.info("规则表 {}: {}{}", table.getCategory(), table.getStatus(),
                    table.getReason() == null ? "" : " (" + table.getReason() + ")");
        }
        return loaded;
    }

    private <T> RuleTable<T> read(RuleCategory category, TypeReference<T> type,
                                  Supplier<T> emptyValue, Predicate<T> isEmpty) {
        String path = location + category.fileName();
        Resource resource = resourceLoader.getResource(path);
        if (!resource.exists()) {
            log.warn("规则文件不存在: {}", path);
            return RuleTable.empty(category, emptyValue.get(), "规则文件不存在: " + path);
        }
        try (InputStream in = resource.getInputStream()) {
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            T data = text.isBlank() ? null : JSON.parseObject(text, type, JSON_FEATURES);
            if (data == null || isEmpty.test(data)) {
                log.warn("规则表为空: {}", path);
                return RuleTable.empty(category, emptyValue.get(), "规则表为空");
            }
            return RuleTable.loaded(category, data);
        } catch (IOException | RuntimeException e) {
            log.error("加载规则表失败 {}: {}", path, e.getMessage(), e);
            return RuleTable.failed(category, emptyValue.get(), e.getMessage());
        }
    }
}
