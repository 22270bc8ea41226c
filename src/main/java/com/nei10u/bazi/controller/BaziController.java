package com.nei10u.bazi.controller;

import com.nei10u.bazi.model.BaziRequest;
import com.nei10u.bazi.model.BaziResponse;
import com.nei10u.bazi.service.BaziAnalysisService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/bazi")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class BaziController {

    private static final Logger log = LoggerFactory.getLogger(BaziController.class);
    private final BaziAnalysisService analysisService;

    @PostMapping("/analyze")
    public ResponseEntity<BaziResponse> analyze(@RequestBody BaziRequest request) {
        String rid = ensureRequestId(request);
        log.info("[{}] analyze request {}-{}-{} {}:{}", rid, request.getYear(), request.getMonth(),
                request.getDay(), request.getHour(), request.getMinute());
        return ResponseEntity.ok(analysisService.analyze(request));
    }

    /** 第一步：只排盘，结果进缓存。 */
    @PostMapping("/chart")
    public ResponseEntity<BaziResponse> chart(@RequestBody BaziRequest request) {
        ensureRequestId(request);
        return ResponseEntity.ok(analysisService.chart(request));
    }

    /** 第二步：按同一 requestId 复用排盘结果生成报告。 */
    @PostMapping("/report")
    public ResponseEntity<BaziResponse> report(@RequestBody BaziRequest request) {
        ensureRequestId(request);
        return ResponseEntity.ok(analysisService.report(request));
    }

    private String ensureRequestId(BaziRequest request) {
        if (request.getRequestId() == null || request.getRequestId().isBlank()) {
            request.setRequestId(UUID.randomUUID().toString());
        }
        return request.getRequestId();
    }
}
