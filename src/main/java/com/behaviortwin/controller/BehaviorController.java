package com.behaviortwin.controller;

import com.behaviortwin.dto.BehaviorResponse;
import com.behaviortwin.dto.BehaviorSummaryResponse;
import com.behaviortwin.dto.WebIntelResponse;
import com.behaviortwin.model.DailyIntelReport;
import com.behaviortwin.service.BehaviorQueryService;
import com.behaviortwin.service.IntelQueryService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/behavior")
@RequiredArgsConstructor
public class BehaviorController {

    private final BehaviorQueryService behaviorQueryService;
    private final IntelQueryService intelQueryService;

    @GetMapping
    public ResponseEntity<BehaviorResponse> find(
            @RequestParam(required = false) String persona,
            @RequestParam(required = false) String region,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        log.info("GET /behavior | persona={} | region={} | startDate={} | endDate={} | limit={}",
                 persona, region, startDate, endDate, limit);
        return ResponseEntity.ok(behaviorQueryService.find(persona, region, startDate, endDate, limit));
    }

    @GetMapping("/summary")
    public ResponseEntity<BehaviorSummaryResponse> summary() {
        return ResponseEntity.ok(behaviorQueryService.summary());
    }

    @GetMapping("/daily-intel")
    public ResponseEntity<List<DailyIntelReport>> dailyIntel(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit) {
        log.info("GET /behavior/daily-intel | date={} | limit={}", date, limit);
        return ResponseEntity.ok(intelQueryService.dailyIntel(date, limit));
    }

    @GetMapping("/web-intel")
    public ResponseEntity<WebIntelResponse> webIntel(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        log.info("GET /behavior/web-intel | date={}", date);
        return ResponseEntity.ok(intelQueryService.webIntel(date));
    }
}
