package com.behaviortwin.service;

import com.behaviortwin.dto.HealthResponse;
import com.behaviortwin.dto.AvailabilityResponse;
import com.behaviortwin.repository.BehaviorRecordRepository;
import com.behaviortwin.repository.IntelRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
public class HealthService {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";
    public static final String READY = "ready";
    public static final String NOT_READY = "not_ready";
    public static final String ALIVE = "alive";

    private final BehaviorRecordRepository behaviorRepository;
    private final IntelRepository intelRepository;
    private final Clock clock;
    private final String version;
    private final Instant startedAt;

    public HealthService(BehaviorRecordRepository behaviorRepository, IntelRepository intelRepository,
                         Clock clock, @Value("${simulation.model-version:1.0.0}") String version) {
        this.behaviorRepository = behaviorRepository;
        this.intelRepository = intelRepository;
        this.clock = clock;
        this.version = version;
        this.startedAt = clock.instant();
    }

    public HealthResponse health() {
        Map<String, String> checks = dataChecks();
        Instant now = clock.instant();
        return HealthResponse.builder()
            .status(allPass(checks) ? HEALTHY : DEGRADED)
            .version(version)
            .timestamp(now)
            .checks(checks)
            .uptimeSeconds(Duration.between(startedAt, now).toMillis() / 1000.0)
            .build();
    }

    /** Ready when every data file exists and the behavior store is readable. */
    public AvailabilityResponse readiness() {
        if (allPass(dataChecks())) {
            return AvailabilityResponse.builder().status(READY).message("Service is ready").build();
        }
        return AvailabilityResponse.builder().status(NOT_READY).message("Data sources not available").build();
    }

    public AvailabilityResponse liveness() {
        return AvailabilityResponse.builder().status(ALIVE).timestamp(clock.instant()).build();
    }

    public static boolean isReady(AvailabilityResponse availability) {
        return READY.equals(availability.getStatus());
    }

    private Map<String, String> dataChecks() {
        Map<String, String> checks = new LinkedHashMap<>();
        checks.put("behaviorData", describe(behaviorRepository.getDataFile()));
        checks.put("dailyIntel", describe(intelRepository.getDailyIntelFile()));
        checks.put("fileAccess", behaviorRepository.isAvailable() ? "pass" : "fail (not readable)");
        return checks;
    }

    private boolean allPass(Map<String, String> checks) {
        return checks.values().stream().noneMatch(v -> v.startsWith("fail"));
    }

    private String describe(Path file) {
        if (!Files.exists(file)) {
            return "fail (file not found)";
        }
        try {
            return "pass (" + Files.size(file) + " bytes)";
        } catch (IOException ex) {
            log.warn("Cannot stat {}: {}", file, ex.getMessage());
            return "fail (" + ex.getClass().getSimpleName() + ")";
        }
    }
}
