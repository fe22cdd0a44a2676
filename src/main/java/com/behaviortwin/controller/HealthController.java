package com.behaviortwin.controller;

import com.behaviortwin.dto.HealthResponse;
import com.behaviortwin.dto.AvailabilityResponse;
import com.behaviortwin.service.HealthService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
public class HealthController {

    private final HealthService healthService;

    @GetMapping
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(healthService.health());
    }

    @GetMapping("/ready")
    public ResponseEntity<AvailabilityResponse> ready() {
        AvailabilityResponse availability = healthService.readiness();
        HttpStatus status = HealthService.isReady(availability) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(availability);
    }

    @GetMapping("/live")
    public ResponseEntity<AvailabilityResponse> live() {
        return ResponseEntity.ok(healthService.liveness());
    }
}
