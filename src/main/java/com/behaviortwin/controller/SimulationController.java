package com.behaviortwin.controller;

import com.behaviortwin.config.RequestIdFilter;
import com.behaviortwin.dto.SimulationCatalogResponse;
import com.behaviortwin.dto.SimulationRequest;
import com.behaviortwin.dto.SimulationResponse;
import com.behaviortwin.service.SimulationService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/simulation")
@RequiredArgsConstructor
public class SimulationController {

    private final SimulationService simulationService;

    @GetMapping
    public ResponseEntity<SimulationCatalogResponse> catalog() {
        return ResponseEntity.ok(simulationService.catalog());
    }

    @PostMapping("/simulate")
    public ResponseEntity<SimulationResponse> simulate(
            @Valid @RequestBody SimulationRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /simulation/simulate | eventType={} | persona={} | region={} | requestId={}",
                 request.getEventType(), request.getPersona(), request.getRegion(), requestId);
        SimulationResponse response = simulationService.simulate(request, requestId);
        return ResponseEntity.ok(response);
    }

    private String resolveRequestId(HttpServletRequest request) {
        return RequestIdFilter.requestIdOf(request);
    }
}
