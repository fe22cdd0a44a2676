package com.behaviortwin.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class HealthResponse {
    String status;
    String version;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;
    Map<String, String> checks;
    double uptimeSeconds;
}
