package com.behaviortwin.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Body of the readiness and liveness endpoints. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AvailabilityResponse {
    String status;
    String message;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;
}
