package com.behaviortwin.dto;

import com.behaviortwin.model.EventType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class SimulationRequest {

    @NotBlank(message = "eventType is required")
    @Pattern(regexp = EventType.ID_PATTERN,
             message = "eventType must be one of: price_change, promotion, competition, external")
    String eventType;

    @Valid
    @Builder.Default
    SimulationParameters parameters = SimulationParameters.defaults();

    String persona;

    String region;

    @Min(value = 1, message = "durationDays must be between 1 and 365")
    @Max(value = 365, message = "durationDays must be between 1 and 365")
    @Builder.Default
    Integer durationDays = 30;
}
