package com.behaviortwin.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class SimulationParameters {

    public static final double NEUTRAL = 1.0;

    @DecimalMin(value = "0.5", message = "electricityPrice must be between 0.5 and 3.0")
    @DecimalMax(value = "3.0", message = "electricityPrice must be between 0.5 and 3.0")
    @Builder.Default
    double electricityPrice = NEUTRAL;

    @DecimalMin(value = "0.5", message = "pointMultiplier must be between 0.5 and 5.0")
    @DecimalMax(value = "5.0", message = "pointMultiplier must be between 0.5 and 5.0")
    @Builder.Default
    double pointMultiplier = NEUTRAL;

    @DecimalMin(value = "0.0", message = "promotionIntensity must be between 0.0 and 2.0")
    @DecimalMax(value = "2.0", message = "promotionIntensity must be between 0.0 and 2.0")
    @Builder.Default
    double promotionIntensity = NEUTRAL;

    // Reserved for future event types; no current rule reads it.
    @DecimalMin(value = "0.5", message = "priceSensitivity must be between 0.5 and 2.0")
    @DecimalMax(value = "2.0", message = "priceSensitivity must be between 0.5 and 2.0")
    @Builder.Default
    double priceSensitivity = NEUTRAL;

    public static SimulationParameters defaults() {
        return SimulationParameters.builder().build();
    }
}
