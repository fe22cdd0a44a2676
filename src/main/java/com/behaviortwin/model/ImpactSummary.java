package com.behaviortwin.model;

public record ImpactSummary(
    double avgBrandShiftPercent,
    double confidenceScore,
    int affectedPersonas,
    double estimatedRevenueChange
) {}
