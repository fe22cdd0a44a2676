package com.behaviortwin.config;

import com.behaviortwin.service.BaselineResolver;
import com.behaviortwin.service.ImpactAggregator;
import com.behaviortwin.service.ImpactCalculator;
import com.behaviortwin.service.InsightGenerator;
import com.behaviortwin.service.WhatIfEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Builds the what-if engine from configuration. The engine components are plain objects;
 * everything they depend on is handed to them here.
 */
@Slf4j
@Configuration
public class SimulationEngineConfig {

    @Bean
    public ImpactCalculator impactCalculator(
            @Value("${simulation.price-sensitive-personas:新鮮人}") List<String> priceSensitivePersonas) {
        log.info("Price-sensitive personas: {}", priceSensitivePersonas);
        return new ImpactCalculator(priceSensitivePersonas);
    }

    @Bean
    public WhatIfEngine whatIfEngine(
            ImpactCalculator impactCalculator,
            Clock clock,
            @Value("${simulation.model-version:1.0.0}") String modelVersion) {
        return new WhatIfEngine(
            new BaselineResolver(),
            impactCalculator,
            new InsightGenerator(),
            new ImpactAggregator(),
            clock,
            modelVersion);
    }
}
