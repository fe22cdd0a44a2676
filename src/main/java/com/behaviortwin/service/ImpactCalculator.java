package com.behaviortwin.service;

import com.behaviortwin.dto.SimulationParameters;
import com.behaviortwin.model.BaselineEntry;
import com.behaviortwin.model.BrandShares;
import com.behaviortwin.model.EventType;
import com.behaviortwin.model.SegmentKey;
import com.behaviortwin.model.SegmentResult;
import com.behaviortwin.util.SegmentAliases;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Projects each baseline distribution through the rule of the selected event type.
 *
 * <p>Personas configured as price-sensitive react more strongly to price changes and to
 * competitor actions than the remaining, resilient personas. An event type the calculator
 * does not know leaves every baseline unchanged.
 *
 * <p>All arithmetic runs unrounded; {@link SegmentResult#of} rounds the projection and the
 * delta to one decimal at the end.
 */
public class ImpactCalculator {

    private static final double MIN_SHARE = 0.0;
    private static final double MAX_SHARE = 100.0;
    private static final double EPS = 1e-9;

    private static final PriceShift SENSITIVE_PRICE_SHIFT = new PriceShift(0.08, 0.07, 0.15);
    private static final PriceShift RESILIENT_PRICE_SHIFT = new PriceShift(0.05, 0.05, 0.10);

    private static final double PROMOTION_GAIN_PER_POINT = 0.12;
    private static final double PROMOTION_OTHER_LOSS_RATIO = 0.5;

    private static final CompetitorShift SENSITIVE_COMPETITOR_SHIFT = new CompetitorShift(3.0, 8.0);
    private static final CompetitorShift RESILIENT_COMPETITOR_SHIFT = new CompetitorShift(2.0, 4.0);

    private static final BrandShares EXTERNAL_SHIFT = new BrandShares(2.0, 1.0, -3.0);

    private final Set<String> priceSensitivePersonas;

    public ImpactCalculator(Collection<String> priceSensitivePersonas) {
        this.priceSensitivePersonas = priceSensitivePersonas.stream()
            .map(SegmentAliases::canonicalPersona)
            .map(p -> p.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * @param persona optional persona filter; {@code null} or blank admits every persona
     * @param region  optional region filter; {@code null} or blank admits every region
     * @return results for the matching baselines, in baseline order; empty when nothing matches
     */
    public Map<SegmentKey, SegmentResult> calculate(
            Map<SegmentKey, BaselineEntry> baseline, SimulationParameters params,
            String eventType, String persona, String region) {

        Optional<EventType> type = EventType.fromId(eventType);
        Map<SegmentKey, SegmentResult> results = new LinkedHashMap<>();
        for (BaselineEntry entry : baseline.values()) {
            SegmentKey key = entry.key();
            if (!SegmentAliases.personaMatches(key.persona(), persona)
                    || !SegmentAliases.regionMatches(key.region(), region)) {
                continue;
            }
            BrandShares projected = type
                .map(t -> project(t, entry, params))
                .orElse(entry.shares());
            results.put(key, SegmentResult.of(key, entry.shares(), projected));
        }
        return results;
    }

    /** Unrounded projection of a single baseline. */
    public BrandShares project(EventType type, BaselineEntry entry, SimulationParameters params) {
        boolean sensitive = isPriceSensitive(entry.key().persona());
        BrandShares base = entry.shares();
        return switch (type) {
            case PRICE_CHANGE -> priceChange(base, params, sensitive);
            case PROMOTION -> promotion(base, params);
            case COMPETITION -> competition(base, sensitive);
            case EXTERNAL -> external(base);
        };
    }

    public boolean isPriceSensitive(String persona) {
        if (persona == null) {
            return false;
        }
        return priceSensitivePersonas.contains(
            SegmentAliases.canonicalPersona(persona).toLowerCase(Locale.ROOT));
    }

    private BrandShares priceChange(BrandShares base, SimulationParameters params, boolean sensitive) {
        double factor = params.getElectricityPrice() - SimulationParameters.NEUTRAL;
        PriceShift shift = sensitive ? SENSITIVE_PRICE_SHIFT : RESILIENT_PRICE_SHIFT;
        return new BrandShares(
            clamp(base.sevenEleven() - shift.fromSevenEleven() * factor),
            clamp(base.familyMart() - shift.fromFamilyMart() * factor),
            clamp(base.other() + shift.toOther() * factor))
            .normalized();
    }

    private BrandShares promotion(BrandShares base, SimulationParameters params) {
        double gain = (params.getPromotionIntensity() - SimulationParameters.NEUTRAL)
            * PROMOTION_GAIN_PER_POINT * params.getPointMultiplier();
        double familyMart = clamp(base.familyMart() + gain);
        double other = clamp(base.other() - gain * PROMOTION_OTHER_LOSS_RATIO);
        double sevenEleven = Math.max(MIN_SHARE, MAX_SHARE - familyMart - other);
        return capAtHundred(new BrandShares(sevenEleven, familyMart, other));
    }

    private BrandShares competition(BrandShares base, boolean sensitive) {
        CompetitorShift shift = sensitive ? SENSITIVE_COMPETITOR_SHIFT : RESILIENT_COMPETITOR_SHIFT;
        double familyMart = clamp(base.familyMart() + shift.toFamilyMart());
        double sevenEleven = clamp(base.sevenEleven() - shift.fromSevenEleven());
        double other = Math.max(MIN_SHARE, MAX_SHARE - familyMart - sevenEleven);
        return capAtHundred(new BrandShares(sevenEleven, familyMart, other));
    }

    private BrandShares external(BrandShares base) {
        return new BrandShares(
            base.sevenEleven() + EXTERNAL_SHIFT.sevenEleven(),
            base.familyMart() + EXTERNAL_SHIFT.familyMart(),
            Math.max(MIN_SHARE, base.other() + EXTERNAL_SHIFT.other()))
            .normalized();
    }

    // The residual share can only overshoot when the two fixed brands already exceed 100.
    private BrandShares capAtHundred(BrandShares shares) {
        return shares.total() > MAX_SHARE + EPS ? shares.normalized() : shares;
    }

    private double clamp(double value) {
        return Math.max(MIN_SHARE, Math.min(MAX_SHARE, value));
    }

    private record PriceShift(double fromSevenEleven, double fromFamilyMart, double toOther) {}

    private record CompetitorShift(double fromSevenEleven, double toFamilyMart) {}
}
