package com.behaviortwin.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Percentage shares of the three tracked brands. Values are percentages of a shared pool
 * and are not required to sum to 100.
 */
public record BrandShares(double sevenEleven, double familyMart, double other) {

    public static final double EQUAL_SHARE = 33.33;

    public static BrandShares equalSplit() {
        return new BrandShares(EQUAL_SHARE, EQUAL_SHARE, EQUAL_SHARE);
    }

    /** Reads the tracked brands from a raw mapping; absent brands count as 0. */
    public static BrandShares fromMap(Map<String, Double> percentages) {
        return new BrandShares(
            valueOf(percentages, Brand.SEVEN_ELEVEN),
            valueOf(percentages, Brand.FAMILY_MART),
            valueOf(percentages, Brand.OTHER));
    }

    public double get(Brand brand) {
        return switch (brand) {
            case SEVEN_ELEVEN -> sevenEleven;
            case FAMILY_MART -> familyMart;
            case OTHER -> other;
        };
    }

    public double total() {
        return sevenEleven + familyMart + other;
    }

    /**
     * Rescales the shares to sum to 100, falling back to an equal split when the total is
     * not positive.
     */
    public BrandShares normalized() {
        double total = total();
        if (total <= 0.0) {
            return equalSplit();
        }
        return new BrandShares(
            sevenEleven / total * 100.0,
            familyMart / total * 100.0,
            other / total * 100.0);
    }

    public BrandShares minus(BrandShares baseline) {
        return new BrandShares(
            sevenEleven - baseline.sevenEleven,
            familyMart - baseline.familyMart,
            other - baseline.other);
    }

    public BrandShares roundedToTenth() {
        return new BrandShares(round1(sevenEleven), round1(familyMart), round1(other));
    }

    public Map<String, Double> toMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (Brand brand : Brand.values()) {
            map.put(brand.getKey(), get(brand));
        }
        return map;
    }

    private static double valueOf(Map<String, Double> percentages, Brand brand) {
        if (percentages == null) {
            return 0.0;
        }
        Double value = percentages.get(brand.getKey());
        return value != null ? value : 0.0;
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
