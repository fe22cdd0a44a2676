package com.behaviortwin.util;

import java.util.Locale;
import java.util.Map;

/**
 * Maps the English spellings analysts use for personas and regions onto the names stored in
 * the behavior records, and compares segment names case-insensitively.
 */
public final class SegmentAliases {

    public static final String FRESH_GRAD = "新鮮人";
    public static final String FINTECH_FAMILY = "FinTech家庭";
    public static final String TAIPEI = "台北";
    public static final String TAINAN = "台南";

    private static final Map<String, String> PERSONA_ALIASES = Map.of(
        "fresh_grad", FRESH_GRAD,
        "fresh_graduate", FRESH_GRAD,
        "新鮮人", FRESH_GRAD,
        "fintech_family", FINTECH_FAMILY,
        "fintech family", FINTECH_FAMILY,
        "fintech家庭", FINTECH_FAMILY
    );

    private static final Map<String, String> REGION_ALIASES = Map.of(
        "taipei", TAIPEI,
        "台北", TAIPEI,
        "tainan", TAINAN,
        "台南", TAINAN
    );

    private SegmentAliases() {}

    public static String canonicalPersona(String persona) {
        return canonical(persona, PERSONA_ALIASES);
    }

    public static String canonicalRegion(String region) {
        return canonical(region, REGION_ALIASES);
    }

    public static boolean personaMatches(String recordPersona, String filter) {
        return matches(recordPersona, filter, PERSONA_ALIASES);
    }

    public static boolean regionMatches(String recordRegion, String filter) {
        return matches(recordRegion, filter, REGION_ALIASES);
    }

    private static boolean matches(String value, String filter, Map<String, String> aliases) {
        if (filter == null || filter.isBlank()) {
            return true;
        }
        if (value == null) {
            return false;
        }
        return value.equalsIgnoreCase(filter.trim())
            || value.equalsIgnoreCase(canonical(filter, aliases));
    }

    private static String canonical(String value, Map<String, String> aliases) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return aliases.getOrDefault(trimmed.toLowerCase(Locale.ROOT), trimmed);
    }
}
