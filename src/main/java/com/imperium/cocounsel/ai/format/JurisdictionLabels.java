package com.imperium.cocounsel.ai.format;

import java.util.Locale;

/**
 * 法域代码到展示名的映射。
 */
public final class JurisdictionLabels {

    public static final String DEFAULT_JURISDICTION = "both";
    public static final String MULTI_STATE = "Multi-state (KS/MO)";

    private JurisdictionLabels() {}

    public static String label(String jurisdiction) {
        if (jurisdiction == null) {
            return MULTI_STATE;
        }
        return switch (jurisdiction.trim().toLowerCase(Locale.ROOT)) {
            case "kansas" -> "Kansas";
            case "missouri" -> "Missouri";
            case "federal" -> "US Federal";
            default -> MULTI_STATE;
        };
    }

    /**
     * 规范化请求中的法域代码，空值取 both。
     */
    public static String normalize(String jurisdiction) {
        if (jurisdiction == null || jurisdiction.isBlank()) {
            return DEFAULT_JURISDICTION;
        }
        return jurisdiction.trim().toLowerCase(Locale.ROOT);
    }
}
