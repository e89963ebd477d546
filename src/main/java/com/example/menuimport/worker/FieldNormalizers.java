package com.example.menuimport.worker;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Total conversions from raw CSV cell text to typed record values. None of these methods throw.
 */
public final class FieldNormalizers {

    public static final String DEFAULT_STRAIN_TYPE = "Hybrid";

    public static final Set<String> SOLD_OUT_VALUES = Set.of(
            "soldout", "sold out", "true", "1", "yes", "out of stock",
            "unavailable", "empty", "oos", "out");

    public static final Set<String> LAST_JAR_VALUES = Set.of(
            "lastjar", "last jar", "true", "1", "yes");

    public static final Set<String> LOW_STOCK_VALUES = Set.of(
            "true", "1", "yes", "last 5 units", "last5units", "last 5", "last5",
            "final units", "remaining units", "low inventory", "last few",
            "limited stock", "low stock", "lowstock");

    private static final Pattern NUMERIC_VALUE = Pattern.compile("(\\d*\\.?\\d+)");
    private static final Pattern PRICE_CLEANUP = Pattern.compile("[$€£¥,\\s]");
    private static final Pattern TYPE_SEPARATORS = Pattern.compile("[\\s\\-./]");

    private static final Map<String, String> STRAIN_TYPE_ALIASES = Map.ofEntries(
            Map.entry("S", "Sativa"),
            Map.entry("SAT", "Sativa"),
            Map.entry("SATIVA", "Sativa"),
            Map.entry("SH", "Sativa-Hybrid"),
            Map.entry("HS", "Sativa-Hybrid"),
            Map.entry("SATHYB", "Sativa-Hybrid"),
            Map.entry("SATIVAHYBRID", "Sativa-Hybrid"),
            Map.entry("H", "Hybrid"),
            Map.entry("HYB", "Hybrid"),
            Map.entry("HYBRID", "Hybrid"),
            Map.entry("IH", "Indica-Hybrid"),
            Map.entry("HI", "Indica-Hybrid"),
            Map.entry("INDHYB", "Indica-Hybrid"),
            Map.entry("INDICAHYBRID", "Indica-Hybrid"),
            Map.entry("I", "Indica"),
            Map.entry("IND", "Indica"),
            Map.entry("INDICA", "Indica"));

    private FieldNormalizers() {
    }

    /**
     * First decimal number in the text, e.g. {@code "24.5%"} gives {@code 24.5}.
     *
     * @return {@code null} for empty input, {@code "-"}, or text without a finite number
     */
    public static Double extractNumeric(String value) {
        if (value == null || value.isEmpty() || "-".equals(value.trim())) {
            return null;
        }
        return firstNumber(value);
    }

    /**
     * Price with currency symbols and thousands separators removed. Unparsable prices are {@code 0}.
     */
    public static double parsePrice(String value) {
        if (value == null || value.isEmpty()) {
            return 0;
        }
        Double parsed = firstNumber(PRICE_CLEANUP.matcher(value).replaceAll(""));
        return parsed != null ? parsed : 0;
    }

    public static String normalizeStrainType(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_STRAIN_TYPE;
        }
        String key = TYPE_SEPARATORS.matcher(value.toUpperCase(Locale.ROOT)).replaceAll("");
        return STRAIN_TYPE_ALIASES.getOrDefault(key, DEFAULT_STRAIN_TYPE);
    }

    public static boolean parseBooleanField(String value, Set<String> trueValues) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        return trueValues.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    private static Double firstNumber(String value) {
        Matcher matcher = NUMERIC_VALUE.matcher(value);
        if (!matcher.find()) {
            return null;
        }
        double parsed = Double.parseDouble(matcher.group(1));
        return Double.isFinite(parsed) ? parsed : null;
    }
}
