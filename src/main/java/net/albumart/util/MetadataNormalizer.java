package net.albumart.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalization for track metadata used as lookup keys and in match validation.
 * Keeps the artwork cache key and the candidate comparison on the same rules.
 */
public final class MetadataNormalizer {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private MetadataNormalizer() {
        // Utility class
    }

    /**
     * Lower-cases, collapses internal whitespace and trims. {@code null} becomes empty.
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE_RUN.matcher(value.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    public static boolean sameValue(String left, String right) {
        return normalize(left).equals(normalize(right));
    }

    public static boolean isBlank(String value) {
        return normalize(value).isEmpty();
    }
}
