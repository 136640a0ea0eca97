package net.findmycard.util;

import java.util.Collection;
import java.util.Map;

/**
 * Null, blank and empty checks shared across services.
 */
public final class ValidationUtils {
    private ValidationUtils() {
    }

    public static boolean isNullOrEmpty(Collection<?> collection) {
        return collection == null || collection.isEmpty();
    }

    public static boolean isNullOrEmpty(Map<?, ?> map) {
        return map == null || map.isEmpty();
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * Trims the value and maps blank input to {@code null}.
     */
    public static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
