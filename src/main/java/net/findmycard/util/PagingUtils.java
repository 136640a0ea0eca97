package net.findmycard.util;

import java.util.List;

/**
 * Paging maths shared by controllers and services so they clamp the same way.
 */
public final class PagingUtils {

    private PagingUtils() {
        // Utility class
    }

    /**
     * Clamp {@code value} to the inclusive {@code [min, max]} range.
     */
    public static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Slice of {@code items} for a one-based page; never throws on bounds.
     */
    public static <T> List<T> page(List<T> items, int page, int pageSize) {
        if (items == null || items.isEmpty() || pageSize <= 0 || page < 1) {
            return List.of();
        }
        long start = (long) (page - 1) * pageSize;
        if (start >= items.size()) {
            return List.of();
        }
        int end = (int) Math.min(items.size(), start + pageSize);
        return List.copyOf(items.subList((int) start, end));
    }

    public static boolean hasMore(int total, int page, int pageSize) {
        if (pageSize <= 0 || total <= 0 || page < 1) {
            return false;
        }
        return (long) page * pageSize < total;
    }
}
