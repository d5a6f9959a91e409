package com.costtracker.costs.model;

import java.util.List;
import java.util.Optional;

/**
 * The fixed set of expense categories. Declaration order is the report display order.
 */
public enum Category {
    FOOD("food"),
    EDUCATION("education"),
    HEALTH("health"),
    HOUSING("housing"),
    SPORTS("sports");

    private static final List<Category> DISPLAY_ORDER = List.of(values());

    private final String wireName;

    Category(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static List<Category> displayOrder() {
        return DISPLAY_ORDER;
    }

    /**
     * Exact, case-sensitive match against the wire names.
     */
    public static Optional<Category> fromWireName(String candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        for (Category category : DISPLAY_ORDER) {
            if (category.wireName.equals(candidate)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    public static boolean isValid(String candidate) {
        return fromWireName(candidate).isPresent();
    }
}
