package com.costtracker.costs.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Monthly costs report. Always carries one bucket per {@link Category}, in
 * {@link Category#displayOrder()}.
 */
public record Report(
        long userId,
        int year,
        int month,
        List<CategoryCosts> costsByCategory
) {
    public Report {
        if (costsByCategory == null || costsByCategory.size() != Category.displayOrder().size()) {
            throw new IllegalArgumentException("report must carry exactly "
                    + Category.displayOrder().size() + " category buckets");
        }
        for (int i = 0; i < costsByCategory.size(); i++) {
            if (costsByCategory.get(i).category() != Category.displayOrder().get(i)) {
                throw new IllegalArgumentException("category buckets out of display order at index " + i);
            }
        }
        costsByCategory = List.copyOf(costsByCategory);
    }

    public List<Entry> entriesFor(Category category) {
        return costsByCategory.get(category.ordinal()).entries();
    }

    public BigDecimal totalAmount() {
        return costsByCategory.stream()
                .flatMap(bucket -> bucket.entries().stream())
                .map(Entry::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public record CategoryCosts(Category category, List<Entry> entries) {
        public CategoryCosts {
            entries = entries == null ? List.of() : List.copyOf(entries);
        }
    }

    public record Entry(BigDecimal amount, String description, int dayOfMonth) {
    }
}
