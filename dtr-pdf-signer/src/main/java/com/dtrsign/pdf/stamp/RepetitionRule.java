package com.dtrsign.pdf.stamp;

import java.util.Objects;

/**
 * Whole-month repetition: one stamp per day cell of {@code grid}, starting at the spec's rectangle.
 */
public record RepetitionRule(int dayCount, GridLayout grid) {

    public static final int DEFAULT_DAY_COUNT = 31;

    public RepetitionRule {
        Objects.requireNonNull(grid, "grid");
        if (dayCount <= 0) {
            throw new IllegalArgumentException("dayCount must be >= 1, got " + dayCount);
        }
    }
}
