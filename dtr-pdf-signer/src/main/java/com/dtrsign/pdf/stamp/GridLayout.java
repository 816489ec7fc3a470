package com.dtrsign.pdf.stamp;

/**
 * Day-cell grid used in whole-month mode. Day {@code i} (0-based) sits at row {@code i / cellsPerRow} and
 * column {@code i % cellsPerRow}; rows grow downwards from the anchor, columns to the right.
 */
public record GridLayout(int rowsPerPage, int cellsPerRow, float rowStep, float columnStep) {

    public static final GridLayout MONTH_COLUMN = new GridLayout(31, 1, 16f, 0f);

    public GridLayout {
        if (rowsPerPage <= 0 || cellsPerRow <= 0) {
            throw new IllegalArgumentException("Grid needs at least one row and one cell per row, got "
                    + rowsPerPage + "x" + cellsPerRow);
        }
        if (rowStep < 0 || columnStep < 0) {
            throw new IllegalArgumentException("Grid steps must not be negative");
        }
    }

    public int capacity() {
        return rowsPerPage * cellsPerRow;
    }

    public StampRect cell(StampRect anchor, int dayIndex) {
        if (dayIndex < 0 || dayIndex >= capacity()) {
            throw new IndexOutOfBoundsException("Day index " + dayIndex + " outside grid of " + capacity());
        }
        int row = dayIndex / cellsPerRow;
        int column = dayIndex % cellsPerRow;
        return anchor.translate(column * columnStep, -row * rowStep);
    }
}
