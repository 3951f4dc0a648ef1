package com.questrail.crossword.api;

/**
 * Direction in which a {@link Slot} runs through the grid.
 */
public enum Orientation
{
    /** Left to right along a row. */
    ACROSS(0, 1),

    /** Top to bottom along a column. */
    DOWN(1, 0);

    private final int rowStep;
    private final int columnStep;

    Orientation(int rowStep, int columnStep) {
        this.rowStep = rowStep;
        this.columnStep = columnStep;
    }

    /**
     * @return row delta between consecutive cells of a slot in this orientation
     */
    public int rowStep() {
        return rowStep;
    }

    /**
     * @return column delta between consecutive cells of a slot in this orientation
     */
    public int columnStep() {
        return columnStep;
    }
}
