package com.questrail.crossword.api;

import java.util.Objects;

/**
 * Slot
 * -----------------------------------------------------------------------------
 * A {@code Slot} is a single CSP variable: a contiguous run of fillable cells in
 * one {@link Orientation} that must hold exactly one word.
 *
 * <h2>Identity</h2>
 * A slot is identified by its start cell, its orientation and its length. Two
 * slots are equal iff all four components are equal. Slots are used as map keys
 * throughout the solver, so equality and hash code are purely structural.
 *
 * <h2>What a Slot is NOT</h2>
 * <ul>
 *   <li>It does not know which words fit it (see {@code DomainStore})</li>
 *   <li>It does not know which slots cross it (see {@code PuzzleStructure})</li>
 * </ul>
 *
 * @param row         zero-based row of the first cell
 * @param column      zero-based column of the first cell
 * @param orientation direction of the run
 * @param length      number of cells, always positive
 */
public record Slot(int row, int column, Orientation orientation, int length)
{
    public Slot {
        Objects.requireNonNull(orientation, "orientation");
        if (row < 0 || column < 0) {
            throw new IllegalArgumentException(
                    "Slot start must be non-negative (was " + row + "," + column + ")");
        }
        if (length <= 0) {
            throw new IllegalArgumentException("Slot length must be positive (was " + length + ")");
        }
    }

    /**
     * Convenience factory for an {@link Orientation#ACROSS} slot.
     */
    public static Slot across(int row, int column, int length) {
        return new Slot(row, column, Orientation.ACROSS, length);
    }

    /**
     * Convenience factory for a {@link Orientation#DOWN} slot.
     */
    public static Slot down(int row, int column, int length) {
        return new Slot(row, column, Orientation.DOWN, length);
    }

    /**
     * Returns the row of the {@code k}-th cell of this slot.
     *
     * @param k zero-based letter position
     * @throws IndexOutOfBoundsException if {@code k} is outside the slot
     */
    public int rowAt(int k) {
        Objects.checkIndex(k, length);
        return row + k * orientation.rowStep();
    }

    /**
     * Returns the column of the {@code k}-th cell of this slot.
     *
     * @param k zero-based letter position
     * @throws IndexOutOfBoundsException if {@code k} is outside the slot
     */
    public int columnAt(int k) {
        Objects.checkIndex(k, length);
        return column + k * orientation.columnStep();
    }

    /**
     * @return the row of the last cell
     */
    public int lastRow() {
        return rowAt(length - 1);
    }

    /**
     * @return the column of the last cell
     */
    public int lastColumn() {
        return columnAt(length - 1);
    }

    /**
     * Returns the letter position at which this slot covers the given cell, or
     * {@code -1} if it does not cover it.
     */
    public int positionOf(int cellRow, int cellColumn) {
        int k = switch (orientation) {
            case ACROSS -> cellRow == row ? cellColumn - column : -1;
            case DOWN -> cellColumn == column ? cellRow - row : -1;
        };
        return k >= 0 && k < length ? k : -1;
    }

    @Override
    public String toString() {
        return "Slot[" + row + "," + column + " " + orientation + " x" + length + "]";
    }
}
