package com.questrail.crossword.render;

/**
 * Pixel geometry for {@link PngGridRenderer}.
 *
 * @param cellSize   edge length of one cell
 * @param cellBorder inset of the white cell rectangle from the cell edge
 * @param fontSize   letter size in points
 */
public record GridImageStyle(int cellSize, int cellBorder, int fontSize) {
    public GridImageStyle {
        if (cellSize <= 0) {
            throw new IllegalArgumentException("cellSize must be positive");
        }
        if (cellBorder < 0 || 2 * cellBorder >= cellSize) {
            throw new IllegalArgumentException("cellBorder must be in [0, cellSize/2)");
        }
        if (fontSize <= 0) {
            throw new IllegalArgumentException("fontSize must be positive");
        }
    }

    /**
     * 100px cells with a 2px border and 80pt letters.
     */
    public static GridImageStyle defaults() {
        return new GridImageStyle(100, 2, 80);
    }

    public int interiorSize() {
        return cellSize - 2 * cellBorder;
    }
}
