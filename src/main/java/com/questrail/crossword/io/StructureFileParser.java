package com.questrail.crossword.io;

import com.questrail.crossword.structure.GridPuzzleStructure;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * StructureFileParser
 * -----------------------------------------------------------------------------
 * Reads the textual grid format:
 *
 * <pre>
 *   #___#
 *   #_##_
 *   #_##_
 *   #_##_
 *   #____
 * </pre>
 *
 * <ul>
 *   <li>Each line is one row.</li>
 *   <li>{@code _} is a fillable cell; every other character is blocked.</li>
 *   <li>The grid is as wide as its longest line; shorter lines are padded with
 *       blocked cells.</li>
 *   <li>Trailing empty lines are ignored.</li>
 * </ul>
 */
public final class StructureFileParser
{
    public static final char FILLABLE = '_';

    public GridPuzzleStructure parse(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return parse(Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    /**
     * @throws PuzzleFormatException if there are no rows or no fillable cells
     */
    public GridPuzzleStructure parse(List<String> lines) {
        Objects.requireNonNull(lines, "lines");

        int height = lines.size();
        while (height > 0 && lines.get(height - 1).isEmpty()) {
            height--;
        }
        if (height == 0) {
            throw new PuzzleFormatException("Structure has no rows");
        }

        int width = 0;
        for (int row = 0; row < height; row++) {
            width = Math.max(width, lines.get(row).length());
        }
        if (width == 0) {
            throw new PuzzleFormatException("Structure has no columns");
        }

        boolean[][] grid = new boolean[height][width];
        boolean anyFillable = false;
        for (int row = 0; row < height; row++) {
            String line = lines.get(row);
            for (int column = 0; column < line.length(); column++) {
                if (line.charAt(column) == FILLABLE) {
                    grid[row][column] = true;
                    anyFillable = true;
                }
            }
        }
        if (!anyFillable) {
            throw new PuzzleFormatException("Structure has no fillable cells");
        }

        return GridPuzzleStructure.fromGrid(grid);
    }
}
