package com.questrail.crossword.structure;

import com.questrail.crossword.api.Overlap;
import com.questrail.crossword.api.Slot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * GridPuzzleStructure
 * -----------------------------------------------------------------------------
 * The default {@link PuzzleStructure}, backed by:
 *
 * <ul>
 *   <li>a boolean matrix for the fillable cells</li>
 *   <li>an ordered list of slots</li>
 *   <li>a map from ordered slot pair to {@link Overlap}</li>
 *   <li>a map from slot to its crossing slots</li>
 * </ul>
 *
 * Everything is computed eagerly from geometry at construction time and never
 * changes afterwards. Malformed input is rejected here, before any solving
 * starts.
 *
 * <h2>Slot derivation</h2>
 * {@link #fromGrid(boolean[][])} turns every maximal horizontal run of at least
 * two fillable cells into an ACROSS slot and every maximal vertical run of at
 * least two into a DOWN slot. A fillable cell covered by neither becomes a
 * one-letter ACROSS slot, so that no fillable cell is left without a variable.
 */
public final class GridPuzzleStructure implements PuzzleStructure
{
    private static final Comparator<Slot> SLOT_ORDER = Comparator
            .comparingInt(Slot::row)
            .thenComparingInt(Slot::column)
            .thenComparing(Slot::orientation);

    private final int height;
    private final int width;
    private final boolean[][] fillable;
    private final List<Slot> slots;
    private final Map<SlotPair, Overlap> overlaps;
    private final Map<Slot, Set<Slot>> neighbors;

    private GridPuzzleStructure(boolean[][] fillable, Collection<Slot> slots) {
        this.height = fillable.length;
        this.width = fillable[0].length;
        this.fillable = fillable;

        List<Slot> ordered = new ArrayList<>(slots);
        ordered.sort(SLOT_ORDER);
        this.slots = Collections.unmodifiableList(ordered);

        this.overlaps = new HashMap<>();
        this.neighbors = new LinkedHashMap<>();
        for (Slot slot : ordered) {
            neighbors.put(slot, new LinkedHashSet<>());
        }
        for (int i = 0; i < ordered.size(); i++) {
            for (int j = i + 1; j < ordered.size(); j++) {
                Slot a = ordered.get(i);
                Slot b = ordered.get(j);
                sharedCell(a, b).ifPresent(overlap -> {
                    overlaps.put(new SlotPair(a, b), overlap);
                    overlaps.put(new SlotPair(b, a), overlap.swapped());
                    neighbors.get(a).add(b);
                    neighbors.get(b).add(a);
                });
            }
        }
        neighbors.replaceAll((slot, set) -> Collections.unmodifiableSet(set));
    }

    /**
     * Derives slots and overlaps from a fillability matrix.
     *
     * @param fillable {@code fillable[row][column]}; must be non-empty and rectangular
     * @return the structure
     * @throws IllegalArgumentException if the matrix is empty or ragged
     */
    public static GridPuzzleStructure fromGrid(boolean[][] fillable) {
        boolean[][] grid = copyRectangular(fillable);
        int height = grid.length;
        int width = grid[0].length;

        List<Slot> slots = new ArrayList<>();
        boolean[][] covered = new boolean[height][width];

        for (int row = 0; row < height; row++) {
            int column = 0;
            while (column < width) {
                if (!grid[row][column]) {
                    column++;
                    continue;
                }
                int start = column;
                while (column < width && grid[row][column]) {
                    column++;
                }
                if (column - start > 1) {
                    Slot slot = Slot.across(row, start, column - start);
                    slots.add(slot);
                    markCovered(covered, slot);
                }
            }
        }

        for (int column = 0; column < width; column++) {
            int row = 0;
            while (row < height) {
                if (!grid[row][column]) {
                    row++;
                    continue;
                }
                int start = row;
                while (row < height && grid[row][column]) {
                    row++;
                }
                if (row - start > 1) {
                    Slot slot = Slot.down(start, column, row - start);
                    slots.add(slot);
                    markCovered(covered, slot);
                }
            }
        }

        // Isolated cells still need a word.
        for (int row = 0; row < height; row++) {
            for (int column = 0; column < width; column++) {
                if (grid[row][column] && !covered[row][column]) {
                    slots.add(Slot.across(row, column, 1));
                }
            }
        }

        return new GridPuzzleStructure(grid, slots);
    }

    /**
     * Builds a structure from explicitly supplied slots. The fillable cells are
     * exactly the cells covered by the slots.
     *
     * @throws IllegalArgumentException if a slot leaves the grid, slots repeat, or
     *         two slots share more than one cell
     */
    public static GridPuzzleStructure fromSlots(int height, int width, Collection<Slot> slots) {
        Objects.requireNonNull(slots, "slots");
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException(
                    "Grid dimensions must be positive (was " + height + "x" + width + ")");
        }
        Set<Slot> unique = new LinkedHashSet<>();
        boolean[][] grid = new boolean[height][width];
        for (Slot slot : slots) {
            Objects.requireNonNull(slot, "slot");
            if (!unique.add(slot)) {
                throw new IllegalArgumentException("Duplicate slot: " + slot);
            }
            if (slot.lastRow() >= height || slot.lastColumn() >= width) {
                throw new IllegalArgumentException(
                        slot + " does not fit in a " + height + "x" + width + " grid");
            }
            markCovered(grid, slot);
        }
        return new GridPuzzleStructure(grid, unique);
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public boolean isFillable(int row, int column) {
        Objects.checkIndex(row, height);
        Objects.checkIndex(column, width);
        return fillable[row][column];
    }

    @Override
    public List<Slot> slots() {
        return slots;
    }

    @Override
    public Set<Slot> neighbors(Slot slot) {
        Objects.requireNonNull(slot, "slot");
        Set<Slot> result = neighbors.get(slot);
        if (result == null) {
            throw new IllegalArgumentException("Unknown slot: " + slot);
        }
        return result;
    }

    @Override
    public Optional<Overlap> overlap(Slot a, Slot b) {
        requireKnown(a);
        requireKnown(b);
        return Optional.ofNullable(overlaps.get(new SlotPair(a, b)));
    }

    @Override
    public boolean contains(Slot slot) {
        Objects.requireNonNull(slot, "slot");
        return neighbors.containsKey(slot);
    }

    @Override
    public String toString() {
        return "GridPuzzleStructure[" + height + "x" + width + ", " + slots.size() + " slots]";
    }

    private void requireKnown(Slot slot) {
        if (!contains(slot)) {
            throw new IllegalArgumentException("Unknown slot: " + slot);
        }
    }

    private static Optional<Overlap> sharedCell(Slot a, Slot b) {
        Overlap found = null;
        for (int k = 0; k < a.length(); k++) {
            int other = b.positionOf(a.rowAt(k), a.columnAt(k));
            if (other < 0) {
                continue;
            }
            if (found != null) {
                throw new IllegalArgumentException(a + " and " + b + " share more than one cell");
            }
            found = new Overlap(k, other);
        }
        return Optional.ofNullable(found);
    }

    private static void markCovered(boolean[][] grid, Slot slot) {
        for (int k = 0; k < slot.length(); k++) {
            grid[slot.rowAt(k)][slot.columnAt(k)] = true;
        }
    }

    private static boolean[][] copyRectangular(boolean[][] fillable) {
        Objects.requireNonNull(fillable, "fillable");
        if (fillable.length == 0 || fillable[0] == null || fillable[0].length == 0) {
            throw new IllegalArgumentException("Grid must have at least one row and one column");
        }
        int width = fillable[0].length;
        boolean[][] copy = new boolean[fillable.length][];
        for (int row = 0; row < fillable.length; row++) {
            boolean[] line = Objects.requireNonNull(fillable[row], "row " + row);
            if (line.length != width) {
                throw new IllegalArgumentException(
                        "Grid is not rectangular: row " + row + " has " + line.length
                                + " cells, expected " + width);
            }
            copy[row] = line.clone();
        }
        return copy;
    }

    private record SlotPair(Slot first, Slot second) {}
}
