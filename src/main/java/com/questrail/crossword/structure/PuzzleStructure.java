package com.questrail.crossword.structure;

import com.questrail.crossword.api.Overlap;
import com.questrail.crossword.api.Slot;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * PuzzleStructure
 * -----------------------------------------------------------------------------
 * {@code PuzzleStructure} is the immutable, pre-parsed description of a crossword
 * grid that the solver consumes.
 *
 * <h2>What it exposes</h2>
 * <ul>
 *   <li>Grid dimensions and the fillable/blocked state of every cell</li>
 *   <li>The derived {@link Slot}s (the CSP variables), in a stable order</li>
 *   <li>The overlap table: for every pair of slots, either no shared cell or the
 *       exact letter positions that must agree</li>
 *   <li>A neighbor query: the slots crossing a given slot</li>
 * </ul>
 *
 * <h2>Overlap symmetry</h2>
 * Implementations must guarantee that {@code overlap(b, a)} is
 * {@code overlap(a, b).map(Overlap::swapped)}, and that a slot never overlaps
 * itself.
 *
 * <h2>Immutability</h2>
 * The structure is computed once when the puzzle is loaded. Neither the solver
 * nor the presentation layer may change it.
 */
public interface PuzzleStructure
{
    /**
     * @return number of rows in the grid
     */
    int height();

    /**
     * @return number of columns in the grid
     */
    int width();

    /**
     * Returns whether the cell at the given position can hold a letter.
     *
     * @throws IndexOutOfBoundsException if the cell is outside the grid
     */
    boolean isFillable(int row, int column);

    /**
     * Returns all slots of the puzzle in a stable order.
     *
     * @return an unmodifiable list of slots
     */
    List<Slot> slots();

    /**
     * Returns the slots that share a cell with {@code slot}, in slot order.
     *
     * @throws IllegalArgumentException if the slot is unknown to this structure
     */
    Set<Slot> neighbors(Slot slot);

    /**
     * Returns the letter positions that {@code a} and {@code b} must agree on.
     *
     * @return the overlap seen from {@code a}, or empty if the slots do not cross
     * @throws IllegalArgumentException if either slot is unknown to this structure
     */
    Optional<Overlap> overlap(Slot a, Slot b);

    /**
     * Returns true if the given slot belongs to this structure.
     */
    default boolean contains(Slot slot) {
        Objects.requireNonNull(slot, "slot");
        return slots().contains(slot);
    }

    /**
     * Returns the number of slots crossing {@code slot}.
     */
    default int degree(Slot slot) {
        return neighbors(slot).size();
    }
}
