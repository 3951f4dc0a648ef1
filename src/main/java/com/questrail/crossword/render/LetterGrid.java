package com.questrail.crossword.render;

import com.questrail.crossword.api.Assignment;
import com.questrail.crossword.api.Slot;
import com.questrail.crossword.structure.PuzzleStructure;

import java.util.Map;
import java.util.Objects;

/**
 * Cell-by-cell view of an assignment laid onto its grid.
 * <p>
 * A cell holds {@code null} when it is blocked or no assigned slot covers it.
 * Building a letter grid never changes the structure or the assignment.
 */
public final class LetterGrid
{
    private final PuzzleStructure structure;
    private final Character[][] letters;

    private LetterGrid(PuzzleStructure structure, Character[][] letters) {
        this.structure = structure;
        this.letters = letters;
    }

    public static LetterGrid of(PuzzleStructure structure, Assignment assignment) {
        Objects.requireNonNull(structure, "structure");
        Objects.requireNonNull(assignment, "assignment");

        Character[][] letters = new Character[structure.height()][structure.width()];
        for (Map.Entry<Slot, String> entry : assignment.asMap().entrySet()) {
            Slot slot = entry.getKey();
            String word = entry.getValue();
            int n = Math.min(word.length(), slot.length());
            for (int k = 0; k < n; k++) {
                letters[slot.rowAt(k)][slot.columnAt(k)] = word.charAt(k);
            }
        }
        return new LetterGrid(structure, letters);
    }

    public PuzzleStructure structure() {
        return structure;
    }

    public int height() {
        return letters.length;
    }

    public int width() {
        return structure.width();
    }

    /**
     * @return the letter at the cell, or {@code null}
     */
    public Character letterAt(int row, int column) {
        Objects.checkIndex(row, height());
        Objects.checkIndex(column, width());
        return letters[row][column];
    }
}
