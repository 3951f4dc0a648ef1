package com.questrail.crossword.render;

import com.questrail.crossword.api.Assignment;
import com.questrail.crossword.structure.PuzzleStructure;
import com.questrail.crossword.structure.TestPuzzles;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.questrail.crossword.structure.TestPuzzles.*;
import static org.junit.jupiter.api.Assertions.*;

class LetterGridTest {

    @Test
    void crossingCellHoldsTheSharedLetter() {
        PuzzleStructure crossing = TestPuzzles.crossing();

        LetterGrid grid = LetterGrid.of(crossing, Assignment.of(Map.of(CROSS_A, "CAT", CROSS_B, "ACE")));

        assertEquals('C', grid.letterAt(0, 0));
        assertEquals('A', grid.letterAt(0, 1));
        assertEquals('C', grid.letterAt(1, 1));
        assertEquals('E', grid.letterAt(2, 1));
        assertNull(grid.letterAt(1, 0));
    }

    @Test
    void emptyAssignmentLeavesEveryCellEmpty() {
        LetterGrid grid = LetterGrid.of(TestPuzzles.frame(), Assignment.empty());

        assertEquals(5, grid.height());
        assertEquals(5, grid.width());
        for (int row = 0; row < grid.height(); row++) {
            for (int column = 0; column < grid.width(); column++) {
                assertNull(grid.letterAt(row, column));
            }
        }
    }

    @Test
    void cellsOutsideTheGridAreRejected() {
        LetterGrid grid = LetterGrid.of(TestPuzzles.crossing(), Assignment.empty());

        assertThrows(IndexOutOfBoundsException.class, () -> grid.letterAt(3, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> grid.letterAt(0, -1));
    }
}
