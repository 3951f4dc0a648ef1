package com.questrail.crossword.api;

import com.questrail.crossword.structure.PuzzleStructure;

/**
 * CrosswordSolver
 * -----------------------------------------------------------------------------
 * Fills every slot of a {@link PuzzleStructure} with a word from a
 * {@link Vocabulary} such that:
 * <ul>
 *   <li>each word has its slot's length</li>
 *   <li>crossing slots agree on the shared letter</li>
 *   <li>no word is used twice</li>
 * </ul>
 *
 * Any satisfying assignment is acceptable; there is no notion of a "better"
 * solution. Implementations must not mutate the structure or the vocabulary.
 */
public interface CrosswordSolver
{
    /**
     * Solves the puzzle.
     *
     * @param structure  the grid and its slots (must not be {@code null})
     * @param vocabulary candidate words (must not be {@code null})
     * @return a solved result carrying a complete assignment, or an
     *         unsatisfiable result; never {@code null}
     */
    SolveResult solve(PuzzleStructure structure, Vocabulary vocabulary);
}
