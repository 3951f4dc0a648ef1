package com.questrail.crossword.solver.internal;

import com.questrail.crossword.api.Assignment;
import com.questrail.crossword.api.Slot;
import com.questrail.crossword.structure.PuzzleStructure;

import java.util.Objects;
import java.util.Optional;

/**
 * BacktrackingSearch
 * -----------------------------------------------------------------------------
 * Depth-first search over partial assignments.
 *
 * <h2>Transition</h2>
 * Pick an unassigned slot with the {@link VariableSelector}; try its candidates
 * in {@link ValueOrderer} order; extend the assignment with the first candidate
 * the {@link AssignmentConsistency} check admits and descend. A failed subtree
 * undoes its extension and the next candidate is tried. When no candidate is
 * left, the failure goes back to the caller.
 *
 * <h2>Domains</h2>
 * Domains are read for candidate enumeration and heuristics only. Propagation
 * ran once before search; nothing here removes candidates.
 *
 * <h2>Depth</h2>
 * Each recursion level assigns one slot, so depth never exceeds the slot count.
 */
public final class BacktrackingSearch
{
    private final PuzzleStructure structure;
    private final VariableSelector variableSelector;
    private final ValueOrderer valueOrderer;
    private final AssignmentConsistency consistency;

    private long assignmentsTried;
    private long backtracks;

    public BacktrackingSearch(PuzzleStructure structure,
                              VariableSelector variableSelector,
                              ValueOrderer valueOrderer,
                              AssignmentConsistency consistency) {
        this.structure = Objects.requireNonNull(structure, "structure");
        this.variableSelector = Objects.requireNonNull(variableSelector, "variableSelector");
        this.valueOrderer = Objects.requireNonNull(valueOrderer, "valueOrderer");
        this.consistency = Objects.requireNonNull(consistency, "consistency");
    }

    /**
     * Searches for a complete, consistent assignment.
     *
     * @return the solution, or empty if the search space holds none
     * @throws IllegalStateException if the found assignment fails the full consistency check
     */
    public Optional<Assignment> search() {
        PartialAssignment assignment = new PartialAssignment();
        if (!backtrack(assignment)) {
            return Optional.empty();
        }
        if (!consistency.isConsistent(assignment.asMap())) {
            throw new IllegalStateException("Search produced an inconsistent assignment: " + assignment);
        }
        return Optional.of(assignment.snapshot());
    }

    /**
     * @return tentative assignments that passed the consistency check
     */
    public long assignmentsTried() {
        return assignmentsTried;
    }

    /**
     * @return tentative assignments undone after their subtree failed
     */
    public long backtracks() {
        return backtracks;
    }

    private boolean backtrack(PartialAssignment assignment) {
        if (assignment.size() == structure.slots().size()) {
            return true;
        }

        Slot slot = variableSelector.select(assignment);
        for (String word : valueOrderer.order(slot, assignment)) {
            if (!consistency.admits(assignment, slot, word)) {
                continue;
            }
            assignmentsTried++;
            assignment.assign(slot, word);
            if (backtrack(assignment)) {
                return true;
            }
            assignment.unassign(slot);
            backtracks++;
        }
        return false;
    }
}
