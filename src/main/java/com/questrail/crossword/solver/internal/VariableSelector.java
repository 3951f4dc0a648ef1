package com.questrail.crossword.solver.internal;

import com.questrail.crossword.api.Slot;
import com.questrail.crossword.solver.config.VariableSelection;
import com.questrail.crossword.structure.PuzzleStructure;

/**
 * Strategy for picking the next slot to fill during backtracking search.
 */
@FunctionalInterface
public interface VariableSelector
{
    /**
     * Returns an unassigned slot.
     *
     * @throws IllegalStateException if every slot is already assigned
     */
    Slot select(PartialAssignment assignment);

    static VariableSelector forPolicy(VariableSelection policy,
                                      PuzzleStructure structure,
                                      DomainStore domains) {
        return switch (policy) {
            case MINIMUM_REMAINING_VALUES -> new MinimumRemainingValuesSelector(structure, domains);
            case FIRST_UNASSIGNED -> new FirstUnassignedSelector(structure);
        };
    }
}
