package com.questrail.crossword.solver.internal;

import com.questrail.crossword.api.Slot;
import com.questrail.crossword.structure.PuzzleStructure;

import java.util.Objects;

/**
 * Picks the earliest unassigned slot in structure order.
 */
public final class FirstUnassignedSelector implements VariableSelector
{
    private final PuzzleStructure structure;

    public FirstUnassignedSelector(PuzzleStructure structure) {
        this.structure = Objects.requireNonNull(structure, "structure");
    }

    @Override
    public Slot select(PartialAssignment assignment) {
        for (Slot slot : structure.slots()) {
            if (!assignment.isAssigned(slot)) {
                return slot;
            }
        }
        throw new IllegalStateException("All slots are assigned");
    }
}
