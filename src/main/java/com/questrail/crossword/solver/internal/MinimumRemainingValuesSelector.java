package com.questrail.crossword.solver.internal;

import com.questrail.crossword.api.Slot;
import com.questrail.crossword.structure.PuzzleStructure;

import java.util.Objects;

/**
 * Minimum-remaining-values selection with a degree tie-break.
 * <p>
 * Among unassigned slots, the one with the smallest domain wins. Equal domain
 * sizes go to the slot crossing the most other slots. Remaining ties go to the
 * earliest slot in structure order, which keeps search fully deterministic.
 */
public final class MinimumRemainingValuesSelector implements VariableSelector
{
    private final PuzzleStructure structure;
    private final DomainStore domains;

    public MinimumRemainingValuesSelector(PuzzleStructure structure, DomainStore domains) {
        this.structure = Objects.requireNonNull(structure, "structure");
        this.domains = Objects.requireNonNull(domains, "domains");
    }

    @Override
    public Slot select(PartialAssignment assignment) {
        Slot best = null;
        int bestSize = Integer.MAX_VALUE;
        int bestDegree = -1;

        for (Slot slot : structure.slots()) {
            if (assignment.isAssigned(slot)) {
                continue;
            }
            int size = domains.size(slot);
            int degree = structure.degree(slot);
            if (size < bestSize || (size == bestSize && degree > bestDegree)) {
                best = slot;
                bestSize = size;
                bestDegree = degree;
            }
        }

        if (best == null) {
            throw new IllegalStateException("All slots are assigned");
        }
        return best;
    }
}
