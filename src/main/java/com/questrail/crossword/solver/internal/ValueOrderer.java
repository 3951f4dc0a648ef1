package com.questrail.crossword.solver.internal;

import com.questrail.crossword.api.Slot;
import com.questrail.crossword.solver.config.ValueOrdering;
import com.questrail.crossword.structure.PuzzleStructure;

import java.util.List;

/**
 * Strategy for ordering a slot's candidate words during backtracking search.
 * Implementations read the {@link DomainStore} but never modify it.
 */
@FunctionalInterface
public interface ValueOrderer
{
    /**
     * @return the slot's current candidates, in the order they should be tried
     */
    List<String> order(Slot slot, PartialAssignment assignment);

    static ValueOrderer forPolicy(ValueOrdering policy,
                                  PuzzleStructure structure,
                                  DomainStore domains) {
        return switch (policy) {
            case LEAST_CONSTRAINING -> new LeastConstrainingValueOrderer(structure, domains);
            case DOMAIN_ORDER -> new DomainOrderValueOrderer(domains);
        };
    }
}
