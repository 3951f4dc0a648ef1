package com.questrail.crossword.solver.observability;

import com.questrail.crossword.api.Slot;

import java.util.Objects;

/**
 * Record emitted for each slot whose domain was left empty by a propagation phase.
 */
public record DomainWipeoutEvent(SolverPhase phase, Slot slot) {
    public DomainWipeoutEvent {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(slot, "slot");
    }
}
