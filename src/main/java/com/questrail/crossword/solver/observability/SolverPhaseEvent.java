package com.questrail.crossword.solver.observability;

import java.util.Objects;

/**
 * Record describing a completed solver phase.
 *
 * @param phase             the phase that finished
 * @param succeeded         {@code false} if the phase proved the puzzle unsatisfiable
 * @param candidatesBefore  total candidates across all domains when the phase started
 * @param candidatesAfter   total candidates across all domains when the phase ended
 */
public record SolverPhaseEvent(
        SolverPhase phase,
        boolean succeeded,
        long candidatesBefore,
        long candidatesAfter
) {
    public SolverPhaseEvent {
        Objects.requireNonNull(phase, "phase");
    }

    /**
     * @return candidates removed during the phase
     */
    public long removed() {
        return candidatesBefore - candidatesAfter;
    }
}
