package com.questrail.crossword.solver.observability;

import com.questrail.crossword.api.SolveResult;

/**
 * Receives solver observability events.
 * Implementations can provide logging, metrics, or tracing.
 * <p>
 * Sinks are called synchronously on the solving thread and must not throw.
 */
public interface SolverObservabilitySink {
    /**
     * Called when node consistency, arc consistency or search finishes.
     * @param event the phase details
     */
    void onPhaseCompleted(SolverPhaseEvent event);

    /**
     * Called once per slot left with an empty domain after a propagation phase.
     * @param event the wiped-out slot
     */
    void onDomainWipeout(DomainWipeoutEvent event);

    /**
     * Called once per solve with the final result.
     * @param result the result returned to the caller
     */
    void onSolveFinished(SolveResult result);
}
