package com.questrail.crossword.solver.observability;

import com.questrail.crossword.api.SolveResult;

/**
 * No-op implementation of SolverObservabilitySink.
 */
public final class NullSolverObservabilitySink implements SolverObservabilitySink {
    public static final NullSolverObservabilitySink INSTANCE = new NullSolverObservabilitySink();

    private NullSolverObservabilitySink() {}

    @Override
    public void onPhaseCompleted(SolverPhaseEvent event) {}

    @Override
    public void onDomainWipeout(DomainWipeoutEvent event) {}

    @Override
    public void onSolveFinished(SolveResult result) {}
}
