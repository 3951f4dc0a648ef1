package com.questrail.crossword.solver.observability;

import com.questrail.crossword.api.SolveResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SolverObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSolverObservabilitySink implements SolverObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSolverObservabilitySink.class);

    @Override
    public void onPhaseCompleted(SolverPhaseEvent event) {
        if (event.succeeded()) {
            log.info("{} completed: {} -> {} candidates",
                event.phase(),
                event.candidatesBefore(),
                event.candidatesAfter());
        } else {
            log.info("{} failed: {} -> {} candidates",
                event.phase(),
                event.candidatesBefore(),
                event.candidatesAfter());
        }
    }

    @Override
    public void onDomainWipeout(DomainWipeoutEvent event) {
        log.info("Domain wipeout for {} during {}", event.slot(), event.phase());
    }

    @Override
    public void onSolveFinished(SolveResult result) {
        log.info("Solve finished: {}", result.outcome());
        log.debug("Solve statistics: {}", result.statistics());
    }
}
