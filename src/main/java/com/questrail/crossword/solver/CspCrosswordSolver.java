package com.questrail.crossword.solver;

import com.questrail.crossword.api.Assignment;
import com.questrail.crossword.api.CrosswordSolver;
import com.questrail.crossword.api.Slot;
import com.questrail.crossword.api.SolveResult;
import com.questrail.crossword.api.SolveStatistics;
import com.questrail.crossword.api.Vocabulary;
import com.questrail.crossword.solver.config.SolverConfig;
import com.questrail.crossword.solver.internal.ArcConsistency;
import com.questrail.crossword.solver.internal.AssignmentConsistency;
import com.questrail.crossword.solver.internal.BacktrackingSearch;
import com.questrail.crossword.solver.internal.DomainStore;
import com.questrail.crossword.solver.internal.NodeConsistency;
import com.questrail.crossword.solver.internal.ValueOrderer;
import com.questrail.crossword.solver.internal.VariableSelector;
import com.questrail.crossword.solver.observability.DomainWipeoutEvent;
import com.questrail.crossword.solver.observability.NullSolverObservabilitySink;
import com.questrail.crossword.solver.observability.SolverObservabilitySink;
import com.questrail.crossword.solver.observability.SolverPhase;
import com.questrail.crossword.solver.observability.SolverPhaseEvent;
import com.questrail.crossword.structure.PuzzleStructure;

import java.util.Objects;
import java.util.Optional;

/**
 * CspCrosswordSolver
 * =============================================================================
 * {@link CrosswordSolver} that treats the puzzle as a constraint-satisfaction
 * problem.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   PuzzleStructure + Vocabulary
 *        → DomainStore            (full vocabulary in every slot)
 *            → NodeConsistency    (length filter)
 *                → ArcConsistency (AC-3 over crossing slots)
 *                    → BacktrackingSearch
 *                        → SolveResult
 * </pre>
 *
 * A phase that leaves a domain empty ends the solve with the matching
 * unsatisfiable outcome; later phases do not run.
 *
 * <h2>Threading</h2>
 * Each {@link #solve} call builds its own domains and assignment, so one solver
 * instance may be shared. A single solve runs entirely on the calling thread.
 */
public final class CspCrosswordSolver implements CrosswordSolver
{
    private final SolverConfig config;
    private final SolverObservabilitySink observabilitySink;

    public CspCrosswordSolver() {
        this(SolverConfig.defaults(), NullSolverObservabilitySink.INSTANCE);
    }

    public CspCrosswordSolver(SolverConfig config) {
        this(config, NullSolverObservabilitySink.INSTANCE);
    }

    public CspCrosswordSolver(SolverConfig config, SolverObservabilitySink observabilitySink) {
        this.config = Objects.requireNonNull(config, "config");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    public SolverConfig config() {
        return config;
    }

    @Override
    public SolveResult solve(PuzzleStructure structure, Vocabulary vocabulary) {
        Objects.requireNonNull(structure, "structure");
        Objects.requireNonNull(vocabulary, "vocabulary");

        DomainStore domains = DomainStore.initialize(structure.slots(), vocabulary);
        long initial = domains.totalCandidates();

        // Node consistency
        long removedByNodes = new NodeConsistency().enforce(domains);
        boolean nodesOk = !domains.anyEmpty();
        completePhase(SolverPhase.NODE_CONSISTENCY, nodesOk, initial, domains);
        if (!nodesOk) {
            SolveStatistics stats = new SolveStatistics(initial, removedByNodes, 0, 0, 0, 0);
            return finish(SolveResult.unsatisfiable(
                    SolveResult.Outcome.UNSATISFIABLE_NODE_CONSISTENCY, stats));
        }

        // Arc consistency
        long removedByArcs = 0;
        long revisions = 0;
        if (config.arcConsistencyEnabled()) {
            long before = domains.totalCandidates();
            ArcConsistency arcConsistency = new ArcConsistency(structure, domains);
            boolean arcsOk = arcConsistency.enforce();
            removedByArcs = arcConsistency.removed();
            revisions = arcConsistency.revisions();
            completePhase(SolverPhase.ARC_CONSISTENCY, arcsOk, before, domains);
            if (!arcsOk) {
                SolveStatistics stats = new SolveStatistics(
                        initial, removedByNodes, removedByArcs, revisions, 0, 0);
                return finish(SolveResult.unsatisfiable(
                        SolveResult.Outcome.UNSATISFIABLE_ARC_CONSISTENCY, stats));
            }
        }

        // Search
        BacktrackingSearch search = new BacktrackingSearch(
                structure,
                VariableSelector.forPolicy(config.variableSelection(), structure, domains),
                ValueOrderer.forPolicy(config.valueOrdering(), structure, domains),
                new AssignmentConsistency(structure));
        Optional<Assignment> solution = search.search();

        long candidates = domains.totalCandidates();
        observabilitySink.onPhaseCompleted(
                new SolverPhaseEvent(SolverPhase.SEARCH, solution.isPresent(), candidates, candidates));

        SolveStatistics stats = new SolveStatistics(
                initial, removedByNodes, removedByArcs, revisions,
                search.assignmentsTried(), search.backtracks());
        return finish(solution
                .map(assignment -> SolveResult.solved(assignment, stats))
                .orElseGet(() -> SolveResult.unsatisfiable(SolveResult.Outcome.SEARCH_EXHAUSTED, stats)));
    }

    private void completePhase(SolverPhase phase, boolean succeeded, long before, DomainStore domains) {
        for (Slot slot : domains.emptySlots()) {
            observabilitySink.onDomainWipeout(new DomainWipeoutEvent(phase, slot));
        }
        observabilitySink.onPhaseCompleted(
                new SolverPhaseEvent(phase, succeeded, before, domains.totalCandidates()));
    }

    private SolveResult finish(SolveResult result) {
        observabilitySink.onSolveFinished(result);
        return result;
    }
}
