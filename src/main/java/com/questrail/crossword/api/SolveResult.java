package com.questrail.crossword.api;

import java.util.Objects;
import java.util.Optional;

/**
 * SolveResult
 * -----------------------------------------------------------------------------
 * Outcome of a single {@link CrosswordSolver#solve} call.
 *
 * <h2>No solution is not an error</h2>
 * An unsatisfiable puzzle is a normal, expected result. The {@link Outcome}
 * records which stage proved it:
 * <ul>
 *   <li>{@link Outcome#UNSATISFIABLE_NODE_CONSISTENCY} – some slot has no word of
 *       the right length; neither propagation nor search ran</li>
 *   <li>{@link Outcome#UNSATISFIABLE_ARC_CONSISTENCY} – AC-3 emptied a domain;
 *       search was skipped</li>
 *   <li>{@link Outcome#SEARCH_EXHAUSTED} – backtracking tried every candidate</li>
 * </ul>
 */
public final class SolveResult
{
    public enum Outcome {
        SOLVED,
        UNSATISFIABLE_NODE_CONSISTENCY,
        UNSATISFIABLE_ARC_CONSISTENCY,
        SEARCH_EXHAUSTED
    }

    private final Outcome outcome;
    private final Assignment solution;
    private final SolveStatistics statistics;

    private SolveResult(Outcome outcome, Assignment solution, SolveStatistics statistics) {
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        this.solution = solution;
        this.statistics = Objects.requireNonNull(statistics, "statistics");
    }

    public static SolveResult solved(Assignment solution, SolveStatistics statistics) {
        return new SolveResult(Outcome.SOLVED, Objects.requireNonNull(solution, "solution"), statistics);
    }

    public static SolveResult unsatisfiable(Outcome outcome, SolveStatistics statistics) {
        if (outcome == Outcome.SOLVED) {
            throw new IllegalArgumentException("A solved result requires a solution");
        }
        return new SolveResult(outcome, null, statistics);
    }

    public Outcome outcome() {
        return outcome;
    }

    public boolean isSolved() {
        return outcome == Outcome.SOLVED;
    }

    /**
     * @return the complete assignment, or empty when there is no solution
     */
    public Optional<Assignment> solution() {
        return Optional.ofNullable(solution);
    }

    public SolveStatistics statistics() {
        return statistics;
    }

    @Override
    public String toString() {
        return "SolveResult[" + outcome + ", " + statistics + "]";
    }
}
