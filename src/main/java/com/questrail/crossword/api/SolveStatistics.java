package com.questrail.crossword.api;

/**
 * Counters collected during a single solve.
 *
 * @param initialCandidates          total candidates across all domains before filtering
 * @param removedByNodeConsistency   candidates dropped by the length filter
 * @param removedByArcConsistency    candidates dropped by AC-3
 * @param revisions                  {@code revise} calls that removed at least one candidate
 * @param assignmentsTried           tentative assignments that passed the consistency check
 * @param backtracks                 tentative assignments undone after a failed subtree
 */
public record SolveStatistics(
        long initialCandidates,
        long removedByNodeConsistency,
        long removedByArcConsistency,
        long revisions,
        long assignmentsTried,
        long backtracks
) {
    public static SolveStatistics none() {
        return new SolveStatistics(0, 0, 0, 0, 0, 0);
    }
}
