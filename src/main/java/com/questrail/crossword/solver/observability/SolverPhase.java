package com.questrail.crossword.solver.observability;

/**
 * The stages of a solve, in execution order.
 */
public enum SolverPhase
{
    NODE_CONSISTENCY,
    ARC_CONSISTENCY,
    SEARCH
}
