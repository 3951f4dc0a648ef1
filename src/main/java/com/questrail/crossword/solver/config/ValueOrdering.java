package com.questrail.crossword.solver.config;

/**
 * Policy for ordering a slot's candidate words during backtracking search.
 * Ordering affects only how quickly a solution is found, never which puzzles
 * are solvable.
 */
public enum ValueOrdering
{
    /**
     * Words that rule out the fewest candidates in unassigned crossing slots
     * come first. Ties keep domain order.
     */
    LEAST_CONSTRAINING,

    /**
     * Domain iteration order, which is vocabulary order.
     */
    DOMAIN_ORDER
}
