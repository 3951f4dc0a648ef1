package com.questrail.crossword.solver.config;

/**
 * Policy for choosing the next unassigned slot during backtracking search.
 */
public enum VariableSelection
{
    /**
     * Fewest remaining candidates first; ties go to the slot with the most
     * crossing slots, then to the earliest slot in structure order.
     */
    MINIMUM_REMAINING_VALUES,

    /**
     * The earliest unassigned slot in structure order.
     */
    FIRST_UNASSIGNED
}
