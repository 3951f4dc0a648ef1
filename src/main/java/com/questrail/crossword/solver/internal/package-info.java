/**
 * Crossword CSP Engine
 * =============================================================================
 *
 * <p>Internal building blocks of {@link com.questrail.crossword.solver.CspCrosswordSolver}.
 * Nothing here is part of the public API.</p>
 *
 * <h2>Data Flow</h2>
 * <pre>
 *   Vocabulary
 *        → DomainStore.initialize
 *        → NodeConsistency.enforce
 *        → ArcConsistency.enforce
 *        → BacktrackingSearch.search
 *        → Assignment
 * </pre>
 *
 * <p>A {@link com.questrail.crossword.solver.internal.DomainStore} only shrinks.
 * Propagation runs once before search; the search reads domains but never
 * removes from them.</p>
 */
package com.questrail.crossword.solver.internal;
