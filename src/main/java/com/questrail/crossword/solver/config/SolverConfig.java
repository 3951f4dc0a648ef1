package com.questrail.crossword.solver.config;

import java.util.Objects;

/**
 * SolverConfig
 * -----------------------------------------------------------------------------
 * Tuning knobs for the CSP crossword solver.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>variableSelection</b>: how the search picks the next slot to fill.</li>
 *   <li><b>valueOrdering</b>: the order in which a slot's candidate words are tried.</li>
 *   <li><b>arcConsistencyEnabled</b>: whether AC-3 runs once before search. When
 *       disabled, search runs over node-consistent domains and is still complete,
 *       only slower.</li>
 * </ul>
 *
 * None of these parameters change which puzzles are solvable. They only change
 * search order and the amount of pruning done up front.
 */
public record SolverConfig(
        VariableSelection variableSelection,
        ValueOrdering valueOrdering,
        boolean arcConsistencyEnabled
) {
    public SolverConfig {
        Objects.requireNonNull(variableSelection, "variableSelection");
        Objects.requireNonNull(valueOrdering, "valueOrdering");
    }

    /**
     * Default values:
     * <ul>
     *   <li>variableSelection: {@link VariableSelection#MINIMUM_REMAINING_VALUES}</li>
     *   <li>valueOrdering: {@link ValueOrdering#LEAST_CONSTRAINING}</li>
     *   <li>arcConsistencyEnabled: {@code true}</li>
     * </ul>
     */
    public static SolverConfig defaults() {
        return new SolverConfig(
                VariableSelection.MINIMUM_REMAINING_VALUES,
                ValueOrdering.LEAST_CONSTRAINING,
                true
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private VariableSelection variableSelection = VariableSelection.MINIMUM_REMAINING_VALUES;
        private ValueOrdering valueOrdering = ValueOrdering.LEAST_CONSTRAINING;
        private boolean arcConsistencyEnabled = true;

        public Builder withVariableSelection(VariableSelection variableSelection) {
            this.variableSelection = variableSelection;
            return this;
        }

        public Builder withValueOrdering(ValueOrdering valueOrdering) {
            this.valueOrdering = valueOrdering;
            return this;
        }

        public Builder withArcConsistencyEnabled(boolean enabled) {
            this.arcConsistencyEnabled = enabled;
            return this;
        }

        public SolverConfig build() {
            return new SolverConfig(variableSelection, valueOrdering, arcConsistencyEnabled);
        }
    }
}
