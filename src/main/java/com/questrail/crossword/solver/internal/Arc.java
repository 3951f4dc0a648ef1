package com.questrail.crossword.solver.internal;

import com.questrail.crossword.api.Slot;

import java.util.Objects;

/**
 * A directed binary constraint: {@code from}'s domain is revised against {@code to}'s.
 */
public record Arc(Slot from, Slot to) {
    public Arc {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (from.equals(to)) {
            throw new IllegalArgumentException("An arc needs two distinct slots: " + from);
        }
    }
}
