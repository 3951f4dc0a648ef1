package com.questrail.crossword.solver.internal;

import com.questrail.crossword.api.Slot;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Unary length filter: removes every candidate whose length differs from its
 * slot's length. Single pass, slots are independent of each other.
 */
public final class NodeConsistency
{
    /**
     * Enforces node consistency on every domain of the store.
     *
     * @return number of candidates removed
     */
    public long enforce(DomainStore domains) {
        Objects.requireNonNull(domains, "domains");
        long removed = 0;
        for (Slot slot : domains.slots()) {
            List<String> wrongLength = new ArrayList<>();
            for (String word : domains.domain(slot)) {
                if (word.length() != slot.length()) {
                    wrongLength.add(word);
                }
            }
            for (String word : wrongLength) {
                domains.remove(slot, word);
            }
            removed += wrongLength.size();
        }
        return removed;
    }
}
