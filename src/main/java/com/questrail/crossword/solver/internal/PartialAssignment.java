package com.questrail.crossword.solver.internal;

import com.questrail.crossword.api.Assignment;
import com.questrail.crossword.api.Slot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The assignment under construction during backtracking search.
 * <p>
 * Extended and retracted one slot at a time: {@link #assign} before descending,
 * {@link #unassign} after a failed subtree. Owned by a single search.
 */
public final class PartialAssignment
{
    private final Map<Slot, String> words = new LinkedHashMap<>();
    private final Map<Slot, String> view = Collections.unmodifiableMap(words);

    public void assign(Slot slot, String word) {
        Objects.requireNonNull(slot, "slot");
        Objects.requireNonNull(word, "word");
        if (words.putIfAbsent(slot, word) != null) {
            throw new IllegalStateException(slot + " is already assigned");
        }
    }

    public void unassign(Slot slot) {
        if (words.remove(slot) == null) {
            throw new IllegalStateException(slot + " is not assigned");
        }
    }

    public boolean isAssigned(Slot slot) {
        return words.containsKey(slot);
    }

    public String word(Slot slot) {
        return words.get(slot);
    }

    public boolean containsWord(String word) {
        return words.containsValue(word);
    }

    public int size() {
        return words.size();
    }

    /**
     * @return a read-only live view
     */
    public Map<Slot, String> asMap() {
        return view;
    }

    public Assignment snapshot() {
        return Assignment.of(words);
    }

    @Override
    public String toString() {
        return words.toString();
    }
}
