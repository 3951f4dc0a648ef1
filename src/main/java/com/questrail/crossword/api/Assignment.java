package com.questrail.crossword.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable mapping from {@link Slot} to the word placed in it.
 * <p>
 * The solver hands out complete assignments only; presentation code reads them
 * and never mutates solver state.
 */
public final class Assignment
{
    private final Map<Slot, String> words;

    private Assignment(Map<Slot, String> words) {
        this.words = Collections.unmodifiableMap(words);
    }

    /**
     * Snapshots the given mapping. Later changes to {@code words} are not seen.
     */
    public static Assignment of(Map<Slot, String> words) {
        Objects.requireNonNull(words, "words");
        Map<Slot, String> copy = new LinkedHashMap<>();
        words.forEach((slot, word) -> copy.put(
                Objects.requireNonNull(slot, "slot"),
                Objects.requireNonNull(word, "word for " + slot)));
        return new Assignment(copy);
    }

    public static Assignment empty() {
        return new Assignment(Map.of());
    }

    public Optional<String> word(Slot slot) {
        Objects.requireNonNull(slot, "slot");
        return Optional.ofNullable(words.get(slot));
    }

    public Set<Slot> slots() {
        return words.keySet();
    }

    public Map<Slot, String> asMap() {
        return words;
    }

    public int size() {
        return words.size();
    }

    /**
     * @return {@code true} if every slot in {@code slots} has a word
     */
    public boolean covers(Set<Slot> slots) {
        return words.keySet().containsAll(slots);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Assignment that)) return false;
        return words.equals(that.words);
    }

    @Override
    public int hashCode() {
        return words.hashCode();
    }

    @Override
    public String toString() {
        return words.toString();
    }
}
