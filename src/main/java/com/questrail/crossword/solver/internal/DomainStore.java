package com.questrail.crossword.solver.internal;

import com.questrail.crossword.api.Slot;
import com.questrail.crossword.api.Vocabulary;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * DomainStore
 * -----------------------------------------------------------------------------
 * Owns the current candidate word set of every slot.
 *
 * <h2>Lifecycle</h2>
 * A store starts with the full vocabulary in every domain and only ever shrinks.
 * Node consistency and arc consistency remove words; search reads the domains
 * but never removes from them.
 *
 * <h2>Ordering</h2>
 * Each domain keeps vocabulary order, so iteration over a domain is
 * deterministic for a given vocabulary.
 *
 * <h2>Mutability</h2>
 * This class is mutable and makes no thread-safety guarantees. A store belongs
 * to exactly one solve.
 */
public final class DomainStore
{
    private final Map<Slot, Set<String>> domains;

    private DomainStore(Map<Slot, Set<String>> domains) {
        this.domains = domains;
    }

    /**
     * Creates a store in which every slot's domain is a copy of the full vocabulary.
     */
    public static DomainStore initialize(Collection<Slot> slots, Vocabulary vocabulary) {
        Objects.requireNonNull(slots, "slots");
        Objects.requireNonNull(vocabulary, "vocabulary");
        Map<Slot, Set<String>> domains = new LinkedHashMap<>();
        for (Slot slot : slots) {
            domains.put(Objects.requireNonNull(slot, "slot"), new LinkedHashSet<>(vocabulary.words()));
        }
        return new DomainStore(domains);
    }

    /**
     * @return the slots this store holds domains for, in insertion order
     */
    public Set<Slot> slots() {
        return Collections.unmodifiableSet(domains.keySet());
    }

    /**
     * Returns a read-only live view of the slot's current domain.
     *
     * @throws IllegalArgumentException if the slot is unknown
     */
    public Set<String> domain(Slot slot) {
        return Collections.unmodifiableSet(require(slot));
    }

    public int size(Slot slot) {
        return require(slot).size();
    }

    /**
     * Removes a word from a slot's domain.
     *
     * @return {@code true} if the word was present
     */
    public boolean remove(Slot slot, String word) {
        Objects.requireNonNull(word, "word");
        return require(slot).remove(word);
    }

    public boolean anyEmpty() {
        return domains.values().stream().anyMatch(Set::isEmpty);
    }

    /**
     * @return slots whose domain is empty, in insertion order
     */
    public Set<Slot> emptySlots() {
        return domains.entrySet().stream()
                .filter(e -> e.getValue().isEmpty())
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * @return total number of candidates across all domains
     */
    public long totalCandidates() {
        return domains.values().stream().mapToLong(Set::size).sum();
    }

    private Set<String> require(Slot slot) {
        Objects.requireNonNull(slot, "slot");
        Set<String> domain = domains.get(slot);
        if (domain == null) {
            throw new IllegalArgumentException("Unknown slot: " + slot);
        }
        return domain;
    }

    @Override
    public String toString() {
        return domains.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue().size())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
