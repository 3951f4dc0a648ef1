package com.questrail.crossword.api;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Vocabulary
 * -----------------------------------------------------------------------------
 * The immutable set of candidate words a puzzle may be filled with.
 *
 * <h2>Normalization</h2>
 * Words are trimmed and upper-cased with {@link Locale#ROOT}. Words that only
 * differ in case therefore collapse into a single entry. Iteration order is the
 * order in which words were first supplied, which makes every solver policy that
 * falls back to "domain order" deterministic.
 *
 * <h2>Validation</h2>
 * Every word must be non-empty and consist of letters only. Anything else is
 * rejected here, at the boundary, so that the propagation and search code can
 * assume well-formed candidates.
 */
public final class Vocabulary
{
    private final Set<String> words;

    private Vocabulary(Set<String> words) {
        this.words = Collections.unmodifiableSet(words);
    }

    /**
     * Creates a vocabulary from raw words.
     *
     * @param rawWords words in any case
     * @return the normalized vocabulary
     * @throws IllegalArgumentException if any word is empty or contains a non-letter
     */
    public static Vocabulary of(Collection<String> rawWords) {
        Objects.requireNonNull(rawWords, "rawWords");
        Set<String> normalized = new LinkedHashSet<>();
        for (String raw : rawWords) {
            normalized.add(normalize(raw));
        }
        return new Vocabulary(normalized);
    }

    public static Vocabulary of(String... rawWords) {
        return of(Arrays.asList(rawWords));
    }

    /**
     * Normalizes and validates a single word.
     *
     * @throws IllegalArgumentException if the word is empty or contains a non-letter
     */
    public static String normalize(String raw) {
        Objects.requireNonNull(raw, "word");
        String word = raw.trim().toUpperCase(Locale.ROOT);
        if (word.isEmpty()) {
            throw new IllegalArgumentException("Vocabulary words must not be empty");
        }
        for (int i = 0; i < word.length(); i++) {
            if (!Character.isLetter(word.charAt(i))) {
                throw new IllegalArgumentException(
                        "Invalid character '" + word.charAt(i) + "' in word \"" + raw + "\"");
            }
        }
        return word;
    }

    /**
     * @return the normalized words, in first-seen order
     */
    public Set<String> words() {
        return words;
    }

    public int size() {
        return words.size();
    }

    public boolean contains(String word) {
        return words.contains(word);
    }

    @Override
    public String toString() {
        return "Vocabulary[" + words.size() + " words]";
    }
}
