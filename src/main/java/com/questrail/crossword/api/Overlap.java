package com.questrail.crossword.api;

/**
 * The letter-agreement constraint between two crossing slots.
 * <p>
 * For an ordered pair {@code (a, b)}, any valid assignment satisfies
 * {@code word(a).charAt(first) == word(b).charAt(second)}. The overlap of
 * {@code (b, a)} is {@link #swapped()}.
 *
 * @param first  zero-based letter position in the first slot
 * @param second zero-based letter position in the second slot
 */
public record Overlap(int first, int second)
{
    public Overlap {
        if (first < 0 || second < 0) {
            throw new IllegalArgumentException(
                    "Overlap positions must be non-negative (was " + first + "," + second + ")");
        }
    }

    /**
     * @return the same constraint seen from the other slot
     */
    public Overlap swapped() {
        return new Overlap(second, first);
    }

    /**
     * Returns {@code true} if the two words agree on the shared letter.
     * Words too short to reach their position never agree.
     */
    public boolean agrees(String firstWord, String secondWord) {
        if (firstWord.length() <= first || secondWord.length() <= second) {
            return false;
        }
        return firstWord.charAt(first) == secondWord.charAt(second);
    }
}
