package com.questrail.crossword.io;

/**
 * Indicates that a structure file or word list could not be turned into a
 * valid puzzle input.
 *
 * This typically reflects:
 * <ul>
 *   <li>A structure file without rows or without fillable cells</li>
 *   <li>A word containing something other than letters</li>
 * </ul>
 *
 * The line number is 1-based, or {@code 0} when the problem concerns the whole
 * file.
 */
public final class PuzzleFormatException extends RuntimeException
{
    private final int lineNumber;

    public PuzzleFormatException(String message) {
        this(message, 0, null);
    }

    public PuzzleFormatException(String message, int lineNumber) {
        this(message, lineNumber, null);
    }

    public PuzzleFormatException(String message, int lineNumber, Throwable cause) {
        super(lineNumber > 0 ? "line " + lineNumber + ": " + message : message, cause);
        this.lineNumber = lineNumber;
    }

    /**
     * @return the offending 1-based line, or {@code 0} if not line-specific
     */
    public int lineNumber() {
        return lineNumber;
    }
}
