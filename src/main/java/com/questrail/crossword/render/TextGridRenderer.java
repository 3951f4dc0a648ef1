package com.questrail.crossword.render;

/**
 * Renders a {@link LetterGrid} as text: one line per row, blocked cells as
 * {@value #BLOCKED}, empty fillable cells as a space.
 */
public final class TextGridRenderer
{
    public static final char BLOCKED = '█';

    public String render(LetterGrid grid) {
        StringBuilder out = new StringBuilder();
        for (int row = 0; row < grid.height(); row++) {
            for (int column = 0; column < grid.width(); column++) {
                if (!grid.structure().isFillable(row, column)) {
                    out.append(BLOCKED);
                    continue;
                }
                Character letter = grid.letterAt(row, column);
                out.append(letter != null ? letter.charValue() : ' ');
            }
            out.append(System.lineSeparator());
        }
        return out.toString();
    }
}
