package com.questrail.crossword.io;

import com.questrail.crossword.api.Vocabulary;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads a word list: one word per line, surrounding whitespace ignored, blank
 * lines skipped. Words are upper-cased by {@link Vocabulary}.
 */
public final class WordListParser
{
    public Vocabulary parse(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return parse(Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    /**
     * @throws PuzzleFormatException if a line holds something other than letters
     */
    public Vocabulary parse(List<String> lines) {
        Objects.requireNonNull(lines, "lines");
        List<String> words = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.isEmpty()) {
                continue;
            }
            try {
                words.add(Vocabulary.normalize(line));
            } catch (IllegalArgumentException e) {
                throw new PuzzleFormatException(e.getMessage(), i + 1, e);
            }
        }
        return Vocabulary.of(words);
    }
}
