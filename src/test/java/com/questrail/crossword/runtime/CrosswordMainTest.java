package com.questrail.crossword.runtime;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.questrail.crossword.runtime.CrosswordRuntimeTest.resource;
import static org.junit.jupiter.api.Assertions.*;

class CrosswordMainTest {

    private static final String NL = System.lineSeparator();

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return CrosswordMain.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void printsTheSolvedGrid() {
        int exit = run(resource("structure0.txt").toString(), resource("words0.txt").toString());

        assertEquals(CrosswordMain.EXIT_OK, exit);
        assertEquals(
                "█SIX█" + NL
                        + "█E██F" + NL
                        + "█V██I" + NL
                        + "█E██V" + NL
                        + "█NINE" + NL,
                stdout());
    }

    @Test
    void optionsSelectSolverPolicies() {
        int exit = run("--variable-selection=first_unassigned", "--value-ordering=DOMAIN_ORDER",
                "--no-arc-consistency", resource("structure0.txt").toString(), resource("words0.txt").toString());

        assertEquals(CrosswordMain.EXIT_OK, exit);
        assertTrue(stdout().startsWith("█SIX█"), stdout());
    }

    @Test
    void unsolvablePuzzleIsNotAnError(@TempDir Path dir) throws IOException {
        Path words = dir.resolve("words.txt");
        Files.write(words, List.of("cat", "dog"), StandardCharsets.UTF_8);

        int exit = run(resource("structure0.txt").toString(), words.toString());

        assertEquals(CrosswordMain.EXIT_OK, exit);
        assertEquals("No solution." + NL, stdout());
    }

    @Test
    void noImageIsWrittenWithoutASolution(@TempDir Path dir) throws IOException {
        Path image = dir.resolve("out.png");
        Path structure = dir.resolve("structure.txt");
        Path words = dir.resolve("words.txt");
        Files.write(structure, List.of("__"), StandardCharsets.UTF_8);
        Files.write(words, List.of("abc"), StandardCharsets.UTF_8);

        int exit = run(structure.toString(), words.toString(), image.toString());

        assertEquals(CrosswordMain.EXIT_OK, exit);
        assertEquals("No solution." + NL, stdout());
        assertFalse(Files.exists(image));
    }

    @Test
    void wrongArgumentCountIsAUsageError() {
        assertEquals(CrosswordMain.EXIT_USAGE, run("only-one"));
        assertTrue(stderr().contains("Usage:"));
    }

    @Test
    void unknownOptionIsAUsageError() {
        assertEquals(CrosswordMain.EXIT_USAGE, run("--fast", "a", "b"));
        assertTrue(stderr().contains("Unknown option: --fast"));
    }

    @Test
    void unknownPolicyIsAUsageError() {
        assertEquals(CrosswordMain.EXIT_USAGE, run("--value-ordering=RANDOM", "a", "b"));
        assertTrue(stderr().contains("Invalid option value"));
    }

    @Test
    void missingFileIsAnInputError(@TempDir Path dir) {
        int exit = run(dir.resolve("missing.txt").toString(), resource("words0.txt").toString());

        assertEquals(CrosswordMain.EXIT_INPUT_ERROR, exit);
        assertTrue(stderr().startsWith("I/O error"), stderr());
    }

    @Test
    void malformedWordIsAnInputError(@TempDir Path dir) throws IOException {
        Path words = dir.resolve("words.txt");
        Files.write(words, List.of("one", "two2"), StandardCharsets.UTF_8);

        int exit = run(resource("structure0.txt").toString(), words.toString());

        assertEquals(CrosswordMain.EXIT_INPUT_ERROR, exit);
        assertTrue(stderr().contains("line 2"), stderr());
    }
}
