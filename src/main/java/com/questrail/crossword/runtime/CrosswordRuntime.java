package com.questrail.crossword.runtime;

import com.questrail.crossword.api.CrosswordSolver;
import com.questrail.crossword.api.SolveResult;
import com.questrail.crossword.api.Vocabulary;
import com.questrail.crossword.io.StructureFileParser;
import com.questrail.crossword.io.WordListParser;
import com.questrail.crossword.solver.CspCrosswordSolver;
import com.questrail.crossword.solver.config.SolverConfig;
import com.questrail.crossword.solver.observability.NullSolverObservabilitySink;
import com.questrail.crossword.solver.observability.SolverObservabilitySink;
import com.questrail.crossword.structure.PuzzleStructure;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * CrosswordRuntime
 * =============================================================================
 * Composition root for file-based crossword generation: parses the structure
 * and word list, then hands both to a {@link CrosswordSolver}.
 */
public final class CrosswordRuntime {
    private final StructureFileParser structureParser;
    private final WordListParser wordListParser;
    private final CrosswordSolver solver;

    private CrosswordRuntime(StructureFileParser structureParser,
                             WordListParser wordListParser,
                             CrosswordSolver solver) {
        this.structureParser = structureParser;
        this.wordListParser = wordListParser;
        this.solver = solver;
    }

    /**
     * A loaded puzzle together with its solve result.
     */
    public record Generation(PuzzleStructure structure, SolveResult result) {
        public Generation {
            Objects.requireNonNull(structure, "structure");
            Objects.requireNonNull(result, "result");
        }
    }

    /**
     * Loads both files and solves the puzzle.
     *
     * @throws IOException if either file cannot be read
     * @throws com.questrail.crossword.io.PuzzleFormatException if either file is malformed
     */
    public Generation generate(Path structureFile, Path wordsFile) throws IOException {
        PuzzleStructure structure = structureParser.parse(structureFile);
        Vocabulary vocabulary = wordListParser.parse(wordsFile);
        return new Generation(structure, solver.solve(structure, vocabulary));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SolverConfig config = SolverConfig.defaults();
        private SolverObservabilitySink observabilitySink = NullSolverObservabilitySink.INSTANCE;

        public Builder withConfig(SolverConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder withObservabilitySink(SolverObservabilitySink sink) {
            this.observabilitySink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public CrosswordRuntime build() {
            return new CrosswordRuntime(
                    new StructureFileParser(),
                    new WordListParser(),
                    new CspCrosswordSolver(config, observabilitySink));
        }
    }
}
