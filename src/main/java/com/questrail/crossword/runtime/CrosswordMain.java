package com.questrail.crossword.runtime;

import com.questrail.crossword.api.Assignment;
import com.questrail.crossword.io.PuzzleFormatException;
import com.questrail.crossword.render.LetterGrid;
import com.questrail.crossword.render.PngGridRenderer;
import com.questrail.crossword.render.TextGridRenderer;
import com.questrail.crossword.solver.config.SolverConfig;
import com.questrail.crossword.solver.config.ValueOrdering;
import com.questrail.crossword.solver.config.VariableSelection;
import com.questrail.crossword.solver.observability.Slf4jSolverObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Command-line entry point.
 *
 * <pre>
 *   crossword [--variable-selection=POLICY] [--value-ordering=POLICY]
 *             [--no-arc-consistency] structure words [output.png]
 * </pre>
 *
 * Exit codes: {@code 0} when solving completed (with or without a solution),
 * {@code 1} for unreadable or malformed input, {@code 2} for usage errors.
 */
public final class CrosswordMain {
    private static final Logger log = LoggerFactory.getLogger(CrosswordMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INPUT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE =
            "Usage: crossword [--variable-selection=MINIMUM_REMAINING_VALUES|FIRST_UNASSIGNED]"
                    + " [--value-ordering=LEAST_CONSTRAINING|DOMAIN_ORDER]"
                    + " [--no-arc-consistency] structure words [output]";

    private CrosswordMain() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        SolverConfig.Builder config = SolverConfig.builder();
        List<String> positional = new ArrayList<>();

        try {
            for (String arg : args) {
                if (arg.startsWith("--variable-selection=")) {
                    config.withVariableSelection(VariableSelection.valueOf(optionValue(arg)));
                } else if (arg.startsWith("--value-ordering=")) {
                    config.withValueOrdering(ValueOrdering.valueOf(optionValue(arg)));
                } else if (arg.equals("--no-arc-consistency")) {
                    config.withArcConsistencyEnabled(false);
                } else if (arg.startsWith("--")) {
                    err.println("Unknown option: " + arg);
                    err.println(USAGE);
                    return EXIT_USAGE;
                } else {
                    positional.add(arg);
                }
            }
        } catch (IllegalArgumentException e) {
            err.println("Invalid option value: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        if (positional.size() != 2 && positional.size() != 3) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        Path structureFile = Path.of(positional.get(0));
        Path wordsFile = Path.of(positional.get(1));
        Optional<Path> output = positional.size() == 3
                ? Optional.of(Path.of(positional.get(2)))
                : Optional.empty();

        CrosswordRuntime runtime = CrosswordRuntime.builder()
                .withConfig(config.build())
                .withObservabilitySink(new Slf4jSolverObservabilitySink())
                .build();

        try {
            CrosswordRuntime.Generation generation = runtime.generate(structureFile, wordsFile);
            Optional<Assignment> solution = generation.result().solution();
            if (solution.isEmpty()) {
                out.println("No solution.");
                return EXIT_OK;
            }

            LetterGrid grid = LetterGrid.of(generation.structure(), solution.get());
            out.print(new TextGridRenderer().render(grid));
            if (output.isPresent()) {
                new PngGridRenderer().write(grid, output.get());
            }
            return EXIT_OK;
        } catch (PuzzleFormatException e) {
            log.debug("Malformed puzzle input", e);
            err.println("Invalid puzzle input: " + e.getMessage());
            return EXIT_INPUT_ERROR;
        } catch (IOException e) {
            log.debug("I/O failure", e);
            err.println("I/O error: " + e.getMessage());
            return EXIT_INPUT_ERROR;
        }
    }

    private static String optionValue(String arg) {
        return arg.substring(arg.indexOf('=') + 1).trim().toUpperCase(Locale.ROOT);
    }
}
