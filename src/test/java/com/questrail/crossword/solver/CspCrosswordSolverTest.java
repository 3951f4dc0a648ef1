package com.questrail.crossword.solver;

import com.questrail.crossword.api.Assignment;
import com.questrail.crossword.api.Slot;
import com.questrail.crossword.api.SolveResult;
import com.questrail.crossword.api.SolveResult.Outcome;
import com.questrail.crossword.api.SolveStatistics;
import com.questrail.crossword.api.Vocabulary;
import com.questrail.crossword.solver.config.SolverConfig;
import com.questrail.crossword.solver.config.ValueOrdering;
import com.questrail.crossword.solver.config.VariableSelection;
import com.questrail.crossword.solver.internal.AssignmentConsistency;
import com.questrail.crossword.solver.observability.DomainWipeoutEvent;
import com.questrail.crossword.solver.observability.RecordingSolverObservabilitySink;
import com.questrail.crossword.solver.observability.SolverPhase;
import com.questrail.crossword.solver.observability.SolverPhaseEvent;
import com.questrail.crossword.structure.GridPuzzleStructure;
import com.questrail.crossword.structure.PuzzleStructure;
import com.questrail.crossword.structure.TestPuzzles;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.questrail.crossword.structure.TestPuzzles.*;
import static org.junit.jupiter.api.Assertions.*;

class CspCrosswordSolverTest {

    private static final Vocabulary NUMBERS = Vocabulary.of(
            "one", "two", "three", "four", "five", "six", "seven", "eight", "nine", "ten");

    private static final Vocabulary LATTICE_WORDS = Vocabulary.of(
            "plant", "spare", "stone", "crane", "odour", "bread", "teeth", "ocean",
            "short", "train", "alone", "house", "earth", "grape", "cat", "dog", "elephant");

    private static void assertValidSolution(PuzzleStructure structure, Vocabulary vocabulary, SolveResult result) {
        assertEquals(Outcome.SOLVED, result.outcome());
        Assignment solution = result.solution().orElseThrow();
        assertTrue(solution.covers(new HashSet<>(structure.slots())));
        assertEquals(structure.slots().size(), solution.size());
        for (String word : solution.asMap().values()) {
            assertTrue(vocabulary.contains(word), word);
        }
        assertTrue(new AssignmentConsistency(structure).isConsistent(solution.asMap()));
    }

    @Test
    void singleCellTakesTheSingleLetterWord() {
        PuzzleStructure structure = GridPuzzleStructure.fromGrid(new boolean[][] {{true}});

        SolveResult result = new CspCrosswordSolver().solve(structure, Vocabulary.of("A"));

        assertEquals(Map.of(Slot.across(0, 0, 1), "A"), result.solution().orElseThrow().asMap());
    }

    @Test
    void crossingSlotsAgreeOnTheSharedLetter() {
        SolveResult result = new CspCrosswordSolver().solve(TestPuzzles.crossing(), Vocabulary.of("CAT", "ACE"));

        Map<Slot, String> words = result.solution().orElseThrow().asMap();
        Set<Map<Slot, String>> accepted = Set.of(
                Map.of(CROSS_A, "CAT", CROSS_B, "ACE"),
                Map.of(CROSS_A, "ACE", CROSS_B, "CAT"));
        assertTrue(accepted.contains(words), words.toString());
    }

    @Test
    void noCompatibleLettersIsProvenByArcConsistency() {
        SolveResult result = new CspCrosswordSolver().solve(TestPuzzles.crossing(), Vocabulary.of("DOG", "CAT"));

        assertEquals(Outcome.UNSATISFIABLE_ARC_CONSISTENCY, result.outcome());
        assertTrue(result.solution().isEmpty());
        assertEquals(0, result.statistics().assignmentsTried());
    }

    @Test
    void withoutArcConsistencySearchExhausts() {
        SolverConfig config = SolverConfig.builder().withArcConsistencyEnabled(false).build();

        SolveResult result = new CspCrosswordSolver(config).solve(TestPuzzles.crossing(), Vocabulary.of("DOG", "CAT"));

        assertEquals(Outcome.SEARCH_EXHAUSTED, result.outcome());
        assertEquals(0, result.statistics().removedByArcConsistency());
    }

    @Test
    void missingWordLengthIsProvenByNodeConsistency() {
        RecordingSolverObservabilitySink sink = new RecordingSolverObservabilitySink();
        Slot slot = Slot.across(0, 0, 4);
        PuzzleStructure structure = GridPuzzleStructure.fromSlots(1, 4, List.of(slot));

        SolveResult result = new CspCrosswordSolver(SolverConfig.defaults(), sink)
                .solve(structure, Vocabulary.of("A", "AB", "ABC"));

        assertEquals(Outcome.UNSATISFIABLE_NODE_CONSISTENCY, result.outcome());
        assertEquals(List.of(SolverPhase.NODE_CONSISTENCY), sink.getCompletedPhases());
        assertEquals(List.of(new DomainWipeoutEvent(SolverPhase.NODE_CONSISTENCY, slot)), sink.getWipeouts());
        assertEquals(new SolveStatistics(3, 3, 0, 0, 0, 0), result.statistics());
    }

    @Test
    void repeatedWordsAreNeverAccepted() {
        PuzzleStructure structure = GridPuzzleStructure.fromSlots(3, 2,
                List.of(Slot.across(0, 0, 2), Slot.across(2, 0, 2)));

        SolveResult result = new CspCrosswordSolver().solve(structure, Vocabulary.of("AB"));

        assertEquals(Outcome.SEARCH_EXHAUSTED, result.outcome());
        assertEquals(1, result.statistics().backtracks());
    }

    @Test
    void solvesTheFrame() {
        SolveResult result = new CspCrosswordSolver().solve(TestPuzzles.frame(), NUMBERS);

        assertValidSolution(TestPuzzles.frame(), NUMBERS, result);
        assertEquals(Map.of(
                FRAME_TOP, "SIX",
                FRAME_LEFT, "SEVEN",
                FRAME_RIGHT, "FIVE",
                FRAME_BOTTOM, "NINE"), result.solution().orElseThrow().asMap());
        // Propagation leaves one word per slot, so search never backtracks.
        assertEquals(0, result.statistics().backtracks());
        assertEquals(4, result.statistics().assignmentsTried());
    }

    @Test
    void solvesTheLatticeUnderEveryConfiguration() {
        PuzzleStructure lattice = TestPuzzles.lattice();
        for (VariableSelection selection : VariableSelection.values()) {
            for (ValueOrdering ordering : ValueOrdering.values()) {
                for (boolean arcs : new boolean[] {true, false}) {
                    SolverConfig config = new SolverConfig(selection, ordering, arcs);

                    SolveResult result = new CspCrosswordSolver(config).solve(lattice, LATTICE_WORDS);

                    assertValidSolution(lattice, LATTICE_WORDS, result);
                }
            }
        }
    }

    @Test
    void statisticsAccountForEveryRemovedCandidate() {
        SolveResult result = new CspCrosswordSolver().solve(TestPuzzles.frame(), NUMBERS);
        SolveStatistics stats = result.statistics();

        assertEquals(40, stats.initialCandidates());
        assertEquals(27, stats.removedByNodeConsistency());
        assertEquals(9, stats.removedByArcConsistency());
        assertTrue(stats.revisions() > 0);
    }

    @Test
    void phasesAreReportedInPipelineOrder() {
        RecordingSolverObservabilitySink sink = new RecordingSolverObservabilitySink();

        new CspCrosswordSolver(SolverConfig.defaults(), sink).solve(TestPuzzles.frame(), NUMBERS);

        assertEquals(List.of(SolverPhase.NODE_CONSISTENCY, SolverPhase.ARC_CONSISTENCY, SolverPhase.SEARCH),
                sink.getCompletedPhases());
        List<SolverPhaseEvent> phases = sink.getPhaseEvents();
        assertEquals(40, phases.get(0).candidatesBefore());
        assertEquals(13, phases.get(0).candidatesAfter());
        assertEquals(9, phases.get(1).removed());
        assertTrue(phases.get(2).succeeded());
        assertTrue(sink.getWipeouts().isEmpty());
        assertTrue(sink.hasEventOfType(SolveResult.class));
    }

    @Test
    void disabledArcConsistencySkipsItsPhase() {
        RecordingSolverObservabilitySink sink = new RecordingSolverObservabilitySink();
        SolverConfig config = SolverConfig.builder().withArcConsistencyEnabled(false).build();

        new CspCrosswordSolver(config, sink).solve(TestPuzzles.frame(), NUMBERS);

        assertEquals(List.of(SolverPhase.NODE_CONSISTENCY, SolverPhase.SEARCH), sink.getCompletedPhases());
    }

    @Test
    void arcConsistencyWipeoutIsReportedPerSlot() {
        RecordingSolverObservabilitySink sink = new RecordingSolverObservabilitySink();

        new CspCrosswordSolver(SolverConfig.defaults(), sink).solve(TestPuzzles.crossing(), Vocabulary.of("DOG", "CAT"));

        assertFalse(sink.getWipeouts().isEmpty());
        for (DomainWipeoutEvent wipeout : sink.getWipeouts()) {
            assertEquals(SolverPhase.ARC_CONSISTENCY, wipeout.phase());
        }
        SolverPhaseEvent last = sink.getPhaseEvents().get(sink.getPhaseEvents().size() - 1);
        assertEquals(SolverPhase.ARC_CONSISTENCY, last.phase());
        assertFalse(last.succeeded());
    }
}
