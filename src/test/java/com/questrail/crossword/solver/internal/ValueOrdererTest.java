package com.questrail.crossword.solver.internal;

import com.questrail.crossword.api.Vocabulary;
import com.questrail.crossword.solver.config.ValueOrdering;
import com.questrail.crossword.structure.PuzzleStructure;
import com.questrail.crossword.structure.TestPuzzles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.questrail.crossword.structure.TestPuzzles.*;
import static org.junit.jupiter.api.Assertions.*;

class ValueOrdererTest {

    private PuzzleStructure structure;
    private DomainStore domains;

    @BeforeEach
    void setUp() {
        structure = TestPuzzles.crossing();
        domains = DomainStore.initialize(structure.slots(), Vocabulary.of("DOG", "ART", "ACE", "CAT"));
    }

    @Test
    void leastConstrainingWordsComeFirst() {
        ValueOrderer orderer = new LeastConstrainingValueOrderer(structure, domains);

        // Ruled out in B: CAT 2, ACE 3, DOG 4, ART 4. Ties keep domain order.
        assertEquals(List.of("CAT", "ACE", "DOG", "ART"), orderer.order(CROSS_A, new PartialAssignment()));
    }

    @Test
    void assignedNeighborsDoNotCount() {
        ValueOrderer orderer = new LeastConstrainingValueOrderer(structure, domains);
        PartialAssignment assignment = new PartialAssignment();
        assignment.assign(CROSS_B, "ACE");

        assertEquals(List.of("DOG", "ART", "ACE", "CAT"), orderer.order(CROSS_A, assignment));
    }

    @Test
    void aWordRulesItselfOutOfItsNeighbors() {
        domains = DomainStore.initialize(structure.slots(), Vocabulary.of("AAB", "CAT"));
        ValueOrderer orderer = new LeastConstrainingValueOrderer(structure, domains);

        // AAB agrees with itself at the crossing but cannot be reused, so it rules out both words.
        assertEquals(List.of("CAT", "AAB"), orderer.order(CROSS_A, new PartialAssignment()));
    }

    @Test
    void domainOrderKeepsVocabularyOrder() {
        ValueOrderer orderer = ValueOrderer.forPolicy(ValueOrdering.DOMAIN_ORDER, structure, domains);

        assertEquals(List.of("DOG", "ART", "ACE", "CAT"), orderer.order(CROSS_A, new PartialAssignment()));
    }
}
