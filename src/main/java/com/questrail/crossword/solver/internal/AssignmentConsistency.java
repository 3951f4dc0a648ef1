package com.questrail.crossword.solver.internal;

import com.questrail.crossword.api.Overlap;
import com.questrail.crossword.api.Slot;
import com.questrail.crossword.structure.PuzzleStructure;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * AssignmentConsistency
 * -----------------------------------------------------------------------------
 * Checks (partial or complete) assignments against every constraint of the
 * puzzle:
 * <ol>
 *   <li>assigned words are pairwise distinct</li>
 *   <li>every word has its slot's length</li>
 *   <li>every pair of assigned crossing slots agrees on the shared letter</li>
 * </ol>
 *
 * This is where the all-different constraint is enforced exactly; propagation
 * only approximates it.
 */
public final class AssignmentConsistency
{
    private final PuzzleStructure structure;

    public AssignmentConsistency(PuzzleStructure structure) {
        this.structure = Objects.requireNonNull(structure, "structure");
    }

    /**
     * Checks a whole assignment.
     *
     * @param assignment slot to word; slots must belong to the structure
     * @return {@code true} if no constraint is violated
     */
    public boolean isConsistent(Map<Slot, String> assignment) {
        Objects.requireNonNull(assignment, "assignment");

        Set<String> seen = new HashSet<>();
        for (String word : assignment.values()) {
            if (!seen.add(word)) {
                return false;
            }
        }

        for (Map.Entry<Slot, String> entry : assignment.entrySet()) {
            if (entry.getValue().length() != entry.getKey().length()) {
                return false;
            }
        }

        List<Slot> assigned = new ArrayList<>(assignment.keySet());
        for (int i = 0; i < assigned.size(); i++) {
            for (int j = i + 1; j < assigned.size(); j++) {
                Slot a = assigned.get(i);
                Slot b = assigned.get(j);
                Optional<Overlap> overlap = structure.overlap(a, b);
                if (overlap.isPresent() && !overlap.get().agrees(assignment.get(a), assignment.get(b))) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Checks whether extending an already consistent assignment with
     * {@code slot = word} keeps it consistent. Only the constraints involving
     * {@code slot} need to be examined.
     */
    public boolean admits(PartialAssignment assignment, Slot slot, String word) {
        Objects.requireNonNull(assignment, "assignment");
        Objects.requireNonNull(word, "word");

        if (word.length() != slot.length()) {
            return false;
        }
        if (assignment.containsWord(word)) {
            return false;
        }
        for (Slot neighbor : structure.neighbors(slot)) {
            String other = assignment.word(neighbor);
            if (other == null) {
                continue;
            }
            Overlap overlap = structure.overlap(slot, neighbor).orElseThrow();
            if (!overlap.agrees(word, other)) {
                return false;
            }
        }
        return true;
    }
}
