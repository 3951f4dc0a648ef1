package com.questrail.crossword.solver.internal;

import com.questrail.crossword.api.Overlap;
import com.questrail.crossword.api.Slot;
import com.questrail.crossword.structure.PuzzleStructure;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Least-constraining-value ordering.
 * <p>
 * A word's cost is the number of candidates it would rule out in the domains of
 * unassigned crossing slots: those disagreeing on the shared letter, plus the
 * word itself since words may not repeat. Cheapest words come first; equal costs
 * keep domain order.
 */
public final class LeastConstrainingValueOrderer implements ValueOrderer
{
    private final PuzzleStructure structure;
    private final DomainStore domains;

    public LeastConstrainingValueOrderer(PuzzleStructure structure, DomainStore domains) {
        this.structure = Objects.requireNonNull(structure, "structure");
        this.domains = Objects.requireNonNull(domains, "domains");
    }

    @Override
    public List<String> order(Slot slot, PartialAssignment assignment) {
        List<Constraint> constraints = new ArrayList<>();
        for (Slot neighbor : structure.neighbors(slot)) {
            if (!assignment.isAssigned(neighbor)) {
                Overlap overlap = structure.overlap(slot, neighbor).orElseThrow();
                constraints.add(new Constraint(overlap, domains.domain(neighbor)));
            }
        }

        List<String> candidates = new ArrayList<>(domains.domain(slot));
        Map<String, Long> cost = new HashMap<>();
        for (String word : candidates) {
            long ruledOut = 0;
            for (Constraint constraint : constraints) {
                ruledOut += constraint.ruledOutBy(word);
            }
            cost.put(word, ruledOut);
        }

        // List.sort is stable, so ties keep domain order.
        candidates.sort(Comparator.comparingLong(cost::get));
        return candidates;
    }

    private static final class Constraint {
        private final Overlap overlap;
        private final Set<String> neighborDomain;
        private final Map<Character, Integer> lettersAtOverlap = new HashMap<>();

        Constraint(Overlap overlap, Set<String> neighborDomain) {
            this.overlap = overlap;
            this.neighborDomain = neighborDomain;
            for (String word : neighborDomain) {
                if (word.length() > overlap.second()) {
                    lettersAtOverlap.merge(word.charAt(overlap.second()), 1, Integer::sum);
                }
            }
        }

        long ruledOutBy(String word) {
            if (word.length() <= overlap.first()) {
                return neighborDomain.size();
            }
            int agreeing = lettersAtOverlap.getOrDefault(word.charAt(overlap.first()), 0);
            long ruledOut = neighborDomain.size() - agreeing;
            if (neighborDomain.contains(word) && overlap.agrees(word, word)) {
                ruledOut++;
            }
            return ruledOut;
        }
    }
}
