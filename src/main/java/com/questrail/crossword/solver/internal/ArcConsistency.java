package com.questrail.crossword.solver.internal;

import com.questrail.crossword.api.Overlap;
import com.questrail.crossword.api.Slot;
import com.questrail.crossword.structure.PuzzleStructure;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ArcConsistency
 * -----------------------------------------------------------------------------
 * Binary overlap filter over a {@link DomainStore}, using the AC-3 queue
 * algorithm.
 *
 * <h2>Support</h2>
 * A candidate {@code wx} of slot {@code x} is supported by slot {@code y} if
 * {@code y}'s domain holds some {@code wy} with {@code wx != wy} and
 * {@code wx[posX] == wy[posY]}. The inequality prunes words that could only
 * cross themselves. It does not replace the all-different check done at
 * assignment time.
 *
 * <h2>Termination</h2>
 * Every revision removes at least one candidate, candidates are never added
 * back, and an arc is only re-queued after a revision. The queue therefore
 * drains for any finite vocabulary.
 */
public final class ArcConsistency
{
    private final PuzzleStructure structure;
    private final DomainStore domains;

    private long revisions;
    private long removed;

    public ArcConsistency(PuzzleStructure structure, DomainStore domains) {
        this.structure = Objects.requireNonNull(structure, "structure");
        this.domains = Objects.requireNonNull(domains, "domains");
    }

    /**
     * Returns every ordered pair of crossing slots, both directions, in slot order.
     */
    public List<Arc> allArcs() {
        List<Arc> arcs = new ArrayList<>();
        for (Slot x : structure.slots()) {
            for (Slot y : structure.neighbors(x)) {
                arcs.add(new Arc(x, y));
            }
        }
        return arcs;
    }

    /**
     * Runs AC-3 starting from every arc of the puzzle.
     *
     * @return {@code false} if some domain is empty afterwards
     */
    public boolean enforce() {
        return enforce(allArcs());
    }

    /**
     * Runs AC-3 starting from the given arcs.
     * <p>
     * Each arc is dequeued and revised; when {@code x} loses candidates, every arc
     * {@code (z, x)} with {@code z} a neighbor of {@code x} other than {@code y} is
     * queued again. An arc already waiting in the queue is not queued twice.
     *
     * @param initialArcs arcs to start from
     * @return {@code false} if some domain is empty once the queue has drained
     */
    public boolean enforce(Collection<Arc> initialArcs) {
        Objects.requireNonNull(initialArcs, "initialArcs");

        Deque<Arc> queue = new ArrayDeque<>();
        Set<Arc> queued = new HashSet<>();
        for (Arc arc : initialArcs) {
            if (queued.add(arc)) {
                queue.add(arc);
            }
        }

        while (!queue.isEmpty()) {
            Arc arc = queue.poll();
            queued.remove(arc);

            if (revise(arc.from(), arc.to())) {
                for (Slot z : structure.neighbors(arc.from())) {
                    if (z.equals(arc.to())) {
                        continue;
                    }
                    Arc next = new Arc(z, arc.from());
                    if (queued.add(next)) {
                        queue.add(next);
                    }
                }
            }
        }

        return !domains.anyEmpty();
    }

    /**
     * Makes {@code x} arc consistent with {@code y}.
     * <p>
     * Slots that do not cross are left untouched.
     *
     * @return {@code true} if at least one candidate was removed from {@code x}
     */
    public boolean revise(Slot x, Slot y) {
        Optional<Overlap> overlap = structure.overlap(x, y);
        if (overlap.isEmpty()) {
            return false;
        }
        int posX = overlap.get().first();
        int posY = overlap.get().second();

        Set<String> yDomain = domains.domain(y);
        Map<Character, Integer> lettersInY = letterCounts(yDomain, posY);

        List<String> unsupported = new ArrayList<>();
        for (String wx : domains.domain(x)) {
            if (!isSupported(wx, posX, posY, yDomain, lettersInY)) {
                unsupported.add(wx);
            }
        }
        if (unsupported.isEmpty()) {
            return false;
        }

        for (String wx : unsupported) {
            domains.remove(x, wx);
        }
        revisions++;
        removed += unsupported.size();
        return true;
    }

    /**
     * @return number of {@link #revise} calls that removed something
     */
    public long revisions() {
        return revisions;
    }

    /**
     * @return total candidates removed by this instance
     */
    public long removed() {
        return removed;
    }

    private static boolean isSupported(String wx, int posX, int posY,
                                       Set<String> yDomain, Map<Character, Integer> lettersInY) {
        if (wx.length() <= posX) {
            return false;
        }
        char letter = wx.charAt(posX);
        int supporters = lettersInY.getOrDefault(letter, 0);

        // wx itself does not count as support: crossing slots hold distinct words.
        if (wx.length() > posY && wx.charAt(posY) == letter && yDomain.contains(wx)) {
            supporters--;
        }
        return supporters > 0;
    }

    private static Map<Character, Integer> letterCounts(Set<String> words, int position) {
        Map<Character, Integer> counts = new HashMap<>();
        for (String word : words) {
            if (word.length() > position) {
                counts.merge(word.charAt(position), 1, Integer::sum);
            }
        }
        return counts;
    }
}
