package com.finmod.drg.engine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Collects a bounded sample of cycles from a graph that Kahn's algorithm could
 * not fully order.
 *
 * <p>
 * Only nodes left unordered are searched: every cycle lies entirely inside that
 * residue. The search is an iterative depth-first walk; each back edge closes
 * one cycle, reported from the back edge's target along the current path.
 * Rotations of an already reported cycle are skipped.
 */
final class CycleFinder {
    static final int DEFAULT_SAMPLE_LIMIT = 5;

    private static final byte WHITE = 0, GRAY = 1, BLACK = 2;

    private final List<String> names;
    private final List<Set<Integer>> forwardEdges;

    CycleFinder(List<String> names, List<Set<Integer>> forwardEdges) {
        this.names = names;
        this.forwardEdges = forwardEdges;
    }

    /**
     * @param ordered nodes Kahn's algorithm managed to order; skipped.
     * @param limit   maximum number of cycles to return.
     */
    List<List<String>> findCycles(boolean[] ordered, int limit) {
        int n = names.size();
        byte[] color = new byte[n];
        List<List<String>> cycles = new ArrayList<>();
        Set<List<Integer>> seen = new HashSet<>();

        List<Integer> path = new ArrayList<>();
        List<Iterator<Integer>> iterators = new ArrayList<>();

        for (int root = 0; root < n && cycles.size() < limit; root++) {
            if (ordered[root] || color[root] != WHITE)
                continue;
            color[root] = GRAY;
            path.add(root);
            iterators.add(forwardEdges.get(root).iterator());

            while (!path.isEmpty() && cycles.size() < limit) {
                int top = path.size() - 1;
                Iterator<Integer> it = iterators.get(top);
                if (!it.hasNext()) {
                    color[path.get(top)] = BLACK;
                    path.remove(top);
                    iterators.remove(top);
                    continue;
                }
                int child = it.next();
                if (ordered[child])
                    continue;
                if (color[child] == GRAY) {
                    List<Integer> cycle = new ArrayList<>(path.subList(path.lastIndexOf(child), path.size()));
                    if (seen.add(canonical(cycle)))
                        cycles.add(toNames(cycle));
                } else if (color[child] == WHITE) {
                    color[child] = GRAY;
                    path.add(child);
                    iterators.add(forwardEdges.get(child).iterator());
                }
            }
            // Unwind whatever is left if we stopped early
            for (int idx : path)
                color[idx] = BLACK;
            path.clear();
            iterators.clear();
        }
        return cycles;
    }

    // Rotation starting at the smallest index, so A->B->A and B->A->B compare equal.
    private static List<Integer> canonical(List<Integer> cycle) {
        int min = 0;
        for (int i = 1; i < cycle.size(); i++)
            if (cycle.get(i) < cycle.get(min))
                min = i;
        List<Integer> out = new ArrayList<>(cycle.size());
        for (int i = 0; i < cycle.size(); i++)
            out.add(cycle.get((min + i) % cycle.size()));
        return out;
    }

    private List<String> toNames(List<Integer> cycle) {
        List<String> out = new ArrayList<>(cycle.size());
        for (int idx : cycle)
            out.add(names.get(idx));
        return out;
    }
}
