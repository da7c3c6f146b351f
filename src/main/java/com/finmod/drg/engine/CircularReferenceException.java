package com.finmod.drg.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Thrown when the cell graph contains at least one cycle.
 *
 * <p>
 * Carries a bounded sample of the cycles found, each as the ordered list of
 * full addresses along the cycle. The sample is not exhaustive.
 */
public class CircularReferenceException extends RuntimeException {
    private final List<List<String>> cycles;

    public CircularReferenceException(List<List<String>> cycles) {
        super("Circular references found: " + cycles);
        List<List<String>> copy = new ArrayList<>(cycles.size());
        for (List<String> c : cycles)
            copy.add(List.copyOf(c));
        this.cycles = List.copyOf(copy);
    }

    /** Sampled cycles, in discovery order. */
    public List<List<String>> cycles() {
        return cycles;
    }
}
