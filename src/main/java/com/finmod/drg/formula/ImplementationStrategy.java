package com.finmod.drg.formula;

/**
 * How a code generator should implement a translated formula.
 */
public enum ImplementationStrategy {
    /** Whole-column numeric operation. */
    VECTORIZED("vectorized"),
    /** Data-frame method: aggregations over ranges, merges for lookups. */
    PANDAS_METHOD("pandas_method"),
    /** Row-by-row loop or apply. */
    ITERATIVE("iterative"),
    /** Dedicated hand-written function. */
    CUSTOM("custom");

    private final String label;

    ImplementationStrategy(String label) {
        this.label = label;
    }

    /** The wire label handed to downstream generators. */
    public String label() {
        return label;
    }
}
