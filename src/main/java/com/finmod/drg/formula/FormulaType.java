package com.finmod.drg.formula;

/**
 * Computational category of a formula, derived from the first function it
 * calls.
 */
public enum FormulaType {
    ARITHMETIC,
    LOGICAL,
    LOOKUP,
    TEXT,
    STATISTICAL,
    FINANCIAL,
    DATE_TIME,
    ARRAY,
    UNKNOWN
}
