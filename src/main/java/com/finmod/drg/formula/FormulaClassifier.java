package com.finmod.drg.formula;

import java.util.Collection;
import java.util.List;

/**
 * Categorises formulas, scores their complexity and recommends how a code
 * generator should implement them.
 *
 * <h3>Complexity score</h3>
 *
 * <pre>
 *   5 * functions
 * + 10 * max(functions - 1, 0)      nesting / chaining
 * + 2 * single-cell references
 * + 5 * range references
 * + 10 * complex functions          VLOOKUP, INDEX, MATCH, OFFSET, INDIRECT, SUMIFS, COUNTIFS
 * + 2 * distinct operators
 * </pre>
 *
 * capped at 100.
 */
public final class FormulaClassifier {

    static final int MAX_SCORE = 100;
    static final int CUSTOM_THRESHOLD = 50;

    /**
     * Category of the first function in the list.
     *
     * @return {@link FormulaType#ARITHMETIC} for an empty list,
     *         {@link FormulaType#UNKNOWN} when the first function is not in the
     *         table.
     */
    public FormulaType classify(List<String> functions) {
        if (functions.isEmpty())
            return FormulaType.ARITHMETIC;
        return FunctionCategories.categoryOf(functions.get(0));
    }

    public int score(List<String> functions, Collection<String> cellReferences,
            Collection<String> rangeReferences, Collection<String> operators) {
        int fc = functions.size();
        int score = 5 * fc;
        score += 10 * Math.max(fc - 1, 0);
        score += 2 * cellReferences.size();
        score += 5 * rangeReferences.size();
        for (String f : functions)
            if (FunctionCategories.COMPLEX_FUNCTIONS.contains(f))
                score += 10;
        score += 2 * operators.size();
        return Math.min(score, MAX_SCORE);
    }

    /**
     * Whether the formula maps onto whole-column numeric operations. Lookups
     * never do.
     */
    public boolean isVectorizable(ParsedFormula formula) {
        switch (formula.type()) {
            case LOOKUP:
                return false;
            case ARITHMETIC:
            case STATISTICAL:
                return true;
            default:
                for (String f : formula.functions())
                    if (FunctionCategories.VECTORIZABLE_FUNCTIONS.contains(f))
                        return true;
                return false;
        }
    }

    public ImplementationStrategy recommendStrategy(ParsedFormula formula) {
        if (isVectorizable(formula))
            return formula.hasRangeReferences() ? ImplementationStrategy.PANDAS_METHOD
                    : ImplementationStrategy.VECTORIZED;
        if (formula.type() == FormulaType.LOOKUP)
            return ImplementationStrategy.PANDAS_METHOD;
        if (formula.complexityScore() > CUSTOM_THRESHOLD)
            return ImplementationStrategy.CUSTOM;
        return ImplementationStrategy.ITERATIVE;
    }
}
