package com.finmod.drg.formula;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable structure of one parsed formula.
 *
 * @param original        formula text without the leading {@code =}.
 * @param type            category of the first function called.
 * @param functions       upper-cased function names in call order, repeats
 *                        kept.
 * @param cellReferences  single-cell tokens as written.
 * @param rangeReferences range tokens as written; interior cells are not
 *                        enumerated.
 * @param namedRanges     heuristic named-range candidates.
 * @param constants       literal numbers ({@code Long} or {@code Double}),
 *                        strings and booleans.
 * @param operators       distinct operator tokens.
 * @param complexityScore heuristic difficulty in [0, 100].
 */
public record ParsedFormula(String original, FormulaType type, List<String> functions,
        Set<String> cellReferences, Set<String> rangeReferences, Set<String> namedRanges,
        List<Object> constants, Set<String> operators, int complexityScore) {

    public ParsedFormula {
        functions = List.copyOf(functions);
        cellReferences = frozen(cellReferences);
        rangeReferences = frozen(rangeReferences);
        namedRanges = frozen(namedRanges);
        constants = List.copyOf(constants);
        operators = frozen(operators);
        if (complexityScore < 0 || complexityScore > 100)
            throw new IllegalArgumentException("Complexity score out of range: " + complexityScore);
    }

    private static Set<String> frozen(Set<String> in) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(in));
    }

    public boolean hasFunctions() {
        return !functions.isEmpty();
    }

    public boolean hasRangeReferences() {
        return !rangeReferences.isEmpty();
    }
}
