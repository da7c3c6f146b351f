package com.finmod.drg.formula;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Read-only lookup tables of well-known spreadsheet functions.
 *
 * <p>
 * Built once at class initialisation and never mutated.
 */
public final class FunctionCategories {

    private static final Map<String, FormulaType> CATEGORIES = Map.ofEntries(
            // Statistical / aggregation
            entry("SUM", FormulaType.STATISTICAL),
            entry("AVERAGE", FormulaType.STATISTICAL),
            entry("COUNT", FormulaType.STATISTICAL),
            entry("MAX", FormulaType.STATISTICAL),
            entry("MIN", FormulaType.STATISTICAL),
            entry("STDEV", FormulaType.STATISTICAL),
            entry("VAR", FormulaType.STATISTICAL),
            entry("SUMIF", FormulaType.STATISTICAL),
            entry("SUMIFS", FormulaType.STATISTICAL),
            entry("COUNTIF", FormulaType.STATISTICAL),
            entry("COUNTIFS", FormulaType.STATISTICAL),
            entry("AVERAGEIF", FormulaType.STATISTICAL),
            entry("AVERAGEIFS", FormulaType.STATISTICAL),
            // Lookup / reference
            entry("VLOOKUP", FormulaType.LOOKUP),
            entry("HLOOKUP", FormulaType.LOOKUP),
            entry("XLOOKUP", FormulaType.LOOKUP),
            entry("INDEX", FormulaType.LOOKUP),
            entry("MATCH", FormulaType.LOOKUP),
            entry("OFFSET", FormulaType.LOOKUP),
            entry("INDIRECT", FormulaType.LOOKUP),
            // Logical
            entry("IF", FormulaType.LOGICAL),
            entry("IFS", FormulaType.LOGICAL),
            entry("AND", FormulaType.LOGICAL),
            entry("OR", FormulaType.LOGICAL),
            entry("NOT", FormulaType.LOGICAL),
            // Text
            entry("CONCATENATE", FormulaType.TEXT),
            entry("CONCAT", FormulaType.TEXT),
            entry("LEFT", FormulaType.TEXT),
            entry("RIGHT", FormulaType.TEXT),
            entry("MID", FormulaType.TEXT),
            entry("LEN", FormulaType.TEXT),
            entry("TRIM", FormulaType.TEXT),
            entry("UPPER", FormulaType.TEXT),
            entry("LOWER", FormulaType.TEXT),
            // Financial
            entry("NPV", FormulaType.FINANCIAL),
            entry("IRR", FormulaType.FINANCIAL),
            entry("PV", FormulaType.FINANCIAL),
            entry("FV", FormulaType.FINANCIAL),
            entry("PMT", FormulaType.FINANCIAL),
            entry("XIRR", FormulaType.FINANCIAL),
            entry("XNPV", FormulaType.FINANCIAL),
            // Date / time
            entry("DATE", FormulaType.DATE_TIME),
            entry("TODAY", FormulaType.DATE_TIME),
            entry("NOW", FormulaType.DATE_TIME),
            entry("YEAR", FormulaType.DATE_TIME),
            entry("MONTH", FormulaType.DATE_TIME),
            entry("DAY", FormulaType.DATE_TIME),
            // Array
            entry("SUMPRODUCT", FormulaType.ARRAY),
            entry("TRANSPOSE", FormulaType.ARRAY),
            entry("MMULT", FormulaType.ARRAY),
            entry("FILTER", FormulaType.ARRAY),
            entry("SORT", FormulaType.ARRAY),
            entry("UNIQUE", FormulaType.ARRAY),
            entry("SEQUENCE", FormulaType.ARRAY));

    /** Functions that add a fixed penalty to the complexity score. */
    public static final Set<String> COMPLEX_FUNCTIONS = Set.of(
            "VLOOKUP", "INDEX", "MATCH", "OFFSET", "INDIRECT", "SUMIFS", "COUNTIFS");

    /** Functions with a direct whole-column numeric equivalent. */
    public static final Set<String> VECTORIZABLE_FUNCTIONS = Set.of(
            "SUM", "AVERAGE", "COUNT", "MAX", "MIN", "STDEV", "VAR");

    private FunctionCategories() {
        // Utility class
    }

    /**
     * Category of a function name, case-insensitive.
     *
     * @return the category, or {@link FormulaType#UNKNOWN} if the function is
     *         not in the table.
     */
    public static FormulaType categoryOf(String functionName) {
        return CATEGORIES.getOrDefault(functionName.toUpperCase(Locale.ROOT), FormulaType.UNKNOWN);
    }

    public static boolean isKnown(String functionName) {
        return CATEGORIES.containsKey(functionName.toUpperCase(Locale.ROOT));
    }

    public static int size() {
        return CATEGORIES.size();
    }
}
