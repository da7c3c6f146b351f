package com.finmod.drg.formula;

import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class FormulaClassifierTest {

    private final FormulaClassifier classifier = new FormulaClassifier();

    private static ParsedFormula formula(FormulaType type, List<String> functions, Set<String> ranges, int score) {
        return new ParsedFormula("x", type, functions, Set.of(), ranges, Set.of(), List.of(), Set.of(), score);
    }

    @Test
    public void testClassifyUsesFirstFunction() {
        assertEquals(FormulaType.ARITHMETIC, classifier.classify(List.of()));
        assertEquals(FormulaType.LOOKUP, classifier.classify(List.of("VLOOKUP", "SUM")));
        assertEquals(FormulaType.STATISTICAL, classifier.classify(List.of("SUM", "VLOOKUP")));
        assertEquals(FormulaType.FINANCIAL, classifier.classify(List.of("NPV")));
        assertEquals(FormulaType.DATE_TIME, classifier.classify(List.of("TODAY")));
        assertEquals(FormulaType.TEXT, classifier.classify(List.of("CONCATENATE")));
        assertEquals(FormulaType.ARRAY, classifier.classify(List.of("SUMPRODUCT")));
        assertEquals(FormulaType.UNKNOWN, classifier.classify(List.of("MYUDF")));
    }

    @Test
    public void testScoreComponents() {
        assertEquals(0, classifier.score(List.of(), Set.of(), Set.of(), Set.of()));
        assertEquals(5, classifier.score(List.of("IF"), Set.of(), Set.of(), Set.of()));
        assertEquals(20, classifier.score(List.of("IF", "AND"), Set.of(), Set.of(), Set.of()));
        assertEquals(15, classifier.score(List.of("MATCH"), Set.of(), Set.of(), Set.of()));
        assertEquals(6, classifier.score(List.of(), Set.of("A1", "B1", "C1"), Set.of(), Set.of()));
        assertEquals(10, classifier.score(List.of(), Set.of(), Set.of("A1:A2", "B1:B2"), Set.of()));
        assertEquals(4, classifier.score(List.of(), Set.of(), Set.of(), Set.of("+", "*")));
    }

    @Test
    public void testScoreIsCapped() {
        List<String> many = List.of("INDEX", "MATCH", "OFFSET", "INDIRECT", "SUMIFS", "COUNTIFS", "VLOOKUP");
        assertEquals(100, classifier.score(many, Set.of(), Set.of(), Set.of()));
    }

    @Test
    public void testLookupNeverVectorizable() {
        ParsedFormula f = formula(FormulaType.LOOKUP, List.of("INDEX", "SUM"), Set.of(), 30);
        assertFalse(classifier.isVectorizable(f));
        assertEquals(ImplementationStrategy.PANDAS_METHOD, classifier.recommendStrategy(f));
    }

    @Test
    public void testStrategyThresholds() {
        assertEquals(ImplementationStrategy.VECTORIZED,
                classifier.recommendStrategy(formula(FormulaType.STATISTICAL, List.of("MAX"), Set.of(), 5)));
        assertEquals(ImplementationStrategy.PANDAS_METHOD,
                classifier.recommendStrategy(formula(FormulaType.STATISTICAL, List.of("SUM"), Set.of("A1:A3"), 10)));
        assertEquals(ImplementationStrategy.ITERATIVE,
                classifier.recommendStrategy(formula(FormulaType.TEXT, List.of("LEFT"), Set.of(), 50)));
        assertEquals(ImplementationStrategy.CUSTOM,
                classifier.recommendStrategy(formula(FormulaType.TEXT, List.of("LEFT"), Set.of(), 51)));
    }

    @Test
    public void testStrategyLabels() {
        assertEquals("vectorized", ImplementationStrategy.VECTORIZED.label());
        assertEquals("pandas_method", ImplementationStrategy.PANDAS_METHOD.label());
        assertEquals("iterative", ImplementationStrategy.ITERATIVE.label());
        assertEquals("custom", ImplementationStrategy.CUSTOM.label());
    }

    @Test
    public void testCategoryLookupIsCaseInsensitive() {
        assertEquals(FormulaType.LOOKUP, FunctionCategories.categoryOf("xlookup"));
        assertTrue(FunctionCategories.isKnown("Sum"));
        assertFalse(FunctionCategories.isKnown("ROUND"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testScoreOutOfRangeRejected() {
        formula(FormulaType.ARITHMETIC, List.of(), Set.of(), 101);
    }
}
