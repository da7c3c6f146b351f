package com.finmod.drg.formula;

import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class ReferenceExtractorTest {

    private final ReferenceExtractor extractor = new ReferenceExtractor();

    @Test
    public void testSimpleSum() {
        assertEquals(Set.of("Sheet1!A1", "Sheet1!B1"), extractor.extract("=A1+B1", "Sheet1"));
    }

    @Test
    public void testDeterministic() {
        for (int i = 0; i < 10; i++)
            assertEquals(List.of("Sheet1!A1", "Sheet1!B1"), List.copyOf(extractor.extract("=A1+B1", "Sheet1")));
    }

    @Test
    public void testLeadingEqualsIsOptional() {
        assertEquals(extractor.extract("=A1*C3", "S"), extractor.extract("A1*C3", "S"));
    }

    @Test
    public void testCaseInsensitive() {
        assertEquals(Set.of("Sheet1!A1", "Sheet1!B2"), extractor.extract("=a1+b2", "Sheet1"));
    }

    @Test
    public void testSheetQualified() {
        assertEquals(Set.of("Sheet2!B3"), extractor.extract("=Sheet2!B3*2", "Sheet1"));
    }

    @Test
    public void testQuotedSheetAndAbsoluteMarkers() {
        assertEquals(Set.of("My Sheet!C4", "Sheet1!D5"),
                extractor.extract("='My Sheet'!$C$4+$D5", "Sheet1"));
    }

    @Test
    public void testRangeBoundariesOnly() {
        Set<String> refs = extractor.extract("=SUM(A1:A10)", "Sheet1");
        assertEquals(Set.of("Sheet1!A1", "Sheet1!A10"), refs);
        assertFalse(refs.contains("Sheet1!A5"));
    }

    @Test
    public void testQualifiedRangeAppliesSheetToBothEnds() {
        assertEquals(Set.of("Data!A1", "Data!B5"), extractor.extract("=SUM(Data!A1:B5)", "Sheet1"));
    }

    @Test
    public void testRangeIsNotDoubleCountedAsCells() {
        ReferenceScan scan = extractor.scan("=SUM(A1:B2)+C3");
        assertEquals(Set.of("C3"), scan.cellReferences());
        assertEquals(Set.of("A1:B2"), scan.rangeReferences());
    }

    @Test
    public void testStringLiteralsAreIgnored() {
        assertEquals(Set.of("Sheet1!A1", "Sheet1!C3"), extractor.extract("=IF(A1>0,\"B2\",C3)", "Sheet1"));
    }

    @Test
    public void testFunctionNamesAreNotCells() {
        assertEquals(Set.of("Sheet1!A2"), extractor.extract("=LOG10(A2)", "Sheet1"));
    }

    @Test
    public void testOverflowingRowIsSkipped() {
        assertEquals(Set.of("Sheet1!B1"), extractor.extract("=B1+A99999999999", "Sheet1"));
        assertEquals(Set.of("Sheet1!B1"), extractor.extract("=SUM(A1:A99999999999)+B1", "Sheet1"));
        assertTrue(extractor.scan("=A99999999999").namedRanges().isEmpty());
    }

    @Test
    public void testNoReferences() {
        assertTrue(extractor.extract("=5+3", "Sheet1").isEmpty());
        assertTrue(extractor.extract("", "Sheet1").isEmpty());
        assertTrue(extractor.extract("=((", "Sheet1").isEmpty());
    }

    @Test
    public void testNamedRanges() {
        ReferenceScan scan = extractor.scan("=SUM(Revenue)-Costs_2024*Rate");
        assertEquals(Set.of("Revenue", "Costs_2024", "Rate"), scan.namedRanges());
        assertTrue(scan.cells().isEmpty());
    }

    @Test
    public void testNamedRangesSkipKeywordsAndSheetPrefixes() {
        assertEquals(Set.of("Rate"), extractor.scan("=IF(TRUE,Inputs!Rate,FALSE)").namedRanges());
        assertTrue(extractor.scan("=A1 AND B1").namedRanges().isEmpty());
    }

    @Test
    public void testNamedRangesIgnoreStringText() {
        assertEquals(Set.of("Rate"), extractor.scan("=Rate&\"Total units\"").namedRanges());
    }

    @Test
    public void testMaskedTextKeepsOffsets() {
        ReferenceScan scan = extractor.scan("=SUM(A1:A3)+B1");
        assertEquals(scan.body().length(), scan.maskedText().length());
        assertEquals("SUM(     )+  ", scan.maskedText());
    }

    @Test
    public void testTokensWithoutContextKeepSheet() {
        ReferenceScan scan = extractor.scan("=Other!A1+B1");
        assertEquals("Other", scan.cells().get(0).sheet());
        assertNull(scan.cells().get(1).sheet());
        assertEquals(Set.of("Other!A1", "Here!B1"), scan.resolve("Here"));
    }
}
