package com.finmod.drg.io;

import com.finmod.drg.api.CellRecord;
import org.junit.Test;

import java.io.InputStream;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class CellListingReaderTest {

    private final CellListingReader reader = new CellListingReader();

    @Test
    public void testParseListing() {
        String json = "{\"name\":\"m\",\"sheets\":{\"Sheet1\":["
                + "{\"address\":\"A1\",\"value\":10},"
                + "{\"address\":\"B1\",\"formula\":\"=A1*2\",\"comment\":\"ignored\"}]},"
                + "\"namedRanges\":{\"Rate\":\"Sheet1!$A$1\"}}";
        CellListing listing = reader.parse(json);

        assertEquals("m", listing.getName());
        assertEquals(Map.of("Rate", "Sheet1!$A$1"), listing.getNamedRanges());

        List<CellRecord> records = listing.records();
        assertEquals(2, records.size());
        CellRecord a1 = records.get(0);
        assertEquals("Sheet1", a1.sheet());
        assertEquals("A1", a1.address());
        assertEquals(10L, a1.value());
        assertFalse(a1.hasFormula());
        assertEquals("=A1*2", records.get(1).formula());
    }

    @Test
    public void testReadResource() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/workbook.json")) {
            CellListing listing = reader.read(in);
            assertEquals("budget", listing.getName());
            assertEquals(List.of("Inputs", "Model Calc"), List.copyOf(listing.getSheets().keySet()));
            assertEquals(6, listing.records().size());
            assertEquals(0.05, listing.getSheets().get("Inputs").get(1).getValue());
            assertEquals(Boolean.TRUE, listing.getSheets().get("Inputs").get(2).getStyle().get("bold"));
        }
    }

    @Test
    public void testBuilderStyleListing() {
        CellListing listing = new CellListing()
                .add("S", "A1", 1, null)
                .add("S", "B1", null, "=A1");
        assertEquals(2, listing.records().size());
        assertTrue(listing.records().get(1).hasFormula());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingAddressRejected() {
        reader.parse("{\"sheets\":{\"S\":[{\"value\":1}]}}").records();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidJson() {
        reader.parse("{\"sheets\": [");
    }
}
