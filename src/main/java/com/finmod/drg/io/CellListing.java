package com.finmod.drg.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.finmod.drg.api.CellRecord;

import lombok.Data;

/**
 * POJO form of a workbook's cell listing, as produced by the spreadsheet
 * reader: sheet name to ordered cells, plus optional named ranges.
 *
 * <pre>{@code
 * {
 *   "name": "model",
 *   "sheets": {
 *     "Sheet1": [ { "address": "A1", "value": 10 },
 *                 { "address": "B1", "formula": "=A1*2" } ]
 *   },
 *   "namedRanges": { "Rate": "Inputs!$B$2" }
 * }
 * }</pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CellListing {
    private String name;
    private Map<String, List<CellDef>> sheets = new LinkedHashMap<>();
    private Map<String, String> namedRanges = new LinkedHashMap<>();

    /** A single cell entry. Style metadata is carried but not interpreted. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class CellDef {
        private String address;
        private Object value;
        private String formula;
        private Map<String, Object> style;
    }

    /** Adds a cell to a sheet, creating the sheet on first use. */
    public CellListing add(String sheet, String address, Object value, String formula) {
        CellDef def = new CellDef();
        def.setAddress(address);
        def.setValue(value);
        def.setFormula(formula);
        sheets.computeIfAbsent(sheet, k -> new ArrayList<>()).add(def);
        return this;
    }

    /** Flattens the listing into records, sheet by sheet, in listing order. */
    public List<CellRecord> records() {
        List<CellRecord> out = new ArrayList<>();
        if (sheets == null)
            return out;
        for (var entry : sheets.entrySet()) {
            if (entry.getValue() == null)
                continue;
            for (CellDef def : entry.getValue()) {
                if (def.getAddress() == null)
                    throw new IllegalArgumentException("Cell without address on sheet " + entry.getKey());
                out.add(new CellRecord(entry.getKey(), def.getAddress(), def.getValue(), def.getFormula()));
            }
        }
        return out;
    }
}
