package com.finmod.drg.api;

import java.util.Objects;

/**
 * One cell as delivered by the spreadsheet reader: its sheet, local address,
 * and either a literal value or formula text (or both, when the reader also
 * supplies a cached result).
 *
 * @param sheet   sheet name.
 * @param address local address such as {@code A1} or {@code $B$2}.
 * @param value   literal or cached value; may be null.
 * @param formula formula text, with or without the leading {@code =}; null or
 *                blank for literal cells.
 */
public record CellRecord(String sheet, String address, Object value, String formula) {

    public CellRecord {
        Objects.requireNonNull(sheet, "sheet");
        Objects.requireNonNull(address, "address");
        if (formula != null && formula.isBlank())
            formula = null;
    }

    public static CellRecord literal(String sheet, String address, Object value) {
        return new CellRecord(sheet, address, value, null);
    }

    public static CellRecord formula(String sheet, String address, String formula) {
        return new CellRecord(sheet, address, null, formula);
    }

    public boolean hasFormula() {
        return formula != null;
    }
}
