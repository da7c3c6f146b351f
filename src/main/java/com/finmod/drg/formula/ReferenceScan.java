package com.finmod.drg.formula;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Raw references found in one formula, before any sheet context is applied.
 *
 * @param body        formula text without the leading {@code =}.
 * @param cells       single-cell tokens, in order of appearance.
 * @param ranges      range tokens, in order of appearance.
 * @param namedRanges identifiers that look like named ranges (heuristic).
 * @param maskedText  {@code body} with string literals, ranges and cells
 *                    blanked out; same length as {@code body}.
 */
public record ReferenceScan(String body, List<CellToken> cells, List<RangeToken> ranges,
        Set<String> namedRanges, String maskedText) {

    public ReferenceScan {
        cells = List.copyOf(cells);
        ranges = List.copyOf(ranges);
        namedRanges = Collections.unmodifiableSet(new LinkedHashSet<>(namedRanges));
    }

    /** A single-cell token. {@code sheet} is null when the token is unqualified. */
    public record CellToken(String text, String sheet, String column, int row) {

        public CellAddress resolve(String currentSheet) {
            return new CellAddress(sheet != null ? sheet : currentSheet, column, row);
        }
    }

    /** A two-ended range token such as {@code A1:B10}. */
    public record RangeToken(String text, CellToken start, CellToken end) {
    }

    /** Single-cell tokens as written, e.g. {@code $B$2}. */
    public Set<String> cellReferences() {
        Set<String> out = new LinkedHashSet<>();
        for (CellToken c : cells)
            out.add(c.text());
        return Collections.unmodifiableSet(out);
    }

    /** Range tokens as written, e.g. {@code A1:A10}. */
    public Set<String> rangeReferences() {
        Set<String> out = new LinkedHashSet<>();
        for (RangeToken r : ranges)
            out.add(r.text());
        return Collections.unmodifiableSet(out);
    }

    /**
     * Full addresses of every single cell and every range boundary, with
     * unqualified tokens placed on {@code currentSheet}. Interior cells of a
     * range are not included.
     */
    public Set<String> resolve(String currentSheet) {
        Set<String> out = new LinkedHashSet<>();
        for (CellToken c : cells)
            out.add(c.resolve(currentSheet).fullAddress());
        for (RangeToken r : ranges) {
            out.add(r.start().resolve(currentSheet).fullAddress());
            out.add(r.end().resolve(currentSheet).fullAddress());
        }
        return Collections.unmodifiableSet(out);
    }
}
