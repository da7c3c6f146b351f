package com.finmod.drg.formula;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.extern.log4j.Log4j2;

/**
 * Lexical scanner for cell, range and named-range references in formula text.
 *
 * <p>
 * Scanning order matters:
 * <ol>
 * <li>String literals are blanked so quoted text is never read as a
 * reference.</li>
 * <li>Ranges ({@code A1:B10}, optionally sheet-qualified) are matched and
 * blanked, so their boundaries are not counted again as single cells.</li>
 * <li>Single cells are matched and blanked.</li>
 * <li>Whatever identifiers remain, minus function names and a few keywords,
 * are reported as named-range candidates.</li>
 * </ol>
 * Blanking replaces characters with spaces, keeping every offset stable.
 *
 * <p>
 * Only the two boundary cells of a range are ever reported; the cells between
 * them are not enumerated. Named ranges are advisory and never expanded.
 *
 * <p>
 * A token whose row number does not fit an {@code int} is blanked and
 * reported as nothing, so one malformed formula never fails a build.
 *
 * <p>
 * Stateless and thread-safe.
 */
@Log4j2
public final class ReferenceExtractor {

    private static final String SHEET_CHARS = "[A-Za-z_][A-Za-z0-9_.]*";
    private static final String QUOTED_CHARS = "(?:[^']|'')+";

    // A reference may not be glued to a preceding identifier, '$', '!' or quote.
    private static final String LEFT_EDGE = "(?<![A-Za-z0-9_.$!'])";
    // ... nor run into a following identifier, a '!' or a call parenthesis.
    private static final String RIGHT_EDGE = "(?![A-Za-z0-9_(!])";

    static final Pattern STRING_LITERAL = Pattern.compile("\"((?:[^\"]|\"\")*)\"");

    static final Pattern FUNCTION_CALL = Pattern.compile("(?<![A-Za-z0-9_.$])([A-Za-z_][A-Za-z0-9_.]*)\\s*\\(");

    private static final Pattern RANGE = Pattern.compile(LEFT_EDGE
            + "(?:(?:'(?<qs1>" + QUOTED_CHARS + ")'|(?<bs1>" + SHEET_CHARS + "))!)?"
            + "\\$?(?<c1>[A-Za-z]{1,3})\\$?(?<r1>\\d+)"
            + ":"
            + "(?:(?:'(?<qs2>" + QUOTED_CHARS + ")'|(?<bs2>" + SHEET_CHARS + "))!)?"
            + "\\$?(?<c2>[A-Za-z]{1,3})\\$?(?<r2>\\d+)"
            + RIGHT_EDGE);

    private static final Pattern CELL = Pattern.compile(LEFT_EDGE
            + "(?:(?:'(?<qs>" + QUOTED_CHARS + ")'|(?<bs>" + SHEET_CHARS + "))!)?"
            + "\\$?(?<col>[A-Za-z]{1,3})\\$?(?<row>\\d+)"
            + RIGHT_EDGE);

    private static final Pattern IDENTIFIER = Pattern.compile("(?<![A-Za-z0-9_.])[A-Za-z_][A-Za-z0-9_.]*");

    private static final Pattern SYNTAX = Pattern.compile("[+\\-*/^&<>=(),;:%\\[\\]{}\"']");

    private static final Set<String> KEYWORDS = Set.of("TRUE", "FALSE", "NULL", "AND", "OR", "NOT");

    /**
     * Full addresses referenced by a formula.
     *
     * @param formulaText      formula with or without the leading {@code =}.
     * @param currentSheetName sheet used for unqualified references.
     * @return single cells plus range boundaries, as {@code Sheet!A1} strings.
     */
    public Set<String> extract(String formulaText, String currentSheetName) {
        Objects.requireNonNull(currentSheetName, "currentSheetName");
        return scan(formulaText).resolve(currentSheetName);
    }

    /** Scans a formula without applying any sheet context. */
    public ReferenceScan scan(String formulaText) {
        String body = stripEquals(Objects.requireNonNull(formulaText, "formulaText"));
        StringBuilder masked = new StringBuilder(body);

        Matcher sm = STRING_LITERAL.matcher(body);
        while (sm.find())
            blank(masked, sm.start(), sm.end());

        List<ReferenceScan.RangeToken> ranges = new ArrayList<>();
        Matcher rm = RANGE.matcher(masked.toString());
        while (rm.find()) {
            String firstSheet = CellAddress.sheetName(rm.group("qs1"), rm.group("bs1"));
            String secondSheet = CellAddress.sheetName(rm.group("qs2"), rm.group("bs2"));
            int colon = rm.end("r1") - rm.start();
            var start = token(rm.group().substring(0, colon), firstSheet, rm.group("c1"), rm.group("r1"));
            var end = token(rm.group().substring(colon + 1), secondSheet != null ? secondSheet : firstSheet,
                    rm.group("c2"), rm.group("r2"));
            if (start != null && end != null)
                ranges.add(new ReferenceScan.RangeToken(rm.group(), start, end));
            blank(masked, rm.start(), rm.end());
        }

        List<ReferenceScan.CellToken> cells = new ArrayList<>();
        Matcher cm = CELL.matcher(masked.toString());
        while (cm.find()) {
            String sheet = CellAddress.sheetName(cm.group("qs"), cm.group("bs"));
            var cell = token(cm.group(), sheet, cm.group("col"), cm.group("row"));
            if (cell != null)
                cells.add(cell);
            blank(masked, cm.start(), cm.end());
        }

        String maskedText = masked.toString();
        return new ReferenceScan(body, cells, ranges, namedRanges(maskedText), maskedText);
    }

    private static Set<String> namedRanges(String maskedText) {
        StringBuilder sb = new StringBuilder(maskedText);
        Matcher fm = FUNCTION_CALL.matcher(maskedText);
        while (fm.find())
            blank(sb, fm.start(1), fm.end(1));
        String stripped = SYNTAX.matcher(sb).replaceAll(" ");

        Set<String> names = new LinkedHashSet<>();
        Matcher im = IDENTIFIER.matcher(stripped);
        while (im.find()) {
            // "Name!" is a sheet prefix, not a name in its own right
            if (im.end() < stripped.length() && stripped.charAt(im.end()) == '!')
                continue;
            String word = im.group();
            if (!KEYWORDS.contains(word.toUpperCase(Locale.ROOT)))
                names.add(word);
        }
        return names;
    }

    /** Null when the row overflows; the caller skips the reference. */
    private static ReferenceScan.CellToken token(String text, String sheet, String column, String row) {
        int rowNumber;
        try {
            rowNumber = Integer.parseInt(row);
        } catch (NumberFormatException e) {
            log.debug("Skipping reference {} with out-of-range row", text);
            return null;
        }
        return new ReferenceScan.CellToken(text, sheet, column.toUpperCase(Locale.ROOT), rowNumber);
    }

    static String stripEquals(String formula) {
        String s = formula.strip();
        int i = 0;
        while (i < s.length() && s.charAt(i) == '=')
            i++;
        return s.substring(i);
    }

    static void blank(StringBuilder sb, int start, int end) {
        for (int i = start; i < end; i++)
            sb.setCharAt(i, ' ');
    }
}
