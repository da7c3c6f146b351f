package com.finmod.drg.formula;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single worksheet cell: sheet name, column letters and row number.
 *
 * <p>
 * Equality is structural. Absolute-reference markers ({@code $}) are accepted
 * by the parse methods but never stored, so {@code $A$1} and {@code A1} on the
 * same sheet are the same address. Column letters are upper-cased.
 *
 * <p>
 * {@link #fullAddress()} ({@code Sheet!A1}) is the key used for a cell
 * everywhere in the graph.
 */
public record CellAddress(String sheet, String column, int row) {

    private static final Pattern ADDRESS = Pattern.compile(
            "^(?:(?:'(?<quoted>(?:[^']|'')+)'|(?<bare>[^!']+))!)?\\$?(?<col>[A-Za-z]{1,3})\\$?(?<row>\\d+)$");

    public CellAddress {
        Objects.requireNonNull(sheet, "sheet");
        Objects.requireNonNull(column, "column");
        if (sheet.isEmpty())
            throw new IllegalArgumentException("Empty sheet name");
        if (column.isEmpty())
            throw new IllegalArgumentException("Empty column");
        if (row < 0)
            throw new IllegalArgumentException("Negative row: " + row);
        column = column.toUpperCase(Locale.ROOT);
    }

    /**
     * Parses a fully qualified address such as {@code Sheet1!A1} or
     * {@code 'My Sheet'!$B$2}.
     *
     * @throws IllegalArgumentException if the text has no sheet prefix or is not
     *                                  a cell address.
     */
    public static CellAddress parse(String text) {
        return parse(text, null);
    }

    /**
     * Parses an address, qualifying it with {@code defaultSheet} when the text
     * carries no sheet prefix.
     */
    public static CellAddress parse(String text, String defaultSheet) {
        Matcher m = ADDRESS.matcher(text.trim());
        if (!m.matches())
            throw new IllegalArgumentException("Not a cell address: " + text);
        String sheet = sheetName(m.group("quoted"), m.group("bare"));
        if (sheet == null)
            sheet = defaultSheet;
        if (sheet == null)
            throw new IllegalArgumentException("Missing sheet name in address: " + text);
        return new CellAddress(sheet, m.group("col"), parseRow(m.group("row"), text));
    }

    static String sheetName(String quoted, String bare) {
        if (quoted != null)
            return quoted.replace("''", "'");
        return bare;
    }

    private static int parseRow(String digits, String context) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Row out of range in " + context, e);
        }
    }

    /** The local part of the address, e.g. {@code A1}. */
    public String localAddress() {
        return column + row;
    }

    /** Canonical {@code Sheet!A1} form. */
    public String fullAddress() {
        return sheet + "!" + column + row;
    }

    @Override
    public String toString() {
        return fullAddress();
    }
}
