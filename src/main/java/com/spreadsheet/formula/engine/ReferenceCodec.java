package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.models.CellCoordinate;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between structured coordinates and A1-style addresses.
 * Pure and stateless.
 *
 * Column 0 is "A", 25 is "Z", 26 is "AA"; row 0 is rendered "1".
 * The canonical address always carries its sheet: "Sheet1!AA10".
 */
public final class ReferenceCodec {

    public static final String DEFAULT_SHEET = "Sheet1";

    // Optional "sheet!" prefix, column letters, 1-based row number
    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^(?:([^!]+)!)?([A-Za-z]+)(\\d+)$");

    /**
     * Sheet name as it may be written inside a formula: a word of letters, digits
     * and underscores in any script, not starting with a digit. Matches what
     * {@link Character#isLetterOrDigit(char)} accepts, so the parser and the
     * reference extractor agree on where a sheet name starts.
     */
    public static final String FORMULA_SHEET_NAME = "[\\p{L}_][\\p{L}\\p{Nd}_]*";

    // A character that may continue a formula word
    static final String WORD_CHAR = "[\\p{L}\\p{Nd}_]";

    // Inside formulas sheet names are plain words, so "1+Sheet2!A1" is not one reference
    private static final Pattern FORMULA_REFERENCE =
            Pattern.compile("^(?:" + FORMULA_SHEET_NAME + "!)?[A-Za-z]+\\d+$");

    private ReferenceCodec() {
    }

    /**
     * Renders a zero-based column/row pair on the given sheet, e.g. (1, 2, "Sheet1") -> "Sheet1!B3".
     */
    public static String toAddress(int column, int row, String sheet) {
        if (column < 0 || row < 0) {
            throw new IllegalArgumentException("Column and row must be non-negative, got " + column + "," + row);
        }
        return sheet + "!" + toColumnLetters(column) + ((long) row + 1);
    }

    /**
     * Base-26 letters for a zero-based column index, 1-indexed: 0 -> A, 26 -> AA.
     */
    public static String toColumnLetters(int column) {
        StringBuilder letters = new StringBuilder();
        long dividend = (long) column + 1;
        while (dividend > 0) {
            int modulo = (int) ((dividend - 1) % 26);
            letters.insert(0, (char) ('A' + modulo));
            dividend = (dividend - modulo) / 26;
        }
        return letters.toString();
    }

    /**
     * Parses an address, defaulting to "Sheet1" when no sheet prefix is given.
     */
    public static Optional<CellCoordinate> parse(String text) {
        return parse(text, DEFAULT_SHEET);
    }

    /**
     * Parses "[sheet!]LETTERS DIGITS" (letters case-insensitive).
     * Returns empty for anything that is not a reference; callers use
     * that to tell references apart from literals.
     */
    public static Optional<CellCoordinate> parse(String text, String defaultSheet) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = ADDRESS_PATTERN.matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String sheet = matcher.group(1) != null ? matcher.group(1) : defaultSheet;

        String letters = matcher.group(2).toUpperCase(Locale.ROOT);
        long column = 0;
        for (int i = 0; i < letters.length(); i++) {
            column = column * 26 + (letters.charAt(i) - 'A' + 1);
            if (column - 1 > Integer.MAX_VALUE) {
                return Optional.empty();
            }
        }
        column -= 1;

        String digits = matcher.group(3);
        long rowNumber;
        try {
            rowNumber = Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        // Rows are 1-based in text; "A0" is not a cell
        if (rowNumber < 1 || rowNumber - 1 > Integer.MAX_VALUE) {
            return Optional.empty();
        }
        return Optional.of(new CellCoordinate(sheet, (int) column, (int) (rowNumber - 1)));
    }

    /**
     * Like {@link #parse(String, String)}, for an operand written inside a formula.
     */
    public static Optional<CellCoordinate> parseFormulaReference(String text, String currentSheet) {
        if (text == null || !FORMULA_REFERENCE.matcher(text).matches()) {
            return Optional.empty();
        }
        return parse(text, currentSheet);
    }

    /**
     * Canonical form of a textual address ("a1" -> "Sheet1!A1"), or empty if it is not one.
     */
    public static Optional<String> canonicalize(String text, String defaultSheet) {
        return parse(text == null ? null : text.trim(), defaultSheet).map(CellCoordinate::toAddress);
    }

    /**
     * Sheet part of a canonical address.
     */
    public static String sheetOf(String address) {
        int bang = address.lastIndexOf('!');
        return bang < 0 ? DEFAULT_SHEET : address.substring(0, bang);
    }
}
