package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.exceptions.FormulaEvaluationException;
import com.spreadsheet.formula.models.CellCoordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds every cell a formula reads, expanding ranges ("A1:B3")
 * into their individual canonical addresses.
 */
public class ReferenceExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceExtractor.class);

    // [sheet!]A1 or [sheet!]A1:B2, not glued to a longer word, not a function name
    private static final Pattern REFERENCE_TOKEN = Pattern.compile(
            "(?<![\\p{L}\\p{Nd}_!.])(?:(" + ReferenceCodec.FORMULA_SHEET_NAME + ")!)?"
                    + "([A-Za-z]+\\d+)(?::([A-Za-z]+\\d+))?(?!" + ReferenceCodec.WORD_CHAR + "|\\()");

    // A whole operand that is a range, e.g. "Sheet2!B1:A3"
    private static final Pattern RANGE_PATTERN = Pattern.compile(
            "^(?:(" + ReferenceCodec.FORMULA_SHEET_NAME + ")!)?([A-Za-z]+\\d+):([A-Za-z]+\\d+)$");

    private static final Pattern STRING_LITERAL = Pattern.compile("\"[^\"]*\"");

    private final int maxRangeCells;

    public ReferenceExtractor(int maxRangeCells) {
        this.maxRangeCells = maxRangeCells;
    }

    /**
     * Returns the de-duplicated canonical addresses referenced by the formula.
     * References without a sheet prefix belong to currentSheet.
     * Ranges larger than the configured cap contribute nothing here;
     * evaluating them reports an error instead.
     */
    public Set<String> extract(String formula, String currentSheet) {
        Set<String> references = new LinkedHashSet<>();
        if (formula == null) {
            return references;
        }
        String scanned = STRING_LITERAL.matcher(formula).replaceAll("\"\"");
        Matcher matcher = REFERENCE_TOKEN.matcher(scanned);
        while (matcher.find()) {
            String sheet = matcher.group(1) != null ? matcher.group(1) : currentSheet;
            Optional<CellCoordinate> start = ReferenceCodec.parse(matcher.group(2), sheet);
            if (start.isEmpty()) {
                continue;
            }
            if (matcher.group(3) == null) {
                references.add(start.get().toAddress());
                continue;
            }
            Optional<CellCoordinate> end = ReferenceCodec.parse(matcher.group(3), sheet);
            if (end.isEmpty()) {
                continue;
            }
            try {
                references.addAll(expand(start.get(), end.get()));
            } catch (FormulaEvaluationException e) {
                logger.warn("Skipping dependencies of {} in formula {}: {}", matcher.group(), formula, e.getMessage());
            }
        }
        return references;
    }

    /**
     * If the text is a range, its cells in row-major order; empty otherwise.
     */
    public Optional<List<String>> expandRange(String text, String currentSheet) {
        Matcher matcher = RANGE_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String sheet = matcher.group(1) != null ? matcher.group(1) : currentSheet;
        Optional<CellCoordinate> start = ReferenceCodec.parse(matcher.group(2), sheet);
        Optional<CellCoordinate> end = ReferenceCodec.parse(matcher.group(3), sheet);
        if (start.isEmpty() || end.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(expand(start.get(), end.get()));
    }

    /**
     * Every cell of the inclusive rectangle spanned by two corners, in any corner order.
     * The sheet of the first corner applies to the whole rectangle.
     */
    List<String> expand(CellCoordinate first, CellCoordinate second) {
        int minRow = Math.min(first.getRow(), second.getRow());
        int maxRow = Math.max(first.getRow(), second.getRow());
        int minCol = Math.min(first.getColumn(), second.getColumn());
        int maxCol = Math.max(first.getColumn(), second.getColumn());

        long size = ((long) maxRow - minRow + 1) * ((long) maxCol - minCol + 1);
        if (size > maxRangeCells) {
            throw new FormulaEvaluationException("Range " + first.toAddress() + ":" + second.toAddress()
                    + " spans " + size + " cells, limit is " + maxRangeCells);
        }

        List<String> cells = new ArrayList<>((int) size);
        for (int r = minRow; r <= maxRow; r++) {
            for (int c = minCol; c <= maxCol; c++) {
                cells.add(ReferenceCodec.toAddress(c, r, first.getSheet()));
            }
        }
        return cells;
    }
}
