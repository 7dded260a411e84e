package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.exceptions.ExpressionSyntaxException;
import com.spreadsheet.formula.exceptions.FormulaEvaluationException;
import com.spreadsheet.formula.models.CellCoordinate;
import com.spreadsheet.formula.models.ComputedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes cell values from raw content, memoized through the {@link CellStore} cache.
 *
 * A formula ("=...") is one of:
 * - a single function call, e.g. SUM(A1:A3)
 * - a bare reference, e.g. Sheet2!B4
 * - arithmetic over numbers, strings, references and nested calls, e.g. (A1+B1)*2
 *
 * Failures never escape {@link #evaluate(String)}: they become a cached
 * "#ERROR: ..." result for the failing cell, kept until invalidated.
 */
public class FormulaEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(FormulaEvaluator.class);

    public static final String NOT_AVAILABLE = "#N/A";

    static final String TOO_DEEP = FormulaEvaluationException.ERROR_PREFIX + "Formula references nest too deeply";

    private static final Pattern FUNCTION_NAME = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)\\s*\\(");

    private final CellStore store;
    private final ReferenceExtractor extractor;

    // Cells currently being computed on this call stack
    private final Set<String> inProgress = new HashSet<>();

    public FormulaEvaluator(CellStore store, ReferenceExtractor extractor) {
        this.store = store;
        this.extractor = extractor;
    }

    /**
     * Returns the cached result for address, computing and caching it first if needed.
     */
    public ComputedResult evaluate(String address) {
        Optional<ComputedResult> cached = store.getCachedResult(address);
        if (cached.isPresent()) {
            return cached.get();
        }
        if (!inProgress.add(address)) {
            // Only reachable from a nested read; the reading cell turns it into its own error
            throw new FormulaEvaluationException("Circular reference detected at " + address);
        }
        try {
            ComputedResult result = compute(address);
            store.putCachedResult(address, result);
            return result;
        } finally {
            inProgress.remove(address);
        }
    }

    public static boolean isFormula(String rawValue) {
        return rawValue != null && rawValue.startsWith("=");
    }

    private ComputedResult compute(String address) {
        String raw = store.getRawContent(address).orElse(null);
        if (!isFormula(raw)) {
            return ComputedResult.of(raw == null ? "" : raw, Collections.emptySet());
        }

        Scope scope = new Scope(ReferenceCodec.sheetOf(address));
        try {
            Object value = evaluateFormula(raw.substring(1).trim(), scope);
            logger.debug("Evaluated {} = {}", address, value);
            return ComputedResult.of(value, scope.dependencies);
        } catch (FormulaEvaluationException e) {
            logger.debug("Evaluation of {} failed: {}", address, e.getMessage());
            return ComputedResult.failed(e.toErrorValue(), scope.dependencies);
        } catch (StackOverflowError e) {
            // Reads nested deeper than the stack allows; callers going through
            // FormulaEngine compute sources first and never get here
            return ComputedResult.failed(TOO_DEEP, scope.dependencies);
        }
    }

    private Object evaluateFormula(String expression, Scope scope) {
        Matcher call = FUNCTION_NAME.matcher(expression);
        if (call.find() && ExpressionParser.findClosingParen(expression, call.end() - 1) == expression.length() - 1) {
            return callFunction(call.group(1), expression.substring(call.end(), expression.length() - 1), scope);
        }

        Optional<CellCoordinate> reference = ReferenceCodec.parseFormulaReference(expression, scope.sheet);
        if (reference.isPresent()) {
            return readCell(reference.get().toAddress(), scope);
        }

        try {
            return ExpressionParser.parse(expression).evaluate(resolverFor(scope));
        } catch (UpstreamErrorException e) {
            // Another cell's error passes through unchanged
            throw e;
        } catch (FormulaEvaluationException e) {
            throw new FormulaEvaluationException(
                    "Invalid arithmetic expression: " + expression + " (" + e.getMessage() + ")", e);
        }
    }

    // ----------------------------------------------------------------
    // Functions
    // ----------------------------------------------------------------

    private Object callFunction(String name, String arguments, Scope scope) {
        String function = name.toUpperCase(Locale.ROOT);
        List<String> args = splitArguments(arguments);

        switch (function) {
            case "SUM": {
                double sum = 0;
                for (double value : numericValues(args, scope)) {
                    sum += value;
                }
                return sum;
            }
            case "AVERAGE": {
                List<Double> values = requireValues(numericValues(args, scope), function);
                double sum = 0;
                for (double value : values) {
                    sum += value;
                }
                return sum / values.size();
            }
            case "MIN":
                return Collections.min(requireValues(numericValues(args, scope), function));
            case "MAX":
                return Collections.max(requireValues(numericValues(args, scope), function));
            case "COUNT":
                return (double) numericValues(args, scope).size();
            case "IF":
                return evaluateIf(args, scope);
            case "CONCATENATE": {
                StringBuilder result = new StringBuilder();
                for (String arg : args) {
                    result.append(FormulaValues.toText(evaluateOperand(arg, scope)));
                }
                return result.toString();
            }
            case "ROUND":
                return evaluateRound(args, scope);
            case "ABS":
                requireArity(args, 1, function);
                return Math.abs(requireNumber(evaluateOperand(args.get(0), scope), function));
            case "SQRT": {
                requireArity(args, 1, function);
                double value = requireNumber(evaluateOperand(args.get(0), scope), function);
                if (value < 0) {
                    throw new FormulaEvaluationException("Invalid argument for SQRT");
                }
                return Math.sqrt(value);
            }
            case "POWER": {
                requireArity(args, 2, function);
                double base = requireNumber(evaluateOperand(args.get(0), scope), function);
                double exponent = requireNumber(evaluateOperand(args.get(1), scope), function);
                double result = Math.pow(base, exponent);
                if (Double.isNaN(result)) {
                    throw new FormulaEvaluationException("Invalid arguments for POWER");
                }
                return result;
            }
            case "VLOOKUP":
                if (args.size() < 3) {
                    throw new FormulaEvaluationException("VLOOKUP requires at least 3 arguments");
                }
                // Table lookups are not supported yet; the placeholder is a value, not a failure
                return NOT_AVAILABLE;
            default:
                throw new FormulaEvaluationException("Unknown function: " + function);
        }
    }

    private Object evaluateIf(List<String> args, Scope scope) {
        if (args.size() != 3) {
            throw new FormulaEvaluationException("IF function requires exactly 3 arguments");
        }
        boolean condition = FormulaValues.isTruthy(evaluateOperand(args.get(0), scope));
        // Only the selected branch is evaluated
        return evaluateOperand(condition ? args.get(1) : args.get(2), scope);
    }

    private Object evaluateRound(List<String> args, Scope scope) {
        if (args.size() != 2) {
            throw new FormulaEvaluationException("ROUND function requires exactly 2 arguments");
        }
        Double number = FormulaValues.toNumber(evaluateOperand(args.get(0), scope));
        Double digits = FormulaValues.toNumber(evaluateOperand(args.get(1), scope));
        if (number == null || digits == null || Math.abs(digits) > 308) {
            throw new FormulaEvaluationException("Invalid arguments for ROUND");
        }
        if (Double.isInfinite(number)) {
            return number;
        }
        return BigDecimal.valueOf(number)
                .setScale(digits.intValue(), RoundingMode.HALF_UP)
                .doubleValue();
    }

    /**
     * Numbers found in the arguments: ranges and references contribute the
     * numeric cells they cover, other operands are evaluated. Anything
     * non-numeric (text, blanks, failed cells) is skipped.
     */
    private List<Double> numericValues(List<String> args, Scope scope) {
        List<Double> values = new ArrayList<>();
        for (String arg : args) {
            Optional<List<String>> range = extractor.expandRange(arg, scope.sheet);
            if (range.isPresent()) {
                for (String cell : range.get()) {
                    addIfNumeric(values, readCellLeniently(cell, scope));
                }
                continue;
            }
            Optional<CellCoordinate> reference = ReferenceCodec.parseFormulaReference(arg, scope.sheet);
            if (reference.isPresent()) {
                addIfNumeric(values, readCellLeniently(reference.get().toAddress(), scope));
            } else {
                addIfNumeric(values, evaluateOperand(arg, scope));
            }
        }
        return values;
    }

    private static void addIfNumeric(List<Double> values, Object value) {
        Double number = FormulaValues.toNumber(value);
        if (number != null) {
            values.add(number);
        }
    }

    private static List<Double> requireValues(List<Double> values, String function) {
        if (values.isEmpty()) {
            throw new FormulaEvaluationException("No valid numbers for " + function);
        }
        return values;
    }

    private static void requireArity(List<String> args, int arity, String function) {
        if (args.size() != arity) {
            throw new FormulaEvaluationException(function + " function requires exactly " + arity
                    + (arity == 1 ? " argument" : " arguments"));
        }
    }

    private static double requireNumber(Object value, String function) {
        Double number = FormulaValues.toNumber(value);
        if (number == null) {
            throw new FormulaEvaluationException("Invalid argument for " + function);
        }
        return number;
    }

    // ----------------------------------------------------------------
    // Operands and references
    // ----------------------------------------------------------------

    /**
     * Value of one function argument: a quoted string stays text, a reference
     * reads the cell, a nested call or arithmetic is evaluated, and anything
     * that does not parse is returned as its own text.
     */
    private Object evaluateOperand(String operand, Scope scope) {
        String trimmed = operand.trim();
        if (trimmed.length() >= 2 && trimmed.charAt(0) == '"' && trimmed.indexOf('"', 1) == trimmed.length() - 1) {
            return trimmed.substring(1, trimmed.length() - 1);
        }

        Optional<CellCoordinate> reference = ReferenceCodec.parseFormulaReference(trimmed, scope.sheet);
        if (reference.isPresent()) {
            return readCell(reference.get().toAddress(), scope);
        }

        ExpressionParser.Node node;
        try {
            node = ExpressionParser.parse(trimmed);
        } catch (ExpressionSyntaxException e) {
            return trimmed;
        }
        return node.evaluate(resolverFor(scope));
    }

    /**
     * Value of another cell; its error, if any, becomes this cell's error.
     */
    private Object readCell(String address, Scope scope) {
        scope.dependencies.add(address);
        ComputedResult result = evaluate(address);
        if (result.isError()) {
            throw new UpstreamErrorException(result.getError());
        }
        return result.getValue();
    }

    /**
     * Value of another cell, or null if it failed.
     */
    private Object readCellLeniently(String address, Scope scope) {
        scope.dependencies.add(address);
        ComputedResult result = evaluate(address);
        return result.isError() ? null : result.getValue();
    }

    private ExpressionParser.Resolver resolverFor(Scope scope) {
        return new ExpressionParser.Resolver() {
            @Override
            public Object resolveReference(String reference) {
                CellCoordinate coordinate = ReferenceCodec.parse(reference, scope.sheet)
                        .orElseThrow(() -> new FormulaEvaluationException("Invalid reference " + reference));
                return readCell(coordinate.toAddress(), scope);
            }

            @Override
            public Object callFunction(String name, String arguments) {
                return FormulaEvaluator.this.callFunction(name, arguments, scope);
            }
        };
    }

    /**
     * Splits on commas outside parentheses and quotes; trims and drops empty pieces.
     */
    static List<String> splitArguments(String arguments) {
        List<String> result = new ArrayList<>();
        int depth = 0;
        boolean quoted = false;
        int start = 0;
        for (int i = 0; i < arguments.length(); i++) {
            char c = arguments.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')') {
                depth--;
            } else if (!quoted && depth == 0 && c == ',') {
                result.add(arguments.substring(start, i));
                start = i + 1;
            }
        }
        result.add(arguments.substring(start));

        List<String> trimmed = new ArrayList<>();
        for (String arg : result) {
            String value = arg.trim();
            if (!value.isEmpty()) {
                trimmed.add(value);
            }
        }
        return trimmed;
    }

    /**
     * A cell read failed because the cell it read had already failed.
     */
    private static final class UpstreamErrorException extends FormulaEvaluationException {
        UpstreamErrorException(String errorValue) {
            super(errorValue);
        }
    }

    /**
     * Per-formula state: the sheet unprefixed references belong to,
     * and the cells read so far.
     */
    private static final class Scope {
        private final String sheet;
        private final Set<String> dependencies = new LinkedHashSet<>();

        Scope(String sheet) {
            this.sheet = sheet;
        }
    }
}
