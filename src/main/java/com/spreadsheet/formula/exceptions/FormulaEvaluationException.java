package com.spreadsheet.formula.exceptions;

/**
 * Raised while evaluating a formula (bad arity, non-numeric operand,
 * unknown function, malformed arithmetic...). Never escapes the evaluator:
 * it is turned into a cached "#ERROR: ..." value for the failing cell.
 */
public class FormulaEvaluationException extends RuntimeException {
    public static final String ERROR_PREFIX = "#ERROR: ";

    public FormulaEvaluationException(String message) {
        super(message);
    }

    public FormulaEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * The marker stored for the failing cell. A message that already is a
     * marker (an error propagated from another cell) is kept as-is.
     */
    public String toErrorValue() {
        String message = getMessage();
        if (message != null && message.startsWith("#")) {
            return message;
        }
        return ERROR_PREFIX + message;
    }
}
