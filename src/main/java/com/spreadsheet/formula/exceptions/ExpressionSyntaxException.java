package com.spreadsheet.formula.exceptions;

/**
 * Thrown when text cannot be parsed as an arithmetic expression at all,
 * as opposed to parsing fine and then failing to evaluate.
 */
public class ExpressionSyntaxException extends FormulaEvaluationException {
    public ExpressionSyntaxException(String message) {
        super(message);
    }
}
