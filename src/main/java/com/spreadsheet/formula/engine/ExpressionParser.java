package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.exceptions.ExpressionSyntaxException;
import com.spreadsheet.formula.exceptions.FormulaEvaluationException;

/**
 * Recursive-descent parser for the arithmetic left over once a formula is
 * neither a single function call nor a bare reference.
 *
 * Grammar:
 *   expression := term (('+' | '-') term)*
 *   term       := unary (('*' | '/') unary)*
 *   unary      := ('-' | '+') unary | primary
 *   primary    := number | "string" | '(' expression ')' | NAME '(' args ')' | [sheet!]A1
 *
 * Parsing only builds a tree; references and function calls are resolved
 * through a {@link Resolver} when the tree is evaluated.
 */
public final class ExpressionParser {

    /**
     * Looks up what the tree itself cannot know.
     */
    public interface Resolver {
        /**
         * Value of the referenced cell, e.g. "A1" or "Sheet2!B3".
         */
        Object resolveReference(String reference);

        /**
         * Result of NAME(arguments), arguments passed as raw text.
         */
        Object callFunction(String name, String arguments);
    }

    /**
     * A parsed expression.
     */
    public interface Node {
        Object evaluate(Resolver resolver);
    }

    private final String text;
    private int pos;

    private ExpressionParser(String text) {
        this.text = text;
    }

    /**
     * Parses the whole text or throws ExpressionSyntaxException.
     */
    public static Node parse(String text) {
        ExpressionParser parser = new ExpressionParser(text);
        Node node = parser.parseExpression();
        parser.skipWhitespace();
        if (parser.pos < text.length()) {
            throw new ExpressionSyntaxException("Unexpected '" + text.charAt(parser.pos) + "' at position " + parser.pos);
        }
        return node;
    }

    private Node parseExpression() {
        Node left = parseTerm();
        while (true) {
            skipWhitespace();
            if (peek('+') || peek('-')) {
                char op = text.charAt(pos++);
                left = new BinaryOperation(op, left, parseTerm());
            } else {
                return left;
            }
        }
    }

    private Node parseTerm() {
        Node left = parseUnary();
        while (true) {
            skipWhitespace();
            if (peek('*') || peek('/')) {
                char op = text.charAt(pos++);
                left = new BinaryOperation(op, left, parseUnary());
            } else {
                return left;
            }
        }
    }

    private Node parseUnary() {
        skipWhitespace();
        if (peek('-')) {
            pos++;
            return new Negation(parseUnary());
        }
        if (peek('+')) {
            pos++;
            return new Negation(new Negation(parseUnary()));
        }
        return parsePrimary();
    }

    private Node parsePrimary() {
        skipWhitespace();
        if (pos >= text.length()) {
            throw new ExpressionSyntaxException("Unexpected end of expression");
        }
        char c = text.charAt(pos);
        if (Character.isDigit(c) || c == '.') {
            return parseNumber();
        }
        if (c == '"') {
            int close = text.indexOf('"', pos + 1);
            if (close < 0) {
                throw new ExpressionSyntaxException("Unterminated string at position " + pos);
            }
            String value = text.substring(pos + 1, close);
            pos = close + 1;
            return resolver -> value;
        }
        if (c == '(') {
            pos++;
            Node inner = parseExpression();
            skipWhitespace();
            expect(')');
            return inner;
        }
        if (Character.isLetter(c) || c == '_') {
            return parseNameOrReference();
        }
        throw new ExpressionSyntaxException("Unexpected '" + c + "' at position " + pos);
    }

    private Node parseNumber() {
        int start = pos;
        while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
            pos++;
        }
        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            int exponent = pos + 1;
            if (exponent < text.length() && (text.charAt(exponent) == '+' || text.charAt(exponent) == '-')) {
                exponent++;
            }
            if (exponent < text.length() && Character.isDigit(text.charAt(exponent))) {
                pos = exponent;
                while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                    pos++;
                }
            }
        }
        String literal = text.substring(start, pos);
        try {
            double value = Double.parseDouble(literal);
            return resolver -> value;
        } catch (NumberFormatException e) {
            throw new ExpressionSyntaxException("Malformed number '" + literal + "'");
        }
    }

    private Node parseNameOrReference() {
        String word = readWord();
        if (peek('!')) {
            pos++;
            String cell = readWord();
            String reference = word + "!" + cell;
            if (ReferenceCodec.parse(reference).isEmpty()) {
                throw new ExpressionSyntaxException("Invalid reference '" + reference + "'");
            }
            return resolver -> resolver.resolveReference(reference);
        }
        if (peek('(')) {
            int close = findClosingParen(text, pos);
            if (close < 0) {
                throw new ExpressionSyntaxException("Unbalanced parentheses after " + word);
            }
            String arguments = text.substring(pos + 1, close);
            pos = close + 1;
            return resolver -> resolver.callFunction(word, arguments);
        }
        if (ReferenceCodec.parse(word).isPresent()) {
            return resolver -> resolver.resolveReference(word);
        }
        throw new ExpressionSyntaxException("Unknown name '" + word + "'");
    }

    private String readWord() {
        int start = pos;
        while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
            pos++;
        }
        if (start == pos) {
            throw new ExpressionSyntaxException("Expected a name at position " + pos);
        }
        return text.substring(start, pos);
    }

    private void expect(char c) {
        if (!peek(c)) {
            throw new ExpressionSyntaxException("Expected '" + c + "' at position " + pos);
        }
        pos++;
    }

    private boolean peek(char c) {
        return pos < text.length() && text.charAt(pos) == c;
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    /**
     * Index of the ')' matching the '(' at openIndex, skipping quoted text; -1 if unbalanced.
     */
    static int findClosingParen(String text, int openIndex) {
        int depth = 0;
        boolean quoted = false;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    // ----------------------------------------------------------------
    // Tree nodes
    // ----------------------------------------------------------------

    private static final class Negation implements Node {
        private final Node operand;

        Negation(Node operand) {
            this.operand = operand;
        }

        @Override
        public Object evaluate(Resolver resolver) {
            return -numeric(operand.evaluate(resolver), '-');
        }
    }

    private static final class BinaryOperation implements Node {
        private final char operator;
        private final Node left;
        private final Node right;

        BinaryOperation(char operator, Node left, Node right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        @Override
        public Object evaluate(Resolver resolver) {
            Object lhs = left.evaluate(resolver);
            Object rhs = right.evaluate(resolver);
            switch (operator) {
                case '+':
                    Double a = FormulaValues.toNumber(blankAsZero(lhs));
                    Double b = FormulaValues.toNumber(blankAsZero(rhs));
                    if (a != null && b != null) {
                        return a + b;
                    }
                    // Text on either side concatenates
                    return FormulaValues.toText(lhs) + FormulaValues.toText(rhs);
                case '-':
                    return numeric(lhs, operator) - numeric(rhs, operator);
                case '*':
                    return numeric(lhs, operator) * numeric(rhs, operator);
                case '/':
                    double divisor = numeric(rhs, operator);
                    if (divisor == 0) {
                        throw new FormulaEvaluationException("Division by zero");
                    }
                    return numeric(lhs, operator) / divisor;
                default:
                    throw new IllegalStateException("Unsupported operator " + operator);
            }
        }
    }

    private static Object blankAsZero(Object value) {
        return "".equals(value) ? 0.0 : value;
    }

    private static double numeric(Object value, char operator) {
        Double number = FormulaValues.toNumber(blankAsZero(value));
        if (number == null) {
            throw new FormulaEvaluationException("Non-numeric operand for '" + operator + "': " + FormulaValues.toText(value));
        }
        return number;
    }
}
