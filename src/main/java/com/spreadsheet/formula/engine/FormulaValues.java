package com.spreadsheet.formula.engine;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Coercions shared by the arithmetic parser and the built-in functions.
 * Cell values are either a String or a Double.
 */
public final class FormulaValues {

    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private FormulaValues() {
    }

    /**
     * The value as a number, or null when it is not one.
     * Strings must be a plain decimal number in their entirety.
     */
    public static Double toNumber(Object value) {
        if (value instanceof Double) {
            Double number = (Double) value;
            return number.isNaN() ? null : number;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (NUMBER.matcher(text).matches()) {
                return Double.parseDouble(text);
            }
        }
        return null;
    }

    /**
     * String form used when a value is concatenated or displayed as text:
     * whole numbers lose their ".0".
     */
    public static String toText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double) {
            double number = (Double) value;
            if (number == Math.rint(number) && !Double.isInfinite(number) && Math.abs(number) < 1e15) {
                return Long.toString((long) number);
            }
            return Double.toString(number);
        }
        return value.toString();
    }

    /**
     * Numbers are true unless zero; text is false when empty, "0" or "false".
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        Double number = toNumber(value);
        if (number != null) {
            return number != 0;
        }
        String text = value.toString().trim();
        return !text.isEmpty() && !text.toLowerCase(Locale.ROOT).equals("false");
    }
}
