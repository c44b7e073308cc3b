/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.stepjs.js;

import io.stepjs.parser.Token;

import java.math.BigDecimal;

/**
 * Coercion and operator rules for primitive values. Object operands are
 * converted to primitives by the evaluator before they reach this class.
 */
public class Terms {

    public static final Object UNDEFINED = new Object() {
        @Override
        public String toString() {
            return "undefined";
        }
    };

    static final Number POSITIVE_ZERO = 0;
    static final Number NEGATIVE_ZERO = -0.0;

    static final Object NAN = Double.NaN;

    final Number lhs;
    final Number rhs;

    Terms(Object lhsObject, Object rhsObject) {
        lhs = objectToNumber(lhsObject);
        rhs = objectToNumber(rhsObject);
    }

    static Number parseFloat(String str) {
        if (str == null) {
            return Double.NaN;
        }
        str = str.trim();
        if (str.isEmpty()) {
            return Double.NaN;
        }
        int index = 0;
        boolean negative = false;
        if (str.charAt(index) == '-') {
            negative = true;
            index++;
        } else if (str.charAt(index) == '+') {
            index++;
        }
        if (str.startsWith("Infinity", index)) {
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        int start = index;
        boolean foundDigit = false;
        boolean seenDot = false;
        boolean seenExp = false;
        while (index < str.length()) {
            char ch = str.charAt(index);
            if (ch >= '0' && ch <= '9') {
                foundDigit = true;
            } else if (ch == '.' && !seenDot && !seenExp) {
                seenDot = true;
            } else if ((ch == 'e' || ch == 'E') && foundDigit && !seenExp) {
                // only an exponent if digits follow
                int next = index + 1;
                if (next < str.length() && (str.charAt(next) == '+' || str.charAt(next) == '-')) {
                    next++;
                }
                if (next >= str.length() || !Character.isDigit(str.charAt(next))) {
                    break;
                }
                seenExp = true;
                index = next;
            } else {
                break; // stop at first invalid char
            }
            index++;
        }
        if (!foundDigit) {
            return Double.NaN;
        }
        double value = Double.parseDouble(str.substring(start, index));
        return narrow(negative ? -value : value);
    }

    static Number parseInt(String str, int radix) {
        if (str == null) {
            return Double.NaN;
        }
        str = str.trim();
        boolean negative = false;
        if (str.startsWith("-")) {
            negative = true;
            str = str.substring(1);
        } else if (str.startsWith("+")) {
            str = str.substring(1);
        }
        if ((radix == 0 || radix == 16) && (str.startsWith("0x") || str.startsWith("0X"))) {
            str = str.substring(2);
            radix = 16;
        }
        if (radix == 0) {
            radix = 10;
        }
        if (radix < 2 || radix > 36) {
            return Double.NaN;
        }
        int end = 0;
        while (end < str.length() && Character.digit(str.charAt(end), radix) != -1) {
            end++;
        }
        if (end == 0) {
            return Double.NaN;
        }
        double value = 0;
        for (int i = 0; i < end; i++) {
            value = value * radix + Character.digit(str.charAt(i), radix);
        }
        return narrow(negative ? -value : value);
    }

    static Number objectToNumber(Object o) {
        if (o instanceof Number) {
            return (Number) o;
        }
        if (o instanceof Boolean) {
            return (Boolean) o ? 1 : 0;
        }
        if (o instanceof String) {
            return toNumber(((String) o).trim());
        }
        if (o == null) {
            return 0;
        }
        return Double.NaN; // includes undefined
    }

    public static Number toNumber(String text) {
        if (text.isEmpty()) {
            return 0;
        }
        if ("Infinity".equals(text) || "+Infinity".equals(text)) {
            return Double.POSITIVE_INFINITY;
        }
        if ("-Infinity".equals(text)) {
            return Double.NEGATIVE_INFINITY;
        }
        Number hex = fromHex(text);
        if (hex != null) {
            return hex;
        }
        if (text.length() > 1 && text.charAt(0) == '0' && (text.charAt(1) == 'x' || text.charAt(1) == 'X')) {
            return Double.NaN; // malformed hex, parseDouble would accept hex floats like 0x1p3
        }
        char last = text.charAt(text.length() - 1);
        if (last == 'd' || last == 'D' || last == 'f' || last == 'F') {
            // Double.parseDouble accepts java type suffixes
            return Double.NaN;
        }
        try {
            return narrow(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    static Number fromHex(String text) {
        if (text.length() < 3 || text.charAt(0) != '0' || (text.charAt(1) != 'x' && text.charAt(1) != 'X')) {
            return null;
        }
        double value = 0;
        for (int i = 2; i < text.length(); i++) {
            char c = text.charAt(i);
            int digit = c < 128 ? Character.digit(c, 16) : -1;
            if (digit < 0) {
                return null;
            }
            value = value * 16 + digit;
        }
        return narrow(value);
    }

    static Object literalValue(Token token) {
        String text = token.getText();
        switch (token.type) {
            case S_STRING:
            case D_STRING:
                return unescapeString(text.substring(1, text.length() - 1));
            case NUMBER:
                return toNumber(text);
            case TRUE:
                return true;
            case FALSE:
                return false;
            default: // NULL
                return null;
        }
    }

    static String unescapeString(String s) {
        if (s.indexOf('\\') == -1) {
            return s;
        }
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != '\\' || i + 1 >= s.length()) {
                sb.append(c);
                continue;
            }
            char next = s.charAt(++i);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'v' -> sb.append('\u000B');
                case '0' -> sb.append('\0');
                case '\n' -> {
                    // line continuation
                }
                case 'u' -> {
                    if (i + 4 < s.length()) {
                        try {
                            sb.append((char) Integer.parseInt(s.substring(i + 1, i + 5), 16));
                            i += 4;
                        } catch (NumberFormatException e) {
                            sb.append(next);
                        }
                    } else {
                        sb.append(next);
                    }
                }
                case 'x' -> {
                    if (i + 2 < s.length()) {
                        try {
                            sb.append((char) Integer.parseInt(s.substring(i + 1, i + 3), 16));
                            i += 2;
                        } catch (NumberFormatException e) {
                            sb.append(next);
                        }
                    } else {
                        sb.append(next);
                    }
                }
                default -> sb.append(next); // \\ \' \" \` and unknown escapes
            }
        }
        return sb.toString();
    }

    static boolean isNullish(Object value) {
        return value == null || value == UNDEFINED;
    }

    static boolean eq(Object lhs, Object rhs, boolean strict) {
        if (lhs == null) {
            return rhs == null || !strict && rhs == UNDEFINED;
        }
        if (lhs == UNDEFINED) {
            return rhs == UNDEFINED || !strict && rhs == null;
        }
        if (lhs == rhs) { // instance equality
            return !(lhs instanceof Double) || !((Double) lhs).isNaN();
        }
        if (rhs == null || rhs == UNDEFINED) {
            return false;
        }
        if (lhs instanceof Number && rhs instanceof Number) {
            return ((Number) lhs).doubleValue() == ((Number) rhs).doubleValue();
        }
        if (lhs instanceof JsObject || rhs instanceof JsObject) {
            return false; // objects compare by identity
        }
        if (lhs.equals(rhs)) {
            return true;
        }
        if (strict) {
            return false;
        }
        if (lhs instanceof Number || rhs instanceof Number || lhs instanceof Boolean || rhs instanceof Boolean) {
            Terms terms = new Terms(lhs, rhs);
            return terms.lhs.doubleValue() == terms.rhs.doubleValue();
        }
        return false;
    }

    static boolean lt(Object lhs, Object rhs) {
        if (lhs instanceof String && rhs instanceof String) {
            return ((String) lhs).compareTo((String) rhs) < 0;
        }
        Terms terms = new Terms(lhs, rhs);
        return terms.lhs.doubleValue() < terms.rhs.doubleValue();
    }

    static boolean gt(Object lhs, Object rhs) {
        if (lhs instanceof String && rhs instanceof String) {
            return ((String) lhs).compareTo((String) rhs) > 0;
        }
        Terms terms = new Terms(lhs, rhs);
        return terms.lhs.doubleValue() > terms.rhs.doubleValue();
    }

    static boolean ltEq(Object lhs, Object rhs) {
        if (lhs instanceof String && rhs instanceof String) {
            return ((String) lhs).compareTo((String) rhs) <= 0;
        }
        Terms terms = new Terms(lhs, rhs);
        return terms.lhs.doubleValue() <= terms.rhs.doubleValue();
    }

    static boolean gtEq(Object lhs, Object rhs) {
        if (lhs instanceof String && rhs instanceof String) {
            return ((String) lhs).compareTo((String) rhs) >= 0;
        }
        Terms terms = new Terms(lhs, rhs);
        return terms.lhs.doubleValue() >= terms.rhs.doubleValue();
    }

    static int toInt32(Number n) {
        double d = n.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return 0;
        }
        return (int) (long) d;
    }

    Object bitAnd() {
        return toInt32(lhs) & toInt32(rhs);
    }

    Object bitOr() {
        return toInt32(lhs) | toInt32(rhs);
    }

    Object bitXor() {
        return toInt32(lhs) ^ toInt32(rhs);
    }

    Object bitShiftRight() {
        return toInt32(lhs) >> (toInt32(rhs) & 0x1F);
    }

    Object bitShiftLeft() {
        return toInt32(lhs) << (toInt32(rhs) & 0x1F);
    }

    Object bitShiftRightUnsigned() {
        return narrow((toInt32(lhs) & 0xFFFFFFFFL) >>> (toInt32(rhs) & 0x1F));
    }

    static Object bitNot(Object value) {
        return ~toInt32(objectToNumber(value));
    }

    static Number negate(Object value) {
        Number number = objectToNumber(value);
        if (number instanceof Integer && number.intValue() == 0) {
            return NEGATIVE_ZERO;
        }
        return narrow(-number.doubleValue());
    }

    Object mul() {
        return narrow(lhs.doubleValue() * rhs.doubleValue());
    }

    Object div() {
        return narrow(lhs.doubleValue() / rhs.doubleValue());
    }

    Object min() {
        return narrow(lhs.doubleValue() - rhs.doubleValue());
    }

    Object mod() {
        return narrow(lhs.doubleValue() % rhs.doubleValue());
    }

    Object exp() {
        return narrow(Math.pow(lhs.doubleValue(), rhs.doubleValue()));
    }

    static Object add(Object lhs, Object rhs) {
        if (lhs instanceof String || rhs instanceof String) {
            return toStringValue(lhs) + toStringValue(rhs);
        }
        Number lhsNum = objectToNumber(lhs);
        Number rhsNum = objectToNumber(rhs);
        if (lhsNum instanceof Integer && rhsNum instanceof Integer) {
            long result = (long) lhsNum.intValue() + rhsNum.intValue();
            return narrow(result);
        }
        return narrow(lhsNum.doubleValue() + rhsNum.doubleValue());
    }

    public static Number narrow(double d) {
        if (Double.doubleToRawLongBits(d) == Double.doubleToRawLongBits(-0.0)) {
            return d;
        }
        if (d % 1 != 0 || Double.isInfinite(d)) {
            return d;
        }
        if (d <= Integer.MAX_VALUE && d >= Integer.MIN_VALUE) {
            return (int) d;
        }
        if (Math.abs(d) < 9007199254740992d) { // 2^53, exact as long
            return (long) d;
        }
        return d;
    }

    public static boolean isTruthy(Object value) {
        if (value == null || value == UNDEFINED) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof String) {
            return !((String) value).isEmpty();
        }
        return true;
    }

    static boolean isPrimitive(Object value) {
        return value == null || value == UNDEFINED
                || value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    public static String typeOf(Object value) {
        if (value == UNDEFINED) {
            return "undefined";
        }
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof JsFunction) {
            return "function";
        }
        return "object"; // includes null and opaque host values
    }

    /**
     * String conversion without invoking guest code, objects get their
     * built-in representation.
     */
    public static String toStringValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof Number) {
            return numberToString((Number) value);
        }
        if (value instanceof JsObject) {
            return ((JsObject) value).toStringValue();
        }
        return value.toString(); // booleans, undefined and opaque host values
    }

    static String numberToString(Number n) {
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte) {
            return n.toString();
        }
        double d = n.doubleValue();
        if (Double.isNaN(d)) {
            return "NaN";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "Infinity" : "-Infinity";
        }
        if (d == 0) {
            return "0"; // includes -0
        }
        double abs = Math.abs(d);
        if (d % 1 == 0 && abs < 1e21) {
            return new BigDecimal(d).toPlainString();
        }
        if (abs >= 1e-6 && abs < 1e21) {
            return new BigDecimal(Double.toString(d)).stripTrailingZeros().toPlainString();
        }
        // exponent form, e.g. 1.0E-7 becomes 1e-7
        String s = Double.toString(d);
        int e = s.indexOf('E');
        String mantissa = s.substring(0, e);
        if (mantissa.endsWith(".0")) {
            mantissa = mantissa.substring(0, mantissa.length() - 2);
        }
        String exponent = s.substring(e + 1);
        return mantissa + "e" + (exponent.startsWith("-") ? exponent : "+" + exponent);
    }

    /**
     * Canonical property key for a primitive, numbers without a fractional
     * part become plain integer strings so that array indexing works.
     */
    static String toPropertyKey(Object value) {
        if (value instanceof String) {
            return (String) value;
        }
        return toStringValue(value);
    }

}
