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

/**
 * A guest-level throw travelling through Java code. Either carries the
 * thrown guest value or, when raised from Java, the name of a built-in error
 * type and a message, turned into an error object by the evaluator.
 */
public class JsException extends RuntimeException {

    private final Object thrown;
    private final String errorType;

    public JsException(Object thrown) {
        super(Terms.toStringValue(thrown), null, false, false);
        this.thrown = thrown;
        this.errorType = null;
    }

    public JsException(String errorType, String message) {
        super(message, null, false, false);
        this.thrown = null;
        this.errorType = errorType;
    }

    public static JsException error(String message) {
        return new JsException("Error", message);
    }

    public static JsException typeError(String message) {
        return new JsException("TypeError", message);
    }

    public static JsException referenceError(String message) {
        return new JsException("ReferenceError", message);
    }

    public static JsException rangeError(String message) {
        return new JsException("RangeError", message);
    }

    public static JsException syntaxError(String message) {
        return new JsException("SyntaxError", message);
    }

    /**
     * @return the built-in error type name, null when a guest value was thrown
     */
    public String getErrorType() {
        return errorType;
    }

    /**
     * @return the thrown guest value, null also when {@link #getErrorType()} is set
     */
    public Object getThrown() {
        return thrown;
    }

}
