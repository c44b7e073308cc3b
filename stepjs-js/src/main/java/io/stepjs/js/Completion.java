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
 * How a statement finished. Anything other than {@link Type#NORMAL} unwinds
 * the evaluation stack until a matching handler is found.
 */
final class Completion {

    enum Type {
        NORMAL, RETURN, BREAK, CONTINUE, THROW
    }

    final Type type;
    final Object value;
    final String label;

    private Completion(Type type, Object value, String label) {
        this.type = type;
        this.value = value;
        this.label = label;
    }

    static Completion returning(Object value) {
        return new Completion(Type.RETURN, value, null);
    }

    static Completion breaking(String label) {
        return new Completion(Type.BREAK, Terms.UNDEFINED, label);
    }

    static Completion continuing(String label) {
        return new Completion(Type.CONTINUE, Terms.UNDEFINED, label);
    }

    static Completion throwing(Object value) {
        return new Completion(Type.THROW, value, null);
    }

    @Override
    public String toString() {
        return type + (label == null ? "" : ":" + label) + " " + Terms.toStringValue(value);
    }

}
