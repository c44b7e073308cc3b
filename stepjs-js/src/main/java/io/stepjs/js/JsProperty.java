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
 * A resolved assignment target or callee: either a variable in an
 * environment or a property of a base value. The base doubles as the
 * receiver ({@code this}) of a method call.
 */
final class JsProperty {

    /**
     * Result of an optional chain whose base was null or undefined, reads
     * give undefined and writes are ignored.
     */
    static final JsProperty SHORT_CIRCUIT = new JsProperty(null, Terms.UNDEFINED, "");

    final Environment env;
    final Object object;
    final String name;

    private JsProperty(Environment env, Object object, String name) {
        this.env = env;
        this.object = object;
        this.name = name;
    }

    static JsProperty variable(Environment env, String name) {
        return new JsProperty(env, null, name);
    }

    static JsProperty member(Object object, String name) {
        return new JsProperty(null, object, name);
    }

    boolean isShortCircuit() {
        return this == SHORT_CIRCUIT;
    }

    boolean isVariable() {
        return env != null;
    }

    Object get(Interpreter interpreter) {
        if (isShortCircuit()) {
            return Terms.UNDEFINED;
        }
        if (env != null) {
            return env.lookup(name);
        }
        return interpreter.getMember(object, name);
    }

    void set(Interpreter interpreter, Object value) {
        if (isShortCircuit()) {
            return;
        }
        if (env != null) {
            env.assign(name, value, interpreter.engine.isStrictAssignment());
        } else {
            interpreter.setMember(object, name, value);
        }
    }

    Object thisValue() {
        return env == null ? object : Terms.UNDEFINED;
    }

    @Override
    public String toString() {
        return env != null ? name : Terms.toStringValue(object) + "." + name;
    }

}
