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
 * A binding entry with its value and declaration kind. Let and const
 * bindings start uninitialized until their declaration runs.
 */
class BindValue {

    final String name;
    final BindingType type;
    Object value;
    boolean initialized;

    BindValue(String name, BindingType type, Object value, boolean initialized) {
        this.name = name;
        this.type = type;
        this.value = value;
        this.initialized = initialized;
    }

    BindValue copy() {
        return new BindValue(name, type, value, initialized);
    }

    @Override
    public String toString() {
        return type + " " + name + "=" + (initialized ? Terms.toStringValue(value) : "<uninitialized>");
    }

}
