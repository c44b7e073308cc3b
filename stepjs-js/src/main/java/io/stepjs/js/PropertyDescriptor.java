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
 * One own property slot of a {@link JsObject}.
 */
public class PropertyDescriptor {

    Object value;
    final boolean writable;
    final boolean enumerable;
    final boolean configurable;

    public PropertyDescriptor(Object value, boolean writable, boolean enumerable, boolean configurable) {
        this.value = value;
        this.writable = writable;
        this.enumerable = enumerable;
        this.configurable = configurable;
    }

    /**
     * Plain assignment creates writable, enumerable, configurable properties.
     */
    static PropertyDescriptor data(Object value) {
        return new PropertyDescriptor(value, true, true, true);
    }

    public Object getValue() {
        return value;
    }

    public boolean isWritable() {
        return writable;
    }

    public boolean isEnumerable() {
        return enumerable;
    }

    public boolean isConfigurable() {
        return configurable;
    }

    @Override
    public String toString() {
        return "{value: " + Terms.toStringValue(value) + ", w: " + writable + ", e: " + enumerable + ", c: " + configurable + "}";
    }

}
