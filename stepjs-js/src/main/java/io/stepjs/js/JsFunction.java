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
 * Base of all callable guest values.
 */
public abstract class JsFunction extends JsObject {

    JsFunction(JsObject functionPrototype, String name, int length) {
        super(functionPrototype);
        defineOwnProperty("name", name == null ? "" : name, false, false, true);
        defineOwnProperty("length", length, false, false, true);
    }

    public String getName() {
        Object name = get("name");
        return name instanceof String ? (String) name : "";
    }

    /**
     * Gives an anonymous function the name of the binding or key it was
     * assigned to.
     */
    void inferName(String name) {
        if (getName().isEmpty() && hasOwnProperty("name")) {
            defineOwnProperty("name", name, false, false, true);
        }
    }

    @Override
    public String getClassName() {
        return "Function";
    }

    @Override
    String toStringValue() {
        return "function " + getName() + "() { [native code] }";
    }

}
