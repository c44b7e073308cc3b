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
 * Wraps a {@link JsCallable}. Built-ins receive guest values as is, while
 * host-registered natives get {@code undefined} converted to {@code null}
 * and have their results converted into guest values.
 */
public class JsNativeFunction extends JsFunction {

    final JsCallable callable;
    final boolean external;

    JsNativeFunction(JsObject functionPrototype, String name, int length, JsCallable callable, boolean external) {
        super(functionPrototype, name, length);
        this.callable = callable;
        this.external = external;
    }

    /**
     * Built-in constructors override this instead of passing a callable.
     */
    public Object call(Context context, Object... args) {
        return callable.call(context, args);
    }

    public boolean isExternal() {
        return external;
    }

}
