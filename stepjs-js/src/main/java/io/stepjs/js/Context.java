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
 * What a native function sees of the engine during a call.
 */
public interface Context {

    Engine getEngine();

    /**
     * @return the receiver of the call, undefined for a plain function call
     */
    Object getThisObject();

    boolean isConstructorCall();

    /**
     * Calls a guest or native function synchronously, evaluating a guest
     * body to completion on a separate stack.
     *
     * @throws JsException if the callee throws
     */
    Object invoke(Object function, Object thisObject, Object... args);

    /**
     * Turns the current call into a pending one: once the native returns,
     * the engine enters the suspended-await state until the returned handle
     * (or {@link Engine#resume(Object)}) supplies the result. The native's own
     * return value is ignored.
     *
     * @throws IllegalStateException inside a nested {@link #invoke} or when called twice
     */
    Deferred suspend();

    /**
     * Guest string conversion, calling a guest {@code toString} if there is one.
     */
    String toStringValue(Object value);

}
