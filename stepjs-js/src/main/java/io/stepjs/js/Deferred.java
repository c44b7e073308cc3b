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
 * Handle for a pending native call created by {@link Context#suspend()}.
 * Settling it may happen before the native returns, later from the host
 * thread, or from another thread.
 */
public class Deferred {

    private final Engine engine;
    private boolean settled;
    private boolean error;
    private Object value;

    Deferred(Engine engine) {
        this.engine = engine;
    }

    public void resolve(Object result) {
        engine.settle(this, result, false);
    }

    /**
     * The value is thrown in the guest at the call site, a string is first
     * wrapped into an {@code Error}.
     */
    public void reject(Object error) {
        engine.settle(this, error, true);
    }

    public boolean isSettled() {
        return settled;
    }

    void markSettled(Object value, boolean error) {
        if (settled) {
            throw new IllegalStateException("already settled");
        }
        this.settled = true;
        this.value = value;
        this.error = error;
    }

    boolean isError() {
        return error;
    }

    Object getValue() {
        return value;
    }

}
