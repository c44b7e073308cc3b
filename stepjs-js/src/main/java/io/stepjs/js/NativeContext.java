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

import java.util.ArrayList;
import java.util.List;

class NativeContext implements Context {

    private final Interpreter interpreter;
    private final Object thisObject;
    private final boolean constructorCall;

    Deferred deferred;
    boolean done;

    NativeContext(Interpreter interpreter, Object thisObject, boolean constructorCall) {
        this.interpreter = interpreter;
        this.thisObject = thisObject;
        this.constructorCall = constructorCall;
    }

    @Override
    public Engine getEngine() {
        return interpreter.engine;
    }

    @Override
    public Object getThisObject() {
        return thisObject;
    }

    @Override
    public boolean isConstructorCall() {
        return constructorCall;
    }

    @Override
    public Object invoke(Object function, Object thisObject, Object... args) {
        List<Object> list = new ArrayList<>(args.length);
        for (Object arg : args) {
            list.add(interpreter.realm.toGuest(arg));
        }
        return interpreter.invokeNested(function, thisObject == null ? Terms.UNDEFINED : thisObject, list);
    }

    @Override
    public Deferred suspend() {
        if (done) {
            throw new IllegalStateException("native call has already returned");
        }
        if (interpreter.nested) {
            throw new IllegalStateException("cannot suspend inside a nested invocation");
        }
        if (deferred != null) {
            throw new IllegalStateException("native call is already suspended");
        }
        deferred = new Deferred(interpreter.engine);
        return deferred;
    }

    @Override
    public String toStringValue(Object value) {
        return interpreter.stringOf(value);
    }

}
