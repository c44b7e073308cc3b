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
import java.util.Arrays;
import java.util.List;

/**
 * Base class of the built-in prototype objects. Built-in methods are looked
 * up by name through {@link #getBuiltinProperty(String)} and installed as
 * non-enumerable own properties, so guest code can still override them.
 */
abstract class Prototype extends JsObject {

    final Realm realm;

    Prototype(Realm realm, JsObject prototype) {
        super(prototype);
        this.realm = realm;
    }

    protected abstract JsCallable getBuiltinProperty(String name);

    void install(String... names) {
        for (String name : names) {
            realm.install(this, name, getBuiltinProperty(name));
        }
    }

    static Object arg(Object[] args, int index) {
        return index < args.length ? args[index] : Terms.UNDEFINED;
    }

    static int intArg(Object[] args, int index, int defaultValue) {
        Object value = arg(args, index);
        if (value == Terms.UNDEFINED) {
            return defaultValue;
        }
        double d = Terms.objectToNumber(value).doubleValue();
        if (Double.isNaN(d)) {
            return 0;
        }
        if (d > Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        if (d < Integer.MIN_VALUE) {
            return Integer.MIN_VALUE;
        }
        return (int) d;
    }

    /**
     * Resolves a relative start / end argument against a length, negative
     * values count from the end.
     */
    static int relative(Object[] args, int index, int length, int defaultValue) {
        int value = intArg(args, index, defaultValue);
        if (value < 0) {
            return Math.max(0, length + value);
        }
        return Math.min(value, length);
    }

    static List<Object> rest(Object[] args, int from) {
        if (from >= args.length) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(args).subList(from, args.length));
    }

    static JsFunction callbackArg(Object[] args, int index) {
        Object value = arg(args, index);
        if (value instanceof JsFunction) {
            return (JsFunction) value;
        }
        throw JsException.typeError(Terms.toStringValue(value) + " is not a function");
    }

}
