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

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * {@code Number.prototype}, consulted for property access on primitive numbers.
 */
class JsNumberPrototype extends Prototype {

    JsNumberPrototype(Realm realm, JsObject objectPrototype) {
        super(realm, objectPrototype);
    }

    void init() {
        install("toFixed", "toString", "valueOf");
    }

    @Override
    protected JsCallable getBuiltinProperty(String name) {
        return switch (name) {
            case "toFixed" -> this::toFixed;
            case "toString" -> this::toStringMethod;
            case "valueOf" -> (context, args) -> thisNumber(context);
            default -> null;
        };
    }

    private static Number thisNumber(Context context) {
        Object thisObject = context.getThisObject();
        if (thisObject instanceof Number) {
            return (Number) thisObject;
        }
        throw JsException.typeError("Number.prototype method called on a non-number");
    }

    private Object toFixed(Context context, Object[] args) {
        double d = thisNumber(context).doubleValue();
        int digits = intArg(args, 0, 0);
        if (digits < 0 || digits > 100) {
            throw JsException.rangeError("toFixed() digits argument must be between 0 and 100");
        }
        if (Double.isNaN(d) || Double.isInfinite(d) || Math.abs(d) >= 1e21) {
            return Terms.numberToString(d);
        }
        return new BigDecimal(Double.toString(d)).setScale(digits, RoundingMode.HALF_UP).toPlainString();
    }

    private Object toStringMethod(Context context, Object[] args) {
        Number n = thisNumber(context);
        Object radixArg = arg(args, 0);
        int radix = radixArg == Terms.UNDEFINED ? 10 : intArg(args, 0, 10);
        if (radix < 2 || radix > 36) {
            throw JsException.rangeError("toString() radix must be between 2 and 36");
        }
        double d = n.doubleValue();
        if (radix == 10 || d % 1 != 0 || Double.isInfinite(d) || Double.isNaN(d)) {
            return Terms.numberToString(n);
        }
        return Long.toString((long) d, radix);
    }

}
