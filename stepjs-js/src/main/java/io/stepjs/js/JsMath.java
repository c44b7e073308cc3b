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

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleUnaryOperator;

/**
 * The global {@code Math} object.
 */
class JsMath extends Prototype {

    JsMath(Realm realm) {
        super(realm, realm.objectPrototype);
    }

    void init() {
        defineOwnProperty("PI", Math.PI, false, false, false);
        defineOwnProperty("E", Math.E, false, false, false);
        install("abs", "floor", "ceil", "round", "max", "min", "pow", "sqrt", "random", "sign", "trunc");
    }

    @Override
    public String getClassName() {
        return "Math";
    }

    @Override
    protected JsCallable getBuiltinProperty(String name) {
        return switch (name) {
            case "abs" -> unary(Math::abs);
            case "floor" -> unary(Math::floor);
            case "ceil" -> unary(Math::ceil);
            case "round" -> unary(d -> Double.isNaN(d) || Double.isInfinite(d) ? d : Math.floor(d + 0.5));
            case "sqrt" -> unary(Math::sqrt);
            case "sign" -> unary(Math::signum);
            case "trunc" -> unary(d -> d < 0 ? Math.ceil(d) : Math.floor(d));
            case "pow" -> (context, args) -> Terms.narrow(Math.pow(number(args, 0), number(args, 1)));
            case "random" -> (context, args) -> ThreadLocalRandom.current().nextDouble();
            case "max" -> (context, args) -> extreme(args, true);
            case "min" -> (context, args) -> extreme(args, false);
            default -> null;
        };
    }

    private static double number(Object[] args, int index) {
        return Terms.objectToNumber(arg(args, index)).doubleValue();
    }

    private static JsCallable unary(DoubleUnaryOperator op) {
        return (context, args) -> Terms.narrow(op.applyAsDouble(number(args, 0)));
    }

    private static Object extreme(Object[] args, boolean max) {
        double result = max ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        for (int i = 0; i < args.length; i++) {
            double d = number(args, i);
            if (Double.isNaN(d)) {
                return Double.NaN;
            }
            result = max ? Math.max(result, d) : Math.min(result, d);
        }
        return Terms.narrow(result);
    }

}
