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
 * The global {@code Number} function and its constants.
 */
class JsNumberConstructor extends JsNativeFunction {

    private final Realm realm;

    JsNumberConstructor(Realm realm) {
        super(realm.functionPrototype, "Number", 1, null, false);
        this.realm = realm;
    }

    void init() {
        realm.linkConstructor(this, realm.numberPrototype);
        defineOwnProperty("MAX_SAFE_INTEGER", 9007199254740991L, false, false, false);
        defineOwnProperty("MIN_SAFE_INTEGER", -9007199254740991L, false, false, false);
        defineOwnProperty("MAX_VALUE", Double.MAX_VALUE, false, false, false);
        defineOwnProperty("MIN_VALUE", Double.MIN_VALUE, false, false, false);
        defineOwnProperty("EPSILON", Math.ulp(1.0), false, false, false);
        defineOwnProperty("POSITIVE_INFINITY", Double.POSITIVE_INFINITY, false, false, false);
        defineOwnProperty("NEGATIVE_INFINITY", Double.NEGATIVE_INFINITY, false, false, false);
        defineOwnProperty("NaN", Double.NaN, false, false, false);
        realm.install(this, "isInteger", (context, args) -> {
            Object value = Prototype.arg(args, 0);
            if (!(value instanceof Number)) {
                return false;
            }
            double d = ((Number) value).doubleValue();
            return !Double.isInfinite(d) && d % 1 == 0;
        });
        realm.install(this, "isNaN", (context, args) -> {
            Object value = Prototype.arg(args, 0);
            return value instanceof Number && Double.isNaN(((Number) value).doubleValue());
        });
        realm.install(this, "isFinite", (context, args) -> {
            Object value = Prototype.arg(args, 0);
            if (!(value instanceof Number)) {
                return false;
            }
            double d = ((Number) value).doubleValue();
            return !Double.isNaN(d) && !Double.isInfinite(d);
        });
        realm.install(this, "parseFloat", realm::parseFloat);
        realm.install(this, "parseInt", realm::parseInt);
    }

    @Override
    public Object call(Context context, Object... args) {
        if (args.length == 0) {
            return 0;
        }
        Object value = args[0];
        if (value instanceof JsObject) {
            value = context.toStringValue(value);
        }
        return Terms.objectToNumber(value);
    }

}
