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
 * {@code Error} and its typed variants. Called with or without {@code new}
 * it returns a fresh error object.
 */
class JsErrorConstructor extends JsNativeFunction {

    private final Realm realm;
    private final JsObject errorPrototype;

    JsErrorConstructor(Realm realm, String name, JsObject errorPrototype) {
        super(realm.functionPrototype, name, 1, null, false);
        this.realm = realm;
        this.errorPrototype = errorPrototype;
        realm.linkConstructor(this, errorPrototype);
    }

    @Override
    public Object call(Context context, Object... args) {
        Object message = Prototype.arg(args, 0);
        return new JsError(errorPrototype, message == Terms.UNDEFINED ? null : context.toStringValue(message));
    }

}
