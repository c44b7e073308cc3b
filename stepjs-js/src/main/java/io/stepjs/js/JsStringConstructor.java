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
 * The global {@code String} function, a conversion only, no wrapper objects.
 */
class JsStringConstructor extends JsNativeFunction {

    private final Realm realm;

    JsStringConstructor(Realm realm) {
        super(realm.functionPrototype, "String", 1, null, false);
        this.realm = realm;
    }

    void init() {
        realm.linkConstructor(this, realm.stringPrototype);
        realm.install(this, "fromCharCode", (context, args) -> {
            StringBuilder sb = new StringBuilder();
            for (Object arg : args) {
                sb.append((char) Terms.toInt32(Terms.objectToNumber(arg)));
            }
            return sb.toString();
        });
    }

    @Override
    public Object call(Context context, Object... args) {
        return args.length == 0 ? "" : context.toStringValue(args[0]);
    }

}
