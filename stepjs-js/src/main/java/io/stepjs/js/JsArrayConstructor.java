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
 * The global {@code Array} function.
 */
class JsArrayConstructor extends JsNativeFunction {

    private final Realm realm;

    JsArrayConstructor(Realm realm) {
        super(realm.functionPrototype, "Array", 1, null, false);
        this.realm = realm;
    }

    void init() {
        realm.linkConstructor(this, realm.arrayPrototype);
        realm.install(this, "isArray", (context, args) -> Prototype.arg(args, 0) instanceof JsArray);
        realm.install(this, "of", (context, args) -> realm.newArray(new ArrayList<>(Arrays.asList(args))));
    }

    /**
     * A single numeric argument is the length, anything else the elements.
     */
    @Override
    public Object call(Context context, Object... args) {
        if (args.length == 1 && args[0] instanceof Number) {
            JsArray array = realm.newArray(new ArrayList<>());
            array.setLength(args[0]);
            return array;
        }
        List<Object> list = new ArrayList<>(Arrays.asList(args));
        return realm.newArray(list);
    }

}
