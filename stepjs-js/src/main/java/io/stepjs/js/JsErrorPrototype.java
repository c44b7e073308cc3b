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
 * {@code Error.prototype}, also the prototype of the typed error prototypes
 * which only override {@code name}.
 */
class JsErrorPrototype extends Prototype {

    JsErrorPrototype(Realm realm, JsObject objectPrototype) {
        super(realm, objectPrototype);
    }

    void init() {
        defineOwnProperty("name", "Error", true, false, true);
        defineOwnProperty("message", "", true, false, true);
        install("toString");
    }

    @Override
    protected JsCallable getBuiltinProperty(String name) {
        if ("toString".equals(name)) {
            return this::toStringMethod;
        }
        return null;
    }

    private Object toStringMethod(Context context, Object[] args) {
        Object thisObject = context.getThisObject();
        if (!(thisObject instanceof JsObject)) {
            throw JsException.typeError("Error.prototype.toString called on a non-object");
        }
        JsObject error = (JsObject) thisObject;
        Object name = error.get("name");
        Object message = error.get("message");
        String nameText = name == Terms.UNDEFINED ? "Error" : context.toStringValue(name);
        String messageText = message == Terms.UNDEFINED ? "" : context.toStringValue(message);
        if (nameText.isEmpty()) {
            return messageText;
        }
        return messageText.isEmpty() ? nameText : nameText + ": " + messageText;
    }

}
