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
 * {@code Function.prototype}. The {@code call}, {@code apply} and
 * {@code bind} entries are recognised by the evaluator, which performs the
 * call in place so that guest code reached through them stays step-able.
 * Their bodies here only run when a native invokes them directly.
 */
class JsFunctionPrototype extends Prototype {

    JsFunctionPrototype(Realm realm, JsObject objectPrototype) {
        super(realm, objectPrototype);
    }

    void init() {
        install("call", "apply", "bind", "toString");
    }

    @Override
    protected JsCallable getBuiltinProperty(String name) {
        return switch (name) {
            case "call" -> this::call;
            case "apply" -> this::apply;
            case "bind" -> this::bind;
            case "toString" -> this::toStringMethod;
            default -> null;
        };
    }

    private JsFunction thisFunction(Context context) {
        Object thisObject = context.getThisObject();
        if (thisObject instanceof JsFunction) {
            return (JsFunction) thisObject;
        }
        throw JsException.typeError("Function.prototype method called on incompatible receiver");
    }

    private Object call(Context context, Object[] args) {
        return context.invoke(thisFunction(context), arg(args, 0), rest(args, 1).toArray());
    }

    private Object apply(Context context, Object[] args) {
        return context.invoke(thisFunction(context), arg(args, 0), realm.toArgumentList(arg(args, 1)).toArray());
    }

    private Object bind(Context context, Object[] args) {
        return new JsBoundFunction(realm.functionPrototype, thisFunction(context), arg(args, 0), rest(args, 1));
    }

    private Object toStringMethod(Context context, Object[] args) {
        return thisFunction(context).toStringValue();
    }

}
