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
 * {@code Object.prototype}, the root of every ordinary prototype chain.
 */
class JsObjectPrototype extends Prototype {

    JsObjectPrototype(Realm realm) {
        super(realm, null);
    }

    void init() {
        install("hasOwnProperty", "toString", "valueOf", "isPrototypeOf", "propertyIsEnumerable", "toLocaleString");
    }

    @Override
    protected JsCallable getBuiltinProperty(String name) {
        return switch (name) {
            case "hasOwnProperty" -> this::hasOwn;
            case "toString", "toLocaleString" -> this::toStringMethod;
            case "valueOf" -> (context, args) -> context.getThisObject();
            case "isPrototypeOf" -> this::isPrototypeOf;
            case "propertyIsEnumerable" -> this::propertyIsEnumerable;
            default -> null;
        };
    }

    private Object hasOwn(Context context, Object[] args) {
        Object thisObject = context.getThisObject();
        String key = context.toStringValue(arg(args, 0));
        if (thisObject instanceof JsObject) {
            return ((JsObject) thisObject).hasOwnProperty(key);
        }
        if (thisObject instanceof String) {
            int index = JsArray.toIndex(key);
            return "length".equals(key) || index != -1 && index < ((String) thisObject).length();
        }
        return false;
    }

    private Object toStringMethod(Context context, Object[] args) {
        Object thisObject = context.getThisObject();
        if (thisObject == Terms.UNDEFINED) {
            return "[object Undefined]";
        }
        if (thisObject == null) {
            return "[object Null]";
        }
        if (thisObject instanceof JsObject) {
            return "[object " + ((JsObject) thisObject).getClassName() + "]";
        }
        if (thisObject instanceof String) {
            return "[object String]";
        }
        if (thisObject instanceof Number) {
            return "[object Number]";
        }
        if (thisObject instanceof Boolean) {
            return "[object Boolean]";
        }
        return "[object Object]";
    }

    private Object isPrototypeOf(Context context, Object[] args) {
        Object thisObject = context.getThisObject();
        Object value = arg(args, 0);
        if (!(value instanceof JsObject) || !(thisObject instanceof JsObject)) {
            return false;
        }
        JsObject temp = ((JsObject) value).getPrototype();
        while (temp != null) {
            if (temp == thisObject) {
                return true;
            }
            temp = temp.getPrototype();
        }
        return false;
    }

    private Object propertyIsEnumerable(Context context, Object[] args) {
        Object thisObject = context.getThisObject();
        if (!(thisObject instanceof JsObject)) {
            return false;
        }
        PropertyDescriptor pd = ((JsObject) thisObject).getOwnProperty(context.toStringValue(arg(args, 0)));
        return pd != null && pd.enumerable;
    }

}
