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

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The primordials of one engine: built-in prototypes, constructors and the
 * global object, plus the conversions between host and guest values.
 */
public class Realm {

    static final String[] ERROR_TYPES = {"TypeError", "ReferenceError", "RangeError", "SyntaxError"};

    final JsObjectPrototype objectPrototype;
    final JsFunctionPrototype functionPrototype;
    final JsArrayPrototype arrayPrototype;
    final JsStringPrototype stringPrototype;
    final JsNumberPrototype numberPrototype;
    final JsBooleanPrototype booleanPrototype;
    final JsErrorPrototype errorPrototype;
    final Map<String, JsObject> errorPrototypes = new HashMap<>();
    final JsObject globalObject;

    // dispatched in place by the evaluator
    final JsFunction functionCall;
    final JsFunction functionApply;

    Realm() {
        objectPrototype = new JsObjectPrototype(this);
        functionPrototype = new JsFunctionPrototype(this, objectPrototype);
        arrayPrototype = new JsArrayPrototype(this, objectPrototype);
        stringPrototype = new JsStringPrototype(this, objectPrototype);
        numberPrototype = new JsNumberPrototype(this, objectPrototype);
        booleanPrototype = new JsBooleanPrototype(this, objectPrototype);
        errorPrototype = new JsErrorPrototype(this, objectPrototype);
        objectPrototype.init();
        functionPrototype.init();
        arrayPrototype.init();
        stringPrototype.init();
        numberPrototype.init();
        booleanPrototype.init();
        errorPrototype.init();
        functionCall = (JsFunction) functionPrototype.get("call");
        functionApply = (JsFunction) functionPrototype.get("apply");
        globalObject = new JsObject(objectPrototype) {
            @Override
            public String getClassName() {
                return "global";
            }
        };
        initGlobals();
    }

    private void initGlobals() {
        globalObject.defineOwnProperty("undefined", Terms.UNDEFINED, false, false, false);
        globalObject.defineOwnProperty("NaN", Double.NaN, false, false, false);
        globalObject.defineOwnProperty("Infinity", Double.POSITIVE_INFINITY, false, false, false);
        globalObject.defineOwnProperty("globalThis", globalObject, true, false, true);
        JsObjectConstructor objectConstructor = new JsObjectConstructor(this);
        objectConstructor.init();
        defineGlobal("Object", objectConstructor);
        JsNativeFunction functionConstructor = new JsNativeFunction(functionPrototype, "Function", 1, (context, args) -> {
            throw JsException.error("Function constructor is not supported");
        }, false);
        linkConstructor(functionConstructor, functionPrototype);
        defineGlobal("Function", functionConstructor);
        JsArrayConstructor arrayConstructor = new JsArrayConstructor(this);
        arrayConstructor.init();
        defineGlobal("Array", arrayConstructor);
        JsStringConstructor stringConstructor = new JsStringConstructor(this);
        stringConstructor.init();
        defineGlobal("String", stringConstructor);
        JsNumberConstructor numberConstructor = new JsNumberConstructor(this);
        numberConstructor.init();
        defineGlobal("Number", numberConstructor);
        JsBooleanConstructor booleanConstructor = new JsBooleanConstructor(this);
        booleanConstructor.init();
        defineGlobal("Boolean", booleanConstructor);
        defineGlobal("Error", new JsErrorConstructor(this, "Error", errorPrototype));
        errorPrototypes.put("Error", errorPrototype);
        for (String type : ERROR_TYPES) {
            JsObject proto = new JsObject(errorPrototype);
            proto.defineOwnProperty("name", type, true, false, true);
            proto.defineOwnProperty("message", "", true, false, true);
            errorPrototypes.put(type, proto);
            defineGlobal(type, new JsErrorConstructor(this, type, proto));
        }
        JsMath math = new JsMath(this);
        math.init();
        defineGlobal("Math", math);
        JsJson json = new JsJson(this);
        json.init();
        defineGlobal("JSON", json);
        install(globalObject, "parseInt", this::parseInt);
        install(globalObject, "parseFloat", this::parseFloat);
        install(globalObject, "isNaN", (context, args) -> Double.isNaN(toNumber(context, Prototype.arg(args, 0))));
        install(globalObject, "isFinite", (context, args) -> {
            double d = toNumber(context, Prototype.arg(args, 0));
            return !Double.isNaN(d) && !Double.isInfinite(d);
        });
    }

    private void defineGlobal(String name, JsObject value) {
        globalObject.defineOwnProperty(name, value, true, false, true);
    }

    private static double toNumber(Context context, Object value) {
        if (value instanceof JsObject) {
            value = context.toStringValue(value);
        }
        return Terms.objectToNumber(value).doubleValue();
    }

    Object parseInt(Context context, Object[] args) {
        String text = context.toStringValue(Prototype.arg(args, 0));
        int radix = Prototype.intArg(args, 1, 0);
        return Terms.parseInt(text, radix);
    }

    Object parseFloat(Context context, Object[] args) {
        return Terms.parseFloat(context.toStringValue(Prototype.arg(args, 0)));
    }

    public JsObject getGlobalObject() {
        return globalObject;
    }

    void install(JsObject target, String name, JsCallable callable) {
        target.defineOwnProperty(name, newNative(name, callable, false), true, false, true);
    }

    void linkConstructor(JsFunction constructor, JsObject prototype) {
        constructor.defineOwnProperty("prototype", prototype, false, false, false);
        prototype.defineOwnProperty("constructor", constructor, true, false, true);
    }

    JsNativeFunction newNative(String name, JsCallable callable, boolean external) {
        return new JsNativeFunction(functionPrototype, name, 0, callable, external);
    }

    public JsObject newObject() {
        return new JsObject(objectPrototype);
    }

    public JsArray newArray(List<Object> list) {
        return new JsArray(arrayPrototype, list);
    }

    public JsError newError(String type, String message) {
        JsObject proto = errorPrototypes.get(type);
        return new JsError(proto == null ? errorPrototype : proto, message);
    }

    /**
     * The object consulted for property lookups on a value, primitives
     * included.
     */
    JsObject prototypeOf(Object value) {
        if (value instanceof JsObject) {
            return ((JsObject) value).getPrototype();
        }
        if (value instanceof String) {
            return stringPrototype;
        }
        if (value instanceof Number) {
            return numberPrototype;
        }
        if (value instanceof Boolean) {
            return booleanPrototype;
        }
        return null;
    }

    /**
     * Argument list of {@code apply}: an array, or nothing for null / undefined.
     */
    List<Object> toArgumentList(Object value) {
        if (Terms.isNullish(value)) {
            return new ArrayList<>();
        }
        if (value instanceof JsArray) {
            return ((JsArray) value).toList();
        }
        throw JsException.typeError("CreateListFromArrayLike called on non-object");
    }

    /**
     * Converts a value returned by a host native: maps, lists and arrays
     * become guest objects recursively, numbers are narrowed and everything
     * else is kept as an opaque host value.
     */
    @SuppressWarnings("unchecked")
    public Object toGuest(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean || value instanceof JsObject
                || value == Terms.UNDEFINED) {
            return value;
        }
        if (value instanceof Integer || value instanceof Long) {
            return value;
        }
        if (value instanceof Number) {
            return Terms.narrow(((Number) value).doubleValue());
        }
        if (value instanceof Character) {
            return value.toString();
        }
        if (value instanceof Map) {
            JsObject object = newObject();
            for (Map.Entry<Object, Object> entry : ((Map<Object, Object>) value).entrySet()) {
                object.put(String.valueOf(entry.getKey()), toGuest(entry.getValue()));
            }
            return object;
        }
        if (value instanceof List) {
            List<Object> list = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                list.add(toGuest(item));
            }
            return newArray(list);
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(toGuest(Array.get(value, i)));
            }
            return newArray(list);
        }
        if (value instanceof JsCallable) {
            return newNative("", (JsCallable) value, true);
        }
        return value;
    }

    /**
     * Converts a guest value for the host: undefined becomes null, arrays
     * become lists and plain objects become maps (own enumerable keys),
     * recursively. Functions are returned as is.
     */
    public Object toHost(Object value) {
        return toHost(value, new HashMap<>());
    }

    private Object toHost(Object value, Map<Object, Object> converted) {
        if (value == Terms.UNDEFINED) {
            return null;
        }
        if (value instanceof JsFunction || !(value instanceof JsObject)) {
            return value;
        }
        Object existing = converted.get(value);
        if (existing != null) {
            return existing;
        }
        if (value instanceof JsArray) {
            JsArray array = (JsArray) value;
            List<Object> list = new ArrayList<>(array.size());
            converted.put(value, list);
            for (int i = 0; i < array.size(); i++) {
                list.add(toHost(array.get(i), converted));
            }
            return list;
        }
        JsObject object = (JsObject) value;
        Map<String, Object> map = new LinkedHashMap<>();
        converted.put(value, map);
        for (String key : object.keys()) {
            map.put(key, toHost(object.get(key), converted));
        }
        return map;
    }

}
