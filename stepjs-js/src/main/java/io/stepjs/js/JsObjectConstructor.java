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
import java.util.List;

/**
 * The global {@code Object} function and its static helpers.
 */
class JsObjectConstructor extends JsNativeFunction {

    private final Realm realm;

    JsObjectConstructor(Realm realm) {
        super(realm.functionPrototype, "Object", 1, null, false);
        this.realm = realm;
    }

    void init() {
        realm.linkConstructor(this, realm.objectPrototype);
        for (String name : new String[]{"keys", "values", "entries", "assign", "create", "getPrototypeOf",
                "setPrototypeOf", "defineProperty", "freeze", "isFrozen"}) {
            realm.install(this, name, getBuiltinProperty(name));
        }
    }

    private JsCallable getBuiltinProperty(String name) {
        return switch (name) {
            case "keys" -> this::keys;
            case "values" -> this::values;
            case "entries" -> this::entries;
            case "assign" -> this::assign;
            case "create" -> this::create;
            case "getPrototypeOf" -> this::getPrototypeOf;
            case "setPrototypeOf" -> this::setPrototypeOf;
            case "defineProperty" -> this::defineProperty;
            case "freeze" -> this::freeze;
            case "isFrozen" -> (context, args) -> {
                Object o = Prototype.arg(args, 0);
                return !(o instanceof JsObject) || ((JsObject) o).isFrozen();
            };
            default -> null;
        };
    }

    @Override
    public Object call(Context context, Object... args) {
        Object value = Prototype.arg(args, 0);
        if (Terms.isNullish(value)) {
            return realm.newObject();
        }
        return value; // primitives are not boxed
    }

    private JsObject objectArg(Object[] args) {
        Object value = Prototype.arg(args, 0);
        if (Terms.isNullish(value)) {
            throw JsException.typeError("Cannot convert undefined or null to object");
        }
        if (value instanceof String) {
            List<Object> chars = new ArrayList<>();
            for (char c : ((String) value).toCharArray()) {
                chars.add(String.valueOf(c));
            }
            return realm.newArray(chars);
        }
        if (value instanceof JsObject) {
            return (JsObject) value;
        }
        return realm.newObject(); // numbers and booleans have no own keys
    }

    private Object keys(Context context, Object[] args) {
        return realm.newArray(new ArrayList<>(objectArg(args).keys()));
    }

    private Object values(Context context, Object[] args) {
        JsObject object = objectArg(args);
        List<Object> result = new ArrayList<>();
        for (String key : object.keys()) {
            result.add(object.get(key));
        }
        return realm.newArray(result);
    }

    private Object entries(Context context, Object[] args) {
        JsObject object = objectArg(args);
        List<Object> result = new ArrayList<>();
        for (String key : object.keys()) {
            List<Object> entry = new ArrayList<>(2);
            entry.add(key);
            entry.add(object.get(key));
            result.add(realm.newArray(entry));
        }
        return realm.newArray(result);
    }

    private Object assign(Context context, Object[] args) {
        JsObject target = objectArg(args);
        for (int i = 1; i < args.length; i++) {
            if (args[i] instanceof JsObject) {
                JsObject source = (JsObject) args[i];
                for (String key : source.keys()) {
                    target.put(key, source.get(key));
                }
            }
        }
        return target;
    }

    private Object create(Context context, Object[] args) {
        Object proto = Prototype.arg(args, 0);
        if (proto != null && !(proto instanceof JsObject)) {
            throw JsException.typeError("Object prototype may only be an Object or null: " + Terms.toStringValue(proto));
        }
        return new JsObject((JsObject) proto);
    }

    private Object getPrototypeOf(Context context, Object[] args) {
        Object value = Prototype.arg(args, 0);
        if (Terms.isNullish(value)) {
            throw JsException.typeError("Cannot convert undefined or null to object");
        }
        return realm.prototypeOf(value);
    }

    private Object setPrototypeOf(Context context, Object[] args) {
        Object value = Prototype.arg(args, 0);
        Object proto = Prototype.arg(args, 1);
        if (proto != null && !(proto instanceof JsObject)) {
            throw JsException.typeError("Object prototype may only be an Object or null: " + Terms.toStringValue(proto));
        }
        if (value instanceof JsObject) {
            ((JsObject) value).setPrototype((JsObject) proto);
        }
        return value;
    }

    private Object defineProperty(Context context, Object[] args) {
        Object value = Prototype.arg(args, 0);
        if (!(value instanceof JsObject)) {
            throw JsException.typeError("Object.defineProperty called on non-object");
        }
        Object descriptor = Prototype.arg(args, 2);
        if (!(descriptor instanceof JsObject)) {
            throw JsException.typeError("Property description must be an object");
        }
        JsObject desc = (JsObject) descriptor;
        if (desc.hasProperty("get") || desc.hasProperty("set")) {
            throw JsException.typeError("accessor properties are not supported");
        }
        JsObject target = (JsObject) value;
        String key = context.toStringValue(Prototype.arg(args, 1));
        PropertyDescriptor existing = target.getOwnProperty(key);
        Object newValue = desc.hasProperty("value") ? desc.get("value") : existing == null ? Terms.UNDEFINED : existing.value;
        target.defineOwnProperty(key, newValue,
                attribute(desc, "writable", existing != null && existing.writable),
                attribute(desc, "enumerable", existing != null && existing.enumerable),
                attribute(desc, "configurable", existing != null && existing.configurable));
        return target;
    }

    private static boolean attribute(JsObject desc, String name, boolean defaultValue) {
        return desc.hasProperty(name) ? Terms.isTruthy(desc.get(name)) : defaultValue;
    }

    private Object freeze(Context context, Object[] args) {
        Object value = Prototype.arg(args, 0);
        if (value instanceof JsObject) {
            ((JsObject) value).freeze();
        }
        return value;
    }

}
