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
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * {@code Array.prototype}. Callback-taking methods call back into guest code
 * through {@link Context#invoke}.
 */
class JsArrayPrototype extends Prototype {

    // arrays being joined, a cyclic reference prints as the empty string
    private final Set<JsArray> joining = Collections.newSetFromMap(new IdentityHashMap<>());

    JsArrayPrototype(Realm realm, JsObject objectPrototype) {
        super(realm, objectPrototype);
    }

    void init() {
        install("push", "pop", "shift", "unshift", "slice", "splice", "concat", "join", "reverse",
                "indexOf", "lastIndexOf", "includes", "forEach", "map", "filter", "reduce", "some", "every",
                "find", "findIndex", "sort", "toString");
    }

    @Override
    protected JsCallable getBuiltinProperty(String name) {
        return switch (name) {
            case "push" -> this::push;
            case "pop" -> this::pop;
            case "shift" -> this::shift;
            case "unshift" -> this::unshift;
            case "slice" -> this::slice;
            case "splice" -> this::splice;
            case "concat" -> this::concat;
            case "join" -> this::join;
            case "reverse" -> this::reverse;
            case "indexOf" -> this::indexOf;
            case "lastIndexOf" -> this::lastIndexOf;
            case "includes" -> this::includes;
            case "forEach" -> this::forEach;
            case "map" -> this::map;
            case "filter" -> this::filter;
            case "reduce" -> this::reduce;
            case "some" -> this::some;
            case "every" -> this::every;
            case "find" -> this::find;
            case "findIndex" -> this::findIndex;
            case "sort" -> this::sort;
            case "toString" -> (context, args) -> join(context, new Object[0]);
            default -> null;
        };
    }

    private static JsArray thisArray(Context context) {
        Object thisObject = context.getThisObject();
        if (thisObject instanceof JsArray) {
            return (JsArray) thisObject;
        }
        throw JsException.typeError("Array.prototype method called on a non-array");
    }

    private static JsArray writableArray(Context context) {
        JsArray array = thisArray(context);
        if (array.isFrozen()) {
            throw JsException.typeError("Cannot modify a frozen array");
        }
        return array;
    }

    private Object push(Context context, Object[] args) {
        JsArray array = writableArray(context);
        for (Object arg : args) {
            array.add(arg);
        }
        return array.size();
    }

    private Object pop(Context context, Object[] args) {
        JsArray array = writableArray(context);
        if (array.size() == 0) {
            return Terms.UNDEFINED;
        }
        Object last = array.get(array.size() - 1);
        array.list.remove(array.size() - 1);
        return last;
    }

    private Object shift(Context context, Object[] args) {
        JsArray array = writableArray(context);
        if (array.size() == 0) {
            return Terms.UNDEFINED;
        }
        Object first = array.get(0);
        array.list.remove(0);
        return first;
    }

    private Object unshift(Context context, Object[] args) {
        JsArray array = writableArray(context);
        for (int i = args.length - 1; i >= 0; i--) {
            array.list.add(0, args[i]);
        }
        return array.size();
    }

    private Object slice(Context context, Object[] args) {
        JsArray array = thisArray(context);
        int size = array.size();
        int start = relative(args, 0, size, 0);
        int end = relative(args, 1, size, size);
        List<Object> result = new ArrayList<>();
        for (int i = start; i < end; i++) {
            result.add(array.list.get(i));
        }
        return realm.newArray(result);
    }

    private Object splice(Context context, Object[] args) {
        JsArray array = writableArray(context);
        int size = array.size();
        int start = relative(args, 0, size, 0);
        int deleteCount = args.length < 2 ? size - start : Math.max(0, Math.min(intArg(args, 1, 0), size - start));
        List<Object> removed = new ArrayList<>();
        for (int i = 0; i < deleteCount; i++) {
            removed.add(array.list.remove(start));
        }
        List<Object> items = rest(args, 2);
        array.list.addAll(start, items);
        return realm.newArray(removed);
    }

    private Object concat(Context context, Object[] args) {
        JsArray array = thisArray(context);
        List<Object> result = new ArrayList<>(array.list);
        for (Object arg : args) {
            if (arg instanceof JsArray) {
                result.addAll(((JsArray) arg).list);
            } else {
                result.add(arg);
            }
        }
        return realm.newArray(result);
    }

    private Object join(Context context, Object[] args) {
        JsArray array = thisArray(context);
        Object separator = arg(args, 0);
        String sep = separator == Terms.UNDEFINED ? "," : context.toStringValue(separator);
        if (!joining.add(array)) {
            return "";
        }
        try {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < array.size(); i++) {
                if (i > 0) {
                    sb.append(sep);
                }
                Object value = array.get(i);
                if (!Terms.isNullish(value)) {
                    sb.append(context.toStringValue(value));
                }
            }
            return sb.toString();
        } finally {
            joining.remove(array);
        }
    }

    private Object reverse(Context context, Object[] args) {
        JsArray array = writableArray(context);
        Collections.reverse(array.list);
        return array;
    }

    private Object indexOf(Context context, Object[] args) {
        JsArray array = thisArray(context);
        Object target = arg(args, 0);
        for (int i = relative(args, 1, array.size(), 0); i < array.size(); i++) {
            if (!array.isHole(i) && Terms.eq(array.get(i), target, true)) {
                return i;
            }
        }
        return -1;
    }

    private Object lastIndexOf(Context context, Object[] args) {
        JsArray array = thisArray(context);
        Object target = arg(args, 0);
        for (int i = array.size() - 1; i >= 0; i--) {
            if (!array.isHole(i) && Terms.eq(array.get(i), target, true)) {
                return i;
            }
        }
        return -1;
    }

    private Object includes(Context context, Object[] args) {
        JsArray array = thisArray(context);
        Object target = arg(args, 0);
        boolean nan = target instanceof Double && ((Double) target).isNaN();
        for (int i = 0; i < array.size(); i++) {
            Object value = array.get(i);
            if (Terms.eq(value, target, true) || nan && value instanceof Double && ((Double) value).isNaN()) {
                return true;
            }
        }
        return false;
    }

    private Object forEach(Context context, Object[] args) {
        JsArray array = thisArray(context);
        JsFunction fn = callbackArg(args, 0);
        for (int i = 0; i < array.size(); i++) {
            if (!array.isHole(i)) {
                context.invoke(fn, arg(args, 1), array.get(i), i, array);
            }
        }
        return Terms.UNDEFINED;
    }

    private Object map(Context context, Object[] args) {
        JsArray array = thisArray(context);
        JsFunction fn = callbackArg(args, 0);
        List<Object> result = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            if (array.isHole(i)) {
                result.add(JsArray.HOLE);
            } else {
                result.add(context.invoke(fn, arg(args, 1), array.get(i), i, array));
            }
        }
        return realm.newArray(result);
    }

    private Object filter(Context context, Object[] args) {
        JsArray array = thisArray(context);
        JsFunction fn = callbackArg(args, 0);
        List<Object> result = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            if (array.isHole(i)) {
                continue;
            }
            Object value = array.get(i);
            if (Terms.isTruthy(context.invoke(fn, arg(args, 1), value, i, array))) {
                result.add(value);
            }
        }
        return realm.newArray(result);
    }

    private Object reduce(Context context, Object[] args) {
        JsArray array = thisArray(context);
        JsFunction fn = callbackArg(args, 0);
        int i = 0;
        Object accumulator;
        if (args.length > 1) {
            accumulator = args[1];
        } else {
            while (i < array.size() && array.isHole(i)) {
                i++;
            }
            if (i >= array.size()) {
                throw JsException.typeError("Reduce of empty array with no initial value");
            }
            accumulator = array.get(i++);
        }
        for (; i < array.size(); i++) {
            if (!array.isHole(i)) {
                accumulator = context.invoke(fn, Terms.UNDEFINED, accumulator, array.get(i), i, array);
            }
        }
        return accumulator;
    }

    private Object some(Context context, Object[] args) {
        JsArray array = thisArray(context);
        JsFunction fn = callbackArg(args, 0);
        for (int i = 0; i < array.size(); i++) {
            if (!array.isHole(i) && Terms.isTruthy(context.invoke(fn, arg(args, 1), array.get(i), i, array))) {
                return true;
            }
        }
        return false;
    }

    private Object every(Context context, Object[] args) {
        JsArray array = thisArray(context);
        JsFunction fn = callbackArg(args, 0);
        for (int i = 0; i < array.size(); i++) {
            if (!array.isHole(i) && !Terms.isTruthy(context.invoke(fn, arg(args, 1), array.get(i), i, array))) {
                return false;
            }
        }
        return true;
    }

    private Object find(Context context, Object[] args) {
        JsArray array = thisArray(context);
        JsFunction fn = callbackArg(args, 0);
        for (int i = 0; i < array.size(); i++) {
            Object value = array.get(i);
            if (Terms.isTruthy(context.invoke(fn, arg(args, 1), value, i, array))) {
                return value;
            }
        }
        return Terms.UNDEFINED;
    }

    private Object findIndex(Context context, Object[] args) {
        JsArray array = thisArray(context);
        JsFunction fn = callbackArg(args, 0);
        for (int i = 0; i < array.size(); i++) {
            if (Terms.isTruthy(context.invoke(fn, arg(args, 1), array.get(i), i, array))) {
                return i;
            }
        }
        return -1;
    }

    private Object sort(Context context, Object[] args) {
        JsArray array = writableArray(context);
        Object compareFn = arg(args, 0);
        List<Object> values = new ArrayList<>();
        int undefinedCount = 0;
        for (int i = 0; i < array.size(); i++) {
            if (array.isHole(i)) {
                continue;
            }
            Object value = array.get(i);
            if (value == Terms.UNDEFINED) {
                undefinedCount++;
            } else {
                values.add(value);
            }
        }
        Comparator<Object> comparator;
        if (compareFn instanceof JsFunction) {
            JsFunction fn = (JsFunction) compareFn;
            comparator = (a, b) -> {
                double d = Terms.objectToNumber(context.invoke(fn, Terms.UNDEFINED, a, b)).doubleValue();
                return d < 0 ? -1 : d > 0 ? 1 : 0;
            };
        } else if (compareFn == Terms.UNDEFINED) {
            comparator = Comparator.comparing(context::toStringValue);
        } else {
            throw JsException.typeError("The comparison function must be either a function or undefined");
        }
        values.sort(comparator);
        int holes = array.size() - values.size() - undefinedCount;
        array.list.clear();
        array.list.addAll(values);
        for (int i = 0; i < undefinedCount; i++) {
            array.list.add(Terms.UNDEFINED);
        }
        for (int i = 0; i < holes; i++) {
            array.list.add(JsArray.HOLE);
        }
        return array;
    }

}
