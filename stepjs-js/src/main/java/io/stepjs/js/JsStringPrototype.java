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
 * {@code String.prototype}, consulted for property access on primitive
 * strings.
 */
class JsStringPrototype extends Prototype {

    private static final int MAX_BUILT_LENGTH = 1 << 26;

    JsStringPrototype(Realm realm, JsObject objectPrototype) {
        super(realm, objectPrototype);
    }

    void init() {
        install("charAt", "charCodeAt", "indexOf", "lastIndexOf", "includes", "startsWith", "endsWith",
                "slice", "substring", "toUpperCase", "toLowerCase", "trim", "split", "replace", "repeat",
                "padStart", "padEnd", "concat", "toString", "valueOf");
    }

    @Override
    protected JsCallable getBuiltinProperty(String name) {
        return switch (name) {
            case "charAt" -> this::charAt;
            case "charCodeAt" -> this::charCodeAt;
            case "indexOf" -> this::indexOf;
            case "lastIndexOf" -> this::lastIndexOf;
            case "includes" -> (context, args) -> thisString(context).contains(context.toStringValue(arg(args, 0)));
            case "startsWith" -> this::startsWith;
            case "endsWith" -> this::endsWith;
            case "slice" -> this::slice;
            case "substring" -> this::substring;
            case "toUpperCase" -> (context, args) -> thisString(context).toUpperCase();
            case "toLowerCase" -> (context, args) -> thisString(context).toLowerCase();
            case "trim" -> (context, args) -> thisString(context).trim();
            case "split" -> this::split;
            case "replace" -> this::replace;
            case "repeat" -> this::repeat;
            case "padStart" -> (context, args) -> pad(context, args, true);
            case "padEnd" -> (context, args) -> pad(context, args, false);
            case "concat" -> this::concat;
            case "toString", "valueOf" -> (context, args) -> thisString(context);
            default -> null;
        };
    }

    private static String thisString(Context context) {
        Object thisObject = context.getThisObject();
        if (Terms.isNullish(thisObject)) {
            throw JsException.typeError("String.prototype method called on null or undefined");
        }
        return context.toStringValue(thisObject);
    }

    private Object charAt(Context context, Object[] args) {
        String s = thisString(context);
        int index = intArg(args, 0, 0);
        return index < 0 || index >= s.length() ? "" : String.valueOf(s.charAt(index));
    }

    private Object charCodeAt(Context context, Object[] args) {
        String s = thisString(context);
        int index = intArg(args, 0, 0);
        return index < 0 || index >= s.length() ? Terms.NAN : (int) s.charAt(index);
    }

    private Object indexOf(Context context, Object[] args) {
        String s = thisString(context);
        return s.indexOf(context.toStringValue(arg(args, 0)), Math.max(0, intArg(args, 1, 0)));
    }

    private Object lastIndexOf(Context context, Object[] args) {
        String s = thisString(context);
        return s.lastIndexOf(context.toStringValue(arg(args, 0)), intArg(args, 1, s.length()));
    }

    private Object startsWith(Context context, Object[] args) {
        String s = thisString(context);
        int position = Math.max(0, Math.min(intArg(args, 1, 0), s.length()));
        return s.startsWith(context.toStringValue(arg(args, 0)), position);
    }

    private Object endsWith(Context context, Object[] args) {
        String s = thisString(context);
        int end = Math.max(0, Math.min(intArg(args, 1, s.length()), s.length()));
        return s.substring(0, end).endsWith(context.toStringValue(arg(args, 0)));
    }

    private Object slice(Context context, Object[] args) {
        String s = thisString(context);
        int start = relative(args, 0, s.length(), 0);
        int end = relative(args, 1, s.length(), s.length());
        return start >= end ? "" : s.substring(start, end);
    }

    private Object substring(Context context, Object[] args) {
        String s = thisString(context);
        int start = Math.max(0, Math.min(intArg(args, 0, 0), s.length()));
        int end = Math.max(0, Math.min(intArg(args, 1, s.length()), s.length()));
        return start <= end ? s.substring(start, end) : s.substring(end, start);
    }

    private Object split(Context context, Object[] args) {
        String s = thisString(context);
        Object separator = arg(args, 0);
        int limit = arg(args, 1) == Terms.UNDEFINED ? Integer.MAX_VALUE : intArg(args, 1, 0);
        List<Object> parts = new ArrayList<>();
        if (separator == Terms.UNDEFINED) {
            parts.add(s);
        } else {
            String sep = context.toStringValue(separator);
            if (sep.isEmpty()) {
                for (int i = 0; i < s.length(); i++) {
                    parts.add(String.valueOf(s.charAt(i)));
                }
            } else {
                int from = 0;
                int index;
                while ((index = s.indexOf(sep, from)) != -1) {
                    parts.add(s.substring(from, index));
                    from = index + sep.length();
                }
                parts.add(s.substring(from));
            }
        }
        while (parts.size() > limit) {
            parts.remove(parts.size() - 1);
        }
        return realm.newArray(parts);
    }

    /**
     * Replaces the first occurrence of a string pattern, the replacement may
     * be a function receiving the match, its offset and the whole string.
     */
    private Object replace(Context context, Object[] args) {
        String s = thisString(context);
        String pattern = context.toStringValue(arg(args, 0));
        int index = s.indexOf(pattern);
        if (index == -1) {
            return s;
        }
        Object replacement = arg(args, 1);
        String with;
        if (replacement instanceof JsFunction) {
            with = context.toStringValue(context.invoke(replacement, Terms.UNDEFINED, pattern, index, s));
        } else {
            with = context.toStringValue(replacement);
        }
        return s.substring(0, index) + with + s.substring(index + pattern.length());
    }

    private Object repeat(Context context, Object[] args) {
        String s = thisString(context);
        int count = intArg(args, 0, 0);
        if (count < 0) {
            throw JsException.rangeError("Invalid count value: " + count);
        }
        if ((long) s.length() * count > MAX_BUILT_LENGTH) {
            throw JsException.rangeError("Invalid string length");
        }
        return s.repeat(count);
    }

    private Object pad(Context context, Object[] args, boolean start) {
        String s = thisString(context);
        int targetLength = intArg(args, 0, 0);
        String filler = arg(args, 1) == Terms.UNDEFINED ? " " : context.toStringValue(arg(args, 1));
        if (targetLength <= s.length() || filler.isEmpty()) {
            return s;
        }
        if (targetLength > MAX_BUILT_LENGTH) {
            throw JsException.rangeError("Invalid string length");
        }
        StringBuilder padding = new StringBuilder();
        while (padding.length() < targetLength - s.length()) {
            padding.append(filler);
        }
        padding.setLength(targetLength - s.length());
        return start ? padding + s : s + padding;
    }

    private Object concat(Context context, Object[] args) {
        StringBuilder sb = new StringBuilder(thisString(context));
        for (Object arg : args) {
            sb.append(context.toStringValue(arg));
        }
        return sb.toString();
    }

}
