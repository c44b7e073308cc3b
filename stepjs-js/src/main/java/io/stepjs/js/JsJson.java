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

import net.minidev.json.JSONValue;
import net.minidev.json.parser.JSONParser;
import net.minidev.json.parser.ParseException;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Collections;

/**
 * The global {@code JSON} object, backed by json-smart. Guest values are
 * converted to plain maps and lists before serialization, parsed documents
 * are converted back into guest objects.
 */
class JsJson extends Prototype {

    JsJson(Realm realm) {
        super(realm, realm.objectPrototype);
    }

    void init() {
        install("stringify", "parse");
    }

    @Override
    public String getClassName() {
        return "JSON";
    }

    @Override
    protected JsCallable getBuiltinProperty(String name) {
        return switch (name) {
            case "stringify" -> this::stringify;
            case "parse" -> this::parse;
            default -> null;
        };
    }

    private Object stringify(Context context, Object[] args) {
        Object value = arg(args, 0);
        if (value == Terms.UNDEFINED || value instanceof JsFunction) {
            return Terms.UNDEFINED;
        }
        Object json = toJson(value, Collections.newSetFromMap(new IdentityHashMap<>()));
        Object space = arg(args, 2);
        String indent = null;
        if (space instanceof Number) {
            int count = Math.min(((Number) space).intValue(), 10);
            if (count > 0) {
                indent = " ".repeat(count);
            }
        } else if (space instanceof String && !((String) space).isEmpty()) {
            String s = (String) space;
            indent = s.substring(0, Math.min(s.length(), 10));
        }
        if (indent == null) {
            return JSONValue.toJSONString(json);
        }
        StringBuilder sb = new StringBuilder();
        pretty(json, indent, "", sb);
        return sb.toString();
    }

    private static Object toJson(Object value, Set<Object> seen) {
        if (value instanceof Double) {
            double d = (Double) value;
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return d == 0 ? (Object) 0 : value;
        }
        if (value instanceof JsArray) {
            if (!seen.add(value)) {
                throw JsException.typeError("Converting circular structure to JSON");
            }
            JsArray array = (JsArray) value;
            List<Object> list = new ArrayList<>(array.size());
            for (int i = 0; i < array.size(); i++) {
                Object item = array.get(i);
                list.add(item == Terms.UNDEFINED || item instanceof JsFunction ? null : toJson(item, seen));
            }
            seen.remove(value);
            return list;
        }
        if (value instanceof JsObject) {
            if (!seen.add(value)) {
                throw JsException.typeError("Converting circular structure to JSON");
            }
            JsObject object = (JsObject) value;
            Map<String, Object> map = new LinkedHashMap<>();
            for (String key : object.keys()) {
                Object item = object.get(key);
                if (item != Terms.UNDEFINED && !(item instanceof JsFunction)) {
                    map.put(key, toJson(item, seen));
                }
            }
            seen.remove(value);
            return map;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static void pretty(Object json, String indent, String current, StringBuilder sb) {
        String inner = current + indent;
        if (json instanceof Map) {
            Map<String, Object> map = (Map<String, Object>) json;
            if (map.isEmpty()) {
                sb.append("{}");
                return;
            }
            sb.append("{\n");
            int i = 0;
            for (Map.Entry<String, Object> entry : map.entrySet()) {
                sb.append(inner).append(JSONValue.toJSONString(entry.getKey())).append(": ");
                pretty(entry.getValue(), indent, inner, sb);
                sb.append(++i < map.size() ? ",\n" : "\n");
            }
            sb.append(current).append('}');
        } else if (json instanceof List) {
            List<Object> list = (List<Object>) json;
            if (list.isEmpty()) {
                sb.append("[]");
                return;
            }
            sb.append("[\n");
            for (int i = 0; i < list.size(); i++) {
                sb.append(inner);
                pretty(list.get(i), indent, inner, sb);
                sb.append(i + 1 < list.size() ? ",\n" : "\n");
            }
            sb.append(current).append(']');
        } else {
            sb.append(JSONValue.toJSONString(json));
        }
    }

    private Object parse(Context context, Object[] args) {
        String text = context.toStringValue(arg(args, 0));
        try {
            JSONParser parser = new JSONParser(JSONParser.MODE_RFC4627);
            return realm.toGuest(parser.parse(text, JSONValue.defaultReader.DEFAULT_ORDERED));
        } catch (ParseException e) {
            throw JsException.syntaxError("Unexpected token in JSON: " + e.getMessage());
        }
    }

}
