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
 * Ordered integer-indexed storage with a derived {@code length}. Missing
 * slots are holes: they read as {@code undefined} and are skipped by
 * enumeration.
 */
public class JsArray extends JsObject {

    static final Object HOLE = new Object() {
        @Override
        public String toString() {
            return "<hole>";
        }
    };

    private static final long MAX_LENGTH = 4294967295L;

    /**
     * Elements are stored densely, holes included, so growth past this
     * length is refused with a RangeError instead of exhausting the heap.
     */
    static final int MAX_DENSE_LENGTH = 1 << 22;

    final List<Object> list;

    public JsArray(JsObject prototype) {
        this(prototype, new ArrayList<>());
    }

    public JsArray(JsObject prototype, List<Object> list) {
        super(prototype);
        this.list = list;
    }

    @Override
    public String getClassName() {
        return "Array";
    }

    /**
     * @return the index for a canonical array index key, or -1
     */
    static int toIndex(String key) {
        int len = key.length();
        if (len == 0 || len > 10) {
            return -1;
        }
        if (len > 1 && key.charAt(0) == '0') {
            return -1;
        }
        long value = 0;
        for (int i = 0; i < len; i++) {
            char c = key.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
            value = value * 10 + (c - '0');
        }
        return value < Integer.MAX_VALUE ? (int) value : -1;
    }

    public int size() {
        return list.size();
    }

    /**
     * Java-side element access, holes and out of range read as undefined.
     */
    public Object get(int index) {
        if (index < 0 || index >= list.size()) {
            return Terms.UNDEFINED;
        }
        Object value = list.get(index);
        return value == HOLE ? Terms.UNDEFINED : value;
    }

    boolean isHole(int index) {
        return index >= list.size() || list.get(index) == HOLE;
    }

    public void set(int index, Object value) {
        if (index >= MAX_DENSE_LENGTH) {
            throw JsException.rangeError("Invalid array length");
        }
        while (list.size() < index) {
            list.add(HOLE);
        }
        if (index == list.size()) {
            list.add(value);
        } else {
            list.set(index, value);
        }
    }

    public void add(Object value) {
        list.add(value);
    }

    void setLength(Object value) {
        double d = Terms.objectToNumber(value).doubleValue();
        if (d < 0 || d % 1 != 0 || d > MAX_LENGTH || Double.isNaN(d) || d > MAX_DENSE_LENGTH) {
            throw JsException.rangeError("Invalid array length");
        }
        int newLength = (int) d;
        while (list.size() > newLength) {
            list.remove(list.size() - 1);
        }
        while (list.size() < newLength) {
            list.add(HOLE);
        }
    }

    private void trimTrailingHoles() {
        while (!list.isEmpty() && list.get(list.size() - 1) == HOLE) {
            list.remove(list.size() - 1);
        }
    }

    /**
     * Elements with holes read as undefined.
     */
    public List<Object> toList() {
        List<Object> result = new ArrayList<>(list.size());
        for (Object o : list) {
            result.add(o == HOLE ? Terms.UNDEFINED : o);
        }
        return result;
    }

    @Override
    PropertyDescriptor ownDescriptor(String key) {
        if ("length".equals(key)) {
            return new PropertyDescriptor(list.size(), !isFrozen(), false, false);
        }
        int index = toIndex(key);
        if (index != -1) {
            if (isHole(index)) {
                return null;
            }
            boolean frozen = isFrozen();
            return new PropertyDescriptor(list.get(index), !frozen, true, !frozen);
        }
        return super.ownDescriptor(key);
    }

    @Override
    public void put(String key, Object value) {
        if (isFrozen()) {
            return;
        }
        if ("length".equals(key)) {
            setLength(value);
            return;
        }
        int index = toIndex(key);
        if (index != -1) {
            if (isExtensible() || !isHole(index)) {
                set(index, value);
            }
            return;
        }
        super.put(key, value);
    }

    @Override
    void writeValue(String key, PropertyDescriptor pd, Object value) {
        put(key, value);
    }

    @Override
    public void defineOwnProperty(String key, Object value, boolean writable, boolean enumerable, boolean configurable) {
        if ("length".equals(key) || toIndex(key) != -1) {
            put(key, value); // element attributes are not tracked
            return;
        }
        super.defineOwnProperty(key, value, writable, enumerable, configurable);
    }

    @Override
    public boolean delete(String key) {
        if ("length".equals(key) || isFrozen()) {
            return false;
        }
        int index = toIndex(key);
        if (index != -1) {
            if (index < list.size()) {
                list.set(index, HOLE);
                trimTrailingHoles();
            }
            return true;
        }
        return super.delete(key);
    }

    @Override
    public List<String> getOwnKeys() {
        List<String> keys = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) != HOLE) {
                keys.add(Integer.toString(i));
            }
        }
        keys.add("length");
        keys.addAll(super.getOwnKeys());
        return keys;
    }

    @Override
    String toStringValue() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            Object o = list.get(i);
            if (o != HOLE && !Terms.isNullish(o)) {
                sb.append(o == this ? "" : Terms.toStringValue(o));
            }
        }
        return sb.toString();
    }

}
