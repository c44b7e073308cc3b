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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A guest object: an insertion-ordered map of own properties plus an optional
 * prototype link that is consulted on lookup misses.
 */
public class JsObject {

    /**
     * Returned by {@link #getProperty(String)} when no own or inherited
     * property exists, distinct from a stored {@code undefined}.
     */
    public static final Object NOT_FOUND = new Object() {
        @Override
        public String toString() {
            return "<not found>";
        }
    };

    private Map<String, PropertyDescriptor> properties;
    private JsObject prototype;
    private boolean extensible = true;
    private boolean frozen;

    public JsObject() {
        this(null);
    }

    public JsObject(JsObject prototype) {
        this.prototype = prototype;
    }

    public JsObject getPrototype() {
        return prototype;
    }

    /**
     * @throws JsException a guest {@code TypeError} if the link would create a cycle
     */
    public void setPrototype(JsObject prototype) {
        JsObject temp = prototype;
        while (temp != null) {
            if (temp == this) {
                throw JsException.typeError("Cyclic __proto__ value");
            }
            temp = temp.prototype;
        }
        this.prototype = prototype;
    }

    public boolean isExtensible() {
        return extensible;
    }

    public void preventExtensions() {
        extensible = false;
    }

    /**
     * Makes every own property read-only and non-configurable and stops new
     * properties from being added.
     */
    public void freeze() {
        if (properties != null) {
            for (Map.Entry<String, PropertyDescriptor> entry : properties.entrySet()) {
                PropertyDescriptor pd = entry.getValue();
                entry.setValue(new PropertyDescriptor(pd.value, false, pd.enumerable, false));
            }
        }
        extensible = false;
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Used for error messages and the default {@code toString}.
     */
    public String getClassName() {
        return "Object";
    }

    PropertyDescriptor ownDescriptor(String key) {
        return properties == null ? null : properties.get(key);
    }

    public PropertyDescriptor getOwnProperty(String key) {
        return ownDescriptor(key);
    }

    public boolean hasOwnProperty(String key) {
        return ownDescriptor(key) != null;
    }

    public boolean hasProperty(String key) {
        JsObject temp = this;
        while (temp != null) {
            if (temp.ownDescriptor(key) != null) {
                return true;
            }
            temp = temp.prototype;
        }
        return false;
    }

    /**
     * Own then inherited lookup.
     *
     * @return the value or {@link #NOT_FOUND}
     */
    public Object getProperty(String key) {
        JsObject temp = this;
        while (temp != null) {
            PropertyDescriptor pd = temp.ownDescriptor(key);
            if (pd != null) {
                return temp.readValue(key, pd);
            }
            temp = temp.prototype;
        }
        return NOT_FOUND;
    }

    // subclasses with computed slots read through here
    Object readValue(String key, PropertyDescriptor pd) {
        return pd.value;
    }

    public Object get(String key) {
        Object value = getProperty(key);
        return value == NOT_FOUND ? Terms.UNDEFINED : value;
    }

    /**
     * Plain assignment. Writes to a read-only own property and new keys on a
     * non-extensible object are ignored.
     */
    public void put(String key, Object value) {
        PropertyDescriptor pd = ownDescriptor(key);
        if (pd != null) {
            if (pd.writable) {
                writeValue(key, pd, value);
            }
            return;
        }
        if (!extensible) {
            return;
        }
        if (properties == null) {
            properties = new LinkedHashMap<>();
        }
        properties.put(key, PropertyDescriptor.data(value));
    }

    void writeValue(String key, PropertyDescriptor pd, Object value) {
        pd.value = value;
    }

    /**
     * Creates or replaces an own property with explicit attributes. A
     * non-configurable property can only have its value changed, and only if
     * it is writable.
     */
    public void defineOwnProperty(String key, Object value, boolean writable, boolean enumerable, boolean configurable) {
        PropertyDescriptor existing = ownDescriptor(key);
        if (existing != null && !existing.configurable) {
            if (!existing.writable) {
                throw JsException.typeError("Cannot redefine property: " + key);
            }
            writeValue(key, existing, value);
            return;
        }
        if (existing == null && !extensible) {
            throw JsException.typeError("Cannot define property " + key + ", object is not extensible");
        }
        if (properties == null) {
            properties = new LinkedHashMap<>();
        }
        properties.put(key, new PropertyDescriptor(value, writable, enumerable, configurable));
    }

    /**
     * @return false only when the own property exists and is not configurable
     */
    public boolean delete(String key) {
        PropertyDescriptor pd = ownDescriptor(key);
        if (pd == null) {
            return true;
        }
        if (!pd.configurable) {
            return false;
        }
        properties.remove(key);
        return true;
    }

    /**
     * All own keys in insertion order, enumerable or not.
     */
    public List<String> getOwnKeys() {
        return properties == null ? Collections.emptyList() : new ArrayList<>(properties.keySet());
    }

    /**
     * Own enumerable keys in insertion order.
     */
    public List<String> keys() {
        List<String> list = new ArrayList<>();
        for (String key : getOwnKeys()) {
            PropertyDescriptor pd = ownDescriptor(key);
            if (pd != null && pd.enumerable) {
                list.add(key);
            }
        }
        return list;
    }

    /**
     * Keys visited by for-in: own enumerable keys first, then enumerable keys
     * along the prototype chain, each name at most once. A name shadowed by a
     * non-enumerable property nearer the object is skipped.
     */
    public List<String> enumerableKeys() {
        Set<String> seen = new LinkedHashSet<>();
        List<String> list = new ArrayList<>();
        JsObject temp = this;
        while (temp != null) {
            for (String key : temp.getOwnKeys()) {
                if (seen.add(key) && temp.ownDescriptor(key).enumerable) {
                    list.add(key);
                }
            }
            temp = temp.prototype;
        }
        return list;
    }

    /**
     * Own enumerable properties as a host map, values unconverted.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String key : keys()) {
            map.put(key, get(key));
        }
        return map;
    }

    /**
     * Built-in string form used when no guest {@code toString} is involved.
     */
    String toStringValue() {
        Object name = getProperty("name");
        Object message = getProperty("message");
        if (message != NOT_FOUND && name instanceof String && isError()) {
            String msg = Terms.toStringValue(message);
            return msg.isEmpty() ? (String) name : name + ": " + msg;
        }
        return "[object " + getClassName() + "]";
    }

    boolean isError() {
        return false;
    }

    @Override
    public String toString() {
        return toStringValue();
    }

}
