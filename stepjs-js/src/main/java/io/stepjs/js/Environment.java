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

import java.util.HashMap;
import java.util.Map;

/**
 * One scope in the lexical chain. The global scope keeps var and function
 * declarations as properties of the global object and let / const in its own
 * binding table, looked up first.
 */
public class Environment {

    final Environment parent;
    private final JsObject globalObject;
    private final boolean functionScope;
    private final Map<String, BindValue> bindings;

    static Environment global(JsObject globalObject) {
        return new Environment(null, globalObject, true, new HashMap<>());
    }

    Environment(Environment parent, boolean functionScope) {
        this(parent, null, functionScope, new HashMap<>());
    }

    private Environment(Environment parent, JsObject globalObject, boolean functionScope, Map<String, BindValue> bindings) {
        this.parent = parent;
        this.globalObject = globalObject;
        this.functionScope = functionScope;
        this.bindings = bindings;
    }

    public Environment getParent() {
        return parent;
    }

    public boolean isGlobal() {
        return globalObject != null;
    }

    /**
     * @return the nearest scope that receives var declarations
     */
    Environment varScope() {
        Environment env = this;
        while (!env.functionScope) {
            env = env.parent;
        }
        return env;
    }

    BindValue findLocal(String name) {
        return bindings.get(name);
    }

    /**
     * Introduces a binding in this scope. Re-declaring a var is allowed and
     * keeps the binding, re-declaring a let or const is a SyntaxError.
     */
    public void declare(String name, Object value, BindingType type) {
        if (globalObject != null && type == BindingType.VAR) {
            if (bindings.containsKey(name)) {
                throw JsException.syntaxError("Identifier '" + name + "' has already been declared");
            }
            globalObject.put(name, value);
            return;
        }
        BindValue existing = bindings.get(name);
        if (existing != null && (existing.type != BindingType.VAR || type != BindingType.VAR)) {
            throw JsException.syntaxError("Identifier '" + name + "' has already been declared");
        }
        bindings.put(name, new BindValue(name, type, value, true));
    }

    /**
     * Hoisted var: created as undefined if absent, an existing value is kept.
     */
    void declareVar(String name) {
        if (globalObject != null) {
            if (!globalObject.hasOwnProperty(name)) {
                globalObject.put(name, Terms.UNDEFINED);
            }
            return;
        }
        if (!bindings.containsKey(name)) {
            bindings.put(name, new BindValue(name, BindingType.VAR, Terms.UNDEFINED, true));
        }
    }

    /**
     * Let / const created at scope entry, unreadable until initialized.
     */
    void declareUninitialized(String name, BindingType type) {
        BindValue existing = bindings.get(name);
        if (existing != null) {
            throw JsException.syntaxError("Identifier '" + name + "' has already been declared");
        }
        bindings.put(name, new BindValue(name, type, Terms.UNDEFINED, false));
    }

    /**
     * Runs when a let / const declaration is reached.
     */
    void initialize(String name, Object value, BindingType type) {
        BindValue bv = bindings.get(name);
        if (bv == null || bv.initialized) {
            declare(name, value, type);
            return;
        }
        bv.value = value;
        bv.initialized = true;
    }

    public boolean has(String name) {
        Environment env = this;
        while (env != null) {
            if (env.bindings.containsKey(name)) {
                return true;
            }
            if (env.globalObject != null && env.globalObject.hasProperty(name)) {
                return true;
            }
            env = env.parent;
        }
        return false;
    }

    /**
     * @throws JsException ReferenceError when undeclared or still uninitialized
     */
    public Object lookup(String name) {
        Environment env = this;
        while (env != null) {
            BindValue bv = env.bindings.get(name);
            if (bv != null) {
                if (!bv.initialized) {
                    throw JsException.referenceError("Cannot access '" + name + "' before initialization");
                }
                return bv.value;
            }
            if (env.globalObject != null) {
                Object value = env.globalObject.getProperty(name);
                if (value != JsObject.NOT_FOUND) {
                    return value;
                }
            }
            env = env.parent;
        }
        throw JsException.referenceError(name + " is not defined");
    }

    /**
     * Writes to the nearest binding. An undeclared name becomes a property of
     * the global object unless {@code strict}.
     */
    public void assign(String name, Object value, boolean strict) {
        Environment env = this;
        while (env != null) {
            BindValue bv = env.bindings.get(name);
            if (bv != null) {
                if (!bv.initialized) {
                    throw JsException.referenceError("Cannot access '" + name + "' before initialization");
                }
                if (bv.type == BindingType.CONST) {
                    throw JsException.typeError("Assignment to constant variable.");
                }
                bv.value = value;
                return;
            }
            if (env.globalObject != null) {
                if (env.globalObject.hasProperty(name) || !strict) {
                    env.globalObject.put(name, value);
                    return;
                }
                break;
            }
            env = env.parent;
        }
        throw JsException.referenceError(name + " is not defined");
    }

    /**
     * Fresh scope for the next loop iteration, carrying the current values
     * so closures created in earlier iterations keep their own copies.
     */
    Environment copyForIteration() {
        Map<String, BindValue> copied = new HashMap<>();
        for (Map.Entry<String, BindValue> entry : bindings.entrySet()) {
            copied.put(entry.getKey(), entry.getValue().copy());
        }
        return new Environment(parent, globalObject, functionScope, copied);
    }

    @Override
    public String toString() {
        return (globalObject != null ? "global" : functionScope ? "function" : "block") + bindings.values();
    }

}
