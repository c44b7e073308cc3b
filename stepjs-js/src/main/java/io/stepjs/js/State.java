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

import io.stepjs.parser.Node;

import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * One pending node evaluation on the interpreter stack. A state is resumed
 * each time a child it pushed completes, {@link #phase} tells it where it
 * left off and {@link #value} holds what the child produced. The remaining
 * fields are scratch space whose meaning depends on the node type.
 */
final class State {

    final Node node;
    Environment env;
    final CallFrame frame;

    int phase;
    int index;
    Object value = Terms.UNDEFINED;

    Object lhs;
    Object target;
    Object callee;
    List<Object> values;
    List<Node> statements;
    Iterator<Object> iterator;
    Environment baseEnv;
    Completion pending;
    Set<String> labels;
    Deferred deferred;
    Node callerNode;

    /** evaluate to a {@link JsProperty} instead of a value */
    boolean reference;
    /** object or callee position of a member access or call, may receive a short-circuit */
    boolean chain;
    /** a guest function body is running on top of this call state */
    boolean callPending;
    boolean construct;
    boolean functionBody;
    boolean perIteration;

    State(Node node, Environment env, CallFrame frame) {
        this.node = node;
        this.env = env;
        this.frame = frame;
    }

    boolean hasLabel(String label) {
        return labels != null && labels.contains(label);
    }

    @Override
    public String toString() {
        return node.type + "[" + phase + "] " + node;
    }

}
