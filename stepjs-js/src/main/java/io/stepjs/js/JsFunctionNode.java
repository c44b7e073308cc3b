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
import io.stepjs.parser.NodeType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function written in the guest language: the syntax node plus the scope
 * it closes over.
 */
public class JsFunctionNode extends JsFunction {

    final Node node;
    final boolean arrow;
    final List<String> params;
    final Node body; // BLOCK, or the expression of a concise arrow body
    final Environment closure;
    final Object lexicalThis;

    JsFunctionNode(Realm realm, Node node, String name, Environment closure, Object lexicalThis) {
        this(realm, node, name, closure, lexicalThis, paramNames(node));
    }

    private JsFunctionNode(Realm realm, Node node, String name, Environment closure, Object lexicalThis, List<String> params) {
        super(realm.functionPrototype, name, params.size());
        this.node = node;
        this.arrow = node.type == NodeType.FN_ARROW_EXPR;
        this.params = params;
        this.closure = closure;
        this.lexicalThis = lexicalThis;
        Node last = node.getLast();
        this.body = last.type == NodeType.EXPR ? last.getFirst() : last;
        if (!arrow) {
            JsObject prototype = new JsObject(realm.objectPrototype);
            prototype.defineOwnProperty("constructor", this, true, false, true);
            defineOwnProperty("prototype", prototype, true, false, false);
        }
    }

    static List<String> paramNames(Node fnNode) {
        Node args = fnNode.type == NodeType.FN_EXPR
                ? fnNode.findImmediateChildren(NodeType.FN_DECL_ARGS).get(0)
                : fnNode.getFirst();
        if (args.isToken()) { // single arrow parameter without parentheses
            return Collections.singletonList(args.getText());
        }
        List<String> names = new ArrayList<>();
        for (Node arg : args.findImmediateChildren(NodeType.FN_DECL_ARG)) {
            names.add(arg.getFirst().getText());
        }
        return names;
    }

    public boolean isArrow() {
        return arrow;
    }

    /**
     * A block body completes with undefined unless it returns, a concise
     * arrow body yields its expression value.
     */
    boolean hasExpressionBody() {
        return body.type != NodeType.BLOCK;
    }

    @Override
    String toStringValue() {
        return node.getTextIncludingWhitespace();
    }

}
