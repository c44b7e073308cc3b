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
import io.stepjs.parser.Token;
import io.stepjs.parser.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Rejects programs the parser accepts but that can never run: assignments
 * to non-references, break / continue / return out of place and unknown
 * labels. Runs once when an engine is constructed.
 */
final class NodeValidator {

    private final boolean inFunction;
    private final int loops;
    private final int breakables;
    private final List<String> labels;
    private final List<String> loopLabels;

    private NodeValidator(boolean inFunction, int loops, int breakables, List<String> labels, List<String> loopLabels) {
        this.inFunction = inFunction;
        this.loops = loops;
        this.breakables = breakables;
        this.labels = labels;
        this.loopLabels = loopLabels;
    }

    static void validate(Node program) {
        new NodeValidator(false, 0, 0, new ArrayList<>(), new ArrayList<>()).walk(program);
    }

    private static EngineException invalid(Node node, String message) {
        StringBuilder sb = new StringBuilder("js failed:\n==========\n");
        Token token = node.getFirstToken();
        if (token != null && token != Token.EMPTY) {
            sb.append("  Line: ").append(token.line + 1).append(", Col: ").append(token.col + 1).append('\n');
            sb.append("  Code: ").append(token.getLineText().trim()).append('\n');
        }
        sb.append("  Error: SyntaxError: ").append(message).append('\n').append("==========");
        return new EngineException(sb.toString(), (Throwable) null);
    }

    private void walkChildren(Node node) {
        for (Node child : node) {
            if (!child.isToken()) {
                walk(child);
            }
        }
    }

    private void walk(Node node) {
        switch (node.type) {
            case FN_EXPR:
            case FN_ARROW_EXPR:
                new NodeValidator(true, 0, 0, new ArrayList<>(), new ArrayList<>()).walkChildren(node);
                return;
            case WHILE_STMT:
            case DO_WHILE_STMT:
                new NodeValidator(inFunction, loops + 1, breakables + 1, labels, loopLabels).walkChildren(node);
                return;
            case FOR_STMT:
                if (node.get(3).isToken(TokenType.IN) || node.get(3).isToken(TokenType.OF)) {
                    checkForInOfTarget(node);
                }
                new NodeValidator(inFunction, loops + 1, breakables + 1, labels, loopLabels).walkChildren(node);
                return;
            case SWITCH_STMT:
                new NodeValidator(inFunction, loops, breakables + 1, labels, loopLabels).walkChildren(node);
                return;
            case LABELED_STMT: {
                String label = node.getFirst().getText();
                if (labels.contains(label)) {
                    throw invalid(node, "Label '" + label + "' has already been declared");
                }
                List<String> nextLabels = new ArrayList<>(labels);
                nextLabels.add(label);
                List<String> nextLoopLabels = loopLabels;
                if (labelsLoop(node)) {
                    nextLoopLabels = new ArrayList<>(loopLabels);
                    nextLoopLabels.add(label);
                }
                new NodeValidator(inFunction, loops, breakables, nextLabels, nextLoopLabels).walkChildren(node);
                return;
            }
            case BREAK_STMT:
                if (node.size() > 1) {
                    String label = node.get(1).getText();
                    if (!labels.contains(label)) {
                        throw invalid(node, "Undefined label '" + label + "'");
                    }
                } else if (breakables == 0) {
                    throw invalid(node, "Illegal break statement");
                }
                return;
            case CONTINUE_STMT:
                if (node.size() > 1) {
                    String label = node.get(1).getText();
                    if (!labels.contains(label)) {
                        throw invalid(node, "Undefined label '" + label + "'");
                    }
                    if (!loopLabels.contains(label)) {
                        throw invalid(node, "Illegal continue statement: '" + label + "' does not denote an iteration statement");
                    }
                } else if (loops == 0) {
                    throw invalid(node, "Illegal continue statement: no surrounding iteration statement");
                }
                return;
            case RETURN_STMT:
                if (!inFunction) {
                    throw invalid(node, "Illegal return statement");
                }
                break;
            case ASSIGN_EXPR:
                if (!isAssignable(node.getFirst())) {
                    throw invalid(node, "Invalid left-hand side in assignment");
                }
                break;
            case MATH_PRE_EXPR:
                if (node.getFirst().isToken(TokenType.PLUS_PLUS) || node.getFirst().isToken(TokenType.MINUS_MINUS)) {
                    if (!isAssignable(node.get(1))) {
                        throw invalid(node, "Invalid left-hand side expression in prefix operation");
                    }
                }
                break;
            case MATH_POST_EXPR:
                if (!isAssignable(node.getFirst())) {
                    throw invalid(node, "Invalid left-hand side expression in postfix operation");
                }
                break;
            default:
        }
        walkChildren(node);
    }

    private static boolean labelsLoop(Node labeled) {
        Node inner = labeled.get(2).getFirst();
        while (inner.type == NodeType.LABELED_STMT) {
            inner = inner.get(2).getFirst();
        }
        return inner.type == NodeType.FOR_STMT || inner.type == NodeType.WHILE_STMT || inner.type == NodeType.DO_WHILE_STMT;
    }

    private static boolean isAssignable(Node node) {
        Node target = Interpreter.unwrap(node);
        switch (target.type) {
            case REF_EXPR:
                return target.getFirst().isToken(TokenType.IDENT) && !"this".equals(target.getFirst().getText());
            case REF_DOT_EXPR:
                return target.get(1).isToken(TokenType.DOT);
            case REF_BRACKET_EXPR:
                return true;
            default:
                return false;
        }
    }

    private static void checkForInOfTarget(Node forNode) {
        Node init = forNode.get(2);
        String kind = forNode.get(3).isToken(TokenType.IN) ? "for-in" : "for-of";
        if (init.isEmpty()) {
            throw invalid(forNode, "Invalid left-hand side in " + kind + " loop");
        }
        Node first = init.getFirst();
        if (first.type == NodeType.VAR_STMT) {
            List<Node> decls = first.findImmediateChildren(NodeType.VAR_DECL);
            if (decls.size() != 1) {
                throw invalid(forNode, "Invalid left-hand side in " + kind + " loop: Must have a single binding.");
            }
            if (decls.get(0).size() > 1) {
                throw invalid(forNode, kind + " loop variable declaration may not have an initializer.");
            }
            return;
        }
        List<Node> exprs = first.findImmediateChildren(NodeType.EXPR);
        if (exprs.size() != 1 || Interpreter.unwrap(exprs.get(0)).type != NodeType.REF_EXPR || !isAssignable(exprs.get(0))) {
            throw invalid(forNode, "Invalid left-hand side in " + kind + " loop");
        }
    }

}
