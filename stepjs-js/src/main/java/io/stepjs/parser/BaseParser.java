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
package io.stepjs.parser;

import io.stepjs.common.Resource;

import java.util.Arrays;
import java.util.List;

import static io.stepjs.parser.TokenType.*;

/**
 * Marker-stack parser base. Every rule {@link #enter}s a node, consumes tokens
 * into it and {@link #exit}s, either attaching the node to its parent or
 * rewinding the token position when the rule did not match.
 */
public abstract class BaseParser {

    private static final int MAX_DEPTH = 256;

    protected final Resource resource;
    protected final List<Token> tokens;
    private final int size;

    private int position = 0;

    private int stackPointer;
    private final int[] positionStack = new int[MAX_DEPTH];
    private final Node[] nodeStack = new Node[MAX_DEPTH];

    protected enum Shift {
        NONE, LEFT, RIGHT
    }

    protected BaseParser(Resource resource, List<Token> tokens) {
        this.resource = resource;
        this.tokens = tokens;
        size = tokens.size();
        positionStack[0] = position;
        nodeStack[0] = new Node(NodeType.ROOT);
        stackPointer = 1;
    }

    protected Node markerNode() {
        return nodeStack[stackPointer - 1];
    }

    protected boolean isCallerType(NodeType type) {
        return stackPointer >= 2 && nodeStack[stackPointer - 2].type == type;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int start = Math.max(0, position - 7);
        int end = Math.min(position + 7, size);
        for (int i = start; i < end; i++) {
            if (i == 0) {
                sb.append("| ");
            }
            if (i == position) {
                sb.append(">>");
            }
            sb.append(tokens.get(i)).append(' ');
        }
        if (position == size) {
            sb.append(">>");
        }
        sb.append("|\ncurrent node: ");
        if (stackPointer >= 3) {
            sb.append(nodeStack[stackPointer - 3].type).append(" >> ");
        }
        if (stackPointer >= 2) {
            sb.append(nodeStack[stackPointer - 2].type).append(" >> ");
        }
        sb.append('[').append(nodeStack[stackPointer - 1].type).append(']');
        return sb.toString();
    }

    protected void error(String message) {
        Token token = peekToken();
        String path = resource.isFile() ? resource.getRelativePath() + ":" : "";
        throw new ParserException(message + "\n" + path
                + token.getPositionDisplay() + " " + token + "\nparser state: " + this);
    }

    protected void error(NodeType... expected) {
        error("expected: " + Arrays.asList(expected));
    }

    protected void error(TokenType... expected) {
        error("expected: " + Arrays.asList(expected));
    }

    protected void enter(NodeType type) {
        push(type);
    }

    protected boolean enter(NodeType type, TokenType token) {
        if (peek() != token) {
            return false;
        }
        push(type);
        consumeNext();
        return true;
    }

    protected boolean enter(NodeType type, TokenType[] tokens) {
        if (!peekAnyOf(tokens)) {
            return false;
        }
        push(type);
        consumeNext();
        return true;
    }

    private void push(NodeType type) {
        if (stackPointer >= MAX_DEPTH) {
            error("too much recursion");
        }
        positionStack[stackPointer] = position;
        nodeStack[stackPointer] = new Node(type);
        stackPointer++;
    }

    protected boolean exit() {
        return exit(true, false, Shift.NONE);
    }

    protected boolean exit(boolean result, boolean mandatory) {
        return exit(result, mandatory, Shift.NONE);
    }

    protected void exit(Shift shift) {
        exit(true, false, shift);
    }

    private boolean exit(boolean result, boolean mandatory, Shift shift) {
        Node node = nodeStack[stackPointer - 1];
        if (mandatory && !result) {
            error(node.type);
        }
        if (result) {
            Node parent = nodeStack[stackPointer - 2];
            switch (shift) {
                case LEFT:
                    node.addFirst(parent.removeFirst()); // previous sibling becomes the first child
                    parent.add(node);
                    break;
                case NONE:
                    parent.add(node);
                    break;
                case RIGHT:
                    Node prevSibling = parent.removeFirst();
                    if (prevSibling.type == node.type) {
                        // re-associate to the right, e.g: a ** b ** c
                        Node newNode = new Node(node.type);
                        parent.add(newNode);
                        newNode.add(prevSibling.get(0));
                        newNode.add(prevSibling.get(1));
                        Node newRhs = new Node(node.type);
                        newNode.add(newRhs);
                        newRhs.add(prevSibling.get(2));
                        newRhs.add(node.get(0));
                        newRhs.add(node.get(1));
                    } else {
                        node.addFirst(prevSibling);
                        parent.add(node);
                    }
            }
        } else {
            position = positionStack[stackPointer - 1];
        }
        stackPointer--;
        nodeStack[stackPointer] = null;
        return result;
    }

    protected TokenType peek() {
        return peekToken().type;
    }

    protected Token peekToken() {
        return position >= size ? Token.EMPTY : tokens.get(position);
    }

    protected TokenType peekAhead(int offset) {
        int index = position + offset;
        return index >= size ? EOF : tokens.get(index).type;
    }

    protected void consume(TokenType token) {
        if (!consumeIf(token)) {
            error(token);
        }
    }

    protected boolean anyOf(TokenType[] tokens) {
        for (TokenType token : tokens) {
            if (consumeIf(token)) {
                return true;
            }
        }
        return false;
    }

    protected boolean consumeIf(TokenType token) {
        if (peekIf(token)) {
            consumeNext();
            return true;
        }
        return false;
    }

    protected boolean peekIf(TokenType token) {
        return peek() == token;
    }

    protected boolean peekAnyOf(TokenType[] tokens) {
        TokenType current = peek();
        for (TokenType token : tokens) {
            if (current == token) {
                return true;
            }
        }
        return false;
    }

    protected TokenType lastConsumed() {
        return nodeStack[stackPointer - 1].getLast().token.type;
    }

    protected void consumeNext() {
        nodeStack[stackPointer - 1].add(new Node(next()));
    }

    protected Token next() {
        return position >= size ? Token.EMPTY : tokens.get(position++);
    }

}
