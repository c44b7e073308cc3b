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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Concrete syntax tree node. Branch nodes carry a {@link NodeType} and
 * children, leaves are TOKEN nodes wrapping a single {@link Token}.
 */
public class Node implements Iterable<Node> {

    public final NodeType type;
    public final Token token;

    private final List<Node> children;
    private Node parent;
    private String text;

    public Node(NodeType type) {
        this.type = type;
        token = Token.EMPTY;
        children = new ArrayList<>(4);
    }

    public Node(Token token) {
        type = NodeType.TOKEN;
        this.token = token;
        children = Collections.emptyList();
    }

    public Node getParent() {
        return parent;
    }

    public boolean isToken() {
        return type == NodeType.TOKEN;
    }

    public boolean isToken(TokenType tokenType) {
        return isToken() && token.type == tokenType;
    }

    public Token getFirstToken() {
        Node node = this;
        while (!node.isToken()) {
            if (node.children.isEmpty()) {
                return Token.EMPTY;
            }
            node = node.children.get(0);
        }
        return node.token;
    }

    private Token getLastToken() {
        Node node = this;
        while (!node.isToken()) {
            if (node.children.isEmpty()) {
                return Token.EMPTY;
            }
            node = node.children.get(node.children.size() - 1);
        }
        return node.token;
    }

    /**
     * Depth-first search of all descendants, this node excluded.
     */
    public List<Node> findAll(NodeType type) {
        List<Node> results = new ArrayList<>();
        collect(type, results);
        return results;
    }

    private void collect(NodeType type, List<Node> results) {
        for (Node child : children) {
            if (child.type == type) {
                results.add(child);
            }
            child.collect(type, results);
        }
    }

    public List<Node> findImmediateChildren(NodeType type) {
        List<Node> results = new ArrayList<>();
        for (Node child : children) {
            if (child.type == type) {
                results.add(child);
            }
        }
        return results;
    }

    /**
     * Concatenated token text, white-space and comments dropped.
     */
    public String getText() {
        if (text == null) {
            if (isToken()) {
                text = token.getText();
            } else {
                StringBuilder sb = new StringBuilder();
                for (Node child : children) {
                    sb.append(child.getText());
                }
                text = sb.toString();
            }
        }
        return text;
    }

    /**
     * The source slice this node spans.
     */
    public String getTextIncludingWhitespace() {
        if (isToken()) {
            return token.getText();
        }
        Token first = getFirstToken();
        Token last = getLastToken();
        if (first == Token.EMPTY || last == Token.EMPTY) {
            return "";
        }
        return last.getResource().getText().substring(first.pos, last.pos + last.length);
    }

    public void add(Node child) {
        child.parent = this;
        children.add(child);
    }

    public void addFirst(Node child) {
        child.parent = this;
        children.add(0, child);
    }

    public Node removeFirst() {
        if (children.isEmpty()) {
            throw new NoSuchElementException();
        }
        return children.remove(0);
    }

    public Node getFirst() {
        if (children.isEmpty()) {
            throw new NoSuchElementException();
        }
        return children.get(0);
    }

    public Node getLast() {
        if (children.isEmpty()) {
            throw new NoSuchElementException();
        }
        return children.get(children.size() - 1);
    }

    public Node get(int index) {
        return children.get(index);
    }

    public int size() {
        return children.size();
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    @Override
    public Iterator<Node> iterator() {
        return Collections.unmodifiableList(children).iterator();
    }

    @Override
    public String toString() {
        return isToken() ? token.getText() : "[" + type + "] " + getTextIncludingWhitespace();
    }

}
