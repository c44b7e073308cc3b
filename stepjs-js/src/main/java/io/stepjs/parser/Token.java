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

/**
 * A lexed token. Each token keeps a link to the one lexed before it
 * (white-space and comments included) so that the parser can tell whether a
 * line break precedes it.
 */
public class Token {

    public static final Token EMPTY = new Token(Resource.text(""), null, TokenType.EOF, 0, 0, 0, 0);

    private final Resource resource;
    private final Token prev;

    public final TokenType type;
    public final int pos;
    public final int line;
    public final int col;
    public final int length;

    Token(Resource resource, Token prev, TokenType type, int pos, int line, int col, int length) {
        this.resource = resource;
        this.prev = prev;
        this.type = type;
        this.pos = pos;
        this.line = line;
        this.col = col;
        this.length = length;
    }

    public Resource getResource() {
        return resource;
    }

    public String getText() {
        return resource.getText().substring(pos, pos + length);
    }

    public Token getPrev() {
        return prev;
    }

    /**
     * @return true if a line break separates this token from the previous primary token
     */
    public boolean isPrecededByNewLine() {
        for (Token t = prev; t != null && !t.type.isPrimary(); t = t.prev) {
            if (t.type == TokenType.WS_LF || (t.type == TokenType.B_COMMENT && t.getText().indexOf('\n') != -1)) {
                return true;
            }
        }
        return false;
    }

    public String getLineText() {
        return resource.getLine(line);
    }

    public String getPositionDisplay() {
        return (line + 1) + ":" + (col + 1);
    }

    @Override
    public String toString() {
        return switch (type) {
            case WS -> "_";
            case WS_LF -> "_\\n_";
            case EOF -> "_EOF_";
            default -> getText();
        };
    }

}
