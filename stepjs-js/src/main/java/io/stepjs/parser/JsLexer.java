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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

import static io.stepjs.parser.TokenType.*;

/**
 * Hand-rolled lexer for the guest language. White-space and comments are
 * emitted as non-primary tokens so that the parser can apply automatic
 * semicolon insertion by looking at what precedes a token.
 */
public class JsLexer {

    private final Resource resource;
    private final String source;
    private final int length;

    private int pos;
    private int line;
    private int col;
    private int tokenStart;
    private int tokenLine;
    private int tokenCol;
    private Token last;

    private boolean regexAllowed = true;
    private final ArrayDeque<LexerState> stateStack = new ArrayDeque<>();

    enum LexerState {
        INITIAL, TEMPLATE, PLACEHOLDER
    }

    public JsLexer(Resource resource) {
        this.resource = resource;
        source = resource.getText();
        length = source.length();
        line = resource.getLineOffset();
        stateStack.push(LexerState.INITIAL);
    }

    /**
     * @return the primary tokens (no white-space or comments), always ending with EOF
     */
    public static List<Token> getTokens(Resource resource) {
        JsLexer lexer = new JsLexer(resource);
        List<Token> list = new ArrayList<>();
        Token token;
        do {
            token = lexer.nextToken();
            if (token.type.isPrimary()) {
                list.add(token);
            }
        } while (token.type != EOF);
        return list;
    }

    public Token nextToken() {
        tokenStart = pos;
        tokenLine = line;
        tokenCol = col;
        TokenType type = scanToken();
        Boolean allowed = type.regexAllowedAfter();
        if (allowed != null) {
            regexAllowed = allowed;
        }
        last = new Token(resource, last, type, tokenStart, tokenLine, tokenCol, pos - tokenStart);
        return last;
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private char peek() {
        return pos >= length ? '\0' : source.charAt(pos);
    }

    private char peek(int offset) {
        int index = pos + offset;
        return (index < 0 || index >= length) ? '\0' : source.charAt(index);
    }

    private char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 0;
        } else {
            col++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (pos >= length || source.charAt(pos) != expected) {
            return false;
        }
        advance();
        return true;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private void pushState(LexerState state) {
        stateStack.push(state);
    }

    private void popState() {
        if (stateStack.size() > 1) {
            stateStack.pop();
        }
    }

    private ParserException unterminated(String what) {
        return new ParserException("unterminated " + what + "\n" + (tokenLine + 1) + ":" + (tokenCol + 1));
    }

    private TokenType scanToken() {
        if (isAtEnd()) {
            if (stateStack.peek() != LexerState.INITIAL) {
                throw unterminated("template literal");
            }
            return EOF;
        }
        if (stateStack.peek() == LexerState.TEMPLATE) {
            return scanTemplateContent();
        }
        char c = source.charAt(pos);
        if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
            return scanWhitespace();
        }
        if (c == '/') {
            return scanSlash();
        }
        if (c == '"' || c == '\'') {
            return scanString(c);
        }
        if (c == '`') {
            advance();
            pushState(LexerState.TEMPLATE);
            return BACKTICK;
        }
        if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$') {
            return scanIdentifier();
        }
        if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
            return scanNumber();
        }
        if (c > 127 && Character.isJavaIdentifierStart(c)) {
            return scanIdentifier();
        }
        return scanOperator();
    }

    private TokenType scanWhitespace() {
        boolean hasNewline = false;
        while (pos < length) {
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\r') {
                if (c == '\r') {
                    hasNewline = true;
                }
                pos++;
                col++;
            } else if (c == '\n') {
                pos++;
                line++;
                col = 0;
                hasNewline = true;
            } else {
                break;
            }
        }
        return hasNewline ? WS_LF : WS;
    }

    private TokenType scanSlash() {
        advance(); // '/'
        if (match('/')) {
            while (pos < length) {
                char c = source.charAt(pos);
                if (c == '\n' || c == '\r') {
                    break;
                }
                pos++;
                col++;
            }
            return L_COMMENT;
        }
        if (match('*')) {
            while (true) {
                if (isAtEnd()) {
                    throw unterminated("comment");
                }
                if (peek() == '*' && peek(1) == '/') {
                    advance();
                    advance();
                    return B_COMMENT;
                }
                advance();
            }
        }
        if (regexAllowed) {
            return scanRegex();
        }
        return match('=') ? SLASH_EQ : SLASH;
    }

    // regex literals are not evaluated, they are lexed so that the parser can reject them by name
    private TokenType scanRegex() {
        boolean inCharClass = false;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\n' || c == '\r') {
                break;
            }
            if (c == '\\') {
                advance();
                if (!isAtEnd() && peek() != '\n') {
                    advance();
                }
                continue;
            }
            if (c == '[') {
                inCharClass = true;
            } else if (c == ']') {
                inCharClass = false;
            } else if (c == '/' && !inCharClass) {
                advance();
                while (!isAtEnd() && Character.isJavaIdentifierPart(peek())) {
                    advance();
                }
                break;
            }
            advance();
        }
        return REGEX;
    }

    private TokenType scanString(char quote) {
        advance(); // opening quote
        while (true) {
            if (isAtEnd()) {
                throw unterminated("string");
            }
            char c = advance();
            if (c == quote) {
                break;
            }
            if (c == '\\' && !isAtEnd()) {
                advance();
            } else if (c == '\n') {
                throw unterminated("string");
            }
        }
        return quote == '"' ? D_STRING : S_STRING;
    }

    private TokenType scanTemplateContent() {
        char c = peek();
        if (c == '`') {
            advance();
            popState();
            return BACKTICK;
        }
        if (c == '$' && peek(1) == '{') {
            advance();
            advance();
            pushState(LexerState.PLACEHOLDER);
            return DOLLAR_L_CURLY;
        }
        while (!isAtEnd()) {
            c = peek();
            if (c == '`' || (c == '$' && peek(1) == '{')) {
                break;
            }
            if (c == '\\') {
                advance();
                if (!isAtEnd()) {
                    advance();
                }
                continue;
            }
            advance();
        }
        return T_STRING;
    }

    private TokenType scanNumber() {
        char c = peek();
        if (c == '0' && (peek(1) == 'x' || peek(1) == 'X')) {
            advance();
            advance();
            while (!isAtEnd() && isHexDigit(peek())) {
                advance();
            }
            return NUMBER;
        }
        if (c == '.') {
            advance();
        } else {
            while (!isAtEnd() && isDigit(peek())) {
                advance();
            }
            if (peek() == '.' && isDigit(peek(1))) {
                advance();
            }
        }
        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }
        if (peek() == 'e' || peek() == 'E') {
            advance();
            if (peek() == '+' || peek() == '-') {
                advance();
            }
            while (!isAtEnd() && isDigit(peek())) {
                advance();
            }
        }
        return NUMBER;
    }

    private TokenType scanIdentifier() {
        while (pos < length) {
            char c = source.charAt(pos);
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || isDigit(c) || c == '_' || c == '$'
                    || (c > 127 && Character.isJavaIdentifierPart(c))) {
                pos++;
                col++;
            } else {
                break;
            }
        }
        return keywordOrIdent(source.substring(tokenStart, pos));
    }

    // "this" is deliberately an identifier, the evaluator resolves it against the call frame
    private static TokenType keywordOrIdent(String text) {
        return switch (text) {
            case "if" -> IF;
            case "in" -> IN;
            case "of" -> OF;
            case "do" -> DO;
            case "var" -> VAR;
            case "let" -> LET;
            case "new" -> NEW;
            case "try" -> TRY;
            case "for" -> FOR;
            case "null" -> NULL;
            case "true" -> TRUE;
            case "else" -> ELSE;
            case "case" -> CASE;
            case "false" -> FALSE;
            case "const" -> CONST;
            case "catch" -> CATCH;
            case "throw" -> THROW;
            case "while" -> WHILE;
            case "break" -> BREAK;
            case "return" -> RETURN;
            case "typeof" -> TYPEOF;
            case "delete" -> DELETE;
            case "switch" -> SWITCH;
            case "finally" -> FINALLY;
            case "default" -> DEFAULT;
            case "function" -> FUNCTION;
            case "continue" -> CONTINUE;
            case "instanceof" -> INSTANCEOF;
            default -> IDENT;
        };
    }

    private TokenType scanOperator() {
        char c = advance();
        switch (c) {
            case '{':
                if (stateStack.peek() == LexerState.PLACEHOLDER) {
                    // nested braces inside a placeholder must not close it
                    pushState(LexerState.PLACEHOLDER);
                }
                return L_CURLY;
            case '}':
                if (stateStack.peek() == LexerState.PLACEHOLDER) {
                    popState();
                }
                return R_CURLY;
            case '[':
                return L_BRACKET;
            case ']':
                return R_BRACKET;
            case '(':
                return L_PAREN;
            case ')':
                return R_PAREN;
            case ',':
                return COMMA;
            case ':':
                return COLON;
            case ';':
                return SEMI;
            case '~':
                return TILDE;
            case '.':
                if (peek() == '.' && peek(1) == '.') {
                    advance();
                    advance();
                    return DOT_DOT_DOT;
                }
                return DOT;
            case '?':
                if (peek() == '.' && !isDigit(peek(1))) {
                    advance();
                    return QUES_DOT;
                }
                return match('?') ? QUES_QUES : QUES;
            case '=':
                if (match('=')) {
                    return match('=') ? EQ_EQ_EQ : EQ_EQ;
                }
                return match('>') ? EQ_GT : EQ;
            case '<':
                if (match('<')) {
                    return match('=') ? LT_LT_EQ : LT_LT;
                }
                return match('=') ? LT_EQ : LT;
            case '>':
                if (match('>')) {
                    if (match('>')) {
                        return match('=') ? GT_GT_GT_EQ : GT_GT_GT;
                    }
                    return match('=') ? GT_GT_EQ : GT_GT;
                }
                return match('=') ? GT_EQ : GT;
            case '!':
                if (match('=')) {
                    return match('=') ? NOT_EQ_EQ : NOT_EQ;
                }
                return NOT;
            case '|':
                if (match('|')) {
                    return match('=') ? PIPE_PIPE_EQ : PIPE_PIPE;
                }
                return match('=') ? PIPE_EQ : PIPE;
            case '&':
                if (match('&')) {
                    return match('=') ? AMP_AMP_EQ : AMP_AMP;
                }
                return match('=') ? AMP_EQ : AMP;
            case '^':
                return match('=') ? CARET_EQ : CARET;
            case '+':
                if (match('+')) {
                    return PLUS_PLUS;
                }
                return match('=') ? PLUS_EQ : PLUS;
            case '-':
                if (match('-')) {
                    return MINUS_MINUS;
                }
                return match('=') ? MINUS_EQ : MINUS;
            case '*':
                if (match('*')) {
                    return match('=') ? STAR_STAR_EQ : STAR_STAR;
                }
                return match('=') ? STAR_EQ : STAR;
            case '%':
                return match('=') ? PERCENT_EQ : PERCENT;
            default:
                throw new ParserException("unexpected character '" + c + "'\n" + (tokenLine + 1) + ":" + (tokenCol + 1));
        }
    }

}
