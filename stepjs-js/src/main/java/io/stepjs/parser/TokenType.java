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

public enum TokenType {

    WS_LF,
    WS,
    EOF,
    BACKTICK,
    L_CURLY,
    R_CURLY,
    L_BRACKET,
    R_BRACKET,
    L_PAREN,
    R_PAREN,
    COMMA,
    COLON,
    SEMI,
    DOT_DOT_DOT,
    QUES_DOT,
    DOT,
    //==== keywords
    NULL(true),
    TRUE(true),
    FALSE(true),
    FUNCTION(true),
    RETURN(true),
    TRY(true),
    CATCH(true),
    FINALLY(true),
    THROW(true),
    NEW(true),
    VAR(true),
    LET(true),
    CONST(true),
    IF(true),
    ELSE(true),
    TYPEOF(true),
    INSTANCEOF(true),
    DELETE(true),
    FOR(true),
    IN(true),
    OF(true),
    DO(true),
    WHILE(true),
    SWITCH(true),
    CASE(true),
    DEFAULT(true),
    BREAK(true),
    CONTINUE(true),
    //====
    EQ_EQ_EQ,
    EQ_EQ,
    EQ,
    EQ_GT, // arrow
    LT_LT_EQ,
    LT_LT,
    LT_EQ,
    LT,
    GT_GT_GT_EQ,
    GT_GT_GT,
    GT_GT_EQ,
    GT_GT,
    GT_EQ,
    GT,
    //====
    NOT_EQ_EQ,
    NOT_EQ,
    NOT,
    PIPE_PIPE_EQ,
    PIPE_PIPE,
    PIPE_EQ,
    PIPE,
    AMP_AMP_EQ,
    AMP_AMP,
    AMP_EQ,
    AMP,
    CARET_EQ,
    CARET,
    QUES_QUES,
    QUES,
    //====
    PLUS_PLUS,
    PLUS_EQ,
    PLUS,
    MINUS_MINUS,
    MINUS_EQ,
    MINUS,
    STAR_STAR_EQ,
    STAR_STAR,
    STAR_EQ,
    STAR,
    SLASH_EQ,
    SLASH,
    PERCENT_EQ,
    PERCENT,
    TILDE,
    //====
    L_COMMENT,
    B_COMMENT,
    S_STRING,
    D_STRING,
    NUMBER,
    IDENT,
    //====
    REGEX,
    DOLLAR_L_CURLY,
    T_STRING;

    public final boolean keyword;

    TokenType() {
        this(false);
    }

    TokenType(boolean keyword) {
        this.keyword = keyword;
    }

    /**
     * False for comments and whitespace, which the parser never sees.
     * EOF counts as primary.
     */
    public boolean isPrimary() {
        return switch (this) {
            case L_COMMENT, B_COMMENT, WS, WS_LF -> false;
            default -> true;
        };
    }

    /**
     * Whether a slash after this token starts a regex literal rather than a
     * division, null when the token leaves the lexer's current decision alone.
     * Evaluated lazily: a switch over this enum cannot run while its
     * constants are still being constructed.
     */
    public Boolean regexAllowedAfter() {
        return switch (this) {
            case L_PAREN, L_BRACKET, L_CURLY, COMMA, SEMI, COLON, EQ, EQ_EQ, EQ_EQ_EQ, NOT_EQ, NOT_EQ_EQ, LT, LT_EQ, GT,
                 GT_EQ, PLUS, PLUS_EQ, MINUS, MINUS_EQ, STAR, STAR_EQ, STAR_STAR, STAR_STAR_EQ, SLASH_EQ, PERCENT,
                 PERCENT_EQ, AMP, AMP_EQ, AMP_AMP, AMP_AMP_EQ, PIPE, PIPE_EQ, PIPE_PIPE, PIPE_PIPE_EQ, CARET, CARET_EQ,
                 QUES, QUES_QUES, TILDE, NOT, RETURN, TYPEOF, DELETE, INSTANCEOF, IN, DO, IF, ELSE, CASE, DEFAULT,
                 THROW -> true;
            case R_PAREN, R_BRACKET, R_CURLY, IDENT, NUMBER, S_STRING, D_STRING, TRUE, FALSE, NULL -> false;
            default -> null;
        };
    }

}
