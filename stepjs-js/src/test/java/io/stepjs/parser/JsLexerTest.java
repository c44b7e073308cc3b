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
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static io.stepjs.parser.TokenType.*;
import static org.junit.jupiter.api.Assertions.*;

class JsLexerTest {

    private static List<Token> tokenize(String text) {
        JsLexer lexer = new JsLexer(Resource.text(text));
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = lexer.nextToken();
            tokens.add(token);
        } while (token.type != EOF);
        return tokens;
    }

    private static List<TokenType> types(String text) {
        return tokenize(text).stream().map(t -> t.type).collect(Collectors.toList());
    }

    private static String firstText(String text) {
        return tokenize(text).get(0).getText();
    }

    @Test
    void testOperatorLongestMatch() {
        assertEquals(List.of(EQ_EQ_EQ, EOF), types("==="));
        assertEquals(List.of(EQ_EQ, EOF), types("=="));
        assertEquals(List.of(EQ, EOF), types("="));
        assertEquals(List.of(NOT_EQ_EQ, EOF), types("!=="));
        assertEquals(List.of(NOT_EQ, EOF), types("!="));
        assertEquals(List.of(NOT, EOF), types("!"));
        assertEquals(List.of(GT_GT_GT_EQ, EOF), types(">>>="));
        assertEquals(List.of(GT_GT_GT, EOF), types(">>>"));
        assertEquals(List.of(GT_GT_EQ, EOF), types(">>="));
        assertEquals(List.of(GT_EQ, EOF), types(">="));
        assertEquals(List.of(LT_LT_EQ, EOF), types("<<="));
        assertEquals(List.of(LT_EQ, EOF), types("<="));
        assertEquals(List.of(STAR_STAR_EQ, EOF), types("**="));
        assertEquals(List.of(STAR_STAR, EOF), types("**"));
        assertEquals(List.of(PIPE_PIPE_EQ, EOF), types("||="));
        assertEquals(List.of(AMP_AMP_EQ, EOF), types("&&="));
        assertEquals(List.of(EQ_GT, EOF), types("=>"));
        assertEquals(List.of(QUES_DOT, EOF), types("?."));
        assertEquals(List.of(QUES_QUES, EOF), types("??"));
        assertEquals(List.of(PLUS_PLUS, EOF), types("++"));
        assertEquals(List.of(MINUS_EQ, EOF), types("-="));
    }

    @Test
    void testOptionalChainVersusTernary() {
        // "a?.5:b" is a ternary with a decimal, not an optional chain
        assertEquals(List.of(IDENT, QUES, NUMBER, COLON, IDENT, EOF), types("a?.5:b"));
        assertEquals(List.of(IDENT, QUES_DOT, IDENT, EOF), types("a?.b"));
    }

    @Test
    void testNumbers() {
        for (String number : new String[]{"0", "123", "1.5", ".5", "1e10", "1E10", "1e+10", "1e-10", "0xFF", "0XDEADBEEF"}) {
            assertEquals(List.of(NUMBER, EOF), types(number), number);
            assertEquals(number, firstText(number));
        }
        assertEquals(List.of(NUMBER, DOT, IDENT, EOF), types("1.toString"));
    }

    @Test
    void testStrings() {
        assertEquals(List.of(D_STRING, EOF), types("\"hello\\\"world\""));
        assertEquals(List.of(S_STRING, EOF), types("'hello\\'world'"));
        assertEquals(List.of(S_STRING, EOF), types("''"));
        assertEquals("'world'", firstText("'world'"));
        ParserException e = assertThrows(ParserException.class, () -> tokenize("'open"));
        assertTrue(e.getMessage().startsWith("unterminated string"));
        assertThrows(ParserException.class, () -> tokenize("'line\nbreak'"));
    }

    @Test
    void testComments() {
        assertEquals(List.of(L_COMMENT, EOF), types("// comment"));
        assertEquals(List.of(L_COMMENT, WS_LF, IDENT, EOF), types("// comment\ncode"));
        assertEquals(List.of(B_COMMENT, WS, IDENT, EOF), types("/* multi\nline */ code"));
        assertThrows(ParserException.class, () -> tokenize("/* never closed"));
    }

    @Test
    void testRegexVersusDivision() {
        assertEquals(List.of(IDENT, WS, EQ, WS, REGEX, EOF), types("a = /test/"));
        assertEquals(List.of(RETURN, WS, REGEX, EOF), types("return /test/"));
        assertEquals(List.of(IDENT, WS, SLASH, WS, IDENT, EOF), types("a / b"));
        assertEquals(List.of(NUMBER, SLASH, NUMBER, EOF), types("6/2"));
        assertEquals(List.of(R_PAREN, WS, SLASH, WS, NUMBER, EOF), types(") / 2"));
        assertEquals(List.of(IDENT, WS, SLASH_EQ, WS, NUMBER, EOF), types("x /= 2"));
        List<Token> tokens = tokenize("return /[/]/gi");
        assertEquals(REGEX, tokens.get(2).type);
        assertEquals("/[/]/gi", tokens.get(2).getText());
    }

    @Test
    void testTokenTypeClassification() {
        assertFalse(WS.isPrimary());
        assertFalse(L_COMMENT.isPrimary());
        assertTrue(EOF.isPrimary());
        assertTrue(IDENT.isPrimary());
        assertEquals(Boolean.TRUE, L_PAREN.regexAllowedAfter());
        assertEquals(Boolean.FALSE, IDENT.regexAllowedAfter());
        assertNull(DOT.regexAllowedAfter());
        // comments keep whatever the previous token decided
        assertEquals(List.of(IDENT, WS, EQ, WS, B_COMMENT, WS, REGEX, EOF), types("a = /* c */ /x/"));
    }

    @Test
    void testTemplates() {
        assertEquals(List.of(BACKTICK, BACKTICK, EOF), types("``"));
        assertEquals(List.of(BACKTICK, T_STRING, BACKTICK, EOF), types("`hello`"));
        assertEquals(List.of(BACKTICK, T_STRING, DOLLAR_L_CURLY, IDENT, R_CURLY, T_STRING, BACKTICK, EOF),
                types("`hello ${name}!`"));
        assertEquals(List.of(BACKTICK, DOLLAR_L_CURLY, IDENT, WS, PLUS, WS,
                BACKTICK, DOLLAR_L_CURLY, IDENT, R_CURLY, BACKTICK, R_CURLY, BACKTICK, EOF), types("`${a + `${b}`}`"));
        assertEquals(List.of(BACKTICK, DOLLAR_L_CURLY, L_CURLY, IDENT, COLON, NUMBER, R_CURLY, DOT, IDENT, R_CURLY, BACKTICK, EOF),
                types("`${{a:1}.a}`"));
        ParserException e = assertThrows(ParserException.class, () -> tokenize("`open"));
        assertTrue(e.getMessage().contains("template literal"));
    }

    @Test
    void testKeywords() {
        assertEquals(List.of(NULL, EOF), types("null"));
        assertEquals(List.of(FUNCTION, EOF), types("function"));
        assertEquals(List.of(CONTINUE, EOF), types("continue"));
        assertEquals(List.of(INSTANCEOF, EOF), types("instanceof"));
        assertEquals(List.of(OF, EOF), types("of"));
        // resolved by the evaluator, not keywords here
        assertEquals(List.of(IDENT, EOF), types("this"));
        assertEquals(List.of(IDENT, EOF), types("undefined"));
        assertEquals(List.of(IDENT, EOF), types("functions"));
    }

    @Test
    void testIdentifiers() {
        for (String ident : new String[]{"foo", "_private", "$el", "x123", "αβγ", "日本語"}) {
            assertEquals(List.of(IDENT, EOF), types(ident), ident);
        }
    }

    @Test
    void testWhitespace() {
        assertEquals(List.of(WS, IDENT, EOF), types("  foo"));
        assertEquals(List.of(IDENT, WS, IDENT, EOF), types("a\tb"));
        assertEquals(List.of(IDENT, WS_LF, IDENT, EOF), types("a\nb"));
        assertEquals(List.of(IDENT, WS_LF, IDENT, EOF), types("a\r\nb"));
    }

    @Test
    void testPositions() {
        List<Token> tokens = tokenize("a\nbc def\n  g");
        assertEquals(0, tokens.get(0).line);
        Token def = tokens.get(4);
        assertEquals("def", def.getText());
        assertEquals(1, def.line);
        assertEquals(3, def.col);
        assertEquals(5, def.pos);
        Token g = tokens.get(6);
        assertEquals(2, g.line);
        assertEquals(2, g.col);
        assertEquals("3:3", g.getPositionDisplay());
    }

    @Test
    void testPrimaryTokens() {
        List<Token> tokens = JsLexer.getTokens(Resource.text("a /* c */ +\n// x\n b"));
        List<TokenType> types = tokens.stream().map(t -> t.type).collect(Collectors.toList());
        assertEquals(List.of(IDENT, PLUS, IDENT, EOF), types);
        assertTrue(tokens.get(2).isPrecededByNewLine());
        assertFalse(tokens.get(1).isPrecededByNewLine());
    }

}
