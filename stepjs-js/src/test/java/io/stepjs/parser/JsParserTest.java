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
import io.stepjs.js.NodeUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsParserTest {

    private static Node parse(String text) {
        return new JsParser(Resource.text(text)).parse();
    }

    private static void expr(String text, String json) {
        Node statement = parse(text).findAll(NodeType.STATEMENT).get(0);
        NodeUtils.assertEquals(text, statement.getFirst(), json);
    }

    private static void program(String text, String json) {
        NodeUtils.assertEquals(text, parse(text), json);
    }

    private static ParserException error(String text) {
        return assertThrows(ParserException.class, () -> parse(text));
    }

    private static Token firstNumber(String text) {
        for (Node node : parse(text).findAll(NodeType.TOKEN)) {
            if (node.isToken(TokenType.NUMBER)) {
                return node.token;
            }
        }
        throw new AssertionError("no number in: " + text);
    }

    @Test
    void testNodeNavigation() {
        Node program = parse("var a  =  1; // one\nvar b = 2;");
        assertEquals(NodeType.PROGRAM, program.type);
        Node statement = program.getFirst();
        assertSame(program, statement.getParent());
        assertEquals("var a  =  1;", statement.getTextIncludingWhitespace());
        assertEquals("vara=1;", statement.getText());
        assertEquals(TokenType.VAR, statement.getFirstToken().type);
        assertEquals(2, program.findImmediateChildren(NodeType.STATEMENT).size());
        assertEquals(2, program.findAll(NodeType.VAR_DECL).size());
        assertTrue(program.getLast().isToken(TokenType.EOF));
    }

    @Test
    void testProgram() {
        program(";", "{PROGRAM:[';','EOF']}");
        program(";;", "{PROGRAM:[';',';','EOF']}");
        program("1;2", "{PROGRAM:[[1,';'],2,'EOF']}");
        program("1\n2", "{PROGRAM:[1,2,'EOF']}");
        program("1 \n 2 ", "{PROGRAM:[1,2,'EOF']}");
        program("1;2;", "{PROGRAM:[[1,';'],[2,';'],'EOF']}");
        program("", "{PROGRAM:'EOF'}");
    }

    @Test
    void testFunctionDeclarationsWithoutSemicolons() {
        program("function A() {} function B() {}",
                "{PROGRAM:[['function','$A',['(',')'],['{','}']],['function','$B',['(',')'],['{','}']],'EOF']}");
    }

    @Test
    void testBlock() {
        expr("{ 1; 2 }", "['{',[1,';'],2,'}']");
        expr("{ 1; 2; }", "['{',[1,';'],[2,';'],'}']");
        expr("{ 1;; 2 }", "['{',[1,';'],';',2,'}']");
    }

    @Test
    void testAddMul() {
        expr("1 + 2", "[1,'+',2]");
        expr("1 + 2 + 3", "[[1,'+',2],'+',3]");
        expr("1 - 2 + 3", "[[1,'-',2],'+',3]");
        expr("6 / 2", "[6,'/',2]");
        expr("1 * 2 + 3", "[[1,'*',2],'+',3]");
        expr("1 + 2 * 3", "[1,'+',[2,'*',3]]");
        expr("7 % 2 * 3", "[[7,'%',2],'*',3]");
    }

    @Test
    void testExp() {
        expr("2 ** 3", "[2,'**',3]");
        expr("1 ** 2 ** 3", "[1,'**',[2,'**',3]]");
        expr("(2 ** 3) ** 2", "[[2,'**',3],'**',2]");
    }

    @Test
    void testPrePost() {
        expr("a++", "['$a','++']");
        expr("a = b++", "['$a','=',['$b','++']]");
        expr("--b", "['--','$b']");
        expr("a = --b", "['$a','=',['--','$b']]");
        expr("-a * 2", "[['-','$a'],'*',2]");
    }

    @Test
    void testBitwise() {
        expr("5 | 1 | 2", "[[5,'|',1],'|',2]");
        expr("1 | 2 & 3", "[1,'|',[2,'&',3]]");
        expr("1 << 2 + 3", "[1,'<<',[2,'+',3]]");
        expr("n >>>= 0", "['$n','>>>=',0]");
    }

    @Test
    void testPrimitives() {
        expr("1", "1");
        expr("null", "null");
        expr("true", "true");
        expr("'foo'", "'foo'");
        expr("\"foo\"", "'foo'");
        expr("'it\\'s'", "\"it's\"");
    }

    @Test
    void testParen() {
        expr("(1)", "1");
        expr("(1 + 3) * 2", "[[1,'+',3],'*',2]");
        expr("2 * (1 + 3)", "[2,'*',[1,'+',3]]");
    }

    @Test
    void testPathExpr() {
        expr("a", "'$a'");
        expr("a.b", "['$a','.','$b']");
        expr("a.b.c", "[['$a','.','$b'],'.','$c']");
        expr("a.b[c]", "[['$a','.','$b'],'[','$c',']']");
        expr("a[b].c[d]", "[[['$a','[','$b',']'],'.','$c'],'[','$d',']']");
        expr("a['b']['c']", "[['$a','[','b',']'],'[','c',']']");
        expr("a[b + 'c']", "['$a','[',['$b','+','c'],']']");
        expr("(a).b", "['$a','.','$b']");
        expr("a.null", "['$a','.',null]");
        expr("a.default", "['$a','.','default']");
    }

    @Test
    void testOptionalChainAndNullish() {
        expr("a?.b", "['$a','?.','$b']");
        expr("a?.b.c", "[['$a','?.','$b'],'.','$c']");
        expr("a ?? b", "['$a','??','$b']");
        expr("a ? .5 : 1", "['$a','?',0.5,':',1]");
    }

    @Test
    void testObject() {
        expr("{}", "['{','}']");
        expr("{ a: 1 }", "['{',['$a:',1],'}']");
        expr("{ a: 'b', c: 2 }", "['{',['$a:','b'],['$c:',2],'}']");
        expr("{ 'x-y': 1 }", "['{',['x-y:',1],'}']");
        expr("{ a, b }", "['{','$a','$b','}']");
        expr("{ if: 1 }", "['{',['if:',1],'}']");
    }

    @Test
    void testArray() {
        expr("[]", "['[',']']");
        expr("[1]", "['[',1,']']");
        expr("[1,]", "['[',1,']']");
        expr("[a, 'b']", "['[','$a','b',']']");
        expr("[1,,3]", "['[',1,',',3,']']");
    }

    @Test
    void testFnExpr() {
        expr("function(){}", "['function',['(',')'],['{','}']]");
        expr("function(a){ return a }", "['function',['(','$a',')'],['{',['return','$a'],'}']]");
        expr("function(a, b){ return { a, b } }",
                "['function',['(',['$a',','],'$b',')'],['{',['return',['{','$a','$b','}']],'}']]");
        expr("function f(){}", "['function','$f',['(',')'],['{','}']]");
    }

    @Test
    void testFnCall() {
        expr("foo()", "['$foo','(',[],')']");
        expr("a.b()", "[['$a','.','$b'],'(',[],')']");
        expr("read('x')", "['$read','(','x',')']");
        expr("f(1, 2)", "['$f','(',[[1,','],2],')']");
        expr("f()()", "[['$f','(',[],')'],'(',[],')']");
    }

    @Test
    void testArrow() {
        expr("() => true", "[['(',')'],'=>',true]");
        expr("() => {}", "[['(',')'],'=>',['{','}']]");
        expr("a => true", "['$a','=>',true]");
        expr("(a) => true", "[['(','$a',')'],'=>',true]");
        expr("(a, b) => true", "[['(',['$a',','],'$b',')'],'=>',true]");
        expr("a => { return true }", "['$a','=>',['{',['return',true],'}']]");
    }

    @Test
    void testVarStatement() {
        expr("var foo", "['var','$foo']");
        expr("var foo = 1", "['var',['$foo','=',1]]");
        expr("var foo, bar", "['var','$foo',',','$bar']");
        expr("var a, b = 1 + 2", "['var','$a',',',['$b','=',[1,'+',2]]]");
        expr("let x = 1", "['let',['$x','=',1]]");
        expr("const y = 2", "['const',['$y','=',2]]");
    }

    @Test
    void testAssign() {
        expr("a = 1", "['$a','=',1]");
        expr("a.b = 1", "[['$a','.','$b'],'=',1]");
        expr("a = b = 1", "['$a','=',['$b','=',1]]");
        expr("a += 2 * 3", "['$a','+=',[2,'*',3]]");
        expr("a ||= b", "['$a','||=','$b']");
    }

    @Test
    void testCommaExpression() {
        expr("a, b, c", "['$a',',','$b',',','$c']");
    }

    @Test
    void testIfStatement() {
        expr("if (true) a = 1", "['if','(',true,')',['$a','=',1]]");
        expr("if (true) a = 1; else a = 2", "['if','(',true,')',[['$a','=',1],';'],'else',['$a','=',2]]");
    }

    @Test
    void testLoops() {
        expr("for(;;){}", "['for','(',[],';',[],';',[],')',['{','}']]");
        expr("for (var i = 0; i < 3; i++) x", "['for','(',['var',['$i','=',0]],';',['$i','<',3],';',['$i','++'],')','$x']");
        expr("for (k in o) x", "['for','(','$k','in','$o',')','$x']");
        expr("for (const v of a) x", "['for','(',['const','$v'],'of','$a',')','$x']");
        expr("while (a) b", "['while','(','$a',')','$b']");
        expr("do a++; while (b)", "['do',[['$a','++'],';'],'while','(','$b',')']");
    }

    @Test
    void testSwitch() {
        expr("switch (a) { case 1: b; default: c }",
                "['switch','(','$a',')','{',['case',1,':',['$b',';']],['default',':','$c'],'}']");
    }

    @Test
    void testJumpsAndLabels() {
        expr("foo: a", "['$foo',':','$a']");
        expr("while (a) { break }", "['while','(','$a',')',['{','break','}']]");
        expr("while (a) { continue foo }", "['while','(','$a',')',['{',['continue','$foo'],'}']]");
        expr("throw e", "['throw','$e']");
    }

    @Test
    void testReturnNewLine() {
        expr("function f() { return\n1 }", "['function','$f',['(',')'],['{','return',1,'}']]");
    }

    @Test
    void testUnaryLogic() {
        expr("!foo || bar", "[['!','$foo'],'||','$bar']");
        expr("a && b || c", "[['$a','&&','$b'],'||','$c']");
        expr("a || b && c", "['$a','||',['$b','&&','$c']]");
        expr("a < b == c", "[['$a','<','$b'],'==','$c']");
        expr("x = a >= b", "['$x','=',['$a','>=','$b']]");
    }

    @Test
    void testTernary() {
        expr("true ? 'foo' : bar", "[true,'?','foo',':','$bar']");
        expr("0 && 1 ? 'foo' : bar", "[[0,'&&',1],'?','foo',':','$bar']");
    }

    @Test
    void testTryStmt() {
        expr("try {} catch (e) {}", "['try',['{','}'],'catch','(','$e',')',['{','}']]");
        expr("try {} finally {}", "['try',['{','}'],'finally',['{','}']]");
        expr("try {} catch (e) {} finally {}", "['try',['{','}'],'catch','(','$e',')',['{','}'],'finally',['{','}']]");
        expr("try {} catch {}", "['try',['{','}'],'catch',['{','}']]");
    }

    @Test
    void testTypeOfInstanceOfDelete() {
        expr("typeof 'foo' === 'string'", "[['typeof','foo'],'===','string']");
        expr("foo instanceof Foo", "['$foo','instanceof','$Foo']");
        expr("delete a.b", "['delete',['$a','.','$b']]");
    }

    @Test
    void testNewExprPrecedence() {
        expr("new Foo()", "['new',['$Foo','(',[],')']]");
        expr("new Foo().bar", "[['new',['$Foo','(',[],')']],'.','$bar']");
        expr("new Foo().bar()", "[[['new',['$Foo','(',[],')']],'.','$bar'],'(',[],')']");
        expr("new Foo.bar()", "['new',[['$Foo','.','$bar'],'(',[],')']]");
        expr("new Foo", "['new','$Foo']");
    }

    @Test
    void testTemplate() {
        expr("``", "['`','`']");
        expr("`foo`", "['`','foo','`']");
        expr("`${foo}`", "['`','${','$foo','}','`']");
        expr("`${1 + 2}`", "['`','${',[1,'+',2],'}','`']");
        expr("`a${b}c`", "['`','a','${','$b','}','c','`']");
    }

    @Test
    void testWhiteSpaceCounting() {
        Token token = firstNumber("/* */  1");
        assertEquals(0, token.line);
        assertEquals(7, token.col);
        assertEquals(7, token.pos);
        token = firstNumber("/* \n* \n*/\n 1");
        assertEquals(3, token.line);
        assertEquals(1, token.col);
        assertEquals(11, token.pos);
        token = firstNumber("// foo \n // bar \n1");
        assertEquals(2, token.line);
        assertEquals(0, token.col);
        token = firstNumber("\n  \n  1");
        assertEquals(2, token.line);
        assertEquals(2, token.col);
        assertEquals(6, token.pos);
    }

    @Test
    void testStatementsNeedSeparators() {
        error("1 2");
        error("a = 1 b = 2");
        program("a = 1\nb = 2", "{PROGRAM:[['$a','=',1],['$b','=',2],'EOF']}");
    }

    @Test
    void testSyntaxErrors() {
        error("function");
        error("`");
        error("'abc");
        error("/* open");
        error("const a");
        error("if (a");
        error("a +");
        error("switch (a) { default: 1; default: 2 }");
        error("try {}");
    }

    @Test
    void testUnsupportedSyntax() {
        assertTrue(error("/foo/").getMessage().contains("regular expression"));
        assertTrue(error("var {a} = b").getMessage().contains("destructuring"));
        assertTrue(error("var [a] = b").getMessage().contains("destructuring"));
        assertTrue(error("[...a]").getMessage().contains("spread"));
        assertTrue(error("f(...a)").getMessage().contains("spread"));
        assertTrue(error("function* g() {}").getMessage().contains("generator"));
    }

    @Test
    void testErrorPosition() {
        ParserException e = error("var a = 1;\nvar b = ;");
        assertTrue(e.getMessage().contains("2:"), e.getMessage());
    }

}
