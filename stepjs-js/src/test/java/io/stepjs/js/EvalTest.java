package io.stepjs.js;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EvalTest extends EvalBase {

    @Test
    void testDev() {

    }

    @Test
    void testNumbers() {
        assertEquals(1, eval("1"));
        assertEquals(1, eval("1.0"));
        assertEquals(0.5d, eval(".5"));
        assertEquals(65280, eval("0x00FF00"));
        assertEquals(7, eval("1 + 2 * 3"));
        assertEquals(2.5d, eval("10 / 4"));
        assertEquals(1, eval("7 % 3"));
        assertEquals(1024, eval("2 ** 10"));
        assertEquals(0.30000000000000004d, eval("0.1 + 0.2"));
        assertEquals(Double.POSITIVE_INFINITY, eval("1 / 0"));
        assertEquals(Double.NEGATIVE_INFINITY, eval("1 / -0"));
        assertEquals("number", eval("typeof NaN"));
        assertEquals(true, eval("isNaN(0 / 0)"));
        assertEquals(-8, eval("~7"));
        assertEquals(2, eval("10 >> 2"));
        assertEquals(6, eval("3 << 1"));
        assertEquals(6, eval("5 ^ 3"));
    }

    @Test
    void testHexLiterals() {
        assertEquals(255, eval("0xff"));
        assertEquals(29, eval("0x1D"));
        assertEquals(16, eval("0x10"));
        assertEquals(255, eval("Number('0xff')"));
        assertEquals(255, eval("'0xff' * 1"));
        assertEquals(true, eval("isNaN(Number('0xfg'))"));
        assertEquals(-255, eval("parseInt('-0xff')"));
        assertEquals(0, eval("parseFloat('0x10')"));
    }

    @Test
    void testHugeStringsAreRefused() {
        assertEquals("RangeError: Invalid string length", eval("var r; try { 'ab'.repeat(1e9) } catch (e) { r = e.name + ': ' + e.message } r"));
        assertEquals("RangeError: Invalid string length", eval("var r; try { 'x'.padStart(1e9) } catch (e) { r = e.name + ': ' + e.message } r"));
        assertEquals("ababab", eval("'ab'.repeat(3)"));
    }

    @Test
    void testStrings() {
        assertEquals("ab", eval("'a' + 'b'"));
        assertEquals("a1", eval("'a' + 1"));
        assertEquals("12", eval("1 + '2'"));
        assertEquals(3, eval("'5' - 2"));
        assertEquals(3, eval("'abc'.length"));
        assertEquals("b", eval("'abc'[1]"));
        assertEquals("HELLO", eval("'hello'.toUpperCase()"));
        assertEquals(3, eval("'a,b,c'.split(',').length"));
        assertEquals("a is 6!", eval("var a = 5; `a is ${a + 1}!`"));
        assertEquals("0.5", eval("'' + 0.5"));
        assertEquals("1e+21", eval("'' + 1e21"));
        assertEquals("0.10", eval("(0.1).toFixed(2)"));
        assertEquals("ff", eval("(255).toString(16)"));
    }

    @Test
    void testEquality() {
        assertEquals(true, eval("1 == '1'"));
        assertEquals(false, eval("1 === '1'"));
        assertEquals(true, eval("null == undefined"));
        assertEquals(false, eval("null === undefined"));
        assertEquals(false, eval("NaN == NaN"));
        assertEquals(true, eval("[1] == 1"));
        assertEquals(true, eval("var o = {}; o == o"));
        assertEquals(false, eval("({}) == ({})"));
        assertEquals(true, eval("'b' > 'a'"));
        assertEquals(true, eval("2 >= 2"));
    }

    @Test
    void testLogical() {
        assertEquals("x", eval("0 || 'x'"));
        assertEquals(2, eval("1 && 2"));
        assertEquals(5, eval("null ?? 5"));
        assertEquals(0, eval("0 ?? 5"));
        assertEquals(false, eval("!'a'"));
        assertEquals("big", eval("var x = 5; x > 3 ? 'big' : 'small'"));
        assertEquals(1, eval("var a = 0; a ||= 1; a"));
        assertEquals(0, eval("var a = 0; a &&= 1; a"));
    }

    @Test
    void testVariables() {
        assertEquals(3, eval("var a = 1; a += 2; a"));
        assertEquals(1, eval("let x = 1; { let x = 2; } x"));
        assertEquals(42, eval("var r = f(); function f() { return 42; } r"));
        assertEquals("undefined", eval("var t = typeof v; var v = 1; t"));
        assertEquals("undefined", eval("typeof nope"));
        assertEquals(5, eval("b = 5; b"));
        assertEquals(3, eval("var i = 1, j = 2; i + j"));
    }

    @Test
    void testTemporalDeadZone() {
        EngineException e = evalFails("x; let x = 1");
        assertTrue(e.getMessage().contains("ReferenceError: Cannot access 'x' before initialization"));
    }

    @Test
    void testConstAssignment() {
        EngineException e = evalFails("const c = 1; c = 2");
        assertTrue(e.getMessage().contains("TypeError: Assignment to constant variable."));
    }

    @Test
    void testUndefinedVariable() {
        EngineException e = evalFails("var a = 1; missing + a");
        assertTrue(e.getMessage().contains("ReferenceError: missing is not defined"));
    }

    @Test
    void testFunctions() {
        assertEquals(3, eval("function mk() { var c = 0; return function() { return ++c; }; } var f = mk(); f(); f(); f()"));
        assertEquals(5, eval("var add = (a, b) => a + b; add(2, 3)"));
        assertEquals(16, eval("var sq = x => x * x; sq(4)"));
        assertEquals(10, eval("var f = (x) => { return x * 2; }; f(5)"));
        assertEquals(3, eval("function f() { return arguments.length; } f(1, 2, 3)"));
        assertEquals(Terms.UNDEFINED, eval("function f(a, b) { return b; } f(1)"));
        assertEquals(Terms.UNDEFINED, eval("function f() { } f()"));
        assertEquals(55, eval("function fib(n) { return n < 2 ? n : fib(n - 1) + fib(n - 2); } fib(10)"));
        assertEquals("foo", eval("var foo = function() {}; foo.name"));
        assertEquals("bar", eval("var o = { bar: () => 1 }; o.bar.name"));
        assertEquals(120, eval("var f = function fact(n) { return n <= 1 ? 1 : n * fact(n - 1); }; f(5)"));
        assertEquals(2, eval("var f = function(a, b) {}; f.length"));
    }

    @Test
    void testThis() {
        assertEquals(2, eval("var o = { v: 2, m: function() { return this.v; } }; o.m()"));
        assertEquals(3, eval("function f(a) { return this.x + a; } var o = { x: 1 }; f.call(o, 2)"));
        assertEquals(6, eval("function f(a) { return this.x + a; } var o = { x: 1 }; f.apply(o, [5])"));
        assertEquals(11, eval("function f(a) { return this.x + a; } var o = { x: 1 }; var g = f.bind(o, 10); g()"));
        assertEquals(7, eval("var o = { v: 7, m: function() { var a = () => this.v; return a(); } }; o.m()"));
        assertEquals(true, eval("this === globalThis"));
        assertEquals(true, eval("function f() { return this; } f() === globalThis"));
    }

    @Test
    void testConstructors() {
        assertEquals("hi x", eval("function P(n) { this.n = n; } P.prototype.hi = function() { return 'hi ' + this.n; }; new P('x').hi()"));
        assertEquals(true, eval("function A() {} var a = new A(); a instanceof A"));
        assertEquals(true, eval("[] instanceof Array"));
        assertEquals(true, eval("({}) instanceof Object"));
        assertEquals(2, eval("function F() { this.a = 1; return { b: 2 }; } new F().b"));
        assertEquals(1, eval("function F() { this.a = 1; } var f = new F; f.a"));
        assertEquals(true, eval("function F() {} new F().constructor === F"));
        EngineException e = evalFails("var f = () => 1; new f()");
        assertTrue(e.getMessage().contains("TypeError: f is not a constructor"));
    }

    @Test
    void testLoops() {
        assertEquals(10, eval("var s = 0; for (var i = 0; i < 5; i++) { s += i; } s"));
        assertEquals("0,1,2", eval("var fs = []; for (let i = 0; i < 3; i++) { fs.push(() => i); } fs.map(f => f()).join(',')"));
        assertEquals("3,3,3", eval("var fs = []; for (var i = 0; i < 3; i++) { fs.push(() => i); } fs.map(f => f()).join(',')"));
        assertEquals(5, eval("var i = 0; do { i++; } while (i < 5); i"));
        assertEquals(3, eval("var i = 0; while (i < 3) i++; i"));
        assertEquals(6, eval("var s = 0; for (var i = 0; i < 10; i++) { if (i == 5) break; if (i % 2) continue; s += i; } s"));
        assertEquals(4, eval("var n = 0; for (;;) { if (++n > 3) break; } n"));
    }

    @Test
    void testLabels() {
        assertEquals(2, eval("var c = 0; outer: for (var i = 0; i < 3; i++) { for (var j = 0; j < 3; j++) { if (j == 1) continue outer; if (i == 2) break outer; c++; } } c"));
        assertEquals(1, eval("var r = 0; block: { r = 1; break block; r = 2; } r"));
    }

    @Test
    void testForInOf() {
        assertEquals("a,b", eval("var o = { a: 1, b: 2 }; var k = []; for (var key in o) k.push(key); k.join()"));
        assertEquals("0,1", eval("var k = []; for (let i in ['x', 'y']) k.push(i); k.join()"));
        assertEquals(6, eval("var s = 0; for (const v of [1, 2, 3]) s += v; s"));
        assertEquals("a-b-c", eval("var r = []; for (var c of 'abc') r.push(c); r.join('-')"));
        assertEquals("a,b", eval("function P() { this.a = 1; } P.prototype.b = 2; var k = []; for (var x in new P()) k.push(x); k.join()"));
        assertEquals(0, eval("var n = 0; for (var x of null) n++; n"));
        EngineException e = evalFails("for (var x of 5) {}");
        assertTrue(e.getMessage().contains("TypeError: 5 is not iterable"));
    }

    @Test
    void testSwitch() {
        assertEquals("one,few,many", eval("function f(x) { switch (x) { case 1: return 'one'; case 2: case 3: return 'few'; default: return 'many'; } } [f(1), f(3), f(9)].join()"));
        assertEquals("bc", eval("var r = ''; switch (2) { case 1: r += 'a'; case 2: r += 'b'; case 3: r += 'c'; break; case 4: r += 'd'; } r"));
        assertEquals("d2", eval("var r; switch (5) { case 1: r = 1; break; default: r = 'd'; case 2: r += '2'; } r"));
        assertEquals(0, eval("var r = 0; switch ('1') { case 1: r = 1; } r"));
    }

    @Test
    void testExceptions() {
        assertEquals("boom", eval("var r; try { throw new Error('boom'); } catch (e) { r = e.message; } r"));
        assertEquals("f1", eval("var log = []; function f() { try { return 1; } finally { log.push('f'); } } var v = f(); log.join() + v"));
        assertEquals("TypeError: Cannot read properties of null (reading 'x')", eval("var r; try { null.x; } catch (e) { r = e.name + ': ' + e.message; } r"));
        assertEquals(2, eval("var r = 0; try { throw 1; } catch { r = 2; } r"));
        assertEquals(42, eval("var r; try { throw { code: 42 }; } catch (e) { r = e.code; } r"));
        assertEquals("inner,a", eval("var r = []; try { try { throw new Error('a'); } finally { r.push('inner'); } } catch (e) { r.push(e.message); } r.join()"));
        assertEquals(true, eval("var r; try { undefinedFn(); } catch (e) { r = e instanceof ReferenceError; } r"));
        assertEquals(true, eval("var r; try { null.x; } catch (e) { r = e instanceof TypeError && e instanceof Error; } r"));
        assertEquals("Error: x", eval("String(new Error('x'))"));
        assertEquals(3, eval("var n = 0; for (var i = 0; i < 3; i++) { try { continue; } finally { n++; } } n"));
    }

    @Test
    void testObjects() {
        assertEquals(1, eval("var o = { a: { b: 1 } }; o.a.b"));
        assertEquals(Terms.UNDEFINED, eval("var o = null; o?.a.b"));
        assertEquals(Terms.UNDEFINED, eval("var o = null; o?.f()"));
        assertEquals("b", eval("var o = { a: 1, b: 2 }; delete o.a; Object.keys(o).join()"));
        assertEquals(5, eval("var o = {}; o['x' + 1] = 5; o.x1"));
        assertEquals(2, eval("var a = 1, b = 2; var o = { a, b }; o.b"));
        assertEquals("[object Object]", eval("'' + {}"));
        assertEquals(43, eval("var o = { valueOf: function() { return 42; } }; o + 1"));
        assertEquals("custom", eval("var o = { toString: () => 'custom' }; `${o}`"));
        assertEquals(true, eval("var p = { x: 1 }; var o = { __proto__: p }; o.x === 1 && !o.hasOwnProperty('x')"));
        matchEval("var o = { a: 1, b: [1, 2], c: { d: 'e' } }; o", "{ a: 1, b: [1, 2], c: { d: 'e' } }");
    }

    @Test
    void testArrays() {
        assertEquals(3, eval("var a = [1, , 3]; a.length"));
        assertEquals(6, eval("var a = []; a[5] = 1; a.length"));
        assertEquals("1,2,3", eval("[3, 1, 2].sort().join()"));
        assertEquals(50, eval("[1, 2, 3].filter(x => x > 1).map(x => x * 10).reduce((a, b) => a + b, 0)"));
        assertEquals("1,2,3", eval("'' + [1, [2, 3]]"));
        assertEquals(true, eval("Array.isArray([])"));
        matchEval("[1, 'a', null, true]", "[1, 'a', null, true]");
    }

    @Test
    void testJsonAndMath() {
        assertEquals("{\"a\":[1,2],\"b\":\"x\"}", eval("JSON.stringify({ a: [1, 2], b: 'x' })"));
        assertEquals(1, eval("JSON.parse('{\"a\":1}').a"));
        assertEquals(5, eval("Math.max(1, 5, 3)"));
        assertEquals(3, eval("Math.floor(3.7)"));
    }

    @Test
    void testTypeof() {
        assertEquals("function", eval("typeof function() {}"));
        assertEquals("object", eval("typeof null"));
        assertEquals("object", eval("typeof []"));
        assertEquals("string", eval("typeof ''"));
        assertEquals("boolean", eval("typeof true"));
        assertEquals("undefined", eval("typeof undefined"));
    }

    @Test
    void testUpdateExpressions() {
        assertEquals(1, eval("var i = 1; i++"));
        assertEquals(2, eval("var i = 1; ++i"));
        assertEquals(0, eval("var i = 1; --i"));
        assertEquals(4, eval("var o = { n: 3 }; o.n++; o.n"));
        assertEquals(2, eval("var a = [1]; a[0]++; a[0]"));
    }

}
