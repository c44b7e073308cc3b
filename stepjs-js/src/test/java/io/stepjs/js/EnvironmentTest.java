package io.stepjs.js;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentTest {

    @Test
    void testGlobalVarsLiveOnGlobalObject() {
        JsObject global = new JsObject();
        Environment env = Environment.global(global);
        env.declare("a", 1, BindingType.VAR);
        assertEquals(1, global.get("a"));
        env.declare("b", 2, BindingType.LET);
        assertFalse(global.hasOwnProperty("b"));
        assertEquals(2, env.lookup("b"));
        assertTrue(env.isGlobal());
    }

    @Test
    void testLookupWalksParents() {
        Environment global = Environment.global(new JsObject());
        global.declare("x", "outer", BindingType.LET);
        Environment fn = new Environment(global, true);
        Environment block = new Environment(fn, false);
        assertEquals("outer", block.lookup("x"));
        block.declare("x", "inner", BindingType.LET);
        assertEquals("inner", block.lookup("x"));
        assertEquals("outer", fn.lookup("x"));
        assertSame(fn, block.varScope());
    }

    @Test
    void testUndeclared() {
        Environment env = new Environment(Environment.global(new JsObject()), true);
        JsException e = assertThrows(JsException.class, () -> env.lookup("nope"));
        assertEquals("ReferenceError", e.getErrorType());
        assertEquals("nope is not defined", e.getMessage());
        assertFalse(env.has("nope"));
    }

    @Test
    void testSloppyAndStrictAssignment() {
        JsObject global = new JsObject();
        Environment env = new Environment(Environment.global(global), true);
        env.assign("created", 5, false);
        assertEquals(5, global.get("created"));
        assertThrows(JsException.class, () -> env.assign("missing", 5, true));
        env.assign("created", 6, true);
        assertEquals(6, global.get("created"));
    }

    @Test
    void testTemporalDeadZone() {
        Environment env = new Environment(Environment.global(new JsObject()), false);
        env.declareUninitialized("t", BindingType.LET);
        assertTrue(env.has("t"));
        JsException e = assertThrows(JsException.class, () -> env.lookup("t"));
        assertEquals("Cannot access 't' before initialization", e.getMessage());
        assertThrows(JsException.class, () -> env.assign("t", 1, false));
        env.initialize("t", 1, BindingType.LET);
        assertEquals(1, env.lookup("t"));
    }

    @Test
    void testConst() {
        Environment env = new Environment(Environment.global(new JsObject()), true);
        env.declare("c", 1, BindingType.CONST);
        JsException e = assertThrows(JsException.class, () -> env.assign("c", 2, false));
        assertEquals("TypeError", e.getErrorType());
        assertEquals("Assignment to constant variable.", e.getMessage());
    }

    @Test
    void testRedeclaration() {
        Environment env = new Environment(Environment.global(new JsObject()), true);
        env.declare("v", 1, BindingType.VAR);
        env.declare("v", 2, BindingType.VAR);
        assertEquals(2, env.lookup("v"));
        env.declare("l", 1, BindingType.LET);
        JsException e = assertThrows(JsException.class, () -> env.declare("l", 2, BindingType.LET));
        assertEquals("SyntaxError", e.getErrorType());
    }

    @Test
    void testHoistedVarKeepsValue() {
        Environment env = new Environment(Environment.global(new JsObject()), true);
        env.declare("h", 3, BindingType.VAR);
        env.declareVar("h");
        assertEquals(3, env.lookup("h"));
        env.declareVar("fresh");
        assertEquals(Terms.UNDEFINED, env.lookup("fresh"));
    }

    @Test
    void testCopyForIteration() {
        Environment env = new Environment(Environment.global(new JsObject()), false);
        env.declare("i", 0, BindingType.LET);
        Environment next = env.copyForIteration();
        next.assign("i", 1, false);
        assertEquals(0, env.lookup("i"));
        assertEquals(1, next.lookup("i"));
        assertSame(env.getParent(), next.getParent());
    }

}
