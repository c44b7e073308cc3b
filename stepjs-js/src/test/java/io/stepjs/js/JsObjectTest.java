package io.stepjs.js;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsObjectTest extends EvalBase {

    @Test
    void testPutAndGet() {
        JsObject object = new JsObject();
        object.put("a", 1);
        object.put("b", "x");
        assertEquals(1, object.get("a"));
        assertEquals(Terms.UNDEFINED, object.get("missing"));
        assertSame(JsObject.NOT_FOUND, object.getProperty("missing"));
        assertEquals(Arrays.asList("a", "b"), object.keys());
    }

    @Test
    void testPrototypeLookup() {
        JsObject proto = new JsObject();
        proto.put("inherited", true);
        JsObject object = new JsObject(proto);
        object.put("own", 1);
        assertEquals(true, object.get("inherited"));
        assertTrue(object.hasProperty("inherited"));
        assertFalse(object.hasOwnProperty("inherited"));
        assertEquals(Arrays.asList("own", "inherited"), object.enumerableKeys());
        assertEquals(Arrays.asList("own"), object.keys());
    }

    @Test
    void testCyclicPrototype() {
        JsObject a = new JsObject();
        JsObject b = new JsObject(a);
        JsException e = assertThrows(JsException.class, () -> a.setPrototype(b));
        assertEquals("TypeError", e.getErrorType());
        assertNull(a.getPrototype());
    }

    @Test
    void testReadOnlyProperty() {
        JsObject object = new JsObject();
        object.defineOwnProperty("fixed", 1, false, true, false);
        object.put("fixed", 2);
        assertEquals(1, object.get("fixed"));
        assertFalse(object.delete("fixed"));
        assertThrows(JsException.class, () -> object.defineOwnProperty("fixed", 3, true, true, true));
    }

    @Test
    void testNonEnumerable() {
        JsObject object = new JsObject();
        object.defineOwnProperty("hidden", 1, true, false, true);
        object.put("shown", 2);
        assertEquals(Arrays.asList("shown"), object.keys());
        assertEquals(Arrays.asList("hidden", "shown"), object.getOwnKeys());
    }

    @Test
    void testFreeze() {
        JsObject object = new JsObject();
        object.put("a", 1);
        object.freeze();
        object.put("a", 2);
        object.put("b", 3);
        assertEquals(1, object.get("a"));
        assertFalse(object.hasOwnProperty("b"));
        assertTrue(object.isFrozen());
        assertFalse(object.delete("a"));
    }

    @Test
    void testPreventExtensions() {
        JsObject object = new JsObject();
        object.put("a", 1);
        object.preventExtensions();
        object.put("a", 2);
        object.put("b", 3);
        assertEquals(2, object.get("a"));
        assertFalse(object.hasOwnProperty("b"));
    }

    @Test
    void testToMap() {
        JsObject object = new JsObject();
        object.put("a", 1);
        object.defineOwnProperty("hidden", 2, true, false, true);
        Map<String, Object> map = object.toMap();
        assertEquals(1, map.size());
        assertEquals(1, map.get("a"));
    }

    @Test
    void testGuestFreeze() {
        assertEquals(1, eval("var o = Object.freeze({ a: 1 }); o.a = 2; o.b = 3; o.a"));
        assertEquals(true, eval("Object.isFrozen(Object.freeze({}))"));
        assertEquals(Terms.UNDEFINED, eval("var o = Object.freeze({ a: 1 }); o.b = 3; o.b"));
    }

    @Test
    void testGuestObjectFunctions() {
        matchEval("Object.keys({ a: 1, b: 2 })", "['a', 'b']");
        matchEval("Object.values({ a: 1, b: 2 })", "[1, 2]");
        matchEval("Object.entries({ a: 1 })", "[['a', 1]]");
        matchEval("Object.assign({ a: 1 }, { b: 2 })", "{ a: 1, b: 2 }");
        assertEquals(true, eval("var p = {}; Object.getPrototypeOf(Object.create(p)) === p"));
        assertEquals(5, eval("var o = {}; Object.defineProperty(o, 'x', { value: 5 }); o.x = 6; o.x"));
        assertEquals("", eval("var o = {}; Object.defineProperty(o, 'x', { value: 5 }); Object.keys(o).join()"));
    }

    @Test
    void testGuestPrototypeChain() {
        assertEquals(true, eval("var a = { x: 1 }; var b = Object.create(a); b.hasOwnProperty('x') === false && b.x === 1"));
        assertEquals(true, eval("Object.prototype.isPrototypeOf.call(Array.prototype, [])"));
        EngineException e = evalFails("var a = {}; var b = Object.create(a); Object.setPrototypeOf(a, b)");
        assertTrue(e.getMessage().contains("Cyclic __proto__ value"));
    }

}
