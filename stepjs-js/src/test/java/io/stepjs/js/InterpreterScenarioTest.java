package io.stepjs.js;

import io.stepjs.parser.ParserException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End to end programs driven the way an embedding host would, with an
 * {@code alert} native collecting output.
 */
class InterpreterScenarioTest {

    List<Object> output;

    @BeforeEach
    void beforeEach() {
        output = new ArrayList<>();
    }

    Bootstrap alert() {
        return (engine, global) -> engine.registerNative(global, "alert", (Invokable) args -> {
            output.add(args.length == 0 ? null : args[0]);
            return null;
        });
    }

    Bootstrap alertAnd(Bootstrap more) {
        return (engine, global) -> {
            alert().init(engine, global);
            more.init(engine, global);
        };
    }

    Engine run(String code) {
        return run(code, alert());
    }

    Engine run(String code, Bootstrap bootstrap) {
        Engine engine = new Engine(code, bootstrap);
        engine.run();
        return engine;
    }

    //==================================================================================================================
    // basics

    @Test
    void testArithmetic() {
        run("var result = 5 + 3;\nalert(result);");
        assertEquals(Arrays.asList(8), output);
    }

    @Test
    void testAssignments() {
        run("var x = 10;\nvar y = 20;\nvar sum = x + y;\nalert(sum);");
        assertEquals(Arrays.asList(30), output);
    }

    @Test
    void testFibonacci() {
        run("var result = [];\n"
                + "function fibonacci(n, output) {\n"
                + "  var a = 1, b = 1, sum;\n"
                + "  for (var i = 0; i < n; i++) {\n"
                + "    output.push(a);\n"
                + "    sum = a + b;\n"
                + "    a = b;\n"
                + "    b = sum;\n"
                + "  }\n"
                + "}\n"
                + "fibonacci(8, result);\n"
                + "alert(result.join(', '));");
        assertEquals(Arrays.asList("1, 1, 2, 3, 5, 8, 13, 21"), output);
    }

    //==================================================================================================================
    // functions

    @Test
    void testFunctionDeclaration() {
        run("function greet(name) {\n  return \"Hello, \" + name + \"!\";\n}\nvar message = greet(\"World\");\nalert(message);");
        assertEquals(Arrays.asList("Hello, World!"), output);
    }

    @Test
    void testRecursion() {
        run("function factorial(n) {\n  if (n <= 1) return 1;\n  return n * factorial(n - 1);\n}\nalert(factorial(5));");
        assertEquals(Arrays.asList(120), output);
    }

    @Test
    void testFunctionExpression() {
        run("var multiply = function(a, b) {\n  return a * b;\n};\nalert(multiply(4, 7));");
        assertEquals(Arrays.asList(28), output);
    }

    //==================================================================================================================
    // control flow

    @Test
    void testIfElse() {
        run("var x = 15;\nif (x > 10) {\n  alert(\"greater than 10\");\n} else {\n  alert(\"less than or equal to 10\");\n}");
        assertEquals(Arrays.asList("greater than 10"), output);
    }

    @Test
    void testForLoop() {
        run("var sum = 0;\nfor (var i = 1; i <= 5; i++) {\n  sum += i;\n}\nalert(sum);");
        assertEquals(Arrays.asList(15), output);
    }

    @Test
    void testWhileLoop() {
        run("var count = 0;\nvar sum = 0;\nwhile (count < 4) {\n  sum += count;\n  count++;\n}\nalert(sum);");
        assertEquals(Arrays.asList(6), output);
    }

    //==================================================================================================================
    // arrays and objects

    @Test
    void testArrayOperations() {
        run("var arr = [1, 2, 3];\narr.push(4);\nalert(arr.length);\nalert(arr[3]);");
        assertEquals(Arrays.asList(4, 4), output);
    }

    @Test
    void testObjectProperties() {
        run("var person = {\n  name: \"John\",\n  age: 30\n};\nperson.city = \"New York\";\n"
                + "alert(person.name);\nalert(person.age);\nalert(person.city);");
        assertEquals(Arrays.asList("John", 30, "New York"), output);
    }

    @Test
    void testComplexArrays() {
        run("var numbers = [1, 2, 3, 4, 5];\n"
                + "var doubled = [];\n"
                + "var filtered = [];\n"
                + "// double each number\n"
                + "for (var i = 0; i < numbers.length; i++) {\n"
                + "  doubled.push(numbers[i] * 2);\n"
                + "}\n"
                + "/* keep the even ones */\n"
                + "for (var j = 0; j < doubled.length; j++) {\n"
                + "  if (doubled[j] % 2 === 0) {\n"
                + "    filtered.push(doubled[j]);\n"
                + "  }\n"
                + "}\n"
                + "alert(\"Original: \" + numbers.join(', '));\n"
                + "alert(\"Doubled: \" + doubled.join(', '));\n"
                + "alert(\"Even doubled: \" + filtered.join(', '));");
        assertEquals(Arrays.asList("Original: 1, 2, 3, 4, 5", "Doubled: 2, 4, 6, 8, 10", "Even doubled: 2, 4, 6, 8, 10"), output);
    }

    //==================================================================================================================
    // natives

    @Test
    void testCustomNative() {
        run("var result = customAdd(5, 3);\nalert(result);", alertAnd((engine, global) ->
                engine.registerNative(global, "customAdd", (Invokable) args ->
                        ((Number) args[0]).doubleValue() + ((Number) args[1]).doubleValue())));
        assertEquals(Arrays.asList(8), output);
    }

    @Test
    void testNativeWithCallback() {
        run("var numbers = [1, 2, 3, 4, 5];\n"
                + "var doubled = mapArray(numbers, function(x) {\n  return x * 2;\n});\n"
                + "alert(doubled.join(', '));", alertAnd((engine, global) ->
                engine.registerNative(global, "mapArray", (context, args) -> {
                    JsArray array = (JsArray) args[0];
                    List<Object> result = new ArrayList<>();
                    for (int i = 0; i < array.size(); i++) {
                        result.add(context.invoke(args[1], null, array.get(i), i));
                    }
                    return result;
                })));
        assertEquals(Arrays.asList("2, 4, 6, 8, 10"), output);
    }

    @Test
    void testMultipleNatives() {
        run("var result1 = customAdd(5, 3);\nvar result2 = customMultiply(4, 6);\nalert(result1);\nalert(result2);",
                alertAnd((engine, global) -> {
                    engine.registerNative(global, "customAdd", (Invokable) args ->
                            ((Number) args[0]).intValue() + ((Number) args[1]).intValue());
                    engine.registerNative(global, "customMultiply", (Invokable) args ->
                            ((Number) args[0]).intValue() * ((Number) args[1]).intValue());
                }));
        assertEquals(Arrays.asList(8, 24), output);
    }

    @Test
    void testNativeReturningObject() {
        run("var data = getData();\nalert(data.name);\nalert(data.value);", alertAnd((engine, global) ->
                engine.registerNative(global, "getData", (Invokable) args -> {
                    Map<String, Object> map = new LinkedHashMap<>();
                    map.put("name", "Test");
                    map.put("value", 42);
                    return map;
                })));
        assertEquals(Arrays.asList("Test", 42), output);
    }

    //==================================================================================================================
    // errors

    @Test
    void testSyntaxError() {
        assertThrows(ParserException.class, () -> new Engine("\nvar x = 5 +;\n", alert()));
    }

    @Test
    void testRuntimeError() {
        Engine engine = new Engine("var obj = null;\nobj.property = \"test\";", alert());
        EngineException e = assertThrows(EngineException.class, engine::run);
        assertTrue(e.getMessage().contains("TypeError: Cannot set properties of null (setting 'property')"), e.getMessage());
        assertEquals(EngineState.FAILED, engine.getState());
    }

    @Test
    void testUndefinedVariable() {
        Engine engine = new Engine("alert(undefinedVariable);", alert());
        EngineException e = assertThrows(EngineException.class, engine::run);
        assertTrue(e.getMessage().contains("ReferenceError: undefinedVariable is not defined"), e.getMessage());
        assertTrue(output.isEmpty());
    }

    //==================================================================================================================
    // stepping and timers

    @Test
    void testStepByStep() {
        Engine engine = new Engine("for (var i = 0; i < 3; i++) {\n  alert(i);\n}", alert());
        int steps = 0;
        while (engine.step() && steps < 1000) {
            steps++;
        }
        assertEquals(Arrays.asList(0, 1, 2), output);
        assertTrue(steps > 0);
    }

    @Test
    void testSetTimeoutSimulation() {
        Deque<JsFunction> timers = new ArrayDeque<>();
        Engine engine = new Engine("var count = 0;\n"
                + "function increment() {\n"
                + "  count++;\n"
                + "  alert(count);\n"
                + "  if (count < 3) {\n"
                + "    setTimeout(increment, 1);\n"
                + "  }\n"
                + "}\n"
                + "increment();", alertAnd((e, global) ->
                e.registerNative(global, "setTimeout", (Invokable) args -> {
                    timers.add((JsFunction) args[0]);
                    return null;
                })));
        int turns = 0;
        engine.run();
        // host event loop: one timer per turn
        while (!timers.isEmpty()) {
            engine.queueCall(timers.poll());
            engine.run();
            turns++;
        }
        assertEquals(2, turns);
        assertEquals(Arrays.asList(1, 2, 3), output);
        assertEquals(EngineState.COMPLETED, engine.getState());
    }

    //==================================================================================================================
    // complex programs

    @Test
    void testPrototypes() {
        run("function Person(name, age) {\n"
                + "  this.name = name;\n"
                + "  this.age = age;\n"
                + "}\n"
                + "Person.prototype.greet = function() {\n"
                + "  return \"Hi, I'm \" + this.name + \" and I'm \" + this.age + \" years old.\";\n"
                + "};\n"
                + "var john = new Person(\"John\", 25);\n"
                + "alert(john.greet());");
        assertEquals(Arrays.asList("Hi, I'm John and I'm 25 years old."), output);
    }

    @Test
    void testClosures() {
        run("function createCounter(start) {\n"
                + "  var count = start;\n"
                + "  return function() {\n"
                + "    count++;\n"
                + "    return count;\n"
                + "  };\n"
                + "}\n"
                + "var counter = createCounter(5);\n"
                + "var other = createCounter(100);\n"
                + "alert(counter());\n"
                + "alert(counter());\n"
                + "other();\n"
                + "alert(counter());");
        assertEquals(Arrays.asList(6, 7, 8), output);
    }

    //==================================================================================================================
    // edge cases

    @Test
    void testEmptyCode() {
        assertDoesNotThrow(() -> run(""));
        assertTrue(output.isEmpty());
    }

    @Test
    void testCommentsOnly() {
        Engine engine = run("\n// This is a comment\n/* This is also a comment */\n");
        assertTrue(output.isEmpty());
        assertEquals(EngineState.COMPLETED, engine.getState());
    }

    @Test
    void testNestedCalls() {
        run("function add(a, b) {\n  return a + b;\n}\n"
                + "function multiply(a, b) {\n  return a * b;\n}\n"
                + "var result = multiply(add(2, 3), add(4, 6));\nalert(result);");
        assertEquals(Arrays.asList(50), output);
    }

    @Test
    void testStateAcrossCalls() {
        run("var counter = 0;\n"
                + "function increment() {\n  counter++;\n  alert(counter);\n}\n"
                + "increment();\nincrement();\nincrement();");
        assertEquals(Arrays.asList(1, 2, 3), output);
    }

    @Test
    void testIndependentEngines() {
        Engine first = new Engine("var x = 10;\nalert(x);", alert());
        Engine second = new Engine("var x = 20;\nalert(x);", alert());
        first.run();
        second.run();
        assertEquals(Arrays.asList(10, 20), output);
        assertEquals(10, first.get("x"));
        assertEquals(20, second.get("x"));
        assertNotSame(first.getGlobalObject(), second.getGlobalObject());
    }

    @Test
    void testInterleavedEngines() {
        Engine first = new Engine("for (var i = 0; i < 3; i++) { alert('a' + i); }", alert());
        Engine second = new Engine("for (var i = 0; i < 3; i++) { alert('b' + i); }", alert());
        boolean more = true;
        while (more) {
            boolean a = first.step();
            boolean b = second.step();
            more = a || b;
        }
        List<Object> fromFirst = new ArrayList<>();
        List<Object> fromSecond = new ArrayList<>();
        for (Object o : output) {
            (o.toString().startsWith("a") ? fromFirst : fromSecond).add(o);
        }
        assertEquals(Arrays.asList("a0", "a1", "a2"), fromFirst);
        assertEquals(Arrays.asList("b0", "b1", "b2"), fromSecond);
    }

}
