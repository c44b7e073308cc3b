package io.stepjs.js;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StepwiseTest {

    private static final String PROGRAM = "var total = 0;\n"
            + "function add(n) { total += n; log('add ' + n); return total; }\n"
            + "for (var i = 0; i < 3; i++) { add(i); }\n"
            + "var o = { toString: function() { log('toString'); return 'O'; } };\n"
            + "log('result ' + o + ' ' + [1, 2].map(function(x) { log('map ' + x); return x * 2; }));\n"
            + "var nothing = null;\n"
            + "try { nothing.x; } catch (e) { log(e.name); } finally { log('finally'); }\n"
            + "total";

    private static Engine engine(List<Object> output) {
        return new Engine(PROGRAM, (engine, global) ->
                engine.registerNative(global, "log", (Invokable) args -> {
                    output.add(args[0]);
                    return null;
                }));
    }

    @Test
    void testSteppingMatchesRun() {
        List<Object> runOutput = new ArrayList<>();
        Engine runEngine = engine(runOutput);
        runEngine.run();
        List<Object> stepOutput = new ArrayList<>();
        Engine stepEngine = engine(stepOutput);
        int steps = 0;
        while (stepEngine.step()) {
            steps++;
            assertEquals(EngineState.SUSPENDED_YIELD, stepEngine.getState());
        }
        assertEquals(EngineState.COMPLETED, stepEngine.getState());
        assertEquals(runOutput, stepOutput);
        assertEquals(Arrays.asList("add 0", "add 1", "add 2", "toString", "map 1", "map 2", "result O 2,4",
                "TypeError", "finally"), stepOutput);
        assertEquals(3, stepEngine.getResult());
        assertEquals(runEngine.getStepCount(), stepEngine.getStepCount());
        assertEquals(steps + 1, stepEngine.getStepCount());
    }

    @Test
    void testStepByStep() {
        List<Object> output = new ArrayList<>();
        Engine engine = new Engine("for (var i = 0; i < 3; i++) { log(i); }", (e, global) ->
                e.registerNative(global, "log", (Invokable) args -> output.add(args[0])));
        int steps = 0;
        while (engine.step()) {
            steps++;
        }
        assertTrue(steps > 0);
        assertEquals(Arrays.asList(0, 1, 2), output);
    }

    @Test
    void testStepsAreFineGrained() {
        Engine engine = new Engine("var x = 1 + 2 * 3;");
        engine.step();
        assertNull(engine.get("x"));
        int steps = 1;
        while (engine.step()) {
            steps++;
        }
        assertEquals(7, engine.get("x"));
        // program, statement, var, literal operands and the operators each take their own steps
        assertTrue(steps > 5, "steps: " + steps);
    }

    @Test
    void testObservableBetweenSteps() {
        Engine engine = new Engine("var i = 0; while (i < 100) { i++; }");
        while (engine.step()) {
            Object i = engine.get("i");
            if (i != null && ((Number) i).intValue() == 50) {
                break;
            }
        }
        assertEquals(EngineState.SUSPENDED_YIELD, engine.getState());
        assertEquals(50, engine.get("i"));
        engine.run();
        assertEquals(100, engine.get("i"));
    }

    @Test
    void testHostBoundsInfiniteLoop() {
        Engine engine = new Engine("var n = 0; while (true) { n++; }");
        for (int i = 0; i < 1000; i++) {
            assertTrue(engine.step());
        }
        assertTrue(((Number) engine.get("n")).intValue() > 10);
        assertEquals(1000, engine.getStepCount());
    }

    @Test
    void testQueuedCallsRunInOrder() {
        List<Object> output = new ArrayList<>();
        Engine engine = new Engine("function show(x) { log(x); } log('main');", (e, global) ->
                e.registerNative(global, "log", (Invokable) args -> output.add(args[0])));
        JsFunction show = (JsFunction) engine.getGlobalObject().get("show");
        engine.queueCall(show, "first");
        engine.queueCall(show, "second");
        assertFalse(engine.run());
        assertEquals(Arrays.asList("main", "first", "second"), output);
        assertEquals(EngineState.COMPLETED, engine.getState());
        engine.queueCall(show, 3);
        assertEquals(EngineState.SUSPENDED_YIELD, engine.getState());
        assertFalse(engine.run());
        assertEquals(Arrays.asList("main", "first", "second", 3), output);
    }

    @Test
    void testTimerChain() {
        // a setTimeout-style native that only queues, the host decides when to run
        List<Object> output = new ArrayList<>();
        Engine engine = new Engine("var count = 0;\n"
                + "function tick() { count++; log(count); if (count < 3) { setTimeout(tick, 10); } }\n"
                + "setTimeout(tick, 10);", (e, global) -> {
            e.registerNative(global, "log", (Invokable) args -> output.add(args[0]));
            e.registerNative(global, "setTimeout", (Invokable) args -> {
                e.queueCall((JsFunction) args[0]);
                return null;
            });
        });
        assertFalse(engine.run());
        assertEquals(Arrays.asList(1, 2, 3), output);
        assertEquals(3, engine.get("count"));
    }

}
