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
package io.stepjs.js;

import io.stepjs.common.Resource;
import io.stepjs.parser.JsParser;
import io.stepjs.parser.Node;
import io.stepjs.parser.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Host-facing handle on one guest program. The program is parsed and
 * validated up front and then advanced with {@link #step()} or
 * {@link #run()}. A native can park the engine with
 * {@link Context#suspend()} until the host calls {@link #resume(Object)}.
 * <p>
 * Each engine owns its own realm (global object and built-ins), nothing is
 * shared between engines. Stepping, resuming and queueing are serialized on
 * the engine instance.
 */
public class Engine {

    static final Logger logger = LoggerFactory.getLogger(Engine.class);

    public static boolean DEBUG = false;

    private final Realm realm = new Realm();
    private final Environment globalEnv;
    private final Interpreter interpreter;
    private final ArrayDeque<QueuedCall> queue = new ArrayDeque<>();
    private final Map<Node, Interpreter.Declarations> declarations = new HashMap<>();

    private EngineState state = EngineState.IDLE;
    private EngineState reported = EngineState.IDLE; // last state logged, RUNNING is not
    private long stepCount;
    private Object thrown;

    private int maxCallDepth = 200;
    private boolean recursionErrorFatal;
    private boolean strictAssignment;

    private static final class QueuedCall {

        final JsFunction function;
        final List<Object> args;

        QueuedCall(JsFunction function, List<Object> args) {
            this.function = function;
            this.args = args;
        }

    }

    public Engine(String source) {
        this(source, null);
    }

    public Engine(String source, Bootstrap bootstrap) {
        this(Resource.text(source), bootstrap);
    }

    public Engine(Resource resource, Bootstrap bootstrap) {
        this(new JsParser(resource).parse(), bootstrap);
    }

    /**
     * @throws EngineException when the program is structurally invalid, for
     *                         example a break outside of a loop
     */
    public Engine(Node program, Bootstrap bootstrap) {
        NodeValidator.validate(program);
        globalEnv = Environment.global(realm.globalObject);
        interpreter = new Interpreter(this, realm, false, 0);
        interpreter.startProgram(program, globalEnv);
        if (bootstrap != null) {
            bootstrap.init(this, realm.globalObject);
        }
        try {
            interpreter.hoistProgram();
        } catch (JsException e) {
            throw failure(interpreter.thrownValue(e), program); // e.g. a duplicate let at top level
        }
    }

    //==================================================================================================================
    // execution

    /**
     * Advances evaluation by one step. While awaiting an external event this
     * does nothing and returns true.
     *
     * @return true if the engine is not finished
     * @throws EngineException       for an uncaught guest throw, the engine is then failed
     * @throws IllegalStateException when called re-entrantly from a native
     */
    public synchronized boolean step() {
        switch (state) {
            case RUNNING:
                throw new IllegalStateException("engine is already running a step");
            case COMPLETED:
            case FAILED:
                return false;
            case SUSPENDED_AWAIT:
                return true;
            default:
        }
        setState(EngineState.RUNNING);
        try {
            if (interpreter.isDone() && !queue.isEmpty()) {
                QueuedCall call = queue.poll();
                interpreter.startCall(call.function, Terms.UNDEFINED, call.args, globalEnv);
            }
            interpreter.step();
            stepCount++;
        } catch (EngineException e) {
            fail(e.getThrown(), e);
            throw e;
        } catch (RuntimeException | Error e) {
            // host failures (including OutOfMemoryError) must not leave the engine running
            fail(null, e);
            throw e;
        }
        if (interpreter.awaiting != null) {
            setState(EngineState.SUSPENDED_AWAIT);
        } else if (!interpreter.isDone() || !queue.isEmpty()) {
            setState(EngineState.SUSPENDED_YIELD);
        } else {
            setState(EngineState.COMPLETED);
        }
        return state != EngineState.COMPLETED;
    }

    /**
     * Steps until the program completes or suspends awaiting an external
     * event.
     *
     * @return true when suspended, false when completed
     */
    public boolean run() {
        while (step()) {
            if (isSuspendedAwaitingExternalEvent()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Delivers the result of the suspended native call.
     *
     * @throws IllegalStateException when not awaiting
     */
    public void resume(Object value) {
        awaitingDeferred().resolve(value);
    }

    /**
     * Makes the suspended native call throw in the guest. A string is
     * wrapped into an {@code Error}.
     */
    public void resumeWithError(Object error) {
        awaitingDeferred().reject(error);
    }

    private synchronized Deferred awaitingDeferred() {
        if (state != EngineState.SUSPENDED_AWAIT || interpreter.awaiting == null) {
            throw new IllegalStateException("engine is not awaiting an external event, state: " + state);
        }
        return interpreter.awaiting;
    }

    synchronized void settle(Deferred deferred, Object value, boolean error) {
        if (error && value instanceof String) {
            value = realm.newError("Error", (String) value);
        }
        deferred.markSettled(value, error);
        if (interpreter.awaiting == deferred) {
            interpreter.resumeAwaiting();
            if (state == EngineState.SUSPENDED_AWAIT) {
                setState(EngineState.SUSPENDED_YIELD);
            }
        }
        // settled during the native call itself: picked up when the native returns
    }

    /**
     * Schedules a guest function to be called once the current program (and
     * any call queued before it) has finished. A completed engine becomes
     * runnable again.
     *
     * @throws IllegalStateException when the engine has failed
     */
    public synchronized void queueCall(JsFunction function, Object... args) {
        if (state == EngineState.FAILED) {
            throw new IllegalStateException("engine has failed");
        }
        List<Object> list = new ArrayList<>(args.length);
        for (Object arg : args) {
            list.add(realm.toGuest(arg));
        }
        queue.add(new QueuedCall(function, list));
        logger.debug("queued call to '{}', pending: {}", function.getName(), queue.size());
        if (state == EngineState.COMPLETED) {
            setState(EngineState.SUSPENDED_YIELD);
        }
    }

    private void setState(EngineState next) {
        if (next != EngineState.RUNNING && next != reported) {
            logger.debug("state {} -> {} at step {}", reported, next, stepCount);
            reported = next;
        }
        state = next;
    }

    private void fail(Object value, Throwable e) {
        thrown = value;
        setState(EngineState.FAILED);
        logger.warn("engine failed after {} steps: {}", stepCount, e.getMessage() == null ? e.toString() : e.getMessage());
    }

    /**
     * Builds the host-facing exception for an uncaught guest value, with the
     * source position of the statement that raised it.
     */
    EngineException failure(Object value, Node node) {
        StringBuilder sb = new StringBuilder("js failed:\n==========\n");
        Token token = node == null ? null : node.getFirstToken();
        if (token != null && token != Token.EMPTY) {
            if (token.getResource().isFile()) {
                sb.append("  File: ").append(token.getResource().getRelativePath()).append('\n');
            }
            sb.append("  Line: ").append(token.line + 1).append(", Col: ").append(token.col + 1).append('\n');
            sb.append("  Code: ").append(token.getLineText().trim()).append('\n');
        }
        sb.append("  Error: ").append(Terms.toStringValue(value)).append('\n');
        sb.append("==========");
        return new EngineException(sb.toString(), value);
    }

    Interpreter.Declarations declarations(Node scope) {
        return declarations.computeIfAbsent(scope, Interpreter.Declarations::of);
    }

    //==================================================================================================================
    // host bridge

    /**
     * Defines a host function as a non-enumerable property of the target.
     * Arguments arrive with undefined mapped to null and the return value is
     * converted with {@link Realm#toGuest(Object)}.
     */
    public JsFunction registerNative(JsObject target, String name, JsCallable callable) {
        JsFunction fn = realm.newNative(name, callable, true);
        target.defineOwnProperty(name, fn, true, false, true);
        return fn;
    }

    public JsFunction registerNative(JsObject target, String name, Invokable invokable) {
        return registerNative(target, name, (JsCallable) invokable);
    }

    public JsFunction registerNative(String name, JsCallable callable) {
        return registerNative(realm.globalObject, name, callable);
    }

    /**
     * A host function value not bound to any property, for example to be
     * returned from another native.
     */
    public JsFunction createNativeFunction(JsCallable callable) {
        return realm.newNative("", callable, true);
    }

    public JsFunction createNativeFunction(Invokable invokable) {
        return createNativeFunction((JsCallable) invokable);
    }

    public void setProperty(JsObject target, String key, Object value) {
        target.put(key, realm.toGuest(value));
    }

    /**
     * Raw guest value of a property, undefined and missing become null.
     */
    public Object getProperty(JsObject target, String key) {
        Object value = target.get(key);
        return value == Terms.UNDEFINED ? null : value;
    }

    /**
     * Value of a global binding converted for the host, or null when not
     * declared.
     */
    public synchronized Object get(String name) {
        if (!globalEnv.has(name)) {
            return null;
        }
        try {
            return realm.toHost(globalEnv.lookup(name));
        } catch (JsException e) {
            logger.debug("binding '{}' not readable: {}", name, e.getMessage());
            return null;
        }
    }

    //==================================================================================================================
    // inspection and configuration

    public synchronized EngineState getState() {
        return state;
    }

    public synchronized boolean isSuspendedAwaitingExternalEvent() {
        return state == EngineState.SUSPENDED_AWAIT;
    }

    /**
     * Completion value of the last statement evaluated at program level,
     * raw guest value.
     */
    public synchronized Object getResult() {
        return interpreter.getProgramResult();
    }

    /**
     * The uncaught guest value after a failure, null otherwise.
     */
    public synchronized Object getThrown() {
        return thrown;
    }

    public synchronized long getStepCount() {
        return stepCount;
    }

    public JsObject getGlobalObject() {
        return realm.globalObject;
    }

    public Realm getRealm() {
        return realm;
    }

    Environment getGlobalEnv() {
        return globalEnv;
    }

    public int getMaxCallDepth() {
        return maxCallDepth;
    }

    public void setMaxCallDepth(int maxCallDepth) {
        this.maxCallDepth = maxCallDepth;
    }

    public boolean isRecursionErrorFatal() {
        return recursionErrorFatal;
    }

    /**
     * When set, exceeding the call depth fails the engine instead of
     * throwing a catchable RangeError.
     */
    public void setRecursionErrorFatal(boolean recursionErrorFatal) {
        this.recursionErrorFatal = recursionErrorFatal;
    }

    public boolean isStrictAssignment() {
        return strictAssignment;
    }

    /**
     * When set, assigning to an undeclared name is a ReferenceError instead
     * of creating a global.
     */
    public void setStrictAssignment(boolean strictAssignment) {
        this.strictAssignment = strictAssignment;
    }

}
