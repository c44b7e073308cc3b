package io.stepjs.js;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class EvalBase {

    static final Logger logger = LoggerFactory.getLogger(EvalBase.class);

    Engine engine;

    /**
     * Runs the program to completion and returns the raw guest value of the
     * last statement.
     */
    Object eval(String text) {
        engine = new Engine(text);
        engine.run();
        return engine.getResult();
    }

    void matchEval(String text, String expected) {
        match(evalHost(text), expected);
    }

    private Object evalHost(String text) {
        Object result = eval(text);
        return engine.getRealm().toHost(result);
    }

    void match(Object actual, String expected) {
        NodeUtils.match(actual, expected);
    }

    Object get(String name) {
        return engine.get(name);
    }

    EngineException evalFails(String text) {
        try {
            eval(text);
        } catch (EngineException e) {
            logger.debug("expected failure: {}", e.getMessage());
            return e;
        }
        throw new AssertionError("expected failure for: " + text);
    }

}
