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

import io.stepjs.parser.Node;
import io.stepjs.parser.NodeType;
import io.stepjs.parser.Token;
import io.stepjs.parser.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Tree-walking evaluator driven one step at a time. Pending work lives on
 * an explicit stack of {@link State}s instead of the Java call stack, so
 * evaluation can stop after any step and pick up later. A step either
 * pushes one child state or completes the top state and hands its value to
 * the parent. Abrupt completions (return, break, continue, throw) unwind the
 * stack until a state that handles them is found.
 */
class Interpreter {

    static final Logger logger = LoggerFactory.getLogger(Interpreter.class);

    private static final Node HOST_CALL = new Node(NodeType.ROOT);

    // call states
    private static final int CALL_ARGS = 2;
    private static final int CALL_RETURNED = 3;
    private static final int CALL_AWAIT = 4;
    private static final int CALL_RESUMED = 5;

    final Engine engine;
    final Realm realm;
    final boolean nested;

    private final int baseDepth;
    private final ArrayDeque<State> stack = new ArrayDeque<>();

    private int depth;
    private Object programResult = Terms.UNDEFINED;
    private Object callResult = Terms.UNDEFINED;
    private Node currentNode;
    private Completion uncaught;
    private Node uncaughtNode;

    Deferred awaiting;

    Interpreter(Engine engine, Realm realm, boolean nested, int baseDepth) {
        this.engine = engine;
        this.realm = realm;
        this.nested = nested;
        this.baseDepth = baseDepth;
    }

    void startProgram(Node program, Environment globalEnv) {
        stack.push(new State(program, globalEnv, new CallFrame(null, realm.globalObject, baseDepth)));
    }

    /**
     * Declares the program's vars, lexicals and functions before the first
     * step, so that the host can reach guest functions right away.
     */
    void hoistProgram() {
        State s = stack.peekLast();
        if (s != null && s.phase == 0 && s.node.type == NodeType.PROGRAM) {
            hoist(s.node, s.env, true);
            s.phase = 1;
        }
    }

    /**
     * Queues an invocation of a guest value with already evaluated
     * arguments, used for host-initiated and nested calls.
     */
    void startCall(Object function, Object thisValue, List<Object> args, Environment env) {
        State s = new State(HOST_CALL, env, new CallFrame(null, realm.globalObject, baseDepth));
        s.callee = function;
        s.target = thisValue;
        s.values = args;
        s.phase = CALL_ARGS;
        stack.push(s);
    }

    boolean isDone() {
        return stack.isEmpty();
    }

    Object getProgramResult() {
        return programResult;
    }

    Object getCallResult() {
        return callResult;
    }

    Node getCurrentNode() {
        return currentNode;
    }

    int getDepth() {
        return baseDepth + depth;
    }

    /**
     * Performs one unit of work.
     *
     * @return true if work remains
     * @throws EngineException for an uncaught throw at the bottom of the main stack
     * @throws JsException for an uncaught throw inside a nested invocation
     */
    boolean step() {
        State s = stack.peek();
        if (s == null) {
            return false;
        }
        try {
            eval(s);
        } catch (JsException e) {
            unwind(Completion.throwing(thrownValue(e)));
        }
        if (uncaught != null) {
            Object thrown = uncaught.value;
            Node node = uncaughtNode;
            uncaught = null;
            uncaughtNode = null;
            if (nested) {
                throw new JsException(thrown);
            }
            throw engine.failure(thrown, node);
        }
        return !stack.isEmpty();
    }

    /**
     * Called by the engine once the deferred this interpreter waits on is
     * settled, the call state picks up the outcome on the next step.
     */
    void resumeAwaiting() {
        State s = stack.peek();
        if (s != null && s.phase == CALL_AWAIT) {
            s.phase = CALL_RESUMED;
        }
        awaiting = null;
    }

    Object thrownValue(JsException e) {
        if (e.getErrorType() != null) {
            return realm.newError(e.getErrorType(), e.getMessage());
        }
        return e.getThrown();
    }

    //==================================================================================================================
    // stack plumbing

    static Node unwrap(Node node) {
        while (true) {
            switch (node.type) {
                case EXPR:
                    node = node.getFirst();
                    break;
                case PAREN_EXPR:
                    node = node.get(1);
                    break;
                case LIT_EXPR:
                    if (node.getFirst().isToken()) {
                        return node;
                    }
                    node = node.getFirst();
                    break;
                default:
                    return node;
            }
        }
    }

    private State push(State parent, Node node) {
        State child = new State(unwrap(node), parent.env, parent.frame);
        stack.push(child);
        return child;
    }

    private void pop(State s, Object value) {
        stack.pop();
        State parent = stack.peek();
        if (parent != null) {
            parent.value = value;
        } else if (s.node.type == NodeType.PROGRAM) {
            programResult = value;
        } else {
            callResult = value;
        }
    }

    private static Node nextChild(State s, NodeType type) {
        Node node = s.node;
        while (s.index < node.size()) {
            Node child = node.get(s.index++);
            if (child.type == type) {
                return child;
            }
        }
        return null;
    }

    //==================================================================================================================
    // abrupt completions

    private void unwind(Completion completion) {
        Node origin = currentNode;
        while (!stack.isEmpty()) {
            State s = stack.peek();
            switch (s.node.type) {
                case TRY_STMT:
                    if (unwindTry(s, completion)) {
                        return;
                    }
                    break;
                case FN_CALL_EXPR:
                case NEW_EXPR:
                case ROOT:
                    if (s.callPending) {
                        exitFunction(s);
                        if (completion.type == Completion.Type.RETURN) {
                            s.value = completion.value;
                            return;
                        }
                    }
                    break;
                case WHILE_STMT:
                case DO_WHILE_STMT:
                case FOR_STMT:
                    if (unwindLoop(s, completion)) {
                        return;
                    }
                    break;
                case SWITCH_STMT:
                    if (completion.type == Completion.Type.BREAK && completion.label == null) {
                        pop(s, Terms.UNDEFINED);
                        return;
                    }
                    break;
                default:
            }
            if (completion.type == Completion.Type.BREAK && completion.label != null && s.hasLabel(completion.label)) {
                pop(s, Terms.UNDEFINED);
                return;
            }
            stack.pop();
        }
        if (completion.type == Completion.Type.THROW) {
            uncaught = completion;
            uncaughtNode = origin;
        }
    }

    private boolean unwindTry(State s, Completion completion) {
        Node node = s.node;
        if (s.phase == 1 && completion.type == Completion.Type.THROW && node.get(2).isToken(TokenType.CATCH)) {
            Environment catchEnv = new Environment(s.env, false);
            Node block;
            if (node.get(3).isToken(TokenType.L_PAREN)) {
                catchEnv.declare(node.get(4).getText(), completion.value, BindingType.LET);
                block = node.get(6);
            } else {
                block = node.get(3);
            }
            s.phase = 2;
            State child = push(s, block);
            child.env = catchEnv;
            return true;
        }
        Node finallyBlock = finallyBlock(node);
        if (finallyBlock != null && s.phase != 3) {
            s.pending = completion;
            s.phase = 3;
            push(s, finallyBlock);
            return true;
        }
        return false;
    }

    private boolean unwindLoop(State s, Completion completion) {
        boolean matches = completion.label == null || s.hasLabel(completion.label);
        if (completion.type == Completion.Type.BREAK && matches) {
            pop(s, Terms.UNDEFINED);
            return true;
        }
        if (completion.type == Completion.Type.CONTINUE && matches) {
            switch (s.node.type) {
                case WHILE_STMT:
                    s.phase = 0;
                    break;
                case DO_WHILE_STMT:
                    s.phase = 1;
                    break;
                default:
                    s.phase = isForInOf(s.node) ? 2 : 4;
            }
            return true;
        }
        return false;
    }

    private static Node finallyBlock(Node tryNode) {
        if (tryNode.get(tryNode.size() - 2).isToken(TokenType.FINALLY)) {
            return tryNode.getLast();
        }
        return null;
    }

    private static boolean isForInOf(Node forNode) {
        return forNode.get(3).isToken(TokenType.IN) || forNode.get(3).isToken(TokenType.OF);
    }

    //==================================================================================================================
    // hoisting

    /**
     * Declarations made at the entry of a program, function body, block or
     * switch body, computed once per node.
     */
    static final class Declarations {

        final Set<String> vars = new LinkedHashSet<>();
        final List<Node> functions = new ArrayList<>();
        final List<Node> lexicals = new ArrayList<>();

        boolean needsScope() {
            return !functions.isEmpty() || !lexicals.isEmpty();
        }

        static Declarations of(Node scope) {
            Declarations d = new Declarations();
            for (Node statement : scopeStatements(scope)) {
                Node inner = statement.getFirst();
                if (inner.type == NodeType.FN_EXPR && inner.get(1).isToken(TokenType.IDENT)) {
                    d.functions.add(inner);
                } else if (inner.type == NodeType.VAR_STMT && !inner.getFirst().isToken(TokenType.VAR)) {
                    d.lexicals.add(inner);
                }
            }
            if (scope.type != NodeType.SWITCH_STMT) {
                collectVars(scope, d.vars);
            }
            return d;
        }

        private static List<Node> scopeStatements(Node scope) {
            if (scope.type != NodeType.SWITCH_STMT) {
                return scope.findImmediateChildren(NodeType.STATEMENT);
            }
            List<Node> statements = new ArrayList<>();
            for (Node clause : scope) {
                if (clause.type == NodeType.CASE_BLOCK || clause.type == NodeType.DEFAULT_BLOCK) {
                    statements.addAll(clause.findImmediateChildren(NodeType.STATEMENT));
                }
            }
            return statements;
        }

        private static void collectVars(Node node, Set<String> names) {
            for (Node child : node) {
                if (child.isToken() || child.type == NodeType.FN_EXPR || child.type == NodeType.FN_ARROW_EXPR) {
                    continue;
                }
                if (child.type == NodeType.VAR_STMT && child.getFirst().isToken(TokenType.VAR)) {
                    for (Node decl : child.findImmediateChildren(NodeType.VAR_DECL)) {
                        names.add(decl.getFirst().getText());
                    }
                }
                collectVars(child, names);
            }
        }

    }

    private void hoist(Node scope, Environment env, boolean functionLevel) {
        Declarations d = engine.declarations(scope);
        if (functionLevel) {
            for (String name : d.vars) {
                env.declareVar(name);
            }
        }
        for (Node statement : d.lexicals) {
            BindingType type = statement.getFirst().isToken(TokenType.LET) ? BindingType.LET : BindingType.CONST;
            for (Node decl : statement.findImmediateChildren(NodeType.VAR_DECL)) {
                env.declareUninitialized(decl.getFirst().getText(), type);
            }
        }
        for (Node fn : d.functions) {
            String name = fn.get(1).getText();
            env.declare(name, new JsFunctionNode(realm, fn, name, env, null), BindingType.VAR);
        }
    }

    //==================================================================================================================
    // dispatch

    private void eval(State s) {
        switch (s.node.type) {
            case PROGRAM:
                evalProgram(s);
                break;
            case STATEMENT:
                evalStatement(s);
                break;
            case BLOCK:
                evalBlock(s);
                break;
            case EXPR_LIST:
                evalExprList(s);
                break;
            case VAR_STMT:
                evalVarStmt(s);
                break;
            case IF_STMT:
                evalIf(s);
                break;
            case FOR_STMT:
                if (isForInOf(s.node)) {
                    evalForInOf(s);
                } else {
                    evalFor(s);
                }
                break;
            case WHILE_STMT:
                evalWhile(s);
                break;
            case DO_WHILE_STMT:
                evalDoWhile(s);
                break;
            case SWITCH_STMT:
                evalSwitch(s);
                break;
            case BREAK_STMT:
                unwind(Completion.breaking(s.node.size() > 1 ? s.node.get(1).getText() : null));
                break;
            case CONTINUE_STMT:
                unwind(Completion.continuing(s.node.size() > 1 ? s.node.get(1).getText() : null));
                break;
            case RETURN_STMT:
                evalReturn(s);
                break;
            case THROW_STMT:
                evalThrow(s);
                break;
            case TRY_STMT:
                evalTry(s);
                break;
            case LABELED_STMT:
                evalLabeled(s);
                break;
            case FN_EXPR:
                evalFnExpr(s);
                break;
            case FN_ARROW_EXPR:
                pop(s, new JsFunctionNode(realm, s.node, "", s.env, s.frame.thisValue));
                break;
            case FN_CALL_EXPR:
            case NEW_EXPR:
            case ROOT:
                evalCall(s);
                break;
            case REF_EXPR:
                evalRef(s);
                break;
            case REF_DOT_EXPR:
                evalRefDot(s);
                break;
            case REF_BRACKET_EXPR:
                evalRefBracket(s);
                break;
            case LIT_EXPR:
                pop(s, Terms.literalValue(s.node.getFirst().token));
                break;
            case LIT_ARRAY:
                evalLitArray(s);
                break;
            case LIT_OBJECT:
                evalLitObject(s);
                break;
            case LIT_TEMPLATE:
                evalLitTemplate(s);
                break;
            case ASSIGN_EXPR:
                evalAssign(s);
                break;
            case LOGIC_TERN_EXPR:
                evalTernary(s);
                break;
            case LOGIC_AND_EXPR:
            case LOGIC_NULLISH_EXPR:
                evalShortCircuit(s);
                break;
            case LOGIC_EXPR:
            case LOGIC_BIT_EXPR:
            case INSTANCEOF_EXPR:
            case MATH_ADD_EXPR:
            case MATH_MUL_EXPR:
            case MATH_EXP_EXPR:
                evalBinary(s);
                break;
            case MATH_PRE_EXPR:
                evalPrefix(s);
                break;
            case MATH_POST_EXPR:
                evalPostfix(s);
                break;
            case UNARY_EXPR:
                evalUnary(s);
                break;
            case TYPEOF_EXPR:
                evalTypeof(s);
                break;
            case DELETE_EXPR:
                evalDelete(s);
                break;
            default:
                throw new IllegalStateException("cannot evaluate " + s.node.type + ": " + s.node);
        }
    }

    //==================================================================================================================
    // statements

    private void evalProgram(State s) {
        if (s.phase == 0) {
            hoist(s.node, s.env, true);
            s.phase = 1;
        } else {
            programResult = s.value;
        }
        Node next = nextChild(s, NodeType.STATEMENT);
        if (next == null) {
            pop(s, programResult);
        } else {
            push(s, next);
        }
    }

    private void evalStatement(State s) {
        if (s.phase == 0) {
            Node inner = s.node.getFirst();
            if (inner.isToken()) {
                pop(s, Terms.UNDEFINED);
                return;
            }
            currentNode = s.node;
            if (logger.isTraceEnabled() || Engine.DEBUG) {
                Token first = s.node.getFirstToken();
                logger.trace("{}{} | {}", first.getResource(), first.getPositionDisplay(), s.node);
                if (Engine.DEBUG) {
                    System.out.println(first.getResource() + first.getPositionDisplay() + " | " + s.node);
                }
            }
            s.phase = 1;
            State child = push(s, inner);
            child.labels = s.labels;
            return;
        }
        pop(s, s.value);
    }

    private void evalBlock(State s) {
        if (s.phase == 0) {
            s.phase = 1;
            if (engine.declarations(s.node).needsScope()) {
                s.env = new Environment(s.env, false);
                hoist(s.node, s.env, false);
            }
        }
        Node next = nextChild(s, NodeType.STATEMENT);
        if (next == null) {
            pop(s, s.functionBody ? Terms.UNDEFINED : s.value);
        } else {
            push(s, next);
        }
    }

    private void evalExprList(State s) {
        Node next = nextChild(s, NodeType.EXPR);
        if (next == null) {
            pop(s, s.value);
        } else {
            push(s, next);
        }
    }

    private void evalVarStmt(State s) {
        Node node = s.node;
        TokenType kind = node.getFirst().token.type;
        if (s.phase == 1) {
            bind(s, kind, (Node) s.lhs, s.value);
            s.phase = 0;
        }
        while (s.index < node.size()) {
            Node decl = node.get(s.index++);
            if (decl.type != NodeType.VAR_DECL) {
                continue;
            }
            if (decl.size() > 2) {
                s.lhs = decl;
                s.phase = 1;
                push(s, decl.get(2));
                return;
            }
            if (kind != TokenType.VAR) {
                bind(s, kind, decl, Terms.UNDEFINED);
            }
        }
        pop(s, Terms.UNDEFINED);
    }

    private void bind(State s, TokenType kind, Node decl, Object value) {
        String name = decl.getFirst().getText();
        if (value instanceof JsFunctionNode) {
            ((JsFunctionNode) value).inferName(name);
        }
        switch (kind) {
            case LET:
                s.env.initialize(name, value, BindingType.LET);
                break;
            case CONST:
                s.env.initialize(name, value, BindingType.CONST);
                break;
            default:
                s.env.assign(name, value, false);
        }
    }

    private void evalIf(State s) {
        Node node = s.node;
        switch (s.phase) {
            case 0:
                s.phase = 1;
                push(s, node.get(2));
                break;
            case 1:
                if (Terms.isTruthy(s.value)) {
                    s.phase = 2;
                    push(s, node.get(4));
                } else if (node.size() > 5) {
                    s.phase = 2;
                    push(s, node.get(6));
                } else {
                    pop(s, Terms.UNDEFINED);
                }
                break;
            default:
                pop(s, s.value);
        }
    }

    private void evalWhile(State s) {
        if (s.phase == 0) {
            s.phase = 1;
            push(s, s.node.get(2));
        } else if (s.phase == 1) {
            if (Terms.isTruthy(s.value)) {
                s.phase = 0;
                push(s, s.node.get(4));
            } else {
                pop(s, Terms.UNDEFINED);
            }
        }
    }

    private void evalDoWhile(State s) {
        switch (s.phase) {
            case 0:
                s.phase = 1;
                push(s, s.node.get(1));
                break;
            case 1:
                s.phase = 2;
                push(s, s.node.get(4));
                break;
            default:
                if (Terms.isTruthy(s.value)) {
                    s.phase = 1;
                    push(s, s.node.get(1));
                } else {
                    pop(s, Terms.UNDEFINED);
                }
        }
    }

    /**
     * Phases: 0 init, 1 after init, 2 test, 3 after test, 4 after body
     * (also where continue lands), then the update and back to 2. A
     * let / const loop variable gets a fresh copy of its scope per
     * iteration.
     */
    private void evalFor(State s) {
        Node node = s.node;
        Node cond = node.get(4);
        switch (s.phase) {
            case 0: {
                Node init = node.get(2);
                s.phase = 1;
                if (!init.isEmpty()) {
                    Node first = init.getFirst();
                    if (first.type == NodeType.VAR_STMT && !first.getFirst().isToken(TokenType.VAR)) {
                        s.env = new Environment(s.env, false);
                        s.perIteration = true;
                    }
                    push(s, first);
                    return;
                }
            }
            // fall through
            case 1:
                if (s.perIteration) {
                    s.env = s.env.copyForIteration();
                }
                // fall through
            case 2:
                if (!cond.isEmpty()) {
                    s.phase = 3;
                    push(s, cond.getFirst());
                    return;
                }
                // fall through
            case 3:
                if (!cond.isEmpty() && !Terms.isTruthy(s.value)) {
                    pop(s, Terms.UNDEFINED);
                    return;
                }
                s.phase = 4;
                push(s, node.getLast());
                return;
            default: {
                if (s.perIteration) {
                    s.env = s.env.copyForIteration();
                }
                s.phase = 2;
                Node update = node.get(6);
                if (!update.isEmpty()) {
                    push(s, update.getFirst());
                }
            }
        }
    }

    private void evalForInOf(State s) {
        Node node = s.node;
        if (s.phase == 0) {
            s.baseEnv = s.env;
            s.phase = 1;
            push(s, node.get(4));
            return;
        }
        boolean forIn = node.get(3).isToken(TokenType.IN);
        if (s.phase == 1) {
            s.target = s.value;
            s.iterator = forIn ? keysOf(s.value) : valuesOf(s.value, node.get(4));
            s.phase = 2;
        }
        Object next;
        while (true) {
            if (!s.iterator.hasNext()) {
                pop(s, Terms.UNDEFINED);
                return;
            }
            next = s.iterator.next();
            // keys deleted during iteration are skipped
            if (forIn && s.target instanceof JsObject && !((JsObject) s.target).hasProperty((String) next)) {
                continue;
            }
            break;
        }
        Node init = node.get(2).getFirst();
        s.env = s.baseEnv;
        if (init.type == NodeType.VAR_STMT) {
            String name = init.get(1).getFirst().getText();
            TokenType kind = init.getFirst().token.type;
            if (kind == TokenType.VAR) {
                s.baseEnv.assign(name, next, false);
            } else {
                s.env = new Environment(s.baseEnv, false);
                s.env.declare(name, next, kind == TokenType.LET ? BindingType.LET : BindingType.CONST);
            }
        } else {
            Node target = unwrap(init.getFirst());
            s.baseEnv.assign(target.getFirst().getText(), next, engine.isStrictAssignment());
        }
        push(s, node.getLast());
    }

    private Iterator<Object> keysOf(Object value) {
        List<Object> keys = new ArrayList<>();
        if (value instanceof JsObject) {
            keys.addAll(((JsObject) value).enumerableKeys());
        } else if (value instanceof String) {
            int length = ((String) value).length();
            for (int i = 0; i < length; i++) {
                keys.add(String.valueOf(i));
            }
        }
        return keys.iterator();
    }

    private Iterator<Object> valuesOf(Object value, Node source) {
        if (Terms.isNullish(value)) {
            return Collections.emptyIterator();
        }
        if (value instanceof JsArray) {
            JsArray array = (JsArray) value;
            return new Iterator<Object>() {
                int index;

                @Override
                public boolean hasNext() {
                    return index < array.size();
                }

                @Override
                public Object next() {
                    if (!hasNext()) {
                        throw new NoSuchElementException();
                    }
                    return array.get(index++);
                }
            };
        }
        if (value instanceof String) {
            String text = (String) value;
            List<Object> chars = new ArrayList<>(text.length());
            text.codePoints().forEach(cp -> chars.add(new String(Character.toChars(cp))));
            return chars.iterator();
        }
        throw JsException.typeError(source.getText() + " is not iterable");
    }

    private void evalSwitch(State s) {
        Node node = s.node;
        List<Node> clauses = new ArrayList<>();
        for (Node child : node) {
            if (child.type == NodeType.CASE_BLOCK || child.type == NodeType.DEFAULT_BLOCK) {
                clauses.add(child);
            }
        }
        switch (s.phase) {
            case 0:
                s.phase = 1;
                push(s, node.get(2));
                return;
            case 1:
                s.lhs = s.value;
                if (engine.declarations(node).needsScope()) {
                    s.env = new Environment(s.env, false);
                    hoist(node, s.env, false);
                }
                s.index = 0;
                // fall through
            case 2:
                while (s.index < clauses.size() && clauses.get(s.index).type != NodeType.CASE_BLOCK) {
                    s.index++;
                }
                if (s.index < clauses.size()) {
                    s.phase = 3;
                    push(s, clauses.get(s.index).get(1));
                    return;
                }
                int defaultIndex = -1;
                for (int i = 0; i < clauses.size(); i++) {
                    if (clauses.get(i).type == NodeType.DEFAULT_BLOCK) {
                        defaultIndex = i;
                    }
                }
                if (defaultIndex == -1) {
                    pop(s, Terms.UNDEFINED);
                } else {
                    enterClauses(s, clauses, defaultIndex);
                }
                return;
            case 3:
                if (Terms.eq(s.lhs, s.value, true)) {
                    enterClauses(s, clauses, s.index);
                } else {
                    s.index++;
                    s.phase = 2;
                }
                return;
            default:
                if (s.index < s.statements.size()) {
                    push(s, s.statements.get(s.index++));
                } else {
                    pop(s, Terms.UNDEFINED);
                }
        }
    }

    /**
     * Execution starts at the matched clause and falls through the ones
     * after it.
     */
    private static void enterClauses(State s, List<Node> clauses, int from) {
        s.statements = new ArrayList<>();
        for (int i = from; i < clauses.size(); i++) {
            s.statements.addAll(clauses.get(i).findImmediateChildren(NodeType.STATEMENT));
        }
        s.index = 0;
        s.phase = 4;
    }

    private void evalReturn(State s) {
        if (s.phase == 0 && s.node.size() > 1) {
            s.phase = 1;
            push(s, s.node.get(1));
            return;
        }
        unwind(Completion.returning(s.phase == 1 ? s.value : Terms.UNDEFINED));
    }

    private void evalThrow(State s) {
        if (s.phase == 0) {
            s.phase = 1;
            push(s, s.node.get(1));
            return;
        }
        unwind(Completion.throwing(s.value));
    }

    /**
     * Phases: 1 try block, 2 catch block, 3 finally block. A completion
     * interrupted by the finally block is held in {@link State#pending}.
     */
    private void evalTry(State s) {
        switch (s.phase) {
            case 0:
                s.phase = 1;
                push(s, s.node.get(1));
                return;
            case 1:
            case 2: {
                s.lhs = s.value;
                Node finallyBlock = finallyBlock(s.node);
                if (finallyBlock != null) {
                    s.phase = 3;
                    push(s, finallyBlock);
                } else {
                    pop(s, s.lhs);
                }
                return;
            }
            default:
                if (s.pending != null) {
                    Completion pending = s.pending;
                    s.pending = null;
                    stack.pop();
                    unwind(pending);
                } else {
                    pop(s, s.lhs);
                }
        }
    }

    private void evalLabeled(State s) {
        if (s.phase == 0) {
            Set<String> labels = s.labels == null ? new HashSet<>() : new HashSet<>(s.labels);
            labels.add(s.node.getFirst().getText());
            s.phase = 1;
            State child = push(s, s.node.get(2));
            child.labels = labels;
            return;
        }
        pop(s, s.value);
    }

    //==================================================================================================================
    // functions and calls

    private void evalFnExpr(State s) {
        Node node = s.node;
        String name = node.get(1).isToken(TokenType.IDENT) ? node.get(1).getText() : "";
        Node parent = node.getParent();
        boolean declaration = parent != null && parent.type == NodeType.STATEMENT && !name.isEmpty();
        if (declaration) {
            Node scope = parent.getParent();
            boolean hoisted = scope != null && (scope.type == NodeType.PROGRAM || scope.type == NodeType.BLOCK
                    || scope.type == NodeType.CASE_BLOCK || scope.type == NodeType.DEFAULT_BLOCK);
            if (!hoisted) {
                s.env.declare(name, new JsFunctionNode(realm, node, name, s.env, null), BindingType.VAR);
            }
            pop(s, Terms.UNDEFINED);
            return;
        }
        Environment closure = s.env;
        if (!name.isEmpty()) {
            closure = new Environment(s.env, false);
        }
        JsFunctionNode fn = new JsFunctionNode(realm, node, name, closure, null);
        if (!name.isEmpty()) {
            closure.declare(name, fn, BindingType.CONST);
        }
        pop(s, fn);
    }

    private static Node argsNode(Node node) {
        if (node.type == NodeType.FN_CALL_EXPR) {
            return node.get(2);
        }
        if (node.type == NodeType.NEW_EXPR) {
            Node inner = unwrap(node.get(1));
            return inner.type == NodeType.FN_CALL_EXPR ? inner.get(2) : null;
        }
        return null;
    }

    private static Node calleeNode(Node node) {
        if (node.type == NodeType.FN_CALL_EXPR) {
            return node.getFirst();
        }
        if (node.type == NodeType.NEW_EXPR) {
            Node inner = unwrap(node.get(1));
            return inner.type == NodeType.FN_CALL_EXPR ? inner.getFirst() : inner;
        }
        return null;
    }

    private static String describeCallee(State s) {
        Node callee = calleeNode(s.node);
        if (callee != null) {
            return callee.getText();
        }
        return Terms.typeOf(s.callee);
    }

    private static boolean isReference(Node node) {
        switch (node.type) {
            case REF_DOT_EXPR:
            case REF_BRACKET_EXPR:
                return true;
            case REF_EXPR:
                return node.getFirst().isToken(TokenType.IDENT) && !"this".equals(node.getFirst().getText());
            default:
                return false;
        }
    }

    private void evalCall(State s) {
        Node node = s.node;
        switch (s.phase) {
            case 0: {
                s.phase = 1;
                State child = push(s, calleeNode(node));
                child.chain = node.type == NodeType.FN_CALL_EXPR;
                child.reference = child.chain && isReference(child.node);
                return;
            }
            case 1: {
                Object value = s.value;
                if (value instanceof JsProperty) {
                    JsProperty ref = (JsProperty) value;
                    if (ref.isShortCircuit()) {
                        pop(s, s.chain ? JsProperty.SHORT_CIRCUIT : Terms.UNDEFINED);
                        return;
                    }
                    s.callee = ref.get(this);
                    s.target = ref.thisValue();
                } else {
                    s.callee = value;
                    s.target = Terms.UNDEFINED;
                }
                s.values = new ArrayList<>();
                s.index = 0;
                s.phase = CALL_ARGS;
            }
            // fall through
            case CALL_ARGS: {
                if (s.values.size() < s.index) {
                    s.values.add(s.value);
                }
                Node args = argsNode(node);
                int count = args == null ? 0 : args.size();
                if (s.index < count) {
                    push(s, args.get(s.index++).getFirst());
                    return;
                }
                invoke(s, s.callee, s.target, s.values, node.type == NodeType.NEW_EXPR);
                return;
            }
            case CALL_RETURNED: {
                if (s.callPending) {
                    exitFunction(s);
                }
                Object result = s.value;
                if (s.construct && !(result instanceof JsObject)) {
                    result = s.lhs;
                }
                pop(s, result);
                return;
            }
            case CALL_RESUMED: {
                Deferred deferred = s.deferred;
                s.deferred = null;
                Object result = realm.toGuest(deferred.getValue());
                if (deferred.isError()) {
                    throw new JsException(result);
                }
                pop(s, result);
                return;
            }
            default:
                // awaiting, nothing to do until settled
        }
    }

    private void invoke(State s, Object fn, Object thisValue, List<Object> args, boolean construct) {
        while (true) {
            if (fn instanceof JsBoundFunction) {
                JsBoundFunction bound = (JsBoundFunction) fn;
                List<Object> merged = new ArrayList<>(bound.boundArgs);
                merged.addAll(args);
                args = merged;
                if (!construct) {
                    thisValue = bound.boundThis;
                }
                fn = bound.target;
            } else if (!construct && fn == realm.functionCall) {
                if (!(thisValue instanceof JsFunction)) {
                    throw JsException.typeError(describeCallee(s) + " is not a function");
                }
                fn = thisValue;
                thisValue = args.isEmpty() ? Terms.UNDEFINED : args.get(0);
                args = args.size() > 1 ? new ArrayList<>(args.subList(1, args.size())) : new ArrayList<>();
            } else if (!construct && fn == realm.functionApply) {
                if (!(thisValue instanceof JsFunction)) {
                    throw JsException.typeError(describeCallee(s) + " is not a function");
                }
                fn = thisValue;
                thisValue = args.isEmpty() ? Terms.UNDEFINED : args.get(0);
                args = realm.toArgumentList(args.size() > 1 ? args.get(1) : Terms.UNDEFINED);
            } else {
                break;
            }
        }
        if (!(fn instanceof JsFunction)) {
            throw JsException.typeError(describeCallee(s) + (construct ? " is not a constructor" : " is not a function"));
        }
        if (fn instanceof JsFunctionNode) {
            JsFunctionNode guest = (JsFunctionNode) fn;
            if (construct) {
                if (guest.arrow) {
                    throw JsException.typeError(describeCallee(s) + " is not a constructor");
                }
                Object proto = guest.get("prototype");
                JsObject instance = new JsObject(proto instanceof JsObject ? (JsObject) proto : realm.objectPrototype);
                s.construct = true;
                s.lhs = instance;
                thisValue = instance;
            }
            enterFunction(s, guest, thisValue, args);
            return;
        }
        callNative(s, (JsNativeFunction) fn, thisValue, args, construct);
    }

    private void checkCallDepth(int callDepth) {
        if (callDepth >= engine.getMaxCallDepth()) {
            if (engine.isRecursionErrorFatal()) {
                throw engine.failure(realm.newError("RangeError", "Maximum call stack size exceeded"), currentNode);
            }
            throw JsException.rangeError("Maximum call stack size exceeded");
        }
    }

    private void enterFunction(State s, JsFunctionNode fn, Object thisValue, List<Object> args) {
        checkCallDepth(baseDepth + depth);
        depth++;
        Environment env = new Environment(fn.closure, true);
        for (int i = 0; i < fn.params.size(); i++) {
            env.declare(fn.params.get(i), i < args.size() ? args.get(i) : Terms.UNDEFINED, BindingType.VAR);
        }
        if (!fn.arrow && !fn.params.contains("arguments")) {
            env.declare("arguments", realm.newArray(new ArrayList<>(args)), BindingType.VAR);
        }
        Object self;
        if (fn.arrow) {
            self = fn.lexicalThis;
        } else {
            self = Terms.isNullish(thisValue) ? realm.globalObject : thisValue;
        }
        s.callPending = true;
        s.callerNode = currentNode;
        s.phase = CALL_RETURNED;
        State body = new State(unwrap(fn.body), env, new CallFrame(fn, self, baseDepth + depth));
        if (!fn.hasExpressionBody()) {
            hoist(fn.body, env, true);
            body.phase = 1;
            body.functionBody = true;
        }
        stack.push(body);
    }

    private void exitFunction(State s) {
        s.callPending = false;
        depth--;
        currentNode = s.callerNode;
    }

    private void callNative(State s, JsNativeFunction fn, Object thisValue, List<Object> args, boolean construct) {
        NativeContext context = new NativeContext(this, thisValue, construct);
        Object[] array = args.toArray();
        if (fn.external) {
            for (int i = 0; i < array.length; i++) {
                if (array[i] == Terms.UNDEFINED) {
                    array[i] = null;
                }
            }
        }
        Object result;
        try {
            result = fn.call(context, array);
        } catch (JsException | EngineException | IllegalStateException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.debug("native function '{}' failed: {}", fn.getName(), e.toString());
            throw JsException.error(e.getMessage() == null ? e.toString() : e.getMessage());
        } finally {
            context.done = true;
        }
        if (context.deferred != null) {
            s.deferred = context.deferred;
            if (s.deferred.isSettled()) {
                s.phase = CALL_RESUMED;
            } else {
                s.phase = CALL_AWAIT;
                awaiting = s.deferred;
                logger.debug("native function '{}' suspended", fn.getName());
            }
            return;
        }
        pop(s, fn.external ? realm.toGuest(result) : result);
    }

    /**
     * Runs a guest function to completion on a separate stack, used by
     * natives calling back into the guest and by implicit conversions.
     * Natives reached this way cannot suspend.
     */
    Object invokeNested(Object function, Object thisValue, List<Object> args) {
        // each nested run holds java stack frames, so it counts as a call level
        checkCallDepth(getDepth());
        Interpreter sub = new Interpreter(engine, realm, true, getDepth() + 1);
        sub.startCall(function, thisValue, args, engine.getGlobalEnv());
        try {
            while (sub.step()) {
                // run to completion
            }
        } catch (StackOverflowError e) {
            throw JsException.rangeError("Maximum call stack size exceeded");
        }
        return sub.callResult;
    }

    //==================================================================================================================
    // references and members

    private void evalRef(State s) {
        Node first = s.node.getFirst();
        if (first.type == NodeType.FN_ARROW_EXPR) {
            pop(s, new JsFunctionNode(realm, first, "", s.env, s.frame.thisValue));
            return;
        }
        String name = first.getText();
        if ("this".equals(name)) {
            pop(s, s.frame.thisValue);
        } else if (s.reference) {
            pop(s, JsProperty.variable(s.env, name));
        } else {
            pop(s, s.env.lookup(name));
        }
    }

    private void evalRefDot(State s) {
        if (s.phase == 0) {
            s.phase = 1;
            State child = push(s, s.node.getFirst());
            child.chain = true;
            return;
        }
        member(s, s.value, s.node.get(2).getText(), s.node.get(1).isToken(TokenType.QUES_DOT));
    }

    private void evalRefBracket(State s) {
        if (s.phase == 0) {
            s.phase = 1;
            State child = push(s, s.node.getFirst());
            child.chain = true;
            return;
        }
        if (s.phase == 1) {
            if (s.value == JsProperty.SHORT_CIRCUIT) {
                shortCircuit(s);
                return;
            }
            s.lhs = s.value;
            s.phase = 2;
            push(s, s.node.get(2));
            return;
        }
        member(s, s.lhs, propertyKey(s.value), false);
    }

    private void member(State s, Object base, String key, boolean optional) {
        if (base == JsProperty.SHORT_CIRCUIT || (optional && Terms.isNullish(base))) {
            shortCircuit(s);
        } else if (s.reference) {
            pop(s, JsProperty.member(base, key));
        } else {
            pop(s, getMember(base, key));
        }
    }

    private void shortCircuit(State s) {
        pop(s, s.chain || s.reference ? JsProperty.SHORT_CIRCUIT : Terms.UNDEFINED);
    }

    String propertyKey(Object value) {
        if (value instanceof JsObject) {
            return stringOf(value);
        }
        return Terms.toPropertyKey(value);
    }

    Object getMember(Object base, String key) {
        if (base instanceof JsObject) {
            return ((JsObject) base).get(key);
        }
        if (Terms.isNullish(base)) {
            throw JsException.typeError("Cannot read properties of " + Terms.toStringValue(base) + " (reading '" + key + "')");
        }
        if (base instanceof String) {
            String text = (String) base;
            if ("length".equals(key)) {
                return text.length();
            }
            int index = JsArray.toIndex(key);
            if (index != -1) {
                return index < text.length() ? String.valueOf(text.charAt(index)) : Terms.UNDEFINED;
            }
        }
        JsObject proto = realm.prototypeOf(base);
        return proto == null ? Terms.UNDEFINED : proto.get(key);
    }

    void setMember(Object base, String key, Object value) {
        if (base instanceof JsObject) {
            ((JsObject) base).put(key, value);
        } else if (Terms.isNullish(base)) {
            throw JsException.typeError("Cannot set properties of " + Terms.toStringValue(base) + " (setting '" + key + "')");
        }
        // writes to primitives are ignored
    }

    //==================================================================================================================
    // literals

    private void evalLitArray(State s) {
        Node node = s.node;
        if (s.phase == 0) {
            s.values = new ArrayList<>();
            s.index = 1;
            s.phase = 1;
        } else {
            s.values.add(s.value);
        }
        while (s.index < node.size() - 1) {
            Node elem = node.get(s.index++);
            if (elem.getFirst().isToken(TokenType.COMMA)) {
                s.values.add(JsArray.HOLE);
                continue;
            }
            push(s, elem.getFirst());
            return;
        }
        pop(s, realm.newArray(s.values));
    }

    private void evalLitObject(State s) {
        Node node = s.node;
        if (s.phase == 0) {
            s.target = realm.newObject();
            s.index = 1;
            s.phase = 1;
        } else {
            defineLiteral((JsObject) s.target, (String) s.lhs, s.value);
        }
        while (s.index < node.size() - 1) {
            Node elem = node.get(s.index++);
            Node keyNode = elem.getFirst();
            String key = literalKey(keyNode);
            if (elem.size() > 1 && elem.get(1).isToken(TokenType.COLON)) {
                s.lhs = key;
                push(s, elem.get(2));
                return;
            }
            defineLiteral((JsObject) s.target, key, s.env.lookup(key));
        }
        pop(s, s.target);
    }

    private static String literalKey(Node keyNode) {
        Token token = keyNode.token;
        switch (token.type) {
            case S_STRING:
            case D_STRING:
                return (String) Terms.literalValue(token);
            case NUMBER:
                return Terms.toStringValue(Terms.toNumber(token.getText()));
            default:
                return token.getText();
        }
    }

    private static void defineLiteral(JsObject object, String key, Object value) {
        if ("__proto__".equals(key)) {
            if (value == null || value instanceof JsObject) {
                object.setPrototype((JsObject) value);
            }
            return;
        }
        if (value instanceof JsFunctionNode) {
            ((JsFunctionNode) value).inferName(key);
        }
        object.put(key, value);
    }

    private void evalLitTemplate(State s) {
        Node node = s.node;
        StringBuilder sb;
        if (s.phase == 0) {
            sb = new StringBuilder();
            s.lhs = sb;
            s.index = 1;
            s.phase = 1;
        } else {
            sb = (StringBuilder) s.lhs;
            sb.append(stringOf(s.value));
        }
        while (s.index < node.size() - 1) {
            Node child = node.get(s.index++);
            if (child.isToken(TokenType.T_STRING)) {
                sb.append(Terms.unescapeString(child.getText()));
            } else if (child.type == NodeType.EXPR) {
                push(s, child);
                return;
            }
        }
        pop(s, sb.toString());
    }

    //==================================================================================================================
    // operators

    private void evalAssign(State s) {
        Node node = s.node;
        TokenType op = node.get(1).token.type;
        if (s.phase == 0) {
            s.phase = 1;
            State child = push(s, node.getFirst());
            child.reference = true;
            return;
        }
        if (s.phase == 1) {
            JsProperty ref = (JsProperty) s.value;
            s.lhs = ref;
            if (op != TokenType.EQ) {
                Object current = ref.get(this);
                s.target = current;
                if ((op == TokenType.AMP_AMP_EQ && !Terms.isTruthy(current))
                        || (op == TokenType.PIPE_PIPE_EQ && Terms.isTruthy(current))) {
                    pop(s, current);
                    return;
                }
            }
            s.phase = 2;
            push(s, node.get(2));
            return;
        }
        JsProperty ref = (JsProperty) s.lhs;
        Object value = s.value;
        if (op == TokenType.EQ) {
            if (value instanceof JsFunctionNode && ref.isVariable()) {
                ((JsFunctionNode) value).inferName(ref.name);
            }
        } else if (op != TokenType.AMP_AMP_EQ && op != TokenType.PIPE_PIPE_EQ) {
            value = binary(compoundOperator(op), s.target, value);
        }
        ref.set(this, value);
        pop(s, value);
    }

    private static TokenType compoundOperator(TokenType op) {
        switch (op) {
            case PLUS_EQ:
                return TokenType.PLUS;
            case MINUS_EQ:
                return TokenType.MINUS;
            case STAR_EQ:
                return TokenType.STAR;
            case SLASH_EQ:
                return TokenType.SLASH;
            case PERCENT_EQ:
                return TokenType.PERCENT;
            case STAR_STAR_EQ:
                return TokenType.STAR_STAR;
            case AMP_EQ:
                return TokenType.AMP;
            case PIPE_EQ:
                return TokenType.PIPE;
            case CARET_EQ:
                return TokenType.CARET;
            case LT_LT_EQ:
                return TokenType.LT_LT;
            case GT_GT_EQ:
                return TokenType.GT_GT;
            case GT_GT_GT_EQ:
                return TokenType.GT_GT_GT;
            default:
                throw new IllegalStateException("not a compound assignment: " + op);
        }
    }

    private void evalTernary(State s) {
        Node node = s.node;
        if (s.phase == 0) {
            s.phase = 1;
            push(s, node.getFirst());
        } else if (s.phase == 1) {
            s.phase = 2;
            push(s, Terms.isTruthy(s.value) ? node.get(2) : node.get(4));
        } else {
            pop(s, s.value);
        }
    }

    private void evalShortCircuit(State s) {
        Node node = s.node;
        if (s.phase == 0) {
            s.phase = 1;
            push(s, node.getFirst());
            return;
        }
        if (s.phase == 1) {
            Object lhs = s.value;
            boolean done;
            switch (node.get(1).token.type) {
                case AMP_AMP:
                    done = !Terms.isTruthy(lhs);
                    break;
                case PIPE_PIPE:
                    done = Terms.isTruthy(lhs);
                    break;
                default: // QUES_QUES
                    done = !Terms.isNullish(lhs);
            }
            if (done) {
                pop(s, lhs);
            } else {
                s.phase = 2;
                push(s, node.get(2));
            }
            return;
        }
        pop(s, s.value);
    }

    private void evalBinary(State s) {
        if (s.phase == 0) {
            s.phase = 1;
            push(s, s.node.getFirst());
        } else if (s.phase == 1) {
            s.lhs = s.value;
            s.phase = 2;
            push(s, s.node.get(2));
        } else {
            pop(s, binary(s.node.get(1).token.type, s.lhs, s.value));
        }
    }

    Object binary(TokenType op, Object lhs, Object rhs) {
        switch (op) {
            case PLUS:
                return Terms.add(toPrimitive(lhs, false), toPrimitive(rhs, false));
            case MINUS:
                return terms(lhs, rhs).min();
            case STAR:
                return terms(lhs, rhs).mul();
            case SLASH:
                return terms(lhs, rhs).div();
            case PERCENT:
                return terms(lhs, rhs).mod();
            case STAR_STAR:
                return terms(lhs, rhs).exp();
            case AMP:
                return terms(lhs, rhs).bitAnd();
            case PIPE:
                return terms(lhs, rhs).bitOr();
            case CARET:
                return terms(lhs, rhs).bitXor();
            case LT_LT:
                return terms(lhs, rhs).bitShiftLeft();
            case GT_GT:
                return terms(lhs, rhs).bitShiftRight();
            case GT_GT_GT:
                return terms(lhs, rhs).bitShiftRightUnsigned();
            case EQ_EQ_EQ:
                return Terms.eq(lhs, rhs, true);
            case NOT_EQ_EQ:
                return !Terms.eq(lhs, rhs, true);
            case EQ_EQ:
                return looseEquals(lhs, rhs);
            case NOT_EQ:
                return !looseEquals(lhs, rhs);
            case LT:
                return Terms.lt(toPrimitive(lhs, false), toPrimitive(rhs, false));
            case GT:
                return Terms.gt(toPrimitive(lhs, false), toPrimitive(rhs, false));
            case LT_EQ:
                return Terms.ltEq(toPrimitive(lhs, false), toPrimitive(rhs, false));
            case GT_EQ:
                return Terms.gtEq(toPrimitive(lhs, false), toPrimitive(rhs, false));
            case INSTANCEOF:
                return instanceOf(lhs, rhs);
            default:
                throw new IllegalStateException("not a binary operator: " + op);
        }
    }

    private Terms terms(Object lhs, Object rhs) {
        return new Terms(toPrimitive(lhs, false), toPrimitive(rhs, false));
    }

    private boolean looseEquals(Object lhs, Object rhs) {
        boolean lhsObject = lhs instanceof JsObject;
        boolean rhsObject = rhs instanceof JsObject;
        if (lhsObject && !rhsObject && !Terms.isNullish(rhs)) {
            return Terms.eq(toPrimitive(lhs, false), rhs, false);
        }
        if (rhsObject && !lhsObject && !Terms.isNullish(lhs)) {
            return Terms.eq(lhs, toPrimitive(rhs, false), false);
        }
        return Terms.eq(lhs, rhs, false);
    }

    private boolean instanceOf(Object lhs, Object rhs) {
        if (!(rhs instanceof JsFunction)) {
            throw JsException.typeError("Right-hand side of 'instanceof' is not callable");
        }
        while (rhs instanceof JsBoundFunction) {
            rhs = ((JsBoundFunction) rhs).target;
        }
        if (!(lhs instanceof JsObject)) {
            return false;
        }
        Object proto = ((JsFunction) rhs).get("prototype");
        if (!(proto instanceof JsObject)) {
            throw JsException.typeError("Function has non-object prototype '" + Terms.toStringValue(proto) + "' in instanceof check");
        }
        JsObject current = ((JsObject) lhs).getPrototype();
        while (current != null) {
            if (current == proto) {
                return true;
            }
            current = current.getPrototype();
        }
        return false;
    }

    private Number toNumeric(Object value) {
        return Terms.objectToNumber(toPrimitive(value, false));
    }

    private void evalPrefix(State s) {
        Node node = s.node;
        TokenType op = node.getFirst().token.type;
        boolean update = op == TokenType.PLUS_PLUS || op == TokenType.MINUS_MINUS;
        if (s.phase == 0) {
            s.phase = 1;
            State child = push(s, node.get(1));
            child.reference = update;
            return;
        }
        if (update) {
            JsProperty ref = (JsProperty) s.value;
            Object updated = Terms.add(toNumeric(ref.get(this)), op == TokenType.PLUS_PLUS ? 1 : -1);
            ref.set(this, updated);
            pop(s, updated);
        } else if (op == TokenType.MINUS) {
            pop(s, Terms.negate(toNumeric(s.value)));
        } else {
            pop(s, toNumeric(s.value));
        }
    }

    private void evalPostfix(State s) {
        Node node = s.node;
        if (s.phase == 0) {
            s.phase = 1;
            State child = push(s, node.getFirst());
            child.reference = true;
            return;
        }
        JsProperty ref = (JsProperty) s.value;
        Number old = toNumeric(ref.get(this));
        ref.set(this, Terms.add(old, node.get(1).isToken(TokenType.PLUS_PLUS) ? 1 : -1));
        pop(s, old);
    }

    private void evalUnary(State s) {
        if (s.phase == 0) {
            s.phase = 1;
            push(s, s.node.get(1));
            return;
        }
        if (s.node.getFirst().isToken(TokenType.NOT)) {
            pop(s, !Terms.isTruthy(s.value));
        } else {
            pop(s, Terms.bitNot(toPrimitive(s.value, false)));
        }
    }

    private void evalTypeof(State s) {
        Node operand = unwrap(s.node.get(1));
        boolean identifier = operand.type == NodeType.REF_EXPR && isReference(operand);
        if (s.phase == 0) {
            s.phase = 1;
            State child = push(s, operand);
            child.reference = identifier;
            return;
        }
        if (identifier) {
            JsProperty ref = (JsProperty) s.value;
            if (!s.env.has(ref.name)) {
                pop(s, "undefined");
                return;
            }
            pop(s, Terms.typeOf(ref.get(this)));
            return;
        }
        pop(s, Terms.typeOf(s.value));
    }

    private void evalDelete(State s) {
        Node operand = unwrap(s.node.get(1));
        boolean member = operand.type == NodeType.REF_DOT_EXPR || operand.type == NodeType.REF_BRACKET_EXPR;
        if (s.phase == 0) {
            if (operand.type == NodeType.REF_EXPR && isReference(operand)) {
                pop(s, false); // bindings cannot be deleted
                return;
            }
            s.phase = 1;
            State child = push(s, operand);
            child.reference = member;
            return;
        }
        if (!member) {
            pop(s, true);
            return;
        }
        JsProperty ref = (JsProperty) s.value;
        if (ref.isShortCircuit()) {
            pop(s, true);
            return;
        }
        if (Terms.isNullish(ref.object)) {
            throw JsException.typeError("Cannot convert undefined or null to object");
        }
        pop(s, !(ref.object instanceof JsObject) || ((JsObject) ref.object).delete(ref.name));
    }

    //==================================================================================================================
    // conversions that may call back into the guest

    /**
     * valueOf then toString, or the reverse when a string is preferred.
     */
    Object toPrimitive(Object value, boolean preferString) {
        if (!(value instanceof JsObject)) {
            return value;
        }
        JsObject object = (JsObject) value;
        String[] order = preferString ? new String[]{"toString", "valueOf"} : new String[]{"valueOf", "toString"};
        for (String name : order) {
            Object method = object.get(name);
            if (method instanceof JsFunction) {
                Object result = invokeNested(method, object, new ArrayList<>());
                if (!(result instanceof JsObject)) {
                    return result;
                }
            }
        }
        throw JsException.typeError("Cannot convert object to primitive value");
    }

    String stringOf(Object value) {
        return Terms.toStringValue(toPrimitive(value, true));
    }

}
