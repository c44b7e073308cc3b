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

import static io.stepjs.parser.TokenType.*;

/**
 * Recursive descent parser with precedence climbing for binary operators.
 * See {@link NodeType} for the shape of every node produced.
 */
public class JsParser extends BaseParser {

    private static final TokenType[] T_VAR_STMT = {VAR, CONST, LET};
    private static final TokenType[] T_ASSIGN_EXPR = {EQ, PLUS_EQ, MINUS_EQ, STAR_EQ, SLASH_EQ, PERCENT_EQ, STAR_STAR_EQ,
            GT_GT_EQ, LT_LT_EQ, GT_GT_GT_EQ, AMP_EQ, PIPE_EQ, CARET_EQ, AMP_AMP_EQ, PIPE_PIPE_EQ};
    private static final TokenType[] T_LOGIC_EQ_EXPR = {EQ_EQ_EQ, NOT_EQ_EQ, EQ_EQ, NOT_EQ};
    private static final TokenType[] T_LOGIC_CMP_EXPR = {LT, GT, LT_EQ, GT_EQ};
    private static final TokenType[] T_LOGIC_SHIFT_EXPR = {GT_GT, LT_LT, GT_GT_GT};
    private static final TokenType[] T_MATH_ADD_EXPR = {PLUS, MINUS};
    private static final TokenType[] T_MATH_MUL_EXPR = {STAR, SLASH, PERCENT};
    private static final TokenType[] T_REF_DOT_EXPR = {DOT, QUES_DOT};
    private static final TokenType[] T_MATH_POST_EXPR = {PLUS_PLUS, MINUS_MINUS};
    private static final TokenType[] T_UNARY_EXPR = {NOT, TILDE};
    private static final TokenType[] T_MATH_PRE_EXPR = {PLUS_PLUS, MINUS_MINUS, MINUS, PLUS};
    private static final TokenType[] T_OBJECT_KEY = {IDENT, S_STRING, D_STRING, NUMBER};
    private static final TokenType[] T_LIT_EXPR = {S_STRING, D_STRING, NUMBER, TRUE, FALSE, NULL};
    private static final TokenType[] T_FOR_IN_OF = {IN, OF};

    public JsParser(Resource resource) {
        super(resource, JsLexer.getTokens(resource));
    }

    public Node parse() {
        enter(NodeType.PROGRAM);
        Node program = markerNode();
        while (true) {
            if (!statement(false)) {
                break;
            }
        }
        if (!consumeIf(EOF)) {
            error("cannot parse statement");
        }
        exit();
        return program;
    }

    private boolean statement(boolean mandatory) {
        enter(NodeType.STATEMENT);
        boolean result = if_stmt()
                || (var_stmt(false) && eos())
                || (return_stmt() && eos())
                || (throw_stmt() && eos())
                || try_stmt()
                || for_stmt()
                || while_stmt()
                || do_while_stmt()
                || switch_stmt()
                || (break_stmt() && eos())
                || (continue_stmt() && eos())
                || labeled_stmt()
                || fn_expr() // function declarations don't need eos
                || (expr_list() && eos())
                || block(false)
                || consumeIf(SEMI); // empty statement
        return exit(result, mandatory);
    }

    private boolean eos() {
        if (enter(NodeType.EOS, SEMI)) {
            return exit();
        }
        Token next = peekToken();
        if (next.type == R_CURLY || next.type == EOF) {
            return true;
        }
        return next.isPrecededByNewLine();
    }

    private boolean expr_list() {
        enter(NodeType.EXPR_LIST);
        boolean atLeastOne = false;
        while (expr(-1, atLeastOne)) {
            atLeastOne = true;
            if (!consumeIf(COMMA)) {
                break;
            }
        }
        return exit(atLeastOne, false);
    }

    private boolean if_stmt() {
        if (!enter(NodeType.IF_STMT, IF)) {
            return false;
        }
        consume(L_PAREN);
        expr(-1, true);
        consume(R_PAREN);
        statement(true);
        if (consumeIf(ELSE)) {
            statement(true);
        }
        return exit();
    }

    private boolean var_stmt(boolean forLoop) {
        if (!enter(NodeType.VAR_STMT, T_VAR_STMT)) {
            return false;
        }
        boolean isConst = lastConsumed() == CONST;
        do {
            var_decl(isConst && !forLoop);
        } while (consumeIf(COMMA));
        return exit();
    }

    private void var_decl(boolean initRequired) {
        enter(NodeType.VAR_DECL);
        if (peekIf(L_CURLY) || peekIf(L_BRACKET)) {
            error("destructuring is not supported");
        }
        consume(IDENT);
        if (consumeIf(EQ)) {
            expr(-1, true);
        } else if (initRequired) {
            error("missing initializer in const declaration");
        }
        exit();
    }

    private boolean return_stmt() {
        if (!enter(NodeType.RETURN_STMT, RETURN)) {
            return false;
        }
        if (!peekToken().isPrecededByNewLine()) { // "return\nfoo" returns undefined
            expr(-1, false);
        }
        return exit();
    }

    private boolean throw_stmt() {
        if (!enter(NodeType.THROW_STMT, THROW)) {
            return false;
        }
        expr(-1, true);
        return exit();
    }

    private boolean try_stmt() {
        if (!enter(NodeType.TRY_STMT, TRY)) {
            return false;
        }
        block(true);
        if (consumeIf(CATCH)) {
            if (consumeIf(L_PAREN)) {
                consume(IDENT);
                consume(R_PAREN);
            }
            block(true);
            if (consumeIf(FINALLY)) {
                block(true);
            }
        } else if (consumeIf(FINALLY)) {
            block(true);
        } else {
            error("expected " + CATCH + " or " + FINALLY);
        }
        return exit();
    }

    private boolean for_stmt() {
        if (!enter(NodeType.FOR_STMT, FOR)) {
            return false;
        }
        consume(L_PAREN);
        enter(NodeType.FOR_INIT);
        boolean hasInit = var_stmt(true) || expr_list();
        exit();
        if (hasInit && anyOf(T_FOR_IN_OF)) {
            expr(-1, true);
        } else {
            consume(SEMI);
            enter(NodeType.FOR_COND);
            expr(-1, false);
            exit();
            consume(SEMI);
            enter(NodeType.FOR_UPDATE);
            expr_list();
            exit();
        }
        consume(R_PAREN);
        statement(true);
        return exit();
    }

    private boolean while_stmt() {
        if (!enter(NodeType.WHILE_STMT, WHILE)) {
            return false;
        }
        consume(L_PAREN);
        expr(-1, true);
        consume(R_PAREN);
        statement(true);
        return exit();
    }

    private boolean do_while_stmt() {
        if (!enter(NodeType.DO_WHILE_STMT, DO)) {
            return false;
        }
        statement(true);
        consume(WHILE);
        consume(L_PAREN);
        expr(-1, true);
        consume(R_PAREN);
        if (enter(NodeType.EOS, SEMI)) {
            exit();
        }
        return exit();
    }

    private boolean switch_stmt() {
        if (!enter(NodeType.SWITCH_STMT, SWITCH)) {
            return false;
        }
        consume(L_PAREN);
        expr(-1, true);
        consume(R_PAREN);
        consume(L_CURLY);
        boolean hasDefault = false;
        while (true) {
            if (case_block()) {
                continue;
            }
            if (peekIf(DEFAULT)) {
                if (hasDefault) {
                    error("more than one default clause in switch statement");
                }
                hasDefault = default_block();
                continue;
            }
            break;
        }
        consume(R_CURLY);
        return exit();
    }

    private boolean case_block() {
        if (!enter(NodeType.CASE_BLOCK, CASE)) {
            return false;
        }
        expr(-1, true);
        consume(COLON);
        case_statements();
        return exit();
    }

    private boolean default_block() {
        if (!enter(NodeType.DEFAULT_BLOCK, DEFAULT)) {
            return false;
        }
        consume(COLON);
        case_statements();
        return exit();
    }

    private void case_statements() {
        while (true) {
            if (peekIf(CASE) || peekIf(DEFAULT) || peekIf(R_CURLY) || peekIf(EOF)) {
                break;
            }
            if (!statement(false)) {
                break;
            }
        }
    }

    private boolean break_stmt() {
        if (!enter(NodeType.BREAK_STMT, BREAK)) {
            return false;
        }
        label();
        return exit();
    }

    private boolean continue_stmt() {
        if (!enter(NodeType.CONTINUE_STMT, CONTINUE)) {
            return false;
        }
        label();
        return exit();
    }

    private void label() {
        if (peekIf(IDENT) && !peekToken().isPrecededByNewLine()) {
            consumeNext();
        }
    }

    private boolean labeled_stmt() {
        if (!peekIf(IDENT) || peekAhead(1) != COLON) {
            return false;
        }
        enter(NodeType.LABELED_STMT);
        consume(IDENT);
        consume(COLON);
        statement(true);
        return exit();
    }

    private boolean block(boolean mandatory) {
        if (!enter(NodeType.BLOCK, L_CURLY)) {
            if (mandatory) {
                error(NodeType.BLOCK);
            }
            return false;
        }
        while (true) {
            if (peekIf(R_CURLY) || peekIf(EOF)) {
                break;
            }
            if (!statement(false)) {
                break;
            }
        }
        consume(R_CURLY);
        return exit();
    }

    //==================================================================================================================
    //
    private boolean expr(int priority, boolean mandatory) {
        if (peekIf(REGEX)) {
            error("regular expression literals are not supported");
        }
        enter(NodeType.EXPR);
        boolean result = ref_expr() // also handles single-arg arrow functions without parentheses
                || lit_expr()
                || fn_expr()
                || fn_arrow_expr()
                || paren_expr()
                || unary_expr()
                || math_pre_expr()
                || new_expr()
                || typeof_expr()
                || delete_expr();
        if (result) {
            expr_rhs(priority);
        }
        return exit(result, mandatory);
    }

    private void expr_rhs(int priority) {
        while (true) {
            if (priority < 0 && enter(NodeType.ASSIGN_EXPR, T_ASSIGN_EXPR)) {
                expr(-1, true);
                exit(Shift.RIGHT);
            } else if (priority < 1 && enter(NodeType.LOGIC_TERN_EXPR, QUES)) {
                expr(-1, true);
                consume(COLON);
                expr(-1, true);
                exit(Shift.RIGHT);
            } else if (priority < 2 && enter(NodeType.LOGIC_AND_EXPR, PIPE_PIPE)) {
                expr(2, true);
                exit(Shift.LEFT);
            } else if (priority < 2 && enter(NodeType.LOGIC_NULLISH_EXPR, QUES_QUES)) {
                expr(2, true);
                exit(Shift.LEFT);
            } else if (priority < 3 && enter(NodeType.LOGIC_AND_EXPR, AMP_AMP)) {
                expr(3, true);
                exit(Shift.LEFT);
            } else if (priority < 4 && enter(NodeType.LOGIC_BIT_EXPR, PIPE)) {
                expr(4, true);
                exit(Shift.LEFT);
            } else if (priority < 5 && enter(NodeType.LOGIC_BIT_EXPR, CARET)) {
                expr(5, true);
                exit(Shift.LEFT);
            } else if (priority < 6 && enter(NodeType.LOGIC_BIT_EXPR, AMP)) {
                expr(6, true);
                exit(Shift.LEFT);
            } else if (priority < 7 && enter(NodeType.LOGIC_EXPR, T_LOGIC_EQ_EXPR)) {
                expr(7, true);
                exit(Shift.LEFT);
            } else if (priority < 8 && enter(NodeType.LOGIC_EXPR, T_LOGIC_CMP_EXPR)) {
                expr(8, true);
                exit(Shift.LEFT);
            } else if (priority < 8 && enter(NodeType.INSTANCEOF_EXPR, INSTANCEOF)) {
                expr(8, true);
                exit(Shift.LEFT);
            } else if (priority < 9 && enter(NodeType.LOGIC_BIT_EXPR, T_LOGIC_SHIFT_EXPR)) {
                expr(9, true);
                exit(Shift.LEFT);
            } else if (priority < 10 && enter(NodeType.MATH_ADD_EXPR, T_MATH_ADD_EXPR)) {
                expr(10, true);
                exit(Shift.LEFT);
            } else if (priority < 11 && enter(NodeType.MATH_MUL_EXPR, T_MATH_MUL_EXPR)) {
                expr(11, true);
                exit(Shift.LEFT);
            } else if (priority < 12 && peekIf(STAR_STAR)) {
                do {
                    enter(NodeType.MATH_EXP_EXPR);
                    consumeNext();
                    expr(12, true);
                    exit(Shift.RIGHT);
                } while (peekIf(STAR_STAR));
            } else if (enter(NodeType.FN_CALL_EXPR, L_PAREN)) {
                fn_call_args();
                consume(R_PAREN);
                exit(Shift.LEFT);
                // new binds to the first call expression only
                // new Foo().bar() parses as (new Foo()).bar()
                if (isCallerType(NodeType.NEW_EXPR)) {
                    break;
                }
            } else if (enter(NodeType.REF_DOT_EXPR, T_REF_DOT_EXPR)) {
                // reserved words are allowed as property names
                TokenType dotNext = peek();
                if (dotNext == IDENT || dotNext.keyword) {
                    consumeNext();
                } else {
                    error(IDENT);
                }
                exit(Shift.LEFT);
            } else if (enter(NodeType.REF_BRACKET_EXPR, L_BRACKET)) {
                expr(-1, true);
                consume(R_BRACKET);
                exit(Shift.LEFT);
            } else if (peekAnyOf(T_MATH_POST_EXPR) && !peekToken().isPrecededByNewLine()) {
                enter(NodeType.MATH_POST_EXPR, T_MATH_POST_EXPR);
                exit(Shift.LEFT);
            } else {
                break;
            }
        }
    }

    private boolean fn_arrow_expr() {
        enter(NodeType.FN_ARROW_EXPR);
        // what looks like arrow function args may not be, e.g: "(function(){})"
        // so fn_decl_args() re-winds and paren_expr() gets its turn
        if (fn_decl_args() && consumeIf(EQ_GT)) {
            if (block(false) || expr(-1, false)) {
                return exit();
            }
            error(NodeType.BLOCK, NodeType.EXPR);
        }
        return exit(false, false);
    }

    private boolean fn_expr() {
        if (!enter(NodeType.FN_EXPR, FUNCTION)) {
            return false;
        }
        if (peekIf(STAR)) {
            error("generator functions are not supported");
        }
        consumeIf(IDENT);
        if (!fn_decl_args()) {
            error(NodeType.FN_DECL_ARGS);
        }
        block(true);
        return exit();
    }

    private boolean fn_decl_args() {
        if (!enter(NodeType.FN_DECL_ARGS, L_PAREN)) {
            return false;
        }
        while (true) {
            if (peekIf(R_PAREN) || peekIf(EOF)) {
                break;
            }
            if (!fn_decl_arg()) {
                break;
            }
        }
        return exit(consumeIf(R_PAREN), false);
    }

    private boolean fn_decl_arg() {
        enter(NodeType.FN_DECL_ARG);
        boolean result = consumeIf(IDENT) && (consumeIf(COMMA) || peekIf(R_PAREN));
        return exit(result, false);
    }

    private void fn_call_args() {
        enter(NodeType.FN_CALL_ARGS);
        while (true) {
            if (peekIf(R_PAREN) || peekIf(EOF)) {
                break;
            }
            if (peekIf(DOT_DOT_DOT)) {
                error("spread arguments are not supported");
            }
            if (!fn_call_arg()) {
                break;
            }
        }
        exit();
    }

    private boolean fn_call_arg() {
        enter(NodeType.FN_CALL_ARG);
        boolean result = expr(-1, false) && (consumeIf(COMMA) || peekIf(R_PAREN));
        return exit(result, false);
    }

    private boolean new_expr() {
        if (!enter(NodeType.NEW_EXPR, NEW)) {
            return false;
        }
        expr(13, true);
        return exit();
    }

    private boolean typeof_expr() {
        if (!enter(NodeType.TYPEOF_EXPR, TYPEOF)) {
            return false;
        }
        expr(13, true);
        return exit();
    }

    private boolean delete_expr() {
        if (!enter(NodeType.DELETE_EXPR, DELETE)) {
            return false;
        }
        expr(13, true);
        return exit();
    }

    private boolean ref_expr() {
        if (!enter(NodeType.REF_EXPR, IDENT)) {
            return false;
        }
        if (enter(NodeType.FN_ARROW_EXPR, EQ_GT)) {
            if (block(false) || expr(-1, false)) {
                exit(Shift.LEFT); // the identifier becomes the single parameter
            } else {
                error(NodeType.BLOCK, NodeType.EXPR);
            }
        }
        return exit();
    }

    private boolean lit_expr() {
        enter(NodeType.LIT_EXPR);
        boolean result = anyOf(T_LIT_EXPR)
                || lit_object()
                || lit_array()
                || lit_template();
        return exit(result, false);
    }

    private boolean lit_template() {
        if (!enter(NodeType.LIT_TEMPLATE, BACKTICK)) {
            return false;
        }
        while (true) {
            if (peek() == EOF) {
                error(BACKTICK);
            }
            if (consumeIf(BACKTICK)) {
                break;
            }
            if (!consumeIf(T_STRING)) {
                consume(DOLLAR_L_CURLY);
                expr(-1, true);
                consume(R_CURLY);
            }
        }
        return exit();
    }

    private boolean unary_expr() {
        if (!enter(NodeType.UNARY_EXPR, T_UNARY_EXPR)) {
            return false;
        }
        expr(13, true);
        return exit();
    }

    private boolean math_pre_expr() {
        if (!enter(NodeType.MATH_PRE_EXPR, T_MATH_PRE_EXPR)) {
            return false;
        }
        expr(13, true);
        return exit();
    }

    private boolean lit_object() {
        if (!enter(NodeType.LIT_OBJECT, L_CURLY)) {
            return false;
        }
        while (true) {
            if (peekIf(R_CURLY) || peekIf(EOF)) {
                break;
            }
            if (!object_elem()) {
                break;
            }
        }
        return exit(consumeIf(R_CURLY), false);
    }

    private boolean object_elem() {
        enter(NodeType.OBJECT_ELEM);
        TokenType keyType = peek();
        if (!(peekAnyOf(T_OBJECT_KEY) || keyType.keyword)) {
            return exit(false, false);
        }
        consumeNext();
        if (keyType == IDENT && (consumeIf(COMMA) || peekIf(R_CURLY))) { // shorthand
            return exit();
        }
        if (!consumeIf(COLON)) {
            return exit(false, false); // could be a block
        }
        expr(-1, true);
        if (!(consumeIf(COMMA) || peekIf(R_CURLY))) {
            error(COMMA, R_CURLY);
        }
        return exit();
    }

    private boolean lit_array() {
        if (!enter(NodeType.LIT_ARRAY, L_BRACKET)) {
            return false;
        }
        while (true) {
            if (peekIf(R_BRACKET) || peekIf(EOF)) {
                break;
            }
            if (peekIf(DOT_DOT_DOT)) {
                error("spread elements are not supported");
            }
            array_elem();
        }
        consume(R_BRACKET);
        return exit();
    }

    private void array_elem() {
        enter(NodeType.ARRAY_ELEM);
        boolean hole = consumeIf(COMMA);
        if (!hole) {
            expr(-1, true);
            if (!(consumeIf(COMMA) || peekIf(R_BRACKET))) {
                error(COMMA, R_BRACKET);
            }
        }
        exit();
    }

    private boolean paren_expr() {
        if (!enter(NodeType.PAREN_EXPR, L_PAREN)) {
            return false;
        }
        expr(-1, true);
        consume(R_PAREN);
        return exit();
    }

}
