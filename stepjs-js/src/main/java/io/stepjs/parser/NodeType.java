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

/**
 * Node kinds of the concrete syntax tree produced by {@link JsParser}.
 * <p>
 * This is the node-shape contract the evaluator relies on. Child layouts are
 * listed in brackets, tokens in capitals, optional parts with {@code ?} and
 * repeats with {@code *}. Wherever a layout says {@code EXPR} the child is an
 * {@link #EXPR} wrapper whose only child is the actual expression node. A
 * left operand moved into a binary node by precedence climbing is the bare
 * expression node (not wrapped).
 */
public enum NodeType {

    /** synthetic parent used by the parser (and the evaluator for host-initiated calls) */
    ROOT,
    /** leaf, see {@link Node#token} */
    TOKEN,
    /** [STATEMENT*, EOF] */
    PROGRAM,
    /** [inner, EOS?] where inner is a statement node, an EXPR_LIST or a SEMI token (empty statement) */
    STATEMENT,
    /** [SEMI] */
    EOS,
    /** [L_CURLY, STATEMENT*, R_CURLY] */
    BLOCK,
    /** [expression] */
    EXPR,
    /** [EXPR, (COMMA, EXPR)*] evaluates to the last value */
    EXPR_LIST,
    /** [VAR|LET|CONST, VAR_DECL, (COMMA, VAR_DECL)*] */
    VAR_STMT,
    /** [IDENT, (EQ, EXPR)?] */
    VAR_DECL,
    /** [IF, L_PAREN, EXPR, R_PAREN, STATEMENT, (ELSE, STATEMENT)?] */
    IF_STMT,
    /**
     * C-style: [FOR, L_PAREN, FOR_INIT, SEMI, FOR_COND, SEMI, FOR_UPDATE, R_PAREN, STATEMENT]<br>
     * for-in / for-of: [FOR, L_PAREN, FOR_INIT, IN|OF, EXPR, R_PAREN, STATEMENT]
     */
    FOR_STMT,
    /** [(VAR_STMT | EXPR_LIST)?] */
    FOR_INIT,
    /** [EXPR?] */
    FOR_COND,
    /** [EXPR_LIST?] */
    FOR_UPDATE,
    /** [WHILE, L_PAREN, EXPR, R_PAREN, STATEMENT] */
    WHILE_STMT,
    /** [DO, STATEMENT, WHILE, L_PAREN, EXPR, R_PAREN, EOS?] */
    DO_WHILE_STMT,
    /** [SWITCH, L_PAREN, EXPR, R_PAREN, L_CURLY, (CASE_BLOCK | DEFAULT_BLOCK)*, R_CURLY] */
    SWITCH_STMT,
    /** [CASE, EXPR, COLON, STATEMENT*] */
    CASE_BLOCK,
    /** [DEFAULT, COLON, STATEMENT*] */
    DEFAULT_BLOCK,
    /** [BREAK, IDENT?] */
    BREAK_STMT,
    /** [CONTINUE, IDENT?] */
    CONTINUE_STMT,
    /** [RETURN, EXPR?] */
    RETURN_STMT,
    /** [THROW, EXPR] */
    THROW_STMT,
    /**
     * [TRY, BLOCK, CATCH, L_PAREN, IDENT, R_PAREN, BLOCK, (FINALLY, BLOCK)?]<br>
     * [TRY, BLOCK, CATCH, BLOCK, (FINALLY, BLOCK)?]<br>
     * [TRY, BLOCK, FINALLY, BLOCK]
     */
    TRY_STMT,
    /** [IDENT, COLON, STATEMENT] */
    LABELED_STMT,
    /**
     * [FUNCTION, IDENT?, FN_DECL_ARGS, BLOCK], a declaration when the parent is a STATEMENT
     */
    FN_EXPR,
    /** [FN_DECL_ARGS | IDENT, EQ_GT, BLOCK | EXPR] */
    FN_ARROW_EXPR,
    /** [L_PAREN, FN_DECL_ARG*, R_PAREN] */
    FN_DECL_ARGS,
    /** [IDENT, COMMA?] */
    FN_DECL_ARG,
    /** [callee, L_PAREN, FN_CALL_ARGS, R_PAREN] */
    FN_CALL_EXPR,
    /** [FN_CALL_ARG*] */
    FN_CALL_ARGS,
    /** [EXPR, COMMA?] */
    FN_CALL_ARG,
    /** [NEW, EXPR] where the EXPR holds a FN_CALL_EXPR (with arguments) or the bare constructor reference */
    NEW_EXPR,
    /** [IDENT] or [FN_ARROW_EXPR] for a single-parameter arrow function */
    REF_EXPR,
    /** [object, DOT|QUES_DOT, IDENT or keyword] */
    REF_DOT_EXPR,
    /** [object, L_BRACKET, EXPR, R_BRACKET] */
    REF_BRACKET_EXPR,
    /** [S_STRING|D_STRING|NUMBER|TRUE|FALSE|NULL] or [LIT_ARRAY] or [LIT_OBJECT] or [LIT_TEMPLATE] */
    LIT_EXPR,
    /** [L_BRACKET, ARRAY_ELEM*, R_BRACKET] */
    LIT_ARRAY,
    /** [EXPR, COMMA?] or [COMMA] for a hole */
    ARRAY_ELEM,
    /** [L_CURLY, OBJECT_ELEM*, R_CURLY] */
    LIT_OBJECT,
    /** [IDENT|S_STRING|D_STRING|NUMBER|keyword, COLON, EXPR, COMMA?] or shorthand [IDENT, COMMA?] */
    OBJECT_ELEM,
    /** [BACKTICK, (T_STRING | DOLLAR_L_CURLY, EXPR, R_CURLY)*, BACKTICK] */
    LIT_TEMPLATE,
    /** [L_PAREN, EXPR, R_PAREN] */
    PAREN_EXPR,
    /** [target, EQ|PLUS_EQ|MINUS_EQ|..., EXPR] where target is a REF_EXPR, REF_DOT_EXPR or REF_BRACKET_EXPR */
    ASSIGN_EXPR,
    /** [condition, QUES, EXPR, COLON, EXPR] */
    LOGIC_TERN_EXPR,
    /** [lhs, AMP_AMP|PIPE_PIPE, EXPR] */
    LOGIC_AND_EXPR,
    /** [lhs, QUES_QUES, EXPR] */
    LOGIC_NULLISH_EXPR,
    /** [lhs, EQ_EQ|EQ_EQ_EQ|NOT_EQ|NOT_EQ_EQ|LT|GT|LT_EQ|GT_EQ, EXPR] */
    LOGIC_EXPR,
    /** [lhs, AMP|PIPE|CARET|LT_LT|GT_GT|GT_GT_GT, EXPR] */
    LOGIC_BIT_EXPR,
    /** [lhs, INSTANCEOF, EXPR] */
    INSTANCEOF_EXPR,
    /** [lhs, PLUS|MINUS, EXPR] */
    MATH_ADD_EXPR,
    /** [lhs, STAR|SLASH|PERCENT, EXPR] */
    MATH_MUL_EXPR,
    /** [lhs, STAR_STAR, rhs] right associative */
    MATH_EXP_EXPR,
    /** [PLUS_PLUS|MINUS_MINUS|PLUS|MINUS, EXPR] */
    MATH_PRE_EXPR,
    /** [operand, PLUS_PLUS|MINUS_MINUS] */
    MATH_POST_EXPR,
    /** [NOT|TILDE, EXPR] */
    UNARY_EXPR,
    /** [TYPEOF, EXPR] */
    TYPEOF_EXPR,
    /** [DELETE, EXPR] */
    DELETE_EXPR

}
