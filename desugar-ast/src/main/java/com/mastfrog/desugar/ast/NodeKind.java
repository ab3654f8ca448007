/*
 * The MIT License
 *
 * Copyright 2019 Mastfrog Technologies.
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
package com.mastfrog.desugar.ast;

import static com.mastfrog.desugar.ast.NodeCategory.DECLARATION;
import static com.mastfrog.desugar.ast.NodeCategory.EXPRESSION;
import static com.mastfrog.desugar.ast.NodeCategory.STATEMENT;

/**
 * The closed set of node kinds an AST may contain. Not every kind has a
 * dedicated model class or an emission rule; kinds without one are carried by
 * {@link com.mastfrog.desugar.ast.stmt.OtherStmt} or
 * {@link com.mastfrog.desugar.ast.decl.OtherDecl}.
 */
public enum NodeKind {
    COMPOUND_STMT(STATEMENT),
    DECL_STMT(STATEMENT),
    RETURN_STMT(STATEMENT),
    IF_STMT(STATEMENT),
    SWITCH_STMT(STATEMENT),
    CASE_STMT(STATEMENT),
    DEFAULT_STMT(STATEMENT),
    WHILE_STMT(STATEMENT),
    DO_STMT(STATEMENT),
    FOR_STMT(STATEMENT),
    RANGE_FOR_STMT(STATEMENT),
    BREAK_STMT(STATEMENT),
    CONTINUE_STMT(STATEMENT),
    NULL_STMT(STATEMENT),
    GOTO_STMT(STATEMENT),
    LABEL_STMT(STATEMENT),
    TRY_STMT(STATEMENT),
    COROUTINE_BODY_STMT(STATEMENT),
    DECL_REF_EXPR(EXPRESSION),
    INTEGER_LITERAL(EXPRESSION),
    FLOATING_LITERAL(EXPRESSION),
    CHARACTER_LITERAL(EXPRESSION),
    STRING_LITERAL(EXPRESSION),
    BOOL_LITERAL(EXPRESSION),
    NULLPTR_LITERAL(EXPRESSION),
    GNU_NULL_EXPR(EXPRESSION),
    THIS_EXPR(EXPRESSION),
    BINARY_OPERATOR(EXPRESSION),
    UNARY_OPERATOR(EXPRESSION),
    CONDITIONAL_OPERATOR(EXPRESSION),
    PAREN_EXPR(EXPRESSION),
    MEMBER_EXPR(EXPRESSION),
    CALL_EXPR(EXPRESSION),
    MEMBER_CALL_EXPR(EXPRESSION),
    OPERATOR_CALL_EXPR(EXPRESSION),
    USER_DEFINED_LITERAL(EXPRESSION),
    CONSTRUCT_EXPR(EXPRESSION),
    IMPLICIT_CAST_EXPR(EXPRESSION),
    NAMED_CAST_EXPR(EXPRESSION),
    C_STYLE_CAST_EXPR(EXPRESSION),
    FUNCTIONAL_CAST_EXPR(EXPRESSION),
    ARRAY_SUBSCRIPT_EXPR(EXPRESSION),
    ARRAY_INIT_LOOP_EXPR(EXPRESSION),
    ARRAY_INIT_INDEX_EXPR(EXPRESSION),
    OPAQUE_VALUE_EXPR(EXPRESSION),
    MATERIALIZE_TEMPORARY_EXPR(EXPRESSION),
    BIND_TEMPORARY_EXPR(EXPRESSION),
    EXPR_WITH_CLEANUPS(EXPRESSION),
    DEFAULT_ARG_EXPR(EXPRESSION),
    DEFAULT_INIT_EXPR(EXPRESSION),
    SUBST_NON_TYPE_TEMPLATE_PARM_EXPR(EXPRESSION),
    INIT_LIST_EXPR(EXPRESSION),
    LAMBDA_EXPR(EXPRESSION),
    NEW_EXPR(EXPRESSION),
    DELETE_EXPR(EXPRESSION),
    SIZEOF_ALIGNOF_EXPR(EXPRESSION),
    TYPEID_EXPR(EXPRESSION),
    UNRESOLVED_LOOKUP_EXPR(EXPRESSION),
    PREDEFINED_EXPR(EXPRESSION),
    STD_INITIALIZER_LIST_EXPR(EXPRESSION),
    THROW_EXPR(EXPRESSION),
    FOLD_EXPR(EXPRESSION),
    VAR_DECL(DECLARATION),
    PARM_VAR_DECL(DECLARATION),
    DECOMPOSITION_DECL(DECLARATION),
    BINDING_DECL(DECLARATION),
    FUNCTION_DECL(DECLARATION),
    METHOD_DECL(DECLARATION),
    FIELD_DECL(DECLARATION),
    ACCESS_SPEC_DECL(DECLARATION),
    RECORD_DECL(DECLARATION),
    TYPE_ALIAS_DECL(DECLARATION),
    TYPEDEF_DECL(DECLARATION),
    USING_DECL(DECLARATION),
    STATIC_ASSERT_DECL(DECLARATION),
    EMPTY_DECL(DECLARATION),
    ENUM_DECL(DECLARATION),
    NAMESPACE_DECL(DECLARATION),
    FRIEND_DECL(DECLARATION);

    private final NodeCategory category;

    NodeKind(NodeCategory category) {
        this.category = category;
    }

    public NodeCategory category() {
        return category;
    }

    public boolean isStatement() {
        return category == STATEMENT;
    }

    public boolean isExpression() {
        return category == EXPRESSION;
    }

    public boolean isDeclaration() {
        return category == DECLARATION;
    }

    /**
     * The kind's name in camel case, e.g. <code>RangeForStmt</code>.
     *
     * @return A name
     */
    public String displayName() {
        StringBuilder sb = new StringBuilder();
        boolean upper = true;
        for (char c : name().toCharArray()) {
            if (c == '_') {
                upper = true;
            } else if (upper) {
                sb.append(c);
                upper = false;
            } else {
                sb.append(Character.toLowerCase(c));
            }
        }
        return sb.toString();
    }
}
