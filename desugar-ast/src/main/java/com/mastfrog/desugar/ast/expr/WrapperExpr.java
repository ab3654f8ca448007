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
package com.mastfrog.desugar.ast.expr;

import com.mastfrog.desugar.ast.Node;
import com.mastfrog.desugar.ast.NodeKind;
import com.mastfrog.desugar.ast.SourceLocation;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.List;

/**
 * Nodes semantic analysis wraps around an expression without changing how it
 * is written: temporaries being materialized or bound, full expressions with
 * cleanups, default arguments and member initializers, and substituted
 * non-type template parameters.
 */
public final class WrapperExpr extends Expr {

    private final Expr inner;

    private WrapperExpr(NodeKind kind, SourceLocation location, Expr inner) {
        super(kind, location, notNull("inner", inner).type());
        this.inner = inner;
    }

    public static WrapperExpr materializeTemporary(Expr inner) {
        return new WrapperExpr(NodeKind.MATERIALIZE_TEMPORARY_EXPR, inner.location(), inner);
    }

    public static WrapperExpr bindTemporary(Expr inner) {
        return new WrapperExpr(NodeKind.BIND_TEMPORARY_EXPR, inner.location(), inner);
    }

    public static WrapperExpr withCleanups(Expr inner) {
        return new WrapperExpr(NodeKind.EXPR_WITH_CLEANUPS, inner.location(), inner);
    }

    public static WrapperExpr defaultArgument(SourceLocation location, Expr inner) {
        return new WrapperExpr(NodeKind.DEFAULT_ARG_EXPR, location, inner);
    }

    public static WrapperExpr defaultInitializer(SourceLocation location, Expr inner) {
        return new WrapperExpr(NodeKind.DEFAULT_INIT_EXPR, location, inner);
    }

    public static WrapperExpr substitutedTemplateParameter(SourceLocation location, Expr replacement) {
        return new WrapperExpr(NodeKind.SUBST_NON_TYPE_TEMPLATE_PARM_EXPR, location, replacement);
    }

    public Expr inner() {
        return inner;
    }

    @Override
    public Expr ignoreImplicit() {
        switch (kind()) {
            case MATERIALIZE_TEMPORARY_EXPR:
            case BIND_TEMPORARY_EXPR:
            case EXPR_WITH_CLEANUPS:
                return inner.ignoreImplicit();
            default:
                return this;
        }
    }

    @Override
    public List<? extends Node> children() {
        return childrenOf(inner);
    }
}
