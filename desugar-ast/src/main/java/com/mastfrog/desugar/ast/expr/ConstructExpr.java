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
import com.mastfrog.desugar.ast.type.CppType;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.Arrays;
import java.util.List;

/**
 * A constructor invocation, written either with parentheses or as list
 * initialization with braces.
 */
public final class ConstructExpr extends Expr {

    private final List<Expr> arguments;
    private final boolean listInitialization;

    public ConstructExpr(SourceLocation location, CppType type, List<? extends Expr> arguments,
            boolean listInitialization) {
        super(NodeKind.CONSTRUCT_EXPR, location, notNull("type", type));
        this.arguments = immutable(arguments);
        this.listInitialization = listInitialization;
    }

    public static ConstructExpr parens(CppType type, Expr... arguments) {
        return new ConstructExpr(null, type, Arrays.asList(arguments), false);
    }

    public static ConstructExpr braces(CppType type, Expr... arguments) {
        return new ConstructExpr(null, type, Arrays.asList(arguments), true);
    }

    public List<Expr> arguments() {
        return arguments;
    }

    public boolean isListInitialization() {
        return listInitialization;
    }

    @Override
    public List<? extends Node> children() {
        return arguments;
    }
}
