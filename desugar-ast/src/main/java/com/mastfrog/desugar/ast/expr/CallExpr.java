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
 * A function call. Subclasses distinguish calls of member functions,
 * overloaded operators and literal operators.
 */
public class CallExpr extends Expr {

    private final Expr callee;
    private final List<Expr> arguments;

    protected CallExpr(NodeKind kind, SourceLocation location, Expr callee,
            List<? extends Expr> arguments, CppType type) {
        super(kind, location, type);
        this.callee = notNull("callee", callee);
        this.arguments = immutable(arguments);
    }

    public CallExpr(SourceLocation location, Expr callee, List<? extends Expr> arguments, CppType type) {
        this(NodeKind.CALL_EXPR, location, callee, arguments, type);
    }

    public static CallExpr call(Expr callee, CppType type, Expr... arguments) {
        return new CallExpr(callee.location(), callee, Arrays.asList(arguments), type);
    }

    public final Expr callee() {
        return callee;
    }

    public final List<Expr> arguments() {
        return arguments;
    }

    @Override
    public List<? extends Node> children() {
        return childrenOf(callee, arguments);
    }
}
