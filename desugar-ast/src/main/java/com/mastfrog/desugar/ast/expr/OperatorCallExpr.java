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

import com.mastfrog.desugar.ast.NodeKind;
import com.mastfrog.desugar.ast.SourceLocation;
import com.mastfrog.desugar.ast.decl.MethodDecl;
import com.mastfrog.desugar.ast.type.CppType;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.Arrays;
import java.util.List;

/**
 * A call of an overloaded operator written with operator syntax. For a member
 * operator the first argument is the object the operator is invoked on.
 */
public final class OperatorCallExpr extends CallExpr {

    private final String operatorSpelling;

    public OperatorCallExpr(SourceLocation location, String operatorSpelling, Expr callee,
            List<? extends Expr> arguments, CppType type) {
        super(NodeKind.OPERATOR_CALL_EXPR, location, callee, arguments, type);
        this.operatorSpelling = notNull("operatorSpelling", operatorSpelling);
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("An operator call needs at least one argument");
        }
    }

    public static OperatorCallExpr call(String operatorSpelling, DeclRefExpr callee,
            CppType type, Expr... arguments) {
        return new OperatorCallExpr(arguments.length == 0 ? null : arguments[0].location(),
                operatorSpelling, callee, Arrays.asList(arguments), type);
    }

    /**
     * The operator token, e.g. <code>+</code> or <code>()</code>.
     *
     * @return The spelling
     */
    public String operatorSpelling() {
        return operatorSpelling;
    }

    /**
     * Whether the called operator is a member function.
     *
     * @return true if a method
     */
    public boolean isMemberOperator() {
        Expr c = callee().ignoreImplicit();
        return c instanceof DeclRefExpr && ((DeclRefExpr) c).decl() instanceof MethodDecl;
    }
}
