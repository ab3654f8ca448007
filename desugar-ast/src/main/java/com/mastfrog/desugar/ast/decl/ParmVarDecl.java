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
package com.mastfrog.desugar.ast.decl;

import com.mastfrog.desugar.ast.NodeKind;
import com.mastfrog.desugar.ast.SourceLocation;
import com.mastfrog.desugar.ast.expr.Expr;
import com.mastfrog.desugar.ast.type.CppType;

/**
 * A function parameter; its initializer, if any, is the default argument.
 */
public final class ParmVarDecl extends VarDecl {

    private ParmVarDecl(Builder b) {
        super(NodeKind.PARM_VAR_DECL, b);
    }

    public static ParmVarDecl of(String name, CppType type) {
        return new ParmVarDecl(builder(name, type));
    }

    public static ParmVarDecl of(String name, CppType type, SourceLocation location, Expr defaultArgument) {
        return new ParmVarDecl(builder(name, type).at(location).initializedWith(defaultArgument));
    }

    public Expr defaultArgument() {
        return initializer();
    }
}
