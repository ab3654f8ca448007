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
import com.mastfrog.desugar.ast.type.BuiltinKind;
import com.mastfrog.desugar.ast.type.CppType;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.List;

/**
 * <code>sizeof</code>, <code>alignof</code> and relatives, applied to either
 * a type or an expression.
 */
public final class UnaryTraitExpr extends Expr {

    private final TraitKind trait;
    private final CppType argumentType;
    private final Expr argument;

    private UnaryTraitExpr(SourceLocation location, TraitKind trait, CppType argumentType, Expr argument) {
        super(NodeKind.SIZEOF_ALIGNOF_EXPR, location, CppType.builtin(BuiltinKind.ULONG));
        this.trait = notNull("trait", trait);
        this.argumentType = argumentType;
        this.argument = argument;
    }

    public static UnaryTraitExpr ofType(SourceLocation location, TraitKind trait, CppType type) {
        return new UnaryTraitExpr(location, trait, notNull("type", type), null);
    }

    public static UnaryTraitExpr ofExpression(SourceLocation location, TraitKind trait, Expr argument) {
        return new UnaryTraitExpr(location, trait, null, notNull("argument", argument));
    }

    public TraitKind trait() {
        return trait;
    }

    public boolean isArgumentType() {
        return argumentType != null;
    }

    public CppType argumentType() {
        return argumentType;
    }

    public Expr argument() {
        return argument;
    }

    @Override
    public List<? extends Node> children() {
        return childrenOf(argument);
    }
}
