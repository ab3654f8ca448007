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

import com.mastfrog.desugar.ast.Node;
import com.mastfrog.desugar.ast.NodeKind;
import com.mastfrog.desugar.ast.SourceLocation;
import com.mastfrog.desugar.ast.expr.Expr;
import com.mastfrog.desugar.ast.type.CppType;
import java.util.List;

/**
 * One name introduced by a decomposition declaration. The binding expression
 * says what the name denotes: a member access or array subscript into the
 * decomposed object, or, for tuple-like decomposition, a reference to a
 * holding variable initialized through <code>get</code>.
 */
public final class BindingDecl extends Decl {

    private final Expr binding;
    private final VarDecl holdingVariable;

    public BindingDecl(SourceLocation location, String name, CppType type, Expr binding, VarDecl holdingVariable) {
        super(NodeKind.BINDING_DECL, location, name, type, null);
        this.binding = binding;
        this.holdingVariable = holdingVariable;
    }

    public static BindingDecl of(String name, CppType type, Expr binding) {
        return new BindingDecl(null, name, type, binding, null);
    }

    public static BindingDecl tupleLike(String name, CppType type, Expr binding, VarDecl holdingVariable) {
        return new BindingDecl(null, name, type, binding, holdingVariable);
    }

    /**
     * The expression the name is bound to; null if the provider could not
     * resolve it.
     *
     * @return An expression or null
     */
    public Expr binding() {
        return binding;
    }

    public VarDecl holdingVariable() {
        return holdingVariable;
    }

    @Override
    public List<? extends Node> children() {
        return childrenOf(binding, holdingVariable);
    }
}
