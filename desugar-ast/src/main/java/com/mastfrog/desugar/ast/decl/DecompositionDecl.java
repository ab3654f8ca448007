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
import java.util.Arrays;
import java.util.List;

/**
 * A structured binding declaration, <code>auto [a, b] = init;</code>. The
 * declaration itself is the unnamed object holding the decomposed value; its
 * type is that object's type.
 */
public final class DecompositionDecl extends VarDecl {

    private final List<BindingDecl> bindings;

    private DecompositionDecl(Builder b, List<BindingDecl> bindings) {
        super(NodeKind.DECOMPOSITION_DECL, b);
        if (b.initializer == null) {
            throw new IllegalArgumentException("A decomposition declaration needs an initializer");
        }
        this.bindings = immutable(bindings);
    }

    public static DecompositionDecl of(Builder b, BindingDecl... bindings) {
        return new DecompositionDecl(b, Arrays.asList(bindings));
    }

    public static DecompositionDecl of(Builder b, List<BindingDecl> bindings) {
        return new DecompositionDecl(b, bindings);
    }

    public List<BindingDecl> bindings() {
        return bindings;
    }

    @Override
    public List<? extends Node> children() {
        return childrenOf(initializer(), bindings);
    }
}
