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
import java.util.Collections;
import java.util.List;

/**
 * A using-declaration, <code>using A::b;</code>. The contexts run from the
 * outermost inward and qualify the introduced name; a using-declaration at
 * function scope has none to print.
 */
public final class UsingDecl extends Decl {

    private final List<DeclContextRef> contexts;
    private final boolean inFunction;

    public UsingDecl(SourceLocation location, String name, List<DeclContextRef> contexts, boolean inFunction) {
        super(NodeKind.USING_DECL, location, name, null, null);
        this.contexts = immutable(contexts);
        this.inFunction = inFunction;
    }

    public List<DeclContextRef> contexts() {
        return contexts;
    }

    public boolean isInFunction() {
        return inFunction;
    }

    @Override
    public List<? extends Node> children() {
        return Collections.emptyList();
    }
}
