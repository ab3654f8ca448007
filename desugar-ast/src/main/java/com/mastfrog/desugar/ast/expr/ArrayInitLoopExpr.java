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
import java.util.List;

/**
 * Element-wise initialization of an array from another array, as happens
 * when a class with an array member is copied or an array is captured or
 * decomposed by value. The element initializer refers to the current index
 * through an {@link ArrayInitIndexExpr}.
 */
public final class ArrayInitLoopExpr extends Expr {

    private final OpaqueValueExpr common;
    private final Expr elementInitializer;
    private final long arraySize;

    public ArrayInitLoopExpr(SourceLocation location, OpaqueValueExpr common, Expr elementInitializer,
            long arraySize, CppType type) {
        super(NodeKind.ARRAY_INIT_LOOP_EXPR, location, type);
        this.common = notNull("common", common);
        this.elementInitializer = notNull("elementInitializer", elementInitializer);
        if (arraySize < 0) {
            throw new IllegalArgumentException("Negative array size " + arraySize);
        }
        this.arraySize = arraySize;
    }

    /**
     * The source array, evaluated once.
     *
     * @return The common expression
     */
    public OpaqueValueExpr common() {
        return common;
    }

    public Expr elementInitializer() {
        return elementInitializer;
    }

    public long arraySize() {
        return arraySize;
    }

    @Override
    public List<? extends Node> children() {
        return childrenOf(common, elementInitializer);
    }
}
