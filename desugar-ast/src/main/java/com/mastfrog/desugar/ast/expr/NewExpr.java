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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A <code>new</code> expression. When the allocated type is a class the
 * provider supplies the constructor call; otherwise the allocated type, the
 * array size for array forms, and any initializer.
 */
public final class NewExpr extends Expr {

    private final List<Expr> placementArguments;
    private final CppType allocatedType;
    private final boolean array;
    private final Expr arraySize;
    private final Expr initializer;
    private final ConstructExpr construction;

    private NewExpr(Builder b) {
        super(NodeKind.NEW_EXPR, b.location, b.allocatedType.pointer());
        this.placementArguments = immutable(b.placementArguments);
        this.allocatedType = b.allocatedType;
        this.array = b.array;
        this.arraySize = b.arraySize;
        this.initializer = b.initializer;
        this.construction = b.construction;
    }

    public static Builder allocating(CppType allocatedType) {
        return new Builder(allocatedType);
    }

    public List<Expr> placementArguments() {
        return placementArguments;
    }

    public CppType allocatedType() {
        return allocatedType;
    }

    public boolean isArray() {
        return array;
    }

    /**
     * The element count of an array form; null if the provider could not
     * supply it.
     *
     * @return An expression or null
     */
    public Expr arraySize() {
        return arraySize;
    }

    public Expr initializer() {
        return initializer;
    }

    public ConstructExpr construction() {
        return construction;
    }

    @Override
    public List<? extends Node> children() {
        return childrenOf(placementArguments, arraySize, initializer, construction);
    }

    public static final class Builder {

        private final CppType allocatedType;
        private final List<Expr> placementArguments = new ArrayList<>();
        private SourceLocation location;
        private boolean array;
        private Expr arraySize;
        private Expr initializer;
        private ConstructExpr construction;

        Builder(CppType allocatedType) {
            this.allocatedType = notNull("allocatedType", allocatedType);
        }

        public Builder at(SourceLocation location) {
            this.location = location;
            return this;
        }

        public Builder placement(Expr... args) {
            placementArguments.addAll(Arrays.asList(args));
            return this;
        }

        public Builder asArray(Expr size) {
            array = true;
            arraySize = size;
            return this;
        }

        public Builder initializedWith(Expr initializer) {
            this.initializer = initializer;
            return this;
        }

        public Builder constructedBy(ConstructExpr construction) {
            this.construction = construction;
            return this;
        }

        public NewExpr build() {
            return new NewExpr(this);
        }
    }
}
