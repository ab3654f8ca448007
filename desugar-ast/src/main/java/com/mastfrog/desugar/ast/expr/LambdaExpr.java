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
import com.mastfrog.desugar.ast.decl.MethodDecl;
import com.mastfrog.desugar.ast.type.CppType;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A lambda expression together with the members of the closure class
 * semantic analysis created for it. For a generic lambda the operator lists
 * hold the specializations actually instantiated, which may be none.
 */
public final class LambdaExpr extends Expr {

    private final List<LambdaCapture> captures;
    private final List<MethodDecl> conversionOperators;
    private final List<MethodDecl> callOperators;
    private final List<MethodDecl> staticInvokers;
    private final boolean generic;

    private LambdaExpr(Builder b) {
        super(NodeKind.LAMBDA_EXPR, b.location, b.type);
        this.captures = immutable(b.captures);
        this.conversionOperators = immutable(b.conversionOperators);
        this.callOperators = immutable(b.callOperators);
        this.staticInvokers = immutable(b.staticInvokers);
        this.generic = b.generic;
    }

    public static Builder builder(SourceLocation location) {
        return new Builder(location);
    }

    public List<LambdaCapture> captures() {
        return captures;
    }

    public List<MethodDecl> conversionOperators() {
        return conversionOperators;
    }

    public List<MethodDecl> callOperators() {
        return callOperators;
    }

    public List<MethodDecl> staticInvokers() {
        return staticInvokers;
    }

    public boolean isGeneric() {
        return generic;
    }

    @Override
    public List<? extends Node> children() {
        List<Expr> inits = new ArrayList<>(captures.size());
        for (LambdaCapture c : captures) {
            if (c.initializer() != null) {
                inits.add(c.initializer());
            }
        }
        return childrenOf(inits, conversionOperators, callOperators, staticInvokers);
    }

    public static final class Builder {

        private final SourceLocation location;
        private final List<LambdaCapture> captures = new ArrayList<>();
        private final List<MethodDecl> conversionOperators = new ArrayList<>();
        private final List<MethodDecl> callOperators = new ArrayList<>();
        private final List<MethodDecl> staticInvokers = new ArrayList<>();
        private CppType type;
        private boolean generic;

        Builder(SourceLocation location) {
            this.location = notNull("location", location);
        }

        public Builder capturing(LambdaCapture... captures) {
            this.captures.addAll(Arrays.asList(captures));
            return this;
        }

        public Builder withCallOperator(MethodDecl op) {
            callOperators.add(notNull("op", op));
            return this;
        }

        public Builder withConversionOperator(MethodDecl op) {
            conversionOperators.add(notNull("op", op));
            return this;
        }

        public Builder withStaticInvoker(MethodDecl invoker) {
            staticInvokers.add(notNull("invoker", invoker));
            return this;
        }

        public Builder generic() {
            generic = true;
            return this;
        }

        public Builder ofType(CppType type) {
            this.type = type;
            return this;
        }

        public LambdaExpr build() {
            if (callOperators.isEmpty() && !generic) {
                throw new IllegalStateException("A non-generic lambda needs a call operator");
            }
            return new LambdaExpr(this);
        }
    }
}
