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

import com.mastfrog.desugar.ast.AccessSpecifier;
import com.mastfrog.desugar.ast.Node;
import com.mastfrog.desugar.ast.NodeKind;
import com.mastfrog.desugar.ast.SourceLocation;
import com.mastfrog.desugar.ast.type.CppType;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A member function, including constructors, destructors and conversion
 * operators. The name is the spelling to print, e.g.
 * <code>operator()</code> or <code>~Foo</code>.
 */
public final class MethodDecl extends FunctionDecl {

    private final MethodKind methodKind;
    private final boolean isVirtual;
    private final boolean isVolatile;
    private final boolean isConst;
    private final boolean defaulted;
    private final boolean deleted;
    private final boolean userProvided;
    private final List<CtorInitializer> initializers;
    private final SourceLocation lambdaLocation;

    private MethodDecl(Builder b) {
        super(NodeKind.METHOD_DECL, b);
        this.methodKind = b.methodKind;
        this.isVirtual = b.isVirtual;
        this.isVolatile = b.isVolatile;
        this.isConst = b.isConst;
        this.defaulted = b.defaulted;
        this.deleted = b.deleted;
        this.userProvided = b.userProvided;
        this.initializers = immutable(b.initializers);
        this.lambdaLocation = b.lambdaLocation;
    }

    public static Builder methodBuilder(String name, CppType returnType) {
        return new Builder(name, returnType);
    }

    public MethodKind methodKind() {
        return methodKind;
    }

    public boolean isVirtual() {
        return isVirtual;
    }

    public boolean isVolatile() {
        return isVolatile;
    }

    public boolean isConst() {
        return isConst;
    }

    public boolean isDefaulted() {
        return defaulted;
    }

    public boolean isDeleted() {
        return deleted;
    }

    /**
     * Whether the user wrote this member, as opposed to the compiler
     * declaring it implicitly or it being defaulted or deleted on its first
     * declaration.
     *
     * @return true if user provided
     */
    public boolean isUserProvided() {
        return userProvided;
    }

    public List<CtorInitializer> initializers() {
        return initializers;
    }

    /**
     * If this method belongs to the closure class of a lambda, the location
     * of that lambda.
     *
     * @return A location or null
     */
    public SourceLocation lambdaLocation() {
        return lambdaLocation;
    }

    public boolean isLambdaMember() {
        return lambdaLocation != null;
    }

    @Override
    public List<? extends Node> children() {
        List<Object> all = new ArrayList<>(super.children());
        for (CtorInitializer init : initializers) {
            all.add(init.initializer());
        }
        return childrenOf(all.toArray());
    }

    public static final class Builder extends AbstractBuilder<Builder> {

        private final List<CtorInitializer> initializers = new ArrayList<>();
        private MethodKind methodKind = MethodKind.ORDINARY;
        private boolean isVirtual;
        private boolean isVolatile;
        private boolean isConst;
        private boolean defaulted;
        private boolean deleted;
        private boolean userProvided = true;
        private SourceLocation lambdaLocation;

        Builder(String name, CppType returnType) {
            super(name, returnType);
        }

        public Builder kind(MethodKind kind) {
            this.methodKind = notNull("kind", kind);
            return this;
        }

        public Builder access(AccessSpecifier access) {
            this.access = notNull("access", access);
            return this;
        }

        public Builder makeVirtual() {
            isVirtual = true;
            return this;
        }

        public Builder makeVolatile() {
            isVolatile = true;
            return this;
        }

        public Builder makeConst() {
            isConst = true;
            return this;
        }

        public Builder defaulted() {
            defaulted = true;
            userProvided = false;
            return this;
        }

        public Builder deleted() {
            deleted = true;
            userProvided = false;
            return this;
        }

        public Builder implicit() {
            userProvided = false;
            return this;
        }

        public Builder initializing(CtorInitializer... inits) {
            initializers.addAll(Arrays.asList(inits));
            return this;
        }

        public Builder memberOfLambdaAt(SourceLocation location) {
            this.lambdaLocation = notNull("location", location);
            return this;
        }

        public MethodDecl build() {
            if (!initializers.isEmpty() && methodKind != MethodKind.CONSTRUCTOR) {
                throw new IllegalStateException("Only constructors have member initializers: " + name);
            }
            return new MethodDecl(this);
        }
    }
}
