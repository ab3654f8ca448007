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
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.List;

/**
 * A variable declaration.
 */
public class VarDecl extends Decl {

    private final Expr initializer;
    private final StorageClass storage;
    private final boolean inline;
    private final boolean constexpr;
    private final boolean nrvo;
    private final boolean local;

    protected VarDecl(NodeKind kind, Builder b) {
        super(kind, b.location, b.name, notNull("type", b.type), null);
        this.initializer = b.initializer;
        this.storage = b.storage;
        this.inline = b.inline;
        this.constexpr = b.constexpr;
        this.nrvo = b.nrvo;
        this.local = b.local;
    }

    public static Builder builder(String name, CppType type) {
        return new Builder(name, type);
    }

    public Expr initializer() {
        return initializer;
    }

    public boolean hasInitializer() {
        return initializer != null;
    }

    public StorageClass storageClass() {
        return storage;
    }

    public boolean isInline() {
        return inline;
    }

    public boolean isConstexpr() {
        return constexpr;
    }

    /**
     * Whether this is the variable a function returns, constructed in the
     * caller's storage by named return value optimization.
     *
     * @return true if an NRVO variable
     */
    public boolean isNrvoVariable() {
        return nrvo;
    }

    /**
     * Whether the variable is declared inside a function body.
     *
     * @return true if function-local
     */
    public boolean isLocal() {
        return local;
    }

    public boolean isStaticLocal() {
        return local && storage == StorageClass.STATIC;
    }

    @Override
    public List<? extends Node> children() {
        return childrenOf(initializer);
    }

    public static class Builder {

        final String name;
        final CppType type;
        SourceLocation location;
        Expr initializer;
        StorageClass storage = StorageClass.NONE;
        boolean inline;
        boolean constexpr;
        boolean nrvo;
        boolean local = true;

        Builder(String name, CppType type) {
            this.name = notNull("name", name);
            this.type = notNull("type", type);
        }

        public Builder at(SourceLocation location) {
            this.location = location;
            return this;
        }

        public Builder at(int line, int column) {
            return at(SourceLocation.at(line, column));
        }

        public Builder initializedWith(Expr initializer) {
            this.initializer = initializer;
            return this;
        }

        public Builder storage(StorageClass storage) {
            this.storage = notNull("storage", storage);
            return this;
        }

        public Builder makeStatic() {
            return storage(StorageClass.STATIC);
        }

        public Builder makeExtern() {
            return storage(StorageClass.EXTERN);
        }

        public Builder makeInline() {
            inline = true;
            return this;
        }

        public Builder makeConstexpr() {
            constexpr = true;
            return this;
        }

        public Builder nrvo() {
            nrvo = true;
            return this;
        }

        /**
         * Mark the variable as declared at namespace or class scope.
         *
         * @return this
         */
        public Builder global() {
            local = false;
            return this;
        }

        public VarDecl build() {
            return new VarDecl(NodeKind.VAR_DECL, this);
        }
    }
}
