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
import com.mastfrog.desugar.ast.TemplateArgument;
import com.mastfrog.desugar.ast.stmt.CompoundStmt;
import com.mastfrog.desugar.ast.type.CppType;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A function declaration or definition.
 */
public class FunctionDecl extends Decl {

    private final CppType returnType;
    private final List<ParmVarDecl> parameters;
    private final CompoundStmt body;
    private final boolean inline;
    private final boolean isStatic;
    private final boolean constexpr;
    private final boolean noexcept;
    private final List<TemplateArgument> templateArguments;

    protected FunctionDecl(NodeKind kind, AbstractBuilder<?> b) {
        super(kind, b.location, b.name, functionType(b), b.access);
        this.returnType = b.returnType;
        this.parameters = immutable(b.parameters);
        this.body = b.body;
        this.inline = b.inline;
        this.isStatic = b.isStatic;
        this.constexpr = b.constexpr;
        this.noexcept = b.noexcept;
        this.templateArguments = immutable(b.templateArguments);
    }

    private static CppType functionType(AbstractBuilder<?> b) {
        CppType[] params = new CppType[b.parameters.size()];
        for (int i = 0; i < params.length; i++) {
            params[i] = b.parameters.get(i).type();
        }
        return CppType.function(b.returnType, params);
    }

    public static Builder builder(String name, CppType returnType) {
        return new Builder(name, returnType);
    }

    public CppType returnType() {
        return returnType;
    }

    public List<ParmVarDecl> parameters() {
        return parameters;
    }

    /**
     * The body, or null for a declaration without a definition.
     *
     * @return A body or null
     */
    public CompoundStmt body() {
        return body;
    }

    public boolean hasBody() {
        return body != null;
    }

    public boolean isInline() {
        return inline;
    }

    public boolean isStatic() {
        return isStatic;
    }

    public boolean isConstexpr() {
        return constexpr;
    }

    public boolean isNoexcept() {
        return noexcept;
    }

    /**
     * For a template specialization, the arguments it was instantiated with.
     *
     * @return A list, empty for non-templates
     */
    public List<TemplateArgument> templateArguments() {
        return templateArguments;
    }

    @Override
    public List<? extends Node> children() {
        return childrenOf(parameters, body);
    }

    public static final class Builder extends AbstractBuilder<Builder> {

        Builder(String name, CppType returnType) {
            super(name, returnType);
        }

        public FunctionDecl build() {
            return new FunctionDecl(NodeKind.FUNCTION_DECL, this);
        }
    }

    /**
     * Shared builder state for functions and methods.
     *
     * @param <B> The concrete builder type
     */
    @SuppressWarnings("unchecked")
    public abstract static class AbstractBuilder<B extends AbstractBuilder<B>> {

        final String name;
        final CppType returnType;
        final List<ParmVarDecl> parameters = new ArrayList<>();
        final List<TemplateArgument> templateArguments = new ArrayList<>();
        SourceLocation location;
        AccessSpecifier access;
        CompoundStmt body;
        boolean inline;
        boolean isStatic;
        boolean constexpr;
        boolean noexcept;

        AbstractBuilder(String name, CppType returnType) {
            this.name = notNull("name", name);
            this.returnType = notNull("returnType", returnType);
        }

        B self() {
            return (B) this;
        }

        public B at(SourceLocation location) {
            this.location = location;
            return self();
        }

        public B at(int line, int column) {
            return at(SourceLocation.at(line, column));
        }

        public B withParameters(ParmVarDecl... params) {
            parameters.addAll(Arrays.asList(params));
            return self();
        }

        public B withTemplateArguments(TemplateArgument... args) {
            templateArguments.addAll(Arrays.asList(args));
            return self();
        }

        public B withBody(CompoundStmt body) {
            this.body = body;
            return self();
        }

        public B makeInline() {
            inline = true;
            return self();
        }

        public B makeStatic() {
            isStatic = true;
            return self();
        }

        public B makeConstexpr() {
            constexpr = true;
            return self();
        }

        public B makeNoexcept() {
            noexcept = true;
            return self();
        }
    }
}
