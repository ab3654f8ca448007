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
import com.mastfrog.desugar.ast.type.CppType;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A class, struct or union. Member declarations appear in declaration order,
 * including the access labels between them and any members the compiler
 * declared implicitly.
 */
public final class RecordDecl extends Decl {

    private final TagKind tagKind;
    private final List<TemplateArgument> templateArguments;
    private final List<BaseSpecifier> bases;
    private final List<Decl> members;
    private final boolean hasDefinition;

    private RecordDecl(Builder b) {
        super(NodeKind.RECORD_DECL, b.location, b.name, CppType.record(b.name), b.access);
        this.tagKind = b.tagKind;
        this.templateArguments = immutable(b.templateArguments);
        this.bases = immutable(b.bases);
        this.members = immutable(b.members);
        this.hasDefinition = b.hasDefinition;
    }

    public static Builder builder(TagKind tagKind, String name) {
        return new Builder(tagKind, name);
    }

    public TagKind tagKind() {
        return tagKind;
    }

    /**
     * For a class template specialization, its template arguments.
     *
     * @return A list, empty otherwise
     */
    public List<TemplateArgument> templateArguments() {
        return templateArguments;
    }

    public List<BaseSpecifier> bases() {
        return bases;
    }

    public List<Decl> members() {
        return members;
    }

    /**
     * Whether this declaration is (or is completed by) a definition; a plain
     * forward declaration is not.
     *
     * @return true if defined
     */
    public boolean hasDefinition() {
        return hasDefinition;
    }

    @Override
    public List<? extends Node> children() {
        return members;
    }

    public static final class Builder {

        private final TagKind tagKind;
        private final String name;
        private final List<TemplateArgument> templateArguments = new ArrayList<>();
        private final List<BaseSpecifier> bases = new ArrayList<>();
        private final List<Decl> members = new ArrayList<>();
        private SourceLocation location;
        private AccessSpecifier access;
        private boolean hasDefinition = true;

        Builder(TagKind tagKind, String name) {
            this.tagKind = notNull("tagKind", tagKind);
            this.name = notNull("name", name);
        }

        public Builder at(SourceLocation location) {
            this.location = location;
            return this;
        }

        public Builder access(AccessSpecifier access) {
            this.access = access;
            return this;
        }

        public Builder withTemplateArguments(TemplateArgument... args) {
            templateArguments.addAll(Arrays.asList(args));
            return this;
        }

        public Builder extending(BaseSpecifier... bases) {
            this.bases.addAll(Arrays.asList(bases));
            return this;
        }

        public Builder withMembers(Decl... members) {
            this.members.addAll(Arrays.asList(members));
            return this;
        }

        public Builder forwardDeclaration() {
            hasDefinition = false;
            return this;
        }

        public RecordDecl build() {
            if (!hasDefinition && !members.isEmpty()) {
                throw new IllegalStateException("Forward declaration of " + name + " with members");
            }
            return new RecordDecl(this);
        }
    }
}
