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

import com.mastfrog.desugar.ast.TemplateArgument;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One enclosing context of a declaration, as needed to qualify its name.
 */
public final class DeclContextRef {

    private final Kind kind;
    private final String name;
    private final boolean transparent;
    private final List<TemplateArgument> templateArguments;
    private final FunctionDecl function;

    private DeclContextRef(Kind kind, String name, boolean transparent,
            List<TemplateArgument> templateArguments, FunctionDecl function) {
        this.kind = kind;
        this.name = notNull("name", name);
        this.transparent = transparent;
        this.templateArguments = templateArguments;
        this.function = function;
    }

    public static DeclContextRef namespace(String name) {
        return new DeclContextRef(Kind.NAMESPACE, name, name.isEmpty(),
                Collections.<TemplateArgument>emptyList(), null);
    }

    public static DeclContextRef inlineNamespace(String name) {
        return new DeclContextRef(Kind.NAMESPACE, name, true,
                Collections.<TemplateArgument>emptyList(), null);
    }

    public static DeclContextRef record(String name) {
        return new DeclContextRef(Kind.RECORD, name, name.isEmpty(),
                Collections.<TemplateArgument>emptyList(), null);
    }

    public static DeclContextRef specialization(String name, TemplateArgument... args) {
        return new DeclContextRef(Kind.CLASS_TEMPLATE_SPECIALIZATION, name, false,
                Collections.unmodifiableList(Arrays.asList(args)), null);
    }

    public static DeclContextRef function(FunctionDecl function) {
        return new DeclContextRef(Kind.FUNCTION, notNull("function", function).name(), false,
                Collections.<TemplateArgument>emptyList(), function);
    }

    public static DeclContextRef enumeration(String name, boolean scoped) {
        return new DeclContextRef(Kind.ENUM, name, !scoped,
                Collections.<TemplateArgument>emptyList(), null);
    }

    public static DeclContextRef other(String name) {
        return new DeclContextRef(Kind.OTHER, name, false,
                Collections.<TemplateArgument>emptyList(), null);
    }

    public Kind kind() {
        return kind;
    }

    public String name() {
        return name;
    }

    /**
     * Whether this context contributes nothing to a qualified name: anonymous
     * and inline namespaces, unnamed classes, and unscoped enumerations.
     *
     * @return true if transparent
     */
    public boolean isTransparent() {
        return transparent;
    }

    public List<TemplateArgument> templateArguments() {
        return templateArguments;
    }

    public FunctionDecl function() {
        return function;
    }

    @Override
    public String toString() {
        return kind + "(" + name + ")";
    }

    public enum Kind {
        NAMESPACE,
        RECORD,
        CLASS_TEMPLATE_SPECIALIZATION,
        FUNCTION,
        ENUM,
        OTHER
    }
}
