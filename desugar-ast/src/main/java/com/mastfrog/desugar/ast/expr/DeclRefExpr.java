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
import com.mastfrog.desugar.ast.TemplateArgument;
import com.mastfrog.desugar.ast.decl.Decl;
import com.mastfrog.desugar.ast.type.CppType;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.Collections;
import java.util.List;

/**
 * A reference to a named declaration. The name is the spelling to print,
 * including any qualifier; a reference to an unnamed entity, such as the
 * hidden object of a decomposition declaration, has an empty name.
 */
public final class DeclRefExpr extends Expr {

    private final String name;
    private final Decl decl;
    private final List<TemplateArgument> templateArguments;

    public DeclRefExpr(SourceLocation location, String name, Decl decl, CppType type,
            List<TemplateArgument> templateArguments) {
        super(NodeKind.DECL_REF_EXPR, location, type);
        this.name = notNull("name", name);
        this.decl = decl;
        this.templateArguments = immutable(templateArguments);
    }

    public static DeclRefExpr to(Decl decl) {
        return new DeclRefExpr(null, decl.name(), decl, decl.type(),
                Collections.<TemplateArgument>emptyList());
    }

    public static DeclRefExpr named(String name, CppType type) {
        return new DeclRefExpr(null, name, null, type, Collections.<TemplateArgument>emptyList());
    }

    public String name() {
        return name;
    }

    /**
     * The referenced declaration, if the provider resolved it.
     *
     * @return A declaration or null
     */
    public Decl decl() {
        return decl;
    }

    public List<TemplateArgument> templateArguments() {
        return templateArguments;
    }

    @Override
    public List<? extends Node> children() {
        return Collections.emptyList();
    }
}
