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
package com.mastfrog.desugar.generator;

import com.mastfrog.desugar.ast.decl.VarDecl;
import com.mastfrog.desugar.ast.expr.ConstructExpr;
import com.mastfrog.desugar.ast.expr.Expr;
import com.mastfrog.desugar.naming.InternalNames;
import com.mastfrog.desugar.output.OutputBuffer;
import static com.mastfrog.desugar.output.util.Utils.commaSeparated;

/**
 * Rewrites a function-local static of a class type with a non-trivial
 * constructor into the flag, raw storage and guarded placement-new the
 * compiler actually generates for it.
 */
final class StaticLocalInitGuard {

    private final CodeGenerator gen;

    StaticLocalInitGuard(CodeGenerator gen) {
        this.gen = gen;
    }

    static boolean applies(VarDecl decl) {
        return decl.isStaticLocal() && decl.type().isRecord()
                && !decl.type().hasTrivialConstruction();
    }

    void emit(VarDecl decl) {
        OutputBuffer out = gen.output();
        InternalNames names = gen.pass().names();
        String storage = names.staticStorage(decl.name());
        String flag = names.staticGuardFlag(decl.name());
        String typeName = gen.types().name(decl.type().unqualified());

        out.appendNewLine("static bool ", flag, ";");
        out.appendNewLine("static char ", storage, "[sizeof(", typeName, ")];");
        out.blankLine();
        out.appendNewLine("if( ! ", flag, " )");
        out.openScope();
        out.append("new (&", storage, ") ", typeName);
        writeConstructorArguments(decl.initializer());
        out.endStatement();
        out.append(flag, " = true").endStatement();
        out.closeScope();
        out.ensureNewLine();
    }

    private void writeConstructorArguments(Expr init) {
        if (init == null) {
            return;
        }
        OutputBuffer out = gen.output();
        Expr e = init.ignoreImplicit();
        if (e instanceof ConstructExpr) {
            ConstructExpr construct = (ConstructExpr) e;
            boolean braces = construct.isListInitialization();
            out.append(braces ? '{' : '(');
            commaSeparated(out, construct.arguments(), gen::emit);
            out.append(braces ? '}' : ')');
        } else {
            out.append('(');
            gen.emit(init);
            out.append(')');
        }
    }
}
