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

import com.mastfrog.desugar.DesugarException;
import com.mastfrog.desugar.ast.Node;
import com.mastfrog.desugar.ast.NodeKind;
import com.mastfrog.desugar.ast.decl.BindingDecl;
import com.mastfrog.desugar.ast.decl.Decl;
import com.mastfrog.desugar.ast.decl.DecompositionDecl;
import com.mastfrog.desugar.ast.decl.VarDecl;
import com.mastfrog.desugar.ast.expr.ArrayInitLoopExpr;
import com.mastfrog.desugar.ast.expr.ArraySubscriptExpr;
import com.mastfrog.desugar.ast.expr.DeclRefExpr;
import com.mastfrog.desugar.ast.expr.Expr;
import com.mastfrog.desugar.ast.expr.MemberExpr;
import com.mastfrog.desugar.ast.type.CppType;
import com.mastfrog.desugar.lambda.LambdaCallerRole;
import com.mastfrog.desugar.lambda.LambdaContext;
import com.mastfrog.desugar.output.OutputBuffer;
import com.mastfrog.desugar.trace.TraceCategory;

/**
 * Expands a decomposition declaration into a hidden temporary holding the
 * decomposed object, followed by one reference or variable per binding.
 */
final class StructuredBindingExpander {

    private final CodeGenerator gen;
    private final GenerationPass pass;

    StructuredBindingExpander(CodeGenerator gen) {
        this.gen = gen;
        this.pass = gen.pass();
    }

    void expand(DecompositionDecl decl) {
        OutputBuffer out = gen.output();
        try (LambdaContext ctx = pass.lambdas().enter(LambdaCallerRole.VAR_DECL, out)) {
            DeclRefExpr ref = findDeclRef(decl.initializer());
            if (ref == null) {
                throw new DesugarException(decl, "unknown decl");
            }
            String temporary = pass.names().decompositionTemporary(baseName(ref), decl.location());
            pass.trace().trace(TraceCategory.BINDINGS, "%s holds %s", temporary, decl);

            gen.writeVarQualifiers(decl);
            out.append(gen.types().nameAsParameter(decl.type(), temporary));
            if (decl.hasInitializer()) {
                out.append(" = ");
                gen.emit(decl.initializer());
            }
            out.endStatement();

            boolean referenceToObject = decl.type().isLValueReference();
            for (BindingDecl binding : decl.bindings()) {
                emitBinding(binding, temporary, referenceToObject);
            }
        }
    }

    private void emitBinding(BindingDecl binding, String temporary, boolean referenceToObject) {
        OutputBuffer out = gen.output();
        Expr bindingExpr = binding.binding();
        if (bindingExpr == null) {
            gen.emitNotYetHandled(binding);
            return;
        }
        VarDecl holding = binding.holdingVariable();
        Expr source;
        if (holding != null) {
            source = holding.initializer();
        } else if (bindingExpr instanceof MemberExpr) {
            source = bindingExpr;
        } else {
            source = null;
        }
        boolean reference = (bindingExpr instanceof ArraySubscriptExpr && referenceToObject)
                || (source != null && !source.is(NodeKind.EXPR_WITH_CLEANUPS));
        CppType type = binding.type();
        if (reference && !type.isReference()) {
            type = type.lvalueReference();
        }
        pass.trace().trace(TraceCategory.BINDINGS, "%s as %s", binding.name(), type);
        out.append(gen.types().nameAsParameter(type, binding.name()), " = ");
        new StructuredBindingCodeGenerator(pass, out, temporary)
                .emit(source == null ? bindingExpr : source);
        out.endStatement();
    }

    private static String baseName(DeclRefExpr ref) {
        Decl target = ref.decl();
        String name = target == null ? ref.name() : target.name();
        int ix = name.lastIndexOf("::");
        if (ix >= 0) {
            name = name.substring(ix + 2);
        }
        return name.startsWith("operator") ? "operator" : name;
    }

    /**
     * Find the first name reference reachable from a node, depth first.
     *
     * @param node A node or null
     * @return A reference or null
     */
    static DeclRefExpr findDeclRef(Node node) {
        if (node == null) {
            return null;
        }
        if (node instanceof DeclRefExpr) {
            return (DeclRefExpr) node;
        }
        if (node instanceof ArrayInitLoopExpr) {
            DeclRefExpr result = findDeclRef(((ArrayInitLoopExpr) node).common());
            if (result != null) {
                return result;
            }
        }
        for (Node child : node.children()) {
            DeclRefExpr result = findDeclRef(child);
            if (result != null) {
                return result;
            }
        }
        return null;
    }
}
