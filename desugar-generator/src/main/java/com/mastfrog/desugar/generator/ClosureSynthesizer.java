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

import com.mastfrog.desugar.ast.decl.MethodDecl;
import com.mastfrog.desugar.ast.expr.CaptureKind;
import com.mastfrog.desugar.ast.expr.LambdaCapture;
import com.mastfrog.desugar.ast.expr.LambdaExpr;
import com.mastfrog.desugar.ast.stmt.CompoundStmt;
import com.mastfrog.desugar.ast.type.CppType;
import com.mastfrog.desugar.format.TypeNamer;
import com.mastfrog.desugar.lambda.LambdaContext;
import com.mastfrog.desugar.naming.InternalNames;
import com.mastfrog.desugar.output.OutputBuffer;
import static com.mastfrog.desugar.output.util.Utils.iterate;
import com.mastfrog.desugar.trace.TraceCategory;
import com.mastfrog.util.strings.Strings;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the class a lambda expression stands for into the staged buffer of
 * a lambda context, and arranges for the use site to construct it.
 */
final class ClosureSynthesizer {

    private final CodeGenerator site;
    private final GenerationPass pass;

    /**
     * Create a synthesizer for lambdas visited by a generator.
     *
     * @param site The generator visiting the lambda, whose rules render the
     * capture initializers
     */
    ClosureSynthesizer(CodeGenerator site) {
        this.site = site;
        this.pass = site.pass();
    }

    void synthesize(LambdaExpr lambda, LambdaContext ctx) {
        OutputBuffer out = ctx.staged();
        String className = InternalNames.lambdaClassName(lambda.location());
        pass.trace().trace(TraceCategory.CLOSURE, "%s for %s as %s", className, lambda, ctx.role());

        out.blankLine();
        out.appendNewLine("class ", className);
        out.openScope();
        writeMethods(lambda, out);

        TypeNamer types = pass.types();
        List<String> params = new ArrayList<>();
        List<String> fieldInits = new ArrayList<>();
        List<String> ctorArgs = new ArrayList<>();
        for (LambdaCapture capture : lambda.captures()) {
            if (capture.kind() == CaptureKind.VLA_TYPE) {
                pass.trace().trace(TraceCategory.CAPTURES, "skip %s", capture);
                continue;
            }
            if (params.isEmpty()) {
                out.blankLine();
                out.appendNewLine("private:");
            }
            String field = capture.capturesVariable() ? capture.variable().name() : InternalNames.capturedThis();
            CppType type = fieldType(capture);
            pass.trace().trace(TraceCategory.CAPTURES, "%s as %s%s", capture, type,
                    capture.isInitCapture() ? ", initialized by its own expression" : "");
            out.append(types.nameAsParameter(type, field)).endStatement();
            params.add(types.nameAsParameter(type, "_" + field));
            fieldInits.add(field + "{_" + field + "}");
            ctorArgs.add(render(capture));
        }
        if (!params.isEmpty()) {
            out.blankLine();
            out.append("public: ", className, "(");
            StringBuilder paramList = new StringBuilder();
            Strings.concatenate(", ", params, paramList, String::toString);
            out.appendNewLine(paramList, ")");
            iterate(fieldInits, (init, first, last) -> {
                out.appendNewLine(first ? ": " : ", ", init);
            });
            out.appendNewLine("{}");
        }
        out.closeScope();

        StringBuilder inits = new StringBuilder("{");
        Strings.concatenate(", ", ctorArgs, inits, String::toString);
        inits.append('}');
        if (ctx.role().stagesInitializers()) {
            ctx.stageInitializers(inits);
        } else {
            out.append(" ", className, inits);
        }
        out.endStatement();
        out.blankLine();
    }

    private void writeMethods(LambdaExpr lambda, OutputBuffer out) {
        LambdaBodyCodeGenerator body = new LambdaBodyCodeGenerator(pass, out);
        boolean conversionWritten = false;
        for (MethodDecl conversion : lambda.conversionOperators()) {
            if (lambda.isGeneric() || conversion.hasBody()) {
                writeMethod(body, conversion, conversion.body());
                conversionWritten = true;
            }
        }
        List<MethodDecl> callOperators = lambda.callOperators();
        for (MethodDecl op : callOperators) {
            writeMethod(body, op, op.body());
        }
        if (conversionWritten) {
            List<MethodDecl> invokers = lambda.staticInvokers();
            for (int i = 0; i < invokers.size(); i++) {
                MethodDecl invoker = invokers.get(i);
                CompoundStmt invokerBody = invoker.body();
                if (invokerBody == null && !callOperators.isEmpty()) {
                    invokerBody = callOperators.get(Math.min(i, callOperators.size() - 1)).body();
                }
                writeMethod(body, invoker, invokerBody);
            }
        }
    }

    private void writeMethod(LambdaBodyCodeGenerator gen, MethodDecl method, CompoundStmt body) {
        OutputBuffer out = gen.output();
        out.append("public: ");
        gen.writeMethodHead(method, true);
        if (body == null) {
            out.endStatement();
        } else {
            gen.emitStatement(body);
        }
        out.blankLine();
    }

    /**
     * The declared type of the field holding a capture.
     */
    private CppType fieldType(LambdaCapture capture) {
        CppType type = capture.type();
        if (type.isArray()) {
            return type.lvalueReference();
        }
        switch (capture.kind()) {
            case BY_REFERENCE:
                return type.isReference() ? type : type.lvalueReference();
            case BY_COPY:
                return type.isReference() ? type.nonReference() : type;
            default:
                return type;
        }
    }

    /**
     * The constructor argument for a capture, as written at the use site.
     */
    private String render(LambdaCapture capture) {
        OutputBuffer buffer = pass.output().newStagedBuffer();
        site.forBuffer(buffer).emit(capture.initializer());
        return buffer.toString().trim();
    }
}
