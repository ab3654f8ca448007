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

import com.mastfrog.desugar.ast.expr.DeclRefExpr;
import com.mastfrog.desugar.output.OutputBuffer;

/**
 * Emits the initializer of a binding, where references to the unnamed
 * object of the decomposition are spelled as its hidden temporary.
 */
final class StructuredBindingCodeGenerator extends CodeGenerator {

    private final String temporaryName;

    StructuredBindingCodeGenerator(GenerationPass pass, OutputBuffer out, String temporaryName) {
        super(pass, out);
        this.temporaryName = temporaryName;
    }

    @Override
    protected CodeGenerator forBuffer(OutputBuffer buffer) {
        return new StructuredBindingCodeGenerator(pass, buffer, temporaryName);
    }

    @Override
    protected void emitDeclRef(DeclRefExpr ref) {
        String name = ref.name();
        if (name.isEmpty() || name.endsWith("::")) {
            out.append(name, temporaryName);
            emitTemplateArguments(ref.templateArguments());
        } else {
            super.emitDeclRef(ref);
        }
    }
}
