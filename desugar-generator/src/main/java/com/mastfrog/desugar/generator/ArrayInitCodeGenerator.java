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

import com.mastfrog.desugar.ast.expr.ArrayInitIndexExpr;
import com.mastfrog.desugar.output.OutputBuffer;

/**
 * Emits one element initializer of an array initialization loop, with the
 * loop index replaced by a constant.
 */
final class ArrayInitCodeGenerator extends CodeGenerator {

    private final long index;

    ArrayInitCodeGenerator(GenerationPass pass, OutputBuffer out, long index) {
        super(pass, out);
        this.index = index;
    }

    @Override
    protected CodeGenerator forBuffer(OutputBuffer buffer) {
        return new ArrayInitCodeGenerator(pass, buffer, index);
    }

    @Override
    protected void emitArrayInitIndex(ArrayInitIndexExpr expr) {
        out.append(Long.toString(index));
    }
}
