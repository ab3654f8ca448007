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
package com.mastfrog.desugar.format;

import com.mastfrog.desugar.ast.decl.FunctionDecl;
import com.mastfrog.desugar.ast.decl.ParmVarDecl;
import com.mastfrog.desugar.output.OutputBuffer;
import java.util.List;

/**
 * Writes function signatures.
 */
public interface PrototypeFormatter {

    /**
     * Write the signature of a free function, everything up to but not
     * including its body or terminating semicolon.
     *
     * @param out The buffer
     * @param function The function
     */
    void formatPrototype(OutputBuffer out, FunctionDecl function);

    /**
     * Write a parameter list, without the enclosing parentheses.
     *
     * @param out The buffer
     * @param parameters The parameters
     */
    void formatParameters(OutputBuffer out, List<? extends ParmVarDecl> parameters);
}
