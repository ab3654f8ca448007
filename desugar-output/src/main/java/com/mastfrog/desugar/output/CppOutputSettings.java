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
package com.mastfrog.desugar.output;

/**
 * Default formatting for generated C++: two-space indentation unless told
 * otherwise, braces for blocks, semicolon terminated statements.
 */
public final class CppOutputSettings implements OutputSettings {

    public static final int DEFAULT_INDENT = 2;
    private final int indentBy;

    public CppOutputSettings(int indentBy) {
        if (indentBy < 0) {
            throw new IllegalArgumentException("Negative indent: " + indentBy);
        }
        this.indentBy = indentBy;
    }

    public CppOutputSettings() {
        this(DEFAULT_INDENT);
    }

    @Override
    public int indentBy() {
        return indentBy;
    }

    @Override
    public char blockOpen() {
        return '{';
    }

    @Override
    public char blockClose() {
        return '}';
    }

    @Override
    public String stringLiteralQuote() {
        return "\"";
    }

    @Override
    public String escapeStringLiteral(String lit) {
        return OutputBuffer.escape(lit);
    }

    @Override
    public char statementTerminator() {
        return ';';
    }

    @Override
    public String blockCommentOpen() {
        return "/* ";
    }

    @Override
    public String blockCommentClose() {
        return " */";
    }

    @Override
    public String toString() {
        return "CppOutputSettings(" + indentBy + ")";
    }
}
