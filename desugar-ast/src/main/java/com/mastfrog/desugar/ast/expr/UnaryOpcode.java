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

/**
 * Built-in unary operators.
 */
public enum UnaryOpcode {
    POST_INC("++", true),
    POST_DEC("--", true),
    PRE_INC("++", false),
    PRE_DEC("--", false),
    ADDR_OF("&", false),
    DEREF("*", false),
    PLUS("+", false),
    MINUS("-", false),
    NOT("~", false),
    LNOT("!", false),
    REAL("__real ", false),
    IMAG("__imag ", false),
    EXTENSION("__extension__ ", false),
    COAWAIT("co_await ", false);

    private final String spelling;
    private final boolean postfix;

    UnaryOpcode(String spelling, boolean postfix) {
        this.spelling = spelling;
        this.postfix = postfix;
    }

    public String spelling() {
        return spelling;
    }

    public boolean isPostfix() {
        return postfix;
    }

    @Override
    public String toString() {
        return spelling;
    }
}
