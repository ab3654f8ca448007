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

import com.mastfrog.desugar.ast.expr.Expr;
import static com.mastfrog.util.preconditions.Checks.notNull;

/**
 * One entry of a constructor's member initializer list. Base class and
 * delegating initializers have no member name; their initializer is the
 * constructor call itself.
 */
public final class CtorInitializer {

    private final String memberName;
    private final Expr initializer;

    private CtorInitializer(String memberName, Expr initializer) {
        this.memberName = memberName;
        this.initializer = notNull("initializer", initializer);
    }

    public static CtorInitializer member(String memberName, Expr initializer) {
        return new CtorInitializer(notNull("memberName", memberName), initializer);
    }

    public static CtorInitializer base(Expr construction) {
        return new CtorInitializer(null, construction);
    }

    public String memberName() {
        return memberName;
    }

    public boolean isMemberInitializer() {
        return memberName != null;
    }

    public Expr initializer() {
        return initializer;
    }

    @Override
    public String toString() {
        return (memberName == null ? "<base>" : memberName) + "(" + initializer + ")";
    }
}
