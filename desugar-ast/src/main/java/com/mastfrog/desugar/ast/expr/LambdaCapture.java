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

import com.mastfrog.desugar.ast.decl.VarDecl;
import com.mastfrog.desugar.ast.type.CppType;
import static com.mastfrog.util.preconditions.Checks.notNull;

/**
 * One capture of a lambda: what is captured, how, and the expression that
 * initializes the closure's copy of it.
 */
public final class LambdaCapture {

    private final CaptureKind kind;
    private final VarDecl variable;
    private final CppType type;
    private final Expr initializer;

    private LambdaCapture(CaptureKind kind, VarDecl variable, CppType type, Expr initializer) {
        this.kind = kind;
        this.variable = variable;
        this.type = type;
        this.initializer = initializer;
    }

    public static LambdaCapture byCopy(VarDecl variable) {
        return new LambdaCapture(CaptureKind.BY_COPY, notNull("variable", variable),
                variable.type(), DeclRefExpr.to(variable));
    }

    public static LambdaCapture byReference(VarDecl variable) {
        return new LambdaCapture(CaptureKind.BY_REFERENCE, notNull("variable", variable),
                variable.type(), DeclRefExpr.to(variable));
    }

    /**
     * An init-capture such as <code>[a = b[1]]</code> or
     * <code>[&amp;r = x]</code>; the variable is the one the capture
     * introduces, and its initializer is the capture initializer.
     *
     * @param variable The introduced variable
     * @param byReference Whether the capture was written with <code>&amp;</code>
     * @return A capture
     */
    public static LambdaCapture initCapture(VarDecl variable, boolean byReference) {
        notNull("variable", variable);
        if (variable.initializer() == null) {
            throw new IllegalArgumentException("Init-capture without initializer: " + variable.name());
        }
        return new LambdaCapture(byReference ? CaptureKind.BY_REFERENCE : CaptureKind.BY_COPY,
                variable, variable.type(), variable.initializer());
    }

    public static LambdaCapture thisPointer(ThisExpr self) {
        return new LambdaCapture(CaptureKind.THIS, null, notNull("self", self).type(), self);
    }

    /**
     * A <code>*this</code> capture, which copies the enclosing object.
     *
     * @param self The dereferenced <code>this</code>, typed as the class
     * @return A capture
     */
    public static LambdaCapture starThis(Expr self) {
        return new LambdaCapture(CaptureKind.STAR_THIS, null, notNull("self", self).type(), self);
    }

    public static LambdaCapture variableLengthArrayType(CppType type) {
        return new LambdaCapture(CaptureKind.VLA_TYPE, null, notNull("type", type), null);
    }

    public CaptureKind kind() {
        return kind;
    }

    public boolean capturesThis() {
        return kind == CaptureKind.THIS || kind == CaptureKind.STAR_THIS;
    }

    public boolean capturesVariable() {
        return variable != null;
    }

    /**
     * Whether the capture introduces a new variable with its own initializer.
     *
     * @return true for init-captures
     */
    public boolean isInitCapture() {
        return variable != null && variable.initializer() != null
                && initializer == variable.initializer();
    }

    public VarDecl variable() {
        return variable;
    }

    public CppType type() {
        return type;
    }

    public Expr initializer() {
        return initializer;
    }

    @Override
    public String toString() {
        return kind + "(" + (variable == null ? "this" : variable.name()) + ")";
    }
}
