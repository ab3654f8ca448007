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

import com.mastfrog.desugar.ast.Node;
import com.mastfrog.desugar.ast.NodeKind;
import com.mastfrog.desugar.ast.SourceLocation;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.List;

/**
 * A predefined identifier such as <code>__func__</code>, with the string it
 * evaluates to in its enclosing function.
 */
public final class PredefinedExpr extends Expr {

    private final String identifier;
    private final StringLiteral functionName;

    public PredefinedExpr(SourceLocation location, String identifier, StringLiteral functionName) {
        super(NodeKind.PREDEFINED_EXPR, location, functionName == null ? null : functionName.type());
        this.identifier = notNull("identifier", identifier);
        this.functionName = functionName;
    }

    public String identifier() {
        return identifier;
    }

    /**
     * The evaluated name, or null outside a function.
     *
     * @return A literal or null
     */
    public StringLiteral functionName() {
        return functionName;
    }

    @Override
    public List<? extends Node> children() {
        return childrenOf(functionName);
    }
}
