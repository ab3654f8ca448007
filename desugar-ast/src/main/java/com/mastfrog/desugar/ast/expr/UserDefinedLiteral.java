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

import com.mastfrog.desugar.ast.NodeKind;
import com.mastfrog.desugar.ast.SourceLocation;
import com.mastfrog.desugar.ast.TemplateArgument;
import com.mastfrog.desugar.ast.type.CppType;
import java.util.List;

/**
 * A call of a literal operator. When the operator is a template, the template
 * arguments of its specialization are carried here; a raw literal operator
 * template receives its digits as a single character pack.
 */
public final class UserDefinedLiteral extends CallExpr {

    private final List<TemplateArgument> specializationArguments;

    public UserDefinedLiteral(SourceLocation location, Expr callee, List<? extends Expr> arguments,
            List<TemplateArgument> specializationArguments, CppType type) {
        super(NodeKind.USER_DEFINED_LITERAL, location, callee, arguments, type);
        this.specializationArguments = immutable(specializationArguments);
    }

    public List<TemplateArgument> specializationArguments() {
        return specializationArguments;
    }
}
