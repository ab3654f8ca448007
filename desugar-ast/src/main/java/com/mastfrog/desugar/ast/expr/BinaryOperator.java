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
import com.mastfrog.desugar.ast.type.CppType;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.List;

public final class BinaryOperator extends Expr {

    private final BinaryOpcode opcode;
    private final Expr lhs;
    private final Expr rhs;

    public BinaryOperator(SourceLocation location, BinaryOpcode opcode, Expr lhs, Expr rhs, CppType type) {
        super(NodeKind.BINARY_OPERATOR, location, type);
        this.opcode = notNull("opcode", opcode);
        this.lhs = notNull("lhs", lhs);
        this.rhs = notNull("rhs", rhs);
    }

    public static BinaryOperator of(Expr lhs, BinaryOpcode opcode, Expr rhs) {
        return new BinaryOperator(lhs.location(), opcode, lhs, rhs,
                opcode.isAssignment() ? lhs.type() : rhs.type());
    }

    public BinaryOpcode opcode() {
        return opcode;
    }

    public Expr lhs() {
        return lhs;
    }

    public Expr rhs() {
        return rhs;
    }

    @Override
    public List<? extends Node> children() {
        return childrenOf(lhs, rhs);
    }
}
