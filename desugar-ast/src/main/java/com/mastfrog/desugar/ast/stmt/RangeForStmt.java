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
package com.mastfrog.desugar.ast.stmt;

import com.mastfrog.desugar.ast.Node;
import com.mastfrog.desugar.ast.NodeKind;
import com.mastfrog.desugar.ast.SourceLocation;
import com.mastfrog.desugar.ast.expr.Expr;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.List;

/**
 * A range-based loop, as semantic analysis lowers it: the hidden range,
 * begin and end variables, the loop condition and increment over them, and
 * the user's loop variable declaration.
 */
public final class RangeForStmt extends Stmt {

    private final DeclStmt rangeStatement;
    private final DeclStmt beginStatement;
    private final DeclStmt endStatement;
    private final Expr condition;
    private final Expr increment;
    private final DeclStmt loopVariable;
    private final Stmt body;

    public RangeForStmt(SourceLocation location, DeclStmt rangeStatement, DeclStmt beginStatement,
            DeclStmt endStatement, Expr condition, Expr increment, DeclStmt loopVariable, Stmt body) {
        super(NodeKind.RANGE_FOR_STMT, location);
        this.rangeStatement = notNull("rangeStatement", rangeStatement);
        this.beginStatement = notNull("beginStatement", beginStatement);
        this.endStatement = notNull("endStatement", endStatement);
        this.condition = notNull("condition", condition);
        this.increment = notNull("increment", increment);
        this.loopVariable = notNull("loopVariable", loopVariable);
        this.body = notNull("body", body);
    }

    public DeclStmt rangeStatement() {
        return rangeStatement;
    }

    public DeclStmt beginStatement() {
        return beginStatement;
    }

    public DeclStmt endStatement() {
        return endStatement;
    }

    public Expr condition() {
        return condition;
    }

    public Expr increment() {
        return increment;
    }

    public DeclStmt loopVariable() {
        return loopVariable;
    }

    public Stmt body() {
        return body;
    }

    @Override
    public List<? extends Node> children() {
        return childrenOf(rangeStatement, beginStatement, endStatement, condition,
                increment, loopVariable, body);
    }
}
