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
import java.util.Collections;
import java.util.List;

/**
 * Statements with no parts: <code>break</code>, <code>continue</code> and the
 * null statement.
 */
public final class SimpleStmt extends Stmt {

    private SimpleStmt(NodeKind kind, SourceLocation location) {
        super(kind, location);
    }

    public static SimpleStmt breakStatement(SourceLocation location) {
        return new SimpleStmt(NodeKind.BREAK_STMT, location);
    }

    public static SimpleStmt continueStatement(SourceLocation location) {
        return new SimpleStmt(NodeKind.CONTINUE_STMT, location);
    }

    public static SimpleStmt nullStatement(SourceLocation location) {
        return new SimpleStmt(NodeKind.NULL_STMT, location);
    }

    @Override
    public List<? extends Node> children() {
        return Collections.emptyList();
    }
}
