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
package com.mastfrog.desugar;

import com.mastfrog.desugar.ast.Node;
import com.mastfrog.desugar.ast.NodeKind;
import com.mastfrog.desugar.ast.SourceLocation;

/**
 * Thrown by an emission rule when the tree it was handed breaks an
 * assumption the rule depends on. The code generator catches it at the
 * enclosing statement or declaration and records it as an error
 * diagnostic, so a pass never fails because of one.
 */
public class DesugarException extends RuntimeException {

    private final transient Node node;

    public DesugarException(Node node, String message) {
        super(message);
        this.node = node;
    }

    public DesugarException(Node node, String message, Throwable cause) {
        super(message, cause);
        this.node = node;
    }

    /**
     * The node being emitted when the problem was found.
     *
     * @return A node, or null
     */
    public Node node() {
        return node;
    }

    public NodeKind kind() {
        return node == null ? null : node.kind();
    }

    public SourceLocation location() {
        return node == null ? SourceLocation.UNKNOWN : node.location();
    }
}
