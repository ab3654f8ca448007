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
package com.mastfrog.desugar.ast;

import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for all AST nodes. Nodes are immutable; a generator only reads
 * them.
 */
public abstract class Node {

    private final NodeKind kind;
    private final SourceLocation location;

    protected Node(NodeKind kind, SourceLocation location) {
        this.kind = notNull("kind", kind);
        this.location = location == null ? SourceLocation.UNKNOWN : location;
    }

    public final NodeKind kind() {
        return kind;
    }

    public final SourceLocation location() {
        return location;
    }

    /**
     * The structural children of this node, in source order, without nulls.
     *
     * @return A list
     */
    public abstract List<? extends Node> children();

    public boolean is(NodeKind k) {
        return kind == k;
    }

    protected static List<Node> childrenOf(Object... nodesOrLists) {
        List<Node> result = new ArrayList<>(nodesOrLists.length);
        for (Object o : nodesOrLists) {
            if (o instanceof Node) {
                result.add((Node) o);
            } else if (o instanceof List<?>) {
                for (Object item : (List<?>) o) {
                    if (item instanceof Node) {
                        result.add((Node) item);
                    }
                }
            }
        }
        return Collections.unmodifiableList(result);
    }

    protected static <T> List<T> immutable(List<? extends T> list) {
        if (list == null || list.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(list));
    }

    @Override
    public String toString() {
        return kind.displayName() + "@" + location;
    }
}
