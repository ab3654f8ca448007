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
package com.mastfrog.desugar.lambda;

import com.mastfrog.desugar.output.OutputBuffer;
import com.mastfrog.desugar.trace.Trace;
import com.mastfrog.desugar.trace.TraceCategory;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Stack of the lambda contexts entered during a generation pass, which
 * decides where closure classes end up.
 * <p>
 * A context entered for a placement role stages its classes in its own
 * buffer, and that buffer is spliced at the start of the line on which the
 * context was entered, in the innermost enclosing placement context's staged
 * buffer if there is one, and otherwise in the buffer the generator was
 * writing to. So for <code>Test([]{ })</code> the class lands before the line
 * containing the call, not between <code>Test(</code> and its arguments.
 * </p>
 */
public final class LambdaStack {

    private final Deque<LambdaContext> contexts = new ArrayDeque<>();
    private final Trace trace;

    public LambdaStack(Trace trace) {
        this.trace = notNull("trace", trace);
    }

    public LambdaStack() {
        this(Trace.none());
    }

    /**
     * Push a new context.
     *
     * @param role The role of the construct being entered
     * @param current The buffer the generator is currently writing to
     * @return A context, which must be closed
     */
    public LambdaContext enter(LambdaCallerRole role, OutputBuffer current) {
        notNull("current", current);
        OutputBuffer target = spliceTarget(current);
        return push(new LambdaContext(this, role, target, target.lineStartPosition()), target == current);
    }

    /**
     * Push a new context whose classes are spliced at an earlier offset of
     * the current buffer, such as the start of a <code>do</code> statement
     * whose condition is being written. If an enclosing placement context
     * receives the classes instead, the offset is ignored.
     *
     * @param role The role of the construct being entered
     * @param current The buffer the generator is currently writing to
     * @param position An offset in the current buffer, at the start of a line
     * @return A context, which must be closed
     */
    public LambdaContext enterAt(LambdaCallerRole role, OutputBuffer current, int position) {
        notNull("current", current);
        OutputBuffer target = spliceTarget(current);
        if (target != current) {
            return push(new LambdaContext(this, role, target, target.lineStartPosition()), false);
        }
        if (position < 0 || position > current.lineStartPosition()) {
            throw new IllegalArgumentException("Position " + position
                    + " is not before the current line, which starts at "
                    + current.lineStartPosition());
        }
        return push(new LambdaContext(this, role, target, position), true);
    }

    private LambdaContext push(LambdaContext result, boolean intoCurrent) {
        contexts.push(result);
        trace.trace(TraceCategory.PLACEMENT, "enter %s at depth %d, splicing at %d into %s",
                result.role(), contexts.size(), result.position(),
                intoCurrent ? "current output" : "enclosing staged buffer");
        return result;
    }

    /**
     * Find the buffer a context entered now would splice into: the staged
     * buffer of the innermost placement-role context, or the current output
     * if there is none.
     *
     * @param current The buffer the generator is currently writing to
     * @return A buffer
     */
    OutputBuffer spliceTarget(OutputBuffer current) {
        for (LambdaContext ctx : contexts) {
            if (ctx.role().isPlacementRole()) {
                return ctx.staged();
            }
        }
        return current;
    }

    void pop(LambdaContext ctx) {
        if (contexts.peek() != ctx) {
            throw new IllegalStateException("Lambda contexts closed out of order: closing "
                    + ctx + " but the top is " + contexts.peek());
        }
        contexts.pop();
        trace.trace(TraceCategory.PLACEMENT, "leave %s, %d remaining", ctx.role(), contexts.size());
    }

    /**
     * The most recently entered context that has not been closed.
     *
     * @return A context, or null if the stack is empty
     */
    public LambdaContext top() {
        return contexts.peek();
    }

    public boolean isEmpty() {
        return contexts.isEmpty();
    }

    public int depth() {
        return contexts.size();
    }
}
