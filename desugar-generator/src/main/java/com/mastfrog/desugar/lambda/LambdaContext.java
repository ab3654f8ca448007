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
import static com.mastfrog.util.preconditions.Checks.notNull;

/**
 * One entry of the lambda stack: a staged buffer for closure classes, the
 * buffer and offset it will be spliced into, and the constructor arguments
 * waiting to be written at the use site. Closing the context pops it and
 * performs the splice; use it in a try-with-resources block.
 */
public final class LambdaContext implements AutoCloseable {

    private final LambdaStack stack;
    private final LambdaCallerRole role;
    private final OutputBuffer target;
    private final int position;
    private final OutputBuffer staged;
    private final StringBuilder initializers = new StringBuilder();
    private boolean closed;

    LambdaContext(LambdaStack stack, LambdaCallerRole role, OutputBuffer target, int position) {
        this.stack = stack;
        this.role = notNull("role", role);
        this.target = notNull("target", target);
        this.position = position;
        this.staged = target.newStagedBuffer();
    }

    public LambdaCallerRole role() {
        return role;
    }

    /**
     * The buffer closure classes are written to.
     *
     * @return A buffer
     */
    public OutputBuffer staged() {
        return staged;
    }

    OutputBuffer target() {
        return target;
    }

    int position() {
        return position;
    }

    public LambdaContext stageInitializers(CharSequence inits) {
        initializers.append(inits);
        return this;
    }

    /**
     * Write any staged constructor arguments to a buffer and forget them.
     *
     * @param into The buffer
     * @return true if anything was written
     */
    public boolean flushInitializers(OutputBuffer into) {
        if (initializers.length() == 0) {
            return false;
        }
        into.append(initializers);
        initializers.setLength(0);
        return true;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Pop this context and splice its staged buffer into the target, if it
     * has any content. Closing twice is an error.
     */
    @Override
    public void close() {
        if (closed) {
            throw new IllegalStateException("Closed twice: " + this);
        }
        closed = true;
        stack.pop(this);
        if (!staged.isEmpty()) {
            if (staged.openScopes() > 0) {
                // emission of a class was abandoned part way
                staged.closeScopesTo(0);
            }
            target.insertAt(position, staged);
        }
    }

    @Override
    public String toString() {
        return "LambdaContext(" + role + " @ " + position + ")";
    }
}
