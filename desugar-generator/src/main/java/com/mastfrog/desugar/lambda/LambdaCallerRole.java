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

/**
 * The syntactic role of the construct a lambda context was entered for.
 * All roles but {@link #LAMBDA} are placement roles: a closure class found
 * anywhere beneath them is written before the statement that contains them.
 */
public enum LambdaCallerRole {
    CALL,
    MEMBER_CALL,
    OPERATOR_CALL,
    VAR_DECL,
    RETURN,
    BINARY_OPERATOR,
    LAMBDA;

    public boolean isPlacementRole() {
        return this != LAMBDA;
    }

    /**
     * Whether a closure class synthesized for this role hands its
     * constructor arguments to the use site, rather than declaring an object
     * of the class after its closing brace.
     *
     * @return true for variable initializers and call arguments
     */
    public boolean stagesInitializers() {
        return this == VAR_DECL || this == CALL;
    }
}
