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

/**
 * What a conversion does, independent of how it was written.
 */
public enum CastKind {
    DEPENDENT,
    BIT_CAST,
    LVALUE_BIT_CAST,
    LVALUE_TO_RVALUE,
    NO_OP,
    BASE_TO_DERIVED,
    DERIVED_TO_BASE,
    UNCHECKED_DERIVED_TO_BASE,
    DYNAMIC,
    TO_UNION,
    ARRAY_TO_POINTER_DECAY,
    FUNCTION_TO_POINTER_DECAY,
    NULL_TO_POINTER,
    NULL_TO_MEMBER_POINTER,
    USER_DEFINED_CONVERSION,
    CONSTRUCTOR_CONVERSION,
    INTEGRAL_TO_POINTER,
    POINTER_TO_INTEGRAL,
    POINTER_TO_BOOLEAN,
    TO_VOID,
    INTEGRAL_CAST,
    INTEGRAL_TO_BOOLEAN,
    INTEGRAL_TO_FLOATING,
    FLOATING_TO_INTEGRAL,
    FLOATING_TO_BOOLEAN,
    FLOATING_CAST,
    ATOMIC_TO_NON_ATOMIC,
    NON_ATOMIC_TO_ATOMIC
}
