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
package com.mastfrog.desugar.format;

import com.mastfrog.desugar.ast.expr.CastKind;
import com.mastfrog.desugar.ast.type.CppType;

/**
 * Decides which implicit conversions become visible casts, and how they are
 * spelled.
 */
public final class Casts {

    public static final String STATIC_CAST = "static_cast";
    public static final String REINTERPRET_CAST = "reinterpret_cast";

    private Casts() {
        throw new AssertionError();
    }

    /**
     * Whether an implicit conversion of this kind is written out as a named
     * cast. Conversions which do not change the value's representation in a
     * way a reader needs to see (lvalue to rvalue, decays, no-ops and the
     * like) stay implicit.
     *
     * @param kind A cast kind
     * @return true if it should be written
     */
    public static boolean isMadeExplicit(CastKind kind) {
        switch (kind) {
            case INTEGRAL_CAST:
            case INTEGRAL_TO_BOOLEAN:
            case INTEGRAL_TO_POINTER:
            case POINTER_TO_INTEGRAL:
            case BIT_CAST:
            case UNCHECKED_DERIVED_TO_BASE:
            case DERIVED_TO_BASE:
            case TO_UNION:
            case USER_DEFINED_CONVERSION:
            case ATOMIC_TO_NON_ATOMIC:
            case NON_ATOMIC_TO_ATOMIC:
            case FLOATING_CAST:
            case INTEGRAL_TO_FLOATING:
            case FLOATING_TO_INTEGRAL:
                return true;
            default:
                return false;
        }
    }

    /**
     * The keyword an implicit conversion is made explicit with.
     *
     * @param kind A cast kind
     * @return A keyword
     */
    public static String implicitCastKeyword(CastKind kind) {
        return kind == CastKind.BIT_CAST ? REINTERPRET_CAST : STATIC_CAST;
    }

    public static boolean isDerivedToBase(CastKind kind) {
        return kind == CastKind.DERIVED_TO_BASE || kind == CastKind.UNCHECKED_DERIVED_TO_BASE;
    }

    /**
     * The text between the angle brackets of a cast. A conversion of a class
     * object to one of its bases yields a reference, so <code>&amp;</code> is
     * appended unless the destination is a pointer.
     *
     * @param namer Spells types
     * @param kind The kind of conversion
     * @param destination The type converted to
     * @return The destination text
     */
    public static String destinationText(TypeNamer namer, CastKind kind, CppType destination) {
        String name = namer.desugaredName(destination);
        if (isDerivedToBase(kind) && destination.isRecord() && !destination.isPointer()) {
            return name + "&";
        }
        return name;
    }
}
