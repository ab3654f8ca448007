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
import com.mastfrog.desugar.ast.type.BuiltinKind;
import com.mastfrog.desugar.ast.type.CppType;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

public class CastsTest {

    private final TypeNamer namer = new DefaultTypeNamer();

    @Test
    public void testWhichConversionsAreVisible() {
        assertTrue(Casts.isMadeExplicit(CastKind.INTEGRAL_CAST));
        assertTrue(Casts.isMadeExplicit(CastKind.INTEGRAL_TO_FLOATING));
        assertTrue(Casts.isMadeExplicit(CastKind.DERIVED_TO_BASE));
        assertTrue(Casts.isMadeExplicit(CastKind.BIT_CAST));
        assertFalse(Casts.isMadeExplicit(CastKind.LVALUE_TO_RVALUE));
        assertFalse(Casts.isMadeExplicit(CastKind.ARRAY_TO_POINTER_DECAY));
        assertFalse(Casts.isMadeExplicit(CastKind.FUNCTION_TO_POINTER_DECAY));
        assertFalse(Casts.isMadeExplicit(CastKind.NO_OP));
        assertFalse(Casts.isMadeExplicit(CastKind.NULL_TO_POINTER));
    }

    @Test
    public void testKeywords() {
        assertEquals("reinterpret_cast", Casts.implicitCastKeyword(CastKind.BIT_CAST));
        assertEquals("static_cast", Casts.implicitCastKeyword(CastKind.INTEGRAL_CAST));
        assertEquals("static_cast", Casts.implicitCastKeyword(CastKind.UNCHECKED_DERIVED_TO_BASE));
    }

    @Test
    public void testDestinationText() {
        CppType base = CppType.record("Base");
        assertEquals("Base&", Casts.destinationText(namer, CastKind.DERIVED_TO_BASE, base));
        assertEquals("Base&", Casts.destinationText(namer, CastKind.UNCHECKED_DERIVED_TO_BASE, base));
        assertEquals("Base *", Casts.destinationText(namer, CastKind.DERIVED_TO_BASE, base.pointer()));
        CppType alias = CppType.alias("Count", CppType.builtin(BuiltinKind.UINT));
        assertEquals("unsigned int", Casts.destinationText(namer, CastKind.INTEGRAL_CAST, alias));
    }
}
