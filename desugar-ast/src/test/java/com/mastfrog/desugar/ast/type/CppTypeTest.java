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
package com.mastfrog.desugar.ast.type;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

public class CppTypeTest {

    private static final CppType INT = CppType.builtin(BuiltinKind.INT);

    @Test
    public void testPredicatesLookThroughSugar() {
        CppType record = CppType.record("Point");
        CppType alias = CppType.alias("P", record);
        CppType deduced = CppType.auto(alias);
        assertTrue(alias.isRecord());
        assertTrue(deduced.isRecord());
        assertFalse(deduced.isUndeducedAuto());
        assertTrue(CppType.auto().isUndeducedAuto());
        assertTrue(CppType.auto(INT.lvalueReference()).isLValueReference());
        assertTrue(CppType.auto(INT.rvalueReference()).isReference());
        assertFalse(CppType.auto(INT.rvalueReference()).isLValueReference());
    }

    @Test
    public void testDesugaredStripsAliasesBelowCompounds() {
        CppType alias = CppType.alias("Int", INT);
        CppType ptr = alias.pointer();
        assertEquals(INT.pointer(), ptr.desugared());
        assertEquals(CppType.arrayOf(INT, 3), CppType.arrayOf(alias, 3).desugared());
        assertEquals(INT.withConst(), alias.withConst().desugared());
        assertSame(INT, INT.desugared());
    }

    @Test
    public void testFunctionPointer() {
        CppType fn = CppType.function(CppType.builtin(BuiltinKind.VOID), INT);
        assertTrue(fn.pointer().isFunctionPointer());
        assertFalse(INT.pointer().isFunctionPointer());
        assertTrue(CppType.alias("Callback", fn.pointer()).isFunctionPointer());
    }

    @Test
    public void testTrivialConstruction() {
        assertTrue(INT.hasTrivialConstruction());
        assertTrue(CppType.record("Pod").hasTrivialConstruction());
        CppType str = CppType.record("std::string", false);
        assertFalse(str.hasTrivialConstruction());
        assertFalse(CppType.arrayOf(str, 2).hasTrivialConstruction());
        assertFalse(CppType.alias("S", str).hasTrivialConstruction());
    }

    @Test
    public void testQualifiers() {
        CppType c = INT.withConst().withVolatile();
        assertTrue(c.isConst());
        assertTrue(c.isVolatile());
        assertEquals(INT, c.unqualified());
        assertSame(INT, INT.unqualified());
        assertNotEquals(INT, INT.withConst());
    }

    @Test
    public void testNonReference() {
        assertEquals(INT, INT.lvalueReference().nonReference());
        assertEquals(INT, INT.rvalueReference().nonReference());
        assertSame(INT, INT.nonReference());
    }

    @Test
    public void testSignedness() {
        assertTrue(INT.isSignedInteger());
        assertFalse(CppType.builtin(BuiltinKind.UINT).isSignedInteger());
        assertFalse(CppType.builtin(BuiltinKind.DOUBLE).isSignedInteger());
        assertEquals(BuiltinKind.LONG, CppType.alias("ssize_t", CppType.builtin(BuiltinKind.LONG))
                .underlyingBuiltin());
    }
}
