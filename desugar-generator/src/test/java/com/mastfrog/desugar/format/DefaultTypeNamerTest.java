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

import com.mastfrog.desugar.ast.type.BuiltinKind;
import com.mastfrog.desugar.ast.type.CppType;
import static org.junit.jupiter.api.Assertions.assertEquals;
import org.junit.jupiter.api.Test;

public class DefaultTypeNamerTest {

    private static final CppType INT = CppType.builtin(BuiltinKind.INT);
    private static final CppType VOID = CppType.builtin(BuiltinKind.VOID);
    private final DefaultTypeNamer namer = new DefaultTypeNamer();

    @Test
    public void testPointersAndReferencesBindToName() {
        assertEquals("int *", namer.name(INT.pointer()));
        assertEquals("int *p", namer.nameAsParameter(INT.pointer(), "p"));
        assertEquals("int &r", namer.nameAsParameter(INT.lvalueReference(), "r"));
        assertEquals("int &&r", namer.nameAsParameter(INT.rvalueReference(), "r"));
        assertEquals("int **pp", namer.nameAsParameter(INT.pointer().pointer(), "pp"));
    }

    @Test
    public void testQualifiers() {
        assertEquals("const int", namer.name(INT.withConst()));
        assertEquals("const int &r", namer.nameAsParameter(INT.withConst().lvalueReference(), "r"));
        assertEquals("int *const p", namer.nameAsParameter(INT.pointer().withConst(), "p"));
        assertEquals("const volatile int", namer.name(INT.withConst().withVolatile()));
    }

    @Test
    public void testArraysAndFunctions() {
        CppType array = CppType.arrayOf(INT, 3);
        assertEquals("int a[3]", namer.nameAsParameter(array, "a"));
        assertEquals("int (&a)[3]", namer.nameAsParameter(array.lvalueReference(), "a"));
        assertEquals("int (*)[3]", namer.name(array.pointer()));
        CppType fn = CppType.function(VOID, INT, INT.pointer());
        assertEquals("void (*)(int, int *)", namer.name(fn.pointer()));
        assertEquals("void (*fp)(int, int *)", namer.nameAsParameter(fn.pointer(), "fp"));
        assertEquals("void (*)(int, int *)", namer.nameAsFunctionPointer(fn));
        assertEquals("int", namer.nameAsFunctionPointer(INT));
    }

    @Test
    public void testSugar() {
        CppType alias = CppType.alias("Count", INT);
        assertEquals("Count", namer.name(alias));
        assertEquals("int", namer.desugaredName(alias));
        assertEquals("Count *", namer.name(alias.pointer()));
        assertEquals("int *", namer.desugaredName(alias.pointer()));
        assertEquals("const int", namer.desugaredName(alias.withConst()));
        assertEquals("int", namer.name(CppType.auto(INT)));
        assertEquals("int &x", namer.nameAsParameter(CppType.auto(INT.lvalueReference()), "x"));
        assertEquals("int (&r)[2]", namer.nameAsParameter(CppType.auto(CppType.arrayOf(INT, 2)).lvalueReference(), "r"));
    }

    @Test
    public void testNamePrefix() {
        assertEquals("int ", namer.namePrefix(INT));
        assertEquals("int *", namer.namePrefix(INT.pointer()));
        assertEquals("int &", namer.namePrefix(INT.lvalueReference()));
        assertEquals("std::string ", namer.namePrefix(CppType.record("std::string")));
    }
}
