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

import com.mastfrog.desugar.ast.TemplateArgument;
import com.mastfrog.desugar.ast.decl.FunctionDecl;
import com.mastfrog.desugar.ast.decl.ParmVarDecl;
import com.mastfrog.desugar.ast.type.BuiltinKind;
import com.mastfrog.desugar.ast.type.CppType;
import com.mastfrog.desugar.output.OutputBuffer;
import java.util.Arrays;
import static org.junit.jupiter.api.Assertions.assertEquals;
import org.junit.jupiter.api.Test;

public class DefaultPrototypeFormatterTest {

    private static final CppType INT = CppType.builtin(BuiltinKind.INT);
    private final PrototypeFormatter formatter = new DefaultPrototypeFormatter(new DefaultTypeNamer());

    private String format(FunctionDecl fn) {
        OutputBuffer out = new OutputBuffer();
        formatter.formatPrototype(out, fn);
        return out.toString();
    }

    @Test
    public void testQualifiersAndParameters() {
        FunctionDecl fn = FunctionDecl.builder("add", INT).makeInline().makeStatic().makeConstexpr()
                .withParameters(ParmVarDecl.of("a", INT), ParmVarDecl.of("b", INT.pointer()))
                .makeNoexcept().build();
        assertEquals("inline static constexpr int add(int a, int *b) noexcept", format(fn));
    }

    @Test
    public void testPointerReturnTypeHasNoExtraSpace() {
        FunctionDecl fn = FunctionDecl.builder("data", INT.pointer()).build();
        assertEquals("int *data()", format(fn));
    }

    @Test
    public void testTemplateArguments() {
        FunctionDecl fn = FunctionDecl.builder("max", INT)
                .withTemplateArguments(TemplateArgument.type(INT), TemplateArgument.integral(3))
                .withParameters(ParmVarDecl.of("a", INT))
                .build();
        assertEquals("int max<int, 3>(int a)", format(fn));
        FunctionDecl nested = FunctionDecl.builder("f", CppType.builtin(BuiltinKind.VOID))
                .withTemplateArguments(TemplateArgument.type(CppType.record("std::vector<int>")))
                .build();
        assertEquals("void f<std::vector<int> >()", format(nested));
    }

    @Test
    public void testParameterList() {
        OutputBuffer out = new OutputBuffer();
        formatter.formatParameters(out, Arrays.asList(ParmVarDecl.of("xs", CppType.arrayOf(INT, 4).lvalueReference()),
                ParmVarDecl.of("n", INT)));
        assertEquals("int (&xs)[4], int n", out.toString());
    }
}
