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
package com.mastfrog.desugar.generator;

import com.mastfrog.desugar.AstFixtures;
import static com.mastfrog.desugar.AstFixtures.INT;
import static com.mastfrog.desugar.AstFixtures.POINT;
import static com.mastfrog.desugar.AstFixtures.STRING;
import static com.mastfrog.desugar.AstFixtures.function;
import com.mastfrog.desugar.Desugarer;
import com.mastfrog.desugar.ast.decl.VarDecl;
import com.mastfrog.desugar.ast.expr.ConstructExpr;
import com.mastfrog.desugar.ast.expr.IntegerLiteral;
import com.mastfrog.desugar.ast.expr.StringLiteral;
import com.mastfrog.desugar.ast.stmt.DeclStmt;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

public class StaticLocalInitGuardTest {

    @Test
    public void testNonTrivialStaticLocalIsGuarded() {
        String expected = "void f()\n"
                + "{\n"
                + "  static bool __sB;\n"
                + "  static char __s[sizeof(std::string)];\n"
                + "\n"
                + "  if( ! __sB )\n"
                + "  {\n"
                + "    new (&__s) std::string{\"x\"};\n"
                + "    __sB = true;\n"
                + "  }\n"
                + "}\n"
                + "\n";
        assertEquals(expected, new Desugarer().desugar(AstFixtures.staticLocalString()).text());
    }

    @Test
    public void testParenthesizedConstructionKeepsParentheses() {
        VarDecl s = VarDecl.builder("name", STRING).at(2, 3).makeStatic()
                .initializedWith(ConstructExpr.parens(STRING, StringLiteral.of("a"), IntegerLiteral.of(3)))
                .build();
        String text = new Desugarer().desugar(function("f", DeclStmt.of(s))).text();
        assertTrue(text.contains("    new (&__name) std::string(\"a\", 3);\n"), text);
    }

    @Test
    public void testWhichVariablesAreGuarded() {
        assertTrue(StaticLocalInitGuard.applies(VarDecl.builder("s", STRING).makeStatic().build()));
        assertFalse(StaticLocalInitGuard.applies(VarDecl.builder("s", STRING).build()));
        assertFalse(StaticLocalInitGuard.applies(VarDecl.builder("s", STRING).makeStatic().global().build()));
        assertFalse(StaticLocalInitGuard.applies(VarDecl.builder("p", POINT).makeStatic().build()));
        assertFalse(StaticLocalInitGuard.applies(VarDecl.builder("i", INT).makeStatic().build()));
    }

    @Test
    public void testTrivialStaticLocalIsLeftAlone() {
        VarDecl counter = VarDecl.builder("counter", INT).at(2, 3).makeStatic()
                .initializedWith(IntegerLiteral.of(0)).build();
        String text = new Desugarer().desugar(function("f", DeclStmt.of(counter))).text();
        assertTrue(text.contains("  static int counter = 0;\n"), text);
    }
}
