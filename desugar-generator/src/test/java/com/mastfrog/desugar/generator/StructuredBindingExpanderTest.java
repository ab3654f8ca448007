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
import static com.mastfrog.desugar.AstFixtures.decomposeArray;
import static com.mastfrog.desugar.AstFixtures.decomposePoint;
import static com.mastfrog.desugar.AstFixtures.function;
import static com.mastfrog.desugar.AstFixtures.point;
import static com.mastfrog.desugar.AstFixtures.ref;
import com.mastfrog.desugar.DesugarResult;
import com.mastfrog.desugar.Desugarer;
import com.mastfrog.desugar.ast.TemplateArgument;
import com.mastfrog.desugar.ast.decl.BindingDecl;
import com.mastfrog.desugar.ast.decl.DecompositionDecl;
import com.mastfrog.desugar.ast.decl.FieldDecl;
import com.mastfrog.desugar.ast.decl.VarDecl;
import com.mastfrog.desugar.ast.expr.CallExpr;
import com.mastfrog.desugar.ast.expr.DeclRefExpr;
import com.mastfrog.desugar.ast.expr.Expr;
import com.mastfrog.desugar.ast.expr.IntegerLiteral;
import com.mastfrog.desugar.ast.expr.MemberExpr;
import com.mastfrog.desugar.ast.expr.ParenExpr;
import com.mastfrog.desugar.ast.expr.WrapperExpr;
import com.mastfrog.desugar.ast.stmt.DeclStmt;
import com.mastfrog.desugar.ast.type.CppType;
import java.util.Collections;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

public class StructuredBindingExpanderTest {

    private static String render(DeclStmt... statements) {
        DesugarResult result = new Desugarer().desugar(function("f", statements));
        assertTrue(result.isClean(), result.diagnostics().toString());
        return result.text();
    }

    @Test
    public void testAggregateMembersBindAsReferences() {
        VarDecl p = point("p", 3);
        String text = render(DeclStmt.of(p), DeclStmt.of(decomposePoint(p, 4, 8, "a", "b")));
        assertTrue(text.contains("  Point p;\n"
                + "  Point __p4 = p;\n"
                + "  int &a = __p4.x;\n"
                + "  int &b = __p4.y;\n"), text);
    }

    @Test
    public void testSecondDecompositionOnSameLineGetsColumn() {
        VarDecl p = point("p", 3);
        String text = render(DeclStmt.of(p), DeclStmt.of(decomposePoint(p, 4, 8, "a", "b")),
                DeclStmt.of(decomposePoint(p, 4, 30, "c", "d")));
        assertTrue(text.contains("  Point __p4 = p;\n"), text);
        assertTrue(text.contains("  Point __p4_30 = p;\n"
                + "  int &c = __p4_30.x;\n"
                + "  int &d = __p4_30.y;\n"), text);
    }

    @Test
    public void testDecomposingThroughReference() {
        VarDecl p = point("p", 3);
        DecompositionDecl decl = DecompositionDecl.of(VarDecl.builder("", POINT.lvalueReference()).at(4, 9)
                .initializedWith(ref(p)),
                BindingDecl.of("a", INT, MemberExpr.dot(
                        DeclRefExpr.named("", POINT), FieldDecl.of("x", INT))));
        String text = render(DeclStmt.of(p), DeclStmt.of(decl));
        assertTrue(text.contains("  Point &__p4 = p;\n  int &a = __p4.x;\n"), text);
    }

    @Test
    public void testArrayElementsAreCopiedByIndex() {
        VarDecl arr = VarDecl.builder("arr", CppType.arrayOf(INT, 2)).at(3, 7).build();
        String text = render(DeclStmt.of(arr), DeclStmt.of(decomposeArray(arr, 4)));
        assertTrue(text.contains("  int arr[2];\n"
                + "  int __arr4[2] = {arr[0], arr[1]};\n"
                + "  int a = __arr4[0];\n"
                + "  int b = __arr4[1];\n"), text);
    }

    @Test
    public void testTupleLikeBindingsUseHoldingVariables() {
        CppType tuple = CppType.record("std::tuple<int, int>");
        VarDecl t = VarDecl.builder("t", tuple).at(3, 3).build();
        BindingDecl first = tupleElement("a", tuple, 0, false);
        BindingDecl second = tupleElement("b", tuple, 1, true);
        DecompositionDecl decl = DecompositionDecl.of(VarDecl.builder("", tuple).at(4, 8)
                .initializedWith(ref(t)), first, second);
        String text = render(DeclStmt.of(t), DeclStmt.of(decl));
        assertTrue(text.contains("  std::tuple<int, int> __t4 = t;\n"
                + "  int &a = std::get<0>(__t4);\n"
                + "  int b = std::get<1>(__t4);\n"), text);
    }

    private static BindingDecl tupleElement(String name, CppType tuple, int index, boolean temporary) {
        DeclRefExpr get = new DeclRefExpr(null, "std::get", null, CppType.function(INT, tuple),
                Collections.singletonList(TemplateArgument.integral(index)));
        Expr call = CallExpr.call(get, INT, DeclRefExpr.named("", tuple));
        if (temporary) {
            call = WrapperExpr.withCleanups(call);
        }
        VarDecl holding = VarDecl.builder(name, INT.rvalueReference()).at(4, 8).initializedWith(call).build();
        return BindingDecl.tupleLike(name, INT, DeclRefExpr.to(holding), holding);
    }

    @Test
    public void testFindDeclRefSearchesDepthFirst() {
        VarDecl arr = VarDecl.builder("arr", CppType.arrayOf(INT, 2)).at(3, 7).build();
        DecompositionDecl decl = decomposeArray(arr, 4);
        DeclRefExpr found = StructuredBindingExpander.findDeclRef(decl.initializer());
        assertEquals("arr", found.name());
        assertSame(arr, found.decl());
        DeclRefExpr nested = ref(AstFixtures.point("q", 2));
        assertSame(nested, StructuredBindingExpander.findDeclRef(ParenExpr.of(nested)));
        assertNull(StructuredBindingExpander.findDeclRef(IntegerLiteral.of(3)));
        assertNull(StructuredBindingExpander.findDeclRef(null));
    }
}
