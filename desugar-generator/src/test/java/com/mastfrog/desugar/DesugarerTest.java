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
package com.mastfrog.desugar;

import static com.mastfrog.desugar.AstFixtures.INT;
import static com.mastfrog.desugar.AstFixtures.VOID;
import static com.mastfrog.desugar.AstFixtures.callUse;
import static com.mastfrog.desugar.AstFixtures.function;
import static com.mastfrog.desugar.AstFixtures.intVar;
import static com.mastfrog.desugar.AstFixtures.loc;
import static com.mastfrog.desugar.AstFixtures.rangeForOverArray;
import static com.mastfrog.desugar.AstFixtures.ref;
import static com.mastfrog.desugar.AstFixtures.rvalue;
import com.mastfrog.desugar.ast.Node;
import com.mastfrog.desugar.ast.NodeKind;
import com.mastfrog.desugar.ast.TemplateArgument;
import com.mastfrog.desugar.ast.decl.BindingDecl;
import com.mastfrog.desugar.ast.decl.DeclContextRef;
import com.mastfrog.desugar.ast.decl.DecompositionDecl;
import com.mastfrog.desugar.ast.decl.FunctionDecl;
import com.mastfrog.desugar.ast.decl.MethodDecl;
import com.mastfrog.desugar.ast.decl.ParmVarDecl;
import com.mastfrog.desugar.ast.decl.StaticAssertDecl;
import com.mastfrog.desugar.ast.decl.UsingDecl;
import com.mastfrog.desugar.ast.decl.VarDecl;
import com.mastfrog.desugar.ast.expr.ArrayInitIndexExpr;
import com.mastfrog.desugar.ast.expr.BoolLiteral;
import com.mastfrog.desugar.ast.expr.CStyleCastExpr;
import com.mastfrog.desugar.ast.expr.CastKind;
import com.mastfrog.desugar.ast.expr.ConstructExpr;
import com.mastfrog.desugar.ast.expr.DeclRefExpr;
import com.mastfrog.desugar.ast.expr.ImplicitCastExpr;
import com.mastfrog.desugar.ast.expr.IntegerLiteral;
import com.mastfrog.desugar.ast.expr.NullExpr;
import com.mastfrog.desugar.ast.expr.OperatorCallExpr;
import com.mastfrog.desugar.ast.expr.StringLiteral;
import com.mastfrog.desugar.ast.expr.ThisExpr;
import com.mastfrog.desugar.ast.expr.UnaryOpcode;
import com.mastfrog.desugar.ast.expr.UnaryOperator;
import com.mastfrog.desugar.ast.expr.UserDefinedLiteral;
import com.mastfrog.desugar.ast.stmt.CaseStmt;
import com.mastfrog.desugar.ast.stmt.CompoundStmt;
import com.mastfrog.desugar.ast.stmt.DeclStmt;
import com.mastfrog.desugar.ast.stmt.DefaultStmt;
import com.mastfrog.desugar.ast.stmt.IfStmt;
import com.mastfrog.desugar.ast.stmt.OtherStmt;
import com.mastfrog.desugar.ast.stmt.RangeForStmt;
import com.mastfrog.desugar.ast.stmt.ReturnStmt;
import com.mastfrog.desugar.ast.stmt.SimpleStmt;
import com.mastfrog.desugar.ast.stmt.SwitchStmt;
import com.mastfrog.desugar.ast.type.BuiltinKind;
import com.mastfrog.desugar.ast.type.CppType;
import java.util.Arrays;
import java.util.Collections;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

public class DesugarerTest {

    private static final CppType LONG = CppType.builtin(BuiltinKind.LONG);

    static String render(Node... nodes) {
        DesugarResult result = new Desugarer().desugar(nodes);
        assertBalanced(result.text());
        return result.text();
    }

    static void assertBalanced(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                assertTrue(depth >= 0, "Unbalanced at " + i + " in\n" + text);
            }
        }
        assertEquals(0, depth, "Unbalanced braces in\n" + text);
    }

    @Test
    public void testRangeForOverArray() {
        String expected = "void f()\n"
                + "{\n"
                + "  int c[3];\n"
                + "  {\n"
                + "    int (&__range1)[3] = c;\n"
                + "    int *__begin1 = __range1;\n"
                + "    int *__end1 = __range1 + 3;\n"
                + "\n"
                + "    for( ; __begin1 != __end1; ++__begin1 )\n"
                + "    {\n"
                + "      int x = *__begin1;\n"
                + "      use(x);\n"
                + "    }\n"
                + "  }\n"
                + "}\n"
                + "\n";
        assertEquals(expected, render(rangeForOverArray()));
    }

    @Test
    public void testIndentationIsConfigurable() {
        DesugarResult result = new Desugarer(DesugarOptions.builder().indentBy(4).build())
                .desugar(rangeForOverArray());
        assertTrue(result.text().contains("\n    int c[3];\n"), result.text());
        assertTrue(result.text().contains("\n            use(x);\n"), result.text());
    }

    @Test
    public void testOutputIsDeterministic() {
        FunctionDecl fn = rangeForOverArray();
        FunctionDecl lambdas = AstFixtures.capturingLambda();
        Desugarer desugarer = new Desugarer();
        String first = desugarer.desugar(fn, lambdas).text();
        assertEquals(first, desugarer.desugar(fn, lambdas).text());
        assertEquals(first, new Desugarer().desugar(Arrays.asList(fn, lambdas)).text());
    }

    @Test
    public void testUnhandledConstructBecomesPlaceholder() {
        OtherStmt jump = new OtherStmt(NodeKind.GOTO_STMT, loc(5, 3), Collections.<Node>emptyList());
        DesugarResult result = new Desugarer().desugar(function("f", jump, DeclStmt.of(intVar("after", 2, 6))));
        assertTrue(result.text().contains("  /* NOT YET HANDLED: GotoStmt */\n  int after = 2;\n"),
                result.text());
        assertEquals(1, result.diagnostics().size());
        Diagnostic d = result.diagnostics().get(0);
        assertEquals(Diagnostic.Severity.WARNING, d.severity());
        assertEquals(NodeKind.GOTO_STMT, d.kind());
        assertEquals(loc(5, 3), d.location());
        assertFalse(result.hasErrors());
        assertFalse(result.isClean());
    }

    @Test
    public void testStructuralFailureAbandonsOnlyItsStatement() {
        CppType point = AstFixtures.POINT;
        DecompositionDecl broken = DecompositionDecl.of(VarDecl.builder("", point).at(4, 8)
                .initializedWith(ConstructExpr.braces(point)),
                BindingDecl.of("a", INT, null));
        DesugarResult result = new Desugarer().desugar(function("f", DeclStmt.of(broken),
                DeclStmt.of(intVar("after", 2, 5))));
        assertTrue(result.hasErrors());
        assertEquals("unknown decl", result.diagnostics().get(0).message());
        assertEquals(NodeKind.DECOMPOSITION_DECL, result.diagnostics().get(0).kind());
        assertTrue(result.text().contains("\n  int after = 2;\n"), result.text());
        assertBalanced(result.text());
    }

    @Test
    public void testScopesOpenedByAbandonedStatementAreClosed() {
        VarDecl range = VarDecl.builder("__range1", INT).at(3, 3).initializedWith(IntegerLiteral.of(0)).build();
        VarDecl begin = VarDecl.builder("__begin1", INT).at(3, 3).initializedWith(IntegerLiteral.of(0)).build();
        VarDecl end = VarDecl.builder("__end1", INT).at(3, 3).initializedWith(IntegerLiteral.of(1)).build();
        VarDecl x = VarDecl.builder("x", INT).at(3, 8).build();
        RangeForStmt loop = new RangeForStmt(loc(3, 3), DeclStmt.of(range), DeclStmt.of(begin),
                DeclStmt.of(end), new ArrayInitIndexExpr(loc(3, 10)),
                UnaryOperator.of(UnaryOpcode.PRE_INC, ref(begin), INT), DeclStmt.of(x), CompoundStmt.of());
        DesugarResult result = new Desugarer().desugar(function("f", loop, DeclStmt.of(intVar("after", 2, 4))));
        assertTrue(result.hasErrors());
        assertEquals(NodeKind.ARRAY_INIT_INDEX_EXPR, result.diagnostics().get(0).kind());
        assertBalanced(result.text());
        assertTrue(result.text().contains("    int __end1 = 1;\n"), result.text());
        assertTrue(result.text().contains("\n  }\n  int after = 2;\n}\n"), result.text());
    }

    @Test
    public void testImplicitConversionsMadeExplicit() {
        CppType charType = CppType.builtin(BuiltinKind.CHAR_S);
        VarDecl ch = VarDecl.builder("ch", charType).at(2, 3).build();
        VarDecl widened = VarDecl.builder("l", LONG).at(3, 3)
                .initializedWith(ImplicitCastExpr.of(CastKind.INTEGRAL_CAST, rvalue(ref(ch)), LONG)).build();
        VarDecl literal = VarDecl.builder("m", LONG).at(4, 3)
                .initializedWith(ImplicitCastExpr.of(CastKind.INTEGRAL_CAST, IntegerLiteral.of(1), LONG)).build();
        VarDecl p = VarDecl.builder("p", INT.pointer()).at(5, 3).build();
        VarDecl addr = VarDecl.builder("n", LONG).at(6, 3)
                .initializedWith(new CStyleCastExpr(null, CastKind.POINTER_TO_INTEGRAL, rvalue(ref(p)), LONG))
                .build();
        String text = render(function("f", DeclStmt.of(ch), DeclStmt.of(widened), DeclStmt.of(literal),
                DeclStmt.of(p), DeclStmt.of(addr)));
        assertTrue(text.contains("  long l = static_cast<long>(ch);\n"), text);
        assertTrue(text.contains("  long m = 1;\n"), text);
        assertTrue(text.contains("  long n = reinterpret_cast<long>(p);\n"), text);
    }

    @Test
    public void testDerivedToBaseConversionOfThisIsCommentedOut() {
        CppType base = CppType.record("Base");
        CppType derived = CppType.record("Derived");
        ThisExpr self = new ThisExpr(null, derived.pointer(), false);
        ReturnStmt ret = ReturnStmt.returning(ImplicitCastExpr.of(CastKind.DERIVED_TO_BASE, self, base.pointer()));
        String text = render(function("f", ret));
        assertTrue(text.contains("  return /*static_cast<Base *>(*/this/*)*/;\n"), text);
    }

    @Test
    public void testFunctionPointerGetsAlias() {
        CppType fn = CppType.function(VOID, INT);
        VarDecl fp = VarDecl.builder("fp", fn.pointer()).at(7, 3)
                .initializedWith(ImplicitCastExpr.of(CastKind.NULL_TO_POINTER, NullExpr.nullptr(null), fn.pointer()))
                .build();
        String text = render(function("f", DeclStmt.of(fp)));
        assertTrue(text.contains("  using FuncPtr_7 = void (*)(int);\n  FuncPtr_7 fp = nullptr;\n"), text);
    }

    @Test
    public void testUsingDeclarations() {
        UsingDecl global = new UsingDecl(loc(1, 1), "swap",
                Collections.singletonList(DeclContextRef.namespace("std")), false);
        UsingDecl local = new UsingDecl(loc(3, 3), "swap",
                Collections.singletonList(DeclContextRef.namespace("std")), true);
        String text = render(global, function("f", DeclStmt.of(local)));
        assertTrue(text.startsWith("using std::swap;\nvoid f()\n"), text);
        assertTrue(text.contains("\n  using swap;\n"), text);
    }

    @Test
    public void testStaticAssertions() {
        StaticAssertDecl passed = new StaticAssertDecl(loc(1, 1), new BoolLiteral(null, true),
                StringLiteral.of("msg"), false);
        StaticAssertDecl failed = new StaticAssertDecl(loc(2, 1), new BoolLiteral(null, false), null, true);
        String text = render(passed, failed);
        assertEquals("/* PASSED: static_assert(true, \"msg\"); */\n"
                + "/* FAILED: static_assert(false); */\n", text);
    }

    @Test
    public void testFunctionPrototype() {
        FunctionDecl add = FunctionDecl.builder("add", INT).at(1, 1).makeInline().makeConstexpr()
                .withParameters(ParmVarDecl.of("a", INT), ParmVarDecl.of("b", INT))
                .makeNoexcept().build();
        assertEquals("inline constexpr int add(int a, int b) noexcept;\n\n", render(add));
    }

    @Test
    public void testIfInitAndConditionVariableAreHoisted() {
        VarDecl n = intVar("n", 1, 2);
        VarDecl ok = VarDecl.builder("ok", INT).at(2, 19).initializedWith(rvalue(ref(n))).build();
        IfStmt stmt = new IfStmt(loc(2, 3), DeclStmt.of(n), ok, rvalue(ref(ok)),
                callUse(rvalue(ref(n))), callUse(IntegerLiteral.of(0)), false);
        String expected = "void f()\n"
                + "{\n"
                + "  {\n"
                + "    int n = 1;\n"
                + "    int ok = n;\n"
                + "    if(ok)\n"
                + "    {\n"
                + "      use(n);\n"
                + "    }\n"
                + "    else\n"
                + "    {\n"
                + "      use(0);\n"
                + "    }\n"
                + "  }\n"
                + "}\n"
                + "\n";
        assertEquals(expected, render(function("f", stmt)));
    }

    @Test
    public void testSwitchInitIsHoisted() {
        VarDecl k = intVar("k", 2, 2);
        CompoundStmt body = CompoundStmt.of(
                new CaseStmt(loc(3, 5), IntegerLiteral.of(1), callUse(rvalue(ref(k)))),
                SimpleStmt.breakStatement(loc(3, 20)),
                new DefaultStmt(loc(4, 5), SimpleStmt.breakStatement(loc(4, 14))));
        SwitchStmt stmt = new SwitchStmt(loc(2, 3), DeclStmt.of(k), null, rvalue(ref(k)), body);
        String expected = "void f()\n"
                + "{\n"
                + "  {\n"
                + "    int k = 2;\n"
                + "    switch(k)\n"
                + "    {\n"
                + "      case 1: use(k);\n"
                + "      break;\n"
                + "      default: break;\n"
                + "    }\n"
                + "  }\n"
                + "}\n"
                + "\n";
        assertEquals(expected, render(function("f", stmt)));
    }

    @Test
    public void testOperatorCalls() {
        CppType point = AstFixtures.POINT;
        VarDecl p = AstFixtures.point("p", 2);
        VarDecl q = AstFixtures.point("q", 3);
        VarDecl ptr = VarDecl.builder("ptr", point.pointer()).at(4, 10).build();
        CppType plus = CppType.function(point, point, point);
        OperatorCallExpr free = OperatorCallExpr.call("+", DeclRefExpr.named("operator+", plus), point,
                ref(p), ref(q));
        MethodDecl shift = MethodDecl.methodBuilder("operator<<", point.lvalueReference())
                .withParameters(ParmVarDecl.of("n", INT)).build();
        OperatorCallExpr member = OperatorCallExpr.call("<<", DeclRefExpr.to(shift), point.lvalueReference(),
                ref(p), IntegerLiteral.of(1));
        OperatorCallExpr throughPointer = OperatorCallExpr.call("<<", DeclRefExpr.to(shift),
                point.lvalueReference(), UnaryOperator.of(UnaryOpcode.DEREF, rvalue(ref(ptr)), point),
                IntegerLiteral.of(2));
        String expected = "void f()\n"
                + "{\n"
                + "  Point p;\n"
                + "  Point q;\n"
                + "  Point *ptr;\n"
                + "  operator+(p, q);\n"
                + "  p.operator<<(1);\n"
                + "  (*ptr).operator<<(2);\n"
                + "}\n"
                + "\n";
        assertEquals(expected, render(function("f", DeclStmt.of(p), DeclStmt.of(q), DeclStmt.of(ptr),
                free, member, throughPointer)));
    }

    @Test
    public void testLiteralOperatorCharacterPack() {
        CppType fn = CppType.function(INT);
        UserDefinedLiteral km = new UserDefinedLiteral(loc(2, 11), DeclRefExpr.named("operator\"\"_km", fn),
                Collections.<IntegerLiteral>emptyList(),
                Arrays.asList(TemplateArgument.pack(TemplateArgument.integral('1'), TemplateArgument.integral('2'))),
                INT);
        VarDecl d = VarDecl.builder("d", INT).at(2, 7).initializedWith(km).build();
        String text = render(function("f", DeclStmt.of(d)));
        assertTrue(text.contains("\n  int d = operator\"\"_km<'1', '2'>();\n"), text);
    }
}
