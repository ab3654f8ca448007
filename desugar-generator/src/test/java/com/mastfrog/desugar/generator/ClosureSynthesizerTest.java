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
import static com.mastfrog.desugar.AstFixtures.VOID;
import static com.mastfrog.desugar.AstFixtures.callOperator;
import static com.mastfrog.desugar.AstFixtures.function;
import static com.mastfrog.desugar.AstFixtures.intVar;
import static com.mastfrog.desugar.AstFixtures.loc;
import static com.mastfrog.desugar.AstFixtures.rvalue;
import com.mastfrog.desugar.DesugarResult;
import com.mastfrog.desugar.Desugarer;
import com.mastfrog.desugar.ast.Node;
import com.mastfrog.desugar.ast.SourceLocation;
import com.mastfrog.desugar.ast.decl.FieldDecl;
import com.mastfrog.desugar.ast.decl.MethodDecl;
import com.mastfrog.desugar.ast.decl.MethodKind;
import com.mastfrog.desugar.ast.decl.VarDecl;
import com.mastfrog.desugar.ast.expr.ArraySubscriptExpr;
import com.mastfrog.desugar.ast.expr.CallExpr;
import com.mastfrog.desugar.ast.expr.CastKind;
import com.mastfrog.desugar.ast.expr.DeclRefExpr;
import com.mastfrog.desugar.ast.expr.ImplicitCastExpr;
import com.mastfrog.desugar.ast.expr.IntegerLiteral;
import com.mastfrog.desugar.ast.expr.LambdaCapture;
import com.mastfrog.desugar.ast.expr.LambdaExpr;
import com.mastfrog.desugar.ast.expr.MemberExpr;
import com.mastfrog.desugar.ast.expr.ThisExpr;
import com.mastfrog.desugar.ast.expr.UnaryOpcode;
import com.mastfrog.desugar.ast.expr.UnaryOperator;
import com.mastfrog.desugar.ast.stmt.CompoundStmt;
import com.mastfrog.desugar.ast.stmt.DeclStmt;
import com.mastfrog.desugar.ast.stmt.DoStmt;
import com.mastfrog.desugar.ast.stmt.IfStmt;
import com.mastfrog.desugar.ast.stmt.ReturnStmt;
import com.mastfrog.desugar.ast.type.CppType;
import com.mastfrog.desugar.naming.InternalNames;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

public class ClosureSynthesizerTest {

    private static String render(Node node) {
        DesugarResult result = new Desugarer().desugar(node);
        assertTrue(result.isClean(), result.diagnostics().toString());
        return result.text();
    }

    private static void assertOrdered(String text, String... fragments) {
        int last = -1;
        for (String f : fragments) {
            int ix = text.indexOf(f, last + 1);
            assertTrue(ix > last, "'" + f + "' missing or out of order in\n" + text);
            last = ix;
        }
    }

    private static LambdaExpr returningOne(SourceLocation at) {
        return LambdaExpr.builder(at)
                .withCallOperator(callOperator(at, ReturnStmt.returning(IntegerLiteral.of(1))))
                .ofType(CppType.record(InternalNames.lambdaClassName(at)))
                .build();
    }

    private static CallExpr run(LambdaExpr lambda) {
        CppType fn = CppType.function(INT, lambda.type());
        return CallExpr.call(ImplicitCastExpr.of(CastKind.FUNCTION_TO_POINTER_DECAY,
                DeclRefExpr.named("run", fn), fn.pointer()), INT, lambda);
    }

    private static VarDecl lambdaVariable(String name, LambdaExpr lambda) {
        SourceLocation at = lambda.location();
        return VarDecl.builder(name, CppType.auto(lambda.type())).at(at.line(), 3)
                .initializedWith(lambda).build();
    }

    @Test
    public void testCapturingLambdaInVariableInitializer() {
        String expected = "void f()\n"
                + "{\n"
                + "  int a = 1;\n"
                + "  class __lambda_3_12\n"
                + "  {\n"
                + "    public: inline int operator()() const\n"
                + "    {\n"
                + "      return a;\n"
                + "    }\n"
                + "\n"
                + "    private:\n"
                + "    int a;\n"
                + "\n"
                + "    public: __lambda_3_12(int _a)\n"
                + "    : a{_a}\n"
                + "    {}\n"
                + "  };\n"
                + "\n"
                + "  __lambda_3_12 l = __lambda_3_12{a};\n"
                + "}\n"
                + "\n";
        assertEquals(expected, render(AstFixtures.capturingLambda()));
    }

    @Test
    public void testReferenceAndArrayCaptures() {
        VarDecl b = intVar("b", 2, 2);
        VarDecl arr = VarDecl.builder("arr", CppType.arrayOf(INT, 2)).at(3, 3).build();
        SourceLocation at = loc(5, 12);
        LambdaExpr lambda = LambdaExpr.builder(at)
                .capturing(LambdaCapture.byReference(b), LambdaCapture.byCopy(arr))
                .withCallOperator(callOperator(at, ReturnStmt.returning(rvalue(DeclRefExpr.named("b", INT)))))
                .ofType(CppType.record("__lambda_5_12"))
                .build();
        String text = render(function("f", DeclStmt.of(b), DeclStmt.of(arr), DeclStmt.of(lambdaVariable("l", lambda))));
        assertOrdered(text, "    private:\n",
                "    int &b;\n",
                "    int (&arr)[2];\n",
                "    public: __lambda_5_12(int &_b, int (&_arr)[2])\n",
                "    : b{_b}\n",
                "    , arr{_arr}\n",
                "  __lambda_5_12 l = __lambda_5_12{b, arr};\n");
    }

    @Test
    public void testCapturedThisIsRenamed() {
        CppType widget = CppType.record("Widget").pointer();
        SourceLocation at = loc(4, 20);
        FieldDecl n = FieldDecl.of("n", INT);
        LambdaExpr lambda = LambdaExpr.builder(at)
                .capturing(LambdaCapture.thisPointer(new ThisExpr(null, widget, false)))
                .withCallOperator(callOperator(at,
                        ReturnStmt.returning(rvalue(MemberExpr.arrow(new ThisExpr(null, widget, true), n)))))
                .ofType(CppType.record("__lambda_4_20"))
                .build();
        String text = render(function("f", DeclStmt.of(lambdaVariable("l", lambda))));
        assertOrdered(text, "      return __this->n;\n",
                "    Widget *__this;\n",
                "    public: __lambda_4_20(Widget *___this)\n",
                "    : __this{___this}\n",
                "  __lambda_4_20 l = __lambda_4_20{this};\n");
    }

    @Test
    public void testClassPrecedesTheLineOfTheCall() {
        SourceLocation at = loc(4, 7);
        CppType closure = CppType.record("__lambda_4_7");
        LambdaExpr lambda = LambdaExpr.builder(at)
                .withCallOperator(callOperator(at, ReturnStmt.returning(IntegerLiteral.of(1))))
                .ofType(closure)
                .build();
        CppType fn = CppType.function(VOID, closure);
        CallExpr call = CallExpr.call(ImplicitCastExpr.of(CastKind.FUNCTION_TO_POINTER_DECAY,
                DeclRefExpr.named("run", fn), fn.pointer()), VOID, lambda);
        String text = render(function("f", call));
        assertOrdered(text, "{\n  class __lambda_4_7\n  {\n",
                "      return 1;\n",
                "  };\n",
                "\n  run(__lambda_4_7{});\n");
    }

    @Test
    public void testReturnedLambdaDeclaresAnObject() {
        SourceLocation at = loc(5, 10);
        LambdaExpr lambda = LambdaExpr.builder(at)
                .withCallOperator(callOperator(at, ReturnStmt.returning(IntegerLiteral.of(1))))
                .ofType(CppType.record("__lambda_5_10"))
                .build();
        String text = render(function("f", ReturnStmt.returning(lambda)));
        assertOrdered(text, "  class __lambda_5_10\n",
                "  } __lambda_5_10{};\n",
                "  return __lambda_5_10;\n");
    }

    @Test
    public void testNestedLambdaLandsInsideEnclosingClass() {
        SourceLocation innerAt = loc(3, 25);
        CppType innerType = CppType.record("__lambda_3_25");
        LambdaExpr inner = LambdaExpr.builder(innerAt)
                .withCallOperator(callOperator(innerAt, ReturnStmt.returning(IntegerLiteral.of(2))))
                .ofType(innerType)
                .build();
        SourceLocation outerAt = loc(3, 12);
        MethodDecl outerCall = MethodDecl.methodBuilder("operator()", innerType).at(outerAt).makeInline().makeConst()
                .memberOfLambdaAt(outerAt).withBody(CompoundStmt.of(ReturnStmt.returning(inner))).build();
        LambdaExpr outer = LambdaExpr.builder(outerAt)
                .withCallOperator(outerCall)
                .ofType(CppType.record("__lambda_3_12"))
                .build();
        String text = render(function("f", DeclStmt.of(lambdaVariable("l", outer))));
        assertOrdered(text, "  class __lambda_3_12\n",
                "    public: inline __lambda_3_25 operator()() const\n",
                "      class __lambda_3_25\n",
                "      } __lambda_3_25{};\n",
                "      return __lambda_3_25;\n",
                "  };\n",
                "  __lambda_3_12 l = __lambda_3_12{};\n");
    }

    @Test
    public void testLambdaInUnbracedIfBodyStaysInsideTheBody() {
        VarDecl b = intVar("b", 1, 3);
        IfStmt stmt = IfStmt.of(rvalue(DeclRefExpr.to(b)), run(returningOne(loc(4, 14))));
        String expected = "void f()\n"
                + "{\n"
                + "  int b = 1;\n"
                + "  if(b)\n"
                + "  {\n"
                + "    class __lambda_4_14\n"
                + "    {\n"
                + "      public: inline int operator()() const\n"
                + "      {\n"
                + "        return 1;\n"
                + "      }\n"
                + "\n"
                + "    };\n"
                + "\n"
                + "    run(__lambda_4_14{});\n"
                + "  }\n"
                + "}\n"
                + "\n";
        assertEquals(expected, render(function("f", DeclStmt.of(b), stmt)));
    }

    @Test
    public void testLambdaInDoWhileConditionPrecedesTheLoop() {
        DoStmt loop = new DoStmt(loc(4, 3), CompoundStmt.of(AstFixtures.callUse(IntegerLiteral.of(1))),
                run(returningOne(loc(4, 20))));
        String expected = "void f()\n"
                + "{\n"
                + "  class __lambda_4_20\n"
                + "  {\n"
                + "    public: inline int operator()() const\n"
                + "    {\n"
                + "      return 1;\n"
                + "    }\n"
                + "\n"
                + "  };\n"
                + "\n"
                + "  do\n"
                + "  {\n"
                + "    use(1);\n"
                + "  }\n"
                + "  while(run(__lambda_4_20{}));\n"
                + "}\n"
                + "\n";
        assertEquals(expected, render(function("f", loop)));
    }

    @Test
    public void testBareLambdaInsideFreeLambdaIsDeclaredBeforeItsStatement() {
        SourceLocation innerAt = loc(3, 5);
        LambdaExpr inner = LambdaExpr.builder(innerAt)
                .withCallOperator(callOperator(innerAt, ReturnStmt.returning(IntegerLiteral.of(2))))
                .ofType(CppType.record("__lambda_3_5"))
                .build();
        SourceLocation outerAt = loc(2, 10);
        LambdaExpr outer = LambdaExpr.builder(outerAt)
                .withCallOperator(callOperator(outerAt, inner, ReturnStmt.returning(IntegerLiteral.of(1))))
                .ofType(CppType.record("__lambda_2_10"))
                .build();
        String expected = "class __lambda_2_10\n"
                + "{\n"
                + "  public: inline int operator()() const\n"
                + "  {\n"
                + "    class __lambda_3_5\n"
                + "    {\n"
                + "      public: inline int operator()() const\n"
                + "      {\n"
                + "        return 2;\n"
                + "      }\n"
                + "\n"
                + "    } __lambda_3_5{};\n"
                + "\n"
                + "    return 1;\n"
                + "  }\n"
                + "\n"
                + "} __lambda_2_10{};\n"
                + "\n";
        assertEquals(expected, render(outer));
    }

    private static LambdaExpr.Builder withConversionAndInvoker(SourceLocation at) {
        CppType fnPtr = CppType.function(INT).pointer();
        MethodDecl conversion = MethodDecl.methodBuilder("operator int (*)()", fnPtr).at(at)
                .kind(MethodKind.CONVERSION).makeInline().makeConst().makeNoexcept()
                .memberOfLambdaAt(at).build();
        MethodDecl invoker = MethodDecl.methodBuilder("__invoke", INT).at(at)
                .makeInline().makeStatic().memberOfLambdaAt(at).build();
        return LambdaExpr.builder(at)
                .withStaticInvoker(invoker)
                .withCallOperator(callOperator(at, ReturnStmt.returning(IntegerLiteral.of(1))))
                .withConversionOperator(conversion)
                .ofType(CppType.record(InternalNames.lambdaClassName(at)));
    }

    @Test
    public void testGenericLambdaMembersInFixedOrder() {
        LambdaExpr lambda = withConversionAndInvoker(loc(3, 12)).generic().build();
        String expected = "void f()\n"
                + "{\n"
                + "  class __lambda_3_12\n"
                + "  {\n"
                + "    public: using retType = int (*)();\n"
                + "    inline operator retType () const noexcept;\n"
                + "\n"
                + "    public: inline int operator()() const\n"
                + "    {\n"
                + "      return 1;\n"
                + "    }\n"
                + "\n"
                + "    public: inline static int __invoke()\n"
                + "    {\n"
                + "      return 1;\n"
                + "    }\n"
                + "\n"
                + "  };\n"
                + "\n"
                + "  __lambda_3_12 l = __lambda_3_12{};\n"
                + "}\n"
                + "\n";
        assertEquals(expected, render(function("f", DeclStmt.of(lambdaVariable("l", lambda)))));
    }

    @Test
    public void testBodilessConversionSkippedForNonGenericLambda() {
        LambdaExpr lambda = withConversionAndInvoker(loc(3, 12)).build();
        String text = render(function("f", DeclStmt.of(lambdaVariable("l", lambda))));
        assertFalse(text.contains("retType"), text);
        assertFalse(text.contains("__invoke"), text);
        assertTrue(text.contains("    public: inline int operator()() const\n"), text);
    }

    @Test
    public void testInitCapturesPassTheirInitializers() {
        VarDecl b = VarDecl.builder("b", CppType.arrayOf(INT, 2)).at(2, 7).build();
        VarDecl x = intVar("x", 3, 3);
        VarDecl a = VarDecl.builder("a", INT).at(5, 13)
                .initializedWith(rvalue(ArraySubscriptExpr.of(ImplicitCastExpr.of(CastKind.ARRAY_TO_POINTER_DECAY,
                        DeclRefExpr.to(b), INT.pointer()), IntegerLiteral.of(1), INT)))
                .build();
        VarDecl r = VarDecl.builder("r", INT.lvalueReference()).at(5, 22)
                .initializedWith(DeclRefExpr.to(x)).build();
        SourceLocation at = loc(5, 12);
        LambdaExpr lambda = LambdaExpr.builder(at)
                .capturing(LambdaCapture.initCapture(a, false), LambdaCapture.initCapture(r, true))
                .withCallOperator(callOperator(at, ReturnStmt.returning(IntegerLiteral.of(1))))
                .ofType(CppType.record("__lambda_5_12"))
                .build();
        String text = render(function("f", DeclStmt.of(b), DeclStmt.of(x), DeclStmt.of(lambdaVariable("l", lambda))));
        assertOrdered(text, "    private:\n",
                "    int a;\n",
                "    int &r;\n",
                "    public: __lambda_5_12(int _a, int &_r)\n",
                "    : a{_a}\n",
                "    , r{_r}\n",
                "    {}\n",
                "  };\n",
                "  __lambda_5_12 l = __lambda_5_12{b[1], x};\n");
    }

    @Test
    public void testStarThisCaptureCopiesTheObject() {
        CppType widget = CppType.record("Widget");
        SourceLocation at = loc(6, 12);
        LambdaExpr lambda = LambdaExpr.builder(at)
                .capturing(LambdaCapture.starThis(
                        UnaryOperator.of(UnaryOpcode.DEREF, new ThisExpr(null, widget.pointer(), false), widget)))
                .withCallOperator(callOperator(at, ReturnStmt.returning(IntegerLiteral.of(1))))
                .ofType(CppType.record("__lambda_6_12"))
                .build();
        String text = render(function("f", DeclStmt.of(lambdaVariable("l", lambda))));
        assertOrdered(text, "    private:\n",
                "    Widget __this;\n",
                "    public: __lambda_6_12(Widget ___this)\n",
                "    : __this{___this}\n",
                "  __lambda_6_12 l = __lambda_6_12{*this};\n");
    }
}
