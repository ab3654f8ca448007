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

import com.mastfrog.desugar.ast.SourceLocation;
import com.mastfrog.desugar.ast.decl.BindingDecl;
import com.mastfrog.desugar.ast.decl.DecompositionDecl;
import com.mastfrog.desugar.ast.decl.FieldDecl;
import com.mastfrog.desugar.ast.decl.FunctionDecl;
import com.mastfrog.desugar.ast.decl.MethodDecl;
import com.mastfrog.desugar.ast.decl.VarDecl;
import com.mastfrog.desugar.ast.expr.ArrayInitIndexExpr;
import com.mastfrog.desugar.ast.expr.ArrayInitLoopExpr;
import com.mastfrog.desugar.ast.expr.ArraySubscriptExpr;
import com.mastfrog.desugar.ast.expr.BinaryOpcode;
import com.mastfrog.desugar.ast.expr.BinaryOperator;
import com.mastfrog.desugar.ast.expr.CallExpr;
import com.mastfrog.desugar.ast.expr.CastKind;
import com.mastfrog.desugar.ast.expr.ConstructExpr;
import com.mastfrog.desugar.ast.expr.DeclRefExpr;
import com.mastfrog.desugar.ast.expr.Expr;
import com.mastfrog.desugar.ast.expr.ImplicitCastExpr;
import com.mastfrog.desugar.ast.expr.IntegerLiteral;
import com.mastfrog.desugar.ast.expr.LambdaCapture;
import com.mastfrog.desugar.ast.expr.LambdaExpr;
import com.mastfrog.desugar.ast.expr.MemberExpr;
import com.mastfrog.desugar.ast.expr.OpaqueValueExpr;
import com.mastfrog.desugar.ast.expr.StringLiteral;
import com.mastfrog.desugar.ast.expr.UnaryOpcode;
import com.mastfrog.desugar.ast.expr.UnaryOperator;
import com.mastfrog.desugar.ast.stmt.CompoundStmt;
import com.mastfrog.desugar.ast.stmt.DeclStmt;
import com.mastfrog.desugar.ast.stmt.RangeForStmt;
import com.mastfrog.desugar.ast.stmt.ReturnStmt;
import com.mastfrog.desugar.ast.stmt.Stmt;
import com.mastfrog.desugar.ast.type.BuiltinKind;
import com.mastfrog.desugar.ast.type.CppType;

/**
 * Trees shaped the way a C++ front end hands them over, for the common
 * test cases.
 */
public final class AstFixtures {

    public static final CppType INT = CppType.builtin(BuiltinKind.INT);
    public static final CppType VOID = CppType.builtin(BuiltinKind.VOID);
    public static final CppType STRING = CppType.record("std::string", false);
    public static final CppType POINT = CppType.record("Point");

    private AstFixtures() {
        throw new AssertionError();
    }

    public static SourceLocation loc(int line, int column) {
        return SourceLocation.at(line, column);
    }

    public static DeclRefExpr ref(VarDecl decl) {
        return DeclRefExpr.to(decl);
    }

    public static Expr rvalue(Expr e) {
        return ImplicitCastExpr.of(CastKind.LVALUE_TO_RVALUE, e, e.type());
    }

    public static VarDecl intVar(String name, long value, int line) {
        return VarDecl.builder(name, INT).at(line, 3).initializedWith(IntegerLiteral.of(value)).build();
    }

    public static FunctionDecl function(String name, Stmt... body) {
        return FunctionDecl.builder(name, VOID).at(1, 1).withBody(CompoundStmt.of(body)).build();
    }

    public static CallExpr callUse(Expr arg) {
        CppType fn = CppType.function(VOID, INT);
        DeclRefExpr use = DeclRefExpr.named("use", fn);
        return CallExpr.call(ImplicitCastExpr.of(CastKind.FUNCTION_TO_POINTER_DECAY, use, fn.pointer()),
                VOID, arg);
    }

    /**
     * <pre>
     * void f() {
     *   int c[3] = {1, 2, 3};
     *   for (int x : c) { use(x); }
     * }
     * </pre>
     *
     * @return A function
     */
    public static FunctionDecl rangeForOverArray() {
        CppType array = CppType.arrayOf(INT, 3);
        VarDecl c = VarDecl.builder("c", array).at(2, 7).build();
        VarDecl range = VarDecl.builder("__range1", array.lvalueReference()).at(3, 17)
                .initializedWith(ref(c)).build();
        VarDecl begin = VarDecl.builder("__begin1", INT.pointer()).at(3, 17)
                .initializedWith(ImplicitCastExpr.of(CastKind.ARRAY_TO_POINTER_DECAY, ref(range), INT.pointer()))
                .build();
        VarDecl end = VarDecl.builder("__end1", INT.pointer()).at(3, 17)
                .initializedWith(BinaryOperator.of(
                        ImplicitCastExpr.of(CastKind.ARRAY_TO_POINTER_DECAY, ref(range), INT.pointer()),
                        BinaryOpcode.ADD, IntegerLiteral.of(3)))
                .build();
        Expr condition = BinaryOperator.of(rvalue(ref(begin)), BinaryOpcode.NE, rvalue(ref(end)));
        Expr increment = UnaryOperator.of(UnaryOpcode.PRE_INC, ref(begin), INT.pointer());
        VarDecl x = VarDecl.builder("x", INT).at(3, 12)
                .initializedWith(rvalue(UnaryOperator.of(UnaryOpcode.DEREF, rvalue(ref(begin)), INT)))
                .build();
        RangeForStmt loop = new RangeForStmt(loc(3, 3), DeclStmt.of(range), DeclStmt.of(begin),
                DeclStmt.of(end), condition, increment, DeclStmt.of(x),
                CompoundStmt.of(callUse(rvalue(ref(x)))));
        return function("f", DeclStmt.of(c), loop);
    }

    /**
     * The call operator of a lambda which returns an int.
     *
     * @param lambdaAt Where the lambda is
     * @param body Its body
     * @return A method
     */
    public static MethodDecl callOperator(SourceLocation lambdaAt, Stmt... body) {
        return MethodDecl.methodBuilder("operator()", INT).at(lambdaAt).makeInline().makeConst()
                .memberOfLambdaAt(lambdaAt).withBody(CompoundStmt.of(body)).build();
    }

    /**
     * <pre>
     * void f() {
     *   int a = 1;
     *   auto l = [a](){ return a; };
     * }
     * </pre>
     *
     * @return A function
     */
    public static FunctionDecl capturingLambda() {
        VarDecl a = intVar("a", 1, 2);
        SourceLocation at = loc(3, 12);
        LambdaExpr lambda = LambdaExpr.builder(at)
                .capturing(LambdaCapture.byCopy(a))
                .withCallOperator(callOperator(at,
                        ReturnStmt.returning(rvalue(DeclRefExpr.named("a", INT)))))
                .ofType(CppType.record("__lambda_3_12"))
                .build();
        VarDecl l = VarDecl.builder("l", CppType.auto(CppType.record("__lambda_3_12"))).at(3, 3)
                .initializedWith(lambda).build();
        return function("f", DeclStmt.of(a), DeclStmt.of(l));
    }

    /**
     * <pre>
     * void f() {
     *   static std::string s{"x"};
     * }
     * </pre>
     *
     * @return A function
     */
    public static FunctionDecl staticLocalString() {
        VarDecl s = VarDecl.builder("s", STRING).at(2, 22).makeStatic()
                .initializedWith(ConstructExpr.braces(STRING, StringLiteral.of("x")))
                .build();
        return function("f", DeclStmt.of(s));
    }

    public static VarDecl point(String name, int line) {
        return VarDecl.builder(name, POINT).at(line, 9).build();
    }

    /**
     * <code>auto [a, b] = p;</code> for an aggregate <code>Point</code>
     * with members <code>x</code> and <code>y</code>.
     *
     * @param p The decomposed variable
     * @param line The line of the declaration
     * @param column Its column
     * @param first Name of the first binding
     * @param second Name of the second binding
     * @return A declaration
     */
    public static DecompositionDecl decomposePoint(VarDecl p, int line, int column, String first, String second) {
        DeclRefExpr hidden = DeclRefExpr.named("", POINT);
        FieldDecl x = FieldDecl.of("x", INT);
        FieldDecl y = FieldDecl.of("y", INT);
        return DecompositionDecl.of(VarDecl.builder("", POINT).at(line, column).initializedWith(ref(p)),
                BindingDecl.of(first, INT, MemberExpr.dot(hidden, x)),
                BindingDecl.of(second, INT, MemberExpr.dot(hidden, y)));
    }

    /**
     * <code>auto [a, b] = arr;</code> for <code>int arr[2]</code>.
     *
     * @param arr The array
     * @param line The line of the declaration
     * @return A declaration
     */
    public static DecompositionDecl decomposeArray(VarDecl arr, int line) {
        CppType array = arr.type();
        OpaqueValueExpr common = OpaqueValueExpr.of(ref(arr));
        Expr element = rvalue(ArraySubscriptExpr.of(
                ImplicitCastExpr.of(CastKind.ARRAY_TO_POINTER_DECAY, common, INT.pointer()),
                new ArrayInitIndexExpr(null), INT));
        ArrayInitLoopExpr init = new ArrayInitLoopExpr(null, common, element, array.arraySize(), array);
        DeclRefExpr hidden = DeclRefExpr.named("", array);
        return DecompositionDecl.of(VarDecl.builder("", array).at(line, 8).initializedWith(init),
                BindingDecl.of("a", INT, ArraySubscriptExpr.of(hidden, IntegerLiteral.of(0), INT)),
                BindingDecl.of("b", INT, ArraySubscriptExpr.of(hidden, IntegerLiteral.of(1), INT)));
    }
}
