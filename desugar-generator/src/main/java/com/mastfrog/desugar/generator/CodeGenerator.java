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

import com.mastfrog.desugar.DesugarException;
import com.mastfrog.desugar.ast.Node;
import com.mastfrog.desugar.ast.NodeKind;
import com.mastfrog.desugar.ast.TemplateArgument;
import com.mastfrog.desugar.ast.TemplateArgumentKind;
import com.mastfrog.desugar.ast.decl.AccessSpecDecl;
import com.mastfrog.desugar.ast.decl.BaseSpecifier;
import com.mastfrog.desugar.ast.decl.Decl;
import com.mastfrog.desugar.ast.decl.DeclContextRef;
import com.mastfrog.desugar.ast.decl.DecompositionDecl;
import com.mastfrog.desugar.ast.decl.FieldDecl;
import com.mastfrog.desugar.ast.decl.FunctionDecl;
import com.mastfrog.desugar.ast.decl.MethodDecl;
import com.mastfrog.desugar.ast.decl.MethodKind;
import com.mastfrog.desugar.ast.decl.ParmVarDecl;
import com.mastfrog.desugar.ast.decl.RecordDecl;
import com.mastfrog.desugar.ast.decl.StaticAssertDecl;
import com.mastfrog.desugar.ast.decl.StorageClass;
import com.mastfrog.desugar.ast.decl.TypeAliasDecl;
import com.mastfrog.desugar.ast.decl.UsingDecl;
import com.mastfrog.desugar.ast.decl.VarDecl;
import com.mastfrog.desugar.ast.expr.ArrayInitIndexExpr;
import com.mastfrog.desugar.ast.expr.ArrayInitLoopExpr;
import com.mastfrog.desugar.ast.expr.ArraySubscriptExpr;
import com.mastfrog.desugar.ast.expr.BinaryOpcode;
import com.mastfrog.desugar.ast.expr.BinaryOperator;
import com.mastfrog.desugar.ast.expr.BoolLiteral;
import com.mastfrog.desugar.ast.expr.CStyleCastExpr;
import com.mastfrog.desugar.ast.expr.CallExpr;
import com.mastfrog.desugar.ast.expr.CastKind;
import com.mastfrog.desugar.ast.expr.CharacterEncoding;
import com.mastfrog.desugar.ast.expr.CharacterLiteral;
import com.mastfrog.desugar.ast.expr.ConditionalOperator;
import com.mastfrog.desugar.ast.expr.ConstructExpr;
import com.mastfrog.desugar.ast.expr.DeclRefExpr;
import com.mastfrog.desugar.ast.expr.DeleteExpr;
import com.mastfrog.desugar.ast.expr.Expr;
import com.mastfrog.desugar.ast.expr.FloatingLiteral;
import com.mastfrog.desugar.ast.expr.FunctionalCastExpr;
import com.mastfrog.desugar.ast.expr.ImplicitCastExpr;
import com.mastfrog.desugar.ast.expr.InitListExpr;
import com.mastfrog.desugar.ast.expr.IntegerLiteral;
import com.mastfrog.desugar.ast.expr.LambdaExpr;
import com.mastfrog.desugar.ast.expr.MemberExpr;
import com.mastfrog.desugar.ast.expr.NamedCastExpr;
import com.mastfrog.desugar.ast.expr.NewExpr;
import com.mastfrog.desugar.ast.expr.OpaqueValueExpr;
import com.mastfrog.desugar.ast.expr.OperatorCallExpr;
import com.mastfrog.desugar.ast.expr.ParenExpr;
import com.mastfrog.desugar.ast.expr.PredefinedExpr;
import com.mastfrog.desugar.ast.expr.StdInitializerListExpr;
import com.mastfrog.desugar.ast.expr.StringLiteral;
import com.mastfrog.desugar.ast.expr.ThisExpr;
import com.mastfrog.desugar.ast.expr.TypeidExpr;
import com.mastfrog.desugar.ast.expr.UnaryOpcode;
import com.mastfrog.desugar.ast.expr.UnaryOperator;
import com.mastfrog.desugar.ast.expr.UnaryTraitExpr;
import com.mastfrog.desugar.ast.expr.UnresolvedLookupExpr;
import com.mastfrog.desugar.ast.expr.UserDefinedLiteral;
import com.mastfrog.desugar.ast.expr.WrapperExpr;
import com.mastfrog.desugar.ast.stmt.CaseStmt;
import com.mastfrog.desugar.ast.stmt.CompoundStmt;
import com.mastfrog.desugar.ast.stmt.DeclStmt;
import com.mastfrog.desugar.ast.stmt.DefaultStmt;
import com.mastfrog.desugar.ast.stmt.DoStmt;
import com.mastfrog.desugar.ast.stmt.ForStmt;
import com.mastfrog.desugar.ast.stmt.IfStmt;
import com.mastfrog.desugar.ast.stmt.RangeForStmt;
import com.mastfrog.desugar.ast.stmt.ReturnStmt;
import com.mastfrog.desugar.ast.stmt.Stmt;
import com.mastfrog.desugar.ast.stmt.SwitchStmt;
import com.mastfrog.desugar.ast.stmt.WhileStmt;
import com.mastfrog.desugar.ast.type.CppType;
import com.mastfrog.desugar.format.Casts;
import com.mastfrog.desugar.format.Literals;
import com.mastfrog.desugar.format.TypeNamer;
import com.mastfrog.desugar.lambda.LambdaCallerRole;
import com.mastfrog.desugar.lambda.LambdaContext;
import com.mastfrog.desugar.naming.InternalNames;
import com.mastfrog.desugar.output.OutputBuffer;
import static com.mastfrog.desugar.output.util.Utils.commaSeparated;
import static com.mastfrog.desugar.output.util.Utils.iterate;
import com.mastfrog.desugar.trace.TraceCategory;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.List;

/**
 * Walks a tree and writes the desugared source for it. Each node kind has
 * exactly one emission rule, selected in {@link #emit(Node)}; statement
 * rules leave the buffer at the start of a fresh line after a terminator or
 * closed scope, expression rules never terminate anything.
 * <p>
 * Subclasses replace single rules for the contexts that need it: the index
 * of an array initialization loop, references to the hidden object of a
 * decomposition declaration, and <code>this</code> inside a closure body.
 * </p>
 */
public class CodeGenerator {

    protected final GenerationPass pass;
    protected final OutputBuffer out;

    public CodeGenerator(GenerationPass pass, OutputBuffer out) {
        this.pass = notNull("pass", pass);
        this.out = notNull("out", out);
    }

    public final OutputBuffer output() {
        return out;
    }

    public final GenerationPass pass() {
        return pass;
    }

    protected final TypeNamer types() {
        return pass.types();
    }

    /**
     * Create a generator which applies the same rules as this one, writing
     * to a different buffer.
     *
     * @param buffer The buffer
     * @return A generator
     */
    protected CodeGenerator forBuffer(OutputBuffer buffer) {
        return new CodeGenerator(pass, buffer);
    }

    /**
     * Emit a node in statement position. An expression is terminated. If the
     * rule fails structurally, the failure is recorded, scopes it opened are
     * closed, and the buffer is left on a fresh line; whatever was written
     * before the failure stays.
     *
     * @param node A node or null
     */
    public void emitStatement(Node node) {
        if (node == null) {
            return;
        }
        int depth = out.openScopes();
        // a lambda outside of any placement context declares its own object
        boolean declaresObject = node.kind() == NodeKind.LAMBDA_EXPR && !inPlacementContext();
        try {
            if (declaresObject) {
                declareLambda((LambdaExpr) node);
            } else {
                emit(node);
                if (node.kind().isExpression()) {
                    out.endStatement();
                }
            }
        } catch (DesugarException ex) {
            pass.error(ex, node);
            out.closeScopesTo(depth);
            out.ensureNewLine();
        }
    }

    private boolean inPlacementContext() {
        LambdaContext top = pass.lambdas().top();
        return top != null && top.role().isPlacementRole();
    }

    /**
     * Emit a node; null is ignored.
     *
     * @param node A node or null
     */
    public void emit(Node node) {
        if (node == null) {
            return;
        }
        pass.trace().trace(TraceCategory.DISPATCH, "%s at depth %d", node, out.openScopes());
        switch (node.kind()) {
            case COMPOUND_STMT:
                emitCompound((CompoundStmt) node);
                break;
            case DECL_STMT:
                emitDeclStmt((DeclStmt) node);
                break;
            case RETURN_STMT:
                emitReturn((ReturnStmt) node);
                break;
            case IF_STMT:
                emitIf((IfStmt) node);
                break;
            case SWITCH_STMT:
                emitSwitch((SwitchStmt) node);
                break;
            case CASE_STMT:
                CaseStmt caseStmt = (CaseStmt) node;
                out.append("case ");
                emit(caseStmt.value());
                out.append(": ");
                emitSubStatement(caseStmt.subStatement());
                break;
            case DEFAULT_STMT:
                out.append("default: ");
                emitSubStatement(((DefaultStmt) node).subStatement());
                break;
            case WHILE_STMT:
                WhileStmt whileStmt = (WhileStmt) node;
                out.append("while(");
                emit(whileStmt.condition());
                out.append(")");
                emitBody(whileStmt.body());
                break;
            case DO_STMT:
                emitDo((DoStmt) node);
                break;
            case FOR_STMT:
                emitFor((ForStmt) node);
                break;
            case RANGE_FOR_STMT:
                emitRangeFor((RangeForStmt) node);
                break;
            case BREAK_STMT:
                out.append("break").endStatement();
                break;
            case CONTINUE_STMT:
                out.append("continue").endStatement();
                break;
            case NULL_STMT:
                out.endStatement();
                break;
            case DECL_REF_EXPR:
                emitDeclRef((DeclRefExpr) node);
                break;
            case INTEGER_LITERAL:
                out.append(Literals.integerLiteral((IntegerLiteral) node));
                break;
            case FLOATING_LITERAL:
                out.append(Literals.floatingLiteral((FloatingLiteral) node));
                break;
            case CHARACTER_LITERAL:
                out.append(Literals.characterLiteral((CharacterLiteral) node));
                break;
            case STRING_LITERAL:
                StringLiteral str = (StringLiteral) node;
                out.appendStringLiteral(str.encoding().prefix(), str.value());
                break;
            case BOOL_LITERAL:
                out.append(((BoolLiteral) node).value() ? "true" : "false");
                break;
            case NULLPTR_LITERAL:
                out.append("nullptr");
                break;
            case GNU_NULL_EXPR:
                out.append("NULL");
                break;
            case THIS_EXPR:
                emitThis((ThisExpr) node);
                break;
            case BINARY_OPERATOR:
                emitBinary((BinaryOperator) node);
                break;
            case UNARY_OPERATOR:
                emitUnary((UnaryOperator) node);
                break;
            case CONDITIONAL_OPERATOR:
                ConditionalOperator cond = (ConditionalOperator) node;
                emit(cond.condition());
                out.append(" ? ");
                emit(cond.whenTrue());
                out.append(" : ");
                emit(cond.whenFalse());
                break;
            case PAREN_EXPR:
                out.append('(');
                emit(((ParenExpr) node).inner());
                out.append(')');
                break;
            case MEMBER_EXPR:
                emitMember((MemberExpr) node);
                break;
            case CALL_EXPR:
            case USER_DEFINED_LITERAL:
                emitCall((CallExpr) node, LambdaCallerRole.CALL);
                break;
            case MEMBER_CALL_EXPR:
                emitCall((CallExpr) node, LambdaCallerRole.MEMBER_CALL);
                break;
            case OPERATOR_CALL_EXPR:
                emitOperatorCall((OperatorCallExpr) node);
                break;
            case CONSTRUCT_EXPR:
                emitConstruct((ConstructExpr) node);
                break;
            case IMPLICIT_CAST_EXPR:
                emitImplicitCast((ImplicitCastExpr) node);
                break;
            case NAMED_CAST_EXPR:
                NamedCastExpr named = (NamedCastExpr) node;
                emitCast(named.keyword().keyword(), named.type(), named.operand(), named.castKind(), false);
                break;
            case C_STYLE_CAST_EXPR:
                CStyleCastExpr cStyle = (CStyleCastExpr) node;
                emitCast(Casts.REINTERPRET_CAST, cStyle.type(), cStyle.operand(), cStyle.castKind(), false);
                break;
            case FUNCTIONAL_CAST_EXPR:
                emitFunctionalCast((FunctionalCastExpr) node);
                break;
            case ARRAY_SUBSCRIPT_EXPR:
                ArraySubscriptExpr subscript = (ArraySubscriptExpr) node;
                emit(subscript.base());
                out.append('[');
                emit(subscript.index());
                out.append(']');
                break;
            case ARRAY_INIT_LOOP_EXPR:
                emitArrayInitLoop((ArrayInitLoopExpr) node);
                break;
            case ARRAY_INIT_INDEX_EXPR:
                emitArrayInitIndex((ArrayInitIndexExpr) node);
                break;
            case OPAQUE_VALUE_EXPR:
                emit(((OpaqueValueExpr) node).source());
                break;
            case MATERIALIZE_TEMPORARY_EXPR:
            case BIND_TEMPORARY_EXPR:
            case EXPR_WITH_CLEANUPS:
            case DEFAULT_ARG_EXPR:
            case DEFAULT_INIT_EXPR:
            case SUBST_NON_TYPE_TEMPLATE_PARM_EXPR:
                emit(((WrapperExpr) node).inner());
                break;
            case INIT_LIST_EXPR:
                out.append('{');
                commaSeparated(out, ((InitListExpr) node).inits(), this::emit);
                out.append('}');
                break;
            case LAMBDA_EXPR:
                emitLambda((LambdaExpr) node);
                break;
            case NEW_EXPR:
                emitNew((NewExpr) node);
                break;
            case DELETE_EXPR:
                DeleteExpr delete = (DeleteExpr) node;
                out.append(delete.isArrayForm() ? "delete[] " : "delete ");
                emit(delete.argument());
                break;
            case SIZEOF_ALIGNOF_EXPR:
                emitUnaryTrait((UnaryTraitExpr) node);
                break;
            case TYPEID_EXPR:
                TypeidExpr typeid = (TypeidExpr) node;
                out.append("typeid(");
                if (typeid.isTypeOperand()) {
                    out.append(types().name(typeid.typeOperand()));
                } else {
                    emit(typeid.exprOperand());
                }
                out.append(')');
                break;
            case UNRESOLVED_LOOKUP_EXPR:
                out.append(((UnresolvedLookupExpr) node).name());
                break;
            case PREDEFINED_EXPR:
                PredefinedExpr predefined = (PredefinedExpr) node;
                if (predefined.functionName() != null) {
                    emit(predefined.functionName());
                } else {
                    out.append(predefined.identifier());
                }
                break;
            case STD_INITIALIZER_LIST_EXPR:
                StdInitializerListExpr stdList = (StdInitializerListExpr) node;
                out.append(types().name(stdList.type().unqualified()));
                emit(stdList.list());
                break;
            case VAR_DECL:
                emitVarDecl((VarDecl) node);
                break;
            case PARM_VAR_DECL:
                ParmVarDecl param = (ParmVarDecl) node;
                out.append(types().nameAsParameter(param.type(), param.name()));
                break;
            case DECOMPOSITION_DECL:
                new StructuredBindingExpander(this).expand((DecompositionDecl) node);
                break;
            case FUNCTION_DECL:
                emitFunction((FunctionDecl) node);
                break;
            case METHOD_DECL:
                emitMethod((MethodDecl) node);
                break;
            case FIELD_DECL:
                FieldDecl field = (FieldDecl) node;
                out.append(types().nameAsParameter(field.type(), field.name())).endStatement();
                break;
            case ACCESS_SPEC_DECL:
                out.blankLine();
                out.appendNewLine(((AccessSpecDecl) node).access().spelling(), ":");
                break;
            case RECORD_DECL:
                emitRecord((RecordDecl) node);
                break;
            case TYPE_ALIAS_DECL:
            case TYPEDEF_DECL:
                TypeAliasDecl alias = (TypeAliasDecl) node;
                out.append("using ", alias.name(), " = ", types().name(alias.underlying())).endStatement();
                break;
            case USING_DECL:
                emitUsing((UsingDecl) node);
                break;
            case STATIC_ASSERT_DECL:
                emitStaticAssert((StaticAssertDecl) node);
                break;
            case EMPTY_DECL:
                break;
            default:
                emitNotYetHandled(node);
        }
    }

    /**
     * Write a placeholder for a construct there is no rule for, and record a
     * warning.
     *
     * @param node The node
     */
    protected void emitNotYetHandled(Node node) {
        out.blockComment("NOT YET HANDLED: ", node.kind().displayName());
        if (!node.kind().isExpression()) {
            out.ensureNewLine();
        }
        pass.warn(node, "No rule for " + node.kind().displayName() + ", wrote a placeholder");
    }

    // Statements

    protected void emitCompound(CompoundStmt stmt) {
        out.openScope();
        emitStatements(stmt.body());
        out.closeScope();
        out.ensureNewLine();
    }

    protected final void emitStatements(List<? extends Stmt> statements) {
        for (Stmt s : statements) {
            emitStatement(s);
        }
    }

    /**
     * Emit the body of a control statement on the lines below it. A body
     * which is not a compound statement is braced as well, so that closure
     * classes hoisted out of it stay in the same block as their use.
     *
     * @param body The body
     */
    protected void emitBody(Stmt body) {
        if (body instanceof CompoundStmt) {
            emitStatement(body);
            return;
        }
        out.openScope();
        emitStatement(body);
        out.closeScope();
        out.ensureNewLine();
    }

    private void emitSubStatement(Stmt sub) {
        if (sub == null) {
            out.ensureNewLine();
        } else {
            emitStatement(sub);
        }
    }

    protected void emitDeclStmt(DeclStmt stmt) {
        for (Decl decl : stmt.decls()) {
            emitStatement(decl);
        }
    }

    protected void emitReturn(ReturnStmt stmt) {
        try (LambdaContext ctx = pass.lambdas().enter(LambdaCallerRole.RETURN, out)) {
            out.append("return");
            if (stmt.value() != null) {
                out.append(' ');
                emit(stmt.value());
            }
            out.endStatement();
        }
    }

    protected void emitIf(IfStmt stmt) {
        boolean hoisted = stmt.hasInit();
        if (hoisted) {
            out.openScope();
            emitStatement(stmt.init());
            emitStatement(stmt.conditionVariable());
        }
        out.append("if", stmt.isConstexpr() ? " constexpr(" : "(");
        emit(stmt.condition());
        out.append(")");
        emitBody(stmt.then());
        Stmt otherwise = stmt.otherwise();
        if (otherwise != null) {
            out.append("else");
            if (stmt.isConstexpr()) {
                out.append(' ').blockComment("constexpr");
            }
            if (otherwise instanceof IfStmt) {
                out.openScope();
                emitStatement(otherwise);
                out.closeScope();
                out.ensureNewLine();
            } else {
                emitBody(otherwise);
            }
        }
        if (hoisted) {
            out.closeScope();
            out.ensureNewLine();
        }
    }

    protected void emitSwitch(SwitchStmt stmt) {
        boolean hoisted = stmt.hasInit();
        if (hoisted) {
            out.openScope();
            emitStatement(stmt.init());
            emitStatement(stmt.conditionVariable());
        }
        out.append("switch(");
        emit(stmt.condition());
        out.append(")");
        emitBody(stmt.body());
        if (hoisted) {
            out.closeScope();
            out.ensureNewLine();
        }
    }

    protected void emitDo(DoStmt stmt) {
        // classes for lambdas in the condition go before the whole statement
        int start = out.lineStartPosition();
        out.append("do");
        emitBody(stmt.body());
        try (LambdaContext ctx = pass.lambdas().enterAt(LambdaCallerRole.VAR_DECL, out, start)) {
            out.append("while(");
            emit(stmt.condition());
            out.append(")").endStatement();
        }
    }

    protected void emitFor(ForStmt stmt) {
        try (LambdaContext ctx = pass.lambdas().enter(LambdaCallerRole.VAR_DECL, out)) {
            out.append("for(");
            Stmt init = stmt.init();
            if (init instanceof DeclStmt) {
                iterate(((DeclStmt) init).decls(), (decl, first, last) -> {
                    if (!first) {
                        out.append(", ");
                    }
                    if (decl instanceof VarDecl) {
                        writeVarDeclarator((VarDecl) decl, first);
                    } else {
                        emit(decl);
                    }
                });
            } else {
                emit(init);
            }
            out.append("; ");
            emit(stmt.condition());
            out.append("; ");
            emit(stmt.increment());
            out.append(")");
        }
        emitBody(stmt.body());
    }

    protected void emitRangeFor(RangeForStmt stmt) {
        out.openScope();
        emitStatement(stmt.rangeStatement());
        emitStatement(stmt.beginStatement());
        emitStatement(stmt.endStatement());
        out.blankLine();
        out.append("for( ; ");
        emit(stmt.condition());
        out.append("; ");
        emit(stmt.increment());
        out.append(" )");
        out.openScope();
        emitStatement(stmt.loopVariable());
        Stmt body = stmt.body();
        if (body instanceof CompoundStmt) {
            emitStatements(((CompoundStmt) body).body());
        } else {
            emitStatement(body);
        }
        out.closeScope();
        out.ensureNewLine();
        out.closeScope();
        out.ensureNewLine();
    }

    // Expressions

    protected void emitDeclRef(DeclRefExpr ref) {
        out.append(ref.name());
        emitTemplateArguments(ref.templateArguments());
    }

    protected void emitThis(ThisExpr expr) {
        out.append("this");
    }

    protected void emitArrayInitIndex(ArrayInitIndexExpr expr) {
        throw new DesugarException(expr, "Array initialization index outside of an array initialization loop");
    }

    protected void emitArrayInitLoop(ArrayInitLoopExpr loop) {
        out.append('{');
        for (long i = 0; i < loop.arraySize(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            new ArrayInitCodeGenerator(pass, out, i).emit(loop.elementInitializer());
        }
        out.append('}');
    }

    protected void emitBinary(BinaryOperator op) {
        try (LambdaContext ctx = pass.lambdas().enter(LambdaCallerRole.BINARY_OPERATOR, out)) {
            emit(op.lhs());
            out.append(op.opcode() == BinaryOpcode.COMMA ? ", " : " " + op.opcode().spelling() + " ");
            emit(op.rhs());
        }
    }

    protected void emitUnary(UnaryOperator op) {
        if (op.opcode().isPostfix()) {
            emit(op.operand());
            out.append(op.opcode().spelling());
        } else {
            out.append(op.opcode().spelling());
            emit(op.operand());
        }
    }

    protected void emitMember(MemberExpr expr) {
        emit(expr.base());
        out.append(expr.isArrow() ? "->" : ".");
        Decl member = expr.member();
        if (member instanceof MethodDecl && ((MethodDecl) member).isLambdaMember()
                && ((MethodDecl) member).methodKind() == MethodKind.CONVERSION) {
            out.append("operator ", InternalNames.lambdaClassName(((MethodDecl) member).lambdaLocation()),
                    "::retType");
            return;
        }
        out.append(expr.memberName());
        if (member instanceof FunctionDecl) {
            emitTemplateArguments(((FunctionDecl) member).templateArguments());
        }
    }

    protected void emitCall(CallExpr call, LambdaCallerRole role) {
        try (LambdaContext ctx = pass.lambdas().enter(role, out)) {
            emit(call.callee());
            if (call instanceof UserDefinedLiteral) {
                emitLiteralOperatorArguments(((UserDefinedLiteral) call).specializationArguments());
            }
            out.append('(');
            commaSeparated(out, call.arguments(), this::emit);
            out.append(')');
        }
    }

    private void emitLiteralOperatorArguments(List<TemplateArgument> args) {
        if (args.size() == 1 && args.get(0).kind() == TemplateArgumentKind.PACK) {
            out.append('<');
            commaSeparated(out, args.get(0).packElements(), el -> {
                out.append("'", Literals.escapeCharacter(el.asIntegral().intValue(), CharacterEncoding.ASCII), "'");
            });
            out.append('>');
        } else {
            emitTemplateArguments(args);
        }
    }

    protected void emitOperatorCall(OperatorCallExpr call) {
        try (LambdaContext ctx = pass.lambdas().enter(LambdaCallerRole.OPERATOR_CALL, out)) {
            List<Expr> args = call.arguments();
            if (call.isMemberOperator()) {
                emitWithParensIfDereference(args.get(0));
                out.append(".operator", call.operatorSpelling(), "(");
                commaSeparated(out, args.subList(1, args.size()), this::emit);
            } else {
                emit(call.callee());
                out.append('(');
                commaSeparated(out, args, this::emit);
            }
            out.append(')');
        }
    }

    private void emitWithParensIfDereference(Expr expr) {
        Expr e = expr.ignoreImplicit();
        boolean parens = e instanceof UnaryOperator && ((UnaryOperator) e).opcode() == UnaryOpcode.DEREF;
        if (parens) {
            out.append('(');
        }
        emit(expr);
        if (parens) {
            out.append(')');
        }
    }

    protected void emitConstruct(ConstructExpr expr) {
        out.append(types().desugaredName(expr.type().unqualified()));
        boolean braces = expr.isListInitialization();
        out.append(braces ? '{' : '(');
        commaSeparated(out, expr.arguments(), this::emit);
        out.append(braces ? '}' : ')');
    }

    protected void emitImplicitCast(ImplicitCastExpr cast) {
        Expr operand = cast.operand();
        CastKind kind = cast.castKind();
        if (!Casts.isMadeExplicit(kind)) {
            emit(operand);
        } else if (operand instanceof IntegerLiteral) {
            emit(operand);
        } else {
            boolean asComment = kind != CastKind.BIT_CAST && operand instanceof ThisExpr;
            emitCast(Casts.implicitCastKeyword(kind), cast.type(), operand, kind, asComment);
        }
    }

    /**
     * Write <code>keyword&lt;T&gt;(operand)</code>. When the cast is only
     * informative, the cast syntax is commented out around the operand.
     */
    protected void emitCast(String keyword, CppType destination, Expr operand, CastKind kind, boolean asComment) {
        String head = keyword + "<" + Casts.destinationText(types(), kind, destination) + ">(";
        if (asComment) {
            out.append("/*", head, "*/");
            emit(operand);
            out.append("/*)*/");
        } else {
            out.append(head);
            emit(operand);
            out.append(')');
        }
    }

    protected void emitFunctionalCast(FunctionalCastExpr cast) {
        Expr operand = cast.operand();
        boolean constructor = operand instanceof ConstructExpr;
        boolean stdList = operand instanceof StdInitializerListExpr;
        boolean parens = !constructor && !stdList && !cast.isListInitialization();
        if (!constructor && !stdList) {
            out.append(types().name(cast.typeAsWritten()));
        }
        if (parens) {
            out.append('(');
        }
        emit(operand);
        if (parens) {
            out.append(')');
        }
    }

    protected void emitNew(NewExpr expr) {
        out.append("new ");
        if (!expr.placementArguments().isEmpty()) {
            out.append('(');
            commaSeparated(out, expr.placementArguments(), this::emit);
            out.append(") ");
        }
        if (expr.construction() != null) {
            emit(expr.construction());
            return;
        }
        out.append(types().name(expr.allocatedType()));
        if (expr.isArray()) {
            if (expr.arraySize() == null) {
                throw new DesugarException(expr, "Array new without an element count");
            }
            out.append('[');
            emit(expr.arraySize());
            out.append(']');
        }
        if (expr.initializer() != null) {
            emitInCurlysIfRequired(expr.initializer());
        }
    }

    /**
     * Emit an initializer which must be delimited, adding braces unless it
     * brings its own.
     *
     * @param init An initializer
     */
    protected void emitInCurlysIfRequired(Expr init) {
        boolean curlys = !(init instanceof InitListExpr) && !(init instanceof ParenExpr)
                && !init.is(NodeKind.DEFAULT_INIT_EXPR);
        if (curlys) {
            out.append('{');
        }
        emit(init);
        if (curlys) {
            out.append('}');
        }
    }

    protected void emitUnaryTrait(UnaryTraitExpr expr) {
        switch (expr.trait()) {
            case SIZEOF:
                out.append("sizeof");
                break;
            case ALIGNOF:
                out.append("alignof");
                break;
            default:
                out.append("unknown");
        }
        if (expr.isArgumentType()) {
            out.append("(", types().name(expr.argumentType()), ")");
        } else if (expr.argument() instanceof ParenExpr) {
            emit(expr.argument());
        } else {
            out.append('(');
            emit(expr.argument());
            out.append(')');
        }
    }

    protected void emitLambda(LambdaExpr lambda) {
        if (inPlacementContext()) {
            LambdaContext top = pass.lambdas().top();
            new ClosureSynthesizer(this).synthesize(lambda, top);
            out.append(InternalNames.lambdaClassName(lambda.location()));
            top.flushInitializers(out);
        } else {
            // the object declared after the class shadows the class name
            declareLambda(lambda);
            out.append(InternalNames.lambdaClassName(lambda.location()));
        }
    }

    /**
     * Write the class for a lambda before the current line, followed by the
     * declaration of an object of it with the same name.
     *
     * @param lambda A lambda
     */
    protected final void declareLambda(LambdaExpr lambda) {
        try (LambdaContext ctx = pass.lambdas().enter(LambdaCallerRole.LAMBDA, out)) {
            new ClosureSynthesizer(this).synthesize(lambda, ctx);
        }
    }

    protected void emitTemplateArguments(List<TemplateArgument> args) {
        if (args.isEmpty()) {
            return;
        }
        out.append('<');
        commaSeparated(out, args, this::emitTemplateArgument);
        // keep ">>" from closing two lists at once
        out.append(out.lastChar() == '>' ? " >" : ">");
    }

    protected void emitTemplateArgument(TemplateArgument arg) {
        switch (arg.kind()) {
            case TYPE:
            case NULL_POINTER:
                out.append(types().name(arg.asType()));
                break;
            case DECLARATION:
                out.append(types().nameAsFunctionPointer(arg.asDeclaration().type()));
                break;
            case INTEGRAL:
                out.append(arg.asIntegral().toString());
                break;
            case EXPRESSION:
                emit(arg.asExpression());
                break;
            case PACK:
                commaSeparated(out, arg.packElements(), this::emitTemplateArgument);
                break;
            case TEMPLATE:
            case TEMPLATE_EXPANSION:
                out.append(arg.asTemplateName());
                break;
            default:
                out.append("null");
        }
    }

    // Declarations

    protected void emitVarDecl(VarDecl decl) {
        try (LambdaContext ctx = pass.lambdas().enter(LambdaCallerRole.VAR_DECL, out)) {
            if (StaticLocalInitGuard.applies(decl)) {
                new StaticLocalInitGuard(this).emit(decl);
                return;
            }
            CppType type = decl.type();
            if (type.isFunctionPointer()) {
                String alias = InternalNames.functionPointerAlias(decl.location());
                out.append("using ", alias, " = ", types().name(type)).endStatement();
                writeVarQualifiers(decl);
                out.append(alias, " ", decl.name());
            } else {
                writeVarQualifiers(decl);
                out.append(types().nameAsParameter(type, decl.name()));
            }
            writeVarInitializer(decl);
            if (decl.isNrvoVariable()) {
                out.append(' ').blockComment("NRVO variable");
            }
            out.endStatement();
        }
    }

    /**
     * Write a variable's declarator and initializer without a terminator,
     * as in the init-statement of a <code>for</code>.
     *
     * @param decl The variable
     * @param withType If false, only the name and initializer are written
     */
    protected void writeVarDeclarator(VarDecl decl, boolean withType) {
        if (withType) {
            writeVarQualifiers(decl);
            out.append(types().nameAsParameter(decl.type(), decl.name()));
        } else {
            out.append(decl.name());
        }
        writeVarInitializer(decl);
    }

    void writeVarQualifiers(VarDecl decl) {
        if (decl.isInline()) {
            out.append("inline ");
        }
        if (decl.storageClass() != StorageClass.NONE) {
            out.append(decl.storageClass().keyword(), " ");
        }
        if (decl.isConstexpr()) {
            out.append("constexpr ");
        }
    }

    private void writeVarInitializer(VarDecl decl) {
        if (decl.hasInitializer()) {
            out.append(" = ");
            emit(decl.initializer());
        }
    }

    protected void emitFunction(FunctionDecl fn) {
        pass.prototypes().formatPrototype(out, fn);
        if (fn.hasBody()) {
            emitStatement(fn.body());
        } else {
            out.endStatement();
        }
        out.blankLine();
    }

    protected void emitMethod(MethodDecl method) {
        writeMethodHead(method, false);
        if (method.isDefaulted()) {
            out.append(" = default").endStatement();
        } else if (method.isDeleted()) {
            out.append(" = delete").endStatement();
        } else if (!method.hasBody()) {
            out.endStatement();
        } else {
            iterate(method.initializers(), (init, first, last) -> {
                out.ensureNewLine();
                out.append(first ? ": " : ", ");
                if (init.isMemberInitializer()) {
                    out.append(init.memberName());
                    emitInCurlysIfRequired(init.initializer());
                } else {
                    emit(init.initializer());
                }
            });
            emitStatement(method.body());
        }
        out.blankLine();
    }

    /**
     * Write the qualifiers, return type, name and parameter list of a
     * method. A conversion operator is preceded by a
     * <code>using retType</code> alias and named through it.
     *
     * @param method The method
     * @param closureMember If true, <code>constexpr</code> is written as a
     * comment
     */
    protected void writeMethodHead(MethodDecl method, boolean closureMember) {
        MethodKind kind = method.methodKind();
        if (kind == MethodKind.CONVERSION) {
            out.append("using retType = ", types().desugaredName(method.returnType())).endStatement();
        }
        if (method.isInline()) {
            out.append("inline ");
        }
        if (method.isStatic()) {
            out.append("static ");
        }
        if (method.isVirtual()) {
            out.append("virtual ");
        }
        if (method.isVolatile()) {
            out.append("volatile ");
        }
        if (method.isConstexpr()) {
            out.append(closureMember ? "/*constexpr */ " : "constexpr ");
        }
        switch (kind) {
            case CONVERSION:
                out.append("operator retType (");
                break;
            case CONSTRUCTOR:
            case DESTRUCTOR:
                out.append(method.name(), "(");
                break;
            default:
                out.append(types().namePrefix(method.returnType()), method.name(), "(");
        }
        pass.prototypes().formatParameters(out, method.parameters());
        out.append(")");
        if (method.isConst()) {
            out.append(" const");
        }
        if (method.isNoexcept()) {
            out.append(" noexcept");
        }
    }

    protected void emitRecord(RecordDecl record) {
        if (!record.hasDefinition()) {
            return;
        }
        out.append(record.tagKind().keyword(), " ", record.name());
        emitTemplateArguments(record.templateArguments());
        if (!record.bases().isEmpty()) {
            out.append(" : ");
            commaSeparated(out, record.bases(), this::writeBase);
        }
        out.openScope();
        for (Decl member : record.members()) {
            emitStatement(member);
        }
        out.closeScopeWithSemicolon();
        out.blankLine();
    }

    private void writeBase(BaseSpecifier base) {
        String access = base.access().spelling();
        if (!access.isEmpty()) {
            out.append(access, " ");
        }
        if (base.isVirtual()) {
            out.append("virtual ");
        }
        out.append(types().name(base.type()));
    }

    protected void emitUsing(UsingDecl using) {
        out.append("using ");
        if (!using.isInFunction()) {
            for (DeclContextRef ctx : using.contexts()) {
                if (ctx.isTransparent()) {
                    continue;
                }
                switch (ctx.kind()) {
                    case FUNCTION:
                        pass.prototypes().formatPrototype(out, ctx.function());
                        break;
                    case CLASS_TEMPLATE_SPECIALIZATION:
                        out.append(ctx.name());
                        emitTemplateArguments(ctx.templateArguments());
                        break;
                    default:
                        out.append(ctx.name());
                }
                out.append("::");
            }
        }
        out.append(using.name()).endStatement();
    }

    protected void emitStaticAssert(StaticAssertDecl decl) {
        out.append(out.settings().blockCommentOpen(), decl.isFailed() ? "FAILED" : "PASSED", ": static_assert(");
        emit(decl.assertion());
        if (decl.message() != null) {
            out.append(", ");
            emit(decl.message());
        }
        out.append(")", String.valueOf(out.settings().statementTerminator()),
                out.settings().blockCommentClose());
        out.ensureNewLine();
    }
}
