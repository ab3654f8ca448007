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
package com.mastfrog.desugar.ast.expr;

import com.mastfrog.desugar.ast.Node;
import com.mastfrog.desugar.ast.NodeKind;
import com.mastfrog.desugar.ast.SourceLocation;
import com.mastfrog.desugar.ast.decl.Decl;
import com.mastfrog.desugar.ast.type.CppType;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.List;

/**
 * Member access through <code>.</code> or <code>-&gt;</code>.
 */
public final class MemberExpr extends Expr {

    private final Expr base;
    private final String memberName;
    private final Decl member;
    private final boolean arrow;

    public MemberExpr(SourceLocation location, Expr base, String memberName, Decl member,
            boolean arrow, CppType type) {
        super(NodeKind.MEMBER_EXPR, location, type);
        this.base = notNull("base", base);
        this.memberName = notNull("memberName", memberName);
        this.member = member;
        this.arrow = arrow;
    }

    public static MemberExpr dot(Expr base, Decl member) {
        return new MemberExpr(base.location(), base, member.name(), member, false, member.type());
    }

    public static MemberExpr arrow(Expr base, Decl member) {
        return new MemberExpr(base.location(), base, member.name(), member, true, member.type());
    }

    public Expr base() {
        return base;
    }

    public String memberName() {
        return memberName;
    }

    /**
     * The declaration of the member, if resolved.
     *
     * @return A declaration or null
     */
    public Decl member() {
        return member;
    }

    public boolean isArrow() {
        return arrow;
    }

    @Override
    public List<? extends Node> children() {
        return childrenOf(base);
    }
}
