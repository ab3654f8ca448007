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
package com.mastfrog.desugar.ast;

import com.mastfrog.desugar.ast.decl.Decl;
import com.mastfrog.desugar.ast.expr.Expr;
import com.mastfrog.desugar.ast.type.CppType;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A template argument: a tagged union whose payload depends on its
 * {@link TemplateArgumentKind}. Accessors for a payload the argument does not
 * carry throw an IllegalStateException.
 */
public final class TemplateArgument {

    private static final TemplateArgument NULL_ARGUMENT
            = new TemplateArgument(TemplateArgumentKind.NULL, null);
    private final TemplateArgumentKind kind;
    private final Object payload;

    private TemplateArgument(TemplateArgumentKind kind, Object payload) {
        this.kind = kind;
        this.payload = payload;
    }

    public static TemplateArgument type(CppType type) {
        return new TemplateArgument(TemplateArgumentKind.TYPE, notNull("type", type));
    }

    public static TemplateArgument declaration(Decl decl) {
        return new TemplateArgument(TemplateArgumentKind.DECLARATION, notNull("decl", decl));
    }

    public static TemplateArgument nullPointer(CppType type) {
        return new TemplateArgument(TemplateArgumentKind.NULL_POINTER, notNull("type", type));
    }

    public static TemplateArgument integral(long value) {
        return integral(BigInteger.valueOf(value));
    }

    public static TemplateArgument integral(BigInteger value) {
        return new TemplateArgument(TemplateArgumentKind.INTEGRAL, notNull("value", value));
    }

    public static TemplateArgument expression(Expr expr) {
        return new TemplateArgument(TemplateArgumentKind.EXPRESSION, notNull("expr", expr));
    }

    public static TemplateArgument pack(TemplateArgument... elements) {
        return pack(Arrays.asList(elements));
    }

    public static TemplateArgument pack(List<TemplateArgument> elements) {
        return new TemplateArgument(TemplateArgumentKind.PACK,
                Collections.unmodifiableList(notNull("elements", elements)));
    }

    /**
     * A character pack, as the template arguments of a literal operator
     * template receive them.
     *
     * @param chars The characters of the literal
     * @return A pack of integral arguments
     */
    public static TemplateArgument characterPack(String chars) {
        TemplateArgument[] items = new TemplateArgument[chars.length()];
        for (int i = 0; i < items.length; i++) {
            items[i] = integral(chars.charAt(i));
        }
        return pack(items);
    }

    public static TemplateArgument template(String name) {
        return new TemplateArgument(TemplateArgumentKind.TEMPLATE, notNull("name", name));
    }

    public static TemplateArgument templateExpansion(String name) {
        return new TemplateArgument(TemplateArgumentKind.TEMPLATE_EXPANSION, notNull("name", name));
    }

    public static TemplateArgument nullArgument() {
        return NULL_ARGUMENT;
    }

    public TemplateArgumentKind kind() {
        return kind;
    }

    private <T> T payload(Class<T> type, TemplateArgumentKind... allowed) {
        for (TemplateArgumentKind k : allowed) {
            if (k == kind) {
                return type.cast(payload);
            }
        }
        throw new IllegalStateException("Template argument of kind " + kind
                + " has no " + type.getSimpleName());
    }

    public CppType asType() {
        return payload(CppType.class, TemplateArgumentKind.TYPE, TemplateArgumentKind.NULL_POINTER);
    }

    public Decl asDeclaration() {
        return payload(Decl.class, TemplateArgumentKind.DECLARATION);
    }

    public BigInteger asIntegral() {
        return payload(BigInteger.class, TemplateArgumentKind.INTEGRAL);
    }

    public Expr asExpression() {
        return payload(Expr.class, TemplateArgumentKind.EXPRESSION);
    }

    @SuppressWarnings("unchecked")
    public List<TemplateArgument> packElements() {
        return payload(List.class, TemplateArgumentKind.PACK);
    }

    public String asTemplateName() {
        return payload(String.class, TemplateArgumentKind.TEMPLATE, TemplateArgumentKind.TEMPLATE_EXPANSION);
    }

    @Override
    public String toString() {
        return kind + "(" + payload + ")";
    }
}
