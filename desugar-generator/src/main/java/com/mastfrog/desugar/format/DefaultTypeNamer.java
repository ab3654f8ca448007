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

import com.mastfrog.desugar.ast.type.CppType;
import com.mastfrog.desugar.ast.type.TypeCategory;
import static com.mastfrog.util.preconditions.Checks.notNull;
import com.mastfrog.util.strings.Strings;

/**
 * Spells types the way a compiler's type printer does: qualifiers before the
 * type name, pointer and reference declarators attached to the declared name
 * (<code>int *p</code>), and parentheses where a pointer or reference binds
 * to an array or function (<code>int (&amp;a)[3]</code>).
 */
public class DefaultTypeNamer implements TypeNamer {

    @Override
    public String name(CppType type) {
        return declarator(notNull("type", type), "", false);
    }

    @Override
    public String desugaredName(CppType type) {
        return declarator(notNull("type", type), "", true);
    }

    @Override
    public String nameAsParameter(CppType type, String name) {
        return declarator(notNull("type", type), notNull("name", name), false);
    }

    @Override
    public String nameAsFunctionPointer(CppType type) {
        if (type.category() == TypeCategory.FUNCTION) {
            return name(type.pointer());
        }
        return name(type);
    }

    private String declarator(CppType type, String inner, boolean desugar) {
        switch (type.category()) {
            case POINTER:
                return wrapped(type, "*", inner, desugar);
            case LVALUE_REFERENCE:
                return wrapped(type, "&", inner, desugar);
            case RVALUE_REFERENCE:
                return wrapped(type, "&&", inner, desugar);
            case ARRAY:
                return declarator(type.element(), inner + "["
                        + (type.arraySize() < 0 ? "" : Long.toString(type.arraySize())) + "]", desugar);
            case FUNCTION:
                StringBuilder params = new StringBuilder(inner).append('(');
                Strings.concatenate(", ", type.parameterTypes(), params, p -> declarator(p, "", desugar));
                return declarator(type.element(), params.append(')').toString(), desugar);
            case AUTO:
                if (type.element() != null) {
                    return declarator(requalify(type.element(), type), inner, desugar);
                }
                return named(type, type.name(), inner);
            case ALIAS:
                if (desugar) {
                    return declarator(requalify(type.element(), type), inner, desugar);
                }
                return named(type, type.name(), inner);
            default:
                return named(type, type.name(), inner);
        }
    }

    private String wrapped(CppType type, String operator, String inner, boolean desugar) {
        StringBuilder sb = new StringBuilder(operator);
        String quals = qualifiers(type);
        if (!quals.isEmpty()) {
            sb.append(quals.trim());
            if (!inner.isEmpty()) {
                sb.append(' ');
            }
        }
        sb.append(inner);
        CppType pointee = type.element();
        while (pointee.category() == TypeCategory.ALIAS && desugar
                || pointee.category() == TypeCategory.AUTO && pointee.element() != null) {
            pointee = pointee.element();
        }
        if (pointee.category() == TypeCategory.ARRAY || pointee.category() == TypeCategory.FUNCTION) {
            sb.insert(0, '(').append(')');
        }
        return declarator(type.element(), sb.toString(), desugar);
    }

    private static String named(CppType type, String name, String inner) {
        String result = qualifiers(type) + name;
        return inner.isEmpty() ? result : result + " " + inner;
    }

    private static String qualifiers(CppType type) {
        if (type.isConst() && type.isVolatile()) {
            return "const volatile ";
        } else if (type.isConst()) {
            return "const ";
        } else if (type.isVolatile()) {
            return "volatile ";
        }
        return "";
    }

    private static CppType requalify(CppType target, CppType sugar) {
        CppType result = target;
        if (sugar.isConst() && !result.isConst()) {
            result = result.withConst();
        }
        if (sugar.isVolatile() && !result.isVolatile()) {
            result = result.withVolatile();
        }
        return result;
    }
}
