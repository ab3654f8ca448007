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
package com.mastfrog.desugar.ast.type;

import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An immutable C++ type. Sugar (aliases and <code>auto</code>) is kept, so a
 * type knows both how it was written and what it denotes; see
 * {@link #desugared()}.
 */
public final class CppType {

    private final TypeCategory category;
    private final String name;
    private final BuiltinKind builtin;
    private final CppType element;
    private final long arraySize;
    private final boolean constQualified;
    private final boolean volatileQualified;
    private final boolean trivialConstruction;
    private final List<CppType> parameterTypes;

    private CppType(TypeCategory category, String name, BuiltinKind builtin, CppType element,
            long arraySize, boolean constQualified, boolean volatileQualified,
            boolean trivialConstruction, List<CppType> parameterTypes) {
        this.category = category;
        this.name = name;
        this.builtin = builtin;
        this.element = element;
        this.arraySize = arraySize;
        this.constQualified = constQualified;
        this.volatileQualified = volatileQualified;
        this.trivialConstruction = trivialConstruction;
        this.parameterTypes = parameterTypes;
    }

    private static CppType of(TypeCategory category, String name, BuiltinKind builtin, CppType element) {
        return new CppType(category, name, builtin, element, -1, false, false, true,
                Collections.<CppType>emptyList());
    }

    public static CppType builtin(BuiltinKind kind) {
        return of(TypeCategory.BUILTIN, notNull("kind", kind).spelling(), kind, null);
    }

    /**
     * A class type whose construction is trivial.
     *
     * @param name The (qualified) name as it should be printed
     * @return A type
     */
    public static CppType record(String name) {
        return record(name, true);
    }

    public static CppType record(String name, boolean trivialConstruction) {
        return new CppType(TypeCategory.RECORD, notNull("name", name), null, null, -1,
                false, false, trivialConstruction, Collections.<CppType>emptyList());
    }

    public static CppType enumType(String name) {
        return of(TypeCategory.ENUM, notNull("name", name), null, null);
    }

    public static CppType dependent(String spelling) {
        return of(TypeCategory.DEPENDENT, notNull("spelling", spelling), null, null);
    }

    public static CppType alias(String name, CppType underlying) {
        return of(TypeCategory.ALIAS, notNull("name", name), null, notNull("underlying", underlying));
    }

    /**
     * An <code>auto</code> placeholder which has not been deduced.
     *
     * @return A type
     */
    public static CppType auto() {
        return of(TypeCategory.AUTO, "auto", null, null);
    }

    public static CppType auto(CppType deduced) {
        return of(TypeCategory.AUTO, "auto", null, notNull("deduced", deduced));
    }

    public static CppType arrayOf(CppType element, long size) {
        return new CppType(TypeCategory.ARRAY, null, null, notNull("element", element), size,
                false, false, true, Collections.<CppType>emptyList());
    }

    public static CppType function(CppType returnType, CppType... parameters) {
        return new CppType(TypeCategory.FUNCTION, null, null, notNull("returnType", returnType),
                -1, false, false, true, Collections.unmodifiableList(Arrays.asList(parameters)));
    }

    public CppType pointer() {
        return of(TypeCategory.POINTER, null, null, this);
    }

    public CppType lvalueReference() {
        return of(TypeCategory.LVALUE_REFERENCE, null, null, this);
    }

    public CppType rvalueReference() {
        return of(TypeCategory.RVALUE_REFERENCE, null, null, this);
    }

    public CppType withConst() {
        return new CppType(category, name, builtin, element, arraySize, true,
                volatileQualified, trivialConstruction, parameterTypes);
    }

    public CppType withVolatile() {
        return new CppType(category, name, builtin, element, arraySize, constQualified,
                true, trivialConstruction, parameterTypes);
    }

    public CppType unqualified() {
        if (!constQualified && !volatileQualified) {
            return this;
        }
        return new CppType(category, name, builtin, element, arraySize, false,
                false, trivialConstruction, parameterTypes);
    }

    public TypeCategory category() {
        return category;
    }

    /**
     * The name of a named type (builtin spelling, record, enum, alias,
     * dependent spelling, or <code>auto</code>); null for compound types.
     *
     * @return A name or null
     */
    public String name() {
        return name;
    }

    public BuiltinKind builtinKind() {
        return builtin;
    }

    /**
     * The pointee, referenced or element type, the return type of a function
     * type, or the type an alias or deduced <code>auto</code> stands for.
     *
     * @return A type or null
     */
    public CppType element() {
        return element;
    }

    public long arraySize() {
        return arraySize;
    }

    public List<CppType> parameterTypes() {
        return parameterTypes;
    }

    public boolean isConst() {
        return constQualified;
    }

    public boolean isVolatile() {
        return volatileQualified;
    }

    public boolean isUndeducedAuto() {
        return category == TypeCategory.AUTO && element == null;
    }

    /**
     * Strip aliases and deduced <code>auto</code> at the top level and below
     * pointers, references and arrays. Qualifiers written on sugar are kept.
     *
     * @return The underlying type
     */
    public CppType desugared() {
        CppType result;
        switch (category) {
            case ALIAS:
            case AUTO:
                if (element == null) {
                    return this;
                }
                result = element.desugared();
                break;
            case POINTER:
                result = element.desugared().pointer();
                break;
            case LVALUE_REFERENCE:
                result = element.desugared().lvalueReference();
                break;
            case RVALUE_REFERENCE:
                result = element.desugared().rvalueReference();
                break;
            case ARRAY:
                result = arrayOf(element.desugared(), arraySize);
                break;
            default:
                return this;
        }
        if (constQualified) {
            result = result.withConst();
        }
        if (volatileQualified) {
            result = result.withVolatile();
        }
        return result;
    }

    private CppType top() {
        CppType t = this;
        while (t.category.isSugar() && t.element != null) {
            t = t.element;
        }
        return t;
    }

    public boolean isBuiltin() {
        return top().category == TypeCategory.BUILTIN;
    }

    public boolean isRecord() {
        return top().category == TypeCategory.RECORD;
    }

    public boolean isPointer() {
        return top().category == TypeCategory.POINTER;
    }

    public boolean isLValueReference() {
        return top().category == TypeCategory.LVALUE_REFERENCE;
    }

    public boolean isReference() {
        TypeCategory c = top().category;
        return c == TypeCategory.LVALUE_REFERENCE || c == TypeCategory.RVALUE_REFERENCE;
    }

    public boolean isArray() {
        return top().category == TypeCategory.ARRAY;
    }

    public boolean isFunctionPointer() {
        CppType t = top();
        return t.category == TypeCategory.POINTER && t.element.top().category == TypeCategory.FUNCTION;
    }

    public boolean isSignedInteger() {
        CppType t = top();
        return t.builtin != null && t.builtin.isSignedInteger();
    }

    /**
     * For builtin types (through sugar), the builtin kind.
     *
     * @return A kind or null
     */
    public BuiltinKind underlyingBuiltin() {
        return top().builtin;
    }

    /**
     * Whether constructing an object of this type runs no user code. Only
     * class types can be non-trivial.
     *
     * @return true if trivial
     */
    public boolean hasTrivialConstruction() {
        CppType t = top();
        if (t.category == TypeCategory.ARRAY) {
            return t.element.hasTrivialConstruction();
        }
        return t.trivialConstruction;
    }

    /**
     * The referenced type for references, otherwise this.
     *
     * @return A type
     */
    public CppType nonReference() {
        CppType t = top();
        return t.isReference() ? t.element : this;
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        } else if (o == null || o.getClass() != CppType.class) {
            return false;
        }
        CppType other = (CppType) o;
        return category == other.category && Objects.equals(name, other.name)
                && builtin == other.builtin && Objects.equals(element, other.element)
                && arraySize == other.arraySize && constQualified == other.constQualified
                && volatileQualified == other.volatileQualified
                && trivialConstruction == other.trivialConstruction
                && parameterTypes.equals(other.parameterTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, name, builtin, element, arraySize, constQualified,
                volatileQualified, parameterTypes);
    }

    @Override
    public String toString() {
        switch (category) {
            case POINTER:
                return element + "*";
            case LVALUE_REFERENCE:
                return element + "&";
            case RVALUE_REFERENCE:
                return element + "&&";
            case ARRAY:
                return element + "[" + arraySize + "]";
            case FUNCTION:
                return element + parameterTypes.toString();
            default:
                return (constQualified ? "const " : "") + name;
        }
    }
}
