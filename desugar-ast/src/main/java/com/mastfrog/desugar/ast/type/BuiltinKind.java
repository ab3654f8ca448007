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

/**
 * Builtin C++ types, with the properties needed to spell literals of them.
 */
public enum BuiltinKind {
    VOID("void", 0, Numeric.NONE),
    BOOL("bool", 8, Numeric.NONE),
    CHAR_S("char", 8, Numeric.SIGNED),
    CHAR_U("char", 8, Numeric.UNSIGNED),
    SCHAR("signed char", 8, Numeric.SIGNED),
    UCHAR("unsigned char", 8, Numeric.UNSIGNED),
    WCHAR_S("wchar_t", 32, Numeric.SIGNED),
    WCHAR_U("wchar_t", 32, Numeric.UNSIGNED),
    CHAR8("char8_t", 8, Numeric.UNSIGNED),
    CHAR16("char16_t", 16, Numeric.UNSIGNED),
    CHAR32("char32_t", 32, Numeric.UNSIGNED),
    SHORT("short", 16, Numeric.SIGNED),
    USHORT("unsigned short", 16, Numeric.UNSIGNED),
    INT("int", 32, Numeric.SIGNED),
    UINT("unsigned int", 32, Numeric.UNSIGNED),
    LONG("long", 64, Numeric.SIGNED),
    ULONG("unsigned long", 64, Numeric.UNSIGNED),
    LONG_LONG("long long", 64, Numeric.SIGNED),
    ULONG_LONG("unsigned long long", 64, Numeric.UNSIGNED),
    INT128("__int128", 128, Numeric.SIGNED),
    UINT128("unsigned __int128", 128, Numeric.UNSIGNED),
    FLOAT("float", 32, Numeric.FLOATING),
    DOUBLE("double", 64, Numeric.FLOATING),
    LONG_DOUBLE("long double", 80, Numeric.FLOATING),
    NULLPTR("std::nullptr_t", 64, Numeric.NONE);

    private final String spelling;
    private final int bits;
    private final Numeric numeric;

    BuiltinKind(String spelling, int bits, Numeric numeric) {
        this.spelling = spelling;
        this.bits = bits;
        this.numeric = numeric;
    }

    public String spelling() {
        return spelling;
    }

    /**
     * Width in bits on an LP64 target.
     *
     * @return A bit count
     */
    public int bits() {
        return bits;
    }

    public boolean isInteger() {
        return numeric == Numeric.SIGNED || numeric == Numeric.UNSIGNED;
    }

    public boolean isSignedInteger() {
        return numeric == Numeric.SIGNED;
    }

    public boolean isUnsignedInteger() {
        return numeric == Numeric.UNSIGNED;
    }

    public boolean isFloating() {
        return numeric == Numeric.FLOATING;
    }

    private enum Numeric {
        NONE,
        SIGNED,
        UNSIGNED,
        FLOATING
    }
}
