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

import com.mastfrog.desugar.ast.expr.CharacterEncoding;
import com.mastfrog.desugar.ast.expr.CharacterLiteral;
import com.mastfrog.desugar.ast.expr.FloatingLiteral;
import com.mastfrog.desugar.ast.expr.IntegerLiteral;
import com.mastfrog.desugar.ast.type.BuiltinKind;
import static com.mastfrog.util.preconditions.Checks.notNull;

/**
 * Spelling of numeric and character literals.
 */
public final class Literals {

    private Literals() {
        throw new AssertionError();
    }

    /**
     * The literal suffix which gives an integer or floating literal the
     * given builtin type; empty for types a plain literal already has and
     * for types no suffix exists for.
     *
     * @param kind A builtin kind, or null
     * @return A suffix, never null
     */
    public static String suffix(BuiltinKind kind) {
        if (kind == null) {
            return "";
        }
        switch (kind) {
            case UINT:
                return "u";
            case ULONG:
                return "ul";
            case ULONG_LONG:
                return "ull";
            case LONG:
                return "l";
            case LONG_LONG:
                return "ll";
            case FLOAT:
                return "f";
            case LONG_DOUBLE:
                return "L";
            default:
                return "";
        }
    }

    public static String integerLiteral(IntegerLiteral literal) {
        return literal.value().toString() + suffix(literal.type().underlyingBuiltin());
    }

    public static String floatingLiteral(FloatingLiteral literal) {
        BuiltinKind kind = literal.type().underlyingBuiltin();
        String digits = kind == BuiltinKind.FLOAT
                ? Float.toString((float) literal.value())
                : Double.toString(literal.value());
        return digits + suffix(kind);
    }

    /**
     * Spell a character literal, including its encoding prefix and quotes.
     *
     * @param literal A literal
     * @return The source text
     */
    public static String characterLiteral(CharacterLiteral literal) {
        notNull("literal", literal);
        return literal.encoding().prefix() + '\''
                + escapeCharacter(literal.value(), literal.encoding()) + '\'';
    }

    /**
     * Escape one character value for use between single quotes. Values which
     * have a named escape use it; printable ASCII is written as itself;
     * anything else becomes an octal escape below 256 and a hexadecimal one
     * above.
     *
     * @param value The code unit value
     * @param encoding The encoding of the literal it comes from
     * @return The escaped text
     */
    public static String escapeCharacter(int value, CharacterEncoding encoding) {
        switch (value) {
            case '\\':
                return "\\\\";
            case 0:
                return "\\0";
            case '\'':
                return "\\'";
            case 0x07:
                return "\\a";
            case '\b':
                return "\\b";
            case '\f':
                return "\\f";
            case '\n':
                return "\\n";
            case '\r':
                return "\\r";
            case '\t':
                return "\\t";
            case 0x0B:
                return "\\v";
            default:
                break;
        }
        long unsigned = Integer.toUnsignedLong(value);
        if ((value & ~0xFF) == ~0xFF && encoding == CharacterEncoding.ASCII) {
            // sign extended plain char
            unsigned = value & 0xFF;
        }
        if (isPrintable(unsigned)) {
            return String.valueOf((char) unsigned);
        } else if (unsigned < 256) {
            return String.format("\\%03o", unsigned);
        }
        return "\\x" + Long.toHexString(unsigned);
    }

    static boolean isPrintable(long value) {
        return value >= 0x20 && value < 0x7F;
    }
}
