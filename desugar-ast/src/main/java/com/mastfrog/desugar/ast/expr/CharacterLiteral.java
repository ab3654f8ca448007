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
import com.mastfrog.desugar.ast.type.BuiltinKind;
import com.mastfrog.desugar.ast.type.CppType;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.Collections;
import java.util.List;

/**
 * A character literal. The value is the code unit as semantic analysis
 * computed it; for a plain <code>char</code> on a signed target, values above
 * 0x7F arrive sign extended.
 */
public final class CharacterLiteral extends Expr {

    private final int value;
    private final CharacterEncoding encoding;

    public CharacterLiteral(SourceLocation location, int value, CharacterEncoding encoding, CppType type) {
        super(NodeKind.CHARACTER_LITERAL, location, type);
        this.value = value;
        this.encoding = notNull("encoding", encoding);
    }

    public static CharacterLiteral of(char c) {
        return new CharacterLiteral(null, c, CharacterEncoding.ASCII, CppType.builtin(BuiltinKind.CHAR_S));
    }

    public static CharacterLiteral of(int value, CharacterEncoding encoding) {
        BuiltinKind kind;
        switch (encoding) {
            case WIDE:
                kind = BuiltinKind.WCHAR_S;
                break;
            case UTF8:
                kind = BuiltinKind.CHAR8;
                break;
            case UTF16:
                kind = BuiltinKind.CHAR16;
                break;
            case UTF32:
                kind = BuiltinKind.CHAR32;
                break;
            default:
                kind = BuiltinKind.CHAR_S;
        }
        return new CharacterLiteral(null, value, encoding, CppType.builtin(kind));
    }

    public int value() {
        return value;
    }

    public CharacterEncoding encoding() {
        return encoding;
    }

    @Override
    public List<? extends Node> children() {
        return Collections.emptyList();
    }
}
