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
package com.mastfrog.desugar.ast.decl;

import com.mastfrog.desugar.ast.AccessSpecifier;
import com.mastfrog.desugar.ast.type.CppType;
import static com.mastfrog.util.preconditions.Checks.notNull;

/**
 * A base class in a class head.
 */
public final class BaseSpecifier {

    private final AccessSpecifier access;
    private final CppType type;
    private final boolean isVirtual;

    public BaseSpecifier(AccessSpecifier access, CppType type, boolean isVirtual) {
        this.access = notNull("access", access);
        this.type = notNull("type", type);
        this.isVirtual = isVirtual;
    }

    public static BaseSpecifier publicBase(CppType type) {
        return new BaseSpecifier(AccessSpecifier.PUBLIC, type, false);
    }

    public AccessSpecifier access() {
        return access;
    }

    public CppType type() {
        return type;
    }

    public boolean isVirtual() {
        return isVirtual;
    }
}
