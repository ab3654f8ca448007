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

/**
 * Spells types in generated source. Implementations must be stateless or at
 * least deterministic, since the same type may be spelled many times in one
 * pass.
 */
public interface TypeNamer {

    /**
     * The type as written, with aliases kept and a deduced
     * <code>auto</code> replaced by what it was deduced to.
     *
     * @param type A type
     * @return Its spelling
     */
    String name(CppType type);

    /**
     * The type with aliases stripped.
     *
     * @param type A type
     * @return Its spelling
     */
    String desugaredName(CppType type);

    /**
     * A declaration of the given name with the given type, e.g.
     * <code>int (&amp;a)[3]</code> or <code>void (*fp)(int)</code>.
     *
     * @param type The type
     * @param name The declared name, possibly empty
     * @return A declarator
     */
    String nameAsParameter(CppType type, String name);

    /**
     * The type, with a function type decayed to a pointer to it.
     *
     * @param type A type
     * @return Its spelling
     */
    String nameAsFunctionPointer(CppType type);

    /**
     * The type spelled so that a name can follow it directly: a space is
     * appended unless the spelling ends in a pointer or reference declarator.
     *
     * @param type A type
     * @return Its spelling, ready to prefix a name
     */
    default String namePrefix(CppType type) {
        String result = name(type);
        char last = result.isEmpty() ? ' ' : result.charAt(result.length() - 1);
        return last == '*' || last == '&' ? result : result + " ";
    }
}
