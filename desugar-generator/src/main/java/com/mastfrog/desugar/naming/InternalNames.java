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
package com.mastfrog.desugar.naming;

import com.mastfrog.desugar.ast.SourceLocation;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.HashSet;
import java.util.Set;

/**
 * Issues the names of entities the generator synthesizes. Names derive from
 * source locations so that output is stable; one instance lives for one pass
 * and remembers which decomposition temporaries it has issued so that they
 * never collide.
 */
public final class InternalNames {

    private static final String PREFIX = "__";
    private final Set<String> issued = new HashSet<>();

    /**
     * The name of the temporary holding the object a decomposition
     * declaration decomposes: <code>__&lt;base&gt;&lt;line&gt;</code>, with the
     * column and then a counter appended as needed to make it unique.
     *
     * @param base The human readable base name
     * @param location Where the declaration is
     * @return A name not issued before in this pass
     */
    public String decompositionTemporary(String base, SourceLocation location) {
        notNull("base", base);
        String candidate;
        if (location == null || !location.isKnown()) {
            candidate = PREFIX + base;
        } else {
            candidate = PREFIX + base + location.line();
            if (issued.contains(candidate)) {
                candidate = candidate + "_" + location.column();
            }
        }
        String result = candidate;
        for (int i = 1; issued.contains(result); i++) {
            result = candidate + "_" + i;
        }
        issued.add(result);
        return result;
    }

    /**
     * The backing storage of a guarded function-local static.
     *
     * @param variableName The variable
     * @return A name
     */
    public String staticStorage(String variableName) {
        return PREFIX + notNull("variableName", variableName);
    }

    /**
     * The flag recording that a guarded function-local static was
     * constructed.
     *
     * @param variableName The variable
     * @return A name
     */
    public String staticGuardFlag(String variableName) {
        return staticStorage(variableName) + "B";
    }

    public static String lambdaClassName(SourceLocation location) {
        return "__lambda_" + location.line() + "_" + location.column();
    }

    public static String functionPointerAlias(SourceLocation location) {
        return "FuncPtr_" + location.line();
    }

    /**
     * Name of the closure field which holds a captured <code>this</code>.
     *
     * @return A name
     */
    public static String capturedThis() {
        return PREFIX + "this";
    }
}
