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
import static org.junit.jupiter.api.Assertions.assertEquals;
import org.junit.jupiter.api.Test;

public class InternalNamesTest {

    @Test
    public void testDecompositionTemporariesNeverCollide() {
        InternalNames names = new InternalNames();
        assertEquals("__p4", names.decompositionTemporary("p", SourceLocation.at(4, 8)));
        assertEquals("__p4_30", names.decompositionTemporary("p", SourceLocation.at(4, 30)));
        assertEquals("__p4_30_1", names.decompositionTemporary("p", SourceLocation.at(4, 30)));
        assertEquals("__q4", names.decompositionTemporary("q", SourceLocation.at(4, 30)));
        assertEquals("__p", names.decompositionTemporary("p", SourceLocation.UNKNOWN));
        assertEquals("__p_1", names.decompositionTemporary("p", null));
    }

    @Test
    public void testInstancesAreIndependent() {
        assertEquals("__p4", new InternalNames().decompositionTemporary("p", SourceLocation.at(4, 8)));
        assertEquals("__p4", new InternalNames().decompositionTemporary("p", SourceLocation.at(4, 8)));
    }

    @Test
    public void testFixedNames() {
        InternalNames names = new InternalNames();
        assertEquals("__s", names.staticStorage("s"));
        assertEquals("__sB", names.staticGuardFlag("s"));
        assertEquals("__lambda_3_12", InternalNames.lambdaClassName(SourceLocation.at(3, 12)));
        assertEquals("FuncPtr_7", InternalNames.functionPointerAlias(SourceLocation.at(7, 3)));
        assertEquals("__this", InternalNames.capturedThis());
    }
}
