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
package com.mastfrog.desugar.lambda;

import com.mastfrog.desugar.output.OutputBuffer;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

public class LambdaStackTest {

    @Test
    public void testContextsAreLastInFirstOut() {
        LambdaStack stack = new LambdaStack();
        OutputBuffer root = new OutputBuffer();
        assertTrue(stack.isEmpty());
        assertNull(stack.top());
        try (LambdaContext outer = stack.enter(LambdaCallerRole.VAR_DECL, root)) {
            try (LambdaContext inner = stack.enter(LambdaCallerRole.CALL, root)) {
                assertSame(inner, stack.top());
                assertEquals(2, stack.depth());
            }
            assertSame(outer, stack.top());
        }
        assertTrue(stack.isEmpty());
    }

    @Test
    public void testClosingOutOfOrderFails() {
        LambdaStack stack = new LambdaStack();
        OutputBuffer root = new OutputBuffer();
        LambdaContext outer = stack.enter(LambdaCallerRole.VAR_DECL, root);
        stack.enter(LambdaCallerRole.RETURN, root);
        assertThrows(IllegalStateException.class, outer::close);
    }

    @Test
    public void testClosingTwiceFails() {
        LambdaStack stack = new LambdaStack();
        LambdaContext ctx = stack.enter(LambdaCallerRole.LAMBDA, new OutputBuffer());
        ctx.close();
        assertTrue(ctx.isClosed());
        assertThrows(IllegalStateException.class, ctx::close);
    }

    @Test
    public void testSpliceTargetIsInnermostPlacementContext() {
        LambdaStack stack = new LambdaStack();
        OutputBuffer root = new OutputBuffer();
        assertSame(root, stack.spliceTarget(root));
        LambdaContext lambda = stack.enter(LambdaCallerRole.LAMBDA, root);
        assertSame(root, stack.spliceTarget(root));
        LambdaContext decl = stack.enter(LambdaCallerRole.VAR_DECL, root);
        assertSame(decl.staged(), stack.spliceTarget(root));
        LambdaContext call = stack.enter(LambdaCallerRole.CALL, root);
        assertSame(call.staged(), stack.spliceTarget(root));
        LambdaContext nested = stack.enter(LambdaCallerRole.LAMBDA, root);
        assertSame(call.staged(), stack.spliceTarget(root));
        nested.close();
        call.close();
        decl.close();
        lambda.close();
    }

    @Test
    public void testStagedTextLandsAtStartOfLine() {
        LambdaStack stack = new LambdaStack();
        OutputBuffer root = new OutputBuffer();
        root.appendNewLine("int a = 1;");
        root.append("auto x = ");
        try (LambdaContext ctx = stack.enter(LambdaCallerRole.VAR_DECL, root)) {
            ctx.staged().append("class A {}").endStatement();
            ctx.stageInitializers("{a}");
            root.append("A");
            assertTrue(ctx.flushInitializers(root));
            assertFalse(ctx.flushInitializers(root));
            root.endStatement();
        }
        assertEquals("int a = 1;\nclass A {};\nauto x = A{a};\n", root.toString());
    }

    @Test
    public void testNestedContextSplicesIntoEnclosingStagedBuffer() {
        LambdaStack stack = new LambdaStack();
        OutputBuffer root = new OutputBuffer();
        try (LambdaContext outer = stack.enter(LambdaCallerRole.VAR_DECL, root)) {
            outer.staged().appendNewLine("class Outer;");
            try (LambdaContext inner = stack.enter(LambdaCallerRole.RETURN, root)) {
                inner.staged().appendNewLine("class Inner;");
            }
            assertEquals("class Outer;\nclass Inner;\n", outer.staged().toString());
            assertTrue(root.isEmpty());
            root.appendNewLine("Outer o;");
        }
        assertEquals("class Outer;\nclass Inner;\nOuter o;\n", root.toString());
    }

    @Test
    public void testContextCanSpliceBeforeAnEarlierLine() {
        LambdaStack stack = new LambdaStack();
        OutputBuffer root = new OutputBuffer();
        root.appendNewLine("int a = 1;");
        int start = root.lineStartPosition();
        root.appendNewLine("do {}");
        try (LambdaContext ctx = stack.enterAt(LambdaCallerRole.VAR_DECL, root, start)) {
            ctx.staged().appendNewLine("class A {};");
            root.append("while(A{}())").endStatement();
        }
        assertEquals("int a = 1;\nclass A {};\ndo {}\nwhile(A{}());\n", root.toString());
        assertThrows(IllegalArgumentException.class,
                () -> stack.enterAt(LambdaCallerRole.VAR_DECL, root, root.currentPosition() + 1));
        assertTrue(stack.isEmpty());
    }

    @Test
    public void testEarlierPositionIgnoredInsideEnclosingPlacementContext() {
        LambdaStack stack = new LambdaStack();
        OutputBuffer root = new OutputBuffer();
        root.appendNewLine("int a = 1;");
        try (LambdaContext outer = stack.enter(LambdaCallerRole.RETURN, root)) {
            try (LambdaContext inner = stack.enterAt(LambdaCallerRole.VAR_DECL, root, 0)) {
                inner.staged().appendNewLine("class B {};");
            }
            assertEquals("class B {};\n", outer.staged().toString());
            root.append("return 0").endStatement();
        }
        assertEquals("int a = 1;\nclass B {};\nreturn 0;\n", root.toString());
    }

    @Test
    public void testAbandonedScopesInStagedBufferAreClosed() {
        LambdaStack stack = new LambdaStack();
        OutputBuffer root = new OutputBuffer();
        try (LambdaContext ctx = stack.enter(LambdaCallerRole.VAR_DECL, root)) {
            ctx.staged().append("class A").openScope().append("int x;");
        }
        assertEquals("class A\n{\n  int x;\n}\n", root.toString());
    }

    @Test
    public void testRoles() {
        for (LambdaCallerRole role : LambdaCallerRole.values()) {
            assertEquals(role != LambdaCallerRole.LAMBDA, role.isPlacementRole(), role.name());
        }
        assertTrue(LambdaCallerRole.VAR_DECL.stagesInitializers());
        assertTrue(LambdaCallerRole.CALL.stagesInitializers());
        assertFalse(LambdaCallerRole.RETURN.stagesInitializers());
        assertFalse(LambdaCallerRole.OPERATOR_CALL.stagesInitializers());
    }
}
