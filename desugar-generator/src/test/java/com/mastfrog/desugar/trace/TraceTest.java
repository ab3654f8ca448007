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
package com.mastfrog.desugar.trace;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

public class TraceTest {

    @Test
    public void testParseCategories() {
        assertSame(TraceCategory.CLOSURE, TraceCategory.parse(" closure "));
        assertSame(TraceCategory.BINDINGS, TraceCategory.parse("BINDINGS"));
        assertThrows(IllegalArgumentException.class, () -> TraceCategory.parse("nothing"));
        assertEquals("com.mastfrog.desugar.trace.placement", TraceCategory.PLACEMENT.loggerName());
    }

    @Test
    public void testDisabledCategoriesDoNotBuildMessages() {
        Trace trace = Trace.of(EnumSet.of(TraceCategory.CLOSURE));
        assertTrue(trace.isEnabled(TraceCategory.CLOSURE));
        assertFalse(trace.isEnabled(TraceCategory.DISPATCH));
        AtomicBoolean called = new AtomicBoolean();
        trace.trace(TraceCategory.DISPATCH, () -> {
            called.set(true);
            return "x";
        });
        assertFalse(called.get());
        assertSame(Trace.none(), Trace.of(EnumSet.noneOf(TraceCategory.class)));
        assertTrue(Trace.none().categories().isEmpty());
    }

    @Test
    public void testEnabledCategoryLogsAtFine() {
        Logger logger = Logger.getLogger(TraceCategory.CAPTURES.loggerName());
        List<LogRecord> records = new ArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        Level old = logger.getLevel();
        logger.setLevel(Level.FINE);
        logger.addHandler(handler);
        try {
            Trace trace = Trace.of(EnumSet.of(TraceCategory.CAPTURES));
            trace.trace(TraceCategory.CAPTURES, "%s as %s", "a", "int");
            trace.trace(TraceCategory.CLOSURE, "ignored");
            assertEquals(1, records.size());
            assertEquals(Level.FINE, records.get(0).getLevel());
            assertEquals("a as int", records.get(0).getMessage());
        } finally {
            logger.removeHandler(handler);
            logger.setLevel(old);
        }
    }
}
