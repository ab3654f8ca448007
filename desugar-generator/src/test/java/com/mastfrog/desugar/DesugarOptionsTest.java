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
package com.mastfrog.desugar;

import com.mastfrog.desugar.format.DefaultPrototypeFormatter;
import com.mastfrog.desugar.format.DefaultTypeNamer;
import com.mastfrog.desugar.format.PrototypeFormatter;
import com.mastfrog.desugar.output.CppOutputSettings;
import com.mastfrog.desugar.trace.TraceCategory;
import java.util.EnumSet;
import java.util.Properties;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

public class DesugarOptionsTest {

    @Test
    public void testDefaults() {
        DesugarOptions opts = DesugarOptions.defaults();
        assertEquals(CppOutputSettings.DEFAULT_INDENT, opts.outputSettings().indentBy());
        assertTrue(opts.traceCategories().isEmpty());
        assertTrue(opts.typeNamer() instanceof DefaultTypeNamer);
        assertTrue(opts.prototypeFormatter() instanceof DefaultPrototypeFormatter);
        assertSame(opts, new Desugarer().options());
    }

    @Test
    public void testFromProperties() {
        Properties props = new Properties();
        props.setProperty(DesugarOptions.INDENT_PROPERTY, " 4 ");
        props.setProperty(DesugarOptions.TRACE_PROPERTY, "closure, bindings,,");
        DesugarOptions opts = DesugarOptions.fromProperties(props);
        assertEquals(4, opts.outputSettings().indentBy());
        assertEquals(EnumSet.of(TraceCategory.CLOSURE, TraceCategory.BINDINGS), opts.traceCategories());
        assertEquals(CppOutputSettings.DEFAULT_INDENT,
                DesugarOptions.fromProperties(new Properties()).outputSettings().indentBy());
    }

    @Test
    public void testBadPropertiesRejected() {
        Properties badIndent = new Properties();
        badIndent.setProperty(DesugarOptions.INDENT_PROPERTY, "wide");
        assertThrows(IllegalArgumentException.class, () -> DesugarOptions.fromProperties(badIndent));
        Properties negative = new Properties();
        negative.setProperty(DesugarOptions.INDENT_PROPERTY, "-1");
        assertThrows(IllegalArgumentException.class, () -> DesugarOptions.fromProperties(negative));
        Properties badTrace = new Properties();
        badTrace.setProperty(DesugarOptions.TRACE_PROPERTY, "closure,everything");
        assertThrows(IllegalArgumentException.class, () -> DesugarOptions.fromProperties(badTrace));
    }

    @Test
    public void testToBuilderKeepsConfiguration() {
        PrototypeFormatter custom = new DefaultPrototypeFormatter(new DefaultTypeNamer());
        DesugarOptions opts = DesugarOptions.builder().indentBy(3).prototypeFormatter(custom)
                .trace(TraceCategory.DISPATCH).build();
        DesugarOptions copy = opts.toBuilder().trace(TraceCategory.PLACEMENT).build();
        assertEquals(3, copy.outputSettings().indentBy());
        assertSame(custom, copy.prototypeFormatter());
        assertEquals(EnumSet.of(TraceCategory.DISPATCH, TraceCategory.PLACEMENT), copy.traceCategories());
        assertEquals(EnumSet.of(TraceCategory.DISPATCH), opts.traceCategories());
        assertThrows(UnsupportedOperationException.class, () -> opts.traceCategories().add(TraceCategory.CLOSURE));
    }
}
