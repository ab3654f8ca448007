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
import com.mastfrog.desugar.format.TypeNamer;
import com.mastfrog.desugar.output.CppOutputSettings;
import com.mastfrog.desugar.output.OutputSettings;
import com.mastfrog.desugar.trace.TraceCategory;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Properties;
import java.util.Set;

/**
 * Immutable configuration of a {@link Desugarer}: output formatting, the
 * collaborators that spell types and signatures, and which trace categories
 * are logged.
 */
public final class DesugarOptions {

    public static final String INDENT_PROPERTY = "desugar.indent";
    public static final String TRACE_PROPERTY = "desugar.trace";
    private static final DesugarOptions DEFAULTS = builder().build();
    private final OutputSettings outputSettings;
    private final TypeNamer typeNamer;
    private final PrototypeFormatter prototypeFormatter;
    private final PrototypeFormatter configuredFormatter;
    private final Set<TraceCategory> trace;

    private DesugarOptions(Builder b) {
        this.outputSettings = b.outputSettings;
        this.typeNamer = b.typeNamer;
        this.configuredFormatter = b.prototypeFormatter;
        this.prototypeFormatter = b.prototypeFormatter == null
                ? new DefaultPrototypeFormatter(b.typeNamer)
                : b.prototypeFormatter;
        this.trace = Collections.unmodifiableSet(EnumSet.copyOf(b.trace));
    }

    public static DesugarOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Options configured from the system properties
     * <code>desugar.indent</code> and <code>desugar.trace</code>.
     *
     * @return Options
     */
    public static DesugarOptions fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Options configured from <code>desugar.indent</code>, the number of
     * spaces per indent level, and <code>desugar.trace</code>, a
     * comma-delimited list of trace categories, in a set of properties.
     *
     * @param props Properties
     * @return Options
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static DesugarOptions fromProperties(Properties props) {
        notNull("props", props);
        Builder b = builder();
        String indent = props.getProperty(INDENT_PROPERTY);
        if (indent != null && !indent.trim().isEmpty()) {
            try {
                b.indentBy(Integer.parseInt(indent.trim()));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Bad value for " + INDENT_PROPERTY
                        + ": '" + indent + "'", ex);
            }
        }
        String trace = props.getProperty(TRACE_PROPERTY);
        if (trace != null) {
            for (String item : trace.split(",")) {
                if (!item.trim().isEmpty()) {
                    b.trace(TraceCategory.parse(item));
                }
            }
        }
        return b.build();
    }

    public OutputSettings outputSettings() {
        return outputSettings;
    }

    public TypeNamer typeNamer() {
        return typeNamer;
    }

    public PrototypeFormatter prototypeFormatter() {
        return prototypeFormatter;
    }

    public Set<TraceCategory> traceCategories() {
        return trace;
    }

    /**
     * Create a builder initialized from this instance.
     *
     * @return A builder
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.outputSettings = outputSettings;
        b.typeNamer = typeNamer;
        b.prototypeFormatter = configuredFormatter;
        b.trace.addAll(trace);
        return b;
    }

    @Override
    public String toString() {
        return "DesugarOptions(" + outputSettings + ", " + typeNamer.getClass().getSimpleName()
                + ", " + prototypeFormatter.getClass().getSimpleName() + ", trace=" + trace + ")";
    }

    public static final class Builder {

        private final Set<TraceCategory> trace = EnumSet.noneOf(TraceCategory.class);
        private OutputSettings outputSettings = new CppOutputSettings();
        private TypeNamer typeNamer = new DefaultTypeNamer();
        private PrototypeFormatter prototypeFormatter;

        Builder() {
        }

        public Builder indentBy(int spaces) {
            this.outputSettings = new CppOutputSettings(spaces);
            return this;
        }

        public Builder outputSettings(OutputSettings settings) {
            this.outputSettings = notNull("settings", settings);
            return this;
        }

        public Builder typeNamer(TypeNamer namer) {
            this.typeNamer = notNull("namer", namer);
            return this;
        }

        /**
         * Set the prototype formatter; if never called, a
         * {@link DefaultPrototypeFormatter} using the type namer is used.
         *
         * @param formatter A formatter
         * @return this
         */
        public Builder prototypeFormatter(PrototypeFormatter formatter) {
            this.prototypeFormatter = notNull("formatter", formatter);
            return this;
        }

        public Builder trace(TraceCategory first, TraceCategory... more) {
            trace.add(notNull("first", first));
            for (TraceCategory c : more) {
                trace.add(notNull("category", c));
            }
            return this;
        }

        public DesugarOptions build() {
            return new DesugarOptions(this);
        }
    }
}
