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

import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Structured tracing for a generation pass. Each category logs at
 * <code>FINE</code> to its own logger, and only when enabled for the pass;
 * messages are built lazily so disabled tracing costs a set lookup.
 */
public final class Trace {

    private static final Trace NONE = new Trace(EnumSet.noneOf(TraceCategory.class));
    private final Set<TraceCategory> enabled;
    private final Map<TraceCategory, Logger> loggers = new EnumMap<>(TraceCategory.class);

    private Trace(Set<TraceCategory> enabled) {
        this.enabled = Collections.unmodifiableSet(enabled);
        for (TraceCategory c : enabled) {
            loggers.put(c, Logger.getLogger(c.loggerName()));
        }
    }

    public static Trace none() {
        return NONE;
    }

    public static Trace of(Set<TraceCategory> categories) {
        notNull("categories", categories);
        if (categories.isEmpty()) {
            return NONE;
        }
        return new Trace(EnumSet.copyOf(categories));
    }

    public boolean isEnabled(TraceCategory category) {
        return enabled.contains(category);
    }

    public Set<TraceCategory> categories() {
        return enabled;
    }

    public void trace(TraceCategory category, Supplier<String> message) {
        if (enabled.contains(category)) {
            Logger logger = loggers.get(category);
            if (logger.isLoggable(Level.FINE)) {
                logger.fine(message.get());
            }
        }
    }

    public void trace(TraceCategory category, String format, Object... args) {
        if (enabled.contains(category)) {
            Logger logger = loggers.get(category);
            if (logger.isLoggable(Level.FINE)) {
                logger.fine(String.format(format, args));
            }
        }
    }

    @Override
    public String toString() {
        return "Trace" + enabled;
    }
}
