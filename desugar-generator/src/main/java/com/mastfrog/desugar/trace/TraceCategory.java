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

import java.util.Locale;

/**
 * Independently switchable areas of generator tracing.
 */
public enum TraceCategory {
    DISPATCH,
    CLOSURE,
    CAPTURES,
    PLACEMENT,
    BINDINGS;

    /**
     * The name of the logger this category writes to.
     *
     * @return A logger name
     */
    public String loggerName() {
        return "com.mastfrog.desugar.trace." + name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a category name, ignoring case and surrounding whitespace.
     *
     * @param name A name
     * @return A category
     * @throws IllegalArgumentException if the name matches no category
     */
    public static TraceCategory parse(String name) {
        String n = name.trim().toUpperCase(Locale.ROOT);
        for (TraceCategory c : values()) {
            if (c.name().equals(n)) {
                return c;
            }
        }
        throw new IllegalArgumentException("No trace category '" + name + "'");
    }
}
