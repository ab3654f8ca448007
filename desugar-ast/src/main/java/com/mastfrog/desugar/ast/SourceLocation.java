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
package com.mastfrog.desugar.ast;

import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.Objects;

/**
 * Position of a node in the original source; used to derive stable names for
 * synthesized entities.
 */
public final class SourceLocation implements Comparable<SourceLocation> {

    public static final SourceLocation UNKNOWN = new SourceLocation("", 0, 0);
    private final String file;
    private final int line;
    private final int column;

    public SourceLocation(String file, int line, int column) {
        this.file = notNull("file", file);
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("Negative position " + line + ":" + column);
        }
        this.line = line;
        this.column = column;
    }

    public static SourceLocation at(int line, int column) {
        return new SourceLocation("input.cpp", line, column);
    }

    public String file() {
        return file;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public int compareTo(SourceLocation o) {
        int result = file.compareTo(o.file);
        if (result == 0) {
            result = Integer.compare(line, o.line);
        }
        if (result == 0) {
            result = Integer.compare(column, o.column);
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        } else if (o == null || o.getClass() != SourceLocation.class) {
            return false;
        }
        SourceLocation other = (SourceLocation) o;
        return line == other.line && column == other.column && file.equals(other.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, column);
    }

    @Override
    public String toString() {
        return isKnown() ? file + ":" + line + ":" + column : "<unknown>";
    }
}
