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

import com.mastfrog.desugar.ast.NodeKind;
import com.mastfrog.desugar.ast.SourceLocation;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.Objects;

/**
 * Something a generation pass could not render faithfully.
 */
public final class Diagnostic {

    private final Severity severity;
    private final String message;
    private final NodeKind kind;
    private final SourceLocation location;

    public Diagnostic(Severity severity, String message, NodeKind kind, SourceLocation location) {
        this.severity = notNull("severity", severity);
        this.message = notNull("message", message);
        this.kind = kind;
        this.location = location == null ? SourceLocation.UNKNOWN : location;
    }

    public Severity severity() {
        return severity;
    }

    public String message() {
        return message;
    }

    /**
     * The kind of the node the problem was found at.
     *
     * @return A kind, or null if not tied to a node
     */
    public NodeKind kind() {
        return kind;
    }

    public SourceLocation location() {
        return location;
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        } else if (!(o instanceof Diagnostic)) {
            return false;
        }
        Diagnostic d = (Diagnostic) o;
        return severity == d.severity && kind == d.kind
                && message.equals(d.message) && location.equals(d.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, message, kind, location);
    }

    @Override
    public String toString() {
        return severity + " " + location + (kind == null ? "" : " " + kind.displayName())
                + ": " + message;
    }

    public enum Severity {
        WARNING,
        ERROR
    }
}
