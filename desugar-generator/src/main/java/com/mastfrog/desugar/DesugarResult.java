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

import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The output of one generation pass.
 */
public final class DesugarResult {

    private final String text;
    private final List<Diagnostic> diagnostics;

    public DesugarResult(String text, List<Diagnostic> diagnostics) {
        this.text = notNull("text", text);
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public String text() {
        return text;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    /**
     * Whether the pass rendered everything without a diagnostic.
     *
     * @return true if there are no diagnostics
     */
    public boolean isClean() {
        return diagnostics.isEmpty();
    }

    public boolean hasErrors() {
        for (Diagnostic d : diagnostics) {
            if (d.severity() == Diagnostic.Severity.ERROR) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return text;
    }
}
