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
package com.mastfrog.desugar.generator;

import com.mastfrog.desugar.DesugarException;
import com.mastfrog.desugar.DesugarOptions;
import com.mastfrog.desugar.Diagnostic;
import com.mastfrog.desugar.ast.Node;
import com.mastfrog.desugar.format.PrototypeFormatter;
import com.mastfrog.desugar.format.TypeNamer;
import com.mastfrog.desugar.lambda.LambdaStack;
import com.mastfrog.desugar.naming.InternalNames;
import com.mastfrog.desugar.output.OutputBuffer;
import com.mastfrog.desugar.trace.Trace;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * State owned by a single generation pass: the root output buffer, the
 * lambda stack, issued internal names and collected diagnostics. Nothing
 * here outlives the pass.
 */
public final class GenerationPass {

    private static final Logger LOG = Logger.getLogger(GenerationPass.class.getName());
    private final DesugarOptions options;
    private final OutputBuffer output;
    private final Trace trace;
    private final LambdaStack lambdas;
    private final InternalNames names = new InternalNames();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public GenerationPass(DesugarOptions options) {
        this.options = notNull("options", options);
        this.output = new OutputBuffer(options.outputSettings());
        this.trace = Trace.of(options.traceCategories());
        this.lambdas = new LambdaStack(trace);
    }

    public DesugarOptions options() {
        return options;
    }

    public OutputBuffer output() {
        return output;
    }

    public Trace trace() {
        return trace;
    }

    public LambdaStack lambdas() {
        return lambdas;
    }

    public InternalNames names() {
        return names;
    }

    public TypeNamer types() {
        return options.typeNamer();
    }

    public PrototypeFormatter prototypes() {
        return options.prototypeFormatter();
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Record a construct that was rendered as a placeholder.
     *
     * @param node The node
     * @param message What happened
     */
    public void warn(Node node, String message) {
        Diagnostic d = new Diagnostic(Diagnostic.Severity.WARNING, message,
                node == null ? null : node.kind(), node == null ? null : node.location());
        diagnostics.add(d);
        LOG.log(Level.WARNING, "{0}", d);
    }

    /**
     * Record a structural failure which abandoned the emission of a
     * statement or declaration.
     *
     * @param ex The failure
     * @param at The statement or declaration that was abandoned
     */
    public void error(DesugarException ex, Node at) {
        Node node = ex.node() == null ? at : ex.node();
        Diagnostic d = new Diagnostic(Diagnostic.Severity.ERROR, ex.getMessage(),
                node == null ? null : node.kind(), node == null ? null : node.location());
        diagnostics.add(d);
        LOG.log(Level.WARNING, "Abandoned emission of " + at, ex);
    }
}
