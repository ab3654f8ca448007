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

import com.mastfrog.desugar.ast.Node;
import com.mastfrog.desugar.generator.CodeGenerator;
import com.mastfrog.desugar.generator.GenerationPass;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Renders syntax trees as the equivalent C++ with the compiler's implicit
 * work written out: closure classes for lambdas, explicit casts, expanded
 * range-for loops and structured bindings, guarded function-local statics.
 * <p>
 * Instances are immutable and may be shared; each call to
 * {@link #desugar(List)} is an independent pass with its own state.
 * </p>
 */
public final class Desugarer {

    private static final Logger LOG = Logger.getLogger(Desugarer.class.getName());
    private final DesugarOptions options;

    public Desugarer(DesugarOptions options) {
        this.options = notNull("options", options);
    }

    public Desugarer() {
        this(DesugarOptions.defaults());
    }

    public DesugarOptions options() {
        return options;
    }

    public DesugarResult desugar(Node... nodes) {
        return desugar(Arrays.asList(nodes));
    }

    /**
     * Render a sequence of top-level nodes, in order.
     *
     * @param nodes The nodes
     * @return The rendered text and any diagnostics
     */
    public DesugarResult desugar(List<? extends Node> nodes) {
        notNull("nodes", nodes);
        GenerationPass pass = new GenerationPass(options);
        CodeGenerator gen = new CodeGenerator(pass, pass.output());
        for (Node node : nodes) {
            gen.emitStatement(notNull("node", node));
        }
        if (!pass.lambdas().isEmpty()) {
            throw new IllegalStateException(pass.lambdas().depth()
                    + " lambda contexts still open after generation");
        }
        if (pass.output().openScopes() != 0) {
            throw new IllegalStateException(pass.output().openScopes()
                    + " scopes still open after generation");
        }
        DesugarResult result = new DesugarResult(pass.output().toString(), pass.diagnostics());
        if (LOG.isLoggable(Level.FINE)) {
            LOG.log(Level.FINE, "Rendered {0} nodes to {1} characters with {2} diagnostics",
                    new Object[]{nodes.size(), result.text().length(), result.diagnostics().size()});
        }
        return result;
    }
}
