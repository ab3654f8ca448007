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
package com.mastfrog.desugar.format;

import com.mastfrog.desugar.ast.TemplateArgument;
import com.mastfrog.desugar.ast.decl.FunctionDecl;
import com.mastfrog.desugar.ast.decl.ParmVarDecl;
import com.mastfrog.desugar.output.OutputBuffer;
import static com.mastfrog.desugar.output.util.Utils.commaSeparated;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.List;

/**
 * Writes <code>inline static constexpr int add(int a, int b) noexcept</code>
 * style signatures, spelling types through a {@link TypeNamer}.
 */
public class DefaultPrototypeFormatter implements PrototypeFormatter {

    private final TypeNamer namer;

    public DefaultPrototypeFormatter(TypeNamer namer) {
        this.namer = notNull("namer", namer);
    }

    @Override
    public void formatPrototype(OutputBuffer out, FunctionDecl function) {
        if (function.isInline()) {
            out.append("inline ");
        }
        if (function.isStatic()) {
            out.append("static ");
        }
        if (function.isConstexpr()) {
            out.append("constexpr ");
        }
        out.append(namer.namePrefix(function.returnType()), function.name());
        List<TemplateArgument> args = function.templateArguments();
        if (!args.isEmpty()) {
            out.append('<');
            commaSeparated(out, args, arg -> appendArgument(out, arg));
            out.append(out.lastChar() == '>' ? " >" : ">");
        }
        out.append('(');
        formatParameters(out, function.parameters());
        out.append(')');
        if (function.isNoexcept()) {
            out.append(" noexcept");
        }
    }

    private void appendArgument(OutputBuffer out, TemplateArgument arg) {
        switch (arg.kind()) {
            case TYPE:
            case NULL_POINTER:
                out.append(namer.name(arg.asType()));
                break;
            case DECLARATION:
                out.append(namer.nameAsFunctionPointer(arg.asDeclaration().type()));
                break;
            case INTEGRAL:
                out.append(arg.asIntegral().toString());
                break;
            case TEMPLATE:
            case TEMPLATE_EXPANSION:
                out.append(arg.asTemplateName());
                break;
            case PACK:
                commaSeparated(out, arg.packElements(), el -> appendArgument(out, el));
                break;
            default:
                // expressions need a code generator to be spelled
                out.blockComment(arg.kind().name());
        }
    }

    @Override
    public void formatParameters(OutputBuffer out, List<? extends ParmVarDecl> parameters) {
        commaSeparated(out, parameters, p -> out.append(namer.nameAsParameter(p.type(), p.name())));
    }
}
