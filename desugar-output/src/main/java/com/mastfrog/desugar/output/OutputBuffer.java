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
package com.mastfrog.desugar.output;

import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Essentially, a smart StringBuilder that knows how to indent, open and close
 * brace-delimited scopes, and splice in the contents of other buffers.
 * Indentation is written lazily, when the first character lands on a fresh
 * line, so that a buffer spliced in at the start of a line picks up its own
 * indentation rather than the target's.
 */
public final class OutputBuffer {

    private final OutputSettings settings;
    private final StringBuilder sb = new StringBuilder(4096);
    private final Deque<Integer> scopes = new ArrayDeque<>();
    private int currIndent;

    public OutputBuffer(OutputSettings settings) {
        this.settings = notNull("settings", settings);
    }

    public OutputBuffer() {
        this(new CppOutputSettings());
    }

    public OutputBuffer(int indentBy) {
        this(new CppOutputSettings(indentBy));
    }

    /**
     * Create an empty buffer with the same settings and current indentation
     * level as this one, for staging text which will later be inserted into
     * this buffer.
     *
     * @return A new buffer
     */
    public OutputBuffer newStagedBuffer() {
        OutputBuffer result = new OutputBuffer(settings);
        result.currIndent = currIndent;
        return result;
    }

    public OutputSettings settings() {
        return settings;
    }

    public int indentBy() {
        return settings.indentBy();
    }

    public int indentLevel() {
        return currIndent;
    }

    /**
     * The number of scopes opened with <code>openScope()</code> which have not
     * yet been closed.
     *
     * @return A count
     */
    public int openScopes() {
        return scopes.size();
    }

    public boolean isEmpty() {
        return sb.length() == 0;
    }

    public int currentPosition() {
        return sb.length();
    }

    /**
     * The offset of the first character of the line currently being written.
     *
     * @return An offset
     */
    public int lineStartPosition() {
        int ix = sb.lastIndexOf("\n");
        return ix < 0 ? 0 : ix + 1;
    }

    public boolean isAtLineStart() {
        return sb.length() == 0 || sb.charAt(sb.length() - 1) == '\n';
    }

    public char lastChar() {
        return sb.length() == 0 ? 0 : sb.charAt(sb.length() - 1);
    }

    private char[] indentChars() {
        char[] c = new char[currIndent * indentBy()];
        Arrays.fill(c, ' ');
        return c;
    }

    private void write(char c) {
        if (c == '\n') {
            trimTrailingSpaces();
        } else if (isAtLineStart()) {
            sb.append(indentChars());
        }
        sb.append(c);
    }

    private void write(CharSequence seq) {
        for (int i = 0; i < seq.length(); i++) {
            write(seq.charAt(i));
        }
    }

    private void trimTrailingSpaces() {
        int len = sb.length();
        while (len > 0 && sb.charAt(len - 1) == ' ') {
            len--;
        }
        sb.setLength(len);
    }

    public OutputBuffer append(char c) {
        write(c);
        return this;
    }

    public OutputBuffer append(CharSequence... fragments) {
        for (CharSequence f : fragments) {
            write(notNull("fragment", f));
        }
        return this;
    }

    public OutputBuffer appendNewLine(CharSequence... fragments) {
        append(fragments);
        write('\n');
        return this;
    }

    public OutputBuffer appendNewLine(char c) {
        write(c);
        write('\n');
        return this;
    }

    /**
     * Move to a fresh line, unless the buffer is empty or already on one.
     *
     * @return this
     */
    public OutputBuffer ensureNewLine() {
        if (!isAtLineStart()) {
            write('\n');
        }
        return this;
    }

    /**
     * Make the next line written follow an empty line, unless the buffer is
     * empty or one is already there.
     *
     * @return this
     */
    public OutputBuffer blankLine() {
        ensureNewLine();
        int len = sb.length();
        if (len > 1 && sb.charAt(len - 2) != '\n') {
            write('\n');
        }
        return this;
    }

    public OutputBuffer blockComment(CharSequence... fragments) {
        append(settings.blockCommentOpen());
        append(fragments);
        return append(settings.blockCommentClose());
    }

    /**
     * Open a brace-delimited scope on its own line; everything written until
     * the matching close is indented one level further.
     *
     * @return this
     */
    public OutputBuffer openScope() {
        ensureNewLine();
        write(settings.blockOpen());
        scopes.push(currIndent);
        currIndent++;
        write('\n');
        return this;
    }

    public OutputBuffer closeScope() {
        return closeScope(true);
    }

    /**
     * Close the most recently opened scope.
     *
     * @param newLineBefore If true, move to a fresh line before writing the
     * closing brace if not already on one
     * @return this
     */
    public OutputBuffer closeScope(boolean newLineBefore) {
        if (scopes.isEmpty()) {
            throw new IllegalStateException("No open scope to close in " + this);
        }
        if (newLineBefore) {
            ensureNewLine();
        }
        currIndent = scopes.pop();
        write(settings.blockClose());
        return this;
    }

    /**
     * Close open scopes until only the given number remain; used to restore
     * balance after the emission of a region was abandoned part way.
     *
     * @param depth The number of scopes which should stay open
     * @return The number of scopes closed
     */
    public int closeScopesTo(int depth) {
        if (depth < 0 || depth > scopes.size()) {
            throw new IllegalArgumentException("Cannot unwind " + scopes.size()
                    + " open scopes to " + depth);
        }
        int result = 0;
        while (scopes.size() > depth) {
            closeScope();
            write('\n');
            result++;
        }
        return result;
    }

    public OutputBuffer closeScopeWithSemicolon() {
        closeScope();
        write(settings.statementTerminator());
        return this;
    }

    /**
     * Terminate the current statement and move to a fresh line.
     *
     * @return this
     */
    public OutputBuffer endStatement() {
        write(settings.statementTerminator());
        write('\n');
        return this;
    }

    /**
     * Insert the contents of another buffer at a position in this one. The
     * other buffer must have no open scopes.
     *
     * @param position The offset
     * @param other Another buffer
     * @return this
     */
    public OutputBuffer insertAt(int position, OutputBuffer other) {
        notNull("other", other);
        if (position < 0 || position > sb.length()) {
            throw new IllegalArgumentException("Bad position " + position
                    + " for buffer of length " + sb.length());
        }
        if (other.openScopes() != 0) {
            throw new IllegalStateException("Splicing a buffer with "
                    + other.openScopes() + " unclosed scopes");
        }
        sb.insert(position, other.sb);
        return this;
    }

    public OutputBuffer appendStringLiteral(String prefix, String literal) {
        return append(prefix, settings.stringLiteralQuote(),
                settings.escapeStringLiteral(literal),
                settings.stringLiteralQuote());
    }

    public static String escape(String literal) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\b':
                    sb.append("\\b");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                case '\f':
                    sb.append("\\f");
                    break;
                case 0x07:
                    sb.append("\\a");
                    break;
                case 0x0B:
                    sb.append("\\v");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                default:
                    if (c < 0x20 || c == 0x7F) {
                        // octal escapes stop after three digits, hex ones do not
                        sb.append('\\').append(String.format("%03o", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
