/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.qrewrite.util;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * An output stream which keeps track of an indentation level.
 * Every line emitted after a newline is prefixed with the current indentation.
 */
public class IndentStream {
    private Appendable stream;
    int indentAmount;
    int indent;
    boolean emitIndentation;

    public IndentStream(Appendable appendable) {
        this.stream = appendable;
        this.indentAmount = 4;
        this.indent = 0;
        this.emitIndentation = true;
    }

    public IndentStream setIndentAmount(int amount) {
        this.indentAmount = amount;
        return this;
    }

    /**
     * Change the stream where the output is written.
     * @return The previous stream.
     */
    public Appendable setOutputStream(Appendable appendable) {
        Appendable result = this.stream;
        this.stream = appendable;
        return result;
    }

    public int getIndent() {
        return this.indent;
    }

    /**
     * Set the indentation level, in steps.  Used to restore a saved level.
     */
    public IndentStream setIndent(int indent) {
        if (indent < 0)
            throw new IllegalArgumentException("Negative indentation " + indent);
        this.indent = indent;
        return this;
    }

    public IndentStream newline() {
        return this.append("\n");
    }

    public IndentStream increase() {
        this.indent++;
        return this;
    }

    public IndentStream decrease() {
        if (this.indent == 0)
            throw new IllegalStateException("Indentation is already 0");
        this.indent--;
        return this;
    }

    private void write(CharSequence data) {
        try {
            this.stream.append(data);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public IndentStream append(String string) {
        int start = 0;
        for (int i = 0; i < string.length(); i++) {
            if (string.charAt(i) == '\n') {
                if (i > start)
                    this.emitLine(string.substring(start, i));
                this.write("\n");
                this.emitIndentation = true;
                start = i + 1;
            }
        }
        if (start < string.length())
            this.emitLine(string.substring(start));
        return this;
    }

    private void emitLine(String fragment) {
        if (this.emitIndentation) {
            this.write(" ".repeat(this.indent * this.indentAmount));
            this.emitIndentation = false;
        }
        this.write(fragment);
    }

    public IndentStream append(int value) {
        return this.append(Integer.toString(value));
    }

    public IndentStream append(long value) {
        return this.append(Long.toString(value));
    }

    public IndentStream append(boolean value) {
        return this.append(Boolean.toString(value));
    }

    public IndentStream append(Object value) {
        return this.append(String.valueOf(value));
    }

    public <T> IndentStream join(String separator, Iterable<T> data) {
        boolean first = true;
        for (T d: data) {
            if (!first)
                this.append(separator);
            first = false;
            this.append(d);
        }
        return this;
    }

    @Override
    public String toString() {
        return this.stream.toString();
    }
}
