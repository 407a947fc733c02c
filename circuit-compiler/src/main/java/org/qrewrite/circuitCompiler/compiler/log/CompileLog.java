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

package org.qrewrite.circuitCompiler.compiler.log;

import org.qrewrite.util.IndentStream;

import java.io.Writer;
import java.util.List;

/**
 * Trace of a compilation: messages emitted by rules, indented
 * according to the nesting of composite rules.
 * One instance is used per compilation; it is passed to every rule together with the DAG.
 * The log only observes the compilation, it never influences it.
 */
public class CompileLog {
    /** Nothing is shown. */
    public static final int SILENT = 0;
    /** One summary line per composite rule. */
    public static final int SUMMARY = 1;
    /** The result of every child rule in every round. */
    public static final int STATE = 2;

    private final IndentStream stream;

    public CompileLog(Appendable output) {
        this.stream = new IndentStream(output).setIndentAmount(2);
    }

    /**
     * A log that writes to standard error.
     */
    public CompileLog() {
        this(System.err);
    }

    /**
     * A log that writes to the specified output.
     */
    public static CompileLog to(Appendable output) {
        return new CompileLog(output);
    }

    /**
     * A log that discards everything.
     */
    public static CompileLog silent() {
        return new CompileLog(Writer.nullWriter());
    }

    /**
     * Current nesting depth.
     */
    public int getDepth() {
        return this.stream.getIndent();
    }

    /**
     * Write a message if its level is enabled.
     * @param message    Message to write, without a newline.
     * @param level      Level of the message; 0 messages are never shown.
     * @param threshold  Display level of the rule emitting the message.
     * @return           True if the message was written.
     */
    public boolean log(String message, int level, int threshold) {
        if (level <= SILENT || level > threshold)
            return false;
        this.stream.append(message).newline();
        return true;
    }

    /**
     * Enter a nested scope; the previous depth is restored when the scope is closed.
     * Use with try-with-resources.
     */
    public Indentation indent() {
        return new Indentation(this.stream);
    }

    /**
     * Scope of one level of indentation.
     */
    public static final class Indentation implements AutoCloseable {
        private final IndentStream stream;
        private final int saved;
        private boolean closed;

        Indentation(IndentStream stream) {
            this.stream = stream;
            this.saved = stream.getIndent();
            this.closed = false;
            stream.increase();
        }

        @Override
        public void close() {
            if (this.closed)
                return;
            this.closed = true;
            this.stream.setIndent(this.saved);
        }
    }

    /** Render the per-child outcome of a round, e.g. "[true, false]". */
    public static String showState(List<Boolean> states) {
        return states.toString();
    }
}
