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

package org.qrewrite.circuitCompiler.compiler;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import javax.annotation.Nullable;

/**
 * Packages options for the circuit compiler.
 */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class CompilerOptions {
    /**
     * Options for the rewriting rules.
     */
    @SuppressWarnings("CanBeFinal")
    public static class Optimizer {
        @Parameter(names = "-p", description = "Rule set to apply: decompose, cz, or simplify")
        public String preset = "decompose";
        @Parameter(names = "-r", description = "Maximum number of rounds of saturating rules; 0 means unlimited")
        public int maxRounds = 0;
        @Parameter(names = "--validate", description = "Check the DAG invariants after rewriting")
        public boolean validate = false;
    }

    /**
     * Options related to input and output.
     */
    @SuppressWarnings("CanBeFinal")
    public static class IO {
        @Parameter(names = "-o", description = "Output file; stdout if null")
        @Nullable
        public String outputFile = null;
        @Parameter(names = "-t", description = "Emit a textual rendering of the circuit instead of JSON")
        public boolean emitText = false;
        @Parameter(names = "-je", description = "Emit error messages as JSON")
        public boolean emitJsonErrors = false;
        @Parameter(names = "-l", description = "Trace level of the rules: 0, 1, or 2")
        public int logLevel = 0;
        @Parameter(description = "Input file to compile; stdin if missing")
        @Nullable
        public String inputFile = null;
    }

    @Parameter(names = {"-h", "--help", "-"}, help = true, description = "Show this message and exit")
    public boolean help;
    @ParametersDelegate
    public IO ioOptions = new IO();
    @ParametersDelegate
    public Optimizer optimizerOptions = new Optimizer();
}
