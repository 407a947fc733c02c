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

package org.qrewrite.circuitCompiler.compiler.errors;

/**
 * Exception thrown when compilation cannot proceed.
 */
public class CompilationError extends RuntimeException {
    /** Index of the gate in the input circuit that caused the error, or -1. */
    public final int gateIndex;

    public CompilationError(String message, int gateIndex) {
        super(message);
        this.gateIndex = gateIndex;
    }

    public CompilationError(String message) {
        this(message, -1);
    }

    public CompilationError(String message, Throwable cause) {
        super(message, cause);
        this.gateIndex = -1;
    }

    /**
     * Short description of the kind of error, used when reporting it.
     */
    public String getErrorType() {
        return "Compilation error";
    }
}
