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

package org.qrewrite.circuitCompiler.compiler.rules;

import org.qrewrite.circuitCompiler.compiler.log.CompileLog;
import org.qrewrite.circuitCompiler.dag.DAGCircuit;

/**
 * A transformation of a {@link DAGCircuit}.
 *
 * <p>A rule that returns false from {@link #apply} must have left the DAG unchanged,
 * and must keep returning false if it is applied again to the same DAG.
 * Composite rules rely on this to terminate.
 * Rules may be reused for many DAGs; they must not keep state between calls.
 */
public interface ICompilerRule {
    /**
     * Name of the rule, used only in diagnostics.
     */
    String getName();

    /**
     * Apply the rule to a DAG, modifying it in place.
     * @param dag  DAG to rewrite.
     * @param log  Trace of the current compilation.
     * @return     True if the DAG was changed.
     */
    boolean apply(DAGCircuit dag, CompileLog log);

    default boolean apply(DAGCircuit dag) {
        return this.apply(dag, CompileLog.silent());
    }

    /**
     * The highest level of the log messages displayed by this rule.
     */
    int getLogLevel();

    /**
     * Set the display level of this rule only.
     */
    ICompilerRule setLogLevel(int level);

    /**
     * Set the display level of this rule and of all rules nested inside it.
     */
    default ICompilerRule setAllLogLevel(int level) {
        return this.setLogLevel(level);
    }

    void accept(RuleVisitor visitor);
}
