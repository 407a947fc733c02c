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
import org.qrewrite.util.Linq;

import java.util.List;

/**
 * Applies a list of rules repeatedly until a fixpoint is reached.
 * Each round applies every rule once, in order, like a {@link SequentialCompiler};
 * the compiler stops after the first round in which no rule changed the DAG.
 * The result is true if any round changed the DAG.
 *
 * <p>Termination relies on every child rule eventually returning false.
 * An optional limit on the number of rounds can be set; 0 means no limit.
 */
public class KroneckerSeqCompiler extends SequentialCompiler {
    public final int maxRounds;

    public KroneckerSeqCompiler(String name, List<? extends ICompilerRule> children, int maxRounds) {
        super(name, children);
        if (maxRounds < 0)
            throw new IllegalArgumentException("Negative round limit " + maxRounds);
        this.maxRounds = maxRounds;
    }

    public KroneckerSeqCompiler(String name, List<? extends ICompilerRule> children) {
        this(name, children, 0);
    }

    public KroneckerSeqCompiler(List<? extends ICompilerRule> children) {
        this("KroneckerSeqCompiler", children);
    }

    public KroneckerSeqCompiler(ICompilerRule... children) {
        this(Linq.list(children));
    }

    @Override
    public boolean apply(DAGCircuit dag, CompileLog log) {
        this.logStart(log);
        boolean compiled = false;
        int rounds = 0;
        try (CompileLog.Indentation ignored = log.indent()) {
            while (true) {
                if (this.maxRounds > 0 && rounds == this.maxRounds) {
                    log.log(this.name + ": stopping after " + rounds + " rounds without reaching a fixpoint.",
                            CompileLog.SUMMARY, this.logLevel);
                    break;
                }
                List<Boolean> states = this.applyChildren(dag, log);
                rounds++;
                if (Linq.any(states, s -> s))
                    compiled = true;
                else
                    break;
            }
        }
        this.logEnd(log, compiled);
        return compiled;
    }

    @Override
    public void accept(RuleVisitor visitor) {
        if (!visitor.preorder(this)) return;
        for (ICompilerRule child: this.children)
            child.accept(visitor);
        visitor.postorder(this);
    }
}
