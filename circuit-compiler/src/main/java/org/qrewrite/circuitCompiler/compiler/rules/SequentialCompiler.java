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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Applies a list of rules once, in order.
 * Each rule sees the changes made by the rules before it.
 * The result is true if any rule changed the DAG.
 */
public class SequentialCompiler extends BasicCompilerRule {
    protected final List<ICompilerRule> children;

    public SequentialCompiler(String name, List<? extends ICompilerRule> children) {
        super(name);
        this.children = new ArrayList<>(children);
    }

    public SequentialCompiler(List<? extends ICompilerRule> children) {
        this("SequentialCompiler", children);
    }

    public SequentialCompiler(ICompilerRule... children) {
        this(Linq.list(children));
    }

    public List<ICompilerRule> getChildren() {
        return Collections.unmodifiableList(this.children);
    }

    @Override
    public SequentialCompiler setAllLogLevel(int level) {
        this.setLogLevel(level);
        for (ICompilerRule child: this.children)
            child.setAllLogLevel(level);
        return this;
    }

    /**
     * Apply every child once.
     * @return  The result of each child, in order.
     */
    protected List<Boolean> applyChildren(DAGCircuit dag, CompileLog log) {
        List<Boolean> states = new ArrayList<>(this.children.size());
        for (ICompilerRule child: this.children)
            states.add(child.apply(dag, log));
        log.log(this.name + ": state for each rule -> " + CompileLog.showState(states),
                CompileLog.STATE, this.logLevel);
        return states;
    }

    protected void logStart(CompileLog log) {
        String childNames = String.join(", ", Linq.map(this.children, ICompilerRule::getName));
        log.log("Running " + this.name + ": " + this.children.size() + " child (" + childNames + ").",
                CompileLog.SUMMARY, this.logLevel);
    }

    protected void logEnd(CompileLog log, boolean compiled) {
        if (compiled)
            log.log(this.name + ": successfully compiled.", CompileLog.SUMMARY, this.logLevel);
        else
            log.log(this.name + ": nothing happened.", CompileLog.SUMMARY, this.logLevel);
    }

    @Override
    public boolean apply(DAGCircuit dag, CompileLog log) {
        this.logStart(log);
        List<Boolean> states;
        try (CompileLog.Indentation ignored = log.indent()) {
            states = this.applyChildren(dag, log);
        }
        boolean compiled = Linq.any(states, s -> s);
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
