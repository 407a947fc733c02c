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

import org.qrewrite.circuitCompiler.circuit.QuantumCircuit;
import org.qrewrite.circuitCompiler.compiler.log.CompileLog;
import org.qrewrite.circuitCompiler.compiler.rules.ICompilerRule;
import org.qrewrite.circuitCompiler.dag.DAGCircuit;
import org.qrewrite.util.IModule;
import org.qrewrite.util.Logger;

/**
 * Compiles a circuit by rewriting its DAG with a rule.
 */
public class CircuitCompiler implements IModule {
    public final CompilerOptions options;

    public CircuitCompiler(CompilerOptions options) {
        this.options = options;
    }

    /**
     * Build the DAG of a circuit, apply a rule once, and convert the result back to a circuit.
     * Rules which need to be repeated must be wrapped in a
     * {@link org.qrewrite.circuitCompiler.compiler.rules.KroneckerSeqCompiler}.
     */
    public static QuantumCircuit compileCircuit(ICompilerRule rule, QuantumCircuit circuit, CompileLog log) {
        DAGCircuit dag = DAGCircuit.build(circuit);
        rule.apply(dag, log);
        return dag.toCircuit();
    }

    public static QuantumCircuit compileCircuit(ICompilerRule rule, QuantumCircuit circuit) {
        return compileCircuit(rule, circuit, CompileLog.silent());
    }

    /**
     * Compile using the settings in the options; optionally validates the DAG after rewriting.
     */
    public QuantumCircuit compile(ICompilerRule rule, QuantumCircuit circuit, CompileLog log) {
        Logger.instance.from(this, 1)
                .append("Compiling circuit with ")
                .append(circuit.size())
                .append(" gates on ")
                .append(circuit.getQubitCount())
                .append(" qubits using ")
                .append(rule.getName())
                .newline();
        DAGCircuit dag = DAGCircuit.build(circuit);
        boolean changed = rule.apply(dag, log);
        if (this.options.optimizerOptions.validate)
            dag.checkInvariants();
        QuantumCircuit result = dag.toCircuit();
        Logger.instance.from(this, 1)
                .append(changed ? "Circuit rewritten: " : "Circuit unchanged: ")
                .append(result.size())
                .append(" gates")
                .newline();
        return result;
    }
}
