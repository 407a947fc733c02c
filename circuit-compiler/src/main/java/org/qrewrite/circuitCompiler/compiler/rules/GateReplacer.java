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

import org.qrewrite.circuitCompiler.circuit.Gate;
import org.qrewrite.circuitCompiler.circuit.QuantumCircuit;
import org.qrewrite.circuitCompiler.compiler.log.CompileLog;
import org.qrewrite.circuitCompiler.dag.DAGCircuit;
import org.qrewrite.circuitCompiler.dag.GateNode;
import org.qrewrite.util.Linq;

import java.util.List;
import java.util.Objects;

/**
 * Replaces every gate that matches a pattern gate with a template circuit.
 * A gate matches if it has the same kind, parameter and number of controls as the pattern.
 * Qubit i of the template is mapped to qubit i of the matched gate, where
 * the qubits of a gate are its targets followed by its controls.
 */
public class GateReplacer extends BasicCompilerRule {
    public final Gate pattern;
    public final QuantumCircuit template;

    public GateReplacer(String name, Gate pattern, QuantumCircuit template) {
        super(name);
        this.pattern = Objects.requireNonNull(pattern);
        this.template = Objects.requireNonNull(template);
        int arity = pattern.qubits().size();
        if (template.getQubitCount() != arity)
            throw new IllegalArgumentException("Template for " + pattern + " must have " + arity +
                    " qubits, but it has " + template.getQubitCount());
        for (Gate gate: template.gates()) {
            for (int qubit: gate.qubits())
                if (qubit < 0 || qubit >= arity)
                    throw new IllegalArgumentException("Template gate " + gate + " uses qubit " + qubit +
                            " outside of the template");
            if (this.matches(gate))
                throw new IllegalArgumentException("Template contains " + gate +
                        " which matches the pattern; the replacement would never terminate");
        }
    }

    public GateReplacer(Gate pattern, QuantumCircuit template) {
        this("GateReplacer<" + pattern.kind + ">", pattern, template);
    }

    public boolean matches(Gate gate) {
        return gate.kind == this.pattern.kind &&
                gate.getControlCount() == this.pattern.getControlCount() &&
                Objects.equals(gate.parameter, this.pattern.parameter);
    }

    @Override
    public boolean apply(DAGCircuit dag, CompileLog log) {
        int count = 0;
        for (GateNode node: dag.gateNodes()) {
            if (!this.matches(node.gate))
                continue;
            List<Integer> qubits = node.gate.qubits();
            List<Gate> replacement = Linq.map(this.template.gates(), g -> g.remap(qubits));
            dag.replace(node, replacement);
            count++;
        }
        if (count > 0)
            log.log(this.name + ": replaced " + count + " gate(s)", CompileLog.STATE, this.logLevel);
        return count > 0;
    }
}
