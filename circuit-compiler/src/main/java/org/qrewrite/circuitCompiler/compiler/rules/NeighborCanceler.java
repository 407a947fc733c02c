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
import org.qrewrite.circuitCompiler.circuit.GateKind;
import org.qrewrite.circuitCompiler.circuit.ParameterValue;
import org.qrewrite.circuitCompiler.compiler.log.CompileLog;
import org.qrewrite.circuitCompiler.dag.DAGCircuit;
import org.qrewrite.circuitCompiler.dag.GateNode;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Simplifies pairs of gates which are adjacent on all their qubits:
 * a gate followed by its inverse is removed, two rotations of the same
 * kind on the same qubits are merged.  Identity gates are removed.
 */
public class NeighborCanceler extends BasicCompilerRule {
    public NeighborCanceler(String name) {
        super(name);
    }

    public NeighborCanceler() {
        this("NeighborCanceler");
    }

    /**
     * The gate that immediately follows a node on every qubit of the node, if any.
     */
    @Nullable
    static GateNode adjacentSuccessor(DAGCircuit dag, GateNode node) {
        List<Integer> qubits = node.gate.qubits();
        GateNode next = dag.next(node, qubits.get(0));
        if (next == null)
            return null;
        for (int qubit: qubits) {
            if (dag.next(node, qubit) != next)
                return null;
        }
        if (next.gate.qubits().size() != qubits.size())
            return null;
        return next;
    }

    /**
     * Try to simplify a node together with its successor.
     * @return True if the DAG was changed.
     */
    boolean simplify(DAGCircuit dag, GateNode node, CompileLog log) {
        if (node.gate.kind == GateKind.I) {
            log.log(this.name + ": removing " + node, CompileLog.STATE, this.logLevel);
            dag.remove(node);
            return true;
        }
        GateNode next = adjacentSuccessor(dag, node);
        if (next == null)
            return false;
        Gate first = node.gate;
        Gate second = next.gate;
        if (first.kind.isRotation()) {
            if (!first.sameShape(second))
                return false;
            ParameterValue sum = Objects.requireNonNull(first.parameter)
                    .add(Objects.requireNonNull(second.parameter));
            dag.remove(next);
            if (sum.isZero()) {
                log.log(this.name + ": cancelling " + node + " and " + next, CompileLog.STATE, this.logLevel);
                dag.remove(node);
            } else {
                log.log(this.name + ": merging " + node + " and " + next, CompileLog.STATE, this.logLevel);
                dag.replace(node, List.of(first.withParameter(sum)));
            }
            return true;
        }
        if (second.equals(first.dagger())) {
            log.log(this.name + ": cancelling " + node + " and " + next, CompileLog.STATE, this.logLevel);
            dag.remove(next);
            dag.remove(node);
            return true;
        }
        return false;
    }

    @Override
    public boolean apply(DAGCircuit dag, CompileLog log) {
        boolean changed = false;
        for (GateNode node: dag.gateNodes()) {
            if (!dag.contains(node))
                continue;
            if (this.simplify(dag, node, log))
                changed = true;
        }
        return changed;
    }
}
