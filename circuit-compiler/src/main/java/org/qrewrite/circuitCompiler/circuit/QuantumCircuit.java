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

package org.qrewrite.circuitCompiler.circuit;

import org.qrewrite.util.Linq;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered sequence of gates on a declared number of qubits.
 * The qubit indices used by the gates are not checked here;
 * they are validated when the circuit is converted to a DAG.
 */
public class QuantumCircuit {
    private final int qubitCount;
    private final List<Gate> gates;

    public QuantumCircuit(int qubitCount) {
        if (qubitCount < 0)
            throw new IllegalArgumentException("Negative qubit count " + qubitCount);
        this.qubitCount = qubitCount;
        this.gates = new ArrayList<>();
    }

    public QuantumCircuit(int qubitCount, List<Gate> gates) {
        this(qubitCount);
        for (Gate gate: gates)
            this.add(gate);
    }

    public QuantumCircuit add(Gate gate) {
        this.gates.add(Objects.requireNonNull(gate));
        return this;
    }

    public int getQubitCount() {
        return this.qubitCount;
    }

    public List<Gate> gates() {
        return Collections.unmodifiableList(this.gates);
    }

    public int size() {
        return this.gates.size();
    }

    public Gate get(int index) {
        return this.gates.get(index);
    }

    /**
     * The gates that touch the specified qubit, in program order.
     */
    public List<Gate> qubitSequence(int qubit) {
        return Linq.where(this.gates, g -> g.touches(qubit));
    }

    /**
     * Number of gates of the specified kind with the specified number of controls.
     */
    public int countKind(GateKind kind, int controls) {
        return Linq.count(this.gates, g -> g.kind == kind && g.getControlCount() == controls);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QuantumCircuit that = (QuantumCircuit) o;
        return this.qubitCount == that.qubitCount && this.gates.equals(that.gates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.qubitCount, this.gates);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("circuit(").append(this.qubitCount).append(" qubits) {\n");
        for (Gate gate: this.gates)
            builder.append("    ").append(gate).append("\n");
        builder.append("}\n");
        return builder.toString();
    }
}
