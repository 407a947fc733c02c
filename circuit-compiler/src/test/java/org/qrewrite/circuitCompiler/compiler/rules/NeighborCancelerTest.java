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

import org.junit.Assert;
import org.junit.Test;
import org.qrewrite.circuitCompiler.circuit.Gate;
import org.qrewrite.circuitCompiler.circuit.GateKind;
import org.qrewrite.circuitCompiler.circuit.ParameterValue;
import org.qrewrite.circuitCompiler.circuit.QuantumCircuit;
import org.qrewrite.circuitCompiler.dag.DAGCircuit;
import org.qrewrite.circuitCompiler.dag.DAGCircuitTest;

import java.util.List;

public class NeighborCancelerTest {
    QuantumCircuit simplify(QuantumCircuit circuit) {
        DAGCircuit dag = DAGCircuit.build(circuit);
        new KroneckerSeqCompiler(new NeighborCanceler()).apply(dag);
        dag.checkInvariants();
        return dag.toCircuit();
    }

    @Test
    public void cancelsSelfInversePairs() {
        QuantumCircuit circuit = new QuantumCircuit(2)
                .add(Gate.on(GateKind.H, 0))
                .add(Gate.on(GateKind.H, 0))
                .add(Gate.cnot(1, 0))
                .add(Gate.cnot(1, 0))
                .add(Gate.on(GateKind.X, 1));
        QuantumCircuit result = this.simplify(circuit);
        Assert.assertEquals(List.of(Gate.on(GateKind.X, 1)), result.gates());
    }

    @Test
    public void cancelsInverseKinds() {
        QuantumCircuit circuit = new QuantumCircuit(1)
                .add(Gate.on(GateKind.S, 0))
                .add(Gate.on(GateKind.SDAG, 0))
                .add(Gate.on(GateKind.TDAG, 0))
                .add(Gate.on(GateKind.T, 0));
        Assert.assertEquals(0, this.simplify(circuit).size());
    }

    @Test
    public void cascadesInsideOut() {
        // H X X H: the inner pair goes first, then the outer one
        QuantumCircuit circuit = new QuantumCircuit(1)
                .add(Gate.on(GateKind.H, 0))
                .add(Gate.on(GateKind.X, 0))
                .add(Gate.on(GateKind.X, 0))
                .add(Gate.on(GateKind.H, 0));
        Assert.assertEquals(0, this.simplify(circuit).size());
    }

    @Test
    public void mergesRotations() {
        QuantumCircuit circuit = new QuantumCircuit(1)
                .add(Gate.on(GateKind.RZ, ParameterValue.symbol("a"), 0))
                .add(Gate.on(GateKind.RZ, ParameterValue.of(0.25), 0));
        QuantumCircuit result = this.simplify(circuit);
        Assert.assertEquals(1, result.size());
        Gate merged = result.get(0);
        Assert.assertEquals(GateKind.RZ, merged.kind);
        Assert.assertTrue(merged.parameter.same(ParameterValue.symbol("a").add(ParameterValue.of(0.25))));
    }

    @Test
    public void opposedRotationsCancel() {
        ParameterValue theta = ParameterValue.symbol("theta");
        QuantumCircuit circuit = new QuantumCircuit(2)
                .add(Gate.twoQubit(GateKind.RZZ, theta, 0, 1))
                .add(Gate.twoQubit(GateKind.RZZ, theta.negate(), 0, 1));
        Assert.assertEquals(0, this.simplify(circuit).size());
    }

    @Test
    public void controlsMustMatch() {
        QuantumCircuit circuit = new QuantumCircuit(3)
                .add(Gate.cnot(0, 1))
                .add(Gate.cnot(0, 2));
        Assert.assertEquals(circuit, this.simplify(circuit));
    }

    @Test
    public void gateInBetweenPreventsCancellation() {
        QuantumCircuit circuit = new QuantumCircuit(2)
                .add(Gate.cnot(1, 0))
                .add(Gate.on(GateKind.Z, 1))
                .add(Gate.cnot(1, 0));
        Assert.assertEquals(circuit, this.simplify(circuit));
    }

    @Test
    public void removesIdentity() {
        QuantumCircuit circuit = new QuantumCircuit(1)
                .add(Gate.on(GateKind.I, 0))
                .add(Gate.on(GateKind.Y, 0));
        Assert.assertEquals(List.of(Gate.on(GateKind.Y, 0)), this.simplify(circuit).gates());
    }

    @Test
    public void noChangeLeavesDagIdentical() {
        QuantumCircuit circuit = new QuantumCircuit(2)
                .add(Gate.on(GateKind.H, 0))
                .add(Gate.cnot(1, 0))
                .add(Gate.on(GateKind.T, 1));
        DAGCircuit dag = DAGCircuit.build(circuit);
        List<List<Integer>> before = DAGCircuitTest.lines(dag);
        NeighborCanceler canceler = new NeighborCanceler();
        Assert.assertFalse(canceler.apply(dag));
        Assert.assertEquals(before, DAGCircuitTest.lines(dag));
        Assert.assertEquals(circuit, dag.toCircuit());
        // Still false when applied again
        Assert.assertFalse(canceler.apply(dag));
    }
}
