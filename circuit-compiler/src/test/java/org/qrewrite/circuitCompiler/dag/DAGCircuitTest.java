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

package org.qrewrite.circuitCompiler.dag;

import org.junit.Assert;
import org.junit.Test;
import org.qrewrite.circuitCompiler.circuit.Gate;
import org.qrewrite.circuitCompiler.circuit.GateKind;
import org.qrewrite.circuitCompiler.circuit.ParameterValue;
import org.qrewrite.circuitCompiler.circuit.QuantumCircuit;
import org.qrewrite.circuitCompiler.compiler.errors.InvalidCircuitException;
import org.qrewrite.circuitCompiler.compiler.errors.RuleViolationException;
import org.qrewrite.util.Linq;

import java.util.ArrayList;
import java.util.List;

public class DAGCircuitTest {
    /**
     * The ids of the nodes on every qubit line; two DAGs with the same lines
     * have the same nodes and the same edges.
     */
    public static List<List<Integer>> lines(DAGCircuit dag) {
        List<List<Integer>> result = new ArrayList<>();
        for (int q = 0; q < dag.getQubitCount(); q++)
            result.add(Linq.map(dag.qubitLine(q), n -> n.id));
        return result;
    }

    static QuantumCircuit sample() {
        return new QuantumCircuit(3)
                .add(Gate.on(GateKind.H, 0))
                .add(Gate.cnot(1, 0))
                .add(Gate.on(GateKind.RX, ParameterValue.symbol("a"), 2))
                .add(Gate.on(GateKind.T, 1))
                .add(Gate.controlled(GateKind.X, 2, 0, 1))
                .add(Gate.on(GateKind.Z, 0))
                .add(Gate.twoQubit(GateKind.RZZ, ParameterValue.of(0.5), 2, 1));
    }

    @Test
    public void buildLinksEveryQubit() {
        DAGCircuit dag = DAGCircuit.build(sample());
        Assert.assertEquals(7, dag.size());
        Assert.assertEquals(3, dag.getQubitCount());
        Assert.assertEquals(4, dag.qubitLine(0).size());
        Assert.assertEquals(4, dag.qubitLine(1).size());
        Assert.assertEquals(3, dag.qubitLine(2).size());
        dag.checkInvariants();
    }

    @Test
    public void frontierIsLastGate() {
        DAGCircuit dag = DAGCircuit.build(sample());
        GateNode frontier = dag.getFrontier(0);
        Assert.assertNotNull(frontier);
        Assert.assertEquals(GateKind.Z, frontier.gate.kind);
        Assert.assertEquals(GateKind.RZZ, dag.getFrontier(2).gate.kind);
        Assert.assertNull(new DAGCircuit(2).getFrontier(1));
    }

    @Test
    public void identityCompilePreservesQubitOrder() {
        QuantumCircuit circuit = sample();
        QuantumCircuit result = DAGCircuit.build(circuit).toCircuit();
        for (int q = 0; q < circuit.getQubitCount(); q++)
            Assert.assertEquals(circuit.qubitSequence(q), result.qubitSequence(q));
        // Without rewrites the program order is reproduced exactly
        Assert.assertEquals(circuit, result);
    }

    @Test
    public void roundTripIsStable() {
        QuantumCircuit once = DAGCircuit.build(sample()).toCircuit();
        QuantumCircuit twice = DAGCircuit.build(once).toCircuit();
        Assert.assertEquals(once, twice);
    }

    @Test
    public void invalidQubitRejected() {
        QuantumCircuit circuit = new QuantumCircuit(2)
                .add(Gate.on(GateKind.H, 0))
                .add(Gate.cnot(2, 0));
        try {
            DAGCircuit.build(circuit);
            Assert.fail("Expected exception");
        } catch (InvalidCircuitException ex) {
            Assert.assertEquals(1, ex.gateIndex);
            Assert.assertTrue(ex.getMessage().contains("qubit 2"));
        }
    }

    @Test(expected = InvalidCircuitException.class)
    public void negativeQubitRejected() {
        DAGCircuit.build(new QuantumCircuit(1).add(Gate.on(GateKind.X, -1)));
    }

    @Test(expected = InvalidCircuitException.class)
    public void appendChecksQubits() {
        new DAGCircuit(1).append(Gate.cnot(0, 1));
    }

    @Test
    public void removeRewiresEveryLine() {
        DAGCircuit dag = DAGCircuit.build(sample());
        GateNode toffoli = dag.gateNodes().get(4);
        Assert.assertEquals(2, toffoli.gate.getControlCount());
        GateNode before0 = dag.previous(toffoli, 0);
        GateNode after0 = dag.next(toffoli, 0);
        GateNode before2 = dag.previous(toffoli, 2);
        dag.remove(toffoli);
        dag.checkInvariants();
        Assert.assertFalse(dag.contains(toffoli));
        Assert.assertEquals(6, dag.size());
        Assert.assertSame(after0, dag.next(before0, 0));
        Assert.assertNotNull(before2);
        Assert.assertEquals(GateKind.RZZ, dag.next(before2, 2).gate.kind);
        QuantumCircuit result = dag.toCircuit();
        List<Gate> expected = new ArrayList<>(sample().gates());
        expected.remove(4);
        Assert.assertEquals(expected, result.gates());
    }

    @Test
    public void replaceInsertsInOrder() {
        DAGCircuit dag = DAGCircuit.build(new QuantumCircuit(2)
                .add(Gate.on(GateKind.H, 0))
                .add(Gate.twoQubit(GateKind.SWAP, null, 0, 1))
                .add(Gate.on(GateKind.X, 1)));
        GateNode swap = dag.gateNodes().get(1);
        List<GateNode> created = dag.replace(swap, List.of(Gate.cnot(1, 0), Gate.cnot(0, 1), Gate.cnot(1, 0)));
        dag.checkInvariants();
        Assert.assertEquals(3, created.size());
        Assert.assertTrue(created.get(0).id > swap.id);
        QuantumCircuit result = dag.toCircuit();
        Assert.assertEquals(5, result.size());
        Assert.assertEquals(Gate.on(GateKind.H, 0), result.get(0));
        Assert.assertEquals(Gate.cnot(1, 0), result.get(1));
        Assert.assertEquals(Gate.cnot(0, 1), result.get(2));
        Assert.assertEquals(Gate.cnot(1, 0), result.get(3));
        Assert.assertEquals(Gate.on(GateKind.X, 1), result.get(4));
    }

    @Test
    public void replaceWithSubsetOfQubits() {
        DAGCircuit dag = DAGCircuit.build(new QuantumCircuit(2)
                .add(Gate.cnot(1, 0))
                .add(Gate.on(GateKind.H, 0)));
        GateNode cnot = dag.gateNodes().get(0);
        dag.replace(cnot, List.of(Gate.on(GateKind.Z, 1)));
        dag.checkInvariants();
        Assert.assertEquals(List.of(Gate.on(GateKind.H, 0)), dag.toCircuit().qubitSequence(0));
        Assert.assertEquals(List.of(Gate.on(GateKind.Z, 1)), dag.toCircuit().qubitSequence(1));
    }

    @Test
    public void replaceWithNothingRemoves() {
        DAGCircuit dag = DAGCircuit.build(sample());
        dag.replace(dag.gateNodes().get(0), List.of());
        dag.checkInvariants();
        Assert.assertEquals(6, dag.size());
    }

    @Test(expected = RuleViolationException.class)
    public void replaceCannotTouchNewQubits() {
        DAGCircuit dag = DAGCircuit.build(sample());
        dag.replace(dag.gateNodes().get(0), List.of(Gate.cnot(1, 0)));
    }

    @Test(expected = RuleViolationException.class)
    public void removeTwice() {
        DAGCircuit dag = DAGCircuit.build(sample());
        GateNode node = dag.gateNodes().get(0);
        dag.remove(node);
        dag.remove(node);
    }

    @Test
    public void flattenTieBreakUsesCreationOrder() {
        // Independent gates are emitted in creation order
        DAGCircuit dag = new DAGCircuit(3);
        dag.append(Gate.on(GateKind.X, 2));
        dag.append(Gate.on(GateKind.Y, 0));
        dag.append(Gate.on(GateKind.Z, 1));
        QuantumCircuit result = dag.toCircuit();
        Assert.assertEquals(GateKind.X, result.get(0).kind);
        Assert.assertEquals(GateKind.Y, result.get(1).kind);
        Assert.assertEquals(GateKind.Z, result.get(2).kind);
    }

    @Test
    public void flattenIsDeterministicAfterRewrites() {
        DAGCircuit first = DAGCircuit.build(sample());
        DAGCircuit second = DAGCircuit.build(sample());
        for (DAGCircuit dag: List.of(first, second)) {
            GateNode rzz = dag.getFrontier(2);
            dag.replace(rzz, List.of(Gate.cnot(1, 2), Gate.on(GateKind.RZ, ParameterValue.of(0.5), 1), Gate.cnot(1, 2)));
        }
        Assert.assertEquals(first.toCircuit(), second.toCircuit());
        Assert.assertEquals(lines(first), lines(second));
    }

    @Test
    public void tagsAreKept() {
        DAGCircuit dag = DAGCircuit.build(sample());
        GateNode node = dag.gateNodes().get(2);
        node.addTag("seen");
        Assert.assertTrue(dag.gateNodes().get(2).hasTag("seen"));
        node.removeTag("seen");
        Assert.assertFalse(node.hasTag("seen"));
    }

    @Test
    public void emptyCircuit() {
        DAGCircuit dag = DAGCircuit.build(new QuantumCircuit(2));
        Assert.assertEquals(0, dag.size());
        Assert.assertEquals(0, dag.toCircuit().size());
        Assert.assertEquals(2, dag.toCircuit().getQubitCount());
        dag.checkInvariants();
    }
}
