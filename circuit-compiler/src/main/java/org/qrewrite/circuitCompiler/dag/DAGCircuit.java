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

import org.qrewrite.circuitCompiler.circuit.Gate;
import org.qrewrite.circuitCompiler.circuit.QuantumCircuit;
import org.qrewrite.circuitCompiler.compiler.errors.InvalidCircuitException;
import org.qrewrite.circuitCompiler.compiler.errors.RuleViolationException;
import org.qrewrite.util.Linq;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;

/**
 * Dependency graph of the gates of a circuit.
 * Each qubit is a line starting at a head sentinel and ending at a tail sentinel;
 * a gate node sits on the line of every qubit it touches.
 * The parent of the tail on a line is the frontier of that line, i.e., the most
 * recently appended gate on the qubit.
 *
 * <p>The graph is converted back to a circuit using a topological sort which,
 * among all gates whose predecessors have been emitted, always emits the one
 * with the smallest node id.  Ids are allocated in creation order, so a DAG that
 * has not been rewritten produces exactly the program order it was built from.
 */
public class DAGCircuit {
    private final int qubitCount;
    private final QubitNode[] heads;
    private final QubitNode[] tails;
    /** Live gate nodes, in creation order. */
    private final Set<GateNode> nodes;
    private int nextId;

    public DAGCircuit(int qubitCount) {
        if (qubitCount < 0)
            throw new IllegalArgumentException("Negative qubit count " + qubitCount);
        this.qubitCount = qubitCount;
        this.heads = new QubitNode[qubitCount];
        this.tails = new QubitNode[qubitCount];
        this.nodes = new LinkedHashSet<>();
        this.nextId = 0;
        for (int q = 0; q < qubitCount; q++) {
            this.heads[q] = new QubitNode(this.nextId++, q, true);
            this.tails[q] = new QubitNode(this.nextId++, q, false);
            connect(this.heads[q], this.tails[q], q);
        }
    }

    /**
     * Build the DAG of a circuit.
     * @throws InvalidCircuitException if a gate uses a qubit outside the declared range.
     *         No DAG is produced in this case.
     */
    public static DAGCircuit build(QuantumCircuit circuit) {
        int index = 0;
        for (Gate gate: circuit.gates()) {
            checkQubits(gate, circuit.getQubitCount(), index);
            index++;
        }
        DAGCircuit result = new DAGCircuit(circuit.getQubitCount());
        for (Gate gate: circuit.gates())
            result.append(gate);
        return result;
    }

    static void checkQubits(Gate gate, int qubitCount, int gateIndex) {
        for (int qubit: gate.qubits()) {
            if (qubit < 0 || qubit >= qubitCount)
                throw new InvalidCircuitException("Gate " + gate + " uses qubit " + qubit +
                        ", but the circuit has " + qubitCount + " qubit(s)", gateIndex);
        }
    }

    static void connect(DAGNode parent, DAGNode child, int qubit) {
        parent.children.put(qubit, child);
        child.parents.put(qubit, parent);
    }

    public int getQubitCount() {
        return this.qubitCount;
    }

    /**
     * Number of gate nodes.
     */
    public int size() {
        return this.nodes.size();
    }

    public boolean contains(GateNode node) {
        return this.nodes.contains(node);
    }

    /**
     * The last gate on the line of a qubit, or null if the line is empty.
     */
    @Nullable
    public GateNode getFrontier(int qubit) {
        DAGNode last = this.tails[qubit].getParent(qubit);
        if (last instanceof GateNode)
            return (GateNode) last;
        return null;
    }

    GateNode newNode(Gate gate) {
        GateNode node = new GateNode(this.nextId++, gate);
        this.nodes.add(node);
        return node;
    }

    /**
     * Append a gate after the frontier of every qubit it touches.
     */
    public GateNode append(Gate gate) {
        checkQubits(gate, this.qubitCount, -1);
        GateNode node = this.newNode(gate);
        for (int qubit: gate.qubits()) {
            DAGNode tail = this.tails[qubit];
            DAGNode last = tail.parents.get(qubit);
            connect(last, node, qubit);
            connect(node, tail, qubit);
        }
        return node;
    }

    void checkLive(GateNode node) {
        if (!this.nodes.contains(node))
            throw new RuleViolationException("Node " + node + " is not part of the DAG");
    }

    /**
     * Remove a gate node; on every qubit line its parent becomes connected to its child.
     */
    public void remove(GateNode node) {
        this.checkLive(node);
        for (int qubit: node.gate.qubits()) {
            DAGNode parent = node.parents.get(qubit);
            DAGNode child = node.children.get(qubit);
            connect(parent, child, qubit);
        }
        node.parents.clear();
        node.children.clear();
        this.nodes.remove(node);
    }

    /**
     * Replace a gate node with a sequence of gates.  The replacement gates
     * are placed in order between the parents and children of the node.
     * @param node         Node to replace.
     * @param replacement  Gates to insert; they may only touch qubits of the node.
     *                     An empty list removes the node.
     * @return             The newly created nodes, in order.
     */
    public List<GateNode> replace(GateNode node, List<Gate> replacement) {
        this.checkLive(node);
        for (Gate gate: replacement) {
            for (int qubit: gate.qubits()) {
                if (!node.gate.touches(qubit))
                    throw new RuleViolationException("Replacement gate " + gate + " uses qubit " + qubit +
                            " which is not used by the replaced gate " + node.gate);
            }
        }
        Map<Integer, DAGNode> current = new TreeMap<>(node.parents);
        Map<Integer, DAGNode> next = new TreeMap<>(node.children);
        node.parents.clear();
        node.children.clear();
        this.nodes.remove(node);

        List<GateNode> result = new ArrayList<>();
        for (Gate gate: replacement) {
            GateNode created = this.newNode(gate);
            for (int qubit: gate.qubits()) {
                connect(current.get(qubit), created, qubit);
                current.put(qubit, created);
            }
            result.add(created);
        }
        for (Map.Entry<Integer, DAGNode> e: current.entrySet())
            connect(e.getValue(), next.get(e.getKey()), e.getKey());
        return result;
    }

    /**
     * The gate following a node on a qubit line, or null if the node is the last one.
     */
    @Nullable
    public GateNode next(GateNode node, int qubit) {
        DAGNode child = node.getChild(qubit);
        if (child instanceof GateNode)
            return (GateNode) child;
        return null;
    }

    @Nullable
    public GateNode previous(GateNode node, int qubit) {
        DAGNode parent = node.getParent(qubit);
        if (parent instanceof GateNode)
            return (GateNode) parent;
        return null;
    }

    /**
     * The gate nodes on the line of a qubit, from head to tail.
     */
    public List<GateNode> qubitLine(int qubit) {
        List<GateNode> result = new ArrayList<>();
        DAGNode current = this.heads[qubit].getChild(qubit);
        while (current instanceof GateNode) {
            result.add((GateNode) current);
            current = current.getChild(qubit);
        }
        return result;
    }

    /**
     * All gate nodes in the order in which they are emitted by {@link #toCircuit()}.
     * The result is a snapshot; the DAG may be modified while iterating over it.
     */
    public List<GateNode> gateNodes() {
        Map<GateNode, Integer> pending = new HashMap<>();
        PriorityQueue<GateNode> ready = new PriorityQueue<>(Comparator.comparingInt(n -> n.id));
        for (GateNode node: this.nodes) {
            int count = Linq.count(node.parents.values(), p -> p instanceof GateNode);
            if (count == 0)
                ready.add(node);
            else
                pending.put(node, count);
        }
        List<GateNode> result = new ArrayList<>(this.nodes.size());
        while (!ready.isEmpty()) {
            GateNode node = ready.remove();
            result.add(node);
            for (DAGNode child: node.children.values()) {
                if (!(child instanceof GateNode))
                    continue;
                GateNode gateChild = (GateNode) child;
                int count = pending.get(gateChild) - 1;
                if (count == 0) {
                    pending.remove(gateChild);
                    ready.add(gateChild);
                } else {
                    pending.put(gateChild, count);
                }
            }
        }
        if (result.size() != this.nodes.size())
            throw new RuleViolationException("DAG contains a cycle: sorted " + result.size() +
                    " out of " + this.nodes.size() + " nodes");
        return result;
    }

    /**
     * Convert the DAG to a circuit.
     */
    public QuantumCircuit toCircuit() {
        QuantumCircuit result = new QuantumCircuit(this.qubitCount);
        for (GateNode node: this.gateNodes())
            result.add(node.gate);
        return result;
    }

    /**
     * Verify the structural invariants of the DAG.
     * @throws RuleViolationException if an invariant does not hold.
     */
    public void checkInvariants() {
        for (GateNode node: this.nodes) {
            Set<Integer> qubits = new HashSet<>(node.gate.qubits());
            if (!node.parents.keySet().equals(qubits) || !node.children.keySet().equals(qubits))
                throw new RuleViolationException("Node " + node + " is not linked on exactly its qubits " + qubits);
        }
        for (int q = 0; q < this.qubitCount; q++) {
            DAGNode previous = this.heads[q];
            DAGNode current = previous.getChild(q);
            int steps = 0;
            while (current != this.tails[q]) {
                if (current == null)
                    throw new RuleViolationException("Line of qubit " + q + " does not reach its tail");
                if (!(current instanceof GateNode) || !this.nodes.contains(current))
                    throw new RuleViolationException("Line of qubit " + q + " contains foreign node " + current);
                if (current.getParent(q) != previous)
                    throw new RuleViolationException("Asymmetric link on qubit " + q + " at " + current);
                if (++steps > this.nodes.size())
                    throw new RuleViolationException("Line of qubit " + q + " contains a loop");
                previous = current;
                current = current.getChild(q);
            }
            if (current.getParent(q) != previous)
                throw new RuleViolationException("Asymmetric link on qubit " + q + " at its tail");
        }
        // gateNodes() checks acyclicity
        this.gateNodes();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("dag(").append(this.qubitCount).append(" qubits) {\n");
        for (GateNode node: this.gateNodes())
            builder.append("    ").append(node).append("\n");
        builder.append("}\n");
        return builder.toString();
    }
}
