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

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A quantum operation applied to some target qubits, optionally
 * conditioned on some control qubits.  Immutable.
 */
public final class Gate {
    public final GateKind kind;
    @Nullable
    public final ParameterValue parameter;
    private final List<Integer> targets;
    private final List<Integer> controls;

    public Gate(GateKind kind, @Nullable ParameterValue parameter, List<Integer> targets, List<Integer> controls) {
        this.kind = Objects.requireNonNull(kind);
        this.parameter = parameter;
        this.targets = List.copyOf(targets);
        this.controls = List.copyOf(controls);
        if (this.targets.size() != kind.targetCount)
            throw new IllegalArgumentException(kind + " expects " + kind.targetCount +
                    " target qubit(s), got " + this.targets);
        if (kind.parameterized && parameter == null)
            throw new IllegalArgumentException(kind + " requires a parameter");
        if (!kind.parameterized && parameter != null)
            throw new IllegalArgumentException(kind + " does not take a parameter");
        Set<Integer> seen = new HashSet<>();
        for (int qubit: this.qubits()) {
            if (!seen.add(qubit))
                throw new IllegalArgumentException("Qubit " + qubit + " used twice in " + kind);
        }
    }

    public Gate(GateKind kind, List<Integer> targets, List<Integer> controls) {
        this(kind, null, targets, controls);
    }

    public static Gate on(GateKind kind, int target) {
        return new Gate(kind, List.of(target), List.of());
    }

    public static Gate on(GateKind kind, ParameterValue parameter, int target) {
        return new Gate(kind, parameter, List.of(target), List.of());
    }

    public static Gate controlled(GateKind kind, int target, Integer... controls) {
        return new Gate(kind, List.of(target), List.of(controls));
    }

    public static Gate controlled(GateKind kind, ParameterValue parameter, int target, Integer... controls) {
        return new Gate(kind, parameter, List.of(target), List.of(controls));
    }

    public static Gate cnot(int target, int control) {
        return controlled(GateKind.X, target, control);
    }

    public static Gate cz(int target, int control) {
        return controlled(GateKind.Z, target, control);
    }

    public static Gate controlledPhase(ParameterValue angle, int target, int control) {
        return controlled(GateKind.PS, angle, target, control);
    }

    public static Gate twoQubit(GateKind kind, @Nullable ParameterValue parameter, int first, int second) {
        return new Gate(kind, parameter, List.of(first, second), List.of());
    }

    public List<Integer> getTargets() {
        return this.targets;
    }

    public List<Integer> getControls() {
        return this.controls;
    }

    /**
     * All qubits touched by the gate: targets followed by controls.
     */
    public List<Integer> qubits() {
        List<Integer> result = new ArrayList<>(this.targets);
        result.addAll(this.controls);
        return Collections.unmodifiableList(result);
    }

    public boolean touches(int qubit) {
        return this.targets.contains(qubit) || this.controls.contains(qubit);
    }

    public int getControlCount() {
        return this.controls.size();
    }

    /**
     * The gate which undoes this one.
     */
    public Gate dagger() {
        ParameterValue param = this.parameter == null ? null : this.parameter.negate();
        return new Gate(this.kind.inverse(), param, this.targets, this.controls);
    }

    /**
     * Same operation on the same qubits, possibly with a different parameter.
     */
    public boolean sameShape(Gate other) {
        return this.kind == other.kind &&
                this.targets.equals(other.targets) &&
                this.controls.equals(other.controls);
    }

    /**
     * Gate with the same shape and a new parameter.
     */
    public Gate withParameter(ParameterValue parameter) {
        return new Gate(this.kind, parameter, this.targets, this.controls);
    }

    /**
     * The same gate applied to different qubits.
     * @param map  map[i] is the new index of qubit i.
     */
    public Gate remap(List<Integer> map) {
        List<Integer> targets = new ArrayList<>();
        for (int t: this.targets)
            targets.add(map.get(t));
        List<Integer> controls = new ArrayList<>();
        for (int c: this.controls)
            controls.add(map.get(c));
        return new Gate(this.kind, this.parameter, targets, controls);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Gate gate = (Gate) o;
        return this.kind == gate.kind &&
                Objects.equals(this.parameter, gate.parameter) &&
                this.targets.equals(gate.targets) &&
                this.controls.equals(gate.controls);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.kind, this.parameter, this.targets, this.controls);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(this.kind.name());
        if (this.parameter != null)
            builder.append("(").append(this.parameter).append(")");
        builder.append(" ").append(this.targets);
        if (!this.controls.isEmpty())
            builder.append(" <- ").append(this.controls);
        return builder.toString();
    }
}
