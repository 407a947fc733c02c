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

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Textbook decompositions of multi-qubit gates into single-qubit gates and CNOTs.
 * CNOT and CZ are never decomposed.
 */
public class GateDecompositions {
    static final ParameterValue HALF_PI = ParameterValue.of(Math.PI / 2);

    private GateDecompositions() {}

    /**
     * The decomposition of a gate, or null if there is none.
     */
    @Nullable
    public static List<Gate> decompose(Gate gate) {
        int controls = gate.getControlCount();
        switch (gate.kind) {
            case SWAP:
                if (controls == 0)
                    return swap(gate.getTargets().get(0), gate.getTargets().get(1));
                break;
            case RZZ:
                if (controls == 0)
                    return rzz(Objects.requireNonNull(gate.parameter), gate.getTargets().get(0), gate.getTargets().get(1));
                break;
            case RXX:
                if (controls == 0)
                    return rxx(Objects.requireNonNull(gate.parameter), gate.getTargets().get(0), gate.getTargets().get(1));
                break;
            case RYY:
                if (controls == 0)
                    return ryy(Objects.requireNonNull(gate.parameter), gate.getTargets().get(0), gate.getTargets().get(1));
                break;
            case PS:
                if (controls == 1)
                    return controlledPhase(Objects.requireNonNull(gate.parameter),
                            gate.getTargets().get(0), gate.getControls().get(0));
                break;
            case RZ:
                if (controls == 1)
                    return controlledRz(Objects.requireNonNull(gate.parameter),
                            gate.getTargets().get(0), gate.getControls().get(0));
                break;
            case Y:
                if (controls == 1)
                    return controlledY(gate.getTargets().get(0), gate.getControls().get(0));
                break;
            case X:
                if (controls == 2)
                    return toffoli(gate.getTargets().get(0), gate.getControls().get(0), gate.getControls().get(1));
                break;
            default:
                break;
        }
        return null;
    }

    static List<Gate> swap(int a, int b) {
        return List.of(Gate.cnot(b, a), Gate.cnot(a, b), Gate.cnot(b, a));
    }

    static List<Gate> rzz(ParameterValue theta, int a, int b) {
        return List.of(
                Gate.cnot(b, a),
                Gate.on(GateKind.RZ, theta, b),
                Gate.cnot(b, a));
    }

    static List<Gate> rxx(ParameterValue theta, int a, int b) {
        List<Gate> result = new ArrayList<>();
        result.add(Gate.on(GateKind.H, a));
        result.add(Gate.on(GateKind.H, b));
        result.addAll(rzz(theta, a, b));
        result.add(Gate.on(GateKind.H, a));
        result.add(Gate.on(GateKind.H, b));
        return result;
    }

    static List<Gate> ryy(ParameterValue theta, int a, int b) {
        List<Gate> result = new ArrayList<>();
        result.add(Gate.on(GateKind.RX, HALF_PI, a));
        result.add(Gate.on(GateKind.RX, HALF_PI, b));
        result.addAll(rzz(theta, a, b));
        result.add(Gate.on(GateKind.RX, HALF_PI.negate(), a));
        result.add(Gate.on(GateKind.RX, HALF_PI.negate(), b));
        return result;
    }

    static List<Gate> controlledPhase(ParameterValue theta, int target, int control) {
        ParameterValue half = theta.scale(0.5);
        return List.of(
                Gate.on(GateKind.PS, half, control),
                Gate.cnot(target, control),
                Gate.on(GateKind.PS, half.negate(), target),
                Gate.cnot(target, control),
                Gate.on(GateKind.PS, half, target));
    }

    static List<Gate> controlledRz(ParameterValue theta, int target, int control) {
        ParameterValue half = theta.scale(0.5);
        return List.of(
                Gate.on(GateKind.RZ, half, target),
                Gate.cnot(target, control),
                Gate.on(GateKind.RZ, half.negate(), target),
                Gate.cnot(target, control));
    }

    static List<Gate> controlledY(int target, int control) {
        return List.of(
                Gate.on(GateKind.SDAG, target),
                Gate.cnot(target, control),
                Gate.on(GateKind.S, target));
    }

    static List<Gate> toffoli(int target, int control0, int control1) {
        return List.of(
                Gate.on(GateKind.H, target),
                Gate.cnot(target, control1),
                Gate.on(GateKind.TDAG, target),
                Gate.cnot(target, control0),
                Gate.on(GateKind.T, target),
                Gate.cnot(target, control1),
                Gate.on(GateKind.TDAG, target),
                Gate.cnot(target, control0),
                Gate.on(GateKind.T, control1),
                Gate.on(GateKind.T, target),
                Gate.on(GateKind.H, target),
                Gate.cnot(control1, control0),
                Gate.on(GateKind.T, control0),
                Gate.on(GateKind.TDAG, control1),
                Gate.cnot(control1, control0));
    }
}
