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

import org.qrewrite.circuitCompiler.circuit.Gate;
import org.qrewrite.circuitCompiler.circuit.GateKind;
import org.qrewrite.circuitCompiler.circuit.QuantumCircuit;
import org.qrewrite.circuitCompiler.compiler.rules.BasicDecompose;
import org.qrewrite.circuitCompiler.compiler.rules.GateReplacer;
import org.qrewrite.circuitCompiler.compiler.rules.ICompilerRule;
import org.qrewrite.circuitCompiler.compiler.rules.KroneckerSeqCompiler;
import org.qrewrite.circuitCompiler.compiler.rules.NeighborCanceler;
import org.qrewrite.util.Linq;

/**
 * Commonly used combinations of rules.
 */
public class CompilerPresets {
    private CompilerPresets() {}

    /**
     * Decompose all multi-qubit gates into single-qubit gates and CNOTs.
     */
    public static ICompilerRule basicDecompose(int maxRounds) {
        return new KroneckerSeqCompiler("BasicDecomposeSaturation",
                Linq.list(new BasicDecompose()), maxRounds);
    }

    /**
     * Replace every CNOT with H CZ H on the target.
     */
    public static GateReplacer cnotToCz() {
        QuantumCircuit template = new QuantumCircuit(2)
                .add(Gate.on(GateKind.H, 0))
                .add(Gate.cz(0, 1))
                .add(Gate.on(GateKind.H, 0));
        return new GateReplacer("CXToCZ", Gate.cnot(0, 1), template);
    }

    /**
     * Compile for a device whose only two-qubit gate is CZ.
     */
    public static ICompilerRule czBasedChip(int maxRounds) {
        return new KroneckerSeqCompiler("CZBasedChipCompiler",
                Linq.list(new BasicDecompose(), cnotToCz(), new NeighborCanceler()), maxRounds);
    }

    /**
     * Cancel and merge neighboring gates until nothing changes.
     */
    public static ICompilerRule simplify(int maxRounds) {
        return new KroneckerSeqCompiler("Simplify", Linq.list(new NeighborCanceler()), maxRounds);
    }

    /**
     * Look up a preset by name.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static ICompilerRule fromName(String name, int maxRounds) {
        switch (name) {
            case "decompose":
                return basicDecompose(maxRounds);
            case "cz":
                return czBasedChip(maxRounds);
            case "simplify":
                return simplify(maxRounds);
            default:
                throw new IllegalArgumentException("Unknown rule set " + name +
                        "; expected one of decompose, cz, simplify");
        }
    }
}
