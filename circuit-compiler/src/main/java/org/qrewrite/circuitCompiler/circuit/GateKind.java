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

/**
 * The operations that can appear in a circuit.
 * Controlled versions of an operation are expressed with control qubits
 * on a gate, not with separate kinds.
 */
public enum GateKind {
    I(1, false, true),
    X(1, false, true),
    Y(1, false, true),
    Z(1, false, true),
    H(1, false, true),
    S(1, false, false),
    SDAG(1, false, false),
    T(1, false, false),
    TDAG(1, false, false),
    RX(1, true, false),
    RY(1, true, false),
    RZ(1, true, false),
    /** Phase shift; with one control this is the controlled-phase gate. */
    PS(1, true, false),
    SWAP(2, false, true),
    RXX(2, true, false),
    RYY(2, true, false),
    RZZ(2, true, false);

    /** Number of target qubits. */
    public final int targetCount;
    public final boolean parameterized;
    /** True if the gate is its own inverse. */
    public final boolean hermitian;

    GateKind(int targetCount, boolean parameterized, boolean hermitian) {
        this.targetCount = targetCount;
        this.parameterized = parameterized;
        this.hermitian = hermitian;
    }

    /**
     * The kind of the inverse operation.
     * Parameterized kinds are inverted by negating the parameter, so they are their own inverse kind.
     */
    public GateKind inverse() {
        switch (this) {
            case S:
                return SDAG;
            case SDAG:
                return S;
            case T:
                return TDAG;
            case TDAG:
                return T;
            default:
                return this;
        }
    }

    /**
     * True for rotations whose parameters add up when two of them are applied in sequence.
     */
    public boolean isRotation() {
        return this.parameterized;
    }

    @Nullable
    public static GateKind fromName(String name) {
        for (GateKind kind: GateKind.values())
            if (kind.name().equalsIgnoreCase(name))
                return kind;
        return null;
    }
}
