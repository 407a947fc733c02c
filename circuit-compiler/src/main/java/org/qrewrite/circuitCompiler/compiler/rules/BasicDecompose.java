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
import org.qrewrite.circuitCompiler.compiler.log.CompileLog;
import org.qrewrite.circuitCompiler.dag.DAGCircuit;
import org.qrewrite.circuitCompiler.dag.GateNode;

import java.util.List;

/**
 * Replaces every gate that has a known decomposition with that decomposition.
 * @see GateDecompositions
 */
public class BasicDecompose extends BasicCompilerRule {
    public BasicDecompose(String name) {
        super(name);
    }

    public BasicDecompose() {
        this("BasicDecompose");
    }

    @Override
    public boolean apply(DAGCircuit dag, CompileLog log) {
        int count = 0;
        for (GateNode node: dag.gateNodes()) {
            List<Gate> replacement = GateDecompositions.decompose(node.gate);
            if (replacement == null)
                continue;
            log.log(this.name + ": decomposing " + node.gate + " into " + replacement.size() + " gates",
                    CompileLog.STATE, this.logLevel);
            dag.replace(node, replacement);
            count++;
        }
        return count > 0;
    }
}
