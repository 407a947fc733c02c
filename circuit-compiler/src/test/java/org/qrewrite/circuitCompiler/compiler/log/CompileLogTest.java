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

package org.qrewrite.circuitCompiler.compiler.log;

import org.junit.Assert;
import org.junit.Test;
import org.qrewrite.circuitCompiler.circuit.Gate;
import org.qrewrite.circuitCompiler.circuit.GateKind;
import org.qrewrite.circuitCompiler.circuit.ParameterValue;
import org.qrewrite.circuitCompiler.circuit.QuantumCircuit;
import org.qrewrite.circuitCompiler.compiler.CircuitCompiler;
import org.qrewrite.circuitCompiler.compiler.CompilerPresets;
import org.qrewrite.circuitCompiler.compiler.rules.BasicDecompose;
import org.qrewrite.circuitCompiler.compiler.rules.ICompilerRule;
import org.qrewrite.circuitCompiler.compiler.rules.KroneckerSeqCompiler;
import org.qrewrite.circuitCompiler.compiler.rules.NeighborCanceler;
import org.qrewrite.circuitCompiler.compiler.rules.SequentialCompiler;
import org.qrewrite.circuitCompiler.dag.DAGCircuit;
import org.qrewrite.util.Linq;

import java.util.List;

public class CompileLogTest {
    static QuantumCircuit swapCircuit() {
        return new QuantumCircuit(2)
                .add(Gate.twoQubit(GateKind.SWAP, null, 0, 1))
                .add(Gate.on(GateKind.H, 1));
    }

    @Test
    public void levels() {
        StringBuilder builder = new StringBuilder();
        CompileLog log = new CompileLog(builder);
        Assert.assertFalse(log.log("never", CompileLog.SILENT, CompileLog.STATE));
        Assert.assertFalse(log.log("too detailed", CompileLog.STATE, CompileLog.SUMMARY));
        Assert.assertTrue(log.log("shown", CompileLog.SUMMARY, CompileLog.SUMMARY));
        Assert.assertFalse(log.log("silent rule", CompileLog.SUMMARY, CompileLog.SILENT));
        Assert.assertEquals("shown\n", builder.toString());
    }

    @Test
    public void indentationIsRestored() {
        StringBuilder builder = new StringBuilder();
        CompileLog log = new CompileLog(builder);
        try (CompileLog.Indentation outer = log.indent()) {
            Assert.assertEquals(1, log.getDepth());
            try (CompileLog.Indentation inner = log.indent()) {
                log.log("deep", 1, 1);
                Assert.assertEquals(2, log.getDepth());
            }
            log.log("middle", 1, 1);
        }
        log.log("top", 1, 1);
        Assert.assertEquals(0, log.getDepth());
        Assert.assertEquals("    deep\n  middle\ntop\n", builder.toString());
    }

    @Test
    public void indentationIsRestoredOnException() {
        CompileLog log = CompileLog.silent();
        try (CompileLog.Indentation ignored = log.indent()) {
            log.indent();
            log.indent();
            throw new IllegalStateException("rule failed");
        } catch (IllegalStateException ex) {
            Assert.assertEquals("rule failed", ex.getMessage());
        }
        Assert.assertEquals(0, log.getDepth());
    }

    @Test
    public void closingTwiceIsHarmless() {
        CompileLog log = CompileLog.silent();
        CompileLog.Indentation indentation = log.indent();
        indentation.close();
        log.indent();
        indentation.close();
        Assert.assertEquals(1, log.getDepth());
    }

    @Test
    public void summaryTrace() {
        StringBuilder builder = new StringBuilder();
        ICompilerRule rule = new KroneckerSeqCompiler("Outer", Linq.list(
                new SequentialCompiler("Inner", Linq.list(new BasicDecompose()))));
        rule.setAllLogLevel(CompileLog.SUMMARY);
        rule.apply(DAGCircuit.build(swapCircuit()), new CompileLog(builder));
        String expected = "Running Outer: 1 child (Inner).\n" +
                "  Running Inner: 1 child (BasicDecompose).\n" +
                "  Inner: successfully compiled.\n" +
                "  Running Inner: 1 child (BasicDecompose).\n" +
                "  Inner: nothing happened.\n" +
                "Outer: successfully compiled.\n";
        Assert.assertEquals(expected, builder.toString());
    }

    @Test
    public void stateTrace() {
        StringBuilder builder = new StringBuilder();
        ICompilerRule rule = new KroneckerSeqCompiler("Saturate", Linq.list(new BasicDecompose(), new NeighborCanceler()));
        rule.setAllLogLevel(CompileLog.STATE);
        rule.apply(DAGCircuit.build(swapCircuit()), new CompileLog(builder));
        String trace = builder.toString();
        Assert.assertTrue(trace.startsWith("Running Saturate: 2 child (BasicDecompose, NeighborCanceler).\n"));
        Assert.assertTrue(trace.contains("  Saturate: state for each rule -> [true, false]\n"));
        Assert.assertTrue(trace.contains("  Saturate: state for each rule -> [false, false]\n"));
        Assert.assertTrue(trace.endsWith("Saturate: successfully compiled.\n"));
    }

    @Test
    public void quietChildInsideVerboseParent() {
        StringBuilder builder = new StringBuilder();
        SequentialCompiler inner = new SequentialCompiler("Inner", Linq.list(new BasicDecompose()));
        KroneckerSeqCompiler outer = new KroneckerSeqCompiler("Outer", Linq.list(inner));
        outer.setLogLevel(CompileLog.SUMMARY);
        outer.apply(DAGCircuit.build(swapCircuit()), new CompileLog(builder));
        Assert.assertFalse(builder.toString().contains("Inner"));
        Assert.assertTrue(builder.toString().contains("Outer: successfully compiled."));
    }

    @Test
    public void loggingDoesNotChangeResults() {
        QuantumCircuit circuit = new QuantumCircuit(3)
                .add(Gate.controlled(GateKind.X, 2, 0, 1))
                .add(Gate.controlledPhase(ParameterValue.of(0.7), 0, 2))
                .add(Gate.twoQubit(GateKind.RXX, ParameterValue.symbol("t"), 1, 2));
        ICompilerRule quiet = CompilerPresets.czBasedChip(0);
        QuantumCircuit silent = CircuitCompiler.compileCircuit(quiet, circuit);
        ICompilerRule verbose = CompilerPresets.czBasedChip(0).setAllLogLevel(CompileLog.STATE);
        StringBuilder builder = new StringBuilder();
        QuantumCircuit traced = CircuitCompiler.compileCircuit(verbose, circuit, new CompileLog(builder));
        Assert.assertEquals(silent, traced);
        Assert.assertFalse(builder.toString().isEmpty());
    }

    @Test
    public void showState() {
        Assert.assertEquals("[true, false]", CompileLog.showState(List.of(true, false)));
    }
}
