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

package org.qrewrite.circuitCompiler;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import org.qrewrite.circuitCompiler.circuit.CircuitJson;
import org.qrewrite.circuitCompiler.circuit.QuantumCircuit;
import org.qrewrite.circuitCompiler.compiler.CircuitCompiler;
import org.qrewrite.circuitCompiler.compiler.CompilerOptions;
import org.qrewrite.circuitCompiler.compiler.CompilerPresets;
import org.qrewrite.circuitCompiler.compiler.errors.CompilationError;
import org.qrewrite.circuitCompiler.compiler.errors.CompilerMessages;
import org.qrewrite.circuitCompiler.compiler.log.CompileLog;
import org.qrewrite.circuitCompiler.compiler.rules.ICompilerRule;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * Main entry point of the circuit compiler.
 */
public class CompilerMain {
    final CompilerOptions options;

    CompilerMain() {
        this.options = new CompilerOptions();
    }

    /**
     * Parse the command-line options.
     * @return False if the program should stop: the options are invalid or help was requested.
     */
    boolean parseOptions(String[] argv) {
        JCommander commander = JCommander.newBuilder()
                .addObject(this.options)
                .build();
        commander.setProgramName("circuit-compiler");
        try {
            commander.parse(argv);
        } catch (ParameterException ex) {
            System.err.println(ex.getMessage());
            commander.usage();
            return false;
        }
        if (this.options.help) {
            commander.usage();
            return false;
        }
        return true;
    }

    void writeToOutput(String program, @Nullable String outputFile) throws IOException {
        PrintStream outputStream;
        if (outputFile == null) {
            outputStream = System.out;
        } else {
            outputStream = new PrintStream(Files.newOutputStream(Paths.get(outputFile)), false, StandardCharsets.UTF_8);
        }
        outputStream.print(program);
        if (outputFile == null)
            outputStream.flush();
        else
            outputStream.close();
    }

    String readInput(@Nullable String inputFile) throws IOException {
        if (inputFile == null) {
            InputStream stream = System.in;
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } else {
            return Files.readString(Paths.get(inputFile), StandardCharsets.UTF_8);
        }
    }

    /**
     * Run compiler, return the messages produced.
     */
    CompilerMessages run() {
        CompilerMessages messages = new CompilerMessages(this.options.ioOptions.emitJsonErrors);
        String input;
        try {
            input = this.readInput(this.options.ioOptions.inputFile);
        } catch (IOException e) {
            messages.reportError(-1, false, "Error reading file", e.getMessage());
            return messages;
        }

        String output;
        try {
            QuantumCircuit circuit = CircuitJson.fromJson(input);
            ICompilerRule rule = CompilerPresets.fromName(
                    this.options.optimizerOptions.preset, this.options.optimizerOptions.maxRounds);
            rule.setAllLogLevel(this.options.ioOptions.logLevel);
            CircuitCompiler compiler = new CircuitCompiler(this.options);
            QuantumCircuit result = compiler.compile(rule, circuit, CompileLog.to(System.err));
            if (this.options.ioOptions.emitText)
                output = result.toString();
            else
                output = CircuitJson.toJson(result) + System.lineSeparator();
        } catch (CompilationError e) {
            messages.reportError(e);
            return messages;
        } catch (IllegalArgumentException e) {
            messages.reportError(-1, false, "Invalid option", e.getMessage());
            return messages;
        }

        try {
            this.writeToOutput(output, this.options.ioOptions.outputFile);
        } catch (IOException e) {
            messages.reportError(-1, false, "Error writing to file", e.getMessage());
        }
        return messages;
    }

    public static CompilerMessages execute(String... argv) {
        CompilerMain main = new CompilerMain();
        if (!main.parseOptions(argv)) {
            CompilerMessages messages = new CompilerMessages(false);
            messages.setExitCode(1);
            return messages;
        }
        return main.run();
    }

    public static void main(String[] argv) {
        CompilerMessages messages = execute(argv);
        messages.show(System.err);
        System.exit(messages.exitCode);
    }
}
