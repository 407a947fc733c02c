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

package org.qrewrite.circuitCompiler.compiler.errors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Messages produced while compiling a circuit: errors and warnings.
 */
public class CompilerMessages {
    public static class Error {
        /** Index of the offending gate in the input circuit, or -1 if unknown. */
        public final int gateIndex;
        public final boolean warning;
        public final String errorType;
        public final String message;

        Error(int gateIndex, boolean warning, String errorType, String message) {
            this.gateIndex = gateIndex;
            this.warning = warning;
            this.errorType = errorType;
            this.message = message;
        }

        Error(CompilationError e) {
            this.gateIndex = e.gateIndex;
            this.warning = false;
            this.errorType = e.getErrorType();
            this.message = Objects.requireNonNullElse(e.getMessage(), "");
        }

        Error(Throwable e) {
            this.gateIndex = -1;
            this.warning = false;
            this.errorType = "This is a bug in the compiler (please report it to the developers)";
            this.message = Objects.requireNonNullElse(e.getMessage(), e.getClass().getSimpleName());
        }

        public void format(StringBuilder output) {
            output.append(this.errorType)
                    .append(System.lineSeparator());
            if (this.gateIndex >= 0)
                output.append("gate ")
                        .append(this.gateIndex)
                        .append(":");
            if (this.warning)
                output.append(" warning");
            else
                output.append(" error");
            output.append(": ")
                    .append(this.message)
                    .append(System.lineSeparator());
        }

        public JsonNode toJson(ObjectMapper mapper) {
            ObjectNode result = mapper.createObjectNode();
            result.put("gateIndex", this.gateIndex);
            result.put("warning", this.warning);
            result.put("errorType", this.errorType);
            result.put("message", this.message);
            return result;
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder();
            this.format(builder);
            return builder.toString();
        }
    }

    public final List<Error> messages;
    public int exitCode = 0;
    /** If true the messages are shown as JSON. */
    public final boolean emitJson;

    public CompilerMessages(boolean emitJson) {
        this.messages = new ArrayList<>();
        this.emitJson = emitJson;
    }

    public void setExitCode(int exitCode) {
        this.exitCode = exitCode;
    }

    void reportError(Error message) {
        this.messages.add(message);
        if (!message.warning)
            this.setExitCode(1);
    }

    public void reportError(int gateIndex, boolean warning, String errorType, String message) {
        this.reportError(new Error(gateIndex, warning, errorType, message));
    }

    public void reportError(CompilationError e) {
        this.reportError(new Error(e));
    }

    public void reportError(Throwable e) {
        this.reportError(new Error(e));
    }

    public int errorCount() {
        return this.messages.size();
    }

    public boolean hasErrors() {
        return this.exitCode != 0;
    }

    public Error getError(int ct) {
        return this.messages.get(ct);
    }

    public void show(PrintStream stream) {
        stream.print(this);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        if (this.emitJson) {
            JsonNode node = this.toJson();
            builder.append(node.toPrettyString());
        } else {
            for (Error message: this.messages) {
                message.format(builder);
            }
        }
        return builder.toString();
    }

    public JsonNode toJson() {
        ObjectMapper mapper = new ObjectMapper();
        ArrayNode result = mapper.createArrayNode();
        for (Error message: this.messages) {
            JsonNode node = message.toJson(mapper);
            result.add(node);
        }
        return result;
    }
}
