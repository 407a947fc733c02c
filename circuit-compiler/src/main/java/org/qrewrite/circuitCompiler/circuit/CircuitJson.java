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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.qrewrite.circuitCompiler.compiler.errors.InvalidCircuitException;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts circuits to and from JSON.
 * <pre>
 * { "qubits": 2,
 *   "gates": [ { "gate": "PS", "targets": [1], "controls": [0],
 *                "parameter": { "constant": 0.0, "symbols": { "a": 1.0 } } } ] }
 * </pre>
 */
public class CircuitJson {
    private final ObjectMapper mapper;

    public CircuitJson() {
        this.mapper = new ObjectMapper();
    }

    public static String toJson(QuantumCircuit circuit) {
        return new CircuitJson().toTree(circuit).toPrettyString();
    }

    public static QuantumCircuit fromJson(String json) {
        CircuitJson reader = new CircuitJson();
        JsonNode root;
        try {
            root = reader.mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidCircuitException("Could not parse JSON: " + e.getOriginalMessage(), e);
        }
        return reader.fromTree(root);
    }

    public ObjectNode toTree(QuantumCircuit circuit) {
        ObjectNode root = this.mapper.createObjectNode();
        root.put("qubits", circuit.getQubitCount());
        ArrayNode gates = root.putArray("gates");
        for (Gate gate: circuit.gates())
            gates.add(this.toTree(gate));
        return root;
    }

    ObjectNode toTree(Gate gate) {
        ObjectNode result = this.mapper.createObjectNode();
        result.put("gate", gate.kind.name());
        ArrayNode targets = result.putArray("targets");
        for (int t: gate.getTargets())
            targets.add(t);
        ArrayNode controls = result.putArray("controls");
        for (int c: gate.getControls())
            controls.add(c);
        if (gate.parameter != null) {
            ObjectNode parameter = result.putObject("parameter");
            parameter.put("constant", gate.parameter.constant);
            ObjectNode symbols = parameter.putObject("symbols");
            for (Map.Entry<String, Double> e: gate.parameter.getSymbols().entrySet())
                symbols.put(e.getKey(), e.getValue());
        }
        return result;
    }

    public QuantumCircuit fromTree(JsonNode root) {
        JsonNode qubits = root.get("qubits");
        if (qubits == null || !qubits.isInt())
            throw new InvalidCircuitException("Expected integer field 'qubits'");
        if (qubits.asInt() < 0)
            throw new InvalidCircuitException("Negative qubit count " + qubits.asInt());
        QuantumCircuit result = new QuantumCircuit(qubits.asInt());
        JsonNode gates = root.get("gates");
        if (gates == null || !gates.isArray())
            throw new InvalidCircuitException("Expected array field 'gates'");
        int index = 0;
        for (JsonNode gate: gates) {
            result.add(this.gateFromTree(gate, index));
            index++;
        }
        return result;
    }

    Gate gateFromTree(JsonNode node, int index) {
        JsonNode name = node.get("gate");
        if (name == null || !name.isTextual())
            throw new InvalidCircuitException("Expected string field 'gate'", index);
        GateKind kind = GateKind.fromName(name.asText());
        if (kind == null)
            throw new InvalidCircuitException("Unknown gate " + name.asText(), index);
        List<Integer> targets = this.qubitList(node, "targets", index, true);
        List<Integer> controls = this.qubitList(node, "controls", index, false);
        ParameterValue parameter = this.parameterFromTree(node.get("parameter"), index);
        try {
            return new Gate(kind, parameter, targets, controls);
        } catch (IllegalArgumentException e) {
            throw new InvalidCircuitException(e.getMessage(), index);
        }
    }

    List<Integer> qubitList(JsonNode node, String field, int index, boolean required) {
        List<Integer> result = new ArrayList<>();
        JsonNode list = node.get(field);
        if (list == null) {
            if (required)
                throw new InvalidCircuitException("Expected array field '" + field + "'", index);
            return result;
        }
        if (!list.isArray())
            throw new InvalidCircuitException("Field '" + field + "' is not an array", index);
        for (JsonNode element: list) {
            if (!element.isInt())
                throw new InvalidCircuitException("Qubit index " + element + " is not an integer", index);
            result.add(element.asInt());
        }
        return result;
    }

    @Nullable
    ParameterValue parameterFromTree(@Nullable JsonNode node, int index) {
        if (node == null || node.isNull())
            return null;
        if (node.isNumber())
            return ParameterValue.of(node.asDouble());
        if (node.isTextual())
            return ParameterValue.symbol(node.asText());
        if (!node.isObject())
            throw new InvalidCircuitException("Cannot parse parameter " + node, index);
        double constant = 0.0;
        JsonNode c = node.get("constant");
        if (c != null) {
            if (!c.isNumber())
                throw new InvalidCircuitException("Parameter constant " + c + " is not a number", index);
            constant = c.asDouble();
        }
        Map<String, Double> symbols = new TreeMap<>();
        JsonNode s = node.get("symbols");
        if (s != null) {
            if (!s.isObject())
                throw new InvalidCircuitException("Parameter symbols must be an object", index);
            Iterator<Map.Entry<String, JsonNode>> it = s.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (!e.getValue().isNumber())
                    throw new InvalidCircuitException("Coefficient of " + e.getKey() + " is not a number", index);
                symbols.put(e.getKey(), e.getValue().asDouble());
            }
        }
        return new ParameterValue(constant, symbols);
    }
}
