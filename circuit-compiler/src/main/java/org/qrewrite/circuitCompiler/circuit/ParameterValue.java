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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * The parameter of a gate: a constant plus a linear combination of named symbols,
 * e.g., 0.5 + 2*theta.  Immutable.
 */
public final class ParameterValue {
    /** Coefficients smaller than this are treated as zero. */
    public static final double EPSILON = 1e-12;

    public final double constant;
    /** Symbol name to coefficient; sorted by name, contains no zero coefficients. */
    private final TreeMap<String, Double> symbols;

    public static final ParameterValue ZERO = new ParameterValue(0.0, new TreeMap<>());

    private ParameterValue(double constant, TreeMap<String, Double> symbols) {
        // Adding 0.0 turns -0.0 into 0.0
        this.constant = constant + 0.0;
        this.symbols = symbols;
    }

    public ParameterValue(double constant, Map<String, Double> symbols) {
        this(constant, normalize(symbols));
    }

    public static ParameterValue of(double constant) {
        return new ParameterValue(constant, new TreeMap<>());
    }

    public static ParameterValue symbol(String name) {
        TreeMap<String, Double> map = new TreeMap<>();
        map.put(name, 1.0);
        return new ParameterValue(0.0, map);
    }

    static TreeMap<String, Double> normalize(Map<String, Double> symbols) {
        TreeMap<String, Double> result = new TreeMap<>();
        for (Map.Entry<String, Double> e: symbols.entrySet()) {
            if (Math.abs(e.getValue()) > EPSILON)
                result.put(e.getKey(), e.getValue());
        }
        return result;
    }

    public Map<String, Double> getSymbols() {
        return Collections.unmodifiableMap(this.symbols);
    }

    public boolean isConstant() {
        return this.symbols.isEmpty();
    }

    public boolean isZero() {
        return this.isConstant() && Math.abs(this.constant) <= EPSILON;
    }

    public ParameterValue add(ParameterValue other) {
        TreeMap<String, Double> sum = new TreeMap<>(this.symbols);
        for (Map.Entry<String, Double> e: other.symbols.entrySet())
            sum.merge(e.getKey(), e.getValue(), Double::sum);
        return new ParameterValue(this.constant + other.constant, normalize(sum));
    }

    public ParameterValue scale(double factor) {
        TreeMap<String, Double> scaled = new TreeMap<>();
        for (Map.Entry<String, Double> e: this.symbols.entrySet())
            scaled.put(e.getKey(), e.getValue() * factor);
        return new ParameterValue(this.constant * factor, normalize(scaled));
    }

    public ParameterValue negate() {
        return this.scale(-1.0);
    }

    /**
     * True if the two parameters are equal up to EPSILON.
     */
    public boolean same(ParameterValue other) {
        return this.add(other.negate()).isZero();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParameterValue that = (ParameterValue) o;
        return Double.compare(that.constant, this.constant) == 0 && this.symbols.equals(that.symbols);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.constant, this.symbols);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (Map.Entry<String, Double> e: this.symbols.entrySet()) {
            double coefficient = e.getValue();
            if (builder.length() > 0)
                builder.append(coefficient < 0 ? " - " : " + ");
            else if (coefficient < 0)
                builder.append("-");
            double abs = Math.abs(coefficient);
            if (abs != 1.0)
                builder.append(abs).append("*");
            builder.append(e.getKey());
        }
        if (builder.length() == 0)
            return Double.toString(this.constant);
        if (Math.abs(this.constant) > EPSILON)
            builder.append(this.constant < 0 ? " - " : " + ").append(Math.abs(this.constant));
        return builder.toString();
    }
}
