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

package org.qrewrite.circuitCompiler.dag;

import javax.annotation.Nullable;
import java.util.TreeMap;

/**
 * A node of a {@link DAGCircuit}.
 * Each node is linked to at most one parent and one child on each qubit line it belongs to.
 */
public abstract class DAGNode {
    /**
     * Unique within the owning DAG; allocated in creation order.
     */
    public final int id;
    final TreeMap<Integer, DAGNode> parents;
    final TreeMap<Integer, DAGNode> children;

    protected DAGNode(int id) {
        this.id = id;
        this.parents = new TreeMap<>();
        this.children = new TreeMap<>();
    }

    @Nullable
    public DAGNode getParent(int qubit) {
        return this.parents.get(qubit);
    }

    @Nullable
    public DAGNode getChild(int qubit) {
        return this.children.get(qubit);
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(this.id);
    }

    @Override
    public boolean equals(Object obj) {
        return this == obj;
    }
}
