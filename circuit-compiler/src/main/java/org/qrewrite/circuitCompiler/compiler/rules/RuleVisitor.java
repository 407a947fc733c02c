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

/**
 * Depth-first traversal of a tree of compiler rules.
 */
@SuppressWarnings("SameReturnValue")
public abstract class RuleVisitor {
    /// If true each visit call will visit by default the superclass.
    final boolean visitSuper;

    protected RuleVisitor(boolean visitSuper) {
        this.visitSuper = visitSuper;
    }

    // preorder methods return 'true' when normal traversal is desired,
    // and 'false' when the traversal should not visit the children of the current rule.
    public boolean preorder(ICompilerRule rule) { return true; }

    public boolean preorder(SequentialCompiler rule) {
        if (this.visitSuper) return this.preorder((ICompilerRule) rule);
        else return true;
    }

    public boolean preorder(KroneckerSeqCompiler rule) {
        if (this.visitSuper) return this.preorder((SequentialCompiler) rule);
        else return true;
    }

    ////////////////////////////////////

    public void postorder(ICompilerRule ignored) {}

    public void postorder(SequentialCompiler rule) {
        if (this.visitSuper) this.postorder((ICompilerRule) rule);
    }

    public void postorder(KroneckerSeqCompiler rule) {
        if (this.visitSuper) this.postorder((SequentialCompiler) rule);
    }
}
