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

import org.apache.commons.lang3.tuple.Pair;
import org.qrewrite.util.IndentStream;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists the rules of a rule tree as (depth, name) pairs, in preorder.
 */
public class RuleTreeLister extends RuleVisitor {
    private final List<Pair<Integer, String>> entries;
    private int depth;

    public RuleTreeLister() {
        super(true);
        this.entries = new ArrayList<>();
        this.depth = 0;
    }

    @Override
    public boolean preorder(ICompilerRule rule) {
        this.entries.add(Pair.of(this.depth, rule.getName()));
        this.depth++;
        return true;
    }

    @Override
    public void postorder(ICompilerRule rule) {
        this.depth--;
    }

    public List<Pair<Integer, String>> getEntries() {
        return this.entries;
    }

    public static List<Pair<Integer, String>> list(ICompilerRule rule) {
        RuleTreeLister lister = new RuleTreeLister();
        rule.accept(lister);
        return lister.getEntries();
    }

    /**
     * Render a rule tree as text, one rule per line, children indented below their parent.
     */
    public static String render(ICompilerRule rule) {
        StringBuilder builder = new StringBuilder();
        IndentStream stream = new IndentStream(builder).setIndentAmount(2);
        for (Pair<Integer, String> entry: list(rule)) {
            stream.setIndent(entry.getLeft())
                    .append(entry.getRight())
                    .newline();
        }
        return builder.toString();
    }
}
