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

import java.util.Objects;

/**
 * Base class for compiler rules: holds the name and the display log level.
 */
public abstract class BasicCompilerRule implements ICompilerRule {
    protected final String name;
    protected int logLevel;

    protected BasicCompilerRule(String name, int logLevel) {
        this.name = Objects.requireNonNull(name);
        this.logLevel = logLevel;
    }

    protected BasicCompilerRule(String name) {
        this(name, 0);
    }

    @Override
    public String getName() {
        return this.name;
    }

    @Override
    public int getLogLevel() {
        return this.logLevel;
    }

    @Override
    public BasicCompilerRule setLogLevel(int level) {
        this.logLevel = level;
        return this;
    }

    @Override
    public void accept(RuleVisitor visitor) {
        if (!visitor.preorder(this)) return;
        visitor.postorder(this);
    }

    @Override
    public String toString() {
        return RuleTreeLister.render(this).trim();
    }
}
