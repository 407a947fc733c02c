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

package org.qrewrite.util;

import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class IndentStreamTest {
    @Test
    public void indentsEveryLine() {
        StringBuilder builder = new StringBuilder();
        IndentStream stream = new IndentStream(builder).setIndentAmount(2);
        stream.append("a").newline()
                .increase()
                .append("b\nc")
                .newline()
                .decrease()
                .append("d");
        Assert.assertEquals("a\n  b\n  c\nd", builder.toString());
    }

    @Test
    public void emptyLinesAreNotIndented() {
        StringBuilder builder = new StringBuilder();
        IndentStream stream = new IndentStream(builder);
        stream.increase().append("x\n\ny");
        Assert.assertEquals("    x\n\n    y", builder.toString());
    }

    @Test
    public void join() {
        StringBuilder builder = new StringBuilder();
        new IndentStream(builder).join(", ", List.of(1, 2, 3)).append(true);
        Assert.assertEquals("1, 2, 3true", builder.toString());
    }

    @Test(expected = IllegalStateException.class)
    public void decreaseBelowZero() {
        new IndentStream(new StringBuilder()).decrease();
    }

    @Test
    public void moduleLevels() {
        StringBuilder builder = new StringBuilder();
        Appendable previous = Logger.instance.setDebugStream(builder);
        try {
            Logger.instance.setDebugLevel("IndentStreamTest", 1);
            IModule module = new IModule() {
                @Override
                public String getModule() {
                    return "IndentStreamTest";
                }
            };
            Logger.instance.from(module, 1).append("visible").newline();
            Logger.instance.from(module, 2).append("hidden").newline();
            Assert.assertEquals(1, module.getDebugLevel());
        } finally {
            Logger.instance.setDebugLevel("IndentStreamTest", 0);
            Logger.instance.setDebugStream(previous);
        }
        Assert.assertEquals("visible\n", builder.toString());
    }
}
