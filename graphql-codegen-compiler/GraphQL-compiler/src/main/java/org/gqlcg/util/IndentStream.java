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

package org.gqlcg.util;

import java.io.IOException;

/** Writes to an {@link Appendable}, indenting every line by the current
 * nesting level.  Indentation is emitted lazily, when the first character
 * of a line is written, so blank lines carry no trailing spaces. */
public class IndentStream implements IIndentStream {
    static final String INDENT = "    ";

    private Appendable stream;
    int level = 0;
    boolean atLineStart = false;

    public IndentStream(Appendable appendable) {
        this.stream = appendable;
    }

    /** Set the output stream.
     * @return The previous output stream. */
    public Appendable setOutputStream(Appendable appendable) {
        Appendable result = this.stream;
        this.stream = appendable;
        return result;
    }

    void write(CharSequence data) {
        try {
            if (this.atLineStart) {
                this.atLineStart = false;
                for (int i = 0; i < this.level; i++)
                    this.stream.append(INDENT);
            }
            this.stream.append(data);
        } catch (IOException ex) {
            throw new RuntimeException(ex);
        }
    }

    @Override
    public IIndentStream appendChar(char c) {
        if (c == '\n') {
            try {
                this.stream.append(c);
            } catch (IOException ex) {
                throw new RuntimeException(ex);
            }
            this.atLineStart = true;
        } else {
            this.write(String.valueOf(c));
        }
        return this;
    }

    @Override
    public IIndentStream appendFast(String s) {
        if (!s.isEmpty())
            this.write(s);
        return this;
    }

    @Override
    public IIndentStream increase() {
        this.level++;
        return this.newline();
    }

    @Override
    public IIndentStream decrease() {
        Utilities.enforce(this.level > 0, "Negative indent");
        this.level--;
        return this;
    }

    /** Drop any indentation left by an interrupted writer. */
    public void resetIndent() {
        this.level = 0;
    }

    @Override
    public String toString() {
        return this.stream.toString();
    }
}
