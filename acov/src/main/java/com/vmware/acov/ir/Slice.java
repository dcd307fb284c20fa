/*
 * Copyright (c) 2021 VMware, Inc.
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
 *
 */

package com.vmware.acov.ir;

import javax.annotation.Nullable;

/**
 * The declared bit range of a signal, as in {@code wire [7:0] x}.
 * The bounds may be given in either order.
 */
public class Slice extends AcovNode {
    public final int a;
    public final int b;

    public Slice(@Nullable SourceRange range, int a, int b) {
        super(range);
        this.a = a;
        this.b = b;
    }

    public Slice(int a, int b) {
        this(null, a, b);
    }

    public int getHigh() {
        return Math.max(this.a, this.b);
    }

    public int getLow() {
        return Math.min(this.a, this.b);
    }

    public int getWidth() {
        return this.getHigh() - this.getLow() + 1;
    }

    @Override
    public String toString() {
        return "[" + this.a + ":" + this.b + "]";
    }
}
