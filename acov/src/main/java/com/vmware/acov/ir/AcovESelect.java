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
 * A bit selection {@code s[i]} or a range selection {@code s[i:j]}.
 */
public class AcovESelect extends AcovExpression {
    public final Symbol symbol;
    public final AcovExpression index0;
    @Nullable
    public final AcovExpression index1;

    public AcovESelect(@Nullable SourceRange range, Symbol symbol,
                       AcovExpression index0, @Nullable AcovExpression index1) {
        super(range);
        this.symbol = this.checkNull(symbol);
        this.index0 = this.checkNull(index0);
        this.index1 = index1;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        if (this.index1 == null)
            return this.symbol + "[" + this.index0 + "]";
        return this.symbol + "[" + this.index0 + ":" + this.index1 + "]";
    }
}
