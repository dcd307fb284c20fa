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

import com.vmware.acov.util.Linq;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * A concatenation {@code {e0, e1, ...}}.  The grammar requires at least one component.
 */
public class AcovEConcat extends AcovExpression {
    public final AcovExpression first;
    public final List<AcovExpression> rest;

    public AcovEConcat(@Nullable SourceRange range, AcovExpression first, List<AcovExpression> rest) {
        super(range);
        this.first = this.checkNull(first);
        this.rest = new ArrayList<AcovExpression>(rest);
    }

    public List<AcovExpression> getComponents() {
        List<AcovExpression> result = new ArrayList<AcovExpression>();
        result.add(this.first);
        result.addAll(this.rest);
        return result;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "{" + String.join(", ", Linq.map(this.getComponents(), AcovExpression::toString)) + "}";
    }
}
