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

public class AcovEUnOp extends AcovExpression {
    public enum UOp {
        LNot("!", true),
        BNeg("~", false),
        UMinus("-", false),
        RedAnd("&", true),
        RedOr("|", true),
        RedXor("^", true),
        RedNand("~&", true),
        RedNor("~|", true),
        RedXnor("~^", true);

        private final String text;
        private final boolean reduction;

        UOp(String text, boolean reduction) {
            this.text = text;
            this.reduction = reduction;
        }

        /**
         * True if the result is a single bit whatever the operand width.
         */
        public boolean isReduction() {
            return this.reduction;
        }

        @Override
        public String toString() {
            return this.text;
        }
    }

    public final UOp uop;
    public final AcovExpression expr;

    public AcovEUnOp(@Nullable SourceRange range, UOp uop, AcovExpression expr) {
        super(range);
        this.uop = uop;
        this.expr = this.checkNull(expr);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "(" + this.uop + this.expr + ")";
    }
}
