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

public class AcovEBinOp extends AcovExpression {
    public enum BOp {
        Times("*"), Div("/"), Mod("%"), Plus("+"), Minus("-"),
        ShiftL("<<"), ShiftR(">>"),
        Lt("<"), Lte("<="), Gt(">"), Gte(">="), Eq("=="), Neq("!="),
        BAnd("&"), BXor("^"), BOr("|"),
        LAnd("&&"), LOr("||");

        private final String text;

        BOp(String text) {
            this.text = text;
        }

        /**
         * Comparisons and logical connectives produce a single bit.
         */
        public boolean isReduction() {
            switch (this) {
                case Lt:
                case Lte:
                case Gt:
                case Gte:
                case Eq:
                case Neq:
                case LAnd:
                case LOr:
                    return true;
                default:
                    return false;
            }
        }

        @Override
        public String toString() {
            return this.text;
        }
    }

    public final BOp bop;
    public final AcovExpression left;
    public final AcovExpression right;

    public AcovEBinOp(@Nullable SourceRange range, BOp bop, AcovExpression left, AcovExpression right) {
        super(range);
        this.bop = bop;
        this.left = this.checkNull(left);
        this.right = this.checkNull(right);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "(" + this.left + " " + this.bop + " " + this.right + ")";
    }
}
