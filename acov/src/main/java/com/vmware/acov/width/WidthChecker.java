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

package com.vmware.acov.width;

import com.vmware.acov.ir.*;
import com.vmware.acov.util.Linq;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Computes the width of expressions over the signals of one module.
 * Widths are never promoted: operands of binary operators and the branches
 * of a conditional must have exactly the same width.
 */
public class WidthChecker implements ExpressionVisitor<ErrorsOr<Integer>> {
    private final SymbolTable<Slice> signals;
    private final ConstantFolder folder;

    public WidthChecker(SymbolTable<Slice> signals, ConstantFolder folder) {
        this.signals = signals;
        this.folder = folder;
    }

    public WidthChecker(SymbolTable<Slice> signals) {
        this(signals, new ConstantFolder());
    }

    public ErrorsOr<Integer> width(AcovExpression expression) {
        return expression.accept(this);
    }

    static ErrorsOr<Void> checkWidth1(AcovExpression expression, int width) {
        if (width != 1)
            return ErrorsOr.bad(expression.getRange(),
                    "Expression has width " + width + " != 1 so can't be used as a condition.");
        return ErrorsOr.ok();
    }

    static ErrorsOr<Void> checkWidths(String opName, AcovExpression expression, int left, int right) {
        if (left != right)
            return ErrorsOr.bad(expression.getRange(),
                    "Left and right side of " + opName + " operator have different widths: " +
                    left + " != " + right + ".");
        return ErrorsOr.ok();
    }

    private static ErrorsOr<Integer> exact(AcovExpression expression, long width) {
        if (width > Integer.MAX_VALUE)
            return ErrorsOr.bad(expression.getRange(), "Expression is too wide: " + width + " bits.");
        return ErrorsOr.good((int)width);
    }

    @Override
    public ErrorsOr<Integer> visit(AcovESym expression) {
        return ErrorsOr.good(this.signals.get(expression.symbol).getWidth());
    }

    @Override
    public ErrorsOr<Integer> visit(AcovEInt expression) {
        Integer width = expression.value.width;
        if (width == null)
            return ErrorsOr.bad(expression.getRange(), "Integer with no width used in expression.");
        return ErrorsOr.good(width);
    }

    @Override
    public ErrorsOr<Integer> visit(AcovESelect expression) {
        Optional<VInt> i0 = this.folder.fold(expression.index0);
        Optional<VInt> i1 = expression.index1 == null ? i0 : this.folder.fold(expression.index1);
        if (!i0.isPresent() || !i1.isPresent())
            return ErrorsOr.bad(expression.getRange(), "Can't compute width of bit selection.");

        BigInteger a = i0.get().value;
        BigInteger b = i1.get().value;
        BigInteger hi = a.max(b);
        BigInteger lo = a.min(b);
        Slice slice = this.signals.get(expression.symbol);
        if (lo.compareTo(BigInteger.valueOf(slice.getLow())) < 0 ||
                hi.compareTo(BigInteger.valueOf(slice.getHigh())) > 0)
            return ErrorsOr.bad(expression.getRange(), "Bit selection overflows size of symbol.");
        return ErrorsOr.good(hi.subtract(lo).intValueExact() + 1);
    }

    @Override
    public ErrorsOr<Integer> visit(AcovEConcat expression) {
        List<ErrorsOr<Integer>> widths = Linq.map(expression.getComponents(), this::width);
        return ErrorsOr.all(widths).flatMap(ws -> {
            long sum = 0;
            for (int w: ws)
                sum += w;
            return exact(expression, sum);
        });
    }

    @Override
    public ErrorsOr<Integer> visit(AcovEReplicate expression) {
        return this.width(expression.expr).flatMap(
                w -> exact(expression, (long)expression.count * w));
    }

    @Override
    public ErrorsOr<Integer> visit(AcovEUnOp expression) {
        return this.width(expression.expr).map(
                w -> expression.uop.isReduction() ? 1 : w);
    }

    @Override
    public ErrorsOr<Integer> visit(AcovEBinOp expression) {
        ErrorsOr<Integer> left = this.width(expression.left);
        ErrorsOr<Integer> right = this.width(expression.right);
        return ErrorsOr.combine(left, right, (l, r) -> new int[] { l, r }).flatMap(
                ws -> checkWidths(expression.bop.toString(), expression, ws[0], ws[1]).map(
                        ignored -> expression.bop.isReduction() ? 1 : ws[0]));
    }

    @Override
    public ErrorsOr<Integer> visit(AcovECond expression) {
        List<ErrorsOr<Integer>> widths = Linq.list(
                this.width(expression.cond),
                this.width(expression.ifTrue),
                this.width(expression.ifFalse));
        return ErrorsOr.all(widths).flatMap(ws -> ErrorsOr.both(
                checkWidth1(expression.cond, ws.get(0)),
                checkWidths("conditional", expression.ifTrue, ws.get(1), ws.get(2)))
                .map(ignored -> ws.get(1)));
    }
}
