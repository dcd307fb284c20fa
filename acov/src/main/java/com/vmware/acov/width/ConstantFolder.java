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
import com.vmware.acov.util.Result;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Tries to evaluate an expression at compile time.  An expression that
 * refers to a signal, or whose operators cannot be applied, is simply
 * not constant: folding never fails.
 */
public class ConstantFolder implements ExpressionVisitor<Optional<VInt>> {
    private static final Logger logger = Logger.getLogger(ConstantFolder.class.getName());

    public Optional<VInt> fold(AcovExpression expression) {
        return expression.accept(this);
    }

    private Optional<VInt> fromResult(AcovExpression expression, Result<VInt> result) {
        if (result.isFailure()) {
            logger.fine(() -> "Not folding " + expression + ": " + result.getError());
            return Optional.empty();
        }
        return Optional.of(result.get());
    }

    @Override
    public Optional<VInt> visit(AcovESym expression) {
        return Optional.empty();
    }

    @Override
    public Optional<VInt> visit(AcovEInt expression) {
        return Optional.of(expression.value);
    }

    @Override
    public Optional<VInt> visit(AcovESelect expression) {
        return Optional.empty();
    }

    @Override
    public Optional<VInt> visit(AcovEConcat expression) {
        return Optional.empty();
    }

    @Override
    public Optional<VInt> visit(AcovEReplicate expression) {
        return Optional.empty();
    }

    @Override
    public Optional<VInt> visit(AcovEUnOp expression) {
        Optional<VInt> value = this.fold(expression.expr);
        if (!value.isPresent())
            return Optional.empty();
        return this.fromResult(expression, Operators.applyUnOp(expression.uop, value.get()));
    }

    @Override
    public Optional<VInt> visit(AcovEBinOp expression) {
        Optional<VInt> left = this.fold(expression.left);
        Optional<VInt> right = this.fold(expression.right);
        if (!left.isPresent() || !right.isPresent())
            return Optional.empty();
        return this.fromResult(expression,
                Operators.applyBinOp(expression.bop, left.get(), right.get()));
    }

    @Override
    public Optional<VInt> visit(AcovECond expression) {
        Optional<VInt> cond = this.fold(expression.cond);
        Optional<VInt> ifTrue = this.fold(expression.ifTrue);
        Optional<VInt> ifFalse = this.fold(expression.ifFalse);
        if (!cond.isPresent() || !ifTrue.isPresent() || !ifFalse.isPresent())
            return Optional.empty();
        return this.fromResult(expression,
                Operators.applyCond(cond.get(), ifTrue.get(), ifFalse.get()));
    }
}
