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

import com.vmware.acov.ir.AcovEBinOp;
import com.vmware.acov.ir.AcovEUnOp;
import com.vmware.acov.ir.VInt;
import com.vmware.acov.util.Result;
import com.vmware.acov.util.Utilities;

import javax.annotation.Nullable;
import java.math.BigInteger;

/**
 * Applies operators to constant integers, with Verilog semantics for sized values.
 */
public class Operators {
    // Larger shifts of unsized integers are rejected rather than materialized.
    static final int maxShift = 1 << 16;

    private static VInt bool(boolean b) {
        return new VInt(b ? BigInteger.ONE : BigInteger.ZERO, 1);
    }

    private static VInt truncate(BigInteger value, @Nullable Integer width) {
        if (width == null)
            return new VInt(value, null);
        return new VInt(value.and(Utilities.mask(width)), width);
    }

    @Nullable
    private static Integer joinWidths(VInt left, VInt right) {
        if (left.width == null)
            return right.width;
        if (right.width == null)
            return left.width;
        return Math.max(left.width, right.width);
    }

    private static Result<BigInteger> bits(String what, VInt value) {
        if (value.width != null)
            return Result.success(value.value.and(Utilities.mask(value.width)));
        if (value.value.signum() < 0)
            return Result.failure("Cannot " + what + " a negative integer with no width.");
        return Result.success(value.value);
    }

    // Sized values are compared and tested by their low bits only.
    private static BigInteger normal(VInt value) {
        if (value.width == null)
            return value.value;
        return value.value.and(Utilities.mask(value.width));
    }

    public static Result<VInt> applyUnOp(AcovEUnOp.UOp op, VInt value) {
        switch (op) {
            case LNot:
                return Result.success(bool(normal(value).signum() == 0));
            case BNeg:
                if (value.width == null)
                    return Result.failure("Cannot bitwise negate an integer with no width.");
                return Result.success(truncate(value.value.not(), value.width));
            case UMinus:
                return Result.success(truncate(value.value.negate(), value.width));
            case RedAnd:
            case RedNand: {
                if (value.width == null)
                    return Result.failure("Cannot and-reduce an integer with no width.");
                BigInteger mask = Utilities.mask(value.width);
                boolean all = value.value.and(mask).equals(mask);
                return Result.success(bool(all == (op == AcovEUnOp.UOp.RedAnd)));
            }
            case RedOr:
            case RedNor:
                return bits("or-reduce", value).map(
                        b -> bool((b.signum() != 0) == (op == AcovEUnOp.UOp.RedOr)));
            case RedXor:
            case RedXnor:
                return bits("xor-reduce", value).map(
                        b -> bool((b.bitCount() % 2 == 1) == (op == AcovEUnOp.UOp.RedXor)));
        }
        throw new RuntimeException("Unexpected operator " + op);
    }

    public static Result<VInt> applyBinOp(AcovEBinOp.BOp op, VInt left, VInt right) {
        Integer width = joinWidths(left, right);
        BigInteger l = normal(left);
        BigInteger r = normal(right);
        switch (op) {
            case Times:
                return Result.success(truncate(l.multiply(r), width));
            case Div:
                if (r.signum() == 0)
                    return Result.failure("Division by zero.");
                return Result.success(truncate(l.divide(r), width));
            case Mod:
                if (r.signum() == 0)
                    return Result.failure("Division by zero.");
                return Result.success(truncate(l.remainder(r), width));
            case Plus:
                return Result.success(truncate(l.add(r), width));
            case Minus:
                return Result.success(truncate(l.subtract(r), width));
            case ShiftL:
            case ShiftR: {
                if (r.signum() < 0 || r.compareTo(BigInteger.valueOf(maxShift)) > 0)
                    return Result.failure("Invalid shift amount " + r + ".");
                int amount = r.intValueExact();
                BigInteger shifted = op == AcovEBinOp.BOp.ShiftL ? l.shiftLeft(amount) : l.shiftRight(amount);
                return Result.success(truncate(shifted, left.width));
            }
            case Lt:
                return Result.success(bool(l.compareTo(r) < 0));
            case Lte:
                return Result.success(bool(l.compareTo(r) <= 0));
            case Gt:
                return Result.success(bool(l.compareTo(r) > 0));
            case Gte:
                return Result.success(bool(l.compareTo(r) >= 0));
            case Eq:
                return Result.success(bool(l.equals(r)));
            case Neq:
                return Result.success(bool(!l.equals(r)));
            case BAnd:
                return Result.success(truncate(l.and(r), width));
            case BXor:
                return Result.success(truncate(l.xor(r), width));
            case BOr:
                return Result.success(truncate(l.or(r), width));
            case LAnd:
                return Result.success(bool(l.signum() != 0 && r.signum() != 0));
            case LOr:
                return Result.success(bool(l.signum() != 0 || r.signum() != 0));
        }
        throw new RuntimeException("Unexpected operator " + op);
    }

    public static Result<VInt> applyCond(VInt cond, VInt ifTrue, VInt ifFalse) {
        if (ifTrue.width != null && ifFalse.width != null && !ifTrue.width.equals(ifFalse.width))
            return Result.failure("Branches have different widths: " +
                    ifTrue.width + " != " + ifFalse.width + ".");
        return Result.success(normal(cond).signum() == 0 ? ifFalse : ifTrue);
    }
}
