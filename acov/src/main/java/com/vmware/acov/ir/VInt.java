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
import java.math.BigInteger;
import java.util.Objects;

/**
 * An integer constant, optionally carrying a Verilog-style explicit width ({@code 8'd3}).
 */
public class VInt {
    public final BigInteger value;
    @Nullable
    public final Integer width;

    public VInt(BigInteger value, @Nullable Integer width) {
        this.value = Objects.requireNonNull(value);
        this.width = width;
    }

    public static VInt of(long value) {
        return new VInt(BigInteger.valueOf(value), null);
    }

    public static VInt sized(int width, long value) {
        return new VInt(BigInteger.valueOf(value), width);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VInt vInt = (VInt) o;
        return value.equals(vInt.value) && Objects.equals(width, vInt.width);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, width);
    }

    @Override
    public String toString() {
        if (this.width == null)
            return this.value.toString();
        return this.width + "'d" + this.value;
    }
}
