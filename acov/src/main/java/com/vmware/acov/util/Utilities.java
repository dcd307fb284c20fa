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

package com.vmware.acov.util;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.util.*;

public class Utilities {
    @SafeVarargs
    public static <T> List<T> concatenate(List<T>... lists) {
        ArrayList<T> result = new ArrayList<T>();
        for (List<T> l: lists)
            result.addAll(l);
        return result;
    }

    /**
     * put something in a hashmap that is supposed to be new.
     * @param map    Map to insert in.
     * @param key    Key to insert in map.
     * @param value  Value to insert in map.
     * @return       True if the key was not already mapped.
     */
    public static <K, V> boolean putNew(@Nullable Map<K, V> map, K key, V value) {
        V previous = Objects.requireNonNull(map).putIfAbsent(Objects.requireNonNull(key), Objects.requireNonNull(value));
        return previous == null;
    }

    /**
     * True if the value can be represented in two's complement with the given number of bits.
     * Non-negative values may use all the bits; negative values need a sign bit.
     */
    public static boolean fitsInBits(BigInteger value, int width) {
        if (value.signum() >= 0)
            return value.bitLength() <= width;
        return value.bitLength() <= width - 1;
    }

    /**
     * True if the value is non-negative and fits into width bits without a sign.
     */
    public static boolean fitsUnsigned(BigInteger value, int width) {
        return value.signum() >= 0 && value.bitLength() <= width;
    }

    public static BigInteger mask(int width) {
        return BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
    }
}
