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

package com.vmware.acov.merge;

import com.vmware.acov.ir.Symbol;

import java.math.BigInteger;
import java.util.*;

/**
 * The values seen for a group of records.  Comparing them with a cover list is left to the report.
 */
public class RecsCoverage extends GroupCoverage {
    public final List<Symbol> records;
    public final SortedSet<BigInteger> values;

    public RecsCoverage(List<Symbol> records, Set<BigInteger> values) {
        this.records = Collections.unmodifiableList(new ArrayList<Symbol>(records));
        this.values = Collections.unmodifiableSortedSet(new TreeSet<BigInteger>(values));
    }

    @Override
    public String toString() {
        return "Recs" + this.records + this.values;
    }
}
