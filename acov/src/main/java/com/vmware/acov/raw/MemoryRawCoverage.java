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

package com.vmware.acov.raw;

import java.math.BigInteger;
import java.util.*;

/**
 * Raw coverage held in memory, filled by a log reader or by tests.
 */
public class MemoryRawCoverage implements RawCoverage {
    public static class MemoryScopeData implements ScopeData {
        private final Map<Integer, SortedSet<BigInteger>> values = new HashMap<Integer, SortedSet<BigInteger>>();

        public MemoryScopeData add(int key, BigInteger... data) {
            SortedSet<BigInteger> set = this.values.computeIfAbsent(key, k -> new TreeSet<BigInteger>());
            Collections.addAll(set, data);
            return this;
        }

        public MemoryScopeData add(int key, long... data) {
            for (long d: data)
                this.add(key, BigInteger.valueOf(d));
            return this;
        }

        @Override
        public int maxGroupKey() {
            int max = -1;
            for (int key: this.values.keySet()) {
                // Key -(k + 1) belongs to group k.
                int group = key >= 0 ? key : -(key + 1);
                max = Math.max(max, group);
            }
            return max;
        }

        @Override
        public Set<BigInteger> valuesForKey(int key) {
            SortedSet<BigInteger> set = this.values.get(key);
            if (set == null)
                return Collections.emptySortedSet();
            return Collections.unmodifiableSortedSet(set);
        }
    }

    public static class MemoryModuleData implements ModuleData {
        private final SortedMap<String, ScopeData> scopes = new TreeMap<String, ScopeData>();

        public MemoryScopeData scope(String name) {
            return (MemoryScopeData)this.scopes.computeIfAbsent(name, n -> new MemoryScopeData());
        }

        @Override
        public Map<String, ScopeData> scopes() {
            return Collections.unmodifiableSortedMap(this.scopes);
        }
    }

    private final int testCount;
    private final List<MemoryModuleData> modules;

    public MemoryRawCoverage(int testCount) {
        this.testCount = testCount;
        this.modules = new ArrayList<MemoryModuleData>();
    }

    public MemoryModuleData addModule() {
        MemoryModuleData data = new MemoryModuleData();
        this.modules.add(data);
        return data;
    }

    @Override
    public int testCount() {
        return this.testCount;
    }

    @Override
    public int moduleCount() {
        return this.modules.size();
    }

    @Override
    public ModuleData moduleData(int index) {
        return this.modules.get(index);
    }
}
