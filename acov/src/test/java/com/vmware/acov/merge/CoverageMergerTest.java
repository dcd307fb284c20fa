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

import com.vmware.acov.ScriptBuilder;
import com.vmware.acov.ir.GroupDeclaration;
import com.vmware.acov.ir.ScopeMatcher;
import com.vmware.acov.ir.Symbol;
import com.vmware.acov.raw.MemoryRawCoverage;
import com.vmware.acov.raw.ScopeData;
import com.vmware.acov.util.Linq;
import com.vmware.acov.util.Result;
import com.vmware.acov.width.ErrorsOr;
import com.vmware.acov.width.WidthPass;
import com.vmware.acov.width.WidthScript;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.math.BigInteger;
import java.util.*;

import static com.vmware.acov.ScriptBuilder.*;

public class CoverageMergerTest {
    private WidthScript script;
    private Symbol r8;
    private Symbol wide;

    /**
     * One module with three groups: an 8-bit record, a 4-bit bits record
     * and a group that only applies to scope "top.u1".
     */
    @Before
    public void setup() {
        ScriptBuilder sb = new ScriptBuilder();
        ScriptBuilder.ModuleBuilder mb = new ScriptBuilder.ModuleBuilder();
        Symbol x = mb.signal("x", 7, 0);
        Symbol w = mb.signal("w", 3, 0);
        this.r8 = mb.recordGroup("r8", sym(x));
        this.wide = mb.record("wide");
        Symbol only = mb.record("only");
        mb.block(null, rec(sym(w), this.wide), rec(sel(x, 0), only));
        mb.group(GroupDeclaration.bitsRecord(null, "wide", ScopeMatcher.anyScope, this.wide));
        mb.group(GroupDeclaration.recs(null, "only", ScopeMatcher.scopes("top.u1"), Linq.list(only)));
        sb.module("m", mb);
        ErrorsOr<WidthScript> checked = new WidthPass().run(sb.build());
        Assert.assertTrue(checked.isGood());
        this.script = checked.get();
    }

    @Test
    public void testMerge() {
        MemoryRawCoverage raw = new MemoryRawCoverage(12);
        MemoryRawCoverage.MemoryModuleData mod = raw.addModule();
        mod.scope("top.u0").add(0, 3, 255).add(1, 0, 1).add(-2, 2, 3);
        mod.scope("top.u1").add(2, 1);

        Result<Coverage> result = new CoverageMerger().merge(this.script, raw);
        Assert.assertTrue(result.toString(), result.isSuccess());
        Coverage coverage = result.get();
        Assert.assertEquals(12, coverage.tests);
        Assert.assertEquals(1, coverage.modules.size());
        ModCoverage m = coverage.modules.get(0);
        Assert.assertEquals("m", m.name);
        Assert.assertEquals(2, m.scopes.size());

        ScopeCoverage u0 = m.scopes.get(0);
        Assert.assertEquals("top.u0", u0.scope);
        Assert.assertEquals(3, u0.groups.size());
        Assert.assertEquals("r8", u0.groups.get(0).groupName);
        RecsCoverage recs = u0.groups.get(0).coverage.to(RecsCoverage.class);
        Assert.assertEquals(Linq.list(this.r8), recs.records);
        Assert.assertEquals(2, recs.values.size());
        BRecCoverage brec = u0.groups.get(1).coverage.to(BRecCoverage.class);
        Assert.assertEquals(this.wide, brec.record);
        Assert.assertEquals(Linq.list(0, 1), Linq.list(brec.ones.toArray(new Integer[0])));
        Assert.assertEquals(Linq.list(2, 3), Linq.list(brec.zeros.toArray(new Integer[0])));
        Assert.assertSame(BadScope.instance, u0.groups.get(2).coverage);

        ScopeCoverage u1 = m.scopes.get(1);
        RecsCoverage only = u1.groups.get(2).coverage.to(RecsCoverage.class);
        Assert.assertEquals(1, only.values.size());
        // Groups that match but saw nothing are empty, not BadScope.
        Assert.assertTrue(u1.groups.get(0).coverage.to(RecsCoverage.class).values.isEmpty());
        Assert.assertTrue(u1.groups.get(1).coverage.to(BRecCoverage.class).ones.isEmpty());
    }

    @Test
    public void testBadScopeCarriesNoData() {
        MemoryRawCoverage raw = new MemoryRawCoverage(1);
        raw.addModule().scope("top.u0").add(2, 1);
        Coverage coverage = new CoverageMerger().merge(this.script, raw).get();
        GroupCoverage gc = coverage.modules.get(0).scopes.get(0).groups.get(2).coverage;
        Assert.assertTrue(gc.is(BadScope.class));
        Assert.assertFalse(gc.is(RecsCoverage.class));
    }

    @Test
    public void testGroupKeyOverflow() {
        MemoryRawCoverage raw = new MemoryRawCoverage(1);
        raw.addModule().scope("top.u0").add(3, 1);
        Result<Coverage> result = new CoverageMerger().merge(this.script, raw);
        Assert.assertEquals("Maximum group key for module at scope top.u0 is 3, " +
                "which overflows the expected group length.", result.getError());
    }

    @Test
    public void testLastGroupKeyAccepted() {
        MemoryRawCoverage raw = new MemoryRawCoverage(1);
        raw.addModule().scope("top.u1").add(2, 0);
        Assert.assertTrue(new CoverageMerger().merge(this.script, raw).isSuccess());
    }

    @Test
    public void testValueTooWide() {
        MemoryRawCoverage raw = new MemoryRawCoverage(1);
        raw.addModule().scope("top.u0").add(0, 256);
        Result<Coverage> result = new CoverageMerger().merge(this.script, raw);
        Assert.assertEquals("The value 100 is more than 8 bits wide. " +
                "Are your acov.log files out of date?", result.getError());
    }

    @Test
    public void testFirstFailureWins() {
        MemoryRawCoverage raw = new MemoryRawCoverage(1);
        MemoryRawCoverage.MemoryModuleData mod = raw.addModule();
        mod.scope("top.a").add(1, 70);
        mod.scope("top.b").add(0, 300);
        Result<Coverage> result = new CoverageMerger().merge(this.script, raw);
        Assert.assertEquals("The index 70 is too big for the width (4).", result.getError());
    }

    /**
     * Scope data that hands out values in insertion order.
     */
    static class InsertionOrderScope implements ScopeData {
        private final Map<Integer, Set<BigInteger>> values = new HashMap<Integer, Set<BigInteger>>();

        InsertionOrderScope add(int key, long... v) {
            Set<BigInteger> set = this.values.computeIfAbsent(key, k -> new LinkedHashSet<BigInteger>());
            for (long l: v)
                set.add(BigInteger.valueOf(l));
            return this;
        }

        @Override
        public int maxGroupKey() {
            int max = -1;
            for (int k: this.values.keySet())
                max = Math.max(max, k < 0 ? -(k + 1) : k);
            return max;
        }

        @Override
        public Set<BigInteger> valuesForKey(int key) {
            return this.values.getOrDefault(key, Collections.emptySet());
        }
    }

    @Test
    public void testSmallestBadValueReported() {
        CoverageMerger merger = new CoverageMerger();
        ScopeData data = new InsertionOrderScope().add(0, 3, 300, 256);
        Result<ScopeCoverage> result = merger.mergeScope(this.script.modules.values().get(0), "top.u0", data);
        Assert.assertEquals("The value 100 is more than 8 bits wide. " +
                "Are your acov.log files out of date?", result.getError());
    }

    @Test
    public void testSmallestBadIndexReported() {
        CoverageMerger merger = new CoverageMerger();
        ScopeData ones = new InsertionOrderScope().add(1, 90, 70, 2);
        Assert.assertEquals("The index 70 is too big for the width (4).",
                merger.mergeScope(this.script.modules.values().get(0), "top.u0", ones).getError());
        ScopeData zeros = new InsertionOrderScope().add(-2, 1, -3, -1);
        Assert.assertEquals("The index -3 is negative, which is invalid.",
                merger.mergeScope(this.script.modules.values().get(0), "top.u0", zeros).getError());
    }

    @Test
    public void testCorruptZeros() {
        MemoryRawCoverage raw = new MemoryRawCoverage(1);
        raw.addModule().scope("top.a").add(-2, -1);
        Result<Coverage> result = new CoverageMerger().merge(this.script, raw);
        Assert.assertEquals("The index -1 is negative, which is invalid.", result.getError());
    }

    @Test
    public void testModuleCountMismatch() {
        MemoryRawCoverage raw = new MemoryRawCoverage(1);
        raw.addModule();
        raw.addModule();
        Result<Coverage> result = new CoverageMerger().merge(this.script, raw);
        Assert.assertEquals("Coverage log has 2 modules, but the script declares 1.", result.getError());

        Result<Coverage> lenient = new CoverageMerger(new MergeOptions(false)).merge(this.script, raw);
        Assert.assertTrue(lenient.isSuccess());
        Assert.assertEquals(1, lenient.get().modules.size());

        MemoryRawCoverage empty = new MemoryRawCoverage(1);
        Assert.assertTrue(new CoverageMerger().merge(this.script, empty).isFailure());
        Assert.assertTrue(new CoverageMerger(new MergeOptions(false)).merge(this.script, empty)
                .get().modules.isEmpty());
    }

    @Test
    public void testUnseenScopesAreAbsent() {
        MemoryRawCoverage raw = new MemoryRawCoverage(0);
        raw.addModule();
        Coverage coverage = new CoverageMerger().merge(this.script, raw).get();
        Assert.assertTrue(coverage.modules.get(0).scopes.isEmpty());
    }

    @Test
    public void testMergeOrThrow() {
        MemoryRawCoverage raw = new MemoryRawCoverage(1);
        raw.addModule().scope("top.u0").add(0, BigInteger.ONE.shiftLeft(64));
        try {
            new CoverageMerger().mergeOrThrow(this.script, raw);
            Assert.fail("Merge should have failed");
        } catch (CoverageMergeException ex) {
            Assert.assertTrue(ex.getMessage().startsWith("The value 10000000000000000 is more than 8 bits"));
        }
    }
}
