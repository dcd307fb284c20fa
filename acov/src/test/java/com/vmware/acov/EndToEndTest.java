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

package com.vmware.acov;

import com.vmware.acov.ir.GroupDeclaration;
import com.vmware.acov.ir.ScopeMatcher;
import com.vmware.acov.ir.Symbol;
import com.vmware.acov.merge.BRecCoverage;
import com.vmware.acov.merge.Coverage;
import com.vmware.acov.merge.CoverageMerger;
import com.vmware.acov.merge.RecsCoverage;
import com.vmware.acov.raw.MemoryRawCoverage;
import com.vmware.acov.util.Result;
import com.vmware.acov.width.ErrorsOr;
import com.vmware.acov.width.WidthPass;
import com.vmware.acov.width.WidthScript;
import org.junit.Assert;
import org.junit.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.TreeSet;

import static com.vmware.acov.ScriptBuilder.*;

/**
 * Width check a script, then merge runtime coverage into it.
 */
public class EndToEndTest {
    @Test
    public void testEnumeratedRecord() {
        ScriptBuilder sb = new ScriptBuilder();
        ScriptBuilder.ModuleBuilder mb = new ScriptBuilder.ModuleBuilder();
        Symbol sig = mb.signal("sig", 7, 0);
        Symbol r = mb.recordGroup("r", sym(sig));
        Symbol m = sb.module("m", mb);
        sb.cover(m, r, null);

        ErrorsOr<WidthScript> checked = new WidthPass().run(sb.build());
        Assert.assertTrue(checked.toString(), checked.isGood());
        WidthScript script = checked.get();
        Assert.assertEquals(8, script.modules.get(m).getRecordWidth(r));

        MemoryRawCoverage raw = new MemoryRawCoverage(2);
        raw.addModule().scope("top").add(0, 3, 255);
        Result<Coverage> merged = new CoverageMerger().merge(script, raw);
        Assert.assertTrue(merged.isSuccess());
        RecsCoverage recs = merged.get().modules.get(0).scopes.get(0).groups.get(0).coverage.to(RecsCoverage.class);
        Assert.assertEquals(new TreeSet<BigInteger>(Arrays.asList(BigInteger.valueOf(3), BigInteger.valueOf(255))),
                recs.values);

        MemoryRawCoverage bad = new MemoryRawCoverage(2);
        bad.addModule().scope("top").add(0, 256);
        Result<Coverage> failed = new CoverageMerger().merge(script, bad);
        Assert.assertTrue(failed.isFailure());
        Assert.assertTrue(failed.getError().contains("more than 8 bits wide"));
    }

    @Test
    public void testBitsRecord() {
        ScriptBuilder sb = new ScriptBuilder();
        ScriptBuilder.ModuleBuilder mb = new ScriptBuilder.ModuleBuilder();
        Symbol sig = mb.signal("sig", 3, 0);
        Symbol r = mb.record("r");
        mb.block(null, rec(sym(sig), r));
        mb.group(GroupDeclaration.bitsRecord(null, "r", ScopeMatcher.anyScope, r));
        sb.module("m", mb);

        WidthScript script = new WidthPass().run(sb.build()).get();
        MemoryRawCoverage raw = new MemoryRawCoverage(1);
        raw.addModule().scope("top").add(0, 0, 1, 4, 67).add(-1, 2, 70);
        Result<Coverage> merged = new CoverageMerger().merge(script, raw);
        Assert.assertTrue(merged.toString(), merged.isSuccess());
        BRecCoverage brec = merged.get().modules.get(0).scopes.get(0).groups.get(0).coverage.to(BRecCoverage.class);
        Assert.assertEquals(new TreeSet<Integer>(Arrays.asList(0, 1)), brec.ones);
        Assert.assertEquals(new TreeSet<Integer>(Arrays.asList(2)), brec.zeros);
    }
}
