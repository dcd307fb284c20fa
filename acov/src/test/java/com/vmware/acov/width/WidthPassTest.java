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

import com.vmware.acov.AcovException;
import com.vmware.acov.ScriptBuilder;
import com.vmware.acov.ir.*;
import com.vmware.acov.util.Linq;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

import static com.vmware.acov.ScriptBuilder.*;

public class WidthPassTest {
    static List<String> messages(ErrorsOr<?> result) {
        Assert.assertTrue(result.isBad());
        return Linq.map(result.getErrors(), d -> d.message);
    }

    @Test
    public void testRecordWidths() {
        ScriptBuilder sb = new ScriptBuilder();
        ScriptBuilder.ModuleBuilder mb = new ScriptBuilder.ModuleBuilder();
        Symbol x = mb.signal("x", 7, 0);
        Symbol en = mb.signal("en", 0, 0);
        Symbol r0 = mb.record("r0");
        Symbol r1 = mb.record("r1");
        mb.block(sym(en), rec(sym(x), r0), rec(sel(x, 3, 0), r1));
        mb.group(GroupDeclaration.recs(null, "g", ScopeMatcher.anyScope, Linq.list(r0, r1)));
        mb.group(GroupDeclaration.bitsRecord(null, "b", ScopeMatcher.anyScope, r0));
        Symbol m = sb.module("m", mb);

        ErrorsOr<WidthScript> result = new WidthPass().run(sb.build());
        Assert.assertTrue(result.toString(), result.isGood());
        WidthModule module = result.get().modules.get(m);
        Assert.assertEquals("m", module.name);
        Assert.assertEquals(8, module.getRecordWidth(r0));
        Assert.assertEquals(4, module.getRecordWidth(r1));
        Assert.assertEquals(2, module.groups.size());
        Assert.assertEquals(12, module.groups.get(0).width);
        Assert.assertEquals(8, module.groups.get(1).width);
        Assert.assertEquals(GroupDeclaration.Kind.BitsRecord, module.groups.get(1).getKind());
    }

    @Test
    public void testGuardMustBeOneBit() {
        ScriptBuilder sb = new ScriptBuilder();
        ScriptBuilder.ModuleBuilder mb = new ScriptBuilder.ModuleBuilder();
        Symbol x = mb.signal("x", 7, 0);
        Symbol r = mb.record("r");
        mb.block(sym(x), rec(sel(x, 0), r));
        sb.module("m", mb);
        Assert.assertEquals(Linq.list("Block is guarded by expression with width 8, not 1."),
                messages(new WidthPass().run(sb.build())));
    }

    @Test
    public void testAllErrorsReported() {
        ScriptBuilder sb = new ScriptBuilder();
        ScriptBuilder.ModuleBuilder mb = new ScriptBuilder.ModuleBuilder();
        Symbol x = mb.signal("x", 7, 0);
        Symbol y = mb.signal("y", 3, 0);
        Symbol r0 = mb.record("r0");
        Symbol r1 = mb.record("r1");
        Symbol r2 = mb.record("r2");
        mb.block(sym(y), rec(bin(AcovEBinOp.BOp.Plus, sym(x), sym(y)), r0),
                rec(sym(x), r1), rec(sel(y, 4), r2));
        sb.module("m", mb);

        ScriptBuilder.ModuleBuilder mb2 = new ScriptBuilder.ModuleBuilder();
        Symbol r = mb2.record("r");
        mb2.block(null, rec(lit(3), r));
        sb.module("n", mb2);

        Assert.assertEquals(Linq.list(
                "Block is guarded by expression with width 4, not 1.",
                "Left and right side of + operator have different widths: 8 != 4.",
                "Bit selection overflows size of symbol.",
                "Integer with no width used in expression."),
                messages(new WidthPass().run(sb.build())));
    }

    @Test
    public void testStatementsNotCheckedWhenModulesFail() {
        ScriptBuilder sb = new ScriptBuilder();
        ScriptBuilder.ModuleBuilder mb = new ScriptBuilder.ModuleBuilder();
        Symbol r = mb.record("r");
        mb.block(null, rec(lit(3), r));
        Symbol m = sb.module("m", mb);
        sb.cover(m, r, null);
        Assert.assertEquals(Linq.list("Integer with no width used in expression."),
                messages(new WidthPass().run(sb.build())));
    }

    @Test
    public void testCrossIsNotChecked() {
        ScriptBuilder sb = new ScriptBuilder();
        ScriptBuilder.ModuleBuilder mb = new ScriptBuilder.ModuleBuilder();
        Symbol x = mb.signal("x", 31, 0);
        Symbol r = mb.recordGroup("r", sym(x));
        Symbol m = sb.module("m", mb);
        sb.statement(new CrossStatement(null, Linq.list(new DottedSymbol(null, m, r))));
        ErrorsOr<WidthScript> result = new WidthPass().run(sb.build());
        Assert.assertTrue(result.isGood());
        Assert.assertEquals(1, result.get().statements.size());
    }

    @Test(expected = AcovException.class)
    public void testRecordedTwice() {
        ScriptBuilder sb = new ScriptBuilder();
        ScriptBuilder.ModuleBuilder mb = new ScriptBuilder.ModuleBuilder();
        Symbol x = mb.signal("x", 7, 0);
        Symbol r = mb.record("r");
        mb.block(null, rec(sym(x), r), rec(sym(x), r));
        sb.module("m", mb);
        new WidthPass().run(sb.build());
    }

    @Test(expected = AcovException.class)
    public void testRecordedTwiceAfterBadWidth() {
        ScriptBuilder sb = new ScriptBuilder();
        ScriptBuilder.ModuleBuilder mb = new ScriptBuilder.ModuleBuilder();
        Symbol x = mb.signal("x", 7, 0);
        Symbol r = mb.record("r");
        mb.block(null, rec(lit(3), r));
        mb.block(null, rec(sym(x), r));
        sb.module("m", mb);
        new WidthPass().run(sb.build());
    }

    @Test(expected = AcovException.class)
    public void testRecordNeverRecorded() {
        ScriptBuilder sb = new ScriptBuilder();
        ScriptBuilder.ModuleBuilder mb = new ScriptBuilder.ModuleBuilder();
        mb.record("r");
        sb.module("m", mb);
        new WidthPass().run(sb.build());
    }
}
