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

import com.vmware.acov.ScriptBuilder;
import com.vmware.acov.ir.*;
import com.vmware.acov.util.Linq;
import org.junit.Assert;
import org.junit.Test;

import java.math.BigInteger;
import java.util.List;

import static com.vmware.acov.ScriptBuilder.*;

public class CoverListTest {
    /**
     * Run the width pass on a single record of the given width, covered with the given list.
     */
    static ErrorsOr<WidthScript> cover(int width, CoverList list) {
        ScriptBuilder sb = new ScriptBuilder();
        ScriptBuilder.ModuleBuilder mb = new ScriptBuilder.ModuleBuilder();
        Symbol x = mb.signal("x", width - 1, 0);
        Symbol r = mb.recordGroup("r", sym(x));
        Symbol m = sb.module("m", mb);
        sb.cover(m, r, list);
        return new WidthPass().run(sb.build());
    }

    static CoverList entries(BigInteger... values) {
        return new CoverList(null, Linq.map(Linq.list(values), ScriptBuilder::lit));
    }

    @Test
    public void testImplicitCoverList() {
        Assert.assertTrue(cover(16, null).isGood());
        ErrorsOr<WidthScript> result = cover(17, null);
        Assert.assertEquals(Linq.list("Symbol has width more than 16 and no cover list."),
                WidthPassTest.messages(result));
    }

    @Test
    public void testWideRecordWithList() {
        Assert.assertTrue(cover(32, coverList(0, 1, 0xffffffffL)).isGood());
    }

    @Test
    public void testEntriesFit() {
        Assert.assertTrue(cover(4, coverList(0, 15, -8, -1)).isGood());
    }

    @Test
    public void testEntryBoundaries() {
        for (int w = 1; w <= 80; w++) {
            BigInteger pow = BigInteger.ONE.shiftLeft(w);
            BigInteger half = BigInteger.ONE.shiftLeft(w - 1);
            Assert.assertTrue(cover(w, entries(pow.subtract(BigInteger.ONE), half.negate())).isGood());
            Assert.assertTrue(cover(w + 1, entries(pow)).isGood());
            Assert.assertTrue(cover(w, entries(pow)).isBad());
            Assert.assertTrue(cover(w, entries(half.negate().subtract(BigInteger.ONE))).isBad());
        }
    }

    @Test
    public void testEveryBadEntryReported() {
        List<String> messages = WidthPassTest.messages(cover(4, coverList(16, 3, -9, 100)));
        Assert.assertEquals(Linq.list(
                "Cover list has entry of 16, but the cover expression has width 4.",
                "Cover list has entry of -9, but the cover expression has width 4.",
                "Cover list has entry of 100, but the cover expression has width 4."), messages);
    }

    @Test
    public void testErrorsAcrossStatements() {
        ScriptBuilder sb = new ScriptBuilder();
        ScriptBuilder.ModuleBuilder mb = new ScriptBuilder.ModuleBuilder();
        Symbol x = mb.signal("x", 19, 0);
        Symbol y = mb.signal("y", 1, 0);
        Symbol rx = mb.recordGroup("rx", sym(x));
        Symbol ry = mb.recordGroup("ry", sym(y));
        Symbol m = sb.module("m", mb);
        sb.cover(m, rx, null);
        sb.cover(m, ry, coverList(4));
        Assert.assertEquals(Linq.list(
                "Symbol has width more than 16 and no cover list.",
                "Cover list has entry of 4, but the cover expression has width 2."),
                WidthPassTest.messages(new WidthPass().run(sb.build())));
    }
}
