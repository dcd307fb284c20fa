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

import com.vmware.acov.ir.SourceRange;
import com.vmware.acov.util.Linq;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class ErrorsOrTest {
    static ErrorsOr<Integer> fail(int line, String message) {
        return ErrorsOr.bad(SourceRange.at(line, 1), message);
    }

    @Test
    public void testCombineAccumulates() {
        ErrorsOr<Integer> result = ErrorsOr.combine(fail(1, "a"), fail(2, "b"), Integer::sum);
        Assert.assertTrue(result.isBad());
        Assert.assertEquals(2, result.getErrors().size());
        Assert.assertEquals("a", result.getErrors().get(0).message);
        Assert.assertEquals("b", result.getErrors().get(1).message);
    }

    @Test
    public void testCombineGood() {
        ErrorsOr<Integer> result = ErrorsOr.combine(ErrorsOr.good(2), ErrorsOr.good(3), Integer::sum);
        Assert.assertEquals(5, (int)result.get());
    }

    @Test
    public void testAllKeepsOrder() {
        List<ErrorsOr<Integer>> list = Linq.list(fail(3, "c"), ErrorsOr.good(1), fail(1, "a"), fail(2, "b"));
        ErrorsOr<List<Integer>> result = ErrorsOr.all(list);
        Assert.assertEquals(Linq.list("c", "a", "b"), Linq.map(result.getErrors(), d -> d.message));
        Assert.assertEquals(3, result.getErrors().get(0).range.startLine);
    }

    @Test
    public void testFlatMapShortCircuits() {
        ErrorsOr<Integer> result = fail(1, "first").flatMap(x -> fail(2, "second"));
        Assert.assertEquals(1, result.getErrors().size());
        Assert.assertEquals("first", result.getErrors().get(0).message);
    }

    @Test
    public void testBothKeepsSecondValue() {
        ErrorsOr<String> result = ErrorsOr.both(ErrorsOr.ok(), ErrorsOr.good("x"));
        Assert.assertEquals("x", result.get());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoEmptyFailure() {
        ErrorsOr.bad(Linq.list());
    }

    @Test
    public void testDiagnosticText() {
        Diagnostic d = new Diagnostic(SourceRange.at(4, 7), "Oops.");
        Assert.assertEquals("line: 4 column: 7: Oops.", d.toString());
        Assert.assertEquals("Oops.", new Diagnostic(null, "Oops.").toString());
    }
}
