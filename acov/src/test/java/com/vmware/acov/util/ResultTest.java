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

import org.junit.Assert;
import org.junit.Test;

public class ResultTest {
    @Test
    public void testSuccess() {
        Result<Integer> r = Result.success(3);
        Assert.assertTrue(r.isSuccess());
        Assert.assertEquals(6, (int)r.map(x -> x * 2).get());
        Assert.assertEquals(4, (int)r.flatMap(x -> Result.success(x + 1)).get());
    }

    @Test
    public void testFailureStopsComputation() {
        Result<Integer> r = Result.failure("broken");
        Result<Integer> mapped = r.map(x -> {
            throw new RuntimeException("should not run");
        });
        Assert.assertTrue(mapped.isFailure());
        Assert.assertEquals("broken", mapped.getError());
        Result<String> chained = r.flatMap(x -> Result.success("x"));
        Assert.assertEquals("broken", chained.getError());
    }

    @Test(expected = IllegalStateException.class)
    public void testGetOnFailure() {
        Result.failure("broken").get();
    }
}
