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

import com.vmware.acov.ir.AcovModule;
import com.vmware.acov.ir.Symbol;
import com.vmware.acov.ir.SymbolTable;

import java.util.ArrayList;
import java.util.List;

/**
 * A module whose records have been assigned widths.
 */
public class WidthModule {
    public final String name;
    public final AcovModule module;
    public final SymbolTable<Integer> recordWidths;
    public final List<Group> groups;

    public WidthModule(String name, AcovModule module, SymbolTable<Integer> recordWidths, List<Group> groups) {
        this.name = name;
        this.module = module;
        this.recordWidths = recordWidths;
        this.groups = new ArrayList<Group>(groups);
    }

    public int getRecordWidth(Symbol record) {
        return this.recordWidths.get(record);
    }
}
