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

import com.vmware.acov.ir.GroupDeclaration;
import com.vmware.acov.ir.Symbol;

import java.util.List;

/**
 * A coverage group together with the width of the values it samples.
 */
public class Group {
    public final GroupDeclaration declaration;
    public final int width;

    public Group(GroupDeclaration declaration, int width) {
        this.declaration = declaration;
        this.width = width;
    }

    public String getName() {
        return this.declaration.name;
    }

    public GroupDeclaration.Kind getKind() {
        return this.declaration.kind;
    }

    public List<Symbol> getRecords() {
        return this.declaration.getRecords();
    }

    public Symbol getBitsRecord() {
        return this.declaration.getBitsRecord();
    }

    public boolean matchesScope(String scope) {
        return this.declaration.matchesScope(scope);
    }

    @Override
    public String toString() {
        return this.getName() + "<" + this.width + ">";
    }
}
