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

package com.vmware.acov.ir;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A coverage group as written in the script.  A group either enumerates the
 * values of a list of records, or tracks each bit of a single wide record.
 */
public class GroupDeclaration extends AcovNode {
    public enum Kind {
        Recs, BitsRecord
    }

    public final String name;
    public final ScopeMatcher scopes;
    public final Kind kind;
    private final List<Symbol> records;

    private GroupDeclaration(@Nullable SourceRange range, String name, ScopeMatcher scopes,
                             Kind kind, List<Symbol> records) {
        super(range);
        this.name = name;
        this.scopes = scopes;
        this.kind = kind;
        this.records = records;
        if (records.isEmpty())
            this.error("Group " + name + " has no records");
    }

    public static GroupDeclaration recs(@Nullable SourceRange range, String name,
                                        ScopeMatcher scopes, List<Symbol> records) {
        return new GroupDeclaration(range, name, scopes, Kind.Recs, new ArrayList<Symbol>(records));
    }

    public static GroupDeclaration bitsRecord(@Nullable SourceRange range, String name,
                                              ScopeMatcher scopes, Symbol record) {
        return new GroupDeclaration(range, name, scopes, Kind.BitsRecord, Collections.singletonList(record));
    }

    /**
     * The records of the group; a single one for {@link Kind#BitsRecord}.
     */
    public List<Symbol> getRecords() {
        return Collections.unmodifiableList(this.records);
    }

    public Symbol getBitsRecord() {
        if (this.kind != Kind.BitsRecord)
            this.error("Group " + this.name + " is not a bits record");
        return this.records.get(0);
    }

    public boolean matchesScope(String scope) {
        return this.scopes.test(scope);
    }
}
