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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ScopeCoverage {
    public static class GroupEntry {
        public final String groupName;
        public final GroupCoverage coverage;

        public GroupEntry(String groupName, GroupCoverage coverage) {
            this.groupName = groupName;
            this.coverage = coverage;
        }

        @Override
        public String toString() {
            return this.groupName + "=" + this.coverage;
        }
    }

    public final String scope;
    public final List<GroupEntry> groups;

    public ScopeCoverage(String scope, List<GroupEntry> groups) {
        this.scope = scope;
        this.groups = Collections.unmodifiableList(new ArrayList<GroupEntry>(groups));
    }

    @Override
    public String toString() {
        return this.scope + this.groups;
    }
}
