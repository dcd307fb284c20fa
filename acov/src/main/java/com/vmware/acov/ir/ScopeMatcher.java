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

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Decides whether a group applies to a scope (a module instance path).
 */
public class ScopeMatcher implements Predicate<String> {
    private final Set<String> scopes;

    private ScopeMatcher(Set<String> scopes) {
        this.scopes = scopes;
    }

    public static final ScopeMatcher anyScope = new ScopeMatcher(Collections.emptySet()) {
        @Override
        public boolean test(String scope) {
            return true;
        }

        @Override
        public String toString() {
            return "*";
        }
    };

    public static ScopeMatcher scopes(String... names) {
        Set<String> set = new TreeSet<String>();
        Collections.addAll(set, names);
        return new ScopeMatcher(set);
    }

    @Override
    public boolean test(String scope) {
        return this.scopes.contains(scope);
    }

    @Override
    public String toString() {
        return String.join(",", this.scopes);
    }
}
