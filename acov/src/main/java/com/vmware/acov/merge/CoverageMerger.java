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

import com.vmware.acov.ir.GroupDeclaration;
import com.vmware.acov.raw.ModuleData;
import com.vmware.acov.raw.RawCoverage;
import com.vmware.acov.raw.ScopeData;
import com.vmware.acov.util.Result;
import com.vmware.acov.util.Utilities;
import com.vmware.acov.width.Group;
import com.vmware.acov.width.WidthModule;
import com.vmware.acov.width.WidthScript;

import java.math.BigInteger;
import java.util.*;
import java.util.logging.Logger;

/**
 * Merges a raw coverage dump with the width-checked script it was collected for.
 *
 * <p>Any mismatch between the two means the log was produced by a different
 * version of the script, so the merge stops at the first problem it finds.
 */
public class CoverageMerger {
    private static final Logger logger = Logger.getLogger(CoverageMerger.class.getName());
    /**
     * The runtime does not know the width of a bits record and may report up to
     * this many extra zero bits above it.
     */
    public static final int paddingBits = 64;

    private final MergeOptions options;

    public CoverageMerger(MergeOptions options) {
        this.options = options;
    }

    public CoverageMerger() {
        this(new MergeOptions());
    }

    public Result<Coverage> merge(WidthScript script, RawCoverage raw) {
        List<WidthModule> modules = script.modules.values();
        int count = modules.size();
        if (raw.moduleCount() != count) {
            if (this.options.strictModuleCount)
                return Result.failure("Coverage log has " + raw.moduleCount() +
                        " modules, but the script declares " + count + ".");
            count = Math.min(count, raw.moduleCount());
            logger.warning("Module count mismatch ignored; merging the first " + count + " modules");
        }

        List<ModCoverage> result = new ArrayList<ModCoverage>();
        for (int i = 0; i < count; i++) {
            Result<ModCoverage> mod = this.mergeModule(modules.get(i), raw.moduleData(i));
            if (mod.isFailure())
                return mod.asFailure();
            result.add(mod.get());
        }
        return Result.success(new Coverage(raw.testCount(), result));
    }

    public Coverage mergeOrThrow(WidthScript script, RawCoverage raw) throws CoverageMergeException {
        Result<Coverage> result = this.merge(script, raw);
        if (result.isFailure())
            throw new CoverageMergeException(result.getError());
        return Objects.requireNonNull(result.get());
    }

    Result<ModCoverage> mergeModule(WidthModule module, ModuleData data) {
        logger.fine(() -> "Merging coverage for module " + module.name);
        List<ScopeCoverage> scopes = new ArrayList<ScopeCoverage>();
        for (Map.Entry<String, ScopeData> e: data.scopes().entrySet()) {
            Result<ScopeCoverage> scope = this.mergeScope(module, e.getKey(), e.getValue());
            if (scope.isFailure())
                return scope.asFailure();
            scopes.add(scope.get());
        }
        return Result.success(new ModCoverage(module.name, scopes));
    }

    Result<ScopeCoverage> mergeScope(WidthModule module, String scope, ScopeData data) {
        logger.fine(() -> "Merging scope " + scope);
        if (data.maxGroupKey() >= module.groups.size())
            return Result.failure("Maximum group key for module at scope " + scope +
                    " is " + data.maxGroupKey() + ", which overflows the expected group length.");

        List<ScopeCoverage.GroupEntry> groups = new ArrayList<ScopeCoverage.GroupEntry>();
        for (int index = 0; index < module.groups.size(); index++) {
            Group group = module.groups.get(index);
            Result<GroupCoverage> coverage = mergeGroup(scope, data, index, group);
            if (coverage.isFailure())
                return coverage.asFailure();
            groups.add(new ScopeCoverage.GroupEntry(group.getName(), coverage.get()));
        }
        return Result.success(new ScopeCoverage(scope, groups));
    }

    static Result<GroupCoverage> mergeGroup(String scope, ScopeData data, int index, Group group) {
        if (!group.matchesScope(scope))
            return Result.success(BadScope.instance);

        SortedSet<BigInteger> values = new TreeSet<BigInteger>(data.valuesForKey(index));
        if (group.getKind() == GroupDeclaration.Kind.Recs) {
            for (BigInteger v: values) {
                Result<Void> check = checkWidth(group.width, v);
                if (check.isFailure())
                    return check.asFailure();
            }
            return Result.success(new RecsCoverage(group.getRecords(), values));
        }

        Result<SortedSet<Integer>> zeros = takeBitIndexes(group.width, data.valuesForKey(-(index + 1)));
        if (zeros.isFailure())
            return zeros.asFailure();
        Result<SortedSet<Integer>> ones = takeBitIndexes(group.width, values);
        if (ones.isFailure())
            return ones.asFailure();
        return Result.success(new BRecCoverage(group.getBitsRecord(), zeros.get(), ones.get()));
    }

    static Result<Void> checkWidth(int width, BigInteger value) {
        if (!Utilities.fitsUnsigned(value, width))
            return Result.failure("The value " + value.toString(16) + " is more than " + width +
                    " bits wide. Are your acov.log files out of date?");
        return Result.success(null);
    }

    static Result<SortedSet<Integer>> takeBitIndexes(int width, Set<BigInteger> bits) {
        SortedSet<Integer> result = new TreeSet<Integer>();
        // Ascending, so the reported index does not depend on the dump's set implementation.
        for (BigInteger bit: new TreeSet<BigInteger>(bits)) {
            Result<Optional<Integer>> index = takeBitIndex(width, bit);
            if (index.isFailure())
                return index.asFailure();
            Objects.requireNonNull(index.get()).ifPresent(result::add);
        }
        return Result.success(result);
    }

    /**
     * Validate a bit index reported for a bits record.
     * @return  The index if it is a bit of the record, empty if it is padding
     *          added by the runtime, and a failure if the log is corrupt.
     */
    static Result<Optional<Integer>> takeBitIndex(int width, BigInteger bit) {
        if (bit.signum() < 0)
            return Result.failure("The index " + bit + " is negative, which is invalid.");
        if (bit.compareTo(BigInteger.valueOf((long)width + paddingBits)) >= 0)
            return Result.failure("The index " + bit + " is too big for the width (" + width + ").");
        if (bit.compareTo(BigInteger.valueOf(width)) >= 0)
            return Result.success(Optional.empty());
        return Result.success(Optional.of(bit.intValueExact()));
    }
}
