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
import com.vmware.acov.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * The result of a check that may report several diagnostics at once.
 *
 * <p>Independent checks are joined with {@link #combine}, {@link #all} or
 * {@link #both}; their diagnostics are concatenated in argument order.
 * A check that needs the value of an earlier one uses {@link #flatMap},
 * which skips the later check when the earlier one failed.
 */
public final class ErrorsOr<T> {
    @Nullable
    private final T value;
    private final List<Diagnostic> errors;

    private ErrorsOr(@Nullable T value, List<Diagnostic> errors) {
        this.value = value;
        this.errors = errors;
    }

    public static <T> ErrorsOr<T> good(@Nullable T value) {
        return new ErrorsOr<T>(value, Collections.emptyList());
    }

    public static ErrorsOr<Void> ok() {
        return good(null);
    }

    public static <T> ErrorsOr<T> bad(List<Diagnostic> errors) {
        if (errors.isEmpty())
            throw new IllegalArgumentException("A failure needs at least one diagnostic");
        return new ErrorsOr<T>(null, Collections.unmodifiableList(new ArrayList<Diagnostic>(errors)));
    }

    public static <T> ErrorsOr<T> bad(@Nullable SourceRange range, String message) {
        return bad(Linq.list(new Diagnostic(range, message)));
    }

    public boolean isGood() {
        return this.errors.isEmpty();
    }

    public boolean isBad() {
        return !this.isGood();
    }

    @Nullable
    public T get() {
        if (this.isBad())
            throw new IllegalStateException("Value has errors: " + this.errors);
        return this.value;
    }

    public List<Diagnostic> getErrors() {
        return this.errors;
    }

    public <S> ErrorsOr<S> map(Function<T, S> function) {
        if (this.isBad())
            return bad(this.errors);
        return good(function.apply(this.value));
    }

    public <S> ErrorsOr<S> flatMap(Function<T, ErrorsOr<S>> function) {
        if (this.isBad())
            return bad(this.errors);
        return function.apply(this.value);
    }

    public static <A, B, R> ErrorsOr<R> combine(ErrorsOr<A> left, ErrorsOr<B> right,
                                                BiFunction<A, B, R> function) {
        if (left.isBad() || right.isBad())
            return bad(Utilities.concatenate(left.errors, right.errors));
        return good(function.apply(left.value, right.value));
    }

    /**
     * Run both checks; keep the value of the second one.
     */
    public static <T> ErrorsOr<T> both(ErrorsOr<?> first, ErrorsOr<T> second) {
        return combine(first, second, (a, b) -> b);
    }

    public static <T> ErrorsOr<List<T>> all(List<ErrorsOr<T>> results) {
        List<Diagnostic> errors = new ArrayList<Diagnostic>();
        List<T> values = new ArrayList<T>(results.size());
        for (ErrorsOr<T> r: results) {
            errors.addAll(r.errors);
            values.add(r.value);
        }
        if (!errors.isEmpty())
            return bad(errors);
        return good(values);
    }

    @Override
    public String toString() {
        if (this.isBad())
            return "Bad" + this.errors;
        return "Good(" + this.value + ")";
    }
}
