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

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.function.Function;

/**
 * Either a value or a single error message.  Computations built from
 * results stop at the first failure.
 */
public final class Result<T> {
    @Nullable
    private final T value;
    @Nullable
    private final String error;

    private Result(@Nullable T value, @Nullable String error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Result<T> success(@Nullable T value) {
        return new Result<T>(value, null);
    }

    public static <T> Result<T> failure(String error) {
        return new Result<T>(null, Objects.requireNonNull(error));
    }

    public boolean isSuccess() {
        return this.error == null;
    }

    public boolean isFailure() {
        return this.error != null;
    }

    /**
     * The value of a successful result.  May be null for {@code Result<Void>}.
     */
    @Nullable
    public T get() {
        if (this.error != null)
            throw new IllegalStateException("Result is a failure: " + this.error);
        return this.value;
    }

    public String getError() {
        if (this.error == null)
            throw new IllegalStateException("Result is not a failure");
        return this.error;
    }

    public <S> Result<S> map(Function<T, S> function) {
        if (this.error != null)
            return failure(this.error);
        return success(function.apply(this.value));
    }

    public <S> Result<S> flatMap(Function<T, Result<S>> function) {
        if (this.error != null)
            return failure(this.error);
        return function.apply(this.value);
    }

    /**
     * Re-type a failure.
     */
    public <S> Result<S> asFailure() {
        return failure(this.getError());
    }

    @Override
    public String toString() {
        if (this.error != null)
            return "Failure(" + this.error + ")";
        return "Success(" + this.value + ")";
    }
}
