package com.dmarket.arb.infra;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Either a decoded value or an {@link ApiError}. Returned by every upstream call instead of
 * throwing, so callers branch on {@link ApiError.Kind}.
 */
public final class ApiResult<T> {

    private final T value;
    private final ApiError error;

    private ApiResult(T value, ApiError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ApiResult<T> success(T value) {
        return new ApiResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> ApiResult<T> failure(ApiError error) {
        return new ApiResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        if (error != null) {
            throw new NoSuchElementException("No value present, failed with " + error);
        }
        return value;
    }

    public ApiError getError() {
        if (error == null) {
            throw new NoSuchElementException("Result is a success");
        }
        return error;
    }

    public <U> ApiResult<U> map(Function<? super T, ? extends U> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(error);
    }

    public <U> ApiResult<U> flatMap(Function<? super T, ApiResult<U>> mapper) {
        return isSuccess() ? mapper.apply(value) : failure(error);
    }

    /** Unwraps the value or throws {@link ApiException} for callers that signal failure by throwing. */
    public T orElseThrow() {
        if (error != null) {
            throw new ApiException(error);
        }
        return value;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ApiResult[success]" : "ApiResult[" + error + "]";
    }
}
