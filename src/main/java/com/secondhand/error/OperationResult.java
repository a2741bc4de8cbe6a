package com.secondhand.error;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result of an externally exposed market operation: a value or a {@link MarketError}.
 *
 * @param <T> value type; {@link Void} operations succeed with a null value
 */
public final class OperationResult<T> {

    @Nullable
    private final T value;

    @Nullable
    private final MarketError error;

    private OperationResult(@Nullable T value, @Nullable MarketError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> OperationResult<T> success(@Nullable T value) {
        return new OperationResult<>(value, null);
    }

    public static OperationResult<Void> done() {
        return new OperationResult<>(null, null);
    }

    public static <T> OperationResult<T> failure(MarketError error) {
        return new OperationResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> OperationResult<T> validation(String message) {
        return failure(MarketError.validation(message));
    }

    public static <T> OperationResult<T> funds(String message) {
        return failure(MarketError.funds(message));
    }

    public static <T> OperationResult<T> race(String message) {
        return failure(MarketError.race(message));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * @throws IllegalStateException if this result is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("Operation failed: " + error.getKind() + " - " + error.getMessage());
        }
        return value;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    @Nullable
    public MarketError getError() {
        return error;
    }

    public boolean failedWith(ErrorKind kind) {
        return error != null && error.getKind() == kind;
    }

    /**
     * Re-type a failure, e.g. to pass a lookup error through an operation of a different type.
     *
     * @throws IllegalStateException if this result is a success
     */
    public <U> OperationResult<U> asFailure() {
        if (error == null) {
            throw new IllegalStateException("Not a failure");
        }
        return failure(error);
    }

    public <U> OperationResult<U> map(Function<? super T, ? extends U> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return error == null
                ? "OperationResult[success: " + value + "]"
                : "OperationResult[" + error.getKind() + ": " + error.getMessage() + "]";
    }
}
