package org.memorydb.client;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a store operation. Carries the value on {@link ResultKind#SUCCESS} and a human readable message on
 * failures.
 *
 * @param <T> value type
 */
public final class StoreResult<T> {

    private static final StoreResult<?> NOT_FOUND = new StoreResult<>(ResultKind.NOT_FOUND, null, null);

    private final ResultKind kind;
    private final T value;
    private final String message;

    private StoreResult(ResultKind kind, T value, String message) {
        this.kind = kind;
        this.value = value;
        this.message = message;
    }

    public static <T> StoreResult<T> success(T value) {
        return new StoreResult<>(ResultKind.SUCCESS, value, null);
    }

    @SuppressWarnings("unchecked")
    public static <T> StoreResult<T> notFound() {
        return (StoreResult<T>) NOT_FOUND;
    }

    public static <T> StoreResult<T> failure(ResultKind kind, String message) {
        Objects.requireNonNull(kind, "kind");
        if (!kind.isFailure()) {
            throw new IllegalArgumentException(kind + " is not a failure kind");
        }
        return new StoreResult<>(kind, null, message);
    }

    public ResultKind getKind() {
        return kind;
    }

    public boolean isSuccess() {
        return kind == ResultKind.SUCCESS;
    }

    public boolean isFailure() {
        return kind.isFailure();
    }

    public Optional<T> getValue() {
        return isSuccess() ? Optional.ofNullable(value) : Optional.empty();
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("StoreResult{kind=").append(kind);
        if (value != null) {
            sb.append(", value=").append(value);
        }
        if (message != null) {
            sb.append(", message='").append(message).append('\'');
        }
        return sb.append('}').toString();
    }
}
