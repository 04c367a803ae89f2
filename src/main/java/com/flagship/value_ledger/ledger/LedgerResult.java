package com.flagship.value_ledger.ledger;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a ledger operation: either a value or a {@link LedgerError}.
 *
 * @param <T> type of the success value
 */
public final class LedgerResult<T> {

    private final T value;
    private final LedgerError error;
    private final String message;

    private LedgerResult(T value, LedgerError error, String message) {
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public static <T> LedgerResult<T> success(T value) {
        return new LedgerResult<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> LedgerResult<T> failure(LedgerError error, String message) {
        return new LedgerResult<>(null, Objects.requireNonNull(error, "error"), message);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public boolean isDuplicate() {
        return error == LedgerError.DUPLICATE_OPERATION;
    }

    /**
     * @throws IllegalStateException if this result is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value on failed result: " + error + " (" + message + ")");
        }
        return value;
    }

    public LedgerError getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public <R> LedgerResult<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return failure(error, message);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isSuccess()
            ? "LedgerResult[success=" + value + "]"
            : "LedgerResult[failure=" + error + ", message=" + message + "]";
    }
}
