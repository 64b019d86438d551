package com.flagship.general_ledger.ledger;

import com.flagship.general_ledger.ledger.error.PostingError;
import com.flagship.general_ledger.ledger.error.PostingException;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a posting step: either a value or a {@link PostingError}.
 *
 * Steps are chained with {@link #flatMap(Function)}; the first failure
 * short-circuits every later step.
 */
public final class PostingResult<T> {

    private final T value;
    private final PostingError error;

    private PostingResult(T value, PostingError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> PostingResult<T> success(T value) {
        return new PostingResult<>(value, null);
    }

    public static PostingResult<Void> ok() {
        return new PostingResult<>(null, null);
    }

    public static <T> PostingResult<T> failure(PostingError error) {
        return new PostingResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("Result is a failure: " + error);
        }
        return value;
    }

    public PostingError getError() {
        if (error == null) {
            throw new IllegalStateException("Result is a success");
        }
        return error;
    }

    public Optional<PostingError> error() {
        return Optional.ofNullable(error);
    }

    public <U> PostingResult<U> map(Function<? super T, ? extends U> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    public <U> PostingResult<U> flatMap(Function<? super T, PostingResult<U>> mapper) {
        if (error != null) {
            return failure(error);
        }
        return mapper.apply(value);
    }

    public PostingResult<T> onFailure(Consumer<PostingError> action) {
        if (error != null) {
            action.accept(error);
        }
        return this;
    }

    public T orElseThrow() {
        if (error != null) {
            throw new PostingException(error);
        }
        return value;
    }

    @Override
    public String toString() {
        return error == null ? "Success[" + value + "]" : "Failure[" + error + "]";
    }
}
