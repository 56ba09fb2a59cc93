package org.pragmatica.latex.util;

import org.pragmatica.latex.error.Cause;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of an operation: either a value or the {@link Cause} of the failure.
 */
public sealed interface Result<T> {

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Cause cause) {
        return new Failure<>(cause);
    }

    /**
     * Collect a list of results into a result of list. The first failure wins.
     */
    static <T> Result<List<T>> allOf(List<Result<T>> results) {
        var values = new ArrayList<T>(results.size());
        for (var result : results) {
            if (result instanceof Failure<T> failure) {
                return failure(failure.cause());
            }
            values.add(((Success<T>) result).value());
        }
        return success(List.copyOf(values));
    }

    <R> R fold(Function<? super Cause, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess);

    default boolean isSuccess() {
        return this instanceof Success<T>;
    }

    default boolean isFailure() {
        return this instanceof Failure<T>;
    }

    default <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        return fold(Result::failure, value -> success(mapper.apply(value)));
    }

    default <R> Result<R> flatMap(Function<? super T, Result<R>> mapper) {
        return fold(Result::failure, mapper);
    }

    default Result<T> onSuccess(Consumer<? super T> action) {
        if (this instanceof Success<T> success) {
            action.accept(success.value());
        }
        return this;
    }

    default Result<T> onFailure(Consumer<? super Cause> action) {
        if (this instanceof Failure<T> failure) {
            action.accept(failure.cause());
        }
        return this;
    }

    /**
     * Value of a successful result.
     *
     * @throws IllegalStateException if the result is a failure
     */
    default T unwrap() {
        return fold(cause -> {
            throw new IllegalStateException("Unwrapping failed result: " + cause.message());
        }, Function.identity());
    }

    record Success<T>(T value) implements Result<T> {
        @Override
        public <R> R fold(Function<? super Cause, ? extends R> onFailure,
                          Function<? super T, ? extends R> onSuccess) {
            return onSuccess.apply(value);
        }
    }

    record Failure<T>(Cause cause) implements Result<T> {
        @Override
        public <R> R fold(Function<? super Cause, ? extends R> onFailure,
                          Function<? super T, ? extends R> onSuccess) {
            return onFailure.apply(cause);
        }
    }
}
