package com.cajunsystems.synccell;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Result of a completed cell operation.
 * Sealed so callers can match exhaustively on Success and Failure.
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    /**
     * Successful result containing a value.
     */
    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> fn) {
            try {
                return new Success<>(fn.apply(value));
            } catch (RuntimeException e) {
                return new Failure<>(e);
            }
        }
    }

    /**
     * Failed result containing the error.
     */
    record Failure<T>(Throwable error) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            if (error instanceof RuntimeException re) {
                throw re;
            }
            throw new SyncCellException("Cell operation failed", error);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> fn) {
            return new Failure<>(error);
        }
    }

    boolean isSuccess();

    T getOrThrow();

    T getOrElse(T defaultValue);

    <U> Result<U> map(Function<? super T, ? extends U> fn);

    default void ifSuccess(Consumer<? super T> consumer) {
        if (this instanceof Success<T> success) {
            consumer.accept(success.value());
        }
    }

    default void ifFailure(Consumer<Throwable> consumer) {
        if (this instanceof Failure<T> failure) {
            consumer.accept(failure.error());
        }
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Throwable error) {
        return new Failure<>(error);
    }
}
