package com.crosslink;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a router operation that callers may prefer to inspect rather than catch,
 * such as claiming a receiver that another component may already hold.
 * Sealed so the two cases are exhaustive.
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
        public T getOrElse(Function<Throwable, T> fn) {
            return value;
        }

        @Override
        public Optional<Throwable> error() {
            return Optional.empty();
        }

        @Override
        public <U> Result<U> map(Function<T, U> fn) {
            try {
                return new Success<>(fn.apply(value));
            } catch (Exception e) {
                return new Failure<>(e);
            }
        }

        @Override
        public <U> Result<U> flatMap(Function<T, Result<U>> fn) {
            try {
                return fn.apply(value);
            } catch (Exception e) {
                return new Failure<>(e);
            }
        }

        @Override
        public Result<T> recover(Function<Throwable, T> fn) {
            return this;
        }
    }

    /**
     * Failed result containing the error that would otherwise have been thrown.
     */
    record Failure<T>(Throwable cause) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new CommsException("Operation failed", null, cause);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElse(Function<Throwable, T> fn) {
            return fn.apply(cause);
        }

        @Override
        public Optional<Throwable> error() {
            return Optional.of(cause);
        }

        @Override
        public <U> Result<U> map(Function<T, U> fn) {
            return new Failure<>(cause);
        }

        @Override
        public <U> Result<U> flatMap(Function<T, Result<U>> fn) {
            return new Failure<>(cause);
        }

        @Override
        public Result<T> recover(Function<Throwable, T> fn) {
            try {
                return new Success<>(fn.apply(cause));
            } catch (Exception e) {
                return new Failure<>(e);
            }
        }
    }

    // Common operations
    boolean isSuccess();
    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElse(Function<Throwable, T> fn);
    Optional<Throwable> error();

    // Monadic operations
    <U> Result<U> map(Function<T, U> fn);
    <U> Result<U> flatMap(Function<T, Result<U>> fn);
    Result<T> recover(Function<Throwable, T> fn);

    default void ifSuccess(Consumer<T> consumer) {
        if (this instanceof Success<T> success) {
            consumer.accept(success.value());
        }
    }

    default void ifFailure(Consumer<Throwable> consumer) {
        if (this instanceof Failure<T> failure) {
            consumer.accept(failure.cause());
        }
    }

    // Factory methods
    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Throwable error) {
        return new Failure<>(error);
    }

    /**
     * Execute code that might throw and wrap in Result.
     */
    static <T> Result<T> attempt(ThrowingSupplier<T> supplier) {
        try {
            return new Success<>(supplier.get());
        } catch (Exception e) {
            return new Failure<>(e);
        }
    }

    @FunctionalInterface
    interface ThrowingSupplier<T> {
        T get() throws Exception;
    }
}
