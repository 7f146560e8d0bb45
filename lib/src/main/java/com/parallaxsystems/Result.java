package com.parallaxsystems;

import java.util.function.Function;

/**
 * Outcome of an asynchronous computation, for callers that prefer inspecting a value
 * over catching an exception. Sealed so that {@link Success} and {@link Failure} are the
 * only cases.
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
        public <U> Result<U> map(Function<T, U> fn) {
            try {
                return new Success<>(fn.apply(value));
            } catch (RuntimeException e) {
                return new Failure<>(e);
            }
        }

        @Override
        public Result<T> recover(Function<Throwable, T> fn) {
            return this;
        }
    }

    /**
     * Failed result containing an error.
     */
    record Failure<T>(Throwable error) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            if (error instanceof RuntimeException) {
                throw (RuntimeException) error;
            }
            if (error instanceof Error) {
                throw (Error) error;
            }
            throw new ReplyException("Computation failed", error);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public <U> Result<U> map(Function<T, U> fn) {
            return new Failure<>(error);
        }

        @Override
        public Result<T> recover(Function<Throwable, T> fn) {
            try {
                return new Success<>(fn.apply(error));
            } catch (RuntimeException e) {
                return new Failure<>(e);
            }
        }
    }

    boolean isSuccess();

    T getOrThrow();

    T getOrElse(T defaultValue);

    <U> Result<U> map(Function<T, U> fn);

    Result<T> recover(Function<Throwable, T> fn);

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Throwable error) {
        return new Failure<>(error);
    }
}
