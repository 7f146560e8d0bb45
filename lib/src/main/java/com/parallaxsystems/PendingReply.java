package com.parallaxsystems;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Implementation of Reply backed by CompletableFuture.
 */
record PendingReply<T>(CompletableFuture<T> future) implements Reply<T> {

    @Override
    public T get() {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw new ReplyException("Ask failed", e.getCause());
        }
    }

    @Override
    public T get(Duration timeout) throws TimeoutException {
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw new ReplyException("Ask failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReplyException("Interrupted while waiting for reply", e);
        }
    }

    @Override
    public Result<T> await() {
        try {
            return Result.success(future.join());
        } catch (CompletionException e) {
            return Result.failure(e.getCause());
        } catch (RuntimeException e) {
            return Result.failure(e);
        }
    }

    @Override
    public Result<T> await(Duration timeout) {
        try {
            return Result.success(future.get(timeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            return Result.failure(e);
        } catch (ExecutionException e) {
            return Result.failure(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.failure(e);
        } catch (RuntimeException e) {
            return Result.failure(e);
        }
    }

    @Override
    public Optional<Result<T>> poll() {
        if (!future.isDone()) {
            return Optional.empty();
        }
        return Optional.of(await());
    }

    @Override
    public <U> Reply<U> map(Function<T, U> fn) {
        return new PendingReply<>(future.thenApply(fn));
    }

    @Override
    public Reply<T> recover(Function<Throwable, T> fn) {
        return new PendingReply<>(future.exceptionally(error -> fn.apply(unwrap(error))));
    }

    @Override
    public void onComplete(Consumer<T> onSuccess, Consumer<Throwable> onFailure) {
        future.whenComplete((value, error) -> {
            if (error != null) {
                onFailure.accept(unwrap(error));
            } else {
                onSuccess.accept(value);
            }
        });
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
