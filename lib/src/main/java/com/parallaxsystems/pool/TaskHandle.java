package com.parallaxsystems.pool;

import com.parallaxsystems.Result;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Handle to a unit of work submitted to a {@link TaskPool}.
 * Provides three tiers of API:
 * 1. Simple: join() - blocks and returns the value, throwing on failure
 * 2. Safe: await() - returns a Result for explicit error handling
 * 3. Advanced: future() - access the underlying CompletableFuture
 * <p>
 * Failures of the unit of work are delivered as {@link TaskExecutionException} with the
 * original exception as cause; work that never started because it was cancelled is
 * delivered as {@link TaskCancelledException}.
 *
 * @param <T> the result type
 */
public final class TaskHandle<T> {

    private final CompletableFuture<T> future;
    private final BooleanSupplier canceller;

    TaskHandle(CompletableFuture<T> future, BooleanSupplier canceller) {
        this.future = future;
        this.canceller = canceller;
    }

    /**
     * Creates an already-completed handle.
     *
     * @param value the value
     * @param <T> the value type
     * @return a completed handle
     */
    public static <T> TaskHandle<T> completed(T value) {
        return new TaskHandle<>(CompletableFuture.completedFuture(value), () -> false);
    }

    // ========== TIER 1: SIMPLE API ==========

    /**
     * Blocks until the work completes and returns its value.
     *
     * @return the value produced by the unit of work
     * @throws TaskExecutionException if the unit of work threw
     * @throws TaskCancelledException if the unit of work was cancelled before it started
     */
    public T join() {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        } catch (CancellationException e) {
            throw asCancellation(e);
        }
    }

    /**
     * Blocks until the work completes or the timeout expires.
     *
     * @param timeout the maximum time to wait
     * @return the value produced by the unit of work
     * @throws TimeoutException if the timeout expires first
     */
    public T join(Duration timeout) throws TimeoutException {
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (CancellationException e) {
            throw asCancellation(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskExecutionException("Interrupted while waiting for task", e);
        }
    }

    // ========== TIER 2: SAFE API ==========

    /**
     * Blocks until the work completes and returns its outcome without throwing.
     *
     * @return a successful or failed Result
     */
    public Result<T> await() {
        try {
            return Result.success(join());
        } catch (RuntimeException e) {
            return Result.failure(e);
        }
    }

    /**
     * Non-blocking check for completion.
     *
     * @return the outcome if the work is done, otherwise empty
     */
    public Optional<Result<T>> poll() {
        if (!future.isDone()) {
            return Optional.empty();
        }
        return Optional.of(await());
    }

    public boolean isDone() {
        return future.isDone();
    }

    /**
     * Attempts to cancel the work. Only work that has not started yet can be cancelled;
     * started work always runs to completion.
     *
     * @return true if the work was cancelled by this call
     */
    public boolean cancel() {
        return canceller.getAsBoolean();
    }

    // ========== TIER 3: ADVANCED API ==========

    public CompletableFuture<T> future() {
        return future;
    }

    /**
     * Transforms the value when it arrives.
     *
     * @param fn the transformation
     * @param <U> the new value type
     * @return a handle for the transformed value
     */
    public <U> TaskHandle<U> map(Function<? super T, ? extends U> fn) {
        return new TaskHandle<>(future.thenApply(fn), () -> false);
    }

    /**
     * Registers callbacks for success and failure. Non-blocking.
     *
     * @param onSuccess invoked with the value
     * @param onFailure invoked with the failure, as join() would throw it
     */
    public void onComplete(Consumer<? super T> onSuccess, Consumer<? super Throwable> onFailure) {
        future.whenComplete((value, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException ? error.getCause() : error;
                onFailure.accept(unwrap(cause));
            } else {
                onSuccess.accept(value);
            }
        });
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof TaskExecutionException) {
            return (TaskExecutionException) cause;
        }
        if (cause instanceof CancellationException) {
            return asCancellation((CancellationException) cause);
        }
        return new TaskExecutionException("Task failed: " + cause, cause);
    }

    private static TaskCancelledException asCancellation(CancellationException e) {
        if (e instanceof TaskCancelledException) {
            return (TaskCancelledException) e;
        }
        TaskCancelledException cancelled = new TaskCancelledException("Task was cancelled");
        cancelled.initCause(e);
        return cancelled;
    }
}
