package com.parallaxsystems;

import com.google.common.base.Preconditions;
import com.parallaxsystems.pipeline.ParallelPipeline;
import com.parallaxsystems.pool.PoolConfig;
import com.parallaxsystems.pool.TaskPool;

import java.util.Collection;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Entry points for scoped pool use and parallel collection pipelines.
 * <pre>{@code
 * long evens = Parallel.withPool(4, pool ->
 *         Parallel.asParallel(pool, numbers).filter(n -> n % 2 == 0).size());
 * }</pre>
 */
public final class Parallel {

    private Parallel() {
    }

    /**
     * Creates a pool, applies the body to it and shuts the pool down on every exit path,
     * letting work already queued finish.
     *
     * @param parallelism number of worker threads
     * @param body        the work to run with the pool
     * @return the body's result
     */
    public static <R> R withPool(int parallelism, Function<? super TaskPool, ? extends R> body) {
        return withPool(PoolConfig.withParallelism(parallelism), body);
    }

    public static <R> R withPool(PoolConfig config, Function<? super TaskPool, ? extends R> body) {
        Preconditions.checkNotNull(body, "body");
        try (TaskPool pool = new TaskPool(config)) {
            return body.apply(pool);
        }
    }

    /**
     * Like {@link #withPool(int, Function)}, for bodies that produce no result.
     */
    public static void runWithPool(int parallelism, Consumer<? super TaskPool> body) {
        Preconditions.checkNotNull(body, "body");
        try (TaskPool pool = new TaskPool(parallelism)) {
            body.accept(pool);
        }
    }

    /**
     * Snapshots a collection into a parallel pipeline running on the given pool.
     */
    public static <T> ParallelPipeline<T> asParallel(TaskPool pool, Collection<? extends T> source) {
        return ParallelPipeline.of(pool, source);
    }
}
