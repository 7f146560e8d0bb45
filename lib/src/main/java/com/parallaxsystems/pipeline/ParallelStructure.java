package com.parallaxsystems.pipeline;

import com.parallaxsystems.forkjoin.ForkJoinExecutor;

import java.util.Arrays;
import java.util.Collection;
import java.util.function.BinaryOperator;

/**
 * The partitioned snapshot a pipeline chain works on. Built once from the source
 * collection and handed from one chained operation to the next; callers never see it.
 * Elements are never mutated in place: every operation produces a new structure.
 */
final class ParallelStructure {

    private static final int SEGMENTS_PER_WORKER = 4;

    private final Object[] elements;
    private final ForkJoinExecutor executor;
    private final int threshold;

    private ParallelStructure(Object[] elements, ForkJoinExecutor executor) {
        this.elements = elements;
        this.executor = executor;
        int parallelism = executor.getPool().getParallelism();
        this.threshold = Math.max(1, elements.length / (parallelism * SEGMENTS_PER_WORKER));
    }

    static ParallelStructure of(Collection<?> source, ForkJoinExecutor executor) {
        return new ParallelStructure(source.toArray(), executor);
    }

    /**
     * A structure over new elements sharing this one's executor. Takes ownership of the array.
     */
    ParallelStructure derive(Object[] newElements) {
        return new ParallelStructure(newElements, executor);
    }

    /**
     * Runs the leaf over every segment and merges the segment results in encounter order.
     * Must not be called on an empty structure.
     */
    <R> R compute(SegmentWorker.Leaf<R> leaf, BinaryOperator<R> merge) {
        return executor.orchestrate(new SegmentWorker<>(0, elements.length, threshold, leaf, merge));
    }

    int size() {
        return elements.length;
    }

    boolean isEmpty() {
        return elements.length == 0;
    }

    Object get(int index) {
        return elements[index];
    }

    Object[] elements() {
        return elements;
    }

    Object[] copyOfElements() {
        return Arrays.copyOf(elements, elements.length);
    }

    int getThreshold() {
        return threshold;
    }
}
