package com.parallaxsystems.pipeline;

import com.parallaxsystems.forkjoin.RecursiveWorker;

import java.util.List;
import java.util.function.BinaryOperator;

/**
 * Splits an index range in halves until it is no longer than the threshold, applies the
 * leaf function to each segment and merges results pairwise, left before right.
 *
 * @param <R> the per-segment result type
 */
final class SegmentWorker<R> extends RecursiveWorker<R> {

    /**
     * Computes the result of one segment {@code [from, to)}.
     */
    @FunctionalInterface
    interface Leaf<R> {
        R apply(int from, int to);
    }

    private final int from;
    private final int to;
    private final int threshold;
    private final Leaf<R> leaf;
    private final BinaryOperator<R> merge;

    SegmentWorker(int from, int to, int threshold, Leaf<R> leaf, BinaryOperator<R> merge) {
        this.from = from;
        this.to = to;
        this.threshold = threshold;
        this.leaf = leaf;
        this.merge = merge;
    }

    @Override
    protected void compute() {
        if (to - from <= threshold) {
            setResult(leaf.apply(from, to));
            return;
        }
        int mid = (from + to) >>> 1;
        forkOffChild(new SegmentWorker<>(from, mid, threshold, leaf, merge));
        forkOffChild(new SegmentWorker<>(mid, to, threshold, leaf, merge));
        List<R> halves = getChildrenResults();
        setResult(merge.apply(halves.get(0), halves.get(1)));
    }
}
