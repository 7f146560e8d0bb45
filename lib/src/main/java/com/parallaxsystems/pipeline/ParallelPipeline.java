package com.parallaxsystems.pipeline;

import com.google.common.base.Preconditions;
import com.google.common.math.LongMath;
import com.parallaxsystems.forkjoin.ForkJoinExecutor;
import com.parallaxsystems.pool.TaskPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A chain of bulk operations over a snapshot of a collection, executed in parallel on a
 * {@link TaskPool}.
 * <p>
 * The source is copied once into an internal partitioned structure when the pipeline is
 * created. Chained operations ({@link #map}, {@link #filter}, {@link #sort()}) each run to
 * completion and hand a new structure to the next pipeline; terminal operations return a
 * plain collection, map or scalar. {@code map} and {@code filter} preserve encounter order
 * and {@code sort} is stable.
 * <pre>{@code
 * List<Double> roots = Parallel.asParallel(pool, numbers)
 *         .filter(n -> n % 2 == 0)
 *         .map(Math::sqrt)
 *         .collection();
 * }</pre>
 * Functions passed to a pipeline must be free of side effects. An exception thrown by one
 * fails the operation with a {@link com.parallaxsystems.pool.TaskExecutionException}
 * carrying it as the cause.
 *
 * @param <T> the element type
 */
public final class ParallelPipeline<T> {

    private static final Logger logger = LoggerFactory.getLogger(ParallelPipeline.class);

    private final ParallelStructure structure;

    private ParallelPipeline(ParallelStructure structure) {
        this.structure = structure;
    }

    /**
     * Snapshots the collection into a new pipeline.
     */
    public static <T> ParallelPipeline<T> of(TaskPool pool, Collection<? extends T> source) {
        Preconditions.checkNotNull(pool, "pool");
        Preconditions.checkNotNull(source, "source");
        ParallelStructure structure = ParallelStructure.of(source, new ForkJoinExecutor(pool));
        logger.trace("Built parallel structure of {} elements, segment threshold {}",
                structure.size(), structure.getThreshold());
        return new ParallelPipeline<>(structure);
    }

    // ---- chained operations ----

    /**
     * Applies the function to every element, keeping their order.
     */
    public <R> ParallelPipeline<R> map(Function<? super T, ? extends R> fn) {
        Preconditions.checkNotNull(fn, "fn");
        Object[] out = new Object[structure.size()];
        if (!structure.isEmpty()) {
            structure.compute((from, to) -> {
                for (int i = from; i < to; i++) {
                    out[i] = fn.apply(element(i));
                }
                return to - from;
            }, Integer::sum);
        }
        return new ParallelPipeline<>(structure.derive(out));
    }

    /**
     * Keeps the elements matching the predicate, in their original order.
     */
    public ParallelPipeline<T> filter(Predicate<? super T> predicate) {
        Preconditions.checkNotNull(predicate, "predicate");
        if (structure.isEmpty()) {
            return this;
        }
        List<Object> kept = structure.compute((from, to) -> {
            List<Object> segment = new ArrayList<>();
            for (int i = from; i < to; i++) {
                if (predicate.test(element(i))) {
                    segment.add(structure.get(i));
                }
            }
            return segment;
        }, (left, right) -> {
            left.addAll(right);
            return left;
        });
        return new ParallelPipeline<>(structure.derive(kept.toArray()));
    }

    /**
     * Sorts by natural order. Elements must be {@link Comparable}.
     */
    public ParallelPipeline<T> sort() {
        return sort(naturalOrder());
    }

    /**
     * Sorts stably: equal elements keep their relative order.
     */
    @SuppressWarnings("unchecked")
    public ParallelPipeline<T> sort(Comparator<? super T> comparator) {
        Preconditions.checkNotNull(comparator, "comparator");
        if (structure.size() < 2) {
            return this;
        }
        Comparator<Object> order = (Comparator<Object>) comparator;
        Object[] sorted = structure.compute((from, to) -> {
            Object[] segment = Arrays.copyOfRange(structure.elements(), from, to);
            Arrays.sort(segment, order);
            return segment;
        }, (left, right) -> mergeSorted(left, right, order));
        return new ParallelPipeline<>(structure.derive(sorted));
    }

    // ---- terminal operations ----

    /**
     * Combines all elements with an associative operator.
     *
     * @return the combined value, or empty for an empty pipeline
     */
    public Optional<T> reduce(BinaryOperator<T> op) {
        Preconditions.checkNotNull(op, "op");
        if (structure.isEmpty()) {
            return Optional.empty();
        }
        T result = structure.compute((from, to) -> {
            T acc = element(from);
            for (int i = from + 1; i < to; i++) {
                acc = op.apply(acc, element(i));
            }
            return acc;
        }, op);
        return Optional.ofNullable(result);
    }

    /**
     * Combines all elements with an associative operator, starting every segment from the
     * identity value.
     */
    public T reduce(T identity, BinaryOperator<T> op) {
        Preconditions.checkNotNull(op, "op");
        if (structure.isEmpty()) {
            return identity;
        }
        return structure.compute((from, to) -> {
            T acc = identity;
            for (int i = from; i < to; i++) {
                acc = op.apply(acc, element(i));
            }
            return acc;
        }, op);
    }

    /**
     * Adds up numeric elements. Integral elements (Byte, Short, Integer, Long) are summed
     * exactly as a {@link Long}, failing on overflow; a Float or Double element makes the
     * result a {@link Double}. An empty pipeline sums to {@code 0L}.
     *
     * @throws com.parallaxsystems.pool.TaskExecutionException if an element is not a boxed primitive number,
     *                                                         or the long sum overflows
     */
    public Number sum() {
        if (structure.isEmpty()) {
            return 0L;
        }
        Sum total = structure.compute((from, to) -> {
            Sum segment = new Sum();
            for (int i = from; i < to; i++) {
                segment.add(structure.get(i));
            }
            return segment;
        }, Sum::merge);
        return total.result();
    }

    /**
     * Smallest element by natural order.
     */
    public Optional<T> min() {
        return min(naturalOrder());
    }

    public Optional<T> min(Comparator<? super T> comparator) {
        Preconditions.checkNotNull(comparator, "comparator");
        return reduce((a, b) -> comparator.compare(b, a) < 0 ? b : a);
    }

    /**
     * Largest element by natural order.
     */
    public Optional<T> max() {
        return max(naturalOrder());
    }

    public Optional<T> max(Comparator<? super T> comparator) {
        Preconditions.checkNotNull(comparator, "comparator");
        return reduce((a, b) -> comparator.compare(b, a) > 0 ? b : a);
    }

    /**
     * Groups elements by key. Keys appear in order of first occurrence and each group keeps
     * its elements in encounter order.
     *
     * @throws com.parallaxsystems.pool.TaskExecutionException caused by a NullPointerException if a key is null
     */
    public <K> Map<K, List<T>> groupBy(Function<? super T, ? extends K> keyFn) {
        Preconditions.checkNotNull(keyFn, "keyFn");
        return group(keyFn, Function.identity());
    }

    /**
     * Folds the values of each key separately, starting every key from a fresh seed.
     * Elements must be {@link Map.Entry} pairs of key and value.
     * <pre>{@code
     * Map<String, Integer> totals = pipeline.combine(Seed.of(0), Integer::sum);
     * }</pre>
     *
     * @param seed        the initial accumulator, copied per key
     * @param accumulator folds one value into an accumulator
     * @return the accumulated value of every distinct key
     */
    @SuppressWarnings("unchecked")
    public <K, V, A> Map<K, A> combine(Seed<A> seed, BiFunction<? super A, ? super V, ? extends A> accumulator) {
        return this.<K, V, A>combine(element -> ((Map.Entry<K, V>) element).getKey(),
                element -> ((Map.Entry<K, V>) element).getValue(),
                seed, accumulator);
    }

    /**
     * Folds the values of each key separately, starting every key from a fresh seed. Keys
     * are compared with {@code equals}/{@code hashCode}. Values of one key are folded in
     * encounter order, but different keys fold concurrently.
     *
     * @throws com.parallaxsystems.pool.TaskExecutionException caused by a NullPointerException if a key is null
     */
    public <K, V, A> Map<K, A> combine(Function<? super T, ? extends K> keyFn,
                                       Function<? super T, ? extends V> valueFn,
                                       Seed<A> seed,
                                       BiFunction<? super A, ? super V, ? extends A> accumulator) {
        Preconditions.checkNotNull(keyFn, "keyFn");
        Preconditions.checkNotNull(valueFn, "valueFn");
        Preconditions.checkNotNull(seed, "seed");
        Preconditions.checkNotNull(accumulator, "accumulator");
        Map<K, List<V>> groups = group(keyFn, valueFn);
        if (groups.isEmpty()) {
            return new LinkedHashMap<>();
        }
        ParallelStructure keys = structure.derive(groups.entrySet().toArray());
        return keys.compute((from, to) -> {
            Map<K, A> folded = new LinkedHashMap<>();
            for (int i = from; i < to; i++) {
                @SuppressWarnings("unchecked")
                Map.Entry<K, List<V>> entry = (Map.Entry<K, List<V>>) keys.get(i);
                A acc = seed.fresh();
                for (V value : entry.getValue()) {
                    acc = accumulator.apply(acc, value);
                }
                folded.put(entry.getKey(), acc);
            }
            return folded;
        }, (left, right) -> {
            left.putAll(right);
            return left;
        });
    }

    /**
     * The elements as a new list, in pipeline order.
     */
    @SuppressWarnings("unchecked")
    public List<T> collection() {
        return new ArrayList<>((List<T>) Arrays.asList(structure.copyOfElements()));
    }

    /**
     * The elements as an unmodifiable list, in pipeline order.
     */
    @SuppressWarnings("unchecked")
    public List<T> values() {
        return Collections.unmodifiableList((List<T>) Arrays.asList(structure.copyOfElements()));
    }

    public int size() {
        return structure.size();
    }

    // ---- internals ----

    @SuppressWarnings("unchecked")
    private T element(int index) {
        return (T) structure.get(index);
    }

    private <K, V> Map<K, List<V>> group(Function<? super T, ? extends K> keyFn, Function<? super T, ? extends V> valueFn) {
        if (structure.isEmpty()) {
            return new LinkedHashMap<>();
        }
        return structure.compute((from, to) -> {
            Map<K, List<V>> segment = new LinkedHashMap<>();
            for (int i = from; i < to; i++) {
                T element = element(i);
                K key = Objects.requireNonNull(keyFn.apply(element), () -> "null key for element " + element);
                segment.computeIfAbsent(key, k -> new ArrayList<>()).add(valueFn.apply(element));
            }
            return segment;
        }, (left, right) -> {
            right.forEach((key, values) -> left.computeIfAbsent(key, k -> new ArrayList<>()).addAll(values));
            return left;
        });
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static <T> Comparator<? super T> naturalOrder() {
        return (Comparator) Comparator.<Comparable<Object>>naturalOrder();
    }

    private static Object[] mergeSorted(Object[] left, Object[] right, Comparator<Object> order) {
        Object[] merged = new Object[left.length + right.length];
        int i = 0;
        int j = 0;
        int k = 0;
        while (i < left.length && j < right.length) {
            // take from the left on ties to keep the sort stable
            merged[k++] = order.compare(right[j], left[i]) < 0 ? right[j++] : left[i++];
        }
        while (i < left.length) {
            merged[k++] = left[i++];
        }
        while (j < right.length) {
            merged[k++] = right[j++];
        }
        return merged;
    }

    private static final class Sum {
        private long integral;
        private double floating;
        private boolean isFloating;

        void add(Object element) {
            if (element instanceof Integer || element instanceof Long
                    || element instanceof Short || element instanceof Byte) {
                integral = LongMath.checkedAdd(integral, ((Number) element).longValue());
            } else if (element instanceof Double || element instanceof Float) {
                isFloating = true;
                floating += ((Number) element).doubleValue();
            } else {
                throw new IllegalArgumentException("sum() supports boxed primitive numbers only, got "
                        + (element == null ? "null" : element.getClass().getName()));
            }
        }

        Sum merge(Sum other) {
            integral = LongMath.checkedAdd(integral, other.integral);
            floating += other.floating;
            isFloating |= other.isFloating;
            return this;
        }

        Number result() {
            if (isFloating) {
                return Double.valueOf(floating + integral);
            }
            return Long.valueOf(integral);
        }
    }
}
