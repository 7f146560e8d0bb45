package com.parallaxsystems.pipeline;

import com.parallaxsystems.Parallel;
import com.parallaxsystems.pool.TaskExecutionException;
import com.parallaxsystems.pool.TaskPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 30, unit = TimeUnit.SECONDS)
class ParallelPipelineTest {

    private TaskPool pool;

    @BeforeEach
    void setUp() {
        pool = new TaskPool(4);
    }

    @AfterEach
    void tearDown() {
        pool.shutdown(false);
    }

    private static List<Integer> range(int fromInclusive, int toInclusive) {
        return IntStream.rangeClosed(fromInclusive, toInclusive).boxed().collect(Collectors.toList());
    }

    @Nested
    class ChainedOperations {

        @Test
        void filterThenMapShouldMatchSequentialResult() {
            List<Integer> numbers = range(1, 1000);

            List<Double> parallel = Parallel.asParallel(pool, numbers)
                    .filter(n -> n % 2 == 0)
                    .map(n -> Math.sqrt(n))
                    .collection();
            List<Double> sequential = numbers.stream()
                    .filter(n -> n % 2 == 0)
                    .map(n -> Math.sqrt(n))
                    .collect(Collectors.toList());

            assertEquals(new HashSet<>(sequential), new HashSet<>(parallel));
            assertEquals(sequential, parallel);
        }

        @Test
        void mapShouldPreserveOrder() {
            List<String> result = Parallel.asParallel(pool, range(1, 257))
                    .map(String::valueOf)
                    .values();

            assertEquals(257, result.size());
            assertEquals("1", result.get(0));
            assertEquals("257", result.get(256));
        }

        @Test
        void sortShouldOrderNaturally() {
            List<Integer> shuffled = new ArrayList<>(range(1, 500));
            java.util.Collections.shuffle(shuffled, new java.util.Random(7));

            assertEquals(range(1, 500), Parallel.asParallel(pool, shuffled).sort().collection());
        }

        @Test
        void sortShouldBeStable() {
            List<String> words = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                words.add((char) ('a' + i % 5) + "-" + i);
            }

            List<String> sorted = Parallel.asParallel(pool, words)
                    .sort(Comparator.comparing(word -> word.charAt(0)))
                    .collection();
            List<String> expected = new ArrayList<>(words);
            expected.sort(Comparator.comparing(word -> word.charAt(0)));

            assertEquals(expected, sorted);
        }

        @Test
        void sourceShouldBeSnapshotAtCreation() {
            List<Integer> source = new ArrayList<>(range(1, 10));
            ParallelPipeline<Integer> pipeline = Parallel.asParallel(pool, source);

            source.add(11);

            assertEquals(10, pipeline.size());
            assertEquals(range(1, 10), pipeline.collection());
        }

        @Test
        void collectionShouldBeMutableAndValuesNot() {
            ParallelPipeline<Integer> pipeline = Parallel.asParallel(pool, range(1, 3));

            List<Integer> copy = pipeline.collection();
            copy.add(4);

            assertEquals(List.of(1, 2, 3), pipeline.collection());
            assertThrows(UnsupportedOperationException.class, () -> pipeline.values().add(4));
        }

        @Test
        void emptyPipelineShouldStayEmpty() {
            ParallelPipeline<Integer> empty = Parallel.asParallel(pool, List.<Integer>of());

            assertTrue(empty.map(n -> n * 2).filter(n -> n > 0).sort().collection().isEmpty());
            assertEquals(Optional.empty(), empty.reduce(Integer::sum));
            assertEquals(0L, empty.sum());
            assertTrue(empty.groupBy(n -> n).isEmpty());
        }
    }

    @Nested
    class TerminalOperations {

        @Test
        void reduceShouldCombineAllElements() {
            assertEquals(Optional.of(500500), Parallel.asParallel(pool, range(1, 1000)).reduce(Integer::sum));
            assertEquals(500500, Parallel.asParallel(pool, range(1, 1000)).reduce(0, Integer::sum));
        }

        @Test
        void reduceShouldKeepEncounterOrderForAssociativeOperators() {
            List<String> letters = List.of("a", "b", "c", "d", "e", "f", "g", "h", "i", "j");
            assertEquals(Optional.of("abcdefghij"), Parallel.asParallel(pool, letters).reduce(String::concat));
        }

        @Test
        void sumOfIntegersShouldBeLong() {
            assertEquals(500500L, Parallel.asParallel(pool, range(1, 1000)).sum());
        }

        @Test
        void sumOfLongsShouldStayExactNearTheLimit() {
            Number sum = Parallel.asParallel(pool, List.of(Long.MAX_VALUE - 1, 1L)).sum();

            assertInstanceOf(Long.class, sum);
            assertEquals(Long.MAX_VALUE, sum);
        }

        @Test
        void sumOverflowingLongShouldFail() {
            TaskExecutionException error = assertThrows(TaskExecutionException.class,
                    () -> Parallel.asParallel(pool, List.of(Long.MAX_VALUE, 1L)).sum());
            assertInstanceOf(ArithmeticException.class, error.getCause());
        }

        @Test
        void sumOfArbitraryPrecisionNumbersShouldBeRejected() {
            List<Number> values = List.of(BigInteger.ONE.shiftLeft(62).add(BigInteger.ONE), BigInteger.ONE);

            TaskExecutionException error = assertThrows(TaskExecutionException.class,
                    () -> Parallel.asParallel(pool, values).sum());
            assertInstanceOf(IllegalArgumentException.class, error.getCause());
            assertThrows(TaskExecutionException.class,
                    () -> Parallel.asParallel(pool, List.<Number>of(1, new BigDecimal("0.5"))).sum());
        }

        @Test
        void sumWithDecimalsShouldBeDouble() {
            Number sum = Parallel.asParallel(pool, List.<Number>of(1, 2.5, 3L)).sum();
            assertEquals(6.5, sum);
        }

        @Test
        void sumOfNonNumbersShouldFail() {
            TaskExecutionException error = assertThrows(TaskExecutionException.class,
                    () -> Parallel.asParallel(pool, List.of("x")).sum());
            assertInstanceOf(IllegalArgumentException.class, error.getCause());
        }

        @Test
        void minAndMaxShouldUseNaturalOrder() {
            List<Integer> numbers = List.of(5, 3, 9, 1, 7);
            assertEquals(Optional.of(1), Parallel.asParallel(pool, numbers).min());
            assertEquals(Optional.of(9), Parallel.asParallel(pool, numbers).max());
        }

        @Test
        void minAndMaxShouldAcceptComparator() {
            List<String> words = List.of("pear", "fig", "banana", "kiwi");
            assertEquals(Optional.of("fig"), Parallel.asParallel(pool, words).min(Comparator.comparing(String::length)));
            assertEquals(Optional.of("banana"), Parallel.asParallel(pool, words).max(Comparator.comparing(String::length)));
        }

        @Test
        void groupByShouldKeepFirstOccurrenceOrder() {
            Map<Integer, List<Integer>> groups = Parallel.asParallel(pool, range(1, 10)).groupBy(n -> n % 3);

            assertEquals(List.of(1, 2, 0), new ArrayList<>(groups.keySet()));
            assertEquals(List.of(1, 4, 7, 10), groups.get(1));
            assertEquals(List.of(3, 6, 9), groups.get(0));
        }

        @Test
        void nullKeyShouldFailGroupBy() {
            TaskExecutionException error = assertThrows(TaskExecutionException.class,
                    () -> Parallel.asParallel(pool, range(1, 5)).groupBy(n -> n == 3 ? null : n));
            assertInstanceOf(NullPointerException.class, error.getCause());
        }

        @Test
        void userFunctionFailureShouldSurfaceWithCause() {
            TaskExecutionException error = assertThrows(TaskExecutionException.class,
                    () -> Parallel.asParallel(pool, range(1, 100)).map(n -> {
                        if (n == 42) {
                            throw new IllegalStateException("no 42");
                        }
                        return n;
                    }));
            assertInstanceOf(IllegalStateException.class, error.getCause());
            assertEquals("no 42", error.getCause().getMessage());
        }
    }

    @Nested
    class Combine {

        @Test
        void shouldSumValuesPerKey() {
            List<Map.Entry<String, Integer>> pairs = List.of(
                    Map.entry("he", 1), Map.entry("she", 2), Map.entry("he", 2),
                    Map.entry("me", 1), Map.entry("she", 5), Map.entry("he", 1));

            Map<String, Integer> totals = Parallel.asParallel(pool, pairs)
                    .<String, Integer, Integer>combine(Seed.of(0), Integer::sum);

            assertEquals(Map.of("he", 4, "she", 7, "me", 1), totals);
        }

        @Test
        void shouldStartEveryKeyFromFreshMutableSeed() {
            List<Integer> numbers = range(1, 100);

            Map<Integer, List<Integer>> byRemainder = Parallel.asParallel(pool, numbers)
                    .<Integer, Integer, List<Integer>>combine(n -> n % 4, n -> n,
                            Seed.supplier(ArrayList::new),
                            (list, value) -> {
                                list.add(value);
                                return list;
                            });

            assertEquals(4, byRemainder.size());
            for (int remainder = 0; remainder < 4; remainder++) {
                assertEquals(25, byRemainder.get(remainder).size());
                for (int value : byRemainder.get(remainder)) {
                    assertEquals(remainder, value % 4);
                }
            }
        }

        @Test
        void cloneableSeedShouldNotBeShared() {
            List<Map.Entry<String, String>> pairs = List.of(
                    Map.entry("a", "x"), Map.entry("b", "y"), Map.entry("a", "z"));

            Map<String, ArrayList<String>> merged = Parallel.asParallel(pool, pairs)
                    .<String, String, ArrayList<String>>combine(Seed.of(new ArrayList<>()), (list, value) -> {
                        list.add(value);
                        return list;
                    });

            assertEquals(List.of("x", "z"), merged.get("a"));
            assertEquals(List.of("y"), merged.get("b"));
            assertNotSame(merged.get("a"), merged.get("b"));
        }

        @Test
        void keysShouldCompareStructurally() {
            List<Map.Entry<List<Integer>, Integer>> pairs = List.of(
                    Map.entry(List.of(1, 2), 1), Map.entry(new ArrayList<>(List.of(1, 2)), 1));

            Map<List<Integer>, Integer> totals = Parallel.asParallel(pool, pairs)
                    .<List<Integer>, Integer, Integer>combine(Seed.of(0), Integer::sum);

            assertEquals(Map.of(List.of(1, 2), 2), totals);
        }

        @Test
        void failingAccumulatorShouldSurfaceWithCause() {
            List<Map.Entry<String, Integer>> pairs = List.of(Map.entry("a", 1));

            TaskExecutionException error = assertThrows(TaskExecutionException.class,
                    () -> Parallel.asParallel(pool, pairs).<String, Integer, Integer>combine(Seed.of(0), (acc, value) -> {
                        throw new ArithmeticException("overflow");
                    }));
            assertInstanceOf(ArithmeticException.class, error.getCause());
        }
    }

    @Test
    void withPoolShouldShutDownPoolAfterBody() {
        TaskPool[] used = new TaskPool[1];
        Set<Integer> evens = Parallel.withPool(2, scoped -> {
            used[0] = scoped;
            return new HashSet<>(Parallel.asParallel(scoped, range(1, 10)).filter(n -> n % 2 == 0).collection());
        });

        assertEquals(Set.of(2, 4, 6, 8, 10), evens);
        assertTrue(used[0].isShutdown());
    }

    @Test
    void runWithPoolShouldShutDownPoolWhenBodyThrows() {
        TaskPool[] used = new TaskPool[1];

        assertThrows(IllegalStateException.class, () -> Parallel.runWithPool(1, scoped -> {
            used[0] = scoped;
            throw new IllegalStateException("body failed");
        }));

        assertTrue(used[0].isShutdown());
    }
}
