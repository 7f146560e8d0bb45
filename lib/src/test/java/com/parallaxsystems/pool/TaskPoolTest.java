package com.parallaxsystems.pool;

import com.parallaxsystems.Result;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 30, unit = TimeUnit.SECONDS)
class TaskPoolTest {

    private TaskPool pool;

    @BeforeEach
    void setUp() {
        pool = new TaskPool(PoolConfig.withParallelism(2).setName("test-pool"));
    }

    @AfterEach
    void tearDown() {
        pool.shutdown(false);
        pool.awaitTermination(Duration.ofSeconds(5));
    }

    @Nested
    class Submission {

        @Test
        void shouldReturnValueOfCallable() {
            TaskHandle<Integer> handle = pool.submit(() -> 6 * 7);
            assertEquals(42, handle.join());
            assertTrue(handle.isDone());
        }

        @Test
        void shouldRunWorkOnNamedWorkers() {
            String threadName = pool.submit(() -> Thread.currentThread().getName()).join();
            assertTrue(threadName.startsWith("test-pool-worker-"), threadName);
        }

        @Test
        void shouldUseConfiguredNumberOfWorkers() throws InterruptedException {
            Set<String> threads = ConcurrentHashMap.newKeySet();
            CountDownLatch bothRunning = new CountDownLatch(2);
            List<TaskHandle<Void>> handles = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                handles.add(pool.submit(() -> {
                    threads.add(Thread.currentThread().getName());
                    bothRunning.countDown();
                    try {
                        bothRunning.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }));
            }
            handles.forEach(TaskHandle::join);
            assertEquals(2, threads.size());
            assertEquals(2, pool.getParallelism());
        }

        @Test
        void runnableShouldCompleteWithNull() {
            AtomicReference<String> ran = new AtomicReference<>();
            assertNull(pool.submit(() -> ran.set("yes")).join());
            assertEquals("yes", ran.get());
        }

        @Test
        void shouldReportWorkerThread() {
            assertFalse(pool.isWorkerThread());
            assertTrue(pool.submit(pool::isWorkerThread).join());
        }
    }

    @Nested
    class Failures {

        @Test
        void joinShouldThrowTaskExecutionExceptionWithCause() {
            TaskHandle<Object> handle = pool.submit(() -> {
                throw new IllegalStateException("broken");
            });

            TaskExecutionException error = assertThrows(TaskExecutionException.class, handle::join);
            assertInstanceOf(IllegalStateException.class, error.getCause());
            assertEquals("broken", error.getCause().getMessage());
        }

        @Test
        void checkedExceptionsShouldBeWrappedToo() {
            TaskHandle<Object> handle = pool.submit(() -> {
                throw new java.io.IOException("disk");
            });

            TaskExecutionException error = assertThrows(TaskExecutionException.class, handle::join);
            assertInstanceOf(java.io.IOException.class, error.getCause());
        }

        @Test
        void failingWorkShouldNotKillWorkers() {
            for (int i = 0; i < 10; i++) {
                pool.submit(() -> {
                    throw new RuntimeException("fail");
                }).await();
            }
            assertEquals("still alive", pool.submit(() -> "still alive").join());
        }

        @Test
        void awaitShouldReturnFailureResult() {
            Result<Object> result = pool.submit(() -> {
                throw new IllegalArgumentException("nope");
            }).await();

            assertFalse(result.isSuccess());
            assertInstanceOf(Result.Failure.class, result);
            assertInstanceOf(TaskExecutionException.class, ((Result.Failure<Object>) result).error());
        }

        @Test
        void joinWithTimeoutShouldExpire() {
            CountDownLatch release = new CountDownLatch(1);
            TaskHandle<Void> handle = pool.submit(() -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });

            assertThrows(TimeoutException.class, () -> handle.join(Duration.ofMillis(50)));
            release.countDown();
        }

        @Test
        void onCompleteShouldReceiveUnwrappedFailure() throws InterruptedException {
            AtomicReference<Throwable> failure = new AtomicReference<>();
            CountDownLatch done = new CountDownLatch(1);
            pool.submit(() -> {
                throw new IllegalStateException("late");
            }).onComplete(value -> done.countDown(), error -> {
                failure.set(error);
                done.countDown();
            });

            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertInstanceOf(TaskExecutionException.class, failure.get());
            assertInstanceOf(IllegalStateException.class, failure.get().getCause());
        }
    }

    @Nested
    class AsyncFunctions {

        @Test
        void asyncFunctionShouldReturnHandleImmediately() {
            Function<Integer, TaskHandle<Integer>> square = pool.async(x -> x * x);

            List<TaskHandle<Integer>> handles = new ArrayList<>();
            for (int i = 1; i <= 5; i++) {
                handles.add(square.apply(i));
            }

            int total = handles.stream().mapToInt(TaskHandle::join).sum();
            assertEquals(1 + 4 + 9 + 16 + 25, total);
        }

        @Test
        void mapShouldTransformValue() {
            assertEquals("42", pool.submit(() -> 42).map(String::valueOf).join());
        }
    }

    @Nested
    class Shutdown {

        @Test
        void drainingShutdownShouldFinishQueuedWork() {
            TaskPool single = new TaskPool(1);
            List<TaskHandle<Integer>> handles = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                int value = i;
                handles.add(single.submit(() -> value));
            }
            single.shutdown(true);

            assertTrue(single.awaitTermination(Duration.ofSeconds(5)));
            for (int i = 0; i < 20; i++) {
                assertEquals(i, handles.get(i).join());
            }
        }

        @Test
        void discardingShutdownShouldCancelQueuedWork() throws InterruptedException {
            TaskPool single = new TaskPool(1);
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            TaskHandle<String> running = single.submit(() -> {
                started.countDown();
                release.await(5, TimeUnit.SECONDS);
                return "first";
            });
            assertTrue(started.await(5, TimeUnit.SECONDS));
            TaskHandle<String> queued = single.submit(() -> "second");

            single.shutdown(false);

            assertThrows(TaskCancelledException.class, queued::join);
            release.countDown();
            assertTrue(single.awaitTermination(Duration.ofSeconds(5)));
            assertTrue(running.isDone());
        }

        @Test
        void cancelShouldOnlyAffectWorkThatHasNotStarted() throws InterruptedException {
            TaskPool single = new TaskPool(1);
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            TaskHandle<String> running = single.submit(() -> {
                started.countDown();
                release.await(5, TimeUnit.SECONDS);
                return "done";
            });
            assertTrue(started.await(5, TimeUnit.SECONDS));
            TaskHandle<String> queued = single.submit(() -> "never");

            assertTrue(queued.cancel());
            assertFalse(running.cancel());
            release.countDown();

            assertEquals("done", running.join());
            assertThrows(TaskCancelledException.class, queued::join);
            single.close();
        }

        @Test
        void submitAfterShutdownShouldBeRejected() {
            pool.shutdown(true);
            assertTrue(pool.isShutdown());
            assertThrows(RejectedExecutionException.class, () -> pool.submit(() -> 1));
            assertThrows(RejectedExecutionException.class, () -> pool.execute(() -> { }));
        }

        @Test
        void closeShouldTerminatePool() {
            TaskPool closing = new TaskPool(2);
            closing.submit(() -> 1).join();
            closing.close();
            assertTrue(closing.isTerminated());
        }
    }
}
