package com.parallaxsystems.dataflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * A single-assignment variable that blocks readers until a value is bound.
 * <p>
 * Lets independent tasks hand results to each other without explicit locks: producers
 * call {@link #bind(Object)} exactly once, consumers call {@link #get()} and wait for the
 * value. A bind happens-before every read that returns the bound value. Binding a second
 * time fails with {@link AlreadyBoundException} and leaves the original value in place.
 * <p>
 * Readers blocked on a pool worker thread are reported to the pool through
 * {@link ForkJoinPool#managedBlock}, so the pool can compensate with a spare worker
 * instead of starving the producer.
 *
 * @param <T> the value type; null is a legal value
 */
public class DataflowVariable<T> {

    private static final Logger logger = LoggerFactory.getLogger(DataflowVariable.class);

    private final String name;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition boundCondition = lock.newCondition();
    private final List<Consumer<? super T>> callbacks = new ArrayList<>();

    private volatile boolean bound = false;
    private T value;
    private int waitingReaders = 0;

    public DataflowVariable() {
        this(null);
    }

    /**
     * @param name a name used in log and error messages, or null
     */
    public DataflowVariable(String name) {
        this.name = name;
    }

    /**
     * Creates a variable that is already bound.
     *
     * @param value the value
     * @param <T> the value type
     * @return a bound variable
     */
    public static <T> DataflowVariable<T> of(T value) {
        DataflowVariable<T> variable = new DataflowVariable<>();
        variable.bind(value);
        return variable;
    }

    /**
     * Binds the variable, releasing every blocked reader and running registered callbacks.
     *
     * @param newValue the value to bind, may be null
     * @throws AlreadyBoundException if the variable is already bound
     */
    public void bind(T newValue) {
        List<Consumer<? super T>> toNotify;
        lock.lock();
        try {
            if (bound) {
                throw new AlreadyBoundException("Dataflow variable " + describe() + " is already bound", value);
            }
            value = newValue;
            bound = true;
            if (waitingReaders > 0) {
                logger.trace("Releasing {} readers of {}", waitingReaders, describe());
            }
            boundCondition.signalAll();
            toNotify = new ArrayList<>(callbacks);
            callbacks.clear();
        } finally {
            lock.unlock();
        }
        for (Consumer<? super T> callback : toNotify) {
            notify(callback, newValue);
        }
    }

    /**
     * Blocks until the variable is bound and returns its value.
     *
     * @return the bound value
     * @throws DataflowException if the calling thread is interrupted while waiting
     */
    public T get() {
        if (bound) {
            return valueAfterBind();
        }
        try {
            ForkJoinPool.managedBlock(new BindBlocker(-1L));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DataflowException("Interrupted while reading " + describe(), e);
        }
        return valueAfterBind();
    }

    /**
     * Blocks until the variable is bound or the timeout expires.
     *
     * @param timeout the maximum time to wait
     * @return the bound value
     * @throws TimeoutException if the variable is still unbound after the timeout
     */
    public T get(Duration timeout) throws TimeoutException {
        if (bound) {
            return valueAfterBind();
        }
        BindBlocker blocker = new BindBlocker(System.nanoTime() + timeout.toNanos());
        try {
            ForkJoinPool.managedBlock(blocker);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DataflowException("Interrupted while reading " + describe(), e);
        }
        if (!bound) {
            throw new TimeoutException("Dataflow variable " + describe() + " not bound within " + timeout);
        }
        return valueAfterBind();
    }

    /**
     * Returns the value if bound, without blocking.
     * An empty Optional is also returned for a variable bound to null.
     */
    public Optional<T> getIfBound() {
        return bound ? Optional.ofNullable(valueAfterBind()) : Optional.empty();
    }

    public boolean isBound() {
        return bound;
    }

    /**
     * Registers a callback that runs once the variable is bound: on the binding thread,
     * or immediately on the calling thread if the variable is already bound.
     *
     * @param callback the callback receiving the bound value
     */
    public void whenBound(Consumer<? super T> callback) {
        T current;
        lock.lock();
        try {
            if (!bound) {
                callbacks.add(callback);
                return;
            }
            current = value;
        } finally {
            lock.unlock();
        }
        notify(callback, current);
    }

    /**
     * Number of readers currently blocked waiting for the bind.
     */
    public int getWaitingReaders() {
        lock.lock();
        try {
            return waitingReaders;
        } finally {
            lock.unlock();
        }
    }

    private T valueAfterBind() {
        // callers have observed bound == true; the volatile read orders this after the write in bind()
        return value;
    }

    private void notify(Consumer<? super T> callback, T boundValue) {
        try {
            callback.accept(boundValue);
        } catch (RuntimeException e) {
            logger.error("Bind callback of {} failed", describe(), e);
        }
    }

    private String describe() {
        return name != null ? "'" + name + "'" : "@" + Integer.toHexString(System.identityHashCode(this));
    }

    @Override
    public String toString() {
        return "DataflowVariable[" + (name != null ? name + ", " : "") + (bound ? "bound=" + value : "unbound") + "]";
    }

    private final class BindBlocker implements ForkJoinPool.ManagedBlocker {
        private final long deadlineNanos;

        BindBlocker(long deadlineNanos) {
            this.deadlineNanos = deadlineNanos;
        }

        @Override
        public boolean block() throws InterruptedException {
            lock.lock();
            try {
                waitingReaders++;
                try {
                    while (!bound) {
                        if (deadlineNanos < 0) {
                            boundCondition.await();
                        } else {
                            long remaining = deadlineNanos - System.nanoTime();
                            if (remaining <= 0) {
                                break;
                            }
                            boundCondition.awaitNanos(remaining);
                        }
                    }
                } finally {
                    waitingReaders--;
                }
            } finally {
                lock.unlock();
            }
            return true;
        }

        @Override
        public boolean isReleasable() {
            return bound || (deadlineNanos >= 0 && System.nanoTime() >= deadlineNanos);
        }
    }
}
