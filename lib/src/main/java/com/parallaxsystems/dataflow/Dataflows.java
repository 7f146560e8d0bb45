package com.parallaxsystems.dataflow;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeoutException;

/**
 * A named collection of {@link DataflowVariable}s, created lazily on first access.
 * <p>
 * Typical use is fanning work out to a pool and collecting results by key:
 * <pre>{@code
 * Dataflows<String, Double> price = new Dataflows<>();
 * for (String stock : stocks) {
 *     pool.submit(() -> price.put(stock, fetchClosingPrice(stock)));
 * }
 * String top = Collections.max(stocks, Comparator.comparing(price::get));
 * }</pre>
 * Reading a name blocks until some task binds it; each name can be bound once.
 *
 * @param <K> the name type
 * @param <V> the value type
 */
public class Dataflows<K, V> {

    private final ConcurrentMap<K, DataflowVariable<V>> variables = new ConcurrentHashMap<>();

    /**
     * Binds the variable with the given name.
     *
     * @param name the name
     * @param value the value
     * @throws AlreadyBoundException if the name is already bound
     */
    public void put(K name, V value) {
        variable(name).bind(value);
    }

    /**
     * Blocks until the variable with the given name is bound and returns its value.
     *
     * @param name the name
     * @return the bound value
     */
    public V get(K name) {
        return variable(name).get();
    }

    /**
     * Blocks until the variable with the given name is bound or the timeout expires.
     *
     * @param name the name
     * @param timeout the maximum time to wait
     * @return the bound value
     * @throws TimeoutException if the name is still unbound after the timeout
     */
    public V get(K name, Duration timeout) throws TimeoutException {
        return variable(name).get(timeout);
    }

    /**
     * Returns the variable for the given name, creating an unbound one if needed.
     *
     * @param name the name
     * @return the variable
     */
    public DataflowVariable<V> variable(K name) {
        return variables.computeIfAbsent(name, key -> new DataflowVariable<>(String.valueOf(key)));
    }

    /**
     * Returns whether a variable with the given name exists and is bound.
     */
    public boolean contains(K name) {
        DataflowVariable<V> variable = variables.get(name);
        return variable != null && variable.isBound();
    }

    /**
     * Returns a snapshot of the names accessed so far, bound or not.
     */
    public Set<K> names() {
        return Set.copyOf(variables.keySet());
    }

    public int size() {
        return variables.size();
    }
}
