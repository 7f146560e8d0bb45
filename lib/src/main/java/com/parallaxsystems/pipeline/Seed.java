package com.parallaxsystems.pipeline;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableCollection;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMultimap;
import com.google.common.collect.ImmutableTable;

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * The initial accumulator of a {@code combine}, handed out fresh for every key.
 * <p>
 * Folds for different keys run concurrently, so a seed must never be shared mutably
 * between them. There are three ways to supply one:
 * <ul>
 *   <li>{@link #of(Object)}: an immutable value, shared as is, or a {@link Cloneable} one,
 *       cloned per key. Anything else is rejected.</li>
 *   <li>{@link #copying(Object, UnaryOperator)}: a template and a copy function, checked to
 *       produce a distinct object.</li>
 *   <li>{@link #supplier(Supplier)}: a factory called once per key.</li>
 * </ul>
 *
 * @param <A> the accumulator type
 */
public abstract class Seed<A> {

    private static final Set<Class<?>> IMMUTABLE_TYPES = Set.of(
            String.class, Integer.class, Long.class, Short.class, Byte.class, Double.class, Float.class,
            Character.class, Boolean.class, BigInteger.class, BigDecimal.class, UUID.class, Class.class);

    private Seed() {
    }

    /**
     * Returns a seed value that no other key's fold can observe.
     */
    public abstract A fresh();

    /**
     * A seed from a value that is either immutable (shared between keys) or cloneable
     * (cloned for every key).
     *
     * @throws IllegalArgumentException if the value is mutable and not cloneable
     */
    public static <A> Seed<A> of(A value) {
        if (isImmutable(value)) {
            return new Shared<>(value);
        }
        if (value instanceof Cloneable) {
            Seed<A> seed = new Cloned<>(value);
            seed.fresh();
            return seed;
        }
        throw new IllegalArgumentException("Seed " + value.getClass().getName()
                + " is neither immutable nor Cloneable; use Seed.copying() or Seed.supplier()");
    }

    /**
     * A seed produced by copying a template for every key.
     *
     * @throws IllegalStateException if the copier returns the template itself
     */
    public static <A> Seed<A> copying(A template, UnaryOperator<A> copier) {
        Preconditions.checkNotNull(copier, "copier");
        Seed<A> seed = new Copied<>(template, copier);
        seed.fresh();
        return seed;
    }

    /**
     * A seed produced by a factory for every key.
     */
    public static <A> Seed<A> supplier(Supplier<? extends A> factory) {
        Preconditions.checkNotNull(factory, "factory");
        return new Supplied<>(factory);
    }

    static boolean isImmutable(Object value) {
        return value == null
                || IMMUTABLE_TYPES.contains(value.getClass())
                || value instanceof Enum
                || value instanceof TemporalAccessor && value.getClass().getName().startsWith("java.time.")
                || value instanceof Optional
                || value instanceof ImmutableCollection
                || value instanceof ImmutableMap
                || value instanceof ImmutableMultimap
                || value instanceof ImmutableTable;
    }

    private static final class Shared<A> extends Seed<A> {
        private final A value;

        private Shared(A value) {
            this.value = value;
        }

        @Override
        public A fresh() {
            return value;
        }
    }

    private static final class Cloned<A> extends Seed<A> {
        private final A template;

        private Cloned(A template) {
            this.template = template;
        }

        @Override
        @SuppressWarnings("unchecked")
        public A fresh() {
            Class<?> type = template.getClass();
            if (type.isArray()) {
                int length = Array.getLength(template);
                Object copy = Array.newInstance(type.getComponentType(), length);
                System.arraycopy(template, 0, copy, 0, length);
                return (A) copy;
            }
            try {
                Method clone = type.getMethod("clone");
                return checkDistinct(template, (A) clone.invoke(template));
            } catch (NoSuchMethodException | IllegalAccessException e) {
                throw new IllegalArgumentException("Seed " + type.getName() + " does not expose a public clone()", e);
            } catch (InvocationTargetException e) {
                throw new IllegalStateException("Cloning seed " + type.getName() + " failed", e.getCause());
            }
        }
    }

    private static final class Copied<A> extends Seed<A> {
        private final A template;
        private final UnaryOperator<A> copier;

        private Copied(A template, UnaryOperator<A> copier) {
            this.template = template;
            this.copier = copier;
        }

        @Override
        public A fresh() {
            return checkDistinct(template, copier.apply(template));
        }
    }

    private static final class Supplied<A> extends Seed<A> {
        private final Supplier<? extends A> factory;

        private Supplied(Supplier<? extends A> factory) {
            this.factory = factory;
        }

        @Override
        public A fresh() {
            return factory.get();
        }
    }

    private static <A> A checkDistinct(A template, A copy) {
        if (copy == template && !isImmutable(template)) {
            throw new IllegalStateException("Seed copy of " + template.getClass().getName()
                    + " returned the template itself; folds for different keys would share it");
        }
        return copy;
    }
}
