package com.parallaxsystems.handler;

import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A table mapping message types to handlers, resolved against the runtime type of each
 * message.
 * <p>
 * Resolution picks the most specific registered type the message is an instance of, be it
 * a class or an interface. When several candidates are equally specific (unrelated
 * interfaces, or the same type registered twice) the later registration wins, so handlers
 * added with {@link #when} after construction override earlier ones. A message matching
 * nothing falls through to the {@link #otherwise} handler, if any.
 * <pre>{@code
 * HandlerRegistry registry = HandlerRegistry.create()
 *         .when(String.class, (text, ctx) -> ctx.reply(text.length()))
 *         .when(Number.class, (number, ctx) -> ctx.reply(number.intValue() * 2))
 *         .otherwise((message, ctx) -> ctx.getLogger().warn("Ignoring {}", message));
 * }</pre>
 */
public final class HandlerRegistry {

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    private final Map<Class<?>, Optional<MessageHandler<Object>>> resolved = new ConcurrentHashMap<>();
    private volatile MessageHandler<Object> fallback;

    private HandlerRegistry() {
    }

    public static HandlerRegistry create() {
        return new HandlerRegistry();
    }

    /**
     * Registers a handler for messages that are instances of the given type.
     *
     * @param type    the message type, a class or an interface
     * @param handler the handler
     * @return this registry
     */
    @SuppressWarnings("unchecked")
    public <T> HandlerRegistry when(Class<T> type, MessageHandler<? super T> handler) {
        Preconditions.checkNotNull(type, "type");
        Preconditions.checkNotNull(handler, "handler");
        registrations.add(new Registration(type, (MessageHandler<Object>) handler));
        resolved.clear();
        return this;
    }

    /**
     * Registers the catch-all handler for messages no typed handler accepts.
     *
     * @param handler the handler
     * @return this registry
     */
    public HandlerRegistry otherwise(MessageHandler<Object> handler) {
        this.fallback = Preconditions.checkNotNull(handler, "handler");
        resolved.clear();
        return this;
    }

    /**
     * Finds the handler for a message of the given runtime type.
     *
     * @param messageType the runtime class of the message
     * @return the handler, or empty if nothing matches and there is no catch-all
     */
    public Optional<MessageHandler<Object>> resolve(Class<?> messageType) {
        return resolved.computeIfAbsent(messageType, this::lookup);
    }

    public boolean hasFallback() {
        return fallback != null;
    }

    public int size() {
        return registrations.size();
    }

    /**
     * Returns an independent copy; later changes to either registry do not affect the other.
     */
    public HandlerRegistry copy() {
        HandlerRegistry copy = new HandlerRegistry();
        copy.registrations.addAll(registrations);
        copy.fallback = fallback;
        return copy;
    }

    private Optional<MessageHandler<Object>> lookup(Class<?> messageType) {
        List<Registration> candidates = new ArrayList<>();
        for (Registration registration : registrations) {
            if (registration.type.isAssignableFrom(messageType)) {
                candidates.add(registration);
            }
        }
        // walk backwards so that among equally specific candidates the latest one wins
        for (int i = candidates.size() - 1; i >= 0; i--) {
            Registration candidate = candidates.get(i);
            if (!isStrictlyMoreGeneral(candidate, candidates)) {
                return Optional.of(candidate.handler);
            }
        }
        return Optional.ofNullable(fallback);
    }

    private static boolean isStrictlyMoreGeneral(Registration candidate, List<Registration> candidates) {
        for (Registration other : candidates) {
            if (other.type != candidate.type && candidate.type.isAssignableFrom(other.type)) {
                return true;
            }
        }
        return false;
    }

    private static final class Registration {
        private final Class<?> type;
        private final MessageHandler<Object> handler;

        private Registration(Class<?> type, MessageHandler<Object> handler) {
            this.type = type;
            this.handler = handler;
        }
    }
}
