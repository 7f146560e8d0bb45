package com.parallaxsystems;

/**
 * What actually travels through an actor's mailbox: a user message with its sender, or
 * an internal control item that must run on the actor's own turn.
 */
final class Envelope<M> {

    enum Kind {
        MESSAGE,
        TIMEOUT,
        TASK
    }

    private final Kind kind;
    private final M message;
    private final Sender sender;
    private final long token;
    private final Runnable task;

    private Envelope(Kind kind, M message, Sender sender, long token, Runnable task) {
        this.kind = kind;
        this.message = message;
        this.sender = sender;
        this.token = token;
        this.task = task;
    }

    static <M> Envelope<M> message(M message, Sender sender) {
        return new Envelope<>(Kind.MESSAGE, message, sender, 0L, null);
    }

    static <M> Envelope<M> timeout(long token) {
        return new Envelope<>(Kind.TIMEOUT, null, null, token, null);
    }

    static <M> Envelope<M> task(Runnable task) {
        return new Envelope<>(Kind.TASK, null, null, 0L, task);
    }

    Kind kind() {
        return kind;
    }

    M message() {
        return message;
    }

    Sender sender() {
        return sender;
    }

    long token() {
        return token;
    }

    Runnable task() {
        return task;
    }

    @Override
    public String toString() {
        switch (kind) {
            case MESSAGE:
                return String.valueOf(message);
            case TIMEOUT:
                return "<timeout #" + token + ">";
            default:
                return "<task>";
        }
    }
}
