package com.parallaxsystems;

import com.google.common.base.Preconditions;

import java.util.function.Function;

/**
 * An actor that applies a function to every message and replies with the result.
 * Messages sent without a sender are processed and the result is dropped. A null result
 * is reported to the sender as a {@link ReplyException}.
 *
 * @param <T> The message type
 * @param <R> The reply type
 */
public class ReactiveActor<T, R> extends Actor<T> {

    private final Function<? super T, ? extends R> function;

    public ReactiveActor(Function<? super T, ? extends R> function) {
        super();
        this.function = Preconditions.checkNotNull(function, "function");
    }

    public ReactiveActor(ParallelGroup group, Function<? super T, ? extends R> function) {
        super(group);
        this.function = Preconditions.checkNotNull(function, "function");
    }

    @Override
    protected void receive(T message) {
        R result = function.apply(message);
        if (result == null) {
            getSender().ifPresent(sender -> sender.deliverFailure(
                    new ReplyException("Actor " + getActorId() + " produced no result for " + message)));
            return;
        }
        replyIfExists(result);
    }

    /**
     * Sends a message and blocks for the function's result.
     */
    public R apply(T message) {
        return sendAndWait(message);
    }
}
