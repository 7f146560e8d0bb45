package com.parallaxsystems;

import java.util.concurrent.CompletableFuture;

/**
 * Sender backing a blocked {@code sendAndWait} caller or an {@link Reply} from {@code ask}.
 * The first reply or failure wins; later ones are ignored.
 */
final class FutureSender<R> implements Sender {

    private final CompletableFuture<R> future = new CompletableFuture<>();

    @Override
    @SuppressWarnings("unchecked")
    public void deliverReply(Object reply) {
        future.complete((R) reply);
    }

    @Override
    public void deliverFailure(Throwable cause) {
        future.completeExceptionally(cause);
    }

    CompletableFuture<R> future() {
        return future;
    }
}
