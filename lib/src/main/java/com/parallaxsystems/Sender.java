package com.parallaxsystems;

/**
 * The return address attached to a message. Replies produced while the message is
 * processed are delivered here.
 * <p>
 * Every {@link Actor} is a sender, and callers blocked in {@link Actor#sendAndWait}
 * or holding a {@link Reply} from {@link Actor#ask} are backed by one.
 */
@FunctionalInterface
public interface Sender {

    /**
     * Delivers a reply value.
     *
     * @param reply the reply, never null
     */
    void deliverReply(Object reply);

    /**
     * Delivers a failure instead of a reply: the message was discarded or its processing
     * failed. Senders that cannot act on failures ignore them.
     *
     * @param cause the reason no reply will arrive
     */
    default void deliverFailure(Throwable cause) {
        // no reply expected
    }
}
