package com.parallaxsystems.mailbox;

/**
 * Enumerates the mailbox implementations an actor can be created with.
 */
public enum MailboxType {
    /**
     * Unbounded {@link LinkedMailbox} backed by a ConcurrentLinkedQueue.
     * Default choice.
     */
    LINKED,

    /**
     * Unbounded lock-free {@link MpscMailbox} backed by a JCTools MPSC queue.
     * Better for actors with many concurrent senders.
     */
    MPSC;

    /**
     * Creates a new, empty mailbox of this type.
     *
     * @param <T> the message type
     * @return a new mailbox
     */
    public <T> Mailbox<T> newMailbox() {
        switch (this) {
            case MPSC:
                return new MpscMailbox<>();
            case LINKED:
            default:
                return new LinkedMailbox<>();
        }
    }
}
