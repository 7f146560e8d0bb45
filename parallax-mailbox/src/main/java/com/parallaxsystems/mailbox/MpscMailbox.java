package com.parallaxsystems.mailbox;

import org.jctools.queues.MpscUnboundedArrayQueue;

import java.util.Collection;
import java.util.Objects;

/**
 * High-throughput mailbox implementation using a JCTools MPSC (Multi-Producer Single-Consumer) queue.
 *
 * This implementation provides:
 * - Lock-free message enqueuing
 * - Minimal allocation overhead (array chunks instead of per-message nodes)
 *
 * Recommended for:
 * - High-throughput actors with many senders
 * - CPU-bound workloads
 *
 * Only one thread may consume at a time. The actor runtime guarantees this because
 * at most one runner per actor is scheduled.
 *
 * @param <T> The type of messages
 */
public class MpscMailbox<T> implements Mailbox<T> {

    private static final int DEFAULT_CHUNK_SIZE = 128;

    private final MpscUnboundedArrayQueue<T> queue;
    private final int chunkSize;

    /**
     * Creates an MPSC mailbox with the default chunk size (128).
     */
    public MpscMailbox() {
        this(DEFAULT_CHUNK_SIZE);
    }

    /**
     * Creates an MPSC mailbox with the specified chunk size.
     * The queue is unbounded; the chunk size only controls allocation granularity.
     *
     * @param chunkSize the chunk size, rounded up to a power of 2 (minimum 2)
     */
    public MpscMailbox(int chunkSize) {
        this.chunkSize = nextPowerOfTwo(Math.max(2, chunkSize));
        this.queue = new MpscUnboundedArrayQueue<>(this.chunkSize);
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        return queue.offer(message);
    }

    @Override
    public T poll() {
        return queue.poll();
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        Objects.requireNonNull(collection, "Collection cannot be null");
        if (maxElements <= 0) {
            return 0;
        }
        return queue.drain(collection::add, maxElements);
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public void clear() {
        queue.clear();
    }

    /**
     * Returns the allocation chunk size of the underlying queue.
     *
     * @return the chunk size (always a power of 2)
     */
    public int getChunkSize() {
        return chunkSize;
    }

    private static int nextPowerOfTwo(int value) {
        int highest = Integer.highestOneBit(value);
        return highest == value ? value : highest << 1;
    }
}
