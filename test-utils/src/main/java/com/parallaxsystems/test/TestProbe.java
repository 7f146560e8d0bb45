package com.parallaxsystems.test;

import com.parallaxsystems.ActorContext;
import com.parallaxsystems.ParallelGroup;
import com.parallaxsystems.Sender;
import com.parallaxsystems.StaticDispatchActor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * An actor that records what it receives so a test can assert on it.
 * <p>
 * Use it as a message target, as the reply address of a send, or as a supervisor:
 * <pre>{@code
 * TestProbe<Object> probe = TestProbe.create(group);
 * worker.send("job", probe.sender());
 * assertEquals("done", probe.expectMessage(Duration.ofSeconds(1)));
 *
 * worker.withSupervisor(probe.sender());
 * ActorFailure failure = probe.expectMessage(ActorFailure.class, Duration.ofSeconds(1));
 * }</pre>
 * Failures delivered instead of replies are recorded separately, see {@link #expectFailure}.
 *
 * @param <T> the type of messages the probe expects
 */
public class TestProbe<T> {

    private static final Logger logger = LoggerFactory.getLogger(TestProbe.class);

    private final ProbeActor actor;
    private final BlockingQueue<T> receivedMessages = new LinkedBlockingQueue<>();
    private final BlockingQueue<Throwable> receivedFailures = new LinkedBlockingQueue<>();

    private TestProbe(ParallelGroup group, String name) {
        this.actor = new ProbeActor(group, name);
        this.actor.start();
        logger.debug("Test probe {} started", name);
    }

    public static <T> TestProbe<T> create(ParallelGroup group) {
        return new TestProbe<>(group, "probe-" + UUID.randomUUID());
    }

    public static <T> TestProbe<T> create(ParallelGroup group, String name) {
        return new TestProbe<>(group, name);
    }

    /**
     * The probe's actor, for sending messages to it directly.
     */
    public StaticDispatchActor<Object> ref() {
        return actor;
    }

    /**
     * The probe as a reply address or supervisor.
     */
    public Sender sender() {
        return actor;
    }

    /**
     * Waits for the next message.
     *
     * @throws AssertionError if no message arrives in time
     */
    public T expectMessage(Duration timeout) {
        T message = poll(receivedMessages, timeout, "message");
        if (message == null) {
            throw new AssertionError("Expected message within " + timeout + " but none received");
        }
        return message;
    }

    /**
     * Waits for the next message and checks its type.
     */
    @SuppressWarnings("unchecked")
    public <M> M expectMessage(Class<M> messageType, Duration timeout) {
        T message = expectMessage(timeout);
        if (!messageType.isInstance(message)) {
            throw new AssertionError("Expected message of type " + messageType.getName()
                    + " but got " + message.getClass().getName() + ": " + message);
        }
        return (M) message;
    }

    /**
     * Waits for the next message and checks it against the predicate.
     */
    public T expectMessage(Predicate<? super T> predicate, Duration timeout) {
        T message = expectMessage(timeout);
        if (!predicate.test(message)) {
            throw new AssertionError("Received message does not match predicate: " + message);
        }
        return message;
    }

    /**
     * Waits for the given number of messages, returned in arrival order.
     */
    public List<T> expectMessages(int count, Duration timeout) {
        List<T> messages = new ArrayList<>(count);
        long deadline = System.nanoTime() + timeout.toNanos();
        while (messages.size() < count) {
            long remaining = deadline - System.nanoTime();
            T message = remaining > 0 ? poll(receivedMessages, Duration.ofNanos(remaining), "messages") : null;
            if (message == null) {
                throw new AssertionError("Expected " + count + " messages but only received "
                        + messages.size() + " within " + timeout + ": " + messages);
            }
            messages.add(message);
        }
        return messages;
    }

    /**
     * Asserts that no message arrives during the given time.
     */
    public void expectNoMessage(Duration duration) {
        T message = poll(receivedMessages, duration, "no message");
        if (message != null) {
            throw new AssertionError("Expected no message but received: " + message);
        }
    }

    /**
     * Waits for a failure delivered to the probe in place of a reply.
     */
    public Throwable expectFailure(Duration timeout) {
        Throwable failure = poll(receivedFailures, timeout, "failure");
        if (failure == null) {
            throw new AssertionError("Expected failure within " + timeout + " but none received");
        }
        return failure;
    }

    public Optional<T> receiveMessage(Duration timeout) {
        return Optional.ofNullable(poll(receivedMessages, timeout, "message"));
    }

    /**
     * Removes and returns every message received so far.
     */
    public List<T> receivedMessages() {
        List<T> messages = new ArrayList<>();
        receivedMessages.drainTo(messages);
        return messages;
    }

    public void stop() {
        actor.stop();
    }

    private static <E> E poll(BlockingQueue<E> queue, Duration timeout, String what) {
        try {
            return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting for " + what, e);
        }
    }

    private final class ProbeActor extends StaticDispatchActor<Object> {

        private ProbeActor(ParallelGroup group, String name) {
            super(group, name, Object.class);
        }

        @Override
        @SuppressWarnings("unchecked")
        protected void onMessage(Object message, ActorContext context) {
            receivedMessages.offer((T) message);
        }

        @Override
        public void deliverFailure(Throwable cause) {
            receivedFailures.offer(cause);
        }
    }
}
