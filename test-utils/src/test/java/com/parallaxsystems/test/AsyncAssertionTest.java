package com.parallaxsystems.test;

import com.parallaxsystems.ActorState;
import com.parallaxsystems.ParallelGroup;
import com.parallaxsystems.StaticDispatchActor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AsyncAssertionTest {

    private ParallelGroup group;

    @BeforeEach
    void setUp() {
        group = new ParallelGroup(2);
    }

    @AfterEach
    void tearDown() {
        group.shutdown();
    }

    @Test
    void eventuallyShouldPassWhenConditionBecomesTrue() {
        AtomicInteger counter = new AtomicInteger(0);
        new Thread(() -> {
            sleep(50);
            counter.set(5);
        }).start();

        AsyncAssertion.eventually(() -> counter.get() == 5, Duration.ofSeconds(2));
        assertEquals(5, counter.get());
    }

    @Test
    void eventuallyShouldFailWhenConditionNeverTrue() {
        AssertionError error = assertThrows(AssertionError.class,
                () -> AsyncAssertion.eventually(() -> false, Duration.ofMillis(100)));
        assertTrue(error.getMessage().contains("Condition did not become true"));
    }

    @Test
    void eventuallyShouldReportLastErrorFromCondition() {
        AssertionError error = assertThrows(AssertionError.class, () -> AsyncAssertion.eventually(() -> {
            throw new IllegalStateException("not ready");
        }, Duration.ofMillis(100)));
        assertTrue(error.getMessage().contains("not ready"));
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void awaitValueShouldReturnValueWhenReached() {
        AtomicInteger counter = new AtomicInteger(0);
        new Thread(() -> {
            for (int i = 1; i <= 3; i++) {
                sleep(20);
                counter.set(i);
            }
        }).start();

        assertEquals(3, AsyncAssertion.awaitValue(counter::get, 3, Duration.ofSeconds(2)));
    }

    @Test
    void awaitValueShouldIncludeHistoryInFailure() {
        AssertionError error = assertThrows(AssertionError.class,
                () -> AsyncAssertion.awaitValue(() -> 1, 2, Duration.ofMillis(100)));
        assertTrue(error.getMessage().contains("Value history: [1]"));
    }

    @Test
    void eventuallyAssertShouldRetryUntilAssertionPasses() {
        AtomicInteger attempts = new AtomicInteger(0);
        AsyncAssertion.eventuallyAssert(() -> assertTrue(attempts.incrementAndGet() >= 3), Duration.ofSeconds(2));
        assertTrue(attempts.get() >= 3);
    }

    @Test
    void awaitStateShouldObserveStoppedActor() {
        StaticDispatchActor<String> actor = group.staticMessageHandler(String.class, (message, context) -> context.stop());
        actor.send("stop");

        AsyncAssertion.awaitState(actor, ActorState.STOPPED, Duration.ofSeconds(2));
    }

    @Test
    void awaitStateShouldNameActorOnFailure() {
        StaticDispatchActor<String> actor = group.staticMessageHandler(String.class, (message, context) -> { });

        AssertionError error = assertThrows(AssertionError.class,
                () -> AsyncAssertion.awaitState(actor, ActorState.STOPPED, Duration.ofMillis(100)));
        assertTrue(error.getMessage().contains(actor.getActorId()));
        assertTrue(error.getMessage().contains("ACTIVE"));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
