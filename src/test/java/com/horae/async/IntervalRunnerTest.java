package com.horae.async;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class IntervalRunnerTest {

    private IntervalRunner runner;

    @AfterEach
    void tearDown() {
        if (runner != null && runner.isRunning()) {
            runner.stop();
        }
    }

    @Test
    void runsActionOnEveryTick() throws Exception {
        CountDownLatch ticks = new CountDownLatch(3);
        runner = new IntervalRunner("test", ticks::countDown, Duration.ofMillis(5));

        runner.start();

        assertTrue(runner.isRunning());
        assertTrue(ticks.await(2, TimeUnit.SECONDS));
    }

    @Test
    void startTwiceFails() {
        runner = new IntervalRunner("test", () -> { }, Duration.ofMillis(5));
        runner.start();

        assertThrows(CannotStartException.class, () -> runner.start());
    }

    @Test
    void stopWithoutStartFails() {
        runner = new IntervalRunner("test", () -> { }, Duration.ofMillis(5));

        assertThrows(CannotStopException.class, () -> runner.stop());
    }

    @Test
    void stopHaltsTheLoop() throws Exception {
        AtomicInteger count = new AtomicInteger();
        runner = new IntervalRunner("test", count::incrementAndGet, Duration.ofMillis(2));
        runner.start();
        Thread.sleep(30);

        runner.stop();
        int afterStop = count.get();
        Thread.sleep(30);

        assertFalse(runner.isRunning());
        assertEquals(afterStop, count.get());
    }

    @Test
    void canRestartAfterStop() throws Exception {
        AtomicInteger count = new AtomicInteger();
        runner = new IntervalRunner("test", count::incrementAndGet, Duration.ofMillis(2));
        runner.start();
        runner.stop();
        int afterFirstCycle = count.get();

        runner.start();
        long deadline = System.currentTimeMillis() + 2000;
        while (count.get() == afterFirstCycle && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }

        assertTrue(count.get() > afterFirstCycle);
    }

    @Test
    @SuppressWarnings("unchecked")
    void actionErrorsGoToHandlerAndDoNotStopTheLoop() throws Exception {
        Consumer<Exception> handler = mock(Consumer.class);
        CountDownLatch attempts = new CountDownLatch(3);
        runner = new IntervalRunner("failing", () -> {
            attempts.countDown();
            throw new IllegalStateException("boom");
        }, Duration.ofMillis(2)).withErrorHandler(handler);

        runner.start();

        assertTrue(attempts.await(2, TimeUnit.SECONDS));
        verify(handler, timeout(1000).atLeast(2)).accept(any(IllegalStateException.class));
        assertTrue(runner.isRunning());
    }

    @Test
    @SuppressWarnings("unchecked")
    void actionThrowingAnErrorKeepsTicking() throws Exception {
        Consumer<Exception> handler = mock(Consumer.class);
        CountDownLatch attempts = new CountDownLatch(5);
        runner = new IntervalRunner("erroring", () -> {
            attempts.countDown();
            throw new AssertionError("boom");
        }, Duration.ofMillis(5)).withErrorHandler(handler);

        runner.start();

        assertTrue(attempts.await(2, TimeUnit.SECONDS), "loop stopped after an Error");
        verify(handler, timeout(1000).atLeast(2))
            .accept(argThat(e -> e instanceof ExecutionException && e.getCause() instanceof AssertionError));
        assertTrue(runner.isRunning());
    }

    @Test
    void errorWithoutHandlerIsLoggedAndLoopContinues() throws Exception {
        CountDownLatch attempts = new CountDownLatch(3);
        runner = new IntervalRunner("unhandled", () -> {
            attempts.countDown();
            throw new StackOverflowError();
        }, Duration.ofMillis(5));

        runner.start();

        assertTrue(attempts.await(2, TimeUnit.SECONDS));
    }

    @Test
    void failingHandlerDoesNotStopTheLoop() throws Exception {
        CountDownLatch attempts = new CountDownLatch(3);
        runner = new IntervalRunner("bad-handler", () -> {
            attempts.countDown();
            throw new IllegalStateException("boom");
        }, Duration.ofMillis(5)).withErrorHandler(e -> {
            throw new IllegalArgumentException("handler broke");
        });

        runner.start();

        assertTrue(attempts.await(2, TimeUnit.SECONDS));
    }

    @Test
    void firstTickWaitsForDelayPlusInterval() throws Exception {
        CountDownLatch firstTick = new CountDownLatch(1);
        runner = new IntervalRunner("delayed", firstTick::countDown, Duration.ofMillis(50))
            .withDelay(Duration.ofMillis(200));

        runner.start();

        assertFalse(firstTick.await(150, TimeUnit.MILLISECONDS));
        assertTrue(firstTick.await(2, TimeUnit.SECONDS));
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class,
                     () -> new IntervalRunner("bad", () -> { }, Duration.ZERO));
    }
}
