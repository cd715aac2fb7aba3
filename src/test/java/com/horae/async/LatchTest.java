package com.horae.async;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LatchTest {

    @Test
    void startsStopped() {
        Latch latch = new Latch();

        assertTrue(latch.isStopped());
        assertTrue(latch.canStart());
        assertFalse(latch.canStop());
        assertEquals(LatchState.STOPPED, latch.getState());
    }

    @Test
    void fullCycleReleasesEachSignal() throws Exception {
        Latch latch = new Latch();

        CountDownLatch starting = latch.notifyStarting();
        latch.starting();
        assertTrue(starting.await(1, TimeUnit.SECONDS));
        assertTrue(latch.isStarting());

        CountDownLatch started = latch.notifyStarted();
        latch.started();
        assertTrue(started.await(1, TimeUnit.SECONDS));
        assertTrue(latch.isRunning());
        assertTrue(latch.canStop());

        CountDownLatch stopping = latch.notifyStopping();
        latch.stopping();
        assertTrue(stopping.await(1, TimeUnit.SECONDS));
        assertTrue(latch.isStopping());

        CountDownLatch stopped = latch.notifyStopped();
        latch.stopped();
        assertTrue(stopped.await(1, TimeUnit.SECONDS));
        assertTrue(latch.isStopped());
    }

    @Test
    void transitionsAreIdempotent() {
        Latch latch = new Latch();
        latch.starting();
        latch.started();
        latch.stopping();
        latch.stopped();

        CountDownLatch nextStarting = latch.notifyStarting();
        latch.stopped();

        assertTrue(latch.isStopped());
        assertSame(nextStarting, latch.notifyStarting());
        assertEquals(1, nextStarting.getCount());
    }

    @Test
    void canBeReusedAcrossCycles() throws Exception {
        Latch latch = new Latch();
        for (int cycle = 0; cycle < 3; cycle++) {
            latch.starting();
            CountDownLatch started = latch.notifyStarted();
            assertEquals(1, started.getCount());
            latch.started();
            assertTrue(started.await(1, TimeUnit.SECONDS));

            latch.stopping();
            CountDownLatch stopped = latch.notifyStopped();
            assertEquals(1, stopped.getCount());
            latch.stopped();
            assertTrue(stopped.await(1, TimeUnit.SECONDS));
        }
        assertTrue(latch.canStart());
    }

    @Test
    void resetReturnsToStopped() {
        Latch latch = new Latch();
        latch.starting();
        latch.started();

        latch.reset();

        assertTrue(latch.isStopped());
        assertEquals(1, latch.notifyStarted().getCount());
    }
}
