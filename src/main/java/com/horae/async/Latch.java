package com.horae.async;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reusable start/stop coordinator for long-running components.
 * 
 * Each transition method fires a one-shot signal that observers can await
 * (e.g. {@code latch.notifyStopped().await()}), then re-arms the signal of the
 * next transition so the same latch can go through any number of start/stop cycles.
 * 
 * Transition methods are idempotent: calling {@link #stopped()} twice has the
 * same observable effect as calling it once.
 * 
 * Thread-safe: the state is atomic, the signal swap is guarded by a separate lock.
 */
public class Latch {

    private final AtomicReference<LatchState> state = new AtomicReference<>(LatchState.STOPPED);
    private final Object signalLock = new Object();

    // one-shot signals, released when the corresponding transition fires
    private CountDownLatch starting = new CountDownLatch(1);
    private CountDownLatch started = new CountDownLatch(1);
    private CountDownLatch stopping = new CountDownLatch(1);
    private CountDownLatch stopped = new CountDownLatch(1);

    /**
     * Resets the latch to STOPPED with fresh signals.
     */
    public void reset() {
        synchronized (signalLock) {
            state.set(LatchState.STOPPED);
            starting = new CountDownLatch(1);
            started = new CountDownLatch(1);
            stopping = new CountDownLatch(1);
            stopped = new CountDownLatch(1);
        }
    }

    // ==================== State checks ====================

    /**
     * @return true if the owner may start (latch is stopped)
     */
    public boolean canStart() {
        return state.get() == LatchState.STOPPED;
    }

    /**
     * @return true if the owner may stop (latch is running)
     */
    public boolean canStop() {
        return state.get() == LatchState.RUNNING;
    }

    public boolean isStarting() {
        return state.get() == LatchState.STARTING;
    }

    public boolean isRunning() {
        return state.get() == LatchState.RUNNING;
    }

    public boolean isStopping() {
        return state.get() == LatchState.STOPPING;
    }

    public boolean isStopped() {
        return state.get() == LatchState.STOPPED;
    }

    public LatchState getState() {
        return state.get();
    }

    // ==================== Signals ====================

    /**
     * @return signal released on the next STOPPED → STARTING transition
     */
    public CountDownLatch notifyStarting() {
        synchronized (signalLock) {
            return starting;
        }
    }

    /**
     * @return signal released on the next STARTING → RUNNING transition
     */
    public CountDownLatch notifyStarted() {
        synchronized (signalLock) {
            return started;
        }
    }

    /**
     * @return signal released when a stop is requested
     */
    public CountDownLatch notifyStopping() {
        synchronized (signalLock) {
            return stopping;
        }
    }

    /**
     * @return signal released once the owner has fully stopped
     */
    public CountDownLatch notifyStopped() {
        synchronized (signalLock) {
            return stopped;
        }
    }

    // ==================== Transitions ====================

    /**
     * Signals that the owner is starting. Typically called before spawning a worker thread.
     */
    public void starting() {
        synchronized (signalLock) {
            if (state.get() == LatchState.STARTING) {
                return;
            }
            state.set(LatchState.STARTING);
            starting.countDown();
            started = new CountDownLatch(1);
        }
    }

    /**
     * Signals that the owner is running.
     */
    public void started() {
        synchronized (signalLock) {
            if (state.get() == LatchState.RUNNING) {
                return;
            }
            state.set(LatchState.RUNNING);
            started.countDown();
            stopping = new CountDownLatch(1);
        }
    }

    /**
     * Requests the owner to stop.
     */
    public void stopping() {
        synchronized (signalLock) {
            if (state.get() == LatchState.STOPPING) {
                return;
            }
            state.set(LatchState.STOPPING);
            stopping.countDown();
            stopped = new CountDownLatch(1);
        }
    }

    /**
     * Signals that the owner has stopped.
     */
    public void stopped() {
        synchronized (signalLock) {
            if (state.get() == LatchState.STOPPED) {
                return;
            }
            state.set(LatchState.STOPPED);
            stopped.countDown();
            starting = new CountDownLatch(1);
        }
    }

    @Override
    public String toString() {
        return "Latch[" + state.get() + "]";
    }
}
