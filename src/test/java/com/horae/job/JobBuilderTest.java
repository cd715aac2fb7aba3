package com.horae.job;

import com.horae.schedule.Schedules;
import com.horae.scheduler.JobInvocation;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class JobBuilderTest {

    private static JobContext contextFor(String name) {
        JobInvocation invocation = mock(JobInvocation.class);
        when(invocation.getName()).thenReturn(name);
        when(invocation.getId()).thenReturn("abcdefghijklmno");
        return new JobContext(invocation);
    }

    @Test
    void unsetCapabilitiesUseDefaults() {
        Job job = JobBuilder.newJob("plain").build();

        assertEquals("plain", job.getName());
        assertNull(job.getSchedule());
        assertEquals(Duration.ZERO, job.getTimeout());
        assertTrue(job.isEnabled());
        assertFalse(job.isSerial());
        assertTrue(job.shouldTriggerListeners());
        assertTrue(job.shouldWriteOutput());
    }

    @Test
    void providersAreQueriedOnEveryCall() {
        AtomicBoolean enabled = new AtomicBoolean(true);
        Job job = JobBuilder.newJob("toggled")
            .enabledProvider(enabled::get)
            .build();

        assertTrue(job.isEnabled());
        enabled.set(false);
        assertFalse(job.isEnabled());
    }

    @Test
    void capturesConfiguredValues() {
        Job job = JobBuilder.newJob("configured")
            .schedule(Schedules.everyMinute())
            .timeout(Duration.ofSeconds(30))
            .serial(true)
            .shouldTriggerListenersProvider(() -> false)
            .shouldWriteOutputProvider(() -> false)
            .build();

        assertNotNull(job.getSchedule());
        assertEquals(Duration.ofSeconds(30), job.getTimeout());
        assertTrue(job.isSerial());
        assertFalse(job.shouldTriggerListeners());
        assertFalse(job.shouldWriteOutput());
    }

    @Test
    void runsActionAndHooks() throws Exception {
        List<String> calls = new ArrayList<>();
        Job job = JobBuilder.newJob("hooked")
            .action(ctx -> calls.add("execute:" + ctx.getJobName()))
            .onStart(ctx -> calls.add("start"))
            .onComplete(ctx -> calls.add("complete"))
            .onFailure(ctx -> calls.add("failure"))
            .onCancellation(ctx -> calls.add("cancellation"))
            .onBroken(ctx -> calls.add("broken"))
            .onFixed(ctx -> calls.add("fixed"))
            .build();
        JobContext context = contextFor("hooked");

        job.onStart(context);
        job.execute(context);
        job.onComplete(context);
        job.onFailure(context);
        job.onCancellation(context);
        job.onBroken(context);
        job.onFixed(context);

        assertEquals(List.of("start", "execute:hooked", "complete", "failure",
                             "cancellation", "broken", "fixed"), calls);
    }

    @Test
    void jobWithoutActionDoesNothing() throws Exception {
        Job job = JobBuilder.newJob("empty").build();

        assertDoesNotThrow(() -> job.execute(contextFor("empty")));
        assertDoesNotThrow(() -> job.onStart(contextFor("empty")));
    }

    @Test
    void buildRequiresName() {
        assertThrows(NullPointerException.class, () -> JobBuilder.newJob(null).build());
    }

    @Test
    void contextReportsCancellation() {
        JobInvocation invocation = mock(JobInvocation.class);
        when(invocation.getName()).thenReturn("cancelled");
        when(invocation.isCancelled()).thenReturn(true);
        JobContext context = new JobContext(invocation);

        assertTrue(context.isCancelled());
        assertThrows(com.horae.scheduler.JobCancelledException.class, context::throwIfCancelled);
    }
}
