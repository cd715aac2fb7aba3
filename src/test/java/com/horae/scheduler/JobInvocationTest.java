package com.horae.scheduler;

import com.horae.job.JobBuilder;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JobInvocationTest {

    private final JobMeta meta = new JobMeta(JobBuilder.newJob("job").build());

    @Test
    void outcomeIsRecordedOnce() {
        JobInvocation invocation = new JobInvocation("abc", meta, Instant.now(), null);
        JobCancelledException cancelled = new JobCancelledException("job");

        assertTrue(invocation.complete(cancelled, Duration.ofMillis(10)));
        assertFalse(invocation.complete(null, Duration.ofMillis(20)));

        assertSame(cancelled, invocation.getError());
        assertEquals(Duration.ofMillis(10), invocation.getElapsed());
        assertTrue(invocation.isCompleted());
    }

    @Test
    void cancelDoesNotRecordAnOutcome() {
        JobInvocation invocation = new JobInvocation("abc", meta, Instant.now(), null);

        invocation.cancel();
        invocation.cancel();

        assertTrue(invocation.isCancelled());
        assertFalse(invocation.isCompleted());
        assertNull(invocation.getError());
    }

    @Test
    void copyIsDetached() {
        JobInvocation invocation = new JobInvocation("abc", meta, Instant.now(), null);
        JobInvocation copy = invocation.copy();

        invocation.cancel();
        invocation.complete(null, Duration.ofMillis(5));

        assertNull(copy.getJobMeta());
        assertFalse(copy.isCancelled());
        assertFalse(copy.isCompleted());
        assertEquals("abc", copy.getId());
    }
}
