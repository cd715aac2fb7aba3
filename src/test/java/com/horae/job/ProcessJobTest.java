package com.horae.job;

import com.horae.scheduler.JobInvocation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessJobTest {

    private static JobContext context() {
        JobInvocation invocation = mock(JobInvocation.class);
        when(invocation.getName()).thenReturn("process");
        when(invocation.getId()).thenReturn("abcdefghijklmno");
        return new JobContext(invocation);
    }

    @Test
    void succeedsOnZeroExitCode() {
        ProcessJob job = new ProcessJob("ok", null, List.of("sh", "-c", "echo hello"), Duration.ZERO, false);

        assertDoesNotThrow(() -> job.execute(context()));
    }

    @Test
    void failsOnNonZeroExitCode() {
        ProcessJob job = new ProcessJob("ko", null, List.of("sh", "-c", "exit 3"), Duration.ZERO, false);

        IOException e = assertThrows(IOException.class, () -> job.execute(context()));
        assertTrue(e.getMessage().contains("exited with code 3"));
    }

    @Test
    void interruptDestroysTheProcess() throws Exception {
        ProcessJob job = new ProcessJob("slow", null, List.of("sleep", "30"), Duration.ZERO, false);
        CompletableFuture<Throwable> outcome = new CompletableFuture<>();
        Thread runner = new Thread(() -> {
            try {
                job.execute(context());
                outcome.complete(null);
            } catch (Exception e) {
                outcome.complete(e);
            }
        });
        runner.start();
        Thread.sleep(200);

        runner.interrupt();

        Throwable error = outcome.get(5, TimeUnit.SECONDS);
        assertInstanceOf(InterruptedException.class, error);
    }

    @Test
    void rejectsEmptyCommand() {
        assertThrows(IllegalArgumentException.class,
                     () -> new ProcessJob("empty", null, List.of(), Duration.ZERO, false));
    }

    @Test
    void exposesCapabilities() {
        ProcessJob job = new ProcessJob("caps", null, List.of("true"), Duration.ofSeconds(5), true);

        assertEquals(Duration.ofSeconds(5), job.getTimeout());
        assertTrue(job.isSerial());
        assertEquals(List.of("true"), job.getCommand());
    }
}
