package me.golemcore.toolexec.infrastructure.config;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionConfigurationTest {

    @Test
    void shouldCreateDaemonWorkerThreadsWithCorrectName() throws Exception {
        ExecutionConfiguration config = new ExecutionConfiguration(new ToolExecProperties());
        ExecutorService executor = config.toolExecWorkers();
        assertNotNull(executor);

        AtomicReference<String> threadName = new AtomicReference<>();
        AtomicReference<Boolean> isDaemon = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);

        executor.submit(() -> {
            threadName.set(Thread.currentThread().getName());
            isDaemon.set(Thread.currentThread().isDaemon());
            latch.countDown();
        });

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertTrue(threadName.get().startsWith("toolexec-worker-"));
        assertTrue(isDaemon.get());

        config.shutdown();
    }

    @Test
    void shouldRunToolCallsOutsideTheWorkerPool() throws Exception {
        ToolExecProperties properties = new ToolExecProperties();
        properties.getExecution().setWorkerThreads(1);
        ExecutionConfiguration config = new ExecutionConfiguration(properties);
        ExecutorService toolCalls = config.toolExecToolCalls();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch blocked = new CountDownLatch(1);
        CountDownLatch secondRan = new CountDownLatch(1);
        AtomicReference<String> threadName = new AtomicReference<>();

        toolCalls.submit(() -> {
            threadName.set(Thread.currentThread().getName());
            started.countDown();
            blocked.await(5, TimeUnit.SECONDS);
            return null;
        });
        toolCalls.submit(secondRan::countDown);
        CountDownLatch workerRan = new CountDownLatch(1);
        config.toolExecWorkers().submit(workerRan::countDown);

        assertTrue(started.await(2, TimeUnit.SECONDS));
        assertTrue(secondRan.await(2, TimeUnit.SECONDS));
        assertTrue(workerRan.await(2, TimeUnit.SECONDS));
        assertTrue(threadName.get().startsWith("toolexec-tool-"));

        blocked.countDown();
        config.shutdown();
    }

    @Test
    void shouldReturnSameExecutorsOnRepeatedCalls() {
        ExecutionConfiguration config = new ExecutionConfiguration(new ToolExecProperties());

        assertSame(config.toolExecWorkers(), config.toolExecWorkers());
        assertSame(config.toolExecScheduler(), config.toolExecScheduler());
        assertSame(config.toolExecToolCalls(), config.toolExecToolCalls());

        config.shutdown();
    }

    @Test
    void shouldShutdownCleanly() {
        ExecutionConfiguration config = new ExecutionConfiguration(new ToolExecProperties());
        ExecutorService workers = config.toolExecWorkers();
        ExecutorService toolCalls = config.toolExecToolCalls();
        ScheduledExecutorService scheduler = config.toolExecScheduler();

        config.shutdown();

        assertTrue(workers.isShutdown());
        assertTrue(toolCalls.isShutdown());
        assertTrue(scheduler.isShutdown());
    }
}
