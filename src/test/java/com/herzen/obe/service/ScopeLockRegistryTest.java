package com.herzen.obe.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ScopeLockRegistryTest {
    private final ScopeLockRegistry registry = new ScopeLockRegistry();

    @Test
    void serializesRunsOfTheSameScope() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Integer>> jobs = IntStream.range(0, 8)
                    .<Callable<Integer>>mapToObj(i -> () -> registry.runExclusive("course:CS101@2024-S1", () -> {
                        maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                        try {
                            Thread.sleep(5);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        active.decrementAndGet();
                        return i;
                    }))
                    .toList();
            for (Future<Integer> f : pool.invokeAll(jobs)) {
                assertNotNull(f.get());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, maxActive.get());
        assertFalse(registry.isRunning("course:CS101@2024-S1"));
        assertEquals(0, registry.trackedScopes());
    }

    @Test
    void dropsScopeLockWhenLastRunLeaves() throws Exception {
        String scopeKey = "course:CS102@2024-S1";
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<String> waiting = registry.runExclusive(scopeKey, () -> {
                Future<String> queued = pool.submit(() -> registry.runExclusive(scopeKey, () -> "second"));
                long deadline = System.currentTimeMillis() + 5000;
                while (registry.queueLength(scopeKey) == 0 && System.currentTimeMillis() < deadline) {
                    Thread.onSpinWait();
                }
                assertEquals(1, registry.queueLength(scopeKey));
                assertEquals(1, registry.trackedScopes());
                return queued;
            });
            assertEquals("second", waiting.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(0, registry.queueLength(scopeKey));
        assertEquals(0, registry.trackedScopes());
    }

    @Test
    void reportsScopeAsRunningInsideAction() {
        boolean running = registry.runExclusive("program:BTECH@2024-S1",
                () -> registry.isRunning("program:BTECH@2024-S1"));

        assertTrue(running);
        assertFalse(registry.isRunning("program:BTECH@2024-S1"));
        assertFalse(registry.isRunning("course:other@2024-S1"));
    }
}
