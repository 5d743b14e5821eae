package com.herzen.obe.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One writer per scope: re-runs of the same scope queue behind each other, distinct scopes run
 * in parallel. A scope's lock is dropped once no run holds or awaits it.
 */
@Component
public class ScopeLockRegistry {
    private final ConcurrentMap<String, ScopeLock> locks = new ConcurrentHashMap<>();

    public <T> T runExclusive(String scopeKey, Supplier<T> action) {
        ScopeLock scopeLock = locks.compute(scopeKey, (k, existing) -> {
            ScopeLock l = existing == null ? new ScopeLock() : existing;
            l.users++;
            return l;
        });
        scopeLock.lock.lock();
        try {
            return action.get();
        } finally {
            scopeLock.lock.unlock();
            locks.computeIfPresent(scopeKey, (k, l) -> --l.users == 0 ? null : l);
        }
    }

    public boolean isRunning(String scopeKey) {
        ScopeLock scopeLock = locks.get(scopeKey);
        return scopeLock != null && scopeLock.lock.isLocked();
    }

    /** Runs waiting for the scope, not counting the one holding it. */
    public int queueLength(String scopeKey) {
        ScopeLock scopeLock = locks.get(scopeKey);
        return scopeLock == null ? 0 : scopeLock.lock.getQueueLength();
    }

    int trackedScopes() {
        return locks.size();
    }

    // users is only read and written inside ConcurrentMap.compute for the scope's key
    private static final class ScopeLock {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
