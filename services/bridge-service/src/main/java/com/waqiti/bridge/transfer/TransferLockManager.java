package com.waqiti.bridge.transfer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-transfer mutual exclusion. Unrelated transfers never share a lock.
 *
 * <p>Locks are reference counted and dropped once no thread holds or waits for them.</p>
 */
@Slf4j
@Component
public class TransferLockManager {

    private final Map<String, LockEntry> locks = new ConcurrentHashMap<>();

    public <T> T executeWithLock(String transferId, Supplier<T> operation) {
        LockEntry entry = locks.compute(transferId, (id, current) -> {
            LockEntry target = current != null ? current : new LockEntry();
            target.users++;
            return target;
        });
        entry.lock.lock();
        try {
            log.trace("Acquired transfer lock: {}", transferId);
            return operation.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(transferId, (id, current) -> --current.users == 0 ? null : current);
        }
    }

    public void executeWithLock(String transferId, Runnable operation) {
        executeWithLock(transferId, () -> {
            operation.run();
            return null;
        });
    }

    int activeLockCount() {
        return locks.size();
    }

    private static final class LockEntry {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }
}
