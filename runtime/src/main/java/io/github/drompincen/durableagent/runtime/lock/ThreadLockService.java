package io.github.drompincen.durableagent.runtime.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes turns of the same thread. Inside this process waiters queue in arrival order on a
 * per-thread lock; the holder then takes a lease from the {@link ThreadLeaseStore} so that other
 * instances sharing the checkpoint store are kept out as well. A waiter that gets neither within
 * the configured timeout fails with {@link ThreadBusyException}. Entries are dropped once no
 * holder or waiter is left.
 */
@Service
public class ThreadLockService {

    private static final Logger log = LoggerFactory.getLogger(ThreadLockService.class);

    private static final long LEASE_POLL_MS = 50;

    private final Map<String, Entry> locks = new ConcurrentHashMap<>();
    private final ThreadLeaseStore leaseStore;
    private final long waitTimeoutMs;

    public ThreadLockService(long waitTimeoutMs) {
        this(ThreadLeaseStore.none(), waitTimeoutMs);
    }

    @Autowired
    public ThreadLockService(ThreadLeaseStore leaseStore,
                             @Value("${durableagent.lock.wait-timeout-ms:60000}") long waitTimeoutMs) {
        this.leaseStore = leaseStore;
        this.waitTimeoutMs = waitTimeoutMs;
    }

    public Lease acquire(String threadId) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(waitTimeoutMs);
        Entry entry = locks.compute(threadId, (id, existing) -> {
            Entry e = existing != null ? existing : new Entry();
            e.users++;
            return e;
        });
        boolean acquired;
        try {
            acquired = entry.lock.tryLock(waitTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            unreference(threadId);
            throw new ThreadBusyException(threadId, waitTimeoutMs);
        }
        if (!acquired) {
            unreference(threadId);
            log.warn("Timed out after {} ms waiting for thread {}", waitTimeoutMs, threadId);
            throw new ThreadBusyException(threadId, waitTimeoutMs);
        }
        String owner = UUID.randomUUID().toString();
        try {
            awaitLease(threadId, owner, deadline);
        } catch (RuntimeException e) {
            entry.lock.unlock();
            unreference(threadId);
            throw e;
        }
        return new Lease(threadId, owner, entry);
    }

    private void awaitLease(String threadId, String owner, long deadline) {
        while (!leaseStore.tryAcquire(threadId, owner)) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.warn("Timed out after {} ms waiting for another instance to release thread {}",
                        waitTimeoutMs, threadId);
                throw new ThreadBusyException(threadId, waitTimeoutMs);
            }
            try {
                TimeUnit.NANOSECONDS.sleep(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(LEASE_POLL_MS)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ThreadBusyException(threadId, waitTimeoutMs);
            }
        }
    }

    public boolean isLocked(String threadId) {
        Entry entry = locks.get(threadId);
        return entry != null && entry.lock.isLocked();
    }

    int trackedThreads() {
        return locks.size();
    }

    private void unreference(String threadId) {
        locks.computeIfPresent(threadId, (id, e) -> --e.users == 0 ? null : e);
    }

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock(true);
        int users;
    }

    /** Held for the duration of one turn. Closing it more than once has no effect. */
    public final class Lease implements AutoCloseable {
        private final String threadId;
        private final String owner;
        private final Entry entry;
        private boolean released;

        private Lease(String threadId, String owner, Entry entry) {
            this.threadId = threadId;
            this.owner = owner;
            this.entry = entry;
        }

        public String threadId() {
            return threadId;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            try {
                leaseStore.release(threadId, owner);
            } catch (RuntimeException e) {
                log.warn("Could not release lease on thread {}, it is reclaimed when it expires", threadId, e);
            } finally {
                entry.lock.unlock();
                unreference(threadId);
            }
        }
    }
}
