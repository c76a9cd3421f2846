package io.github.drompincen.durableagent.runtime.index;

import io.github.drompincen.durableagent.runtime.graph.WorkflowState;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Copies finished turns into the {@link SearchIndex} on a background worker.
 * <p>
 * {@link #publish} never blocks: it stores the newest projection of the thread and queues the
 * thread id. If a thread is published again before the worker reaches it, only the newest
 * projection is written. Failed upserts are retried with exponential backoff and then dropped.
 */
@Component
public class Indexer {

    private static final Logger log = LoggerFactory.getLogger(Indexer.class);
    private static final long POLL_MS = 200;

    private final SearchIndex searchIndex;
    private final int maxAttempts;
    private final long initialBackoffMs;
    private final Map<String, SearchDocument> latest = new ConcurrentHashMap<>();
    private final BlockingQueue<String> pending;
    private final Object idleMonitor = new Object();
    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "search-indexer");
        t.setDaemon(true);
        return t;
    });

    private final AtomicLong indexed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private int outstanding;
    private volatile boolean running = true;

    public Indexer(SearchIndex searchIndex,
                   @Value("${durableagent.indexer.max-attempts:3}") int maxAttempts,
                   @Value("${durableagent.indexer.initial-backoff-ms:200}") long initialBackoffMs,
                   @Value("${durableagent.indexer.queue-capacity:1000}") int queueCapacity) {
        this.searchIndex = searchIndex;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = initialBackoffMs;
        this.pending = new LinkedBlockingQueue<>(queueCapacity);
        worker.submit(this::drain);
    }

    /** Schedules {@code state} for indexing and returns immediately. */
    public void publish(WorkflowState state) {
        if (!running || !searchIndex.isAvailable()) {
            return;
        }
        String threadId = state.getThreadId();
        SearchDocument doc = SearchDocument.from(state);
        synchronized (idleMonitor) {
            if (latest.put(threadId, doc) != null) {
                return;
            }
            if (!pending.offer(threadId)) {
                latest.remove(threadId);
                dropped.incrementAndGet();
                log.warn("Index queue full, dropping update for thread {}", threadId);
                return;
            }
            outstanding++;
        }
    }

    /** Waits until every queued update has been written or given up on. */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (outstanding > 0) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    return false;
                }
                idleMonitor.wait(remainingMs);
            }
            return true;
        }
    }

    @PreDestroy
    public void shutdown() {
        running = false;
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (!pending.isEmpty()) {
            log.warn("Indexer stopped with {} update(s) not written", pending.size());
        }
    }

    public long indexedCount() { return indexed.get(); }
    public long failedCount() { return failed.get(); }
    public long droppedCount() { return dropped.get(); }

    private void drain() {
        while (running || !pending.isEmpty()) {
            String threadId;
            try {
                threadId = pending.poll(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (threadId == null) {
                continue;
            }
            SearchDocument doc;
            synchronized (idleMonitor) {
                doc = latest.remove(threadId);
            }
            try {
                if (doc != null) {
                    write(doc);
                }
            } finally {
                synchronized (idleMonitor) {
                    outstanding--;
                    idleMonitor.notifyAll();
                }
            }
        }
    }

    private void write(SearchDocument doc) {
        long backoff = initialBackoffMs;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                searchIndex.upsert(doc);
                indexed.incrementAndGet();
                return;
            } catch (RuntimeException e) {
                if (attempt == maxAttempts) {
                    failed.incrementAndGet();
                    log.warn("Giving up indexing thread {} after {} attempt(s): {}",
                            doc.threadId(), attempt, e.getMessage());
                    return;
                }
                log.debug("Indexing thread {} failed (attempt {}), retrying in {} ms",
                        doc.threadId(), attempt, backoff);
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    failed.incrementAndGet();
                    return;
                }
                backoff *= 2;
            }
        }
    }
}
