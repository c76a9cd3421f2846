package io.github.drompincen.durableagent.runtime.lock;

import io.github.drompincen.durableagent.persistence.document.LockDocument;
import io.github.drompincen.durableagent.persistence.repository.LockRepository;
import io.github.drompincen.durableagent.runtime.checkpoint.StateStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Leases in the {@code thread_locks} collection. Acquiring inserts a document keyed by the thread,
 * so the primary key decides between racing instances. A lease left behind by a crashed instance
 * is taken over once it expires.
 */
public class MongoThreadLeaseStore implements ThreadLeaseStore {

    private static final Logger log = LoggerFactory.getLogger(MongoThreadLeaseStore.class);

    private final LockRepository lockRepository;
    private final MongoTemplate mongoTemplate;
    private final String namespace;
    private final Clock clock;
    private final Duration ttl;

    public MongoThreadLeaseStore(LockRepository lockRepository, MongoTemplate mongoTemplate, String namespace,
                                 Clock clock, Duration ttl) {
        this.lockRepository = lockRepository;
        this.mongoTemplate = mongoTemplate;
        this.namespace = namespace;
        this.clock = clock;
        this.ttl = ttl;
    }

    @Override
    public boolean tryAcquire(String threadId, String owner) {
        String lockId = LockDocument.idFor(namespace, threadId);
        Instant now = clock.instant();
        try {
            if (lockRepository.deleteByLockIdAndExpiresAtBefore(lockId, now) > 0) {
                log.info("Reclaimed expired lease on thread {}", threadId);
            }
            LockDocument lock = new LockDocument();
            lock.setLockId(lockId);
            lock.setThreadId(threadId);
            lock.setOwner(owner);
            lock.setAcquiredAt(now);
            lock.setExpiresAt(now.plus(ttl));
            lockRepository.insert(lock);
            log.debug("Lease on thread {} acquired by {}", threadId, owner);
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("Lease on thread {} is held elsewhere", threadId);
            return false;
        } catch (RuntimeException e) {
            throw new StateStoreException("Failed to acquire lease on thread " + threadId, e);
        }
    }

    @Override
    public void release(String threadId, String owner) {
        long deleted;
        try {
            deleted = lockRepository.deleteByLockIdAndOwner(LockDocument.idFor(namespace, threadId), owner);
        } catch (RuntimeException e) {
            throw new StateStoreException("Failed to release lease on thread " + threadId, e);
        }
        if (deleted == 0) {
            log.warn("Lease on thread {} had already expired before release", threadId);
        }
    }

    @Override
    public void setup() {
        try {
            mongoTemplate.indexOps(LockDocument.class).ensureIndex(
                    new Index().on("expiresAt", Sort.Direction.ASC).named("expiresAt").expire(0, TimeUnit.SECONDS));
        } catch (RuntimeException e) {
            throw new StateStoreException("Failed to set up lease collection", e);
        }
        log.info("Thread leases ready (namespace={}, ttl={}s)", namespace, ttl.toSeconds());
    }
}
