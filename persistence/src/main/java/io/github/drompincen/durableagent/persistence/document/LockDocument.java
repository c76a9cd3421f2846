package io.github.drompincen.durableagent.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Cross-process lease on one thread. The id is {@code namespace:threadId}, so a second insert for
 * a held thread fails on the primary key. Mongo removes the document once {@code expiresAt} passes.
 */
@Document(collection = "thread_locks")
public class LockDocument {

    @Id
    private String lockId;
    private String threadId;
    private String owner;
    private Instant acquiredAt;

    @Indexed(expireAfterSeconds = 0)
    private Instant expiresAt;

    public LockDocument() {}

    public static String idFor(String namespace, String threadId) {
        return namespace + ":" + threadId;
    }

    public String getLockId() { return lockId; }
    public void setLockId(String lockId) { this.lockId = lockId; }

    public String getThreadId() { return threadId; }
    public void setThreadId(String threadId) { this.threadId = threadId; }

    public String getOwner() { return owner; }
    public void setOwner(String owner) { this.owner = owner; }

    public Instant getAcquiredAt() { return acquiredAt; }
    public void setAcquiredAt(Instant acquiredAt) { this.acquiredAt = acquiredAt; }

    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
}
