package io.github.drompincen.durableagent.persistence.repository;

import io.github.drompincen.durableagent.persistence.document.LockDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;

public interface LockRepository extends MongoRepository<LockDocument, String> {
    long deleteByLockIdAndExpiresAtBefore(String lockId, Instant now);
    long deleteByLockIdAndOwner(String lockId, String owner);
}
