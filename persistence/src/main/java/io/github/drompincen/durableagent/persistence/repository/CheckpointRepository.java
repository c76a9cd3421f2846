package io.github.drompincen.durableagent.persistence.repository;

import io.github.drompincen.durableagent.persistence.document.CheckpointDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface CheckpointRepository extends MongoRepository<CheckpointDocument, String> {
    Optional<CheckpointDocument> findByNamespaceAndThreadId(String namespace, String threadId);
}
