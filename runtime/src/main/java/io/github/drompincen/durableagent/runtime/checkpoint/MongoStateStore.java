package io.github.drompincen.durableagent.runtime.checkpoint;

import io.github.drompincen.durableagent.persistence.document.CheckpointDocument;
import io.github.drompincen.durableagent.persistence.repository.CheckpointRepository;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.CompoundIndexDefinition;

import java.time.Clock;
import java.util.Optional;

/**
 * Checkpoints in the {@code checkpoints} collection. The document id is {@code namespace:threadId},
 * so each save replaces the thread's previous checkpoint.
 */
public class MongoStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(MongoStateStore.class);

    private final CheckpointRepository checkpointRepository;
    private final MongoTemplate mongoTemplate;
    private final String namespace;
    private final Clock clock;

    public MongoStateStore(CheckpointRepository checkpointRepository, MongoTemplate mongoTemplate, String namespace,
                           Clock clock) {
        this.checkpointRepository = checkpointRepository;
        this.mongoTemplate = mongoTemplate;
        this.namespace = namespace;
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String threadId) {
        try {
            return checkpointRepository.findById(CheckpointDocument.idFor(namespace, threadId))
                    .map(CheckpointDocument::getState);
        } catch (RuntimeException e) {
            throw new StateStoreException("Failed to read checkpoint for thread " + threadId, e);
        }
    }

    @Override
    public void put(String threadId, String json) {
        CheckpointDocument doc = new CheckpointDocument();
        doc.setCheckpointId(CheckpointDocument.idFor(namespace, threadId));
        doc.setNamespace(namespace);
        doc.setThreadId(threadId);
        doc.setSavedAt(clock.instant());
        doc.setState(json);
        try {
            checkpointRepository.save(doc);
        } catch (RuntimeException e) {
            throw new StateStoreException("Failed to write checkpoint for thread " + threadId, e);
        }
        log.debug("Stored checkpoint {}", doc.getCheckpointId());
    }

    @Override
    public void delete(String threadId) {
        try {
            checkpointRepository.deleteById(CheckpointDocument.idFor(namespace, threadId));
        } catch (RuntimeException e) {
            throw new StateStoreException("Failed to delete checkpoint for thread " + threadId, e);
        }
        log.debug("Deleted checkpoint of thread {}", threadId);
    }

    @Override
    public void setup() {
        try {
            mongoTemplate.indexOps(CheckpointDocument.class).ensureIndex(
                    new CompoundIndexDefinition(new Document("namespace", 1).append("threadId", 1))
                            .named("namespace_thread")
                            .unique());
        } catch (RuntimeException e) {
            throw new StateStoreException("Failed to set up checkpoint collection", e);
        }
        log.info("Checkpoint store ready (namespace={})", namespace);
    }

    @Override
    public boolean isDurable() {
        return true;
    }

    public String getNamespace() {
        return namespace;
    }
}
