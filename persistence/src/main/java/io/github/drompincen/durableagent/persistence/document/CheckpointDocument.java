package io.github.drompincen.durableagent.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Latest checkpoint of one thread. The id is {@code namespace:threadId}, so a save replaces the
 * previous checkpoint instead of appending a new record. The state is the serialized checkpoint
 * JSON, stored as a string to keep Mongo type metadata out of it.
 */
@Document(collection = "checkpoints")
@CompoundIndex(name = "namespace_thread", def = "{'namespace': 1, 'threadId': 1}", unique = true)
public class CheckpointDocument {

    @Id
    private String checkpointId;
    private String namespace;
    private String threadId;
    private Instant savedAt;
    private String state;

    public CheckpointDocument() {}

    public static String idFor(String namespace, String threadId) {
        return namespace + ":" + threadId;
    }

    public String getCheckpointId() { return checkpointId; }
    public void setCheckpointId(String checkpointId) { this.checkpointId = checkpointId; }

    public String getNamespace() { return namespace; }
    public void setNamespace(String namespace) { this.namespace = namespace; }

    public String getThreadId() { return threadId; }
    public void setThreadId(String threadId) { this.threadId = threadId; }

    public Instant getSavedAt() { return savedAt; }
    public void setSavedAt(Instant savedAt) { this.savedAt = savedAt; }

    public String getState() { return state; }
    public void setState(String state) { this.state = state; }
}
