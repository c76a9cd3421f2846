package io.github.drompincen.durableagent.runtime.checkpoint;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.drompincen.durableagent.protocol.api.CheckpointDto;
import io.github.drompincen.durableagent.runtime.graph.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Loads and saves the latest checkpoint of a thread. Each save is a full-state overwrite
 * serialized as JSON; the version of a thread's checkpoint grows by one per save.
 */
@Component
public class CheckpointManager {

    private static final Logger log = LoggerFactory.getLogger(CheckpointManager.class);

    private final StateStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CheckpointManager(StateStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.objectMapper = checkpointMapper();
    }

    /** Field-based mapper so the stored form does not depend on which accessors a state exposes. */
    static ObjectMapper checkpointMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE);
        mapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
        mapper.setVisibility(PropertyAccessor.CREATOR, JsonAutoDetect.Visibility.ANY);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public void setup() {
        store.setup();
    }

    public boolean isDurable() {
        return store.isDurable();
    }

    public Optional<Checkpoint> load(String threadId) {
        return store.get(threadId).map(json -> decode(threadId, json));
    }

    /**
     * Persists {@code state} as the thread's latest checkpoint. Returns only after the store
     * acknowledged the write; a failed write raises {@link StateStoreException}.
     */
    public Checkpoint save(String threadId, WorkflowState state, String nextNode) {
        if (!threadId.equals(state.getThreadId())) {
            throw new IllegalArgumentException("State belongs to thread " + state.getThreadId()
                    + ", not " + threadId);
        }
        long version = currentVersion(threadId) + 1;
        Instant savedAt = clock.instant();
        StoredCheckpoint stored = new StoredCheckpoint(threadId, version, nextNode, savedAt, state);
        String json;
        try {
            json = objectMapper.writeValueAsString(stored);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Failed to serialize checkpoint for thread " + threadId, e);
        }
        store.put(threadId, json);
        log.debug("Saved checkpoint v{} for thread {} (next={})", version, threadId, nextNode);
        return new Checkpoint(threadId, version, state, nextNode, savedAt);
    }

    /**
     * Puts the thread back to {@code prior}: a thread that had no checkpoint loses whatever was
     * saved since, otherwise the prior state and next node are saved again under a new version.
     * Nothing is written when the stored checkpoint already is {@code prior}.
     */
    public void restore(String threadId, Optional<Checkpoint> prior) {
        Optional<Checkpoint> current = load(threadId);
        if (prior.isEmpty()) {
            if (current.isPresent()) {
                store.delete(threadId);
                log.debug("Dropped checkpoint v{} of thread {}", current.get().version(), threadId);
            }
            return;
        }
        Checkpoint previous = prior.get();
        if (current.isPresent() && current.get().version() == previous.version()) {
            return;
        }
        save(threadId, previous.state(), previous.nextNode());
        log.debug("Restored thread {} to its pre-turn state (stored version was {})", threadId,
                current.map(Checkpoint::version).orElse(0L));
    }

    public Optional<CheckpointDto> describe(String threadId) {
        return load(threadId).map(cp -> new CheckpointDto(cp.threadId(), cp.version(), cp.nextNode(),
                cp.savedAt(), store.isDurable(), stateTree(cp.state())));
    }

    public JsonNode stateTree(WorkflowState state) {
        return objectMapper.valueToTree(state);
    }

    private long currentVersion(String threadId) {
        return store.get(threadId).map(json -> {
            try {
                return objectMapper.readTree(json).path("version").asLong(0);
            } catch (JsonProcessingException e) {
                throw new StateStoreException("Corrupt checkpoint for thread " + threadId, e);
            }
        }).orElse(0L);
    }

    private Checkpoint decode(String threadId, String json) {
        try {
            StoredCheckpoint stored = objectMapper.readValue(json, StoredCheckpoint.class);
            if (stored.state == null) {
                throw new StateStoreException("Checkpoint for thread " + threadId + " has no state");
            }
            if (stored.threadId != null && !stored.threadId.equals(threadId)) {
                throw new StateStoreException("Checkpoint stored under " + threadId
                        + " belongs to thread " + stored.threadId);
            }
            return new Checkpoint(threadId, stored.version, stored.state, stored.nextNode, stored.savedAt);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Corrupt checkpoint for thread " + threadId, e);
        }
    }

    private static final class StoredCheckpoint {
        private String threadId;
        private long version;
        private String nextNode;
        private Instant savedAt;
        private WorkflowState state;

        private StoredCheckpoint() {}

        StoredCheckpoint(String threadId, long version, String nextNode, Instant savedAt, WorkflowState state) {
            this.threadId = threadId;
            this.version = version;
            this.nextNode = nextNode;
            this.savedAt = savedAt;
            this.state = state;
        }
    }
}
