package io.github.drompincen.durableagent.runtime.checkpoint;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Process-local store. Checkpoints are lost when the JVM exits. */
public class InMemoryStateStore implements StateStore {

    private final Map<String, String> values = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String threadId) {
        return Optional.ofNullable(values.get(threadId));
    }

    @Override
    public void put(String threadId, String json) {
        values.put(threadId, json);
    }

    @Override
    public void delete(String threadId) {
        values.remove(threadId);
    }

    @Override
    public void setup() {
    }

    @Override
    public boolean isDurable() {
        return false;
    }

    public int size() {
        return values.size();
    }
}
