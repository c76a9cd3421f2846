package io.github.drompincen.durableagent.runtime.checkpoint;

import java.util.Optional;

/**
 * Primary key-value store for serialized checkpoints, one value per thread.
 * A {@link #put} returns only once the value is acknowledged by the store.
 */
public interface StateStore {

    Optional<String> get(String threadId);

    void put(String threadId, String json);

    /** Removes the thread's value. Deleting a missing thread is a no-op. */
    void delete(String threadId);

    /** Creates collections and indexes. Safe to call more than once. */
    void setup();

    boolean isDurable();
}
