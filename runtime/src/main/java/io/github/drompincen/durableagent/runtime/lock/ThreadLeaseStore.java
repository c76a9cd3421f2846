package io.github.drompincen.durableagent.runtime.lock;

/**
 * Lease on a thread shared between processes. {@link ThreadLockService} takes one after its
 * in-process lock, so two instances behind a load balancer never run the same thread at once.
 */
public interface ThreadLeaseStore {

    /** @return false when another owner holds an unexpired lease on the thread */
    boolean tryAcquire(String threadId, String owner);

    /** Releases the lease if {@code owner} still holds it. */
    void release(String threadId, String owner);

    void setup();

    /** For a single process with an in-memory checkpoint store; every lease is granted. */
    static ThreadLeaseStore none() {
        return new ThreadLeaseStore() {
            @Override
            public boolean tryAcquire(String threadId, String owner) {
                return true;
            }

            @Override
            public void release(String threadId, String owner) {
            }

            @Override
            public void setup() {
            }
        };
    }
}
