package io.github.drompincen.durableagent.runtime.lock;

public class ThreadBusyException extends RuntimeException {

    public ThreadBusyException(String threadId, long waitedMs) {
        super("Thread " + threadId + " is busy; gave up after " + waitedMs + " ms");
    }
}
