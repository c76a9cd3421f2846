package io.github.drompincen.durableagent.runtime.graph;

public class GraphExecutionException extends RuntimeException {

    private final String threadId;

    public GraphExecutionException(String threadId, String message) {
        super(message);
        this.threadId = threadId;
    }

    public String getThreadId() {
        return threadId;
    }
}
