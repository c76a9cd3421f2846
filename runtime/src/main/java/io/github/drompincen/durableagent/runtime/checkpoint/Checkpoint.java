package io.github.drompincen.durableagent.runtime.checkpoint;

import io.github.drompincen.durableagent.runtime.graph.WorkflowState;

import java.time.Instant;

public record Checkpoint(String threadId, long version, WorkflowState state, String nextNode, Instant savedAt) {

    public boolean hasNextNode() {
        return nextNode != null;
    }
}
