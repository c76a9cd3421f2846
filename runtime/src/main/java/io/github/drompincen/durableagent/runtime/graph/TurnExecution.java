package io.github.drompincen.durableagent.runtime.graph;

/**
 * Result of one pass through the graph. {@code nextNode} is null when the turn reached the end
 * of the graph, and names the interrupt-before node otherwise.
 */
public record TurnExecution(WorkflowState state, String nextNode, Outcome outcome, int steps,
                            long checkpointVersion) {

    public enum Outcome { COMPLETED, INTERRUPTED }

    public boolean interrupted() {
        return outcome == Outcome.INTERRUPTED;
    }
}
