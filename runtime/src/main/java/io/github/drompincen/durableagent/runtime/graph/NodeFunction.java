package io.github.drompincen.durableagent.runtime.graph;

/**
 * One unit of step content. Receives the current state and returns the next one; it may only
 * change the fields its node owns.
 */
@FunctionalInterface
public interface NodeFunction {

    WorkflowState apply(WorkflowState state) throws Exception;
}
