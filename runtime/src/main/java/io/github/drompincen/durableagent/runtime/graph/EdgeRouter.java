package io.github.drompincen.durableagent.runtime.graph;

/** Picks the outcome of a conditional edge. The outcome is looked up in the edge's path map. */
@FunctionalInterface
public interface EdgeRouter {

    String route(WorkflowState state);
}
