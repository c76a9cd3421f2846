package io.github.drompincen.durableagent.runtime.graph;

/** Decides the {@code resolved} flag of a turn that reached {@link GraphDefinition#END}. */
@FunctionalInterface
public interface ResolutionPolicy {

    ResolutionPolicy ALWAYS_RESOLVED = state -> true;

    boolean isResolved(WorkflowState state);
}
