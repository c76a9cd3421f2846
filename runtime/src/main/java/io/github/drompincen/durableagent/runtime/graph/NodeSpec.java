package io.github.drompincen.durableagent.runtime.graph;

import java.util.Set;

public record NodeSpec(String name, NodeFunction function, Set<StateField> ownedFields) {

    public NodeSpec {
        ownedFields = Set.copyOf(ownedFields);
    }

    public boolean owns(StateField field) {
        return ownedFields.contains(field);
    }
}
