package io.github.drompincen.durableagent.runtime.graph;

/** Malformed graph: raised when a definition is built, or when a router returns an unmapped outcome. */
public class GraphConfigurationException extends RuntimeException {

    public GraphConfigurationException(String message) {
        super(message);
    }
}
