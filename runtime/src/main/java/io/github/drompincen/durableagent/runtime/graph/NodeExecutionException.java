package io.github.drompincen.durableagent.runtime.graph;

/**
 * A node threw, or returned a state that breaks the node boundary contract. Nothing the node
 * produced has been checkpointed when this is raised.
 */
public class NodeExecutionException extends RuntimeException {

    private final String nodeName;

    public NodeExecutionException(String nodeName, String message) {
        super("Node '" + nodeName + "': " + message);
        this.nodeName = nodeName;
    }

    public NodeExecutionException(String nodeName, Throwable cause) {
        super("Node '" + nodeName + "' failed: " + cause.getMessage(), cause);
        this.nodeName = nodeName;
    }

    public String getNodeName() {
        return nodeName;
    }
}
