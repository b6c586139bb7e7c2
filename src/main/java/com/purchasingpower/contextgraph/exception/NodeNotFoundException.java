package com.purchasingpower.contextgraph.exception;

import lombok.Getter;

/**
 * Thrown when an operation references a context node that is not in the graph.
 */
@Getter
public class NodeNotFoundException extends RuntimeException {

    private final String nodeId;

    public NodeNotFoundException(String nodeId) {
        super("Context node not found: " + nodeId);
        this.nodeId = nodeId;
    }

    public NodeNotFoundException(String nodeId, String role) {
        super(role + " node not found: " + nodeId);
        this.nodeId = nodeId;
    }
}
