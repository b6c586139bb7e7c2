package com.purchasingpower.contextgraph.knowledge;

/**
 * Relationship traversal direction.
 */
public enum RelationshipDirection {
    INCOMING,
    OUTGOING,
    BOTH;

    public boolean includesOutgoing() {
        return this == OUTGOING || this == BOTH;
    }

    public boolean includesIncoming() {
        return this == INCOMING || this == BOTH;
    }
}
