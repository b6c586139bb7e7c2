package com.purchasingpower.contextgraph.knowledge;

import com.purchasingpower.contextgraph.model.graph.ContextEdge;
import com.purchasingpower.contextgraph.model.graph.ContextNode;

/**
 * Receives graph mutations after they have been applied.
 *
 * <p>Callbacks run on the mutating thread once the write lock is released, so a
 * listener may read the graph but must not block for long.
 */
public interface GraphMutationListener {

    default void onNodeUpserted(ContextNode node) {
    }

    default void onNodeRemoved(String nodeId) {
    }

    default void onEdgeAdded(ContextEdge edge) {
    }

    default void onEdgeRemoved(ContextEdge edge) {
    }
}
