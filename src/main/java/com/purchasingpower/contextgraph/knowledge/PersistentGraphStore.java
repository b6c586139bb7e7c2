package com.purchasingpower.contextgraph.knowledge;

import com.purchasingpower.contextgraph.exception.PersistenceException;
import com.purchasingpower.contextgraph.model.graph.ContextEdge;
import com.purchasingpower.contextgraph.model.graph.ContextNode;
import com.purchasingpower.contextgraph.model.graph.Neighbor;

import java.util.List;
import java.util.Map;

/**
 * Optional durable copy of the context graph.
 *
 * <p>The in-memory {@link ContextGraph} stays authoritative; traversals never
 * call this interface. Implementations wrap backend failures in
 * {@link PersistenceException}.
 */
public interface PersistentGraphStore {

    void upsertNode(ContextNode node);

    /**
     * Both endpoints must already be stored.
     */
    void upsertEdge(ContextEdge edge);

    void deleteNode(String contextId);

    void deleteEdge(ContextEdge edge);

    List<Neighbor> fetchNeighbors(String contextId);

    /**
     * Run a backend-native query.
     *
     * @return one map per result row
     */
    List<Map<String, Object>> runQuery(String query, Map<String, Object> parameters);

    /**
     * Delete everything.
     *
     * @throws IllegalStateException in a production environment
     */
    void clearAll();

    Map<String, Object> stats();

    boolean isAvailable();
}
