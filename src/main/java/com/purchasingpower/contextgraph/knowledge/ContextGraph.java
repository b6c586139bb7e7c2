package com.purchasingpower.contextgraph.knowledge;

import com.purchasingpower.contextgraph.exception.ContextValidationException;
import com.purchasingpower.contextgraph.exception.NodeNotFoundException;
import com.purchasingpower.contextgraph.model.graph.ContextEdge;
import com.purchasingpower.contextgraph.model.graph.ContextNode;
import com.purchasingpower.contextgraph.model.graph.Neighbor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-memory store of context nodes and the typed, weighted edges between them.
 *
 * <p>Nodes and edges live in flat tables keyed by node id:
 * <ul>
 *   <li>{@code nodes} - id to node, in insertion order</li>
 *   <li>{@code outgoing} / {@code incoming} - id to the edges leaving / entering it</li>
 *   <li>{@code typeIndex} - relationship type to its edges</li>
 * </ul>
 * An edge refers to its endpoints by id only, so removing a node is a filter
 * over these tables.
 *
 * <p><b>Thread Safety:</b> mutations take the write lock. Traversals must run
 * inside {@link #withReadLock(Supplier)} so that no mutation can interleave with
 * an iteration over the adjacency lists. The lock is reentrant for readers, but
 * a reader must not call a mutating method.
 */
@Slf4j
public class ContextGraph {

    public static final double DEFAULT_EDGE_WEIGHT = 1.0;

    private final Map<String, ContextNode> nodes = new LinkedHashMap<>();
    private final Map<String, List<ContextEdge>> outgoing = new HashMap<>();
    private final Map<String, List<ContextEdge>> incoming = new HashMap<>();
    private final Map<String, Set<ContextEdge>> typeIndex = new LinkedHashMap<>();
    private int edgeCount;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<GraphMutationListener> listeners = new CopyOnWriteArrayList<>();
    private final double defaultEdgeWeight;
    private final Clock clock;

    public ContextGraph() {
        this(DEFAULT_EDGE_WEIGHT, Clock.systemUTC());
    }

    public ContextGraph(double defaultEdgeWeight, Clock clock) {
        if (defaultEdgeWeight <= 0 || defaultEdgeWeight > 1) {
            throw new IllegalArgumentException("Default edge weight must be in (0,1]: " + defaultEdgeWeight);
        }
        this.defaultEdgeWeight = defaultEdgeWeight;
        this.clock = clock;
    }

    // ================================================================
    // MUTATIONS
    // ================================================================

    /**
     * Inserts a node, or replaces the payload of an existing one. Edges of a
     * replaced node are kept.
     */
    public ContextNode addNode(String id, Map<String, Object> payload) {
        if (id == null || id.isBlank()) {
            throw new ContextValidationException("id", "Context id is required");
        }
        ContextNode node = new ContextNode(id, payload, clock.instant());
        lock.writeLock().lock();
        try {
            if (nodes.containsKey(id)) {
                log.warn("Node already exists, updating: {}", id);
            }
            putNode(node);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Node added: {} (nodeCount={})", id, nodeCount());
        listeners.forEach(l -> l.onNodeUpserted(node));
        return node;
    }

    /**
     * Restores a node with its access bookkeeping, as read from a snapshot.
     */
    public void restoreNode(ContextNode node) {
        lock.writeLock().lock();
        try {
            putNode(node);
        } finally {
            lock.writeLock().unlock();
        }
        listeners.forEach(l -> l.onNodeUpserted(node));
    }

    private void putNode(ContextNode node) {
        nodes.put(node.getId(), node);
        outgoing.computeIfAbsent(node.getId(), k -> new ArrayList<>());
        incoming.computeIfAbsent(node.getId(), k -> new ArrayList<>());
    }

    public ContextEdge addEdge(String from, String to, String type) {
        return addEdge(from, to, type, null, null);
    }

    /**
     * Adds a directed edge. An edge with the same endpoints and type is replaced.
     *
     * @param weight   edge weight in (0,1]; {@code null} selects the default weight
     * @param metadata arbitrary edge attributes, may be {@code null}
     * @throws NodeNotFoundException       if either endpoint is absent
     * @throws ContextValidationException  if the type is blank or the weight is out of range
     */
    public ContextEdge addEdge(String from, String to, String type, Double weight, Map<String, Object> metadata) {
        if (type == null || type.isBlank()) {
            throw new ContextValidationException("relationshipType", "Relationship type is required");
        }
        double w = weight == null ? defaultEdgeWeight : weight;
        if (!(w > 0 && w <= 1.0)) {
            throw new ContextValidationException("weight", "Edge weight must be in (0,1]: " + w);
        }
        ContextEdge edge = ContextEdge.builder()
                .from(from)
                .to(to)
                .relationshipType(type)
                .weight(w)
                .metadata(metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata)))
                .createdAt(clock.instant())
                .build();
        insertEdge(edge);
        return edge;
    }

    /**
     * Re-inserts an edge exactly as exported, keeping its creation time.
     */
    public void restoreEdge(ContextEdge edge) {
        if (edge.getWeight() <= 0 || edge.getWeight() > 1.0) {
            throw new ContextValidationException("weight", "Edge weight must be in (0,1]: " + edge.getWeight());
        }
        insertEdge(edge);
    }

    private void insertEdge(ContextEdge edge) {
        ContextEdge replaced;
        lock.writeLock().lock();
        try {
            if (!nodes.containsKey(edge.getFrom())) {
                throw new NodeNotFoundException(edge.getFrom(), "Source");
            }
            if (!nodes.containsKey(edge.getTo())) {
                throw new NodeNotFoundException(edge.getTo(), "Target");
            }
            replaced = unlinkEdge(edge.getFrom(), edge.getTo(), edge.getRelationshipType());
            outgoing.get(edge.getFrom()).add(edge);
            incoming.get(edge.getTo()).add(edge);
            typeIndex.computeIfAbsent(edge.getRelationshipType(), k -> new LinkedHashSet<>()).add(edge);
            edgeCount++;
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Edge added: {} -[{}]-> {} (edgeCount={})",
                edge.getFrom(), edge.getRelationshipType(), edge.getTo(), edgeCount());
        if (replaced != null) {
            listeners.forEach(l -> l.onEdgeRemoved(replaced));
        }
        listeners.forEach(l -> l.onEdgeAdded(edge));
    }

    /**
     * Removes a node and every edge touching it.
     *
     * @return whether the node existed
     */
    public boolean removeNode(String id) {
        List<ContextEdge> removedEdges = new ArrayList<>();
        lock.writeLock().lock();
        try {
            if (!nodes.containsKey(id)) {
                return false;
            }
            for (ContextEdge edge : List.copyOf(outgoing.get(id))) {
                removedEdges.add(unlinkEdge(edge.getFrom(), edge.getTo(), edge.getRelationshipType()));
            }
            for (ContextEdge edge : List.copyOf(incoming.get(id))) {
                removedEdges.add(unlinkEdge(edge.getFrom(), edge.getTo(), edge.getRelationshipType()));
            }
            nodes.remove(id);
            outgoing.remove(id);
            incoming.remove(id);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Node removed: {} ({} edges cascaded)", id, removedEdges.size());
        removedEdges.forEach(edge -> listeners.forEach(l -> l.onEdgeRemoved(edge)));
        listeners.forEach(l -> l.onNodeRemoved(id));
        return true;
    }

    /**
     * @return whether an edge was removed
     */
    public boolean removeEdge(String from, String to, String type) {
        ContextEdge removed;
        lock.writeLock().lock();
        try {
            removed = unlinkEdge(from, to, type);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed == null) {
            return false;
        }
        listeners.forEach(l -> l.onEdgeRemoved(removed));
        return true;
    }

    // caller holds the write lock
    private ContextEdge unlinkEdge(String from, String to, String type) {
        List<ContextEdge> out = outgoing.get(from);
        if (out == null) {
            return null;
        }
        ContextEdge match = null;
        for (ContextEdge edge : out) {
            if (edge.connects(from, to, type)) {
                match = edge;
                break;
            }
        }
        if (match == null) {
            return null;
        }
        out.remove(match);
        List<ContextEdge> in = incoming.get(to);
        if (in != null) {
            in.remove(match);
        }
        Set<ContextEdge> typed = typeIndex.get(type);
        if (typed != null) {
            typed.remove(match);
            if (typed.isEmpty()) {
                typeIndex.remove(type);
            }
        }
        edgeCount--;
        return match;
    }

    /**
     * Drops every node and edge.
     */
    public void clear() {
        List<String> ids;
        lock.writeLock().lock();
        try {
            ids = new ArrayList<>(nodes.keySet());
            nodes.clear();
            outgoing.clear();
            incoming.clear();
            typeIndex.clear();
            edgeCount = 0;
        } finally {
            lock.writeLock().unlock();
        }
        ids.forEach(id -> listeners.forEach(l -> l.onNodeRemoved(id)));
        log.info("Context graph cleared ({} nodes)", ids.size());
    }

    /**
     * Records a read of the node. No-op when the node is absent.
     */
    public void recordAccess(String id) {
        lock.writeLock().lock();
        try {
            ContextNode node = nodes.get(id);
            if (node != null) {
                node.touch(clock.instant());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ================================================================
    // READS
    // ================================================================

    /**
     * Runs a read-only computation while holding the read lock, so the
     * adjacency lists cannot change underneath it.
     */
    public <T> T withReadLock(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Neighbor> getNeighbors(String id, RelationshipDirection direction, Collection<String> typeFilter) {
        return withReadLock(() -> {
            List<Neighbor> neighbors = new ArrayList<>();
            boolean allTypes = typeFilter == null || typeFilter.isEmpty();
            if (direction.includesOutgoing()) {
                for (ContextEdge edge : outgoing.getOrDefault(id, List.of())) {
                    if (allTypes || typeFilter.contains(edge.getRelationshipType())) {
                        neighbors.add(new Neighbor(edge.getTo(), edge.getRelationshipType(),
                                RelationshipDirection.OUTGOING, edge.getWeight()));
                    }
                }
            }
            if (direction.includesIncoming()) {
                for (ContextEdge edge : incoming.getOrDefault(id, List.of())) {
                    if (allTypes || typeFilter.contains(edge.getRelationshipType())) {
                        neighbors.add(new Neighbor(edge.getFrom(), edge.getRelationshipType(),
                                RelationshipDirection.INCOMING, edge.getWeight()));
                    }
                }
            }
            return neighbors;
        });
    }

    /**
     * Edges leaving the node. Only valid inside {@link #withReadLock(Supplier)}
     * when iterated as part of a larger traversal.
     */
    public List<ContextEdge> outgoingEdges(String id) {
        return withReadLock(() -> Collections.unmodifiableList(outgoing.getOrDefault(id, List.of())));
    }

    public List<ContextEdge> incomingEdges(String id) {
        return withReadLock(() -> Collections.unmodifiableList(incoming.getOrDefault(id, List.of())));
    }

    public List<ContextEdge> edgesOfType(String type) {
        return withReadLock(() -> List.copyOf(typeIndex.getOrDefault(type, Set.of())));
    }

    public List<ContextEdge> edges() {
        return withReadLock(() -> {
            List<ContextEdge> all = new ArrayList<>(edgeCount);
            for (String id : nodes.keySet()) {
                all.addAll(outgoing.get(id));
            }
            return all;
        });
    }

    public Optional<ContextNode> getNode(String id) {
        return withReadLock(() -> Optional.ofNullable(nodes.get(id)));
    }

    public boolean containsNode(String id) {
        return withReadLock(() -> nodes.containsKey(id));
    }

    public List<String> nodeIds() {
        return withReadLock(() -> List.copyOf(nodes.keySet()));
    }

    public List<ContextNode> nodes() {
        return withReadLock(() -> List.copyOf(nodes.values()));
    }

    public int nodeCount() {
        return withReadLock(nodes::size);
    }

    public int edgeCount() {
        return withReadLock(() -> edgeCount);
    }

    public Set<String> relationshipTypes() {
        return withReadLock(() -> Set.copyOf(typeIndex.keySet()));
    }

    public double getDefaultEdgeWeight() {
        return defaultEdgeWeight;
    }

    public void addListener(GraphMutationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(GraphMutationListener listener) {
        listeners.remove(listener);
    }
}
