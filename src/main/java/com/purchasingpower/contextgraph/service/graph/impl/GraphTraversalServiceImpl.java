package com.purchasingpower.contextgraph.service.graph.impl;

import com.purchasingpower.contextgraph.configuration.GraphProperties;
import com.purchasingpower.contextgraph.knowledge.ContextGraph;
import com.purchasingpower.contextgraph.knowledge.RelationshipDirection;
import com.purchasingpower.contextgraph.model.graph.ContextEdge;
import com.purchasingpower.contextgraph.model.graph.ContextNode;
import com.purchasingpower.contextgraph.model.graph.DependencyCycle;
import com.purchasingpower.contextgraph.model.graph.DependencyEntry;
import com.purchasingpower.contextgraph.model.graph.GraphPath;
import com.purchasingpower.contextgraph.model.graph.GraphStatistics;
import com.purchasingpower.contextgraph.model.graph.ImpactAnalysisReport;
import com.purchasingpower.contextgraph.model.graph.ImpactEntry;
import com.purchasingpower.contextgraph.model.graph.Neighbor;
import com.purchasingpower.contextgraph.model.graph.QueryMatch;
import com.purchasingpower.contextgraph.service.graph.GraphTraversalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.function.Predicate;

@Slf4j
@Service
@RequiredArgsConstructor
public class GraphTraversalServiceImpl implements GraphTraversalService {

    private final ContextGraph graph;
    private final GraphProperties properties;

    // ================================================================
    // DEPENDENCIES
    // ================================================================

    @Override
    public List<DependencyEntry> findDependencies(String contextId) {
        return findDependencies(contextId, properties.getMaxTraversalDepth(),
                properties.getDefaultDependencyTypes(), true);
    }

    @Override
    public List<DependencyEntry> findDependencies(String contextId, int maxDepth,
                                                  Collection<String> relationshipTypes, boolean transitive) {
        Set<String> types = Set.copyOf(relationshipTypes);
        List<DependencyEntry> result = graph.withReadLock(() -> {
            Map<String, DependencyEntry> dependencies = new LinkedHashMap<>();
            collectDependencies(contextId, contextId, 1, maxDepth, types, transitive,
                    new ArrayList<>(), new HashMap<>(), dependencies);
            List<DependencyEntry> sorted = new ArrayList<>(dependencies.values());
            sorted.sort(Comparator.comparingInt(DependencyEntry::getDistance)
                    .thenComparing(Comparator.comparingDouble(DependencyEntry::getWeight).reversed()));
            return sorted;
        });
        graph.recordAccess(contextId);
        log.debug("Found {} dependencies for {} (maxDepth={})", result.size(), contextId, maxDepth);
        return result;
    }

    /**
     * DFS where {@code depth} is the distance of the edges leaving {@code nodeId}. A node is expanded
     * again whenever a shorter path reaches it.
     */
    private void collectDependencies(String origin, String nodeId, int depth, int maxDepth, Set<String> types,
                                     boolean transitive, List<ContextEdge> path, Map<String, Integer> expandedAt,
                                     Map<String, DependencyEntry> dependencies) {
        if (depth > maxDepth || depth >= expandedAt.getOrDefault(nodeId, Integer.MAX_VALUE)) {
            return;
        }
        expandedAt.put(nodeId, depth);
        for (ContextEdge edge : graph.outgoingEdges(nodeId)) {
            if (!types.contains(edge.getRelationshipType())) {
                continue;
            }
            List<ContextEdge> edgePath = new ArrayList<>(path);
            edgePath.add(edge);

            if (!edge.getTo().equals(origin)) {
                DependencyEntry existing = dependencies.get(edge.getTo());
                if (existing == null || existing.getDistance() > depth
                        || (existing.getDistance() == depth && existing.getWeight() < edge.getWeight())) {
                    dependencies.put(edge.getTo(), DependencyEntry.builder()
                            .contextId(edge.getTo())
                            .relationship(edge.getRelationshipType())
                            .distance(depth)
                            .weight(edge.getWeight())
                            .path(List.copyOf(edgePath))
                            .metadata(edge.getMetadata())
                            .build());
                }
            }

            if (transitive) {
                collectDependencies(origin, edge.getTo(), depth + 1, maxDepth, types, true,
                        edgePath, expandedAt, dependencies);
            }
        }
    }

    // ================================================================
    // IMPACT
    // ================================================================

    @Override
    public List<ImpactEntry> findImpactedContexts(String contextId) {
        return findImpactedContexts(contextId, properties.getImpactMaxDistance(), properties.getDefaultImpactTypes(),
                properties.getImpactThreshold(), properties.getImpactDecayFactor());
    }

    @Override
    public List<ImpactEntry> findImpactedContexts(String contextId, int maxDistance,
                                                  Collection<String> relationshipTypes,
                                                  double impactThreshold, double decayFactor) {
        Set<String> types = Set.copyOf(relationshipTypes);
        return graph.withReadLock(() -> {
            Map<String, ImpactEntry> impacted = new LinkedHashMap<>();
            Deque<ImpactEntry> queue = new ArrayDeque<>();
            queue.add(ImpactEntry.builder().contextId(contextId).impact(1.0).distance(0).path(List.of()).build());

            // a node is re-expanded each time its impact improves; superseded queue entries are skipped
            while (!queue.isEmpty()) {
                ImpactEntry current = queue.poll();
                boolean superseded = current.getDistance() > 0 && impacted.get(current.getContextId()) != current;
                if (superseded || current.getDistance() >= maxDistance) {
                    continue;
                }
                for (ContextEdge edge : graph.incomingEdges(current.getContextId())) {
                    if (!types.contains(edge.getRelationshipType()) || edge.getFrom().equals(contextId)) {
                        continue;
                    }
                    double impact = current.getImpact() * edge.getWeight() * decayFactor;
                    if (impact < impactThreshold) {
                        continue;
                    }
                    ImpactEntry existing = impacted.get(edge.getFrom());
                    if (existing == null || existing.getImpact() < impact) {
                        List<ContextEdge> path = new ArrayList<>(current.getPath());
                        path.add(edge);
                        ImpactEntry entry = ImpactEntry.builder()
                                .contextId(edge.getFrom())
                                .impact(impact)
                                .distance(current.getDistance() + 1)
                                .relationship(edge.getRelationshipType())
                                .path(List.copyOf(path))
                                .build();
                        impacted.put(edge.getFrom(), entry);
                        queue.add(entry);
                    }
                }
            }

            List<ImpactEntry> sorted = new ArrayList<>(impacted.values());
            sorted.sort(Comparator.comparingDouble(ImpactEntry::getImpact).reversed());
            return sorted;
        });
    }

    // ================================================================
    // CYCLES
    // ================================================================

    @Override
    public List<DependencyCycle> detectCycles() {
        return detectCycles(properties.getCycleTypes());
    }

    @Override
    public List<DependencyCycle> detectCycles(Collection<String> relationshipTypes) {
        Set<String> types = Set.copyOf(relationshipTypes);
        List<DependencyCycle> cycles = graph.withReadLock(() -> {
            List<DependencyCycle> found = new ArrayList<>();
            Set<String> visited = new HashSet<>();
            for (String root : graph.nodeIds()) {
                if (visited.contains(root)) {
                    continue;
                }
                DependencyCycle cycle = findCycleFrom(root, types, visited, new LinkedHashSet<>(), new ArrayList<>());
                if (cycle != null) {
                    found.add(cycle);
                }
            }
            return found;
        });
        log.info("Cycle detection complete: {} cycles found", cycles.size());
        return cycles;
    }

    /**
     * DFS keeping the recursion stack; returns the first back-edge loop reached from this root.
     */
    private DependencyCycle findCycleFrom(String nodeId, Set<String> types, Set<String> visited,
                                          Set<String> onStack, List<String> path) {
        visited.add(nodeId);
        onStack.add(nodeId);
        path.add(nodeId);

        for (ContextEdge edge : graph.outgoingEdges(nodeId)) {
            if (!types.contains(edge.getRelationshipType())) {
                continue;
            }
            String next = edge.getTo();
            if (!visited.contains(next)) {
                DependencyCycle cycle = findCycleFrom(next, types, visited, onStack, path);
                if (cycle != null) {
                    return cycle;
                }
            } else if (onStack.contains(next)) {
                List<String> loop = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                loop.add(next);
                return new DependencyCycle(loop, edgesAlong(loop, types));
            }
        }

        onStack.remove(nodeId);
        path.remove(path.size() - 1);
        return null;
    }

    private List<ContextEdge> edgesAlong(List<String> nodePath, Set<String> types) {
        List<ContextEdge> edges = new ArrayList<>();
        for (int i = 0; i < nodePath.size() - 1; i++) {
            String to = nodePath.get(i + 1);
            graph.outgoingEdges(nodePath.get(i)).stream()
                    .filter(e -> e.getTo().equals(to) && types.contains(e.getRelationshipType()))
                    .findFirst()
                    .ifPresent(edges::add);
        }
        return edges;
    }

    // ================================================================
    // SHORTEST PATH
    // ================================================================

    @Override
    public GraphPath findShortestPath(String from, String to, boolean weighted, Collection<String> relationshipTypes) {
        Set<String> types = relationshipTypes == null ? Set.of() : Set.copyOf(relationshipTypes);
        return graph.withReadLock(() -> {
            if (!graph.containsNode(from) || !graph.containsNode(to)) {
                return null;
            }
            if (from.equals(to)) {
                return new GraphPath(List.of(), List.of(from), 0.0);
            }

            Map<String, Double> distances = new HashMap<>();
            Map<String, ContextEdge> previous = new HashMap<>();
            Set<String> settled = new HashSet<>();
            PriorityQueue<Map.Entry<String, Double>> frontier =
                    new PriorityQueue<>(Map.Entry.comparingByValue());

            distances.put(from, 0.0);
            frontier.add(Map.entry(from, 0.0));

            while (!frontier.isEmpty()) {
                String current = frontier.poll().getKey();
                if (!settled.add(current)) {
                    continue;
                }
                if (current.equals(to)) {
                    break;
                }
                double base = distances.get(current);
                for (ContextEdge edge : graph.outgoingEdges(current)) {
                    if (!types.isEmpty() && !types.contains(edge.getRelationshipType())) {
                        continue;
                    }
                    double candidate = base + (weighted ? 1.0 / edge.getWeight() : 1.0);
                    if (candidate < distances.getOrDefault(edge.getTo(), Double.POSITIVE_INFINITY)) {
                        distances.put(edge.getTo(), candidate);
                        previous.put(edge.getTo(), edge);
                        frontier.add(Map.entry(edge.getTo(), candidate));
                    }
                }
            }

            if (!previous.containsKey(to)) {
                return null;
            }
            List<ContextEdge> edges = new ArrayList<>();
            for (String cursor = to; !cursor.equals(from); cursor = previous.get(cursor).getFrom()) {
                edges.add(0, previous.get(cursor));
            }
            List<String> nodes = new ArrayList<>();
            nodes.add(from);
            edges.forEach(e -> nodes.add(e.getTo()));
            return new GraphPath(List.copyOf(edges), List.copyOf(nodes), distances.get(to));
        });
    }

    // ================================================================
    // QUERY
    // ================================================================

    @Override
    public List<QueryMatch> query(Collection<String> startNodes, Collection<String> relationshipTypes, int maxDepth,
                                  Predicate<ContextNode> nodeFilter, Predicate<ContextEdge> edgeFilter,
                                  Integer limit) {
        Set<String> types = relationshipTypes == null ? Set.of() : Set.copyOf(relationshipTypes);
        Predicate<ContextNode> acceptNode = nodeFilter == null ? n -> true : nodeFilter;
        Predicate<ContextEdge> acceptEdge = edgeFilter == null ? e -> true : edgeFilter;
        int max = limit == null ? Integer.MAX_VALUE : limit;

        return graph.withReadLock(() -> {
            List<QueryMatch> results = new ArrayList<>();
            Set<String> visited = new HashSet<>();
            Collection<String> roots = startNodes == null || startNodes.isEmpty() ? graph.nodeIds() : startNodes;
            for (String root : roots) {
                if (results.size() >= max) {
                    break;
                }
                walk(root, 0, List.of(), maxDepth, types, acceptNode, acceptEdge, max, visited, results);
            }
            return results;
        });
    }

    private void walk(String nodeId, int depth, List<ContextEdge> path, int maxDepth, Set<String> types,
                      Predicate<ContextNode> acceptNode, Predicate<ContextEdge> acceptEdge, int limit,
                      Set<String> visited, List<QueryMatch> results) {
        if (depth > maxDepth || results.size() >= limit || !visited.add(nodeId)) {
            return;
        }
        graph.getNode(nodeId)
                .filter(acceptNode)
                .ifPresent(node -> results.add(new QueryMatch(node, path, depth)));

        for (ContextEdge edge : graph.outgoingEdges(nodeId)) {
            if ((!types.isEmpty() && !types.contains(edge.getRelationshipType())) || !acceptEdge.test(edge)) {
                continue;
            }
            List<ContextEdge> next = new ArrayList<>(path);
            next.add(edge);
            walk(edge.getTo(), depth + 1, List.copyOf(next), maxDepth, types, acceptNode, acceptEdge, limit,
                    visited, results);
        }
    }

    // ================================================================
    // STATISTICS
    // ================================================================

    @Override
    public GraphStatistics statistics() {
        return graph.withReadLock(() -> {
            List<String> ids = graph.nodeIds();
            int n = ids.size();
            int edges = graph.edgeCount();

            double averageDegree = 0.0;
            if (n > 0) {
                long totalDegree = 0;
                for (String id : ids) {
                    totalDegree += graph.outgoingEdges(id).size() + graph.incomingEdges(id).size();
                }
                averageDegree = (double) totalDegree / n;
            }
            double density = n <= 1 ? 0.0 : (double) edges / ((double) n * (n - 1));

            return GraphStatistics.builder()
                    .nodeCount(n)
                    .edgeCount(edges)
                    .relationshipTypes(graph.relationshipTypes().stream().sorted().toList())
                    .averageDegree(averageDegree)
                    .density(density)
                    .components(countComponents(ids))
                    .build();
        });
    }

    private int countComponents(List<String> ids) {
        Set<String> visited = new HashSet<>();
        int components = 0;
        for (String id : ids) {
            if (visited.contains(id)) {
                continue;
            }
            components++;
            Deque<String> stack = new ArrayDeque<>();
            stack.push(id);
            visited.add(id);
            while (!stack.isEmpty()) {
                String current = stack.pop();
                for (ContextEdge edge : graph.outgoingEdges(current)) {
                    if (visited.add(edge.getTo())) {
                        stack.push(edge.getTo());
                    }
                }
                for (ContextEdge edge : graph.incomingEdges(current)) {
                    if (visited.add(edge.getFrom())) {
                        stack.push(edge.getFrom());
                    }
                }
            }
        }
        return components;
    }

    // ================================================================
    // IMPACT REPORT
    // ================================================================

    @Override
    public ImpactAnalysisReport analyzeImpact(String contextId) {
        log.info("Analyzing impact for: {}", contextId);

        List<DependencyEntry> dependencies = findDependencies(contextId);
        List<ImpactEntry> impacted = findImpactedContexts(contextId);
        List<Neighbor> dependents = graph.getNeighbors(contextId, RelationshipDirection.INCOMING,
                properties.getDefaultImpactTypes());

        List<String> critical = impacted.stream()
                .map(ImpactEntry::getContextId)
                .filter(id -> graph.getNeighbors(id, RelationshipDirection.INCOMING,
                        properties.getDefaultImpactTypes()).size() > 3)
                .toList();

        return ImpactAnalysisReport.builder()
                .analyzedNode(contextId)
                .directDependencies(dependencies.stream()
                        .filter(d -> d.getDistance() == 1)
                        .map(DependencyEntry::getContextId)
                        .toList())
                .transitiveDependencies(dependencies.stream().map(DependencyEntry::getContextId).toList())
                .directDependents(dependents.stream().map(Neighbor::getContextId).distinct().toList())
                .impactedContexts(impacted.stream().map(ImpactEntry::getContextId).toList())
                .criticalContexts(critical)
                .impactScore(Math.min(10.0, dependents.size() * 2.0 + impacted.size() * 0.5))
                .riskLevel(ImpactAnalysisReport.riskFor(impacted.size()))
                .build();
    }
}
