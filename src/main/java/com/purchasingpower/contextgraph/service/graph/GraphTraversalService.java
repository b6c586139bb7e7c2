package com.purchasingpower.contextgraph.service.graph;

import com.purchasingpower.contextgraph.model.graph.ContextEdge;
import com.purchasingpower.contextgraph.model.graph.ContextNode;
import com.purchasingpower.contextgraph.model.graph.DependencyCycle;
import com.purchasingpower.contextgraph.model.graph.DependencyEntry;
import com.purchasingpower.contextgraph.model.graph.GraphPath;
import com.purchasingpower.contextgraph.model.graph.GraphStatistics;
import com.purchasingpower.contextgraph.model.graph.ImpactAnalysisReport;
import com.purchasingpower.contextgraph.model.graph.ImpactEntry;
import com.purchasingpower.contextgraph.model.graph.QueryMatch;

import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;

/**
 * Read-only algorithms over the context graph.
 * Every call runs under the graph's read lock; depth and result bounds
 * truncate silently.
 */
public interface GraphTraversalService {

    /**
     * Find what a context depends on, following outgoing edges.
     *
     * @param contextId         Starting context
     * @param maxDepth          Deepest distance reported (direct dependencies are distance 1)
     * @param relationshipTypes Edge types to follow
     * @param transitive        Follow edges past the first hop
     * @return Entries sorted by distance ascending, then weight descending. Never contains the origin.
     */
    List<DependencyEntry> findDependencies(String contextId, int maxDepth,
                                           Collection<String> relationshipTypes, boolean transitive);

    /**
     * Same as above with the configured depth and dependency types, transitive.
     */
    List<DependencyEntry> findDependencies(String contextId);

    /**
     * Find contexts affected by a change, following incoming edges breadth-first.
     *
     * <p>Impact is 1.0 at the origin and is multiplied by {@code weight * decayFactor}
     * on every hop. Nodes below {@code impactThreshold} are neither reported nor expanded.
     *
     * @param contextId         Changed context
     * @param maxDistance       Deepest hop count reported
     * @param relationshipTypes Edge types to follow
     * @param impactThreshold   Minimum impact kept
     * @param decayFactor       Per-hop decay in (0,1]
     * @return Entries sorted by impact descending
     */
    List<ImpactEntry> findImpactedContexts(String contextId, int maxDistance, Collection<String> relationshipTypes,
                                           double impactThreshold, double decayFactor);

    /**
     * Same as above with the configured distance, types, threshold and decay.
     */
    List<ImpactEntry> findImpactedContexts(String contextId);

    /**
     * Report dependency cycles, at most one per DFS root.
     *
     * @param relationshipTypes Edge types that form dependencies
     * @return Cycles as closed node sequences with their edges; empty for a DAG
     */
    List<DependencyCycle> detectCycles(Collection<String> relationshipTypes);

    List<DependencyCycle> detectCycles();

    /**
     * Cheapest path between two contexts.
     *
     * @param weighted          Edge cost is {@code 1/weight} when true, 1 otherwise
     * @param relationshipTypes Edge types allowed; {@code null} or empty allows all
     * @return The path, or {@code null} when either node is absent or {@code to} is unreachable
     */
    GraphPath findShortestPath(String from, String to, boolean weighted, Collection<String> relationshipTypes);

    /**
     * Depth-bounded filtered walk.
     *
     * @param startNodes        Roots; {@code null} or empty starts from every node
     * @param relationshipTypes Edge types to follow; empty follows all
     * @param nodeFilter        Accepts nodes into the result; {@code null} accepts all
     * @param edgeFilter        Accepts edges to follow; {@code null} accepts all
     * @param limit             Stop once this many matches are collected; {@code null} for no limit
     */
    List<QueryMatch> query(Collection<String> startNodes, Collection<String> relationshipTypes, int maxDepth,
                           Predicate<ContextNode> nodeFilter, Predicate<ContextEdge> edgeFilter, Integer limit);

    GraphStatistics statistics();

    /**
     * Aggregate dependency and impact view of one context.
     */
    ImpactAnalysisReport analyzeImpact(String contextId);
}
