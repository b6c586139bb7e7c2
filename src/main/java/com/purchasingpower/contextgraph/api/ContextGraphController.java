package com.purchasingpower.contextgraph.api;

import com.purchasingpower.contextgraph.configuration.GraphProperties;
import com.purchasingpower.contextgraph.exception.ContextValidationException;
import com.purchasingpower.contextgraph.exception.NodeNotFoundException;
import com.purchasingpower.contextgraph.knowledge.ContextGraph;
import com.purchasingpower.contextgraph.model.compression.CompressionOptions;
import com.purchasingpower.contextgraph.model.compression.CompressionResult;
import com.purchasingpower.contextgraph.model.compression.CompressionStrategyType;
import com.purchasingpower.contextgraph.model.context.ContextLevel;
import com.purchasingpower.contextgraph.model.context.ContextRecord;
import com.purchasingpower.contextgraph.model.graph.ContextEdge;
import com.purchasingpower.contextgraph.model.graph.ContextNode;
import com.purchasingpower.contextgraph.model.graph.DependencyCycle;
import com.purchasingpower.contextgraph.model.graph.DependencyEntry;
import com.purchasingpower.contextgraph.model.graph.GraphPath;
import com.purchasingpower.contextgraph.model.graph.GraphSnapshot;
import com.purchasingpower.contextgraph.model.graph.GraphStatistics;
import com.purchasingpower.contextgraph.model.graph.ImpactAnalysisReport;
import com.purchasingpower.contextgraph.model.graph.ImpactEntry;
import com.purchasingpower.contextgraph.service.compression.ContextBudgetService;
import com.purchasingpower.contextgraph.service.compression.ContextCompressionService;
import com.purchasingpower.contextgraph.service.graph.ContextRelationshipExtractor;
import com.purchasingpower.contextgraph.service.graph.GraphAnalyzer;
import com.purchasingpower.contextgraph.service.graph.GraphSerializationService;
import com.purchasingpower.contextgraph.service.graph.GraphTraversalService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * HTTP view of the context graph and the compression engine.
 *
 * @see ApiExceptionHandler
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/graph")
@RequiredArgsConstructor
public class ContextGraphController {

    private final ContextGraph graph;
    private final GraphProperties graphProperties;
    private final GraphTraversalService traversalService;
    private final GraphAnalyzer graphAnalyzer;
    private final GraphSerializationService serializationService;
    private final ContextRelationshipExtractor relationshipExtractor;
    private final ContextCompressionService compressionService;
    private final ContextBudgetService budgetService;

    /**
     * GET /api/v1/graph/stats
     */
    @GetMapping("/stats")
    public GraphStatistics stats() {
        return traversalService.statistics();
    }

    /**
     * POST /api/v1/graph/nodes
     */
    @PostMapping("/nodes")
    public ResponseEntity<NodeResponse> addNode(@Valid @RequestBody NodeRequest request) {
        ContextNode node = graph.addNode(request.getId(), request.getPayload());
        int extracted = request.isExtractRelationships()
                ? relationshipExtractor.extractAndLink(node.getId(), node.getPayload()).size()
                : 0;
        return ResponseEntity.status(HttpStatus.CREATED).body(NodeResponse.builder()
                .id(node.getId())
                .createdAt(node.getCreatedAt())
                .extractedRelationships(extracted)
                .build());
    }

    /**
     * POST /api/v1/graph/edges
     */
    @PostMapping("/edges")
    public ResponseEntity<ContextEdge> addEdge(@Valid @RequestBody EdgeRequest request) {
        ContextEdge edge = graph.addEdge(request.getFrom(), request.getTo(), request.getType(),
                request.getWeight(), request.getMetadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(edge);
    }

    /**
     * DELETE /api/v1/graph/nodes/{id}
     */
    @DeleteMapping("/nodes/{id}")
    public ResponseEntity<Void> removeNode(@PathVariable String id) {
        if (!graph.removeNode(id)) {
            throw new NodeNotFoundException(id);
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * GET /api/v1/graph/nodes/{id}/dependencies
     */
    @GetMapping("/nodes/{id}/dependencies")
    public List<DependencyEntry> dependencies(@PathVariable String id,
                                              @RequestParam(required = false) Integer maxDepth,
                                              @RequestParam(required = false) List<String> types,
                                              @RequestParam(defaultValue = "true") boolean transitive) {
        requireNode(id);
        return traversalService.findDependencies(id,
                maxDepth != null ? maxDepth : graphProperties.getMaxTraversalDepth(),
                types != null && !types.isEmpty() ? types : graphProperties.getDefaultDependencyTypes(),
                transitive);
    }

    /**
     * GET /api/v1/graph/nodes/{id}/impact
     */
    @GetMapping("/nodes/{id}/impact")
    public List<ImpactEntry> impact(@PathVariable String id,
                                    @RequestParam(required = false) Integer maxDistance,
                                    @RequestParam(required = false) List<String> types,
                                    @RequestParam(required = false) Double threshold,
                                    @RequestParam(required = false) Double decay) {
        requireNode(id);
        return traversalService.findImpactedContexts(id,
                maxDistance != null ? maxDistance : graphProperties.getImpactMaxDistance(),
                types != null && !types.isEmpty() ? types : graphProperties.getDefaultImpactTypes(),
                threshold != null ? threshold : graphProperties.getImpactThreshold(),
                decay != null ? decay : graphProperties.getImpactDecayFactor());
    }

    /**
     * GET /api/v1/graph/nodes/{id}/analysis
     */
    @GetMapping("/nodes/{id}/analysis")
    public AnalysisResponse analysis(@PathVariable String id) {
        requireNode(id);
        ImpactAnalysisReport report = traversalService.analyzeImpact(id);
        return AnalysisResponse.builder()
                .report(report)
                .position(graphAnalyzer.analyze(id))
                .markdown(report.toMarkdown())
                .build();
    }

    /**
     * GET /api/v1/graph/cycles
     */
    @GetMapping("/cycles")
    public List<DependencyCycle> cycles(@RequestParam(required = false) List<String> types) {
        return types != null && !types.isEmpty()
                ? traversalService.detectCycles(types)
                : traversalService.detectCycles();
    }

    /**
     * GET /api/v1/graph/path?from=..&to=..&weighted=true
     *
     * <p>204 when the target is unreachable.
     */
    @GetMapping("/path")
    public ResponseEntity<GraphPath> path(@RequestParam String from,
                                          @RequestParam String to,
                                          @RequestParam(defaultValue = "true") boolean weighted,
                                          @RequestParam(required = false) List<String> types) {
        requireNode(from);
        requireNode(to);
        GraphPath path = traversalService.findShortestPath(from, to, weighted, types);
        return path == null ? ResponseEntity.noContent().build() : ResponseEntity.ok(path);
    }

    /**
     * GET /api/v1/graph/export
     */
    @GetMapping("/export")
    public GraphSnapshot export() {
        return serializationService.export();
    }

    /**
     * POST /api/v1/graph/import - replaces the graph content
     */
    @PostMapping("/import")
    public GraphStatistics importGraph(@RequestBody GraphSnapshot snapshot) {
        log.info("Importing graph snapshot: {} nodes, {} edges",
                snapshot.getNodes() == null ? 0 : snapshot.getNodes().size(),
                snapshot.getEdges() == null ? 0 : snapshot.getEdges().size());
        return serializationService.importSnapshot(snapshot);
    }

    /**
     * POST /api/v1/graph/compress
     */
    @PostMapping("/compress")
    public CompressionResult compress(@RequestBody CompressRequest request) {
        ContextLevel level = ContextLevel.fromName(request.getLevel());
        ContextRecord record = toRecord(request, level);

        if (request.isEnforceBudget()) {
            return budgetService.enforce(record);
        }
        CompressionOptions options = CompressionOptions.builder()
                .strategy(request.getStrategy() != null ? request.getStrategy() : CompressionStrategyType.SMART)
                .level(request.getCompressionLevel())
                .targetTokens(request.getTargetTokens())
                .maxStringLength(request.getMaxStringLength())
                .build();
        if (request.getPayload() == null) {
            return compressionService.compressNode(record.getId(), level, options);
        }
        return compressionService.compress(record, options);
    }

    private ContextRecord toRecord(CompressRequest request, ContextLevel level) {
        if (request.getPayload() != null) {
            return ContextRecord.builder()
                    .id(request.getContextId() != null ? request.getContextId() : "inline")
                    .level(level)
                    .payload(request.getPayload())
                    .createdAt(request.getCreatedAt() != null ? request.getCreatedAt() : Instant.now())
                    .build();
        }
        if (request.getContextId() == null || request.getContextId().isBlank()) {
            throw new ContextValidationException("contextId", "Either contextId or payload is required");
        }
        ContextNode node = graph.getNode(request.getContextId())
                .orElseThrow(() -> new NodeNotFoundException(request.getContextId()));
        return ContextRecord.fromNode(node, level);
    }

    private void requireNode(String id) {
        if (!graph.containsNode(id)) {
            throw new NodeNotFoundException(id);
        }
    }
}
