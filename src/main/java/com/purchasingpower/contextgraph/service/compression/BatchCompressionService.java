package com.purchasingpower.contextgraph.service.compression;

import com.purchasingpower.contextgraph.configuration.BatchProperties;
import com.purchasingpower.contextgraph.knowledge.ContextGraph;
import com.purchasingpower.contextgraph.model.CallContext;
import com.purchasingpower.contextgraph.model.ServiceType;
import com.purchasingpower.contextgraph.model.compression.CompressionOptions;
import com.purchasingpower.contextgraph.model.compression.CompressionResult;
import com.purchasingpower.contextgraph.model.compression.CompressionStrategyType;
import com.purchasingpower.contextgraph.model.context.ContextRecord;
import com.purchasingpower.contextgraph.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Graph-aware compression of many independent records.
 *
 * <p>Batches larger than {@code chunk-size} are split into chunks; the records of
 * one chunk run concurrently on the compression pool and the next chunk starts
 * when the previous one is done. Smaller batches run on the calling thread.
 * Results follow input order. An empty graph downgrades every record to smart
 * compression.
 */
@Slf4j
@Service
public class BatchCompressionService {

    private final ContextCompressionService compressionService;
    private final ContextGraph graph;
    private final BatchProperties properties;
    private final Executor executor;

    public BatchCompressionService(ContextCompressionService compressionService, ContextGraph graph,
                                   BatchProperties properties,
                                   @Qualifier("compressionExecutor") Executor executor) {
        this.compressionService = compressionService;
        this.graph = graph;
        this.properties = properties;
        this.executor = executor;
    }

    public List<CompressionResult> compressAll(List<ContextRecord> records) {
        return compressAll(records, properties.getTargetTokensPerContext());
    }

    public List<CompressionResult> compressAll(List<ContextRecord> records, int targetTokensPerContext) {
        if (records.isEmpty()) {
            return List.of();
        }
        CompressionStrategyType strategy = graph == null || graph.nodeCount() == 0
                ? CompressionStrategyType.SMART
                : CompressionStrategyType.GRAPH_AWARE;
        CompressionOptions options = CompressionOptions.builder()
                .strategy(strategy)
                .targetTokens(targetTokensPerContext)
                .build();

        int chunkSize = properties.getChunkSize();
        if (records.size() <= chunkSize) {
            log.debug("Compressing {} contexts sequentially with {}", records.size(), strategy.getId());
            return records.stream().map(r -> compressionService.compress(r, options)).toList();
        }

        CallContext call = ExternalCallLogger.startCall(ServiceType.WORKER_POOL, "compressBatch", log);
        call.logRequest(records.size() + " contexts",
                "strategy", strategy.getId(),
                "chunkSize", chunkSize,
                "targetTokensPerContext", targetTokensPerContext);

        List<CompressionResult> results = new ArrayList<>(records.size());
        for (int start = 0; start < records.size(); start += chunkSize) {
            List<CompletableFuture<CompressionResult>> futures = records
                    .subList(start, Math.min(start + chunkSize, records.size()))
                    .stream()
                    .map(r -> CompletableFuture.supplyAsync(() -> compressionService.compress(r, options), executor))
                    .toList();
            try {
                CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            } catch (CompletionException e) {
                call.logError("Chunk starting at " + start + " failed", e.getCause());
                throw unwrap(e);
            }
            futures.forEach(f -> results.add(f.join()));
        }

        long compressed = results.stream().filter(CompressionResult::isCompressed).count();
        call.logResponse(compressed + "/" + results.size() + " contexts compressed");
        return results;
    }

    private static RuntimeException unwrap(CompletionException e) {
        if (e.getCause() instanceof RuntimeException cause) {
            return cause;
        }
        return new IllegalStateException("Batch compression failed", e.getCause());
    }
}
