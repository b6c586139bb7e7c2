package com.purchasingpower.contextgraph.service.compression;

import com.purchasingpower.contextgraph.exception.NodeNotFoundException;
import com.purchasingpower.contextgraph.model.compression.CompressionLevel;
import com.purchasingpower.contextgraph.model.compression.CompressionOptions;
import com.purchasingpower.contextgraph.model.compression.CompressionResult;
import com.purchasingpower.contextgraph.model.compression.CompressionStatistics;
import com.purchasingpower.contextgraph.model.context.ContextLevel;
import com.purchasingpower.contextgraph.model.context.ContextRecord;

/**
 * Entry point of the compression engine.
 *
 * <p>Strategies are pure functions of the record and the options; nothing here
 * writes back to the graph.
 */
public interface ContextCompressionService {

    /**
     * Compress with the strategy named in {@code options}.
     */
    CompressionResult compress(ContextRecord record, CompressionOptions options);

    /**
     * Compress the payload of a graph node.
     *
     * @throws NodeNotFoundException when the node is absent
     */
    CompressionResult compressNode(String contextId, ContextLevel level, CompressionOptions options);

    CompressionLevel calculateCompressionLevel(long currentSize, long maxSize);

    long estimateTokens(long bytes);

    /**
     * True when the record's estimated tokens exceed
     * {@code tokenLimit * token-warning-ratio}.
     */
    boolean needsTokenSummarization(ContextRecord record, long tokenLimit);

    boolean needsTokenSummarization(ContextRecord record);

    CompressionStatistics statistics();
}
