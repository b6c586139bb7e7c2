package com.purchasingpower.contextgraph.service.compression.strategy;

import com.purchasingpower.contextgraph.model.compression.CompressionOptions;
import com.purchasingpower.contextgraph.model.compression.CompressionResult;
import com.purchasingpower.contextgraph.model.compression.CompressionStrategyType;
import com.purchasingpower.contextgraph.model.context.ContextRecord;

/**
 * One way of shrinking a context payload.
 *
 * <p>Strategies never mutate the record or the graph. When the input exceeds
 * the target, the returned payload is never larger than the input.
 */
public interface CompressionStrategy {

    CompressionStrategyType type();

    CompressionResult compress(ContextRecord record, CompressionOptions options);
}
