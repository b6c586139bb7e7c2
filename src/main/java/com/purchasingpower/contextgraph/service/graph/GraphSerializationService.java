package com.purchasingpower.contextgraph.service.graph;

import com.purchasingpower.contextgraph.model.graph.GraphSnapshot;
import com.purchasingpower.contextgraph.model.graph.GraphStatistics;

/**
 * Export and import of the whole context graph.
 *
 * <p>Importing an export reproduces the node count, edge count and
 * relationship-type set of the exported graph, along with node access metadata.
 */
public interface GraphSerializationService {

    GraphSnapshot export();

    String exportJson();

    /**
     * Replace the graph content with the snapshot.
     *
     * @return statistics of the graph after import
     */
    GraphStatistics importSnapshot(GraphSnapshot snapshot);

    GraphStatistics importJson(String json);
}
